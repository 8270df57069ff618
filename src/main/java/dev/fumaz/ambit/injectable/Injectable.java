package dev.fumaz.ambit.injectable;

import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An {@link Injectable} pairs a {@link Factory} with a {@link Lifetime}.
 * <p>
 * Identity is the definition object itself: two injectables built from the same factory are unrelated. Each
 * injectable also remembers which other injectables were resolved while its own factory was running.
 *
 * @param <A> the type of the explicit argument its factory accepts
 * @param <T> the type of the produced value
 */
public final class Injectable<A, T> {

    private final @NotNull Factory<A, T> factory;
    private final @NotNull Lifetime lifetime;
    private final @Nullable String name;
    private final Set<Injectable<?, ?>> dependencies = new CopyOnWriteArraySet<>();

    private Injectable(@NotNull Factory<A, T> factory, @NotNull InjectableOptions options) {
        this.factory = Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(options, "options");
        this.lifetime = options.getLifetime();
        this.name = options.getName();
    }

    public static <T> @NotNull Injectable<Void, T> define(@NotNull Supplier<? extends T> factory) {
        return define(factory, InjectableOptions.defaults());
    }

    public static <T> @NotNull Injectable<Void, T> define(@NotNull Supplier<? extends T> factory,
                                                         @NotNull Lifetime lifetime) {
        return define(factory, InjectableOptions.of(lifetime));
    }

    public static <T> @NotNull Injectable<Void, T> define(@NotNull Supplier<? extends T> factory,
                                                         @NotNull InjectableOptions options) {
        return new Injectable<>(Factory.of(factory), options);
    }

    public static <A, T> @NotNull Injectable<A, T> defineWithArgument(@NotNull Function<? super A, ? extends T> factory) {
        return defineWithArgument(factory, InjectableOptions.defaults());
    }

    public static <A, T> @NotNull Injectable<A, T> defineWithArgument(@NotNull Function<? super A, ? extends T> factory,
                                                                     @NotNull Lifetime lifetime) {
        return defineWithArgument(factory, InjectableOptions.of(lifetime));
    }

    public static <A, T> @NotNull Injectable<A, T> defineWithArgument(@NotNull Function<? super A, ? extends T> factory,
                                                                     @NotNull InjectableOptions options) {
        return new Injectable<>(Factory.of(factory), options);
    }

    public static <A, T> @NotNull Injectable<A, T> define(@NotNull Factory<A, T> factory,
                                                         @NotNull InjectableOptions options) {
        return new Injectable<>(factory, options);
    }

    public @NotNull Factory<A, T> getFactory() {
        return factory;
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @Nullable String getName() {
        return name;
    }

    /**
     * Returns the injectables observed as dependencies so far, in the order they were first resolved.
     */
    public @NotNull Set<Injectable<?, ?>> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /**
     * Records {@code dependency} as resolved while this injectable's factory was running.
     * Only the resolution engine records dependencies; application code must not call this.
     */
    @ApiStatus.Internal
    public void recordDependency(@NotNull Injectable<?, ?> dependency) {
        dependencies.add(Objects.requireNonNull(dependency, "dependency"));
    }

    @Override
    public String toString() {
        String id = name == null ? "Injectable@" + Integer.toHexString(System.identityHashCode(this)) : name;
        return id + "(" + lifetime.name().toLowerCase(Locale.ROOT) + ")";
    }
}
