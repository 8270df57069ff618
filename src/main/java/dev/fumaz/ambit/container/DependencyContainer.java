package dev.fumaz.ambit.container;

import dev.fumaz.ambit.annotation.Scoped;
import dev.fumaz.ambit.annotation.Singleton;
import dev.fumaz.ambit.annotation.Transient;
import dev.fumaz.ambit.exception.ConfigurationException;
import dev.fumaz.ambit.exception.NotFoundException;
import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injectable.InjectableOptions;
import dev.fumaz.ambit.injectable.Lifetime;
import dev.fumaz.ambit.injector.Injector;
import dev.fumaz.ambit.reflection.Reflections;
import dev.fumaz.ambit.scope.Scope;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * A {@link DependencyContainer} binds values to {@link DependencyId}s and looks them up by id.
 * <p>
 * Every binding is backed by an {@link Injectable}, so lookups follow the same lifetime rules as
 * {@link Injector#inject(Injectable)}: singletons live in the root scope, scoped bindings in the active scope, and
 * transient bindings are built on every lookup.
 */
public final class DependencyContainer {

    private static final Logger LOGGER = Logger.getLogger(DependencyContainer.class.getName());
    private static final DependencyContainer SHARED = new DependencyContainer();

    private final Set<String> names = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<DependencyId<?>, Injectable<Void, ?>> bindings = new ConcurrentHashMap<>();

    public static @NotNull DependencyContainer shared() {
        return SHARED;
    }

    public <T> @NotNull DependencyId<T> createId(@NotNull String name, @NotNull Class<T> type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");

        if (!names.add(name)) {
            LOGGER.warning(() -> "\"" + name + "\" name is already in use; names are only used for debugging");
        }

        return new DependencyId<>(name, type);
    }

    /**
     * Binds {@code implementation} to {@code id}, using the lifetime declared by its {@link Singleton},
     * {@link Scoped} or {@link Transient} annotation, or {@link Lifetime#SINGLETON} when it has none.
     */
    public <T> void bindClass(@NotNull DependencyId<T> id,
                              @NotNull Class<? extends T> implementation,
                              @NotNull List<? extends DependencyId<?>> dependencies) {
        bindClass(id, implementation, dependencies, declaredLifetime(implementation));
    }

    public <T> void bindClass(@NotNull DependencyId<T> id,
                              @NotNull Class<? extends T> implementation,
                              @NotNull DependencyId<?>... dependencies) {
        bindClass(id, implementation, Arrays.asList(dependencies));
    }

    /**
     * Binds {@code implementation} to {@code id}. Each lookup that has to build an instance resolves
     * {@code dependencies} in order and passes them to the matching constructor.
     *
     * @throws ConfigurationException if no constructor accepts the dependency types
     */
    public <T> void bindClass(@NotNull DependencyId<T> id,
                              @NotNull Class<? extends T> implementation,
                              @NotNull List<? extends DependencyId<?>> dependencies,
                              @NotNull Lifetime lifetime) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(implementation, "implementation");
        List<DependencyId<?>> ordered = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(dependencies, "dependencies")));

        if (!id.getType().isAssignableFrom(implementation)) {
            throw new ConfigurationException(implementation.getName() + " cannot be bound to " + id);
        }

        Class<?>[] parameterTypes = ordered.stream()
                .map(DependencyId::getType)
                .toArray(Class<?>[]::new);

        Reflections.findConstructor(implementation, parameterTypes);

        bind(id, () -> {
            Object[] arguments = new Object[ordered.size()];

            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = use(ordered.get(i));
            }

            return Reflections.construct(implementation, parameterTypes, arguments);
        }, lifetime);
    }

    public <T> void bind(@NotNull DependencyId<T> id, @NotNull Supplier<? extends T> factory) {
        bind(id, factory, Lifetime.SINGLETON);
    }

    public <T> void bind(@NotNull DependencyId<T> id,
                         @NotNull Supplier<? extends T> factory,
                         @NotNull Lifetime lifetime) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(lifetime, "lifetime");

        Injectable<Void, T> injectable = Injectable.define(factory, InjectableOptions.builder()
                .lifetime(lifetime)
                .name(id.getName())
                .build());

        if (bindings.put(id, injectable) != null) {
            LOGGER.fine(() -> "Replacing \"" + id.getName() + "\" binding with a new one");
        }
    }

    public <T> T use(@NotNull DependencyId<T> id) {
        return Injector.inject(getInjectable(id));
    }

    public <T> T use(@NotNull DependencyId<T> id, @NotNull Scope scope) {
        Objects.requireNonNull(scope, "scope");

        return scope.inject(getInjectable(id));
    }

    public boolean contains(@NotNull DependencyId<?> id) {
        return bindings.containsKey(id);
    }

    /**
     * @throws NotFoundException if nothing is bound to {@code id}
     */
    @SuppressWarnings("unchecked")
    public <T> @NotNull Injectable<Void, T> getInjectable(@NotNull DependencyId<T> id) {
        Objects.requireNonNull(id, "id");
        Injectable<Void, ?> injectable = bindings.get(id);

        if (injectable == null) {
            throw new NotFoundException("\"" + id.getName() + "\" dependency not found");
        }

        return (Injectable<Void, T>) injectable;
    }

    private static Lifetime declaredLifetime(Class<?> implementation) {
        List<Lifetime> declared = new ArrayList<>();

        if (implementation.isAnnotationPresent(Singleton.class)) {
            declared.add(Lifetime.SINGLETON);
        }

        if (implementation.isAnnotationPresent(Scoped.class)) {
            declared.add(Lifetime.SCOPED);
        }

        if (implementation.isAnnotationPresent(Transient.class)) {
            declared.add(Lifetime.TRANSIENT);
        }

        if (declared.size() > 1) {
            throw new ConfigurationException(implementation.getName() + " declares more than one lifetime: " + declared);
        }

        return declared.isEmpty() ? Lifetime.SINGLETON : declared.get(0);
    }
}
