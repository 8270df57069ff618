package dev.fumaz.ambit.scope;

import dev.fumaz.ambit.context.AmbientContext;
import dev.fumaz.ambit.context.ResolutionContext;
import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injector.Injector;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * A {@link Scope} caches the instances produced for {@link Injectable}s resolved while it is the active scope.
 * <p>
 * Entries are keyed by injectable identity. A scope never disposes what it holds; {@link #reset()} only forgets it.
 */
public final class Scope {

    private static final Logger LOGGER = Logger.getLogger(Scope.class.getName());

    private final @Nullable String label;
    private final ConcurrentMap<Injectable<?, ?>, Object> instances = new ConcurrentHashMap<>();

    Scope(@Nullable String label) {
        this.label = label;
    }

    public @Nullable String getLabel() {
        return label;
    }

    /**
     * Resolves {@code injectable} with this scope installed as the active scope.
     */
    public <T> T inject(@NotNull Injectable<?, T> injectable) {
        Objects.requireNonNull(injectable, "injectable");

        return AmbientContext.runWith(entryContext(injectable), () -> Injector.inject(injectable));
    }

    /**
     * Resolves {@code injectable} with this scope installed as the active scope, passing {@code argument} to its
     * factory if an instance has to be produced.
     */
    public <A, T> T inject(@NotNull Injectable<A, T> injectable, @Nullable A argument) {
        Objects.requireNonNull(injectable, "injectable");

        return AmbientContext.runWith(entryContext(injectable), () -> Injector.inject(injectable, argument));
    }

    /**
     * Looks up the instance {@code injectable} would resolve to from this scope, without producing one.
     */
    public <T> @NotNull Optional<T> use(@NotNull Injectable<?, T> injectable) {
        Objects.requireNonNull(injectable, "injectable");

        return AmbientContext.runWith(ResolutionContext.of(this), () -> Injector.use(injectable));
    }

    public void reset() {
        int cleared = instances.size();
        instances.clear();

        LOGGER.fine(() -> "Reset " + this + ", dropped " + cleared + " cached instance(s)");
    }

    @SuppressWarnings("unchecked")
    public <T> @NotNull Optional<T> get(@NotNull Injectable<?, T> injectable) {
        return Optional.ofNullable((T) instances.get(injectable));
    }

    public boolean contains(@NotNull Injectable<?, ?> injectable) {
        return instances.containsKey(injectable);
    }

    /**
     * Caches {@code instance} for {@code injectable}. Only the resolution engine populates scopes; application code
     * resolves through {@link #inject(Injectable)} instead.
     */
    @ApiStatus.Internal
    public <T> void put(@NotNull Injectable<?, T> injectable, @NotNull T instance) {
        instances.put(Objects.requireNonNull(injectable, "injectable"), Objects.requireNonNull(instance, "instance"));
    }

    public int size() {
        return instances.size();
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }

    public @NotNull Map<Injectable<?, ?>, Object> getInstances() {
        return Collections.unmodifiableMap(instances);
    }

    public boolean isRoot() {
        return this == Scopes.root();
    }

    // Entry points install the injectable as its own parent; nested calls keep the caller's parent.
    private ResolutionContext entryContext(Injectable<?, ?> injectable) {
        Injectable<?, ?> parent = AmbientContext.current().getParent();

        return ResolutionContext.of(this, parent == null ? injectable : parent);
    }

    @Override
    public String toString() {
        return label == null ? "Scope@" + Integer.toHexString(System.identityHashCode(this)) : "Scope[" + label + "]";
    }
}
