package dev.fumaz.ambit.injector;

import dev.fumaz.ambit.context.AmbientContext;
import dev.fumaz.ambit.context.ResolutionContext;
import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injectable.Lifetime;
import dev.fumaz.ambit.scope.Scope;
import dev.fumaz.ambit.scope.Scopes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The {@link Injector} resolves {@link Injectable}s against the ambient {@link ResolutionContext}.
 * <p>
 * Singletons are cached in the root scope, scoped instances in the active scope, and transient instances nowhere.
 * While a factory runs, the injectable being produced is installed as the parent, so every nested resolution is
 * recorded as one of its dependencies. On a cache hit the explicit argument is discarded: the first resolution wins.
 * <p>
 * Exceptions thrown by factories reach the caller unchanged. Nothing is cached for a failed resolution, and the
 * ambient context is restored before the exception propagates.
 * <p>
 * A {@code null} instance is returned to the caller but never cached, so the factory runs again on the next
 * resolution.
 */
public final class Injector {

    private static final Logger LOGGER = Logger.getLogger(Injector.class.getName());

    private Injector() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static <T> T inject(@NotNull Injectable<?, T> injectable) {
        return resolve(injectable, null, false);
    }

    public static <A, T> T inject(@NotNull Injectable<A, T> injectable, @Nullable A argument) {
        return resolve(injectable, argument, true);
    }

    /**
     * Returns the cached instance {@code injectable} would resolve to, without producing one and without recording
     * a dependency. Transient injectables are never cached, so they are always absent.
     */
    public static <T> @NotNull Optional<T> use(@NotNull Injectable<?, T> injectable) {
        Objects.requireNonNull(injectable, "injectable");

        if (!injectable.getLifetime().isCached()) {
            return Optional.empty();
        }

        return targetScope(injectable, AmbientContext.current()).get(injectable);
    }

    private static <A, T> T resolve(Injectable<A, T> injectable, @Nullable A argument, boolean supplied) {
        Objects.requireNonNull(injectable, "injectable");

        ResolutionContext context = AmbientContext.current();
        Injectable<?, ?> parent = context.getParent();

        if (parent != null) {
            parent.recordDependency(injectable);
        }

        ResolutionContext production = context.withParent(injectable);

        if (injectable.getLifetime() == Lifetime.TRANSIENT) {
            return AmbientContext.runWith(production, () -> produce(injectable, argument, supplied));
        }

        Scope target = targetScope(injectable, context);
        Optional<T> cached = target.get(injectable);

        if (cached.isPresent()) {
            return cached.get();
        }

        return AmbientContext.runWith(production, () -> {
            T instance = produce(injectable, argument, supplied);

            if (instance == null) {
                LOGGER.fine(() -> injectable + " produced null, nothing was cached in " + target);
                return null;
            }

            target.put(injectable, instance);
            LOGGER.fine(() -> "Cached new instance of " + injectable + " in " + target);

            return instance;
        });
    }

    private static <A, T> @Nullable T produce(Injectable<A, T> injectable, @Nullable A argument, boolean supplied) {
        return supplied ? injectable.getFactory().create(argument) : injectable.getFactory().create();
    }

    private static Scope targetScope(Injectable<?, ?> injectable, ResolutionContext context) {
        return injectable.getLifetime() == Lifetime.SINGLETON ? Scopes.root() : context.getScope();
    }
}
