package dev.fumaz.ambit.context;

import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.scope.Scope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link ResolutionContext} is the state a resolution runs under: the scope it resolves into and the injectable
 * whose factory is currently executing, if any.
 */
public final class ResolutionContext {

    private final @NotNull Scope scope;
    private final @Nullable Injectable<?, ?> parent;

    private ResolutionContext(@NotNull Scope scope, @Nullable Injectable<?, ?> parent) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.parent = parent;
    }

    public static @NotNull ResolutionContext of(@NotNull Scope scope) {
        return new ResolutionContext(scope, null);
    }

    public static @NotNull ResolutionContext of(@NotNull Scope scope, @Nullable Injectable<?, ?> parent) {
        return new ResolutionContext(scope, parent);
    }

    public @NotNull Scope getScope() {
        return scope;
    }

    public @Nullable Injectable<?, ?> getParent() {
        return parent;
    }

    public boolean hasParent() {
        return parent != null;
    }

    public @NotNull ResolutionContext withParent(@Nullable Injectable<?, ?> parent) {
        return new ResolutionContext(scope, parent);
    }

    @Override
    public String toString() {
        return "ResolutionContext{scope=" + scope + ", parent=" + parent + '}';
    }
}
