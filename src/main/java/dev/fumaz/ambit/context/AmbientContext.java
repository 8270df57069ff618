package dev.fumaz.ambit.context;

import dev.fumaz.ambit.scope.Scopes;
import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

/**
 * Ambient {@link ResolutionContext}, seeded with the root scope and no parent.
 * <p>
 * The binding is held per thread. A factory that hands resolution to another thread does not carry its binding
 * along: the worker thread resolves under {@code {root scope, no parent}}, so scoped instances land in the root scope
 * and no dependency edge is recorded on the factory's injectable.
 */
public final class AmbientContext {

    private static final ContextCell<ResolutionContext> CELL =
            ContextCell.withInitial(ResolutionContext.of(Scopes.root()));

    private AmbientContext() {
    }

    public static @NotNull ResolutionContext current() {
        return CELL.get();
    }

    public static <R> R runWith(@NotNull ResolutionContext context, @NotNull Supplier<R> action) {
        return CELL.runWith(context, action);
    }
}
