package dev.fumaz.ambit.context;

import dev.fumaz.ambit.exception.OutOfContextException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link ContextCell} holds an ambient binding that can be temporarily replaced for the dynamic extent of a call.
 * <p>
 * Each thread sees its own binding, seeded with the cell's initial value. A replaced binding is always restored
 * when the call returns or throws, so nested calls unwind in stack order.
 *
 * @param <T> the type of the binding
 */
public final class ContextCell<T> {

    private final ThreadLocal<T> current;

    private ContextCell(@Nullable T initial) {
        this.current = ThreadLocal.withInitial(() -> initial);
    }

    public static <T> @NotNull ContextCell<T> withInitial(@NotNull T initial) {
        return new ContextCell<>(Objects.requireNonNull(initial, "initial"));
    }

    public static <T> @NotNull ContextCell<T> empty() {
        return new ContextCell<>(null);
    }

    /**
     * Returns the binding visible to the current call.
     *
     * @throws OutOfContextException if no binding has been established
     */
    public @NotNull T get() {
        T binding = current.get();

        if (binding == null) {
            throw new OutOfContextException("No ambient context has been established on thread "
                    + Thread.currentThread().getName());
        }

        return binding;
    }

    public boolean isBound() {
        return current.get() != null;
    }

    /**
     * Runs {@code action} with {@code binding} installed and returns its result.
     * The previous binding is restored on every exit path.
     */
    public <R> R runWith(@NotNull T binding, @NotNull Supplier<R> action) {
        Objects.requireNonNull(binding, "binding");
        Objects.requireNonNull(action, "action");

        T previous = current.get();
        current.set(binding);

        try {
            return action.get();
        } finally {
            restore(previous);
        }
    }

    public void run(@NotNull T binding, @NotNull Runnable action) {
        Objects.requireNonNull(action, "action");

        runWith(binding, () -> {
            action.run();
            return null;
        });
    }

    private void restore(@Nullable T previous) {
        if (previous == null) {
            current.remove();
        } else {
            current.set(previous);
        }
    }
}
