package dev.fumaz.ambit.injectable;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link Factory} produces the value of an {@link Injectable}, either with or without an explicit argument.
 *
 * @param <A> the type of the explicit argument
 * @param <T> the type of the produced value
 */
public interface Factory<A, T> {

    static <T> @NotNull Factory<Void, T> of(@NotNull Supplier<? extends T> supplier) {
        return new SupplierFactory<>(supplier);
    }

    static <A, T> @NotNull Factory<A, T> of(@NotNull Function<? super A, ? extends T> function) {
        return new FunctionFactory<>(function);
    }

    @Nullable T create();

    @Nullable T create(@Nullable A argument);

    final class SupplierFactory<A, T> implements Factory<A, T> {
        private final Supplier<? extends T> supplier;

        private SupplierFactory(Supplier<? extends T> supplier) {
            this.supplier = Objects.requireNonNull(supplier, "supplier");
        }

        @Override
        public T create() {
            return supplier.get();
        }

        // Argument-less factories ignore whatever they are given.
        @Override
        public T create(A argument) {
            return supplier.get();
        }
    }

    final class FunctionFactory<A, T> implements Factory<A, T> {
        private final Function<? super A, ? extends T> function;

        private FunctionFactory(Function<? super A, ? extends T> function) {
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public T create() {
            return function.apply(null);
        }

        @Override
        public T create(A argument) {
            return function.apply(argument);
        }
    }
}
