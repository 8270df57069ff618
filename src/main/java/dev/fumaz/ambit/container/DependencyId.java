package dev.fumaz.ambit.container;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link DependencyId} identifies a binding in a {@link DependencyContainer}.
 * <p>
 * Identity is the id object itself. The name is for messages and debugging only.
 *
 * @param <T> the type of the bound value
 */
public final class DependencyId<T> {

    private final @NotNull String name;
    private final @NotNull Class<T> type;

    DependencyId(@NotNull String name, @NotNull Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + "<" + type.getSimpleName() + ">";
    }
}
