package dev.fumaz.ambit.scope;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Public facade for creating scopes and reaching the root scope.
 */
public final class Scopes {

    private static final Scope ROOT = new Scope("root");

    private Scopes() {
    }

    /**
     * The root scope holds every singleton and is the active scope whenever no other has been installed.
     */
    public static @NotNull Scope root() {
        return ROOT;
    }

    public static @NotNull Scope create() {
        return new Scope(null);
    }

    public static @NotNull Scope create(@Nullable String label) {
        return new Scope(label);
    }
}
