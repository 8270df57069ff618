package dev.fumaz.ambit.injectable;

/**
 * Declares how long an instance produced for an {@link Injectable} is reused.
 */
public enum Lifetime {

    /**
     * One instance per process, cached in the root scope whichever scope is active.
     */
    SINGLETON,

    /**
     * One instance per scope, cached in the scope that is active when it is first resolved.
     */
    SCOPED,

    /**
     * A new instance on every resolution. Never cached.
     */
    TRANSIENT;

    public boolean isCached() {
        return this != TRANSIENT;
    }
}
