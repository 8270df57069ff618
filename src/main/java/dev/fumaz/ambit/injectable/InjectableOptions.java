package dev.fumaz.ambit.injectable;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Configuration object controlling how {@link Injectable#define(java.util.function.Supplier, InjectableOptions)}
 * builds a definition.
 */
public final class InjectableOptions {

    private static final InjectableOptions DEFAULTS = builder().build();

    private final Lifetime lifetime;
    private final @Nullable String name;

    private InjectableOptions(Lifetime lifetime, @Nullable String name) {
        this.lifetime = lifetime;
        this.name = name;
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    /**
     * Debugging name. Has no effect on resolution.
     */
    public @Nullable String getName() {
        return name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InjectableOptions defaults() {
        return DEFAULTS;
    }

    public static InjectableOptions of(@NotNull Lifetime lifetime) {
        return builder().lifetime(lifetime).build();
    }

    public static final class Builder {
        private Lifetime lifetime = Lifetime.SINGLETON;
        private String name;

        public Builder lifetime(@NotNull Lifetime lifetime) {
            this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
            return this;
        }

        public Builder singleton() {
            return lifetime(Lifetime.SINGLETON);
        }

        public Builder scoped() {
            return lifetime(Lifetime.SCOPED);
        }

        public Builder transientLifetime() {
            return lifetime(Lifetime.TRANSIENT);
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public InjectableOptions build() {
            return new InjectableOptions(lifetime, name);
        }
    }
}
