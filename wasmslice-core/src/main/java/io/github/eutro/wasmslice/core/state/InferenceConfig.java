package io.github.eutro.wasmslice.core.state;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * How much {@link StateInference} propagates variables, rather than minting fresh ones.
 * <p>
 * With every option enabled, {@code local.get 0} pushes the variable currently held by local 0,
 * and {@code i32.const 1} pushes the shared constant {@code (i32 1)}. With an option disabled,
 * the corresponding instructions push (or store) a fresh variable of their own instead.
 */
public final class InferenceConfig {
    /**
     * Every option enabled.
     */
    public static final InferenceConfig DEFAULT = builder().build();
    /**
     * Every option disabled: each of these instructions mints its own variable.
     */
    public static final InferenceConfig OPAQUE = builder()
            .propagateLocals(false)
            .propagateGlobals(false)
            .useConstants(false)
            .build();

    /**
     * Whether locals hold the variables stored into them, instead of a fresh variable per store and read.
     */
    public final boolean propagateLocals;
    /**
     * Whether globals hold the variables stored into them, instead of a fresh variable per store and read.
     */
    public final boolean propagateGlobals;
    /**
     * Whether literals are identified by their value, instead of by the instruction that pushes them.
     */
    public final boolean useConstants;

    private InferenceConfig(Builder builder) {
        this.propagateLocals = builder.propagateLocals;
        this.propagateGlobals = builder.propagateGlobals;
        this.useConstants = builder.useConstants;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from the process environment.
     * <p>
     * Each of {@code WASMSLICE_PROPAGATE_LOCALS}, {@code WASMSLICE_PROPAGATE_GLOBALS} and
     * {@code WASMSLICE_USE_CONSTANTS} disables its option if set to {@code false} or {@code 0},
     * and leaves it enabled otherwise.
     *
     * @return The configuration.
     */
    public static InferenceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Read the configuration from a map of environment variables.
     *
     * @param env The environment lookup, returning null for unset variables.
     * @return The configuration.
     * @see #fromEnvironment()
     */
    public static InferenceConfig fromEnvironment(UnaryOperator<String> env) {
        return builder()
                .propagateLocals(flag(env.apply("WASMSLICE_PROPAGATE_LOCALS")))
                .propagateGlobals(flag(env.apply("WASMSLICE_PROPAGATE_GLOBALS")))
                .useConstants(flag(env.apply("WASMSLICE_USE_CONSTANTS")))
                .build();
    }

    private static boolean flag(String value) {
        if (value == null) return true;
        String v = value.trim();
        return !(v.equalsIgnoreCase("false") || v.equals("0"));
    }

    public Builder toBuilder() {
        return builder()
                .propagateLocals(propagateLocals)
                .propagateGlobals(propagateGlobals)
                .useConstants(useConstants);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InferenceConfig that = (InferenceConfig) o;
        return propagateLocals == that.propagateLocals
                && propagateGlobals == that.propagateGlobals
                && useConstants == that.useConstants;
    }

    @Override
    public int hashCode() {
        return Objects.hash(propagateLocals, propagateGlobals, useConstants);
    }

    @Override
    public String toString() {
        return "InferenceConfig{" +
                "propagateLocals=" + propagateLocals +
                ", propagateGlobals=" + propagateGlobals +
                ", useConstants=" + useConstants +
                '}';
    }

    public static final class Builder {
        private boolean propagateLocals = true;
        private boolean propagateGlobals = true;
        private boolean useConstants = true;

        private Builder() {
        }

        public Builder propagateLocals(boolean propagateLocals) {
            this.propagateLocals = propagateLocals;
            return this;
        }

        public Builder propagateGlobals(boolean propagateGlobals) {
            this.propagateGlobals = propagateGlobals;
            return this;
        }

        public Builder useConstants(boolean useConstants) {
            this.useConstants = useConstants;
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }
    }
}
