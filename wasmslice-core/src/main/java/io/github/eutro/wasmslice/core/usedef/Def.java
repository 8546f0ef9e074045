package io.github.eutro.wasmslice.core.usedef;

import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.state.Var;

import java.util.Objects;
import java.util.Optional;

/**
 * The unique definition of a {@link Var}.
 */
public abstract class Def {
    /**
     * The variable being defined.
     */
    public final Var var;

    private Def(Var var) {
        this.var = var;
    }

    public static Instruction instruction(Label label, Var var) {
        return new Instruction(label, var);
    }

    public static Merge merge(int block, Var var) {
        return new Merge(block, var);
    }

    public static Entry entry(Var var) {
        return new Entry(var);
    }

    public static Constant constant(Var.Constant var) {
        return new Constant(var);
    }

    /**
     * Get the label of the instruction or merge block making this definition, if there is one.
     *
     * @return The label, empty for definitions at function entry and for constants.
     */
    public abstract Optional<Label> label();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Def def = (Def) o;
        return var.equals(def.var) && label().equals(def.label());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), var, label());
    }

    /**
     * A variable defined by an instruction.
     */
    public static final class Instruction extends Def {
        public final Label label;

        private Instruction(Label label, Var var) {
            super(var);
            this.label = label;
        }

        @Override
        public Optional<Label> label() {
            return Optional.of(label);
        }

        @Override
        public String toString() {
            return "def(" + label + ", " + var + ")";
        }
    }

    /**
     * A variable defined at a merge block.
     */
    public static final class Merge extends Def {
        public final int block;

        private Merge(int block, Var var) {
            super(var);
            this.block = block;
        }

        @Override
        public Optional<Label> label() {
            return Optional.of(Label.merge(block));
        }

        @Override
        public String toString() {
            return "def(merge" + block + ", " + var + ")";
        }
    }

    /**
     * A variable holding the value of a local or global when the function is entered.
     */
    public static final class Entry extends Def {
        private Entry(Var var) {
            super(var);
        }

        @Override
        public Optional<Label> label() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "def(entry, " + var + ")";
        }
    }

    /**
     * A literal, which needs no instruction to be defined.
     */
    public static final class Constant extends Def {
        private Constant(Var.Constant var) {
            super(var);
        }

        @Override
        public Optional<Label> label() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "def(const, " + var + ")";
        }
    }
}
