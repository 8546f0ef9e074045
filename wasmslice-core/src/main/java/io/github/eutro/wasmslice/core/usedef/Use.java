package io.github.eutro.wasmslice.core.usedef;

import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.state.Var;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An occurrence of a {@link Var} being consumed, by an instruction or by a merge block.
 * <p>
 * Uses are ordered by location, then by variable.
 */
public abstract class Use implements Comparable<Use> {
    /**
     * The variable being used.
     */
    public final Var var;

    private Use(Var var) {
        this.var = var;
    }

    public static Instruction instruction(Label label, Var var) {
        return new Instruction(label, var);
    }

    public static Merge merge(int block, Var var) {
        return new Merge(block, var);
    }

    /**
     * Get the label of the instruction, or the merge label of the block, where the use happens.
     *
     * @return The label.
     */
    public abstract Label label();

    @Override
    public int compareTo(@NotNull Use o) {
        int c = label().compareTo(o.label());
        return c != 0 ? c : var.compareTo(o.var);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Use use = (Use) o;
        return label().equals(use.label()) && var.equals(use.var);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label(), var);
    }

    public static final class Instruction extends Use {
        public final Label label;

        private Instruction(Label label, Var var) {
            super(var);
            this.label = label;
        }

        @Override
        public Label label() {
            return label;
        }

        @Override
        public String toString() {
            return "use(" + label + ", " + var + ")";
        }
    }

    public static final class Merge extends Use {
        public final int block;

        private Merge(int block, Var var) {
            super(var);
            this.block = block;
        }

        @Override
        public Label label() {
            return Label.merge(block);
        }

        @Override
        public String toString() {
            return "use(merge" + block + ", " + var + ")";
        }
    }
}
