package io.github.eutro.wasmslice.core.state;

import io.github.eutro.wasmslice.core.cfg.Label;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A symbolic identifier for one abstract value.
 * <p>
 * Every variable is minted exactly once: at function entry, by one instruction,
 * or at one merge block. Variables are immutable, compared structurally,
 * and totally ordered (by variant, then by contents).
 */
public abstract class Var implements Comparable<Var> {
    // declaration order is the order between variants
    enum Kind {
        STACK_ORIGIN,
        LOCAL,
        GLOBAL,
        CONSTANT,
        MERGE,
        MEMORY_CELL,
        FUNCTION_RESULT,
        HOLE,
    }

    /**
     * The value returned by the function, as seen at the exit block.
     */
    public static final Var RESULT = new FunctionResult();
    /**
     * A placeholder for a merged position whose variable is not assigned yet.
     */
    static final Var HOLE = new Hole();

    private Var() {
    }

    abstract Kind kind();

    abstract int compareSame(Var o);

    public static StackOrigin stack(Label label) {
        return new StackOrigin(label);
    }

    public static Local local(int index) {
        return new Local(index);
    }

    public static Global global(int index) {
        return new Global(index);
    }

    public static Constant constant(PrimValue value) {
        return new Constant(value);
    }

    public static MergeVar merge(int block, int n) {
        return new MergeVar(block, n);
    }

    public static MemoryCell memoryCell(Var address, int offset) {
        return new MemoryCell(address, offset);
    }

    @Override
    public final int compareTo(@NotNull Var o) {
        int c = kind().compareTo(o.kind());
        return c != 0 ? c : compareSame(o);
    }

    /**
     * The value pushed by the instruction with the given label.
     */
    public static final class StackOrigin extends Var {
        public final Label label;

        private StackOrigin(Label label) {
            this.label = label;
        }

        @Override
        Kind kind() {
            return Kind.STACK_ORIGIN;
        }

        @Override
        int compareSame(Var o) {
            return label.compareTo(((StackOrigin) o).label);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StackOrigin && label.equals(((StackOrigin) o).label);
        }

        @Override
        public int hashCode() {
            return label.hashCode();
        }

        @Override
        public String toString() {
            return "i" + label;
        }
    }

    /**
     * The value of a local at function entry.
     */
    public static final class Local extends Var {
        public final int index;

        private Local(int index) {
            this.index = index;
        }

        @Override
        Kind kind() {
            return Kind.LOCAL;
        }

        @Override
        int compareSame(Var o) {
            return Integer.compare(index, ((Local) o).index);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Local && index == ((Local) o).index;
        }

        @Override
        public int hashCode() {
            return 31 + index;
        }

        @Override
        public String toString() {
            return "l" + index;
        }
    }

    /**
     * The value of a global at function entry.
     */
    public static final class Global extends Var {
        public final int index;

        private Global(int index) {
            this.index = index;
        }

        @Override
        Kind kind() {
            return Kind.GLOBAL;
        }

        @Override
        int compareSame(Var o) {
            return Integer.compare(index, ((Global) o).index);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Global && index == ((Global) o).index;
        }

        @Override
        public int hashCode() {
            return 37 + index;
        }

        @Override
        public String toString() {
            return "g" + index;
        }
    }

    /**
     * A literal, shared by every occurrence of the same value.
     */
    public static final class Constant extends Var {
        public final PrimValue value;

        private Constant(PrimValue value) {
            this.value = value;
        }

        @Override
        Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        int compareSame(Var o) {
            return value.compareTo(((Constant) o).value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant && value.equals(((Constant) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "(" + value + ")";
        }
    }

    /**
     * The {@code n}th variable synthesized at a merge block.
     */
    public static final class MergeVar extends Var {
        public final int block;
        public final int n;

        private MergeVar(int block, int n) {
            this.block = block;
            this.n = n;
        }

        @Override
        Kind kind() {
            return Kind.MERGE;
        }

        @Override
        int compareSame(Var o) {
            MergeVar m = (MergeVar) o;
            int c = Integer.compare(block, m.block);
            return c != 0 ? c : Integer.compare(n, m.n);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof MergeVar)) return false;
            MergeVar m = (MergeVar) o;
            return block == m.block && n == m.n;
        }

        @Override
        public int hashCode() {
            return Objects.hash(block, n);
        }

        @Override
        public String toString() {
            return "m" + block + "_" + n;
        }
    }

    /**
     * A location in linear memory: the address held by a variable, plus a static byte offset.
     * Used as a key of {@link State#memory()}.
     */
    public static final class MemoryCell extends Var {
        public final Var address;
        public final int offset;

        private MemoryCell(Var address, int offset) {
            this.address = address;
            this.offset = offset;
        }

        @Override
        Kind kind() {
            return Kind.MEMORY_CELL;
        }

        @Override
        int compareSame(Var o) {
            MemoryCell m = (MemoryCell) o;
            int c = address.compareTo(m.address);
            return c != 0 ? c : Integer.compare(offset, m.offset);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof MemoryCell)) return false;
            MemoryCell m = (MemoryCell) o;
            return offset == m.offset && address.equals(m.address);
        }

        @Override
        public int hashCode() {
            return Objects.hash(address, offset);
        }

        @Override
        public String toString() {
            return "[" + address + "+" + offset + "]";
        }
    }

    private static final class FunctionResult extends Var {
        @Override
        Kind kind() {
            return Kind.FUNCTION_RESULT;
        }

        @Override
        int compareSame(Var o) {
            return 0;
        }

        @Override
        public String toString() {
            return "ret";
        }
    }

    private static final class Hole extends Var {
        @Override
        Kind kind() {
            return Kind.HOLE;
        }

        @Override
        int compareSame(Var o) {
            return 0;
        }

        @Override
        public String toString() {
            return "_";
        }
    }
}
