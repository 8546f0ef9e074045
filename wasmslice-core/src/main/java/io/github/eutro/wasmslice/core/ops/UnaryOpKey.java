package io.github.eutro.wasmslice.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An operation key for operations with exactly one non-null intermediate, of type {@code T}.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    public UnaryOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * An operation of this key.
     */
    public class UnaryOp extends Op {
        /**
         * The intermediate.
         */
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnaryOpKey.UnaryOp)) return false;
            UnaryOp unaryOp = (UnaryOp) o;
            return key == unaryOp.key && arg.equals(unaryOp.arg);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, arg);
        }

        @Override
        public String toString() {
            return key + " " + arg;
        }
    }

    /**
     * Get the intermediate of an operation, if it has this key.
     *
     * @param op The operation.
     * @return The intermediate, or null if the operation has another key.
     */
    @SuppressWarnings("unchecked")
    public @Nullable T argNullable(Op op) {
        return op.key == this ? ((UnaryOp) op).arg : null;
    }

    /**
     * Cast an operation to one of this key.
     *
     * @param op The operation.
     * @return The operation.
     * @throws ClassCastException If the operation has another key.
     */
    @SuppressWarnings("unchecked")
    public UnaryOp cast(Op op) {
        if (op.key != this) {
            throw new ClassCastException(op + " is not a " + this + " operation");
        }
        return (UnaryOp) op;
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("null intermediate for " + this);
        }
        return new UnaryOp(arg);
    }
}
