package io.github.eutro.wasmslice.core.ops;

import io.github.eutro.wasmslice.core.cfg.ValType;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.state.PrimValue;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.List;
import java.util.Objects;

/**
 * The instruction vocabulary of the analysed stack machine.
 * <p>
 * Data operations appear in data blocks, control operations alone in control blocks.
 * Operators that only differ in the value they compute (e.g. {@code i32.add} and {@code i64.mul})
 * are folded into one key per shape, with the operator name as the intermediate.
 */
public class WasmOps {
    @Retention(RetentionPolicy.CLASS)
    @Target(ElementType.TYPE_USE)
    public @interface For {
        String value();
    }

    public static final SimpleOpKey NOP = new SimpleOpKey("nop");
    public static final SimpleOpKey DROP = new SimpleOpKey("drop");
    public static final SimpleOpKey SELECT = new SimpleOpKey("select");
    public static final SimpleOpKey MEMORY_SIZE = new SimpleOpKey("memory.size");
    public static final SimpleOpKey MEMORY_GROW = new SimpleOpKey("memory.grow");

    public static final UnaryOpKey<@For("local") Integer> LOCAL_GET = new UnaryOpKey<>("local.get");
    public static final UnaryOpKey<@For("local") Integer> LOCAL_SET = new UnaryOpKey<>("local.set");
    public static final UnaryOpKey<@For("local") Integer> LOCAL_TEE = new UnaryOpKey<>("local.tee");
    public static final UnaryOpKey<@For("global") Integer> GLOBAL_GET = new UnaryOpKey<>("global.get");
    public static final UnaryOpKey<@For("global") Integer> GLOBAL_SET = new UnaryOpKey<>("global.set");

    public static final UnaryOpKey<PrimValue> CONST = new UnaryOpKey<>("const");

    public static final UnaryOpKey<@For("operator") String> UNARY = new UnaryOpKey<>("unary");
    public static final UnaryOpKey<@For("operator") String> BINARY = new UnaryOpKey<>("binary");
    public static final UnaryOpKey<@For("operator") String> COMPARE = new UnaryOpKey<>("compare");
    public static final UnaryOpKey<@For("operator") String> TEST = new UnaryOpKey<>("test");
    public static final UnaryOpKey<@For("operator") String> CONVERT = new UnaryOpKey<>("convert");

    public static final UnaryOpKey<WithMemArg<ValType>> LOAD = new UnaryOpKey<>("load");
    public static final UnaryOpKey<WithMemArg<ValType>> STORE = new UnaryOpKey<>("store");

    // structured markers; they never reach the transfer functions of a well-formed graph
    public static final SimpleOpKey BLOCK = new SimpleOpKey("block");
    public static final SimpleOpKey LOOP = new SimpleOpKey("loop");

    public static final SimpleOpKey IF = new SimpleOpKey("if");
    public static final UnaryOpKey<@For("depth") Integer> BR = new UnaryOpKey<>("br");
    public static final UnaryOpKey<@For("depth") Integer> BR_IF = new UnaryOpKey<>("br_if");
    public static final UnaryOpKey<List<@For("depth") Integer>> BR_TABLE = new UnaryOpKey<>("br_table");
    public static final UnaryOpKey<CallType> CALL = new UnaryOpKey<>("call");
    public static final UnaryOpKey<CallType> CALL_INDIRECT = new UnaryOpKey<>("call_indirect");
    public static final SimpleOpKey RETURN = new SimpleOpKey("return");
    public static final SimpleOpKey UNREACHABLE = new SimpleOpKey("unreachable");

    static {
        for (OpKey key : new OpKey[]{
                BLOCK,
                LOOP,
                IF,
                BR,
                BR_IF,
                BR_TABLE,
                CALL,
                CALL_INDIRECT,
                RETURN,
                UNREACHABLE,
        }) {
            key.attachExt(CommonExts.IS_CONTROL, true);
        }
        for (OpKey key : new OpKey[]{
                IF,
                BR_IF,
                BR_TABLE,
        }) {
            key.attachExt(CommonExts.IS_BRANCH, true);
        }
    }

    /**
     * Get whether an operation may only appear in a control block.
     *
     * @param op The operation.
     * @return Whether it is a control operation.
     */
    public static boolean isControl(Op op) {
        return op.getExt(CommonExts.IS_CONTROL).orElse(false);
    }

    /**
     * Get whether an operation decides between several outgoing edges.
     *
     * @param op The operation.
     * @return Whether it is a branch.
     */
    public static boolean isBranch(Op op) {
        return op.getExt(CommonExts.IS_BRANCH).orElse(false);
    }

    public static Op i32Const(int value) {
        return CONST.create(PrimValue.i32(value));
    }

    public static Op binary(String operator) {
        return BINARY.create(operator);
    }

    public static Op call(int func, int arityIn, int arityOut) {
        return CALL.create(new CallType(func, arityIn, arityOut));
    }

    public static Op callIndirect(int type, int arityIn, int arityOut) {
        return CALL_INDIRECT.create(new CallType(type, arityIn, arityOut));
    }

    public static Op load(ValType type, int offset) {
        return LOAD.create(WithMemArg.create(type, offset));
    }

    public static Op store(ValType type, int offset) {
        return STORE.create(WithMemArg.create(type, offset));
    }

    /**
     * The signature of a call, as far as the operand stack is concerned.
     */
    public static class CallType {
        /**
         * The called function for {@link #CALL}, or the type index for {@link #CALL_INDIRECT}.
         */
        public final int index;
        /**
         * How many arguments the callee pops, not counting the table index of an indirect call.
         */
        public final int arityIn;
        /**
         * How many results the callee pushes, zero or one.
         */
        public final int arityOut;

        public CallType(int index, int arityIn, int arityOut) {
            if (arityIn < 0 || arityOut < 0 || arityOut > 1) {
                throw new IllegalArgumentException(String.format("invalid call arity (%d, %d)", arityIn, arityOut));
            }
            this.index = index;
            this.arityIn = arityIn;
            this.arityOut = arityOut;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CallType callType = (CallType) o;
            return index == callType.index && arityIn == callType.arityIn && arityOut == callType.arityOut;
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, arityIn, arityOut);
        }

        @Override
        public String toString() {
            return index + " (" + arityIn + " -> " + arityOut + ")";
        }
    }

    public static class WithMemArg<T> {
        public final T value;
        public final int offset;

        private WithMemArg(T value, int offset) {
            this.value = value;
            this.offset = offset;
        }

        public static <T> WithMemArg<T> create(T value, int offset) {
            return new WithMemArg<>(value, offset);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WithMemArg<?> that = (WithMemArg<?>) o;
            return offset == that.offset && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, offset);
        }

        @Override
        public String toString() {
            return value + " offset=" + offset;
        }
    }
}
