package io.github.eutro.wasmslice.core.ops;

import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.ext.ExtContainer;
import io.github.eutro.wasmslice.core.ext.ExtHolder;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 * <p>
 * Exts not attached to the operation are looked up on its key.
 */
public /* virtual */ class Op extends ExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    /**
     * Construct an operation with the given key.
     *
     * @param key The key.
     */
    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer fallback() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct an instruction with this as its operation, at the given label.
     *
     * @param label The label of the instruction.
     * @return The instruction.
     */
    public Insn insn(Label label) {
        return new Insn(label, this);
    }
}
