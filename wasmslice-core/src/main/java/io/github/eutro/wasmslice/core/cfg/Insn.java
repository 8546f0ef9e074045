package io.github.eutro.wasmslice.core.cfg;

import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.Ext;
import io.github.eutro.wasmslice.core.ext.ExtContainer;
import io.github.eutro.wasmslice.core.ext.ExtHolder;
import io.github.eutro.wasmslice.core.ops.Op;
import io.github.eutro.wasmslice.core.state.State;
import org.jetbrains.annotations.Nullable;

/**
 * A single instruction of a {@link BasicBlock}: an {@link Op} at a {@link Label}.
 * <p>
 * Exts not found on the instruction are looked up on its operation.
 */
public final class Insn extends ExtHolder {
    /**
     * The label of the instruction, unique in its function.
     */
    public final Label label;
    /**
     * The operation of the instruction.
     */
    public final Op op;

    // fast paths for the exts every instruction gets
    private State before;
    private State after;

    public Insn(Label label, Op op) {
        this.label = label;
        this.op = op;
    }

    /**
     * Copy this instruction, without any of its exts.
     *
     * @return The copy.
     */
    public Insn copy() {
        return new Insn(label, op);
    }

    @Override
    protected ExtContainer fallback() {
        return op;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == AnalysisExts.STATE_BEFORE) {
            return (T) before;
        } else if (ext == AnalysisExts.STATE_AFTER) {
            return (T) after;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == AnalysisExts.STATE_BEFORE) {
            before = (State) value;
            return;
        } else if (ext == AnalysisExts.STATE_AFTER) {
            after = (State) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == AnalysisExts.STATE_BEFORE) {
            before = null;
            return;
        } else if (ext == AnalysisExts.STATE_AFTER) {
            after = null;
            return;
        }
        super.removeExt(ext);
    }

    @Override
    public String toString() {
        return label + ": " + op;
    }
}
