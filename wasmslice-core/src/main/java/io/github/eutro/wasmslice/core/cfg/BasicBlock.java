package io.github.eutro.wasmslice.core.cfg;

import io.github.eutro.wasmslice.core.ext.ExtHolder;
import io.github.eutro.wasmslice.core.ops.WasmOps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block of a {@link Cfg}.
 * <p>
 * A block is one of:
 * <ul>
 *     <li>a {@link Kind#DATA data} block, a straight-line list of data instructions, possibly empty;</li>
 *     <li>a {@link Kind#CONTROL control} block, exactly one control instruction;</li>
 *     <li>a {@link Kind#MERGE merge} block, no instructions, where control flow joins.</li>
 * </ul>
 */
public final class BasicBlock extends ExtHolder {
    public enum Kind {
        DATA,
        CONTROL,
        MERGE,
    }

    /**
     * The index of this block in its graph.
     */
    public final int index;
    /**
     * The kind of this block.
     */
    public final Kind kind;
    private final List<Insn> insns;

    private BasicBlock(int index, Kind kind, List<Insn> insns) {
        this.index = index;
        this.kind = kind;
        this.insns = Collections.unmodifiableList(new ArrayList<>(insns));
    }

    public static BasicBlock data(int index, List<Insn> insns) {
        for (Insn insn : insns) {
            if (WasmOps.isControl(insn.op)) {
                throw new IllegalArgumentException(String.format("control instruction %s in data block %d", insn, index));
            }
        }
        return new BasicBlock(index, Kind.DATA, insns);
    }

    public static BasicBlock control(int index, Insn insn) {
        if (!WasmOps.isControl(insn.op)) {
            throw new IllegalArgumentException(String.format("data instruction %s in control block %d", insn, index));
        }
        return new BasicBlock(index, Kind.CONTROL, List.of(insn));
    }

    public static BasicBlock merge(int index) {
        return new BasicBlock(index, Kind.MERGE, List.of());
    }

    /**
     * Get the instructions of this block.
     *
     * @return An unmodifiable list of the instructions.
     */
    public List<Insn> getInsns() {
        return insns;
    }

    /**
     * Get the instruction of this control block.
     *
     * @return The instruction.
     * @throws IllegalStateException If this is not a control block.
     */
    public Insn getControl() {
        if (kind != Kind.CONTROL) throw new IllegalStateException("block " + index + " is not a control block");
        return insns.get(0);
    }

    public boolean isMerge() {
        return kind == Kind.MERGE;
    }

    /**
     * Get whether this is a control block whose instruction branches.
     *
     * @return Whether this block ends in a branch.
     */
    public boolean isBranch() {
        return kind == Kind.CONTROL && WasmOps.isBranch(insns.get(0).op);
    }

    /**
     * Get the label identifying this merge block in use-def chains and slices.
     *
     * @return The merge label.
     */
    public Label mergeLabel() {
        return Label.merge(index);
    }

    /**
     * Copy this block, with fresh copies of its instructions and none of its exts.
     *
     * @return The copy.
     */
    public BasicBlock copy() {
        List<Insn> copies = new ArrayList<>(insns.size());
        for (Insn insn : insns) {
            copies.add(insn.copy());
        }
        return new BasicBlock(index, kind, copies);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("block ").append(index).append(" (").append(kind.name().toLowerCase()).append(")");
        for (Insn insn : insns) {
            sb.append("\n ").append(insn);
        }
        return sb.toString();
    }
}
