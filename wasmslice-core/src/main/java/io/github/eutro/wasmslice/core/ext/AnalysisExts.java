package io.github.eutro.wasmslice.core.ext;

import io.github.eutro.wasmslice.core.analysis.TransferResult;
import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.passes.meta.AnnotateStates;
import io.github.eutro.wasmslice.core.passes.meta.ComputeControlDeps;
import io.github.eutro.wasmslice.core.passes.meta.ComputePostDoms;
import io.github.eutro.wasmslice.core.passes.meta.ComputeUseDefs;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.usedef.UseDefChains;

import java.util.Set;

/**
 * A collection of {@link Ext}s holding the results of the analyses.
 */
public class AnalysisExts {
    /**
     * Attached to an {@link Insn} or a {@link BasicBlock}.
     * The symbolic state right before the instruction or block executes.
     * <p>
     * Computed by {@link AnnotateStates}.
     */
    public static final Ext<State> STATE_BEFORE = Ext.create(State.class, "STATE_BEFORE");
    /**
     * Attached to an {@link Insn} or a {@link BasicBlock}.
     * The symbolic state right after the instruction or block executes.
     * For branching instructions, this is the state on the {@code true} edge;
     * both edges always agree on the stack height.
     * <p>
     * Computed by {@link AnnotateStates}.
     */
    public static final Ext<State> STATE_AFTER = Ext.create(State.class, "STATE_AFTER");
    /**
     * Attached to a {@link BasicBlock}. The state(s) leaving the block, per edge condition.
     * <p>
     * Computed by {@link AnnotateStates}.
     */
    public static final Ext<TransferResult<State>> OUT_STATE = Ext.create(TransferResult.class, "OUT_STATE");

    /**
     * Attached to a {@link Cfg}. The use-def chains of the function.
     * <p>
     * Computed by {@link ComputeUseDefs}.
     */
    public static final Ext<UseDefChains> USE_DEF_CHAINS = Ext.create(UseDefChains.class, "USE_DEF_CHAINS");

    /**
     * Attached to a {@link BasicBlock}. The index of the immediate post-dominator of the block,
     * or {@link ComputePostDoms#SINK} if it is only post-dominated by the virtual sink.
     * <p>
     * Computed by {@link ComputePostDoms}.
     */
    public static final Ext<Integer> IPDOM = Ext.create(Integer.class, "IPDOM");
    /**
     * Attached to a {@link BasicBlock}. The indices of the blocks in the post-dominance frontier of the block.
     * <p>
     * Computed by {@link ComputeControlDeps}.
     */
    public static final Ext<Set<Integer>> POST_DOM_FRONTIER = Ext.create(Set.class, "POST_DOM_FRONTIER");
    /**
     * Attached to a {@link BasicBlock}. The labels of the branch instructions
     * that decide whether the block executes.
     * <p>
     * Computed by {@link ComputeControlDeps}.
     */
    public static final Ext<Set<Label>> CONTROL_DEPS = Ext.create(Set.class, "CONTROL_DEPS");
}
