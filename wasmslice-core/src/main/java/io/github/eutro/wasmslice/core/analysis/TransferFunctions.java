package io.github.eutro.wasmslice.core.analysis;

import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Insn;

import java.util.List;

/**
 * The abstract semantics of an intraprocedural analysis, as driven by {@link IntraAnalysis}.
 * <p>
 * Implementations must be pure: the same arguments always give equal results.
 * The driver relies on this to detect that it reached a fixpoint.
 *
 * @param <S> The type of abstract states.
 */
public interface TransferFunctions<S> {
    /**
     * Get the state at the start of the entry block.
     *
     * @param cfg The analysed function.
     * @return The initial state.
     */
    S initState(Cfg cfg);

    /**
     * Get the state of program points that have not been reached yet.
     * The driver recognises it by identity.
     *
     * @return The bottom state.
     */
    S bottomState();

    /**
     * Compute the state after a data instruction.
     *
     * @param cfg   The analysed function.
     * @param insn  The instruction.
     * @param state The state before the instruction.
     * @return The state after the instruction.
     */
    S transferData(Cfg cfg, Insn insn, S state);

    /**
     * Compute the state(s) after a control instruction.
     *
     * @param cfg   The analysed function.
     * @param insn  The instruction.
     * @param state The state before the instruction.
     * @return The state(s) after the instruction.
     */
    TransferResult<S> transferControl(Cfg cfg, Insn insn, S state);

    /**
     * Compute the state at the start of a block, from the states arriving along each incoming edge.
     *
     * @param cfg        The analysed function.
     * @param block      The block.
     * @param predStates The state on each incoming edge, in edge order, {@link #bottomState() bottom}
     *                   for predecessors that have not been reached yet. For the entry block,
     *                   the {@link #initState(Cfg) initial state} comes first.
     * @return The state at the start of the block.
     */
    S merge(Cfg cfg, BasicBlock block, List<S> predStates);

    /**
     * Combine the state previously computed at a program point with a newly computed one.
     *
     * @param old  The previous state.
     * @param next The new state.
     * @return The combined state.
     */
    S join(S old, S next);

    /**
     * Like {@link #join(Object, Object)}, but applied at loop heads, where the driver
     * needs the sequence of states to stabilise.
     *
     * @param old  The previous state.
     * @param next The new state.
     * @return The combined state.
     */
    S widen(S old, S next);
}
