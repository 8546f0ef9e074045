package io.github.eutro.wasmslice.core.util;

import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.ExtContainer;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.state.Var;

import java.util.HashSet;
import java.util.Set;

/**
 * A set of utilities for working with annotated control-flow graphs.
 */
public class IRUtils {
    /**
     * Count the distinct variables appearing in the state annotations of a graph,
     * annotating it first if needed.
     * <p>
     * This is a measure of the size of a function, to compare it with its slices.
     *
     * @param cfg The graph.
     * @return The number of variables.
     */
    public static int countVars(Cfg cfg) {
        cfg.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(cfg, MetadataState.STATES);
        Set<Var> vars = new HashSet<>();
        for (BasicBlock block : cfg.blocks()) {
            collectVars(block, vars);
            for (Insn insn : block.getInsns()) {
                collectVars(insn, vars);
            }
        }
        return vars.size();
    }

    private static void collectVars(ExtContainer annotated, Set<Var> vars) {
        for (State state : new State[]{
                annotated.getNullable(AnalysisExts.STATE_BEFORE),
                annotated.getNullable(AnalysisExts.STATE_AFTER),
        }) {
            if (state != null && !state.isBottom()) {
                vars.addAll(state.vars());
            }
        }
    }
}
