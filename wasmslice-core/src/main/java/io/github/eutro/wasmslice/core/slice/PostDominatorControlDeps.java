package io.github.eutro.wasmslice.core.slice;

import io.github.eutro.wasmslice.core.analysis.TransferResult;
import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Edge;
import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.passes.meta.ComputeControlDeps;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.usedef.Use;

import java.util.*;

/**
 * A {@link ControlDependenceOracle} built on the post-dominance frontiers of {@link ComputeControlDeps}.
 * <p>
 * A use at an instruction depends on the branches in the frontier of the instruction's block.
 * A use at a merge block depends on whatever decides that the edge bringing the used variable is taken:
 * for each predecessor whose outgoing state holds the variable, the branches in its frontier, and the
 * predecessor's own instruction if it is a branch.
 */
public class PostDominatorControlDeps implements ControlDependenceOracle {
    private final Cfg cfg;

    /**
     * Create the oracle for an annotated graph, computing control dependences if needed.
     *
     * @param cfg The graph.
     */
    public PostDominatorControlDeps(Cfg cfg) {
        this.cfg = cfg;
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.STATES, MetadataState.CONTROL_DEPS);
    }

    @Override
    public Set<Label> branchesFor(Use use) {
        if (use instanceof Use.Instruction) {
            return cfg.blockOf(use.label()).getExtOrThrow(AnalysisExts.CONTROL_DEPS);
        }
        int block = ((Use.Merge) use).block;
        List<Edge> incoming = cfg.backEdges().from(block);
        Set<Label> branches = new TreeSet<>();
        boolean found = false;
        for (Edge edge : incoming) {
            TransferResult<State> out = cfg.block(edge.target).getExtOrThrow(AnalysisExts.OUT_STATE);
            State state = out.onEdge(edge.condition);
            if (!state.isBottom() && state.vars().contains(use.var)) {
                found = true;
                addDeciders(edge.target, branches);
            }
        }
        if (!found) {
            for (Edge edge : incoming) {
                addDeciders(edge.target, branches);
            }
        }
        return branches;
    }

    private void addDeciders(int pred, Set<Label> branches) {
        BasicBlock block = cfg.block(pred);
        branches.addAll(block.getExtOrThrow(AnalysisExts.CONTROL_DEPS));
        if (block.isBranch()) {
            branches.add(block.getControl().label);
        }
    }
}
