package io.github.eutro.wasmslice.core.passes.meta;

import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes {@link AnalysisExts#POST_DOM_FRONTIER} and {@link AnalysisExts#CONTROL_DEPS} for each block.
 * <p>
 * A block is control dependent on the blocks in its post-dominance frontier: the branches
 * with one edge from which it is sure to execute, and another from which it may be skipped.
 */
public class ComputeControlDeps implements InPlaceIRPass<Cfg> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeControlDeps INSTANCE = new ComputeControlDeps();

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.POST_DOMS);

        Map<Integer, Set<Integer>> frontiers = new HashMap<>();
        for (BasicBlock block : cfg.blocks()) {
            frontiers.put(block.index, new TreeSet<>());
        }
        Set<Integer> sinkPreds = ComputePostDoms.sinkPreds(cfg);
        for (BasicBlock block : cfg.blocks()) {
            Set<Integer> succs = ComputePostDoms.reversedPreds(cfg, block.index, sinkPreds);
            if (succs.size() < 2) continue;
            int ipdom = block.getExtOrThrow(AnalysisExts.IPDOM);
            for (int succ : succs) {
                int runner = succ;
                while (runner != ComputePostDoms.SINK && runner != ipdom) {
                    frontiers.get(runner).add(block.index);
                    runner = cfg.block(runner).getExtOrThrow(AnalysisExts.IPDOM);
                }
            }
        }

        for (BasicBlock block : cfg.blocks()) {
            Set<Integer> frontier = frontiers.get(block.index);
            Set<Label> deps = new TreeSet<>();
            for (int idx : frontier) {
                BasicBlock branch = cfg.block(idx);
                if (branch.kind == BasicBlock.Kind.CONTROL) {
                    deps.add(branch.getControl().label);
                }
            }
            block.attachExt(AnalysisExts.POST_DOM_FRONTIER, Collections.unmodifiableSet(frontier));
            block.attachExt(AnalysisExts.CONTROL_DEPS, Collections.unmodifiableSet(deps));
        }

        ms.validate(MetadataState.CONTROL_DEPS);
    }
}
