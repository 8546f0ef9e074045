package io.github.eutro.wasmslice.core.passes.meta;

import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.passes.InPlaceIRPass;
import io.github.eutro.wasmslice.core.util.GraphWalker;

import java.util.*;

/**
 * Computes {@link AnalysisExts#IPDOM} for each block.
 * <p>
 * Post-dominators are the dominators of the reversed graph, rooted at a virtual sink
 * that every way out of the function leads to: the exit block, and every block without successors.
 * Blocks from which the sink cannot be reached are only post-dominated by the sink.
 */
public class ComputePostDoms implements InPlaceIRPass<Cfg> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    /**
     * The index standing for the virtual sink.
     */
    public static final int SINK = -1;

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);

        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        Set<Integer> sinkPreds = sinkPreds(cfg);
        List<Integer> post = new GraphWalker<Integer>(SINK, n -> n == SINK
                ? sinkPreds
                : new LinkedHashSet<>(cfg.predecessors(n)))
                .postOrder()
                .toList();
        Map<Integer, Integer> po = new HashMap<>();
        for (int n : post) {
            po.put(n, po.size());
        }
        List<Integer> rpo = new ArrayList<>(post);
        Collections.reverse(rpo);

        Map<Integer, Integer> ipdom = new HashMap<>();
        ipdom.put(SINK, SINK);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b : rpo) {
                if (b == SINK) continue;
                Integer newIpdom = null;
                for (int p : reversedPreds(cfg, b, sinkPreds)) {
                    if (!ipdom.containsKey(p)) continue;
                    newIpdom = newIpdom == null ? p : intersect(p, newIpdom, ipdom, po);
                }
                if (!Objects.equals(ipdom.get(b), newIpdom)) {
                    ipdom.put(b, newIpdom);
                    changed = true;
                }
            }
        }

        for (BasicBlock block : cfg.blocks()) {
            Integer pd = ipdom.get(block.index);
            block.attachExt(AnalysisExts.IPDOM, pd == null ? SINK : pd);
        }

        ms.validate(MetadataState.POST_DOMS);
    }

    private static int intersect(int b1, int b2, Map<Integer, Integer> ipdom, Map<Integer, Integer> po) {
        while (b1 != b2) {
            while (po.get(b1) < po.get(b2)) b1 = ipdom.get(b1);
            while (po.get(b2) < po.get(b1)) b2 = ipdom.get(b2);
        }
        return b1;
    }

    /**
     * Get the blocks that lead straight to the virtual sink.
     *
     * @param cfg The graph.
     * @return The exit block, and every block without successors.
     */
    static Set<Integer> sinkPreds(Cfg cfg) {
        Set<Integer> preds = new LinkedHashSet<>();
        preds.add(cfg.exit);
        for (BasicBlock block : cfg.blocks()) {
            if (cfg.successors(block.index).isEmpty()) preds.add(block.index);
        }
        return preds;
    }

    /**
     * Get the predecessors of a block in the reversed graph: its distinct successors,
     * and the sink if it leads straight there.
     */
    static Set<Integer> reversedPreds(Cfg cfg, int block, Set<Integer> sinkPreds) {
        Set<Integer> preds = new LinkedHashSet<>(cfg.successors(block));
        if (sinkPreds.contains(block)) preds.add(SINK);
        return preds;
    }
}
