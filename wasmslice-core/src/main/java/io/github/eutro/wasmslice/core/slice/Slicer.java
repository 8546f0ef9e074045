package io.github.eutro.wasmslice.core.slice;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.ops.Op;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.passes.IRPass;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.usedef.Def;
import io.github.eutro.wasmslice.core.usedef.Use;
import io.github.eutro.wasmslice.core.usedef.UseDefChains;
import io.github.eutro.wasmslice.core.util.GraphWalker;

import java.util.*;

/**
 * Backward slicing of an annotated {@link Cfg}.
 * <p>
 * The slice of an instruction is the set of instructions (and merge blocks) it transitively depends on,
 * through data dependences ({@link UseDefChains}) and control dependences
 * ({@link ControlDependenceOracle}). Slicing rewrites the graph to only keep those instructions,
 * while keeping its structure and the height of the operand stack at every kept instruction:
 * discarded instructions are replaced by {@link Label.Section#SYNTHETIC synthetic} {@code drop}s and
 * {@code i32.const 0}s with the same net effect on the stack.
 */
public class Slicer {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private Slicer() {
    }

    /**
     * Compute the instructions to keep in the slice of a graph, using {@link PostDominatorControlDeps}.
     *
     * @param cfg       The graph, annotated with states (annotated with defaults if it is not).
     * @param criterion The label of the instruction to slice on.
     * @return The labels of the kept instructions and merge blocks.
     * @see #instructionsToKeep(Cfg, Label, ControlDependenceOracle)
     */
    public static SortedSet<Label> instructionsToKeep(Cfg cfg, Label criterion) {
        return instructionsToKeep(cfg, criterion, new PostDominatorControlDeps(cfg));
    }

    /**
     * Compute the instructions to keep in the slice of a graph.
     * <p>
     * Starting from the criterion, every kept instruction keeps the definitions reaching its uses
     * (if they are made by an instruction or a merge block), and the branches its uses are control dependent on.
     * The uses of a kept merge block are the variables it merges.
     *
     * @param cfg       The graph, annotated with states (annotated with defaults if it is not).
     * @param criterion The label of the instruction to slice on.
     * @param oracle    The control dependences.
     * @return The labels of the kept instructions and merge blocks.
     * @throws IllegalArgumentException If the criterion is not a label of the graph.
     */
    public static SortedSet<Label> instructionsToKeep(Cfg cfg, Label criterion, ControlDependenceOracle oracle) {
        if (!cfg.hasLabel(criterion)) {
            throw new IllegalArgumentException(String.format("criterion %s is not in %s", criterion, cfg.name));
        }
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.STATES, MetadataState.USE_DEFS);
        UseDefChains chains = cfg.getExtOrThrow(AnalysisExts.USE_DEF_CHAINS);

        SortedSet<Label> slice = new TreeSet<>();
        Deque<Label> worklist = new ArrayDeque<>();
        worklist.add(criterion);
        while (!worklist.isEmpty()) {
            Label label = worklist.pop();
            if (!slice.add(label)) continue;
            for (Use use : chains.usesAt(label)) {
                Def def = chains.get(use);
                def.label().ifPresent(worklist::add);
                worklist.addAll(oracle.branchesFor(use));
            }
        }
        return slice;
    }

    /**
     * Slice a graph on an instruction, using {@link PostDominatorControlDeps}.
     *
     * @param cfg       The graph.
     * @param criterion The label of the instruction to slice on.
     * @return The sliced graph.
     * @see #slice(Cfg, Label, ControlDependenceOracle)
     */
    public static Cfg slice(Cfg cfg, Label criterion) {
        return slice(cfg, criterion, new PostDominatorControlDeps(cfg));
    }

    /**
     * Slice a graph on an instruction.
     * <p>
     * Merge blocks are kept as they are, and so are control blocks whose instruction is kept.
     * Data blocks only keep the kept instructions, each run of discarded instructions being replaced
     * with placeholders having the same net stack effect. Other control blocks are replaced by
     * a data block of placeholders.
     * <p>
     * A block left empty is deleted, splicing its incoming edges to its outgoing ones, unless it
     * is the entry or exit block, or has several predecessors. A discarded control block with a non-zero
     * net stack effect is never deleted. Finally, edges into the exit block coming from blocks no longer
     * reachable from the entry are removed.
     * <p>
     * The sliced graph has none of the annotations of the original, and can be analysed again.
     *
     * @param cfg       The graph.
     * @param criterion The label of the instruction to slice on.
     * @param oracle    The control dependences.
     * @return The sliced graph.
     */
    public static Cfg slice(Cfg cfg, Label criterion, ControlDependenceOracle oracle) {
        Set<Label> kept = instructionsToKeep(cfg, criterion, oracle);
        return new Rewrite(cfg, kept).run();
    }

    /**
     * Get a pass slicing on the given instruction.
     *
     * @param criterion The label of the instruction to slice on.
     * @return The pass.
     */
    public static IRPass<Cfg, Cfg> pass(Label criterion) {
        return cfg -> slice(cfg, criterion);
    }

    /**
     * Find every {@code call_indirect} of a graph, the usual slicing criteria.
     *
     * @param cfg The graph.
     * @return The labels of the instructions, in order.
     */
    public static List<Label> findCallIndirectInstructions(Cfg cfg) {
        List<Label> labels = new ArrayList<>();
        for (Insn insn : cfg.allInstructions()) {
            if (insn.op.key == WasmOps.CALL_INDIRECT) {
                labels.add(insn.label);
            }
        }
        return labels;
    }

    private static class Rewrite {
        final Cfg cfg;
        final Set<Label> kept;
        final EdgeMap edges;
        final EdgeMap backEdges;
        final List<BasicBlock> blocks = new ArrayList<>();
        final Set<Integer> deleted = new TreeSet<>();
        int nextSynthetic;

        Rewrite(Cfg cfg, Set<Label> kept) {
            this.cfg = cfg;
            this.kept = kept;
            this.edges = cfg.edges().copy();
            this.backEdges = cfg.backEdges().copy();
            int maxSynthetic = -1;
            for (Insn insn : cfg.allInstructions()) {
                if (insn.label.section == Label.Section.SYNTHETIC) {
                    maxSynthetic = Math.max(maxSynthetic, insn.label.id);
                }
            }
            nextSynthetic = maxSynthetic + 1;
        }

        Cfg run() {
            for (BasicBlock block : cfg.blocks()) {
                BasicBlock replacement = rewrite(block);
                if (replacement == null) {
                    delete(block.index);
                } else {
                    blocks.add(replacement);
                }
            }
            pruneExitEdges();

            Set<Integer> loopHeads = new TreeSet<>(cfg.loopHeads());
            loopHeads.removeAll(deleted);
            Cfg sliced = new Cfg(cfg.name, cfg.type, blocks, edges, backEdges, cfg.entry, cfg.exit, loopHeads);
            logger.atFine().log("slice of %s keeps %d labels, %d of %d blocks",
                    cfg.name, kept.size(), blocks.size(), cfg.blocks().size());
            return sliced;
        }

        BasicBlock rewrite(BasicBlock block) {
            boolean keepAnyway = block.index == cfg.entry
                    || block.index == cfg.exit
                    || cfg.predecessors(block.index).size() > 1;
            switch (block.kind) {
                case MERGE:
                    return block.copy();
                case CONTROL: {
                    if (kept.contains(block.getControl().label)) return block.copy();
                    int effect = netEffect(block.getExtOrThrow(AnalysisExts.STATE_BEFORE),
                            block.getExtOrThrow(AnalysisExts.STATE_AFTER));
                    if (keepAnyway || effect != 0) {
                        return BasicBlock.data(block.index, placeholders(effect));
                    }
                    return null;
                }
                default: {
                    List<Insn> insns = new ArrayList<>();
                    List<Insn> discarded = new ArrayList<>();
                    for (Insn insn : block.getInsns()) {
                        if (kept.contains(insn.label)) {
                            insns.addAll(placeholders(runEffect(discarded)));
                            discarded.clear();
                            insns.add(insn.copy());
                        } else {
                            discarded.add(insn);
                        }
                    }
                    insns.addAll(placeholders(runEffect(discarded)));
                    if (keepAnyway || !insns.isEmpty()) {
                        return BasicBlock.data(block.index, insns);
                    }
                    return null;
                }
            }
        }

        int runEffect(List<Insn> run) {
            if (run.isEmpty()) return 0;
            return netEffect(run.get(0).getExtOrThrow(AnalysisExts.STATE_BEFORE),
                    run.get(run.size() - 1).getExtOrThrow(AnalysisExts.STATE_AFTER));
        }

        int netEffect(State before, State after) {
            if (before.isBottom() || after.isBottom()) return 0;
            return after.height() - before.height();
        }

        List<Insn> placeholders(int effect) {
            Op op = effect < 0 ? WasmOps.DROP.create() : WasmOps.i32Const(0);
            List<Insn> insns = new ArrayList<>(Math.abs(effect));
            for (int i = 0; i < Math.abs(effect); i++) {
                insns.add(op.insn(Label.synthetic(nextSynthetic++)));
            }
            return insns;
        }

        void delete(int idx) {
            deleted.add(idx);
            List<Edge> incoming = new ArrayList<>(backEdges.from(idx));
            List<Edge> outgoing = new ArrayList<>(edges.from(idx));

            edges.removeFrom(idx);
            for (Edge in : incoming) {
                edges.remove(in.target, idx);
            }
            backEdges.removeFrom(idx);
            for (Edge out : outgoing) {
                backEdges.remove(out.target, idx);
            }

            for (Edge in : incoming) {
                for (Edge out : outgoing) {
                    if (in.target == idx || out.target == idx || in.target == out.target) continue;
                    // the incoming condition still decides whether the target is reached
                    edges.add(in.target, new Edge(out.target, in.condition));
                    backEdges.add(out.target, new Edge(in.target, in.condition));
                }
            }
        }

        void pruneExitEdges() {
            Set<Integer> reachable = new HashSet<>();
            if (!deleted.contains(cfg.entry)) {
                for (int idx : new GraphWalker<Integer>(cfg.entry, n -> successors(n)).preOrder()) {
                    reachable.add(idx);
                }
            }
            for (Edge in : new ArrayList<>(backEdges.from(cfg.exit))) {
                if (deleted.contains(in.target) || !reachable.contains(in.target)) {
                    edges.remove(in.target, cfg.exit);
                    backEdges.remove(cfg.exit, in.target);
                }
            }
        }

        List<Integer> successors(int idx) {
            List<Integer> succs = new ArrayList<>();
            for (Edge e : edges.from(idx)) succs.add(e.target);
            return succs;
        }
    }
}
