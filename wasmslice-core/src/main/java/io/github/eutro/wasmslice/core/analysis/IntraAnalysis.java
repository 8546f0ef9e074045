package io.github.eutro.wasmslice.core.analysis;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.util.GraphWalker;

import java.util.*;

/**
 * A sequential worklist fixpoint driver for {@link TransferFunctions}.
 * <p>
 * Blocks reachable from the entry are visited in reverse post-order, followed by the
 * unreachable ones by index. Whenever the states leaving a block change, its successors are
 * queued again, and the queue is always drained in that same order. Since the symbolic-state
 * joins keep the most recent state, the fixpoint reached on a loop depends on this order.
 * <p>
 * A block none of whose predecessors has been reached keeps {@link TransferFunctions#bottomState() bottom}
 * states and is not transferred through. The entry block starts from
 * {@link TransferFunctions#initState(Cfg) the initial state}. If it also has predecessors, as when
 * the function body starts with a loop, the initial state is merged with theirs, as if it arrived
 * along one more edge.
 *
 * @param <S> The type of states.
 * @see io.github.eutro.wasmslice.core.state.StateInference
 */
public class IntraAnalysis<S> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * How many times a single block may be visited before the analysis is deemed not to terminate.
     */
    public static final int DEFAULT_MAX_VISITS = 1000;

    private final TransferFunctions<S> tf;
    private final int maxVisits;

    public IntraAnalysis(TransferFunctions<S> tf) {
        this(tf, DEFAULT_MAX_VISITS);
    }

    public IntraAnalysis(TransferFunctions<S> tf, int maxVisits) {
        if (maxVisits <= 0) throw new IllegalArgumentException("maxVisits must be positive: " + maxVisits);
        this.tf = tf;
        this.maxVisits = maxVisits;
    }

    /**
     * Run the analysis to a fixpoint.
     *
     * @param cfg The function to analyse.
     * @return The states at every program point.
     * @throws AnalysisException If the transfer functions reject the function,
     *                           or some block is visited more than the allowed number of times.
     */
    public AnalysisResult<S> analyze(Cfg cfg) {
        return new Run(cfg).run();
    }

    private class Run {
        final Cfg cfg;
        final S bottom = tf.bottomState();
        final Map<Integer, Integer> order = new HashMap<>();
        final Map<Label, S> insnBefore = new HashMap<>();
        final Map<Label, S> insnAfter = new HashMap<>();
        final Map<Integer, S> blockBefore = new HashMap<>();
        final Map<Integer, S> blockAfter = new HashMap<>();
        final Map<Integer, S> blockIn = new HashMap<>();
        final Map<Integer, TransferResult<S>> blockOut = new HashMap<>();
        final Map<Integer, Integer> visitCounts = new HashMap<>();
        final TreeSet<Integer> worklist;

        Run(Cfg cfg) {
            this.cfg = cfg;
            List<Integer> rpo = GraphWalker.reversePostOrder(cfg);
            for (int idx : rpo) {
                order.put(idx, order.size());
            }
            for (BasicBlock block : cfg.blocks()) {
                order.putIfAbsent(block.index, order.size());
            }
            worklist = new TreeSet<>(Comparator.comparing(order::get));
        }

        AnalysisResult<S> run() {
            for (BasicBlock block : cfg.blocks()) {
                annotateBottom(block);
                worklist.add(block.index);
            }
            int visits = 0;
            while (!worklist.isEmpty()) {
                int idx = worklist.pollFirst();
                visits++;
                int count = visitCounts.merge(idx, 1, Integer::sum);
                if (count > maxVisits) {
                    throw AnalysisException.format("no fixpoint for %s: block %d visited %d times", cfg.name, idx, count);
                }
                visit(cfg.block(idx));
            }
            logger.atFine().log("analysed %s: %d blocks, %d visits", cfg.name, cfg.blocks().size(), visits);
            return new AnalysisResult<>(insnBefore, insnAfter, blockBefore, blockAfter, blockOut, visits);
        }

        boolean isLoopHead(int idx) {
            if (cfg.loopHeads().contains(idx)) return true;
            int own = order.get(idx);
            for (int pred : cfg.predecessors(idx)) {
                if (order.get(pred) >= own) return true;
            }
            return false;
        }

        void visit(BasicBlock block) {
            int idx = block.index;
            List<S> predStates = new ArrayList<>();
            for (Edge edge : cfg.backEdges().from(idx)) {
                TransferResult<S> out = blockOut.get(edge.target);
                predStates.add(out == null ? bottom : out.onEdge(edge.condition));
            }

            S init = null;
            if (idx == cfg.entry) {
                init = tf.initState(cfg);
                predStates.add(0, init);
            }

            S in;
            if (predStates.stream().allMatch(s -> s == bottom)) {
                logger.atFinest().log("block %d of %s not reached yet", idx, cfg.name);
                return;
            } else if (init != null && predStates.size() == 1) {
                in = init;
            } else {
                in = tf.merge(cfg, block, predStates);
            }
            S old = blockIn.get(idx);
            if (old != null) {
                in = isLoopHead(idx) ? tf.widen(old, in) : tf.join(old, in);
            }
            blockIn.put(idx, in);

            TransferResult<S> out;
            switch (block.kind) {
                case MERGE: {
                    S before = bottom;
                    for (S s : predStates) {
                        if (s != bottom) before = before == bottom ? s : tf.join(before, s);
                    }
                    blockBefore.put(idx, init != null ? init : before == bottom ? in : before);
                    blockAfter.put(idx, in);
                    out = TransferResult.simple(in);
                    break;
                }
                case CONTROL: {
                    Insn insn = block.getControl();
                    out = tf.transferControl(cfg, insn, in);
                    insnBefore.put(insn.label, in);
                    insnAfter.put(insn.label, out.primary());
                    blockBefore.put(idx, in);
                    blockAfter.put(idx, out.primary());
                    break;
                }
                default: {
                    S s = in;
                    for (Insn insn : block.getInsns()) {
                        insnBefore.put(insn.label, s);
                        s = tf.transferData(cfg, insn, s);
                        insnAfter.put(insn.label, s);
                    }
                    blockBefore.put(idx, in);
                    blockAfter.put(idx, s);
                    out = TransferResult.simple(s);
                    break;
                }
            }

            TransferResult<S> oldOut = blockOut.put(idx, out);
            if (!out.equals(oldOut)) {
                logger.atFinest().log("block %d of %s changed: %s", idx, cfg.name, out);
                worklist.addAll(cfg.successors(idx));
            }
        }

        void annotateBottom(BasicBlock block) {
            for (Insn insn : block.getInsns()) {
                insnBefore.put(insn.label, bottom);
                insnAfter.put(insn.label, bottom);
            }
            blockBefore.put(block.index, bottom);
            blockAfter.put(block.index, bottom);
            blockOut.put(block.index, TransferResult.simple(bottom));
        }
    }
}
