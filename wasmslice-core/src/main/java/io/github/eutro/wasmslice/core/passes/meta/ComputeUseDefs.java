package io.github.eutro.wasmslice.core.passes.meta;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.analysis.TransferResult;
import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Edge;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.passes.InPlaceIRPass;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.state.Var;
import io.github.eutro.wasmslice.core.usedef.Def;
import io.github.eutro.wasmslice.core.usedef.InsnUseDefs;
import io.github.eutro.wasmslice.core.usedef.Use;
import io.github.eutro.wasmslice.core.usedef.UseDefChains;

import java.util.*;

/**
 * Computes {@link AnalysisExts#USE_DEF_CHAINS} for a graph, from its state annotations.
 * <p>
 * Definitions come from four places:
 * <ul>
 *     <li>the entry state, whose locals and globals are defined at {@link Def.Entry entry};</li>
 *     <li>constants, each defined once by a {@link Def.Constant};</li>
 *     <li>merge blocks, which define each variable they introduce, and use the variable
 *     it replaces on each incoming edge;</li>
 *     <li>instructions, which define the variables named after them.</li>
 * </ul>
 * Blocks that were never reached are skipped.
 */
public class ComputeUseDefs implements InPlaceIRPass<Cfg> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUseDefs INSTANCE = new ComputeUseDefs();

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.STATES);

        UseDefChains.Builder ud = UseDefChains.builder();

        State entry = cfg.block(cfg.entry).getExtOrThrow(AnalysisExts.STATE_BEFORE);
        for (Var var : entry.vars()) {
            if (!(var instanceof Var.Constant)) {
                ud.define(Def.entry(var));
            }
        }
        for (BasicBlock block : cfg.blocks()) {
            for (State state : annotations(block)) {
                for (Var var : state.vars()) {
                    if (var instanceof Var.Constant && !ud.isDefined(var)) {
                        ud.define(Def.constant((Var.Constant) var));
                    }
                }
            }
        }

        for (BasicBlock block : cfg.allMergeBlocks()) {
            State after = block.getExtOrThrow(AnalysisExts.STATE_AFTER);
            if (after.isBottom()) continue;
            Set<Var> defined = new HashSet<>();
            List<State> incomings = new ArrayList<>();
            if (block.index == cfg.entry) {
                // the entry state arrives as if along one more edge
                incomings.add(entry);
            }
            for (Edge edge : cfg.backEdges().from(block.index)) {
                TransferResult<State> out = cfg.block(edge.target).getExtOrThrow(AnalysisExts.OUT_STATE);
                incomings.add(out.onEdge(edge.condition));
            }
            for (State incoming : incomings) {
                if (incoming.isBottom()) continue;
                for (Renaming renaming : changedVars(incoming, after)) {
                    if (defined.add(renaming.merged)) {
                        ud.define(Def.merge(block.index, renaming.merged));
                    }
                    ud.use(Use.merge(block.index, renaming.incoming));
                }
            }
        }

        for (BasicBlock block : cfg.blocks()) {
            for (Insn insn : block.getInsns()) {
                State before = insn.getExtOrThrow(AnalysisExts.STATE_BEFORE);
                State after = insn.getExtOrThrow(AnalysisExts.STATE_AFTER);
                if (before.isBottom()) continue;
                for (Var var : InsnUseDefs.uses(insn, before)) {
                    ud.use(Use.instruction(insn.label, var));
                }
                for (Var var : InsnUseDefs.defs(insn, before, after)) {
                    ud.define(Def.instruction(insn.label, var));
                }
            }
        }

        UseDefChains chains = ud.build();
        logger.atFine().log("%s: %d definitions, %d uses", cfg.name, chains.defs().size(), chains.entries().size());
        cfg.attachExt(AnalysisExts.USE_DEF_CHAINS, chains);
        ms.validate(MetadataState.USE_DEFS);
    }

    private static List<State> annotations(BasicBlock block) {
        List<State> states = new ArrayList<>();
        states.add(block.getExtOrThrow(AnalysisExts.STATE_BEFORE));
        states.add(block.getExtOrThrow(AnalysisExts.STATE_AFTER));
        for (Insn insn : block.getInsns()) {
            states.add(insn.getExtOrThrow(AnalysisExts.STATE_BEFORE));
            states.add(insn.getExtOrThrow(AnalysisExts.STATE_AFTER));
        }
        return states;
    }

    /**
     * Compare the state arriving at a merge block with the state after the merge, position by position.
     * <p>
     * Stacks of different heights are compared on their common top.
     * Memory cells are compared for the keys present in both states.
     *
     * @param incoming The state arriving along one edge.
     * @param merged   The state after the merge block.
     * @return The renamings of every position where they differ.
     */
    public static List<Renaming> changedVars(State incoming, State merged) {
        List<Renaming> changes = new ArrayList<>();
        int height = Math.min(incoming.height(), merged.height());
        diff(incoming.vstack().subList(0, height), merged.vstack().subList(0, height), changes);
        diff(incoming.locals(), merged.locals(), changes);
        diff(incoming.globals(), merged.globals(), changes);
        for (Map.Entry<Var.MemoryCell, Var> entry : merged.memory().entrySet()) {
            Var old = incoming.memory().get(entry.getKey());
            if (old != null && !old.equals(entry.getValue())) {
                changes.add(new Renaming(old, entry.getValue()));
            }
        }
        return changes;
    }

    private static void diff(List<Var> olds, List<Var> news, List<Renaming> changes) {
        int n = Math.min(olds.size(), news.size());
        for (int i = 0; i < n; i++) {
            if (!olds.get(i).equals(news.get(i))) {
                changes.add(new Renaming(olds.get(i), news.get(i)));
            }
        }
    }

    /**
     * A variable arriving at a merge block, replaced by a variable of the merge.
     */
    public static final class Renaming {
        /**
         * The variable in the arriving state.
         */
        public final Var incoming;
        /**
         * The variable after the merge.
         */
        public final Var merged;

        Renaming(Var incoming, Var merged) {
            this.incoming = incoming;
            this.merged = merged;
        }

        @Override
        public String toString() {
            return incoming + " -> " + merged;
        }
    }
}
