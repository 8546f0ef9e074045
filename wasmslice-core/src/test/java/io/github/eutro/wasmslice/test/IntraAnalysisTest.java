package io.github.eutro.wasmslice.test;

import io.github.eutro.wasmslice.core.analysis.AnalysisException;
import io.github.eutro.wasmslice.core.analysis.AnalysisResult;
import io.github.eutro.wasmslice.core.analysis.IntraAnalysis;
import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.state.PrimValue;
import io.github.eutro.wasmslice.core.state.StateInference;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.state.Var;
import io.github.eutro.wasmslice.core.usedef.Def;
import io.github.eutro.wasmslice.core.usedef.Use;
import io.github.eutro.wasmslice.core.usedef.UseDefChains;
import io.github.eutro.wasmslice.core.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IntraAnalysisTest {
    @Test
    void testReversePostOrder() {
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), GraphWalker.reversePostOrder(Programs.ifElse()));
        // the skipped block comes before the merge block
        assertEquals(List.of(0, 1, 2, 3), GraphWalker.reversePostOrder(Programs.brIf()));
        assertEquals(List.of(0, 1, 2, 3, 4, 5), GraphWalker.reversePostOrder(Programs.counter()));
    }

    @Test
    void testStraightLine() {
        Cfg cfg = Programs.twoAdds();
        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference()).analyze(cfg);
        assertEquals(List.of(Var.stack(Label.of(6))), result.after(Label.of(6)).vstack());
        assertEquals(List.of(Var.RESULT), result.blockAfter(1).vstack());
        assertEquals(result.after(Label.of(6)), result.blockBefore(1));
        assertEquals(2, result.visits());
    }

    @Test
    void testLoopFixpoint() {
        Cfg cfg = Programs.counter();
        IntraAnalysis<State> analysis = new IntraAnalysis<>(new StateInference());
        AnalysisResult<State> result = analysis.analyze(cfg);

        Var merged = Var.merge(1, 0);
        Var incremented = Var.stack(Label.of(4));
        assertEquals(List.of(merged), result.blockAfter(1).locals());
        assertEquals(List.of(merged), result.after(Label.of(2)).vstack());
        assertEquals(List.of(incremented), result.after(Label.of(5)).locals());
        assertEquals(List.of(Var.RESULT), result.blockAfter(5).vstack());

        AnalysisResult<State> again = analysis.analyze(cfg);
        for (Insn insn : cfg.allInstructions()) {
            assertEquals(result.before(insn.label), again.before(insn.label));
            assertEquals(result.after(insn.label), again.after(insn.label));
        }
        assertEquals(result.visits(), again.visits());
    }

    @Test
    void testLoopAtEntry() {
        Cfg cfg = Programs.entryLoop();
        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference()).analyze(cfg);

        Var zero = Var.constant(PrimValue.i32(0));
        Var size = Var.stack(Label.of(0));
        Var merged = Var.merge(0, 0);
        // the entry values and the back edge disagree on the local
        assertEquals(List.of(zero), result.blockBefore(0).locals());
        assertEquals(List.of(merged), result.blockAfter(0).locals());
        assertEquals(List.of(merged), result.before(Label.of(0)).locals());
        assertEquals(List.of(size), result.blockOut(2).onEdge(true).locals());
        assertEquals(List.of(Var.RESULT), result.blockAfter(4).vstack());

        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        assertDoesNotThrow(() -> ms.ensureValid(cfg, MetadataState.USE_DEFS));
        UseDefChains chains = cfg.getExtOrThrow(AnalysisExts.USE_DEF_CHAINS);
        assertEquals(Def.merge(0, merged), chains.defs().get(merged));
        assertEquals(Def.constant((Var.Constant) zero), chains.get(Use.merge(0, zero)));
        assertEquals(Def.instruction(Label.of(0), size), chains.get(Use.merge(0, size)));
    }

    @Test
    void testEntryWithBackEdgeMustMerge() {
        CfgBuilder cb = new CfgBuilder("entryNotMerge", FuncType.of());
        int b0 = cb.data(WasmOps.NOP.create());
        int b1 = cb.data(WasmOps.NOP.create());
        cb.edge(b0, b1)
                .edge(b1, b0);
        Cfg cfg = cb.build();
        AnalysisException e = assertThrows(AnalysisException.class,
                () -> new IntraAnalysis<>(new StateInference()).analyze(cfg));
        assertTrue(e.getMessage().contains("not a merge block"), e::getMessage);
    }

    @Test
    void testUnreachedBackEdge() {
        Cfg cfg = Programs.deadBackEdge();
        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference()).analyze(cfg);

        assertTrue(result.blockAfter(3).isBottom());
        // the single reached predecessor passes through unchanged
        assertSame(result.blockAfter(0), result.blockAfter(1));
        for (Var var : result.blockAfter(1).vars()) {
            assertFalse(var instanceof Var.MergeVar, var::toString);
        }
        assertEquals(List.of(Var.stack(Label.of(0))), result.before(Label.of(1)).vstack());
        assertEquals(List.of(Var.RESULT), result.blockAfter(4).vstack());
    }

    @Test
    void testVisitCap() {
        Cfg cfg = Programs.counter();
        assertThrows(AnalysisException.class, () -> new IntraAnalysis<>(new StateInference(), 1).analyze(cfg));
        assertThrows(IllegalArgumentException.class, () -> new IntraAnalysis<>(new StateInference(), 0));
    }

    @Test
    void testUnreachableStaysBottom() {
        CfgBuilder cb = new CfgBuilder("unreachable", FuncType.of());
        int b0 = cb.data(WasmOps.NOP.create());
        int b1 = cb.data(WasmOps.MEMORY_SIZE.create());
        int b2 = cb.merge();
        cb.edge(b0, b2)
                .edge(b1, b2);
        Cfg cfg = cb.build();

        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference()).analyze(cfg);
        assertTrue(result.before(Label.of(1)).isBottom());
        assertTrue(result.blockAfter(b1).isBottom());
        assertFalse(result.blockAfter(b2).isBottom());
        assertEquals(List.of(), result.blockAfter(b2).vstack());
    }

    @Test
    void testBranchStates() {
        Cfg cfg = Programs.brIf();
        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference()).analyze(cfg);
        assertEquals(List.of(Var.stack(Label.of(1))), result.before(Label.of(2)).vstack());
        assertEquals(List.of(), result.blockOut(1).onEdge(false).vstack());
        assertEquals(List.of(), result.blockBefore(2).vstack());
        assertEquals(List.of(), result.blockAfter(3).vstack());
    }

    @Test
    void testNonMergeJoinIsFatal() {
        CfgBuilder cb = new CfgBuilder("badJoin", FuncType.of());
        int b0 = cb.control(WasmOps.BR_IF.create(0));
        int b1 = cb.data(WasmOps.NOP.create());
        cb.edge(b0, b1, true)
                .edge(b0, b1, false);
        Cfg cfg = cb.build();
        // br_if underflows first
        assertThrows(AnalysisException.class, () -> new IntraAnalysis<>(new StateInference()).analyze(cfg));

        cb = new CfgBuilder("badJoin2", FuncType.of());
        int c0 = cb.data(WasmOps.MEMORY_SIZE.create());
        int c1 = cb.control(WasmOps.BR_IF.create(0));
        int c2 = cb.data(WasmOps.NOP.create());
        cb.edge(c0, c1)
                .edge(c1, c2, true)
                .edge(c1, c2, false);
        Cfg cfg2 = cb.build();
        AnalysisException e = assertThrows(AnalysisException.class,
                () -> new IntraAnalysis<>(new StateInference()).analyze(cfg2));
        assertTrue(e.getMessage().contains("not a merge block"), e::getMessage);
    }
}
