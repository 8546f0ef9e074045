package io.github.eutro.wasmslice.test;

import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.passes.IRPass;
import io.github.eutro.wasmslice.core.passes.meta.AnnotateStates;
import io.github.eutro.wasmslice.core.passes.meta.ComputeUseDefs;
import io.github.eutro.wasmslice.core.passes.misc.ChainedPass;
import io.github.eutro.wasmslice.core.slice.Slicer;
import io.github.eutro.wasmslice.core.state.InferenceConfig;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.util.IRUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SlicerTest {
    static Set<Label> labels(int... ids) {
        Set<Label> labels = new TreeSet<>();
        for (int id : ids) labels.add(Label.of(id));
        return labels;
    }

    static Cfg opaque(Cfg cfg) {
        return new AnnotateStates(InferenceConfig.OPAQUE).run(cfg);
    }

    @Test
    void testConstAddOpaque() {
        Cfg cfg = opaque(Programs.constAdd());
        assertEquals(labels(0, 1, 2), Slicer.instructionsToKeep(cfg, Label.of(2)));
    }

    @Test
    void testConstAddWithConstants() {
        Cfg cfg = Programs.constAdd();
        assertEquals(labels(2), Slicer.instructionsToKeep(cfg, Label.of(2)));
    }

    @Test
    void testTwoAdds() {
        Cfg cfg = Programs.twoAdds();
        assertEquals(labels(0, 1, 2), Slicer.instructionsToKeep(cfg, Label.of(2)));
        assertEquals(labels(4, 5, 6), Slicer.instructionsToKeep(cfg, Label.of(6)));
    }

    @Test
    void testBrIf() {
        Cfg cfg = Programs.brIf();
        assertEquals(labels(1, 2, 3, 4), Slicer.instructionsToKeep(cfg, Label.of(4)));
    }

    @Test
    void testIfElse() {
        Cfg cfg = Programs.ifElse();
        Set<Label> expected = labels(0, 1, 2, 3, 9, 10);
        expected.add(Label.merge(4));
        assertEquals(expected, Slicer.instructionsToKeep(cfg, Label.of(10)));
    }

    @Test
    void testCounter() {
        Cfg cfg = Programs.counter();
        SortedSet<Label> kept = Slicer.instructionsToKeep(cfg, Label.of(7));
        assertTrue(kept.contains(Label.of(4)), kept::toString);
        assertTrue(kept.contains(Label.of(6)), kept::toString);
        assertTrue(kept.contains(Label.merge(1)), kept::toString);
        assertFalse(kept.contains(Label.of(0)), kept::toString);
    }

    @Test
    void testUnknownCriterion() {
        Cfg cfg = Programs.constAdd();
        assertThrows(IllegalArgumentException.class, () -> Slicer.instructionsToKeep(cfg, Label.of(42)));
    }

    @Test
    void testMonotonic() {
        for (Cfg cfg : List.of(Programs.twoAdds(), Programs.brIf(), Programs.ifElse(), Programs.counter())) {
            for (Insn criterion : cfg.allInstructions()) {
                SortedSet<Label> kept = Slicer.instructionsToKeep(cfg, criterion.label);
                for (Label label : kept) {
                    if (label.section != Label.Section.FUNCTION) continue;
                    Set<Label> inner = Slicer.instructionsToKeep(cfg, label);
                    assertTrue(kept.containsAll(inner),
                            () -> cfg.name + ": slice of " + label + " " + inner
                                    + " not in slice of " + criterion.label + " " + kept);
                }
            }
        }
    }

    @Test
    void testShrinks() {
        for (Cfg cfg : List.of(Programs.twoAdds(), Programs.brIf(), Programs.ifElse(), Programs.counter(), Programs.chain())) {
            for (Insn criterion : cfg.allInstructions()) {
                Set<Label> kept = Slicer.instructionsToKeep(cfg, criterion.label);
                Cfg sliced = Slicer.slice(cfg, criterion.label);
                for (Insn insn : sliced.allInstructions()) {
                    if (insn.label.section == Label.Section.FUNCTION) {
                        assertTrue(kept.contains(insn.label), () -> cfg.name + ": " + insn + " not kept");
                    }
                }
                assertTrue(sliced.allInstructions().stream().anyMatch(insn -> insn.label.equals(criterion.label)));
            }
        }
    }

    @Test
    void testReanalysable() {
        for (Cfg cfg : List.of(Programs.twoAdds(), Programs.brIf(), Programs.ifElse(), Programs.counter(), Programs.chain())) {
            for (Insn criterion : cfg.allInstructions()) {
                IRPass<Cfg, Cfg> pass = Slicer.pass(criterion.label)
                        .then(AnnotateStates.INSTANCE)
                        .then(ComputeUseDefs.INSTANCE);
                assertEquals(3, ((ChainedPass<?, ?>) pass).getPasses().size());
                assertFalse(pass.isInPlace());
                Cfg sliced = assertDoesNotThrow(() -> pass.run(cfg));
                assertNotNull(sliced.getNullable(AnalysisExts.USE_DEF_CHAINS));
                assertTrue(IRUtils.countVars(sliced) <= IRUtils.countVars(cfg));
            }
        }
    }

    @Test
    void testKeepsStackHeights() {
        Cfg cfg = Programs.ifElse();
        Cfg sliced = Slicer.slice(cfg, Label.of(10));
        AnnotateStates.INSTANCE.run(sliced);
        for (Insn insn : sliced.allInstructions()) {
            if (insn.label.section != Label.Section.FUNCTION) continue;
            State before = cfg.instruction(insn.label).getExtOrThrow(AnalysisExts.STATE_BEFORE);
            State after = insn.getExtOrThrow(AnalysisExts.STATE_BEFORE);
            assertEquals(before.height(), after.height(), insn::toString);
        }
    }

    @Test
    void testPlaceholders() {
        Cfg cfg = Programs.twoAdds();
        Cfg sliced = Slicer.slice(cfg, Label.of(6));
        List<Insn> insns = sliced.block(0).getInsns();
        // the first addition and its drop have no net effect
        assertEquals(List.of(Label.of(4), Label.of(5), Label.of(6)),
                insns.stream().map(insn -> insn.label).collect(Collectors.toList()));

        sliced = Slicer.slice(cfg, Label.of(2));
        assertEquals(3, sliced.block(0).getInsns().size());

        sliced = Slicer.slice(Programs.counter(), Label.of(0));
        insns = sliced.block(0).getInsns();
        assertEquals(2, insns.size());
        // local.set consumed the constant
        Insn placeholder = insns.get(1);
        assertEquals(Label.synthetic(0), placeholder.label);
        assertSame(WasmOps.DROP, placeholder.op.key);
    }

    @Test
    void testDeletesEmptyBlocks() {
        Cfg cfg = Programs.chain();
        Cfg sliced = Slicer.slice(cfg, Label.of(3));
        assertEquals(List.of(0, 2, 3), sliced.blocks().stream()
                .map(block -> block.index)
                .collect(Collectors.toList()));
        assertEquals(List.of(2), sliced.successors(0));
        assertEquals(List.of(0), sliced.predecessors(2));

        // the value of block 0 still sits under the kept one
        Insn placeholder = sliced.block(0).getInsns().get(0);
        assertEquals(Label.synthetic(0), placeholder.label);
        assertSame(WasmOps.CONST, placeholder.op.key);
    }

    @Test
    void testKeepsControlStructure() {
        Cfg cfg = Programs.brIf();
        Cfg sliced = Slicer.slice(cfg, Label.of(4));
        assertEquals(cfg.edges(), sliced.edges());
        assertEquals(cfg.backEdges(), sliced.backEdges());
        assertEquals(BasicBlock.Kind.CONTROL, sliced.block(1).kind);
    }

    @Test
    void testDiscardedBranchKeepsStackEffect() {
        Cfg cfg = Programs.brIf();
        Cfg sliced = Slicer.slice(cfg, Label.of(1));
        // br_if is not needed, but it popped its condition
        BasicBlock replaced = sliced.block(1);
        assertEquals(BasicBlock.Kind.DATA, replaced.kind);
        assertEquals(1, replaced.getInsns().size());
        assertSame(WasmOps.DROP, replaced.getInsns().get(0).op.key);
        assertDoesNotThrow(() -> AnnotateStates.INSTANCE.run(sliced));
    }

    @Test
    void testSyntheticLabelsDoNotClash() {
        Cfg cfg = Programs.chain();
        Cfg once = Slicer.slice(cfg, Label.of(3));
        Cfg twice = Slicer.slice(once, Label.of(3));
        Set<Label> seen = new TreeSet<>();
        for (Insn insn : twice.allInstructions()) {
            assertTrue(seen.add(insn.label), insn::toString);
        }
    }

    @Test
    void testFindCallIndirect() {
        Cfg cfg = Programs.callIndirect();
        assertEquals(List.of(Label.of(2)), Slicer.findCallIndirectInstructions(cfg));
        assertEquals(List.of(), Slicer.findCallIndirectInstructions(Programs.ifElse()));

        assertEquals(labels(2), Slicer.instructionsToKeep(cfg, Label.of(2)));
        Cfg opaque = opaque(Programs.callIndirect());
        assertEquals(labels(0, 1, 2), Slicer.instructionsToKeep(opaque, Label.of(2)));
    }
}
