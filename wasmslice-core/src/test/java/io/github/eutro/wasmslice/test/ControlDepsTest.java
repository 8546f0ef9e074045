package io.github.eutro.wasmslice.test;

import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.passes.meta.ComputeControlDeps;
import io.github.eutro.wasmslice.core.passes.meta.ComputePostDoms;
import io.github.eutro.wasmslice.core.slice.PostDominatorControlDeps;
import io.github.eutro.wasmslice.core.state.Var;
import io.github.eutro.wasmslice.core.usedef.Use;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ControlDepsTest {
    static Cfg controlDeps(Cfg cfg) {
        return ComputeControlDeps.INSTANCE.run(cfg);
    }

    static int ipdom(Cfg cfg, int block) {
        return cfg.block(block).getExtOrThrow(AnalysisExts.IPDOM);
    }

    static Set<Label> deps(Cfg cfg, int block) {
        return cfg.block(block).getExtOrThrow(AnalysisExts.CONTROL_DEPS);
    }

    @Test
    void testBrIf() {
        Cfg cfg = controlDeps(Programs.brIf());
        assertEquals(1, ipdom(cfg, 0));
        assertEquals(3, ipdom(cfg, 1));
        assertEquals(3, ipdom(cfg, 2));
        assertEquals(ComputePostDoms.SINK, ipdom(cfg, 3));

        assertEquals(Set.of(1), cfg.block(2).getExtOrThrow(AnalysisExts.POST_DOM_FRONTIER));
        assertEquals(Set.of(Label.of(2)), deps(cfg, 2));
        assertEquals(Set.of(), deps(cfg, 0));
        assertEquals(Set.of(), deps(cfg, 1));
        assertEquals(Set.of(), deps(cfg, 3));
    }

    @Test
    void testIfElse() {
        Cfg cfg = controlDeps(Programs.ifElse());
        assertEquals(4, ipdom(cfg, 1));
        assertEquals(Set.of(Label.of(1)), deps(cfg, 2));
        assertEquals(Set.of(Label.of(1)), deps(cfg, 3));
        assertEquals(Set.of(), deps(cfg, 4));
        assertEquals(Set.of(), deps(cfg, 5));
    }

    @Test
    void testLoop() {
        Cfg cfg = controlDeps(Programs.counter());
        assertEquals(4, ipdom(cfg, 3));
        assertEquals(2, ipdom(cfg, 1));
        // the loop body runs again only if the branch is taken
        assertEquals(Set.of(Label.of(6)), deps(cfg, 1));
        assertEquals(Set.of(Label.of(6)), deps(cfg, 2));
        assertEquals(Set.of(Label.of(6)), deps(cfg, 3));
        assertEquals(Set.of(), deps(cfg, 0));
        assertEquals(Set.of(), deps(cfg, 4));
    }

    @Test
    void testTrap() {
        CfgBuilder cb = new CfgBuilder("trap", FuncType.of());
        int b0 = cb.data(WasmOps.MEMORY_SIZE.create());
        int b1 = cb.control(WasmOps.BR_IF.create(0));
        int b2 = cb.control(WasmOps.UNREACHABLE.create());
        int b3 = cb.data(WasmOps.NOP.create());
        int b4 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2, true)
                .edge(b1, b3, false)
                .edge(b3, b4);
        Cfg cfg = controlDeps(cb.build());

        assertEquals(ComputePostDoms.SINK, ipdom(cfg, b2));
        assertEquals(ComputePostDoms.SINK, ipdom(cfg, b1));
        assertEquals(b4, ipdom(cfg, b3));
        assertEquals(Set.of(Label.of(1)), deps(cfg, b2));
        assertEquals(Set.of(Label.of(1)), deps(cfg, b3));
        // reaching the exit depends on not trapping
        assertEquals(Set.of(Label.of(1)), deps(cfg, b4));
    }

    @Test
    void testComputedOnDemand() {
        Cfg cfg = Programs.ifElse();
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        assertFalse(ms.isValid(MetadataState.POST_DOMS));
        ms.ensureValid(cfg, MetadataState.CONTROL_DEPS);
        assertTrue(ms.isValid(MetadataState.POST_DOMS));
        assertTrue(ms.isValid(MetadataState.CONTROL_DEPS));
    }

    @Test
    void testOracle() {
        Cfg cfg = Programs.ifElse();
        PostDominatorControlDeps oracle = new PostDominatorControlDeps(cfg);
        assertEquals(Set.of(Label.of(1)), oracle.branchesFor(Use.merge(4, Var.stack(Label.of(2)))));
        assertEquals(Set.of(Label.of(1)), oracle.branchesFor(Use.merge(4, Var.stack(Label.of(3)))));
        assertEquals(Set.of(), oracle.branchesFor(Use.instruction(Label.of(10), Var.stack(Label.of(9)))));
        assertEquals(Set.of(Label.of(1)), oracle.branchesFor(Use.instruction(Label.of(2), Var.stack(Label.of(0)))));

        Cfg brIf = Programs.brIf();
        oracle = new PostDominatorControlDeps(brIf);
        // no incoming state holds the variable, so every incoming edge counts
        assertEquals(Set.of(Label.of(2)), oracle.branchesFor(Use.merge(3, Var.stack(Label.of(1)))));
    }
}
