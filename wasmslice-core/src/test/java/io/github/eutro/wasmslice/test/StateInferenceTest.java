package io.github.eutro.wasmslice.test;

import io.github.eutro.wasmslice.core.analysis.AnalysisException;
import io.github.eutro.wasmslice.core.analysis.TransferResult;
import io.github.eutro.wasmslice.core.cfg.*;
import io.github.eutro.wasmslice.core.ops.Op;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.state.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StateInferenceTest {
    static final Var A = Var.stack(Label.of(100));
    static final Var B = Var.stack(Label.of(101));

    final Cfg cfg = Programs.constAdd();

    static Insn insn(Op op) {
        return op.insn(Label.of(7));
    }

    static Var own() {
        return Var.stack(Label.of(7));
    }

    static State state(List<Var> stack) {
        return State.of(stack, List.of(Var.local(0)), List.of(Var.global(0)), Map.of());
    }

    @Test
    void testInitState() {
        CfgBuilder cb = new CfgBuilder("init", new FuncType(
                List.of(ValType.I32, ValType.F64),
                List.of(ValType.I64),
                List.of(ValType.I32),
                List.of()));
        cb.merge();
        Cfg init = cb.build();

        State s = new StateInference().initState(init);
        assertEquals(List.of(), s.vstack());
        assertEquals(List.of(Var.local(0), Var.local(1), Var.constant(PrimValue.i64(0))), s.locals());
        assertEquals(List.of(Var.global(0)), s.globals());
        assertTrue(s.memory().isEmpty());
        assertFalse(s.isBottom());

        State opaque = new StateInference(InferenceConfig.OPAQUE).initState(init);
        assertEquals(List.of(Var.local(0), Var.local(1), Var.local(2)), opaque.locals());
    }

    @Test
    void testArithmetic() {
        StateInference si = new StateInference();
        State s = state(List.of(A, B));
        assertEquals(List.of(own()), si.transferData(cfg, insn(WasmOps.binary("i32.add")), s).vstack());
        assertEquals(List.of(own(), A, B), si.transferData(cfg, insn(WasmOps.MEMORY_SIZE.create()), s).vstack());
        assertEquals(List.of(own(), B), si.transferData(cfg, insn(WasmOps.UNARY.create("i32.clz")), s).vstack());
        assertEquals(List.of(B), si.transferData(cfg, insn(WasmOps.DROP.create()), s).vstack());
        assertEquals(s, si.transferData(cfg, insn(WasmOps.NOP.create()), s));
    }

    @Test
    void testConstants() {
        State s = state(List.of());
        Insn c = insn(WasmOps.i32Const(5));
        assertEquals(List.of(Var.constant(PrimValue.i32(5))), new StateInference().transferData(cfg, c, s).vstack());
        assertEquals(List.of(own()), new StateInference(InferenceConfig.OPAQUE).transferData(cfg, c, s).vstack());
    }

    @Test
    void testLocals() {
        StateInference si = new StateInference();
        StateInference opaque = new StateInference(InferenceConfig.OPAQUE);
        State s = state(List.of(A));

        assertEquals(List.of(Var.local(0), A), si.transferData(cfg, insn(WasmOps.LOCAL_GET.create(0)), s).vstack());
        assertEquals(List.of(own(), A), opaque.transferData(cfg, insn(WasmOps.LOCAL_GET.create(0)), s).vstack());

        State set = si.transferData(cfg, insn(WasmOps.LOCAL_SET.create(0)), s);
        assertEquals(List.of(), set.vstack());
        assertEquals(List.of(A), set.locals());
        assertEquals(List.of(own()), opaque.transferData(cfg, insn(WasmOps.LOCAL_SET.create(0)), s).locals());

        State tee = si.transferData(cfg, insn(WasmOps.LOCAL_TEE.create(0)), s);
        assertEquals(List.of(A), tee.vstack());
        assertEquals(List.of(A), tee.locals());
    }

    @Test
    void testGlobals() {
        StateInference si = new StateInference();
        State s = state(List.of(A));
        assertEquals(List.of(Var.global(0), A), si.transferData(cfg, insn(WasmOps.GLOBAL_GET.create(0)), s).vstack());
        State set = si.transferData(cfg, insn(WasmOps.GLOBAL_SET.create(0)), s);
        assertEquals(List.of(), set.vstack());
        assertEquals(List.of(A), set.globals());

        InferenceConfig noGlobals = InferenceConfig.builder().propagateGlobals(false).build();
        State opaque = new StateInference(noGlobals).transferData(cfg, insn(WasmOps.GLOBAL_SET.create(0)), s);
        assertEquals(List.of(own()), opaque.globals());
    }

    @Test
    void testMemory() {
        StateInference si = new StateInference();
        // value on top, address below
        State s = state(List.of(A, B));
        State stored = si.transferData(cfg, insn(WasmOps.store(ValType.I32, 4)), s);
        assertEquals(List.of(), stored.vstack());
        assertEquals(Map.of(Var.memoryCell(B, 4), A), stored.memory());

        State loaded = si.transferData(cfg, insn(WasmOps.load(ValType.I32, 4)), stored.push(B));
        assertEquals(List.of(own()), loaded.vstack());
        assertEquals(stored.memory(), loaded.memory());
    }

    @Test
    void testUnderflow() {
        StateInference si = new StateInference();
        State s = state(List.of(A));
        AnalysisException e = assertThrows(AnalysisException.class,
                () -> si.transferData(cfg, insn(WasmOps.binary("i32.add")), s));
        assertTrue(e.getMessage().contains(cfg.name), e::getMessage);
        assertThrows(AnalysisException.class, () -> si.transferData(cfg, insn(WasmOps.DROP.create()), state(List.of())));
    }

    @Test
    void testBranches() {
        StateInference si = new StateInference();
        State s = state(List.of(A, B));
        TransferResult<State> brIf = si.transferControl(cfg, insn(WasmOps.BR_IF.create(0)), s);
        assertEquals(List.of(B), brIf.onEdge(true).vstack());
        assertEquals(List.of(B), brIf.onEdge(false).vstack());
        assertEquals(2, brIf.states().size());

        TransferResult<State> br = si.transferControl(cfg, insn(WasmOps.BR.create(0)), s);
        assertEquals(s, br.primary());
        TransferResult<State> table = si.transferControl(cfg, insn(WasmOps.BR_TABLE.create(List.of(0, 1))), s);
        assertEquals(List.of(B), table.primary().vstack());
    }

    @Test
    void testCalls() {
        StateInference si = new StateInference();
        State s = state(List.of(A, B));
        assertEquals(List.of(own()), si.transferControl(cfg, insn(WasmOps.call(3, 2, 1)), s).primary().vstack());
        assertEquals(List.of(B), si.transferControl(cfg, insn(WasmOps.call(3, 1, 0)), s).primary().vstack());
        // the table index comes on top of the arguments
        assertEquals(List.of(own()), si.transferControl(cfg, insn(WasmOps.callIndirect(0, 1, 1)), s).primary().vstack());
    }

    @Test
    void testReturn() {
        StateInference si = new StateInference();
        State s = state(List.of(A, B));
        assertEquals(List.of(A), si.transferControl(cfg, insn(WasmOps.RETURN.create()), s).primary().vstack());
        assertEquals(List.of(), si.transferControl(cfg, insn(WasmOps.UNREACHABLE.create()), s).primary().vstack());
        assertEquals(List.of(), si.transferControl(Programs.brIf(), insn(WasmOps.RETURN.create()), s).primary().vstack());
    }

    @Test
    void testUnsupported() {
        StateInference si = new StateInference();
        State s = state(List.of(A));
        assertThrows(AnalysisException.class, () -> si.transferControl(cfg, insn(WasmOps.NOP.create()), s));
        assertThrows(AnalysisException.class, () -> si.transferControl(cfg, insn(WasmOps.BLOCK.create()), s));
        assertThrows(AnalysisException.class, () -> si.transferControl(cfg, insn(WasmOps.LOOP.create()), s));
        assertThrows(AnalysisException.class, () -> si.transferData(cfg, insn(WasmOps.IF.create()), s));
    }
}
