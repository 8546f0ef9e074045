package io.github.eutro.wasmslice.core.usedef;

import io.github.eutro.wasmslice.core.analysis.AnalysisException;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.ops.OpKey;
import io.github.eutro.wasmslice.core.ops.WasmOps;
import io.github.eutro.wasmslice.core.state.State;
import io.github.eutro.wasmslice.core.state.Var;

import java.util.*;

/**
 * The variables each instruction uses and may define, read off its annotated states.
 */
public class InsnUseDefs {
    private interface Uses {
        List<Var> of(Insn insn, State before);
    }

    private interface Defs {
        List<Var> of(Insn insn, State before, State after);
    }

    private static final Map<OpKey, Uses> USES = new HashMap<>();
    private static final Map<OpKey, Defs> DEFS = new HashMap<>();

    private static Uses top(int n) {
        return (insn, before) -> before.top(n);
    }

    private static Defs topAfter(int n) {
        return (insn, before, after) -> after.top(n);
    }

    static {
        for (OpKey key : new OpKey[]{
                WasmOps.NOP,
                WasmOps.MEMORY_SIZE,
                WasmOps.CONST,
                WasmOps.BLOCK,
                WasmOps.LOOP,
                WasmOps.BR,
                WasmOps.RETURN,
                WasmOps.UNREACHABLE,
        }) {
            USES.put(key, (insn, before) -> List.of());
        }
        for (OpKey key : new OpKey[]{
                WasmOps.DROP,
                WasmOps.MEMORY_GROW,
                WasmOps.UNARY,
                WasmOps.TEST,
                WasmOps.CONVERT,
                WasmOps.LOAD,
                WasmOps.LOCAL_SET,
                WasmOps.LOCAL_TEE,
                WasmOps.GLOBAL_SET,
                WasmOps.IF,
                WasmOps.BR_IF,
                WasmOps.BR_TABLE,
        }) {
            USES.put(key, top(1));
        }
        for (OpKey key : new OpKey[]{
                WasmOps.BINARY,
                WasmOps.COMPARE,
                WasmOps.STORE,
        }) {
            USES.put(key, top(2));
        }
        USES.put(WasmOps.SELECT, top(3));
        USES.put(WasmOps.LOCAL_GET, (insn, before) -> List.of(before.local(WasmOps.LOCAL_GET.cast(insn.op).arg)));
        USES.put(WasmOps.GLOBAL_GET, (insn, before) -> List.of(before.global(WasmOps.GLOBAL_GET.cast(insn.op).arg)));
        USES.put(WasmOps.CALL, (insn, before) -> before.top(WasmOps.CALL.cast(insn.op).arg.arityIn));
        USES.put(WasmOps.CALL_INDIRECT, (insn, before) -> before.top(WasmOps.CALL_INDIRECT.cast(insn.op).arg.arityIn + 1));
    }

    static {
        for (OpKey key : new OpKey[]{
                WasmOps.SELECT,
                WasmOps.MEMORY_SIZE,
                WasmOps.MEMORY_GROW,
                WasmOps.CONST,
                WasmOps.UNARY,
                WasmOps.TEST,
                WasmOps.CONVERT,
                WasmOps.LOAD,
                WasmOps.BINARY,
                WasmOps.COMPARE,
                WasmOps.LOCAL_GET,
                WasmOps.GLOBAL_GET,
        }) {
            DEFS.put(key, topAfter(1));
        }
        DEFS.put(WasmOps.LOCAL_SET, (insn, before, after) -> List.of(after.local(WasmOps.LOCAL_SET.cast(insn.op).arg)));
        DEFS.put(WasmOps.LOCAL_TEE, (insn, before, after) -> List.of(after.local(WasmOps.LOCAL_TEE.cast(insn.op).arg)));
        DEFS.put(WasmOps.GLOBAL_SET, (insn, before, after) -> List.of(after.global(WasmOps.GLOBAL_SET.cast(insn.op).arg)));
        DEFS.put(WasmOps.STORE, (insn, before, after) -> {
            Var.MemoryCell cell = Var.memoryCell(before.top(2).get(1), WasmOps.STORE.cast(insn.op).arg.offset);
            Var stored = after.memory().get(cell);
            if (stored == null) {
                throw AnalysisException.format("no memory entry for %s after store %s", cell, insn);
            }
            return List.of(stored);
        });
        DEFS.put(WasmOps.CALL, (insn, before, after) -> after.top(WasmOps.CALL.cast(insn.op).arg.arityOut));
        DEFS.put(WasmOps.CALL_INDIRECT, (insn, before, after) -> after.top(WasmOps.CALL_INDIRECT.cast(insn.op).arg.arityOut));
    }

    /**
     * Get the variables an instruction reads.
     *
     * @param insn   The instruction.
     * @param before The state before the instruction.
     * @return The used variables.
     * @throws AnalysisException If the state does not have the operands of the instruction.
     */
    public static List<Var> uses(Insn insn, State before) {
        Uses uses = USES.get(insn.op.key);
        if (uses == null) throw new IllegalArgumentException("unknown instruction " + insn);
        try {
            return uses.of(insn, before);
        } catch (AnalysisException e) {
            throw new AnalysisException(String.format("uses of %s: %s", insn, e.getMessage()), e);
        }
    }

    /**
     * Get the variables an instruction writes.
     * <p>
     * This includes variables the instruction merely copies, such as the value stored by {@code local.set}
     * when locals are propagated; see {@link #defs(Insn, State, State)}.
     *
     * @param insn   The instruction.
     * @param before The state before the instruction.
     * @param after  The state after the instruction.
     * @return The written variables.
     */
    public static List<Var> defCandidates(Insn insn, State before, State after) {
        Defs defs = DEFS.get(insn.op.key);
        if (defs == null) return List.of();
        try {
            return defs.of(insn, before, after);
        } catch (AnalysisException e) {
            throw new AnalysisException(String.format("definitions of %s: %s", insn, e.getMessage()), e);
        }
    }

    /**
     * Get the variables an instruction defines: those it writes and that are named after it.
     *
     * @param insn   The instruction.
     * @param before The state before the instruction.
     * @param after  The state after the instruction.
     * @return The defined variables.
     */
    public static List<Var> defs(Insn insn, State before, State after) {
        Var own = Var.stack(insn.label);
        List<Var> defs = new ArrayList<>(1);
        for (Var var : defCandidates(insn, before, after)) {
            if (var.equals(own) && !defs.contains(var)) defs.add(var);
        }
        return defs;
    }
}
