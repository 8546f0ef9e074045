package io.github.eutro.wasmslice.core.state;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.analysis.AnalysisException;
import io.github.eutro.wasmslice.core.analysis.TransferFunctions;
import io.github.eutro.wasmslice.core.analysis.TransferResult;
import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.FuncType;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.ops.OpKey;
import io.github.eutro.wasmslice.core.ops.WasmOps;

import java.util.*;

/**
 * Infers, for every program point, which symbolic {@link Var} each stack slot, local, global
 * and known memory cell holds.
 * <p>
 * Every value an instruction produces is named after the instruction
 * ({@link Var.StackOrigin}); values that are merely moved around (through locals, globals, or
 * memory) keep their name, as configured by the {@link InferenceConfig}. Where control flow joins,
 * positions on which the incoming states disagree get a fresh {@link Var.MergeVar}.
 * The result is a program in which every variable has exactly one definition.
 * <p>
 * {@link #join(State, State)} and {@link #widen(State, State)} both keep the most recent state.
 * This is not a lattice join: termination on loops relies on merge variables being named
 * deterministically by block and position, and on the reverse post-order of
 * {@link io.github.eutro.wasmslice.core.analysis.IntraAnalysis}.
 */
public class StateInference implements TransferFunctions<State> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * The configuration of this inference.
     */
    public final InferenceConfig config;

    public StateInference(InferenceConfig config) {
        this.config = config;
    }

    public StateInference() {
        this(InferenceConfig.DEFAULT);
    }

    private interface DataTransfer {
        State transfer(Insn insn, State state, StateInference slf);
    }

    private interface ControlTransfer {
        TransferResult<State> transfer(Insn insn, State state, Cfg cfg);
    }

    private static final Map<OpKey, DataTransfer> DATA_TRANSFERS = new HashMap<>();
    private static final Map<OpKey, ControlTransfer> CONTROL_TRANSFERS = new HashMap<>();

    private static Var fresh(Insn insn) {
        return Var.stack(insn.label);
    }

    static {
        DATA_TRANSFERS.put(WasmOps.NOP, (insn, s, slf) -> s);
        DATA_TRANSFERS.put(WasmOps.MEMORY_SIZE, (insn, s, slf) -> s.push(fresh(insn)));
        DATA_TRANSFERS.put(WasmOps.DROP, (insn, s, slf) -> s.pop(1));
        DATA_TRANSFERS.put(WasmOps.SELECT, (insn, s, slf) -> s.pop(3).push(fresh(insn)));

        for (OpKey key : new OpKey[]{
                WasmOps.MEMORY_GROW,
                WasmOps.UNARY,
                WasmOps.TEST,
                WasmOps.CONVERT,
                WasmOps.LOAD,
        }) {
            DATA_TRANSFERS.put(key, (insn, s, slf) -> s.pop(1).push(fresh(insn)));
        }
        for (OpKey key : new OpKey[]{
                WasmOps.BINARY,
                WasmOps.COMPARE,
        }) {
            DATA_TRANSFERS.put(key, (insn, s, slf) -> s.pop(2).push(fresh(insn)));
        }

        DATA_TRANSFERS.put(WasmOps.LOCAL_GET, (insn, s, slf) -> {
            int local = WasmOps.LOCAL_GET.cast(insn.op).arg;
            Var held = s.local(local);
            return s.push(slf.config.propagateLocals ? held : fresh(insn));
        });
        DATA_TRANSFERS.put(WasmOps.LOCAL_SET, (insn, s, slf) -> {
            int local = WasmOps.LOCAL_SET.cast(insn.op).arg;
            Var top = s.peek();
            return s.pop(1).withLocal(local, slf.config.propagateLocals ? top : fresh(insn));
        });
        DATA_TRANSFERS.put(WasmOps.LOCAL_TEE, (insn, s, slf) -> {
            int local = WasmOps.LOCAL_TEE.cast(insn.op).arg;
            Var top = s.peek();
            return s.withLocal(local, slf.config.propagateLocals ? top : fresh(insn));
        });
        DATA_TRANSFERS.put(WasmOps.GLOBAL_GET, (insn, s, slf) -> {
            int global = WasmOps.GLOBAL_GET.cast(insn.op).arg;
            Var held = s.global(global);
            return s.push(slf.config.propagateGlobals ? held : fresh(insn));
        });
        DATA_TRANSFERS.put(WasmOps.GLOBAL_SET, (insn, s, slf) -> {
            int global = WasmOps.GLOBAL_SET.cast(insn.op).arg;
            Var top = s.peek();
            return s.pop(1).withGlobal(global, slf.config.propagateGlobals ? top : fresh(insn));
        });

        DATA_TRANSFERS.put(WasmOps.CONST, (insn, s, slf) -> s.push(slf.config.useConstants
                ? Var.constant(WasmOps.CONST.cast(insn.op).arg)
                : fresh(insn)));

        DATA_TRANSFERS.put(WasmOps.STORE, (insn, s, slf) -> {
            int offset = WasmOps.STORE.cast(insn.op).arg.offset;
            List<Var> operands = s.top(2);
            Var value = operands.get(0);
            Var address = operands.get(1);
            return s.pop(2).withMemory(Var.memoryCell(address, offset), value);
        });
    }

    static {
        for (OpKey key : new OpKey[]{
                WasmOps.IF,
                WasmOps.BR_IF,
        }) {
            CONTROL_TRANSFERS.put(key, (insn, s, cfg) -> {
                State popped = s.pop(1);
                return TransferResult.branch(popped, popped);
            });
        }
        CONTROL_TRANSFERS.put(WasmOps.BR, (insn, s, cfg) -> TransferResult.simple(s));
        CONTROL_TRANSFERS.put(WasmOps.BR_TABLE, (insn, s, cfg) -> TransferResult.simple(s.pop(1)));
        CONTROL_TRANSFERS.put(WasmOps.CALL, (insn, s, cfg) ->
                TransferResult.simple(call(insn, s, WasmOps.CALL.cast(insn.op).arg, 0)));
        CONTROL_TRANSFERS.put(WasmOps.CALL_INDIRECT, (insn, s, cfg) ->
                TransferResult.simple(call(insn, s, WasmOps.CALL_INDIRECT.cast(insn.op).arg, 1)));
        CONTROL_TRANSFERS.put(WasmOps.RETURN, (insn, s, cfg) -> TransferResult.simple(cfg.type.returnsValue()
                ? s.withStack(s.top(1))
                : s.withStack(List.of())));
        CONTROL_TRANSFERS.put(WasmOps.UNREACHABLE, (insn, s, cfg) -> TransferResult.simple(s.withStack(List.of())));
    }

    private static State call(Insn insn, State s, WasmOps.CallType type, int extra) {
        State popped = s.pop(type.arityIn + extra);
        return type.arityOut == 1 ? popped.push(fresh(insn)) : popped;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Arguments hold {@link Var.Local}s, declared locals hold the constant zero of their type
     * (or a {@link Var.Local} if constants are not used), and globals hold {@link Var.Global}s.
     */
    @Override
    public State initState(Cfg cfg) {
        FuncType type = cfg.type;
        List<Var> locals = new ArrayList<>(type.localCount());
        for (int i = 0; i < type.params.size(); i++) {
            locals.add(Var.local(i));
        }
        for (int i = 0; i < type.locals.size(); i++) {
            locals.add(config.useConstants
                    ? Var.constant(PrimValue.zero(type.locals.get(i)))
                    : Var.local(type.params.size() + i));
        }
        List<Var> globals = new ArrayList<>(type.globals.size());
        for (int i = 0; i < type.globals.size(); i++) {
            globals.add(Var.global(i));
        }
        return State.of(List.of(), locals, globals, Map.of());
    }

    @Override
    public State bottomState() {
        return State.BOTTOM;
    }

    @Override
    public State transferData(Cfg cfg, Insn insn, State state) {
        DataTransfer dt = DATA_TRANSFERS.get(insn.op.key);
        if (dt == null) {
            throw AnalysisException.format("unsupported data instruction %s in %s", insn, cfg.name);
        }
        try {
            return dt.transfer(insn, state, this);
        } catch (AnalysisException e) {
            throw new AnalysisException(String.format("at %s in %s: %s", insn, cfg.name, e.getMessage()), e);
        }
    }

    @Override
    public TransferResult<State> transferControl(Cfg cfg, Insn insn, State state) {
        ControlTransfer ct = CONTROL_TRANSFERS.get(insn.op.key);
        if (ct == null) {
            throw AnalysisException.format("unsupported control instruction %s in %s", insn, cfg.name);
        }
        try {
            return ct.transfer(insn, state, cfg);
        } catch (AnalysisException e) {
            throw new AnalysisException(String.format("at %s in %s: %s", insn, cfg.name, e.getMessage()), e);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * A block without predecessors starts from the initial state. A block with a single predecessor,
     * or a merge block with a single reached predecessor, takes that state as is. Otherwise, the
     * reached states are merged position by position (see {@link #mergeStates(int, List)}).
     * At the exit block, the value on top of the stack is then renamed to {@link Var#RESULT}.
     *
     * @throws AnalysisException If a block that is not a merge block has more than one predecessor,
     *                           or no predecessor of a merge block has been reached.
     */
    @Override
    public State merge(Cfg cfg, BasicBlock block, List<State> predStates) {
        State merged;
        if (predStates.isEmpty()) {
            merged = initState(cfg);
        } else if (!block.isMerge()) {
            if (predStates.size() > 1) {
                throw AnalysisException.format("block %d of %s has %d predecessors but is not a merge block",
                        block.index, cfg.name, predStates.size());
            }
            merged = predStates.get(0);
        } else {
            List<State> reached = new ArrayList<>(predStates.size());
            for (State s : predStates) {
                if (!s.isBottom()) reached.add(s);
            }
            if (reached.isEmpty()) {
                throw AnalysisException.format("merge block %d of %s has no reached predecessor", block.index, cfg.name);
            } else if (reached.size() == 1) {
                merged = reached.get(0);
            } else {
                merged = mergeStates(block.index, reached);
            }
        }
        if (block.isMerge() && block.index == cfg.exit && !merged.isBottom() && merged.height() > 0) {
            List<Var> stack = new ArrayList<>(merged.vstack());
            stack.set(0, Var.RESULT);
            merged = merged.withStack(stack);
        }
        return merged;
    }

    /**
     * Merge several reached states at a merge block.
     * <p>
     * This is done in two passes. First, every position (stack slot, local, global, memory cell
     * present in all states) on which the states agree keeps its variable, and every other position
     * gets a hole. Then, holes are plugged with {@link Var.MergeVar}s numbered from 0 in position order:
     * stack from the top, locals, globals, then memory cells in key order.
     * Memory cells missing from some state are dropped.
     *
     * @param block  The index of the merge block.
     * @param states The reached states, at least two.
     * @return The merged state.
     * @throws AnalysisException If the states have different stack heights, or numbers of locals or globals.
     */
    State mergeStates(int block, List<State> states) {
        State first = states.get(0);
        for (State s : states) {
            if (s.height() != first.height()
                    || s.locals().size() != first.locals().size()
                    || s.globals().size() != first.globals().size()) {
                throw AnalysisException.format("cannot merge states of different shapes at block %d: %s and %s",
                        block, first, s);
            }
        }

        List<Var> stack = mergeSlots(states, State::vstack);
        List<Var> locals = mergeSlots(states, State::locals);
        List<Var> globals = mergeSlots(states, State::globals);
        SortedMap<Var.MemoryCell, Var> memory = new TreeMap<>();
        for (Map.Entry<Var.MemoryCell, Var> entry : first.memory().entrySet()) {
            Var.MemoryCell cell = entry.getKey();
            Var value = entry.getValue();
            boolean inAll = true;
            for (State s : states) {
                Var other = s.memory().get(cell);
                if (other == null) {
                    inAll = false;
                    break;
                } else if (!other.equals(value)) {
                    value = Var.HOLE;
                }
            }
            if (inAll) {
                memory.put(cell, value);
            } else {
                logger.atFine().log("dropping memory cell %s at merge block %d", cell, block);
            }
        }

        int[] counter = {0};
        plug(stack, block, counter);
        plug(locals, block, counter);
        plug(globals, block, counter);
        for (Map.Entry<Var.MemoryCell, Var> entry : memory.entrySet()) {
            if (entry.getValue() == Var.HOLE) {
                entry.setValue(Var.merge(block, counter[0]++));
            }
        }
        logger.atFinest().log("merged %d states at block %d with %d new variables", states.size(), block, counter[0]);
        return State.of(stack, locals, globals, memory);
    }

    private interface Slots {
        List<Var> of(State state);
    }

    private static List<Var> mergeSlots(List<State> states, Slots slots) {
        List<Var> first = slots.of(states.get(0));
        List<Var> merged = new ArrayList<>(first);
        for (State s : states) {
            List<Var> other = slots.of(s);
            for (int i = 0; i < merged.size(); i++) {
                if (!other.get(i).equals(merged.get(i))) {
                    merged.set(i, Var.HOLE);
                }
            }
        }
        return merged;
    }

    private static void plug(List<Var> vars, int block, int[] counter) {
        for (int i = 0; i < vars.size(); i++) {
            if (vars.get(i) == Var.HOLE) {
                vars.set(i, Var.merge(block, counter[0]++));
            }
        }
    }

    @Override
    public State join(State old, State next) {
        return next;
    }

    @Override
    public State widen(State old, State next) {
        return next;
    }
}
