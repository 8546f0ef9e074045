package io.github.eutro.wasmslice.core.state;

import io.github.eutro.wasmslice.core.analysis.AnalysisException;

import java.util.*;

/**
 * The symbolic state of the abstract machine at a program point:
 * which {@link Var} is in each stack slot, local, global and known memory cell.
 * <p>
 * States are immutable; every update returns a new state.
 * The stack is listed top first.
 * <p>
 * {@link #BOTTOM} stands for "not analysed yet". It is only ever recognised by identity:
 * a function without locals or globals has an entry state with the same (empty) contents,
 * which is not bottom.
 */
public final class State {
    public static final State BOTTOM = new State(
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptySortedMap());

    private final List<Var> vstack;
    private final List<Var> locals;
    private final List<Var> globals;
    private final SortedMap<Var.MemoryCell, Var> memory;

    private State(List<Var> vstack, List<Var> locals, List<Var> globals, SortedMap<Var.MemoryCell, Var> memory) {
        this.vstack = vstack;
        this.locals = locals;
        this.globals = globals;
        this.memory = memory;
    }

    public static State of(List<Var> vstack, List<Var> locals, List<Var> globals, Map<Var.MemoryCell, Var> memory) {
        return new State(
                Collections.unmodifiableList(new ArrayList<>(vstack)),
                Collections.unmodifiableList(new ArrayList<>(locals)),
                Collections.unmodifiableList(new ArrayList<>(globals)),
                Collections.unmodifiableSortedMap(new TreeMap<>(memory)));
    }

    public boolean isBottom() {
        return this == BOTTOM;
    }

    /**
     * Get the operand stack, top first.
     *
     * @return An unmodifiable view of the stack.
     */
    public List<Var> vstack() {
        return vstack;
    }

    public List<Var> locals() {
        return locals;
    }

    public List<Var> globals() {
        return globals;
    }

    /**
     * Get the known contents of linear memory, keyed by address variable and offset.
     *
     * @return An unmodifiable view of the memory.
     */
    public SortedMap<Var.MemoryCell, Var> memory() {
        return memory;
    }

    public int height() {
        return vstack.size();
    }

    /**
     * Get the top {@code n} stack values, top first.
     *
     * @param n The number of values.
     * @return The values.
     * @throws AnalysisException If there are fewer than {@code n} values on the stack.
     */
    public List<Var> top(int n) {
        requireHeight(n);
        return vstack.subList(0, n);
    }

    public Var peek() {
        return top(1).get(0);
    }

    public Var local(int i) {
        return locals.get(checkIndex(i, locals, "local"));
    }

    public Var global(int i) {
        return globals.get(checkIndex(i, globals, "global"));
    }

    private static int checkIndex(int i, List<Var> slots, String what) {
        if (i < 0 || i >= slots.size()) {
            throw AnalysisException.format("no %s %d (%d declared)", what, i, slots.size());
        }
        return i;
    }

    private void requireHeight(int n) {
        if (vstack.size() < n) {
            throw AnalysisException.format("stack underflow: %d values needed, %d on the stack", n, vstack.size());
        }
    }

    public State push(Var var) {
        List<Var> stack = new ArrayList<>(vstack.size() + 1);
        stack.add(var);
        stack.addAll(vstack);
        return withStack(stack);
    }

    public State pop(int n) {
        requireHeight(n);
        return withStack(vstack.subList(n, vstack.size()));
    }

    public State withStack(List<Var> stack) {
        return new State(Collections.unmodifiableList(new ArrayList<>(stack)), locals, globals, memory);
    }

    public State withLocal(int i, Var var) {
        List<Var> ls = new ArrayList<>(locals);
        ls.set(checkIndex(i, locals, "local"), var);
        return new State(vstack, Collections.unmodifiableList(ls), globals, memory);
    }

    public State withGlobal(int i, Var var) {
        List<Var> gs = new ArrayList<>(globals);
        gs.set(checkIndex(i, globals, "global"), var);
        return new State(vstack, locals, Collections.unmodifiableList(gs), memory);
    }

    public State withMemory(Var.MemoryCell cell, Var var) {
        SortedMap<Var.MemoryCell, Var> mem = new TreeMap<>(memory);
        mem.put(cell, var);
        return new State(vstack, locals, globals, Collections.unmodifiableSortedMap(mem));
    }

    /**
     * Get every variable mentioned in this state, including the address variables of memory keys.
     *
     * @return The variables.
     */
    public Set<Var> vars() {
        Set<Var> vars = new TreeSet<>(vstack);
        vars.addAll(locals);
        vars.addAll(globals);
        for (Map.Entry<Var.MemoryCell, Var> entry : memory.entrySet()) {
            vars.add(entry.getKey().address);
            vars.add(entry.getValue());
        }
        return vars;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        if (isBottom() || state.isBottom()) return false;
        return vstack.equals(state.vstack)
                && locals.equals(state.locals)
                && globals.equals(state.globals)
                && memory.equals(state.memory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vstack, locals, globals, memory);
    }

    @Override
    public String toString() {
        if (isBottom()) return "bottom";
        return "[" + join(vstack) + "] [" + join(locals) + "] [" + join(globals) + "] " + memory;
    }

    private static String join(List<Var> vars) {
        StringJoiner sj = new StringJoiner(", ");
        for (Var var : vars) sj.add(var.toString());
        return sj.toString();
    }
}
