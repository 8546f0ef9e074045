package io.github.eutro.wasmslice.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The signature of an analysed function, together with everything
 * that determines the shape of its abstract state.
 */
public final class FuncType {
    /**
     * The types of the arguments.
     */
    public final List<ValType> params;
    /**
     * The types of the declared locals, not including the arguments.
     */
    public final List<ValType> locals;
    /**
     * The types of the globals of the enclosing module.
     */
    public final List<ValType> globals;
    /**
     * The result types.
     */
    public final List<ValType> results;

    public FuncType(List<ValType> params, List<ValType> locals, List<ValType> globals, List<ValType> results) {
        if (results.size() > 1) {
            throw new IllegalArgumentException("multiple results are not supported: " + results);
        }
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.globals = Collections.unmodifiableList(new ArrayList<>(globals));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    /**
     * A function taking no arguments, and with no locals or globals.
     *
     * @param results The result types.
     * @return The function type.
     */
    public static FuncType of(ValType... results) {
        return new FuncType(List.of(), List.of(), List.of(), List.of(results));
    }

    /**
     * Get the number of local slots, arguments included.
     *
     * @return The number of locals.
     */
    public int localCount() {
        return params.size() + locals.size();
    }

    /**
     * Get whether the function returns a value.
     *
     * @return Whether there is a result.
     */
    public boolean returnsValue() {
        return !results.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuncType funcType = (FuncType) o;
        return params.equals(funcType.params)
                && locals.equals(funcType.locals)
                && globals.equals(funcType.globals)
                && results.equals(funcType.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, locals, globals, results);
    }

    @Override
    public String toString() {
        return params + " -> " + results + " (locals " + locals + ", globals " + globals + ")";
    }
}
