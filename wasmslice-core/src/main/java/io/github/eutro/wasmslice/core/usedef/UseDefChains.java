package io.github.eutro.wasmslice.core.usedef;

import io.github.eutro.wasmslice.core.analysis.AnalysisException;
import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.state.Var;

import java.util.*;

/**
 * The data dependences of a function: the definition of every variable, the uses of every variable,
 * and the one definition that reaches each use.
 * <p>
 * Instances are immutable, and total: every recorded use has a definition.
 *
 * @see io.github.eutro.wasmslice.core.passes.meta.ComputeUseDefs
 */
public final class UseDefChains {
    private final SortedMap<Var, Def> defs;
    private final SortedMap<Var, SortedSet<Use>> uses;
    private final SortedMap<Use, Def> chains;
    private final Map<Label, List<Use>> usesAt;

    private UseDefChains(SortedMap<Var, Def> defs, SortedMap<Var, SortedSet<Use>> uses, SortedMap<Use, Def> chains) {
        this.defs = Collections.unmodifiableSortedMap(defs);
        this.uses = Collections.unmodifiableSortedMap(uses);
        this.chains = Collections.unmodifiableSortedMap(chains);
        Map<Label, List<Use>> at = new HashMap<>();
        for (Use use : chains.keySet()) {
            at.computeIfAbsent(use.label(), $ -> new ArrayList<>()).add(use);
        }
        this.usesAt = at;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the definition reaching a use.
     *
     * @param use The use.
     * @return The definition.
     * @throws IllegalArgumentException If the use is not part of these chains.
     */
    public Def get(Use use) {
        Def def = chains.get(use);
        if (def == null) throw new IllegalArgumentException("unknown use " + use);
        return def;
    }

    /**
     * Get every use with its reaching definition.
     *
     * @return An unmodifiable view of the chains, ordered by use.
     */
    public SortedMap<Use, Def> entries() {
        return chains;
    }

    /**
     * Get the definition of every variable.
     *
     * @return An unmodifiable view of the definitions.
     */
    public SortedMap<Var, Def> defs() {
        return defs;
    }

    /**
     * Get the uses of every used variable.
     *
     * @return An unmodifiable view of the uses.
     */
    public SortedMap<Var, SortedSet<Use>> uses() {
        return uses;
    }

    /**
     * Get the uses happening at an instruction or merge block.
     *
     * @param label The label of the instruction, or the merge label of the block.
     * @return The uses, in order.
     */
    public List<Use> usesAt(Label label) {
        List<Use> at = usesAt.get(label);
        return at == null ? Collections.emptyList() : Collections.unmodifiableList(at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return chains.equals(((UseDefChains) o).chains) && defs.equals(((UseDefChains) o).defs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chains, defs);
    }

    @Override
    public String toString() {
        return chains.toString();
    }

    /**
     * Collects definitions and uses, and checks that they form valid chains.
     */
    public static final class Builder {
        private final SortedMap<Var, Def> defs = new TreeMap<>();
        private final SortedMap<Var, SortedSet<Use>> uses = new TreeMap<>();

        private Builder() {
        }

        /**
         * Record a definition.
         *
         * @param def The definition.
         * @return This builder.
         * @throws AnalysisException If the variable already has a definition.
         */
        public Builder define(Def def) {
            Def old = defs.putIfAbsent(def.var, def);
            if (old != null) {
                throw AnalysisException.format("%s is defined twice: %s and %s", def.var, old, def);
            }
            return this;
        }

        /**
         * Get whether a variable has been defined.
         *
         * @param var The variable.
         * @return Whether it has a definition.
         */
        public boolean isDefined(Var var) {
            return defs.containsKey(var);
        }

        public Builder use(Use use) {
            uses.computeIfAbsent(use.var, $ -> new TreeSet<>()).add(use);
            return this;
        }

        /**
         * Link every use to the definition of its variable.
         *
         * @return The chains.
         * @throws AnalysisException If some used variable has no definition.
         */
        public UseDefChains build() {
            SortedMap<Use, Def> chains = new TreeMap<>();
            SortedMap<Var, SortedSet<Use>> usesCopy = new TreeMap<>();
            for (Map.Entry<Var, SortedSet<Use>> entry : uses.entrySet()) {
                Def def = defs.get(entry.getKey());
                if (def == null) {
                    throw AnalysisException.format("%s is used at %s but never defined",
                            entry.getKey(), entry.getValue().first().label());
                }
                for (Use use : entry.getValue()) {
                    chains.put(use, def);
                }
                usesCopy.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
            }
            return new UseDefChains(new TreeMap<>(defs), usesCopy, chains);
        }
    }
}
