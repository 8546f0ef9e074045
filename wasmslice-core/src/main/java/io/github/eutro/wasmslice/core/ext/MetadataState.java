package io.github.eutro.wasmslice.core.ext;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.passes.InPlaceIRPass;
import io.github.eutro.wasmslice.core.passes.meta.AnnotateStates;
import io.github.eutro.wasmslice.core.passes.meta.ComputeControlDeps;
import io.github.eutro.wasmslice.core.passes.meta.ComputePostDoms;
import io.github.eutro.wasmslice.core.passes.meta.ComputeUseDefs;

import java.util.*;

/**
 * Keeps track of which analysis results attached to a {@link Cfg} are up to date.
 * <p>
 * Each kind of result declares the kinds it is computed from. Invalidating a kind
 * also invalidates everything computed from it, transitively.
 */
public class MetadataState {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    /**
     * A kind of result whose validity is tracked by {@link MetadataState}.
     */
    public static class MetaKind {
        private static final List<MetaKind> KINDS = new ArrayList<>();

        final int id;
        final String name;
        final List<MetaKind> dependencies;

        MetaKind(String name, MetaKind... dependencies) {
            this.name = name;
            this.dependencies = List.of(dependencies);
            synchronized (KINDS) {
                id = KINDS.size();
                KINDS.add(this);
            }
        }

        /**
         * Get the kinds this is computed from.
         *
         * @return The dependencies.
         */
        public List<MetaKind> getDependencies() {
            return dependencies;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of result that can also be computed on demand, by running a pass.
     *
     * @param <T> The IR the pass runs on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final InPlaceIRPass<T> pass;

        ComputableMetaKind(String name, InPlaceIRPass<T> pass, MetaKind... dependencies) {
            super(name, dependencies);
            this.pass = pass;
        }
    }

    /**
     * The results of the analyses of a {@link Cfg}.
     * <p>
     * {@link #STATES} is computed with the default inference configuration
     * when nothing else attached states first.
     */
    public static final ComputableMetaKind<Cfg>
            STATES = new ComputableMetaKind<>("STATES", AnnotateStates.INSTANCE),
            USE_DEFS = new ComputableMetaKind<>("USE_DEFS", ComputeUseDefs.INSTANCE, STATES),
            POST_DOMS = new ComputableMetaKind<>("POST_DOMS", ComputePostDoms.INSTANCE),
            CONTROL_DEPS = new ComputableMetaKind<>("CONTROL_DEPS", ComputeControlDeps.INSTANCE, POST_DOMS);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether a kind of result is up to date.
     *
     * @param kind The kind of result.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute every given kind of result that is not up to date, dependencies first.
     *
     * @param t     The IR to run passes on.
     * @param first The first kind.
     * @param kinds The other kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (isValid(kind)) return;
        for (MetaKind dep : kind.dependencies) {
            if (dep instanceof ComputableMetaKind) {
                ensureValid0(t, (ComputableMetaKind<T>) dep);
            }
        }
        logger.atFinest().log("computing %s", kind);
        kind.pass.runInPlace(t);
        validate(kind);
    }

    /**
     * Mark the given kinds of result as up to date.
     *
     * @param kinds The kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    /**
     * Mark the given kinds of result, and everything computed from them, as out of date.
     *
     * @param kinds The kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
            invalidateDependents(kind);
        }
    }

    private void invalidateDependents(MetaKind kind) {
        synchronized (MetaKind.KINDS) {
            for (MetaKind other : MetaKind.KINDS) {
                if (other.dependencies.contains(kind)) {
                    invalidate(other);
                }
            }
        }
    }

    /**
     * Invalidate everything computed from the states, after new states were attached.
     */
    public void statesChanged() {
        invalidateDependents(STATES);
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "valid: [", "]");
        synchronized (MetaKind.KINDS) {
            for (MetaKind kind : MetaKind.KINDS) {
                if (isValid(kind)) sj.add(kind.name);
            }
        }
        return sj.toString();
    }
}
