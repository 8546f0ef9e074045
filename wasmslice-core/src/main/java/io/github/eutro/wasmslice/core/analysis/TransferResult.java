package io.github.eutro.wasmslice.core.analysis;

import io.github.eutro.wasmslice.core.cfg.Edge;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The state(s) leaving a control instruction: either one state for every outgoing edge,
 * or one state per outcome of a branch.
 *
 * @param <S> The type of states.
 */
public abstract class TransferResult<S> {
    private TransferResult() {
    }

    public static <S> Simple<S> simple(S state) {
        return new Simple<>(state);
    }

    public static <S> Branch<S> branch(S ifTrue, S ifFalse) {
        return new Branch<>(ifTrue, ifFalse);
    }

    /**
     * Get the state flowing along an edge taken on the given branch outcome.
     * <p>
     * An unconditional edge leaving a branch gets the {@code true} state.
     *
     * @param condition The {@link Edge#condition condition} of the edge.
     * @return The state.
     */
    public abstract S onEdge(@Nullable Boolean condition);

    /**
     * Get the state recorded as the state after the instruction: the only state,
     * or the state of the {@code true} outcome.
     *
     * @return The state.
     */
    public abstract S primary();

    /**
     * Get every state in this result.
     *
     * @return The states.
     */
    public abstract List<S> states();

    public static final class Simple<S> extends TransferResult<S> {
        public final S state;

        private Simple(S state) {
            this.state = state;
        }

        @Override
        public S onEdge(@Nullable Boolean condition) {
            return state;
        }

        @Override
        public S primary() {
            return state;
        }

        @Override
        public List<S> states() {
            return List.of(state);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Simple && state.equals(((Simple<?>) o).state);
        }

        @Override
        public int hashCode() {
            return state.hashCode();
        }

        @Override
        public String toString() {
            return state.toString();
        }
    }

    public static final class Branch<S> extends TransferResult<S> {
        public final S ifTrue;
        public final S ifFalse;

        private Branch(S ifTrue, S ifFalse) {
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Override
        public S onEdge(@Nullable Boolean condition) {
            return condition == null || condition ? ifTrue : ifFalse;
        }

        @Override
        public S primary() {
            return ifTrue;
        }

        @Override
        public List<S> states() {
            return List.of(ifTrue, ifFalse);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Branch)) return false;
            Branch<?> branch = (Branch<?>) o;
            return ifTrue.equals(branch.ifTrue) && ifFalse.equals(branch.ifFalse);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ifTrue, ifFalse);
        }

        @Override
        public String toString() {
            return "true: " + ifTrue + ", false: " + ifFalse;
        }
    }
}
