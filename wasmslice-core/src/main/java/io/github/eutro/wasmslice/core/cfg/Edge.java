package io.github.eutro.wasmslice.core.cfg;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An edge in an {@link EdgeMap}: the block at the other end, and the branch outcome it is taken on, if any.
 */
public final class Edge {
    /**
     * The block at the other end of the edge: the target in forward edges, the source in back edges.
     */
    public final int target;
    /**
     * The outcome of the branch of the source block that takes this edge, or null if unconditional.
     */
    @Nullable
    public final Boolean condition;

    public Edge(int target, @Nullable Boolean condition) {
        this.target = target;
        this.condition = condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return target == edge.target && Objects.equals(condition, edge.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, condition);
    }

    @Override
    public String toString() {
        return condition == null ? Integer.toString(target) : target + "[" + condition + "]";
    }
}
