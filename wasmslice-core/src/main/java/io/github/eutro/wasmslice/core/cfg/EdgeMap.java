package io.github.eutro.wasmslice.core.cfg;

import java.util.*;

/**
 * A mutable multimap from block indices to {@link Edge}s.
 * <p>
 * A {@link Cfg} holds one for its forward edges and one for its back edges,
 * which must be kept symmetric.
 */
public final class EdgeMap {
    private final SortedMap<Integer, List<Edge>> edges = new TreeMap<>();

    /**
     * Get the edges from a block, in insertion order.
     *
     * @param src The block index.
     * @return An unmodifiable view of the edges, empty if there are none.
     */
    public List<Edge> from(int src) {
        List<Edge> es = edges.get(src);
        return es == null ? Collections.emptyList() : Collections.unmodifiableList(es);
    }

    public void add(int src, Edge edge) {
        edges.computeIfAbsent(src, $ -> new ArrayList<>()).add(edge);
    }

    /**
     * Remove every edge from {@code src} to {@code target}.
     *
     * @param src    The source block.
     * @param target The target block.
     */
    public void remove(int src, int target) {
        List<Edge> es = edges.get(src);
        if (es == null) return;
        es.removeIf(e -> e.target == target);
        if (es.isEmpty()) edges.remove(src);
    }

    /**
     * Remove every edge from {@code src}.
     *
     * @param src The source block.
     */
    public void removeFrom(int src) {
        edges.remove(src);
    }

    /**
     * Get the blocks that have outgoing edges in this map.
     *
     * @return The source indices, in ascending order.
     */
    public Set<Integer> sources() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public EdgeMap copy() {
        EdgeMap copy = new EdgeMap();
        for (Map.Entry<Integer, List<Edge>> entry : edges.entrySet()) {
            copy.edges.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return edges.equals(((EdgeMap) o).edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
