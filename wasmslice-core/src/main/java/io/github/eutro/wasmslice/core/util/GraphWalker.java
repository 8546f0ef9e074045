package io.github.eutro.wasmslice.core.util;

import io.github.eutro.wasmslice.core.cfg.Cfg;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * In pre-order, elements yielded later by the successor function are visited first.
     * In post-order, elements yielded earlier are descended into first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the block indices of a {@link Cfg}, starting at its entry block.
     * <p>
     * Successors are yielded in reverse edge order, so targets of earlier edges come first
     * in both the pre-order and the reverse post-order.
     *
     * @param cfg The control-flow graph.
     * @return The graph walker.
     */
    public static GraphWalker<Integer> blockWalker(Cfg cfg) {
        return new GraphWalker<>(cfg.entry, idx -> reversedIterable(cfg.successors(idx)));
    }

    /**
     * Compute the reverse post-order of the blocks of a {@link Cfg} that are reachable from its entry.
     *
     * @param cfg The control-flow graph.
     * @return The reachable block indices, in reverse post-order.
     */
    public static List<Integer> reversePostOrder(Cfg cfg) {
        List<Integer> order = blockWalker(cfg).postOrder().toList();
        Collections.reverse(order);
        return order;
    }

    private static <T> Iterable<T> reversedIterable(List<T> ts) {
        return () -> {
            ListIterator<T> li = ts.listIterator(ts.size());
            return new Iterator<T>() {
                @Override
                public boolean hasNext() {
                    return li.hasPrevious();
                }

                @Override
                public T next() {
                    return li.previous();
                }
            };
        };
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private static class Frame<T> {
        final T node;
        final Iterator<? extends T> children;

        Frame(T node, Iterator<? extends T> children) {
            this.node = node;
            this.children = children;
        }
    }

    // a node is finished only once every child reachable through it is, so forward edges are respected
    private class PostIter implements Iterator<T> {
        private final Deque<Frame<T>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            stack.addLast(new Frame<>(node, getChildren.apply(node).iterator()));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Frame<T> top = stack.getLast();
                if (top.children.hasNext()) {
                    T child = top.children.next();
                    if (!seen.contains(child)) {
                        push(child);
                    }
                } else {
                    stack.removeLast();
                    return top.node;
                }
            }
        }
    }
}
