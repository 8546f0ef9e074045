package io.github.eutro.wasmslice.core.ext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key, under which a value of type {@code T} can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity. Each is given a small dense index on creation,
 * which {@link ExtHolder} uses to store values in an array.
 *
 * @param <T> The type of the value.
 */
public final class Ext<T> {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    final int index = COUNTER.getAndIncrement();
    private final String name;

    private Ext(String name) {
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Only the erasure of {@code R} can be given as a class, so {@code type} may be
     * a raw superclass of it, as in {@code Ext<Set<Label>> e = Ext.create(Set.class, "E")}.
     *
     * @param type The erasure of the type of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The erased type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(name + ": " + type.getSimpleName());
    }

    @Override
    public String toString() {
        return name;
    }
}
