package io.github.eutro.wasmslice.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An {@link ExtContainer} storing values in an array indexed by ext.
 * <p>
 * Subclasses may name a {@link #fallback() fallback} container, which is looked up
 * for exts that have no value here.
 */
public class ExtHolder implements ExtContainer {
    private static final Object[] EMPTY = new Object[0];

    private Object[] values = EMPTY; // most holders never get any

    /**
     * Get the container to look exts up in when they have no value here.
     *
     * @return The fallback, or null if there is none.
     */
    protected @Nullable ExtContainer fallback() {
        return null;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext.index >= values.length) {
            values = Arrays.copyOf(values, Math.max(ext.index + 1, values.length * 2));
        }
        values[ext.index] = value;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext.index < values.length) {
            values[ext.index] = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext.index < values.length && values[ext.index] != null) {
            return (T) values[ext.index];
        }
        ExtContainer fallback = fallback();
        return fallback == null ? null : fallback.getNullable(ext);
    }
}
