package io.github.eutro.wasmslice.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something analysis results can be attached to. See the
 * {@link io.github.eutro.wasmslice.core.ext package-level documentation} for more info.
 */
public interface ExtContainer {
    /**
     * Attach a value under {@code ext}, replacing any previous one.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value attached under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value attached under {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value attached under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value attached under {@code ext}, which must be present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If there is no value, typically because the analysis computing it was not run.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("ext " + ext + " not present on " + this);
        }
        return value;
    }
}
