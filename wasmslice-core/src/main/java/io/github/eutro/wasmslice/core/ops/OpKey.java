package io.github.eutro.wasmslice.core.ops;

import io.github.eutro.wasmslice.core.ext.ExtHolder;

/**
 * An operation key, representing a type of operation, without intermediates.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The mnemonic of the operation, as it would appear in the text format.
     */
    public final String mnemonic;

    /**
     * Construct an operation key with the given mnemonic.
     *
     * @param mnemonic The mnemonic.
     */
    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
