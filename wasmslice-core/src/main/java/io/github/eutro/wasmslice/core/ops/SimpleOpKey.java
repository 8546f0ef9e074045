package io.github.eutro.wasmslice.core.ops;

/**
 * An operation key for operations without any intermediates,
 * which can thus share a single {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Get the single operation of this key.
     *
     * @return The operation.
     */
    public Op create() {
        return op;
    }
}
