package io.github.eutro.wasmslice.core.cfg;

/**
 * A WebAssembly number type.
 */
public enum ValType {
    I32("i32"),
    I64("i64"),
    F32("f32"),
    F64("f64");

    private final String name;

    ValType(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
