package io.github.eutro.wasmslice.core.state;

import io.github.eutro.wasmslice.core.cfg.ValType;
import org.jetbrains.annotations.NotNull;

/**
 * A typed literal. Floats are compared by bit pattern, so {@code NaN}s with the same payload are equal
 * and {@code 0.0} differs from {@code -0.0}.
 */
public final class PrimValue implements Comparable<PrimValue> {
    public final ValType type;
    private final long bits;

    private PrimValue(ValType type, long bits) {
        this.type = type;
        this.bits = bits;
    }

    public static PrimValue i32(int value) {
        return new PrimValue(ValType.I32, value);
    }

    public static PrimValue i64(long value) {
        return new PrimValue(ValType.I64, value);
    }

    public static PrimValue f32(float value) {
        return new PrimValue(ValType.F32, Float.floatToRawIntBits(value));
    }

    public static PrimValue f64(double value) {
        return new PrimValue(ValType.F64, Double.doubleToRawLongBits(value));
    }

    /**
     * The zero of a type, which declared locals are initialised to.
     *
     * @param type The type.
     * @return The zero value.
     */
    public static PrimValue zero(ValType type) {
        return new PrimValue(type, 0);
    }

    public int asI32() {
        return (int) bits;
    }

    public long asI64() {
        return bits;
    }

    public float asF32() {
        return Float.intBitsToFloat((int) bits);
    }

    public double asF64() {
        return Double.longBitsToDouble(bits);
    }

    @Override
    public int compareTo(@NotNull PrimValue o) {
        int c = type.compareTo(o.type);
        return c != 0 ? c : Long.compare(bits, o.bits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PrimValue that = (PrimValue) o;
        return bits == that.bits && type == that.type;
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + Long.hashCode(bits);
    }

    @Override
    public String toString() {
        switch (type) {
            case I32:
                return type + " " + asI32();
            case I64:
                return type + " " + asI64();
            case F32:
                return type + " " + asF32();
            default:
                return type + " " + asF64();
        }
    }
}
