package li.cil.softfloat;

import li.cil.softfloat.bigint.BigInt;
import org.apache.commons.lang3.Validate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Describes a binary floating point format by the widths of its exponent and mantissa fields.
 * <p>
 * The layout follows IEEE754: a sign bit, a biased exponent field and a mantissa field with an implicit leading
 * bit. The highest exponent field value is reserved for infinities and NaNs, the lowest one for zeros and
 * subnormal numbers.
 */
public final class FloatFormat {
    public static final FloatFormat FP16 = new FloatFormat(5, 10);
    public static final FloatFormat BF16 = new FloatFormat(8, 7);
    public static final FloatFormat FP32 = new FloatFormat(8, 23);
    public static final FloatFormat FP64 = new FloatFormat(11, 52);
    public static final FloatFormat FP128 = new FloatFormat(15, 112);
    public static final FloatFormat FP256 = new FloatFormat(19, 236);

    public static final int MIN_EXPONENT_SIZE = 2;
    public static final int MAX_EXPONENT_SIZE = 32;

    private final int exponentSize;
    private final int mantissaSize;

    private FloatFormat(final int exponentSize, final int mantissaSize) {
        Validate.inclusiveBetween(MIN_EXPONENT_SIZE, MAX_EXPONENT_SIZE, exponentSize, "Unsupported exponent size");
        Validate.isTrue(mantissaSize >= 1, "Mantissa size must be positive: %d", mantissaSize);

        // One spare bit above the significand catches the carry when rounding up.
        final int capacity = SoftFloat.MANTISSA_WORDS * BigInt.WORD_SIZE;
        Validate.isTrue(mantissaSize + 2 <= capacity, "Mantissa size exceeds capacity of %d bits: %d", capacity, mantissaSize);
        Validate.isTrue(1 + exponentSize + mantissaSize <= capacity, "Format size exceeds capacity of %d bits", capacity);

        this.exponentSize = exponentSize;
        this.mantissaSize = mantissaSize;
    }

    /**
     * Returns the format with the specified field widths.
     *
     * @param exponentSize the width of the exponent field, in bits.
     * @param mantissaSize the width of the mantissa field, in bits, excluding the implicit leading bit.
     * @return the format.
     */
    @Nonnull
    public static FloatFormat of(final int exponentSize, final int mantissaSize) {
        for (final FloatFormat format : new FloatFormat[]{FP16, BF16, FP32, FP64, FP128, FP256}) {
            if (format.exponentSize == exponentSize && format.mantissaSize == mantissaSize) {
                return format;
            }
        }
        return new FloatFormat(exponentSize, mantissaSize);
    }

    public int getExponentSize() {
        return exponentSize;
    }

    public int getMantissaSize() {
        return mantissaSize;
    }

    /**
     * The total width of an encoded value, sign bit included.
     *
     * @return the size of the format in bits.
     */
    public int getSize() {
        return 1 + exponentSize + mantissaSize;
    }

    /**
     * The number of significant bits, including the implicit leading bit.
     *
     * @return the precision of the format.
     */
    public int getPrecision() {
        return mantissaSize + 1;
    }

    public long getBias() {
        return (1L << (exponentSize - 1)) - 1;
    }

    public long getExponentMask() {
        return (1L << exponentSize) - 1;
    }

    /**
     * The smallest unbiased exponent of a normal number. Subnormal numbers share this exponent.
     *
     * @return the minimum exponent.
     */
    public long getMinExponent() {
        return 1 - getBias();
    }

    /**
     * The largest unbiased exponent of a finite number. The exponent field above it encodes infinities and NaNs.
     *
     * @return the maximum exponent.
     */
    public long getMaxExponent() {
        return (1L << exponentSize) - getBias() - 2;
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FloatFormat that = (FloatFormat) o;
        return exponentSize == that.exponentSize &&
               mantissaSize == that.mantissaSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(exponentSize, mantissaSize);
    }

    @Override
    public String toString() {
        return "FP" + getSize() + "[E=" + exponentSize + " M=" + mantissaSize + "]";
    }
}
