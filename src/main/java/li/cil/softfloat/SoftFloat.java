package li.cil.softfloat;

import li.cil.softfloat.bigint.BigInt;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Software implementation of binary floating point numbers according to IEEE754, in arbitrary formats.
 * <p>
 * Unlike Java, this supports exponent and mantissa widths beyond those of {@code float} and {@code double} as well
 * as different rounding modes. Values are immutable.
 * <p>
 * The mantissa of a normal value is stored with its leading bit made explicit, right-aligned so that after
 * normalization the leading bit sits at bit {@code precision - 1}. A normal value represents
 * {@code mantissa * 2^(exponent - (precision - 1))}. Values too small for the minimum exponent keep that exponent and
 * lose their leading bit, which is how subnormal numbers are represented.
 */
public final class SoftFloat {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * The number of 64-bit words used for the mantissa of every value, regardless of its format.
     */
    public static final int MANTISSA_WORDS = 6;

    private final FloatFormat format;
    private final boolean sign;
    private final long exponent;
    private final BigInt mantissa;
    private final Category category;

    private SoftFloat(final FloatFormat format, final boolean sign, final long exponent, final BigInt mantissa, final Category category) {
        this.format = format;
        this.sign = sign;
        this.exponent = exponent;
        this.mantissa = mantissa;
        this.category = category;
    }

    @Nonnull
    public static SoftFloat zero(final FloatFormat format, final boolean sign) {
        return new SoftFloat(format, sign, 0, BigInt.zero(MANTISSA_WORDS), Category.ZERO);
    }

    @Nonnull
    public static SoftFloat infinity(final FloatFormat format, final boolean sign) {
        return new SoftFloat(format, sign, 0, BigInt.zero(MANTISSA_WORDS), Category.INFINITY);
    }

    @Nonnull
    public static SoftFloat nan(final FloatFormat format, final boolean sign) {
        return new SoftFloat(format, sign, 0, BigInt.zero(MANTISSA_WORDS), Category.NAN);
    }

    /**
     * Returns the finite value with the largest magnitude in the specified format.
     *
     * @param format the format of the value.
     * @param sign   {@code true} for the negative value, {@code false} for the positive one.
     * @return the largest finite value.
     */
    @Nonnull
    public static SoftFloat largest(final FloatFormat format, final boolean sign) {
        return new SoftFloat(format, sign, format.getMaxExponent(), BigInt.allOnes(MANTISSA_WORDS, format.getPrecision()), Category.NORMAL);
    }

    /**
     * Creates a normal value from the specified fields. The value is not normalized.
     * <p>
     * This is the entry point for operations computing an exact intermediate result: construct the value from it,
     * then call {@link #normalize(RoundingMode, LossFraction)} with the loss of any bits dropped while computing it.
     *
     * @param format   the format of the value.
     * @param sign     the sign, {@code true} if negative.
     * @param exponent the unbiased exponent of bit {@code precision - 1} of the mantissa.
     * @param mantissa the mantissa, including the leading bit. At most {@link #MANTISSA_WORDS} significant words.
     * @return the new value, or a zero if the mantissa is zero.
     */
    @Nonnull
    public static SoftFloat of(final FloatFormat format, final boolean sign, final long exponent, final BigInt mantissa) {
        if (mantissa.isZero()) {
            return zero(format, sign);
        }
        return new SoftFloat(format, sign, exponent, toMantissaWidth(mantissa), Category.NORMAL);
    }

    /**
     * Creates a value from the specified fields as-is.
     *
     * @param format   the format of the value.
     * @param sign     the sign, {@code true} if negative.
     * @param exponent the unbiased exponent.
     * @param mantissa the mantissa, including the leading bit.
     * @param category the category of the value.
     * @return the new value.
     */
    @Nonnull
    public static SoftFloat raw(final FloatFormat format, final boolean sign, final long exponent, final BigInt mantissa, final Category category) {
        return new SoftFloat(format, sign, exponent, toMantissaWidth(mantissa), category);
    }

    @Nonnull
    public static SoftFloat fromUnsignedLong(final FloatFormat format, final long value) {
        if (value == 0) {
            return zero(format, false);
        }

        final int sizeInBits = Long.SIZE - 1 - Long.numberOfLeadingZeros(value);
        if (sizeInBits > format.getMaxExponent()) {
            return infinity(format, false);
        }

        // Bit zero of the mantissa has weight one, so the leading bit position has weight 2^(precision - 1).
        final SoftFloat result = new SoftFloat(format, false, format.getPrecision() - 1,
                BigInt.valueOf(MANTISSA_WORDS, value), Category.NORMAL);
        return result.normalize(RoundingMode.NEAREST_TIES_TO_EVEN, LossFraction.EXACTLY_ZERO);
    }

    @Nonnull
    public static SoftFloat fromLong(final FloatFormat format, final long value) {
        if (value < 0) {
            // -Long.MIN_VALUE wraps to itself, which is the correct magnitude as an unsigned value.
            return fromUnsignedLong(format, -value).neg();
        }
        return fromUnsignedLong(format, value);
    }

    @Nonnull
    public static SoftFloat fromFloat(final FloatFormat format, final float value) {
        return fromBits(format, FloatFormat.FP32, Integer.toUnsignedLong(Float.floatToRawIntBits(value)));
    }

    @Nonnull
    public static SoftFloat fromDouble(final FloatFormat format, final double value) {
        return fromBits(format, FloatFormat.FP64, Double.doubleToRawLongBits(value));
    }

    /**
     * Decodes a value packed in the specified encoding of at most 64 bits into the specified format.
     *
     * @param format   the format of the returned value.
     * @param encoding the format the bits are packed in.
     * @param bits     the packed bits, right-aligned.
     * @return the decoded value, rounded to the target format using {@link RoundingMode#NEAREST_TIES_TO_EVEN}.
     */
    @Nonnull
    public static SoftFloat fromBits(final FloatFormat format, final FloatFormat encoding, final long bits) {
        Validate.isTrue(encoding.getSize() <= Long.SIZE, "Encoding does not fit into 64 bits: %s", encoding);
        return decode(format, encoding, BigInt.valueOf(MANTISSA_WORDS, bits));
    }

    /**
     * Decodes a value packed in the specified encoding into the specified format.
     *
     * @param format   the format of the returned value.
     * @param encoding the format the bits are packed in.
     * @param bits     the packed bits, right-aligned.
     * @return the decoded value, rounded to the target format using {@link RoundingMode#NEAREST_TIES_TO_EVEN}.
     */
    @Nonnull
    public static SoftFloat decode(final FloatFormat format, final FloatFormat encoding, final BigInt bits) {
        final int exponentSize = encoding.getExponentSize();
        final int mantissaSize = encoding.getMantissaSize();

        final BigInt raw = toMantissaWidth(bits);
        Validate.isTrue(raw.msbIndex() <= encoding.getSize(), "Bits exceed encoding %s: %s", encoding, bits);

        final boolean sign = raw.testBit(exponentSize + mantissaSize);

        final BigInt exponentField = raw.copy();
        exponentField.shiftRight(mantissaSize);
        exponentField.mask(exponentSize);
        final long biasedExponent = exponentField.longValueExact();

        final BigInt fraction = raw.copy();
        fraction.mask(mantissaSize);

        if (biasedExponent == encoding.getExponentMask()) { // NaN or Infinity
            return fraction.isZero() ? infinity(format, sign) : nan(format, sign);
        }

        final long exponent;
        if (biasedExponent == 0) { // subnormal or zero, no leading bit
            exponent = encoding.getMinExponent();
        } else { // normal, make implicit leading 1 explicit
            exponent = biasedExponent - encoding.getBias();
            fraction.setBit(mantissaSize);
        }

        // Rescale the exponent so the value stays the same when read at the precision of the target format.
        final long rescaledExponent = exponent + format.getPrecision() - encoding.getPrecision();
        return of(format, sign, rescaledExponent, fraction)
                .normalize(RoundingMode.NEAREST_TIES_TO_EVEN, LossFraction.EXACTLY_ZERO);
    }

    public FloatFormat getFormat() {
        return format;
    }

    public boolean getSign() {
        return sign;
    }

    public long getExponent() {
        return exponent;
    }

    @Nonnull
    public BigInt getMantissa() {
        return mantissa.copy();
    }

    public Category getCategory() {
        return category;
    }

    public boolean isNegative() {
        return sign;
    }

    public boolean isZero() {
        return category == Category.ZERO;
    }

    public boolean isNormal() {
        return category == Category.NORMAL;
    }

    public boolean isInfinite() {
        return category == Category.INFINITY;
    }

    public boolean isNaN() {
        return category == Category.NAN;
    }

    /**
     * Checks whether this is a value too small for the minimum exponent of its format, i.e. a normal value whose
     * leading bit is not set.
     *
     * @return {@code true} if this value is subnormal; {@code false} otherwise.
     */
    public boolean isSubnormal() {
        return category == Category.NORMAL && !mantissa.testBit(format.getPrecision() - 1);
    }

    @Nonnull
    public SoftFloat neg() {
        return new SoftFloat(format, !sign, exponent, mantissa, category);
    }

    /**
     * Compares the magnitudes of this and the specified value. NaNs are not less than anything.
     *
     * @param other the value to compare to.
     * @return {@code true} if {@code |this| < |other|}; {@code false} otherwise.
     */
    public boolean absoluteLessThan(final SoftFloat other) {
        if (isNaN() || other.isNaN() || isInfinite() || other.isZero()) {
            return false;
        }
        if (other.isInfinite() || isZero()) {
            return true;
        }

        final int msb = mantissa.msbIndex();
        final int otherMsb = other.mantissa.msbIndex();
        final long leadingExponent = exponent + msb - format.getPrecision();
        final long otherLeadingExponent = other.exponent + otherMsb - other.format.getPrecision();
        if (leadingExponent != otherLeadingExponent) {
            return leadingExponent < otherLeadingExponent;
        }

        final BigInt a = mantissa.copy();
        final BigInt b = other.mantissa.copy();
        if (msb < otherMsb) {
            a.shiftLeft(otherMsb - msb);
        } else {
            b.shiftLeft(msb - otherMsb);
        }
        return a.compareTo(b) < 0;
    }

    /**
     * Brings this value into canonical form for its format and rounds it to its precision.
     * <p>
     * The mantissa is shifted so that its leading bit sits at the precision of the format. Bits shifted out are
     * combined with the loss already incurred while computing this value to decide whether to round away from
     * zero. Exponents above the range of the format overflow according to the rounding mode, exponents below it are
     * clamped to the minimum, producing subnormal values or zero.
     *
     * @param mode the rounding mode to use.
     * @param loss the loss of bits already discarded below the current mantissa.
     * @return the normalized value.
     * @throws IllegalStateException if the mantissa has to be widened while the incoming loss is not zero.
     */
    @Nonnull
    public SoftFloat normalize(final RoundingMode mode, final LossFraction loss) {
        if (category != Category.NORMAL) {
            return this;
        }

        final long minExponent = format.getMinExponent();
        final long maxExponent = format.getMaxExponent();
        final int precision = format.getPrecision();

        final BigInt newMantissa = mantissa.copy();
        long newExponent = exponent;
        LossFraction newLoss = loss;

        final int msb = newMantissa.msbIndex();
        if (msb > 0) {
            long exponentChange = msb - (long) precision;

            if (newExponent + exponentChange > maxExponent) {
                return overflow(mode);
            }

            if (newExponent + exponentChange < minExponent) {
                exponentChange = minExponent - newExponent;
            }

            if (exponentChange < 0) {
                Validate.validState(newLoss.isExactlyZero(), "Widening the mantissa would lose information, loss is %s", newLoss);
                newMantissa.shiftLeft((int) -exponentChange);
                return new SoftFloat(format, sign, newExponent + exponentChange, newMantissa, Category.NORMAL);
            }

            if (exponentChange > 0) {
                // Everything past the width shifts out completely.
                final int shift = (int) Math.min(exponentChange, newMantissa.getBitCount() + 1);
                final LossFraction shiftLoss = newMantissa.getLossForTruncationAt(shift);
                newMantissa.shiftRight(shift);
                newExponent += exponentChange;
                newLoss = LossFraction.combine(shiftLoss, newLoss);
            }
        }

        if (newLoss.isExactlyZero()) {
            return newMantissa.isZero() ? zero(format, sign) : new SoftFloat(format, sign, newExponent, newMantissa, Category.NORMAL);
        }

        if (needsRoundAwayFromZero(mode, newLoss, newMantissa)) {
            if (newMantissa.isZero()) {
                newExponent = minExponent;
            }

            newMantissa.addInPlace(BigInt.one(MANTISSA_WORDS));
            if (newMantissa.msbIndex() > precision) { // carry out of the precision
                if (newExponent < maxExponent) {
                    newMantissa.shiftRight(1);
                    newExponent++;
                } else {
                    return infinity(format, sign);
                }
            }
        }

        if (newMantissa.isZero()) {
            return zero(format, sign);
        }
        return new SoftFloat(format, sign, newExponent, newMantissa, Category.NORMAL);
    }

    /**
     * Converts this value to the specified format, rounding to nearest, ties to even.
     *
     * @param target the format to convert to.
     * @return the converted value.
     */
    @Nonnull
    public SoftFloat cast(final FloatFormat target) {
        return cast(target, RoundingMode.NEAREST_TIES_TO_EVEN);
    }

    /**
     * Converts this value to the specified format using the specified rounding mode.
     *
     * @param target the format to convert to.
     * @param mode   the rounding mode to use.
     * @return the converted value.
     */
    @Nonnull
    public SoftFloat cast(final FloatFormat target, final RoundingMode mode) {
        if (category != Category.NORMAL) {
            return new SoftFloat(target, sign, exponent, mantissa, category);
        }

        // The mantissa is kept as-is, so the exponent moves by the difference in precision.
        final long rescaledExponent = exponent + target.getPrecision() - format.getPrecision();
        return new SoftFloat(target, sign, rescaledExponent, mantissa, Category.NORMAL)
                .normalize(mode, LossFraction.EXACTLY_ZERO);
    }

    /**
     * Packs this value into the IEEE754 interchange layout of its format.
     * <p>
     * NaNs are always encoded as quiet NaN without payload, keeping only the sign.
     *
     * @return the packed bits, right-aligned, in the smallest number of words holding the format.
     * @throws IllegalStateException if this value is not normalized.
     */
    @Nonnull
    public BigInt encode() {
        final int mantissaSize = format.getMantissaSize();
        final int exponentSize = format.getExponentSize();

        final BigInt bits;
        final long biasedExponent;
        switch (category) {
            case INFINITY -> {
                bits = BigInt.zero(MANTISSA_WORDS);
                biasedExponent = format.getExponentMask();
            }
            case NAN -> {
                bits = BigInt.zero(MANTISSA_WORDS);
                bits.setBit(mantissaSize - 1);
                biasedExponent = format.getExponentMask();
            }
            case ZERO -> {
                bits = BigInt.zero(MANTISSA_WORDS);
                biasedExponent = 0;
            }
            case NORMAL -> {
                checkNormalized();
                bits = mantissa.copy();
                bits.mask(mantissaSize); // Clear the explicit leading bit.
                biasedExponent = mantissa.testBit(mantissaSize) ? exponent + format.getBias() : 0;
            }
            default -> throw new IllegalStateException();
        }

        final BigInt exponentField = BigInt.valueOf(MANTISSA_WORDS, biasedExponent);
        exponentField.shiftLeft(mantissaSize);
        bits.addInPlace(exponentField);
        if (sign) {
            bits.setBit(exponentSize + mantissaSize);
        }

        return bits.truncate((format.getSize() + BigInt.WORD_SIZE - 1) / BigInt.WORD_SIZE);
    }

    /**
     * Packs this value into the IEEE754 interchange layout of its format, which must be at most 64 bits wide.
     *
     * @return the packed bits, right-aligned.
     */
    public long toBits() {
        Validate.isTrue(format.getSize() <= Long.SIZE, "Format does not fit into 64 bits: %s", format);
        return encode().longValueExact();
    }

    public float floatValue() {
        return Float.intBitsToFloat((int) cast(FloatFormat.FP32).toBits());
    }

    public double doubleValue() {
        return Double.longBitsToDouble(cast(FloatFormat.FP64).toBits());
    }

    public void dump() {
        LOGGER.debug("{} {}", format, this);
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SoftFloat that = (SoftFloat) o;
        return sign == that.sign &&
               exponent == that.exponent &&
               category == that.category &&
               format.equals(that.format) &&
               mantissa.equals(that.mantissa);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, sign, exponent, mantissa, category);
    }

    @Override
    public String toString() {
        final String signString = sign ? "-" : "+";
        return switch (category) {
            case NAN -> "[" + signString + "NaN]";
            case INFINITY -> "[" + signString + "Inf]";
            case ZERO -> "[" + signString + "0.0]";
            case NORMAL -> String.format("FP[%s E=%+d M=%s]", signString, exponent, mantissa.bigIntegerValue().toString(2));
        };
    }

    private SoftFloat overflow(final RoundingMode mode) {
        return switch (mode) {
            case NEAREST_TIES_TO_EVEN, NEAREST_TIES_TO_AWAY -> infinity(format, sign);
            case TOWARD_ZERO -> largest(format, sign);
            case TOWARD_POSITIVE -> sign ? largest(format, true) : infinity(format, false);
            case TOWARD_NEGATIVE -> sign ? infinity(format, true) : largest(format, false);
        };
    }

    private boolean needsRoundAwayFromZero(final RoundingMode mode, final LossFraction loss, final BigInt roundedMantissa) {
        return switch (mode) {
            case TOWARD_POSITIVE -> !sign;
            case TOWARD_NEGATIVE -> sign;
            case TOWARD_ZERO -> false;
            case NEAREST_TIES_TO_AWAY -> loss.isGreaterThanOrEqualToHalf();
            case NEAREST_TIES_TO_EVEN -> loss.isMoreThanHalf() || (loss.isExactlyHalf() && roundedMantissa.isOdd());
        };
    }

    private void checkNormalized() {
        final int msb = mantissa.msbIndex();
        final boolean inRange = exponent >= format.getMinExponent() && exponent <= format.getMaxExponent();
        final boolean aligned = msb == format.getPrecision() || (msb < format.getPrecision() && exponent == format.getMinExponent());
        Validate.validState(inRange && aligned, "Value is not normalized: %s", this);
    }

    private static BigInt toMantissaWidth(final BigInt value) {
        if (value.getWordCount() <= MANTISSA_WORDS) {
            return value.extend(MANTISSA_WORDS);
        }
        return value.truncate(MANTISSA_WORDS);
    }
}
