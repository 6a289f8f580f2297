package li.cil.softfloat.bigint;

import li.cil.softfloat.LossFraction;
import org.apache.commons.lang3.Validate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Unsigned integer of a fixed number of 64-bit words.
 * <p>
 * Words are stored little-endian, i.e. word zero holds the least significant bits. The width is fixed when an
 * instance is created and all binary operations require both operands to have the same width. Arithmetic never
 * silently loses information: additions, subtractions and multiplications report when their result wrapped.
 * <p>
 * Instances are mutable through the explicit in-place operations ({@link #addInPlace(BigInt)},
 * {@link #shiftLeft(int)}, {@link #mask(int)}, ...) and are not thread-safe.
 */
public final class BigInt implements Comparable<BigInt> {
    public static final int WORD_SIZE = Long.SIZE;

    private static final BigInteger UNSIGNED_LONG_HIGH_BIT = BigInteger.ONE.shiftLeft(WORD_SIZE - 1);

    private final long[] parts;

    private BigInt(final long[] parts) {
        this.parts = parts;
    }

    @Nonnull
    public static BigInt zero(final int words) {
        Validate.isTrue(words > 0, "Word count must be positive: %d", words);
        return new BigInt(new long[words]);
    }

    @Nonnull
    public static BigInt one(final int words) {
        return valueOf(words, 1);
    }

    /**
     * Creates a value with the lowest {@code bits} bits set.
     *
     * @param words the width of the value in words.
     * @param bits  the number of low bits to set.
     * @return the new value.
     */
    @Nonnull
    public static BigInt allOnes(final int words, final int bits) {
        final BigInt result = zero(words);
        Validate.isTrue(bits >= 0 && bits <= result.getBitCount(), "Bit count out of range: %d", bits);
        Arrays.fill(result.parts, -1L);
        result.mask(bits);
        return result;
    }

    /**
     * Creates a value holding the specified 64-bit value, interpreted as unsigned.
     *
     * @param words the width of the value in words.
     * @param value the value for the low word.
     * @return the new value.
     */
    @Nonnull
    public static BigInt valueOf(final int words, final long value) {
        final BigInt result = zero(words);
        result.parts[0] = value;
        return result;
    }

    /**
     * Creates a value holding the specified unsigned 128-bit value.
     *
     * @param words the width of the value in words, at least two.
     * @param high  the upper 64 bits of the value.
     * @param low   the lower 64 bits of the value.
     * @return the new value.
     */
    @Nonnull
    public static BigInt valueOf(final int words, final long high, final long low) {
        Validate.isTrue(words >= 2, "A 128-bit value needs at least two words, got %d", words);
        final BigInt result = zero(words);
        result.parts[0] = low;
        result.parts[1] = high;
        return result;
    }

    /**
     * Creates a value from the specified words, least significant word first.
     *
     * @param parts the words of the value. The array is copied.
     * @return the new value.
     */
    @Nonnull
    public static BigInt fromParts(final long... parts) {
        Validate.isTrue(parts.length > 0, "Word count must be positive");
        return new BigInt(parts.clone());
    }

    @Nonnull
    public static BigInt fromBigInteger(final int words, final BigInteger value) {
        final BigInt result = zero(words);
        Validate.isTrue(value.signum() >= 0, "Value must not be negative: %s", value);
        Validate.isTrue(value.bitLength() <= result.getBitCount(), "Value does not fit into %d words: %s", words, value);
        for (int i = 0; i < words; i++) {
            result.parts[i] = value.shiftRight(i * WORD_SIZE).longValue();
        }
        return result;
    }

    public int getWordCount() {
        return parts.length;
    }

    public int getBitCount() {
        return parts.length * WORD_SIZE;
    }

    public long getPart(final int index) {
        return parts[index];
    }

    @Nonnull
    public BigInt copy() {
        return new BigInt(parts.clone());
    }

    /**
     * Returns the value as a 64-bit value.
     *
     * @return the low word of this value.
     * @throws IllegalArgumentException if any bit above the low word is set.
     */
    public long longValueExact() {
        for (int i = 1; i < parts.length; i++) {
            Validate.isTrue(parts[i] == 0, "Value does not fit into 64 bits: %s", this);
        }
        return parts[0];
    }

    /**
     * Returns the value as an unsigned 128-bit value.
     *
     * @return the low two words of this value.
     * @throws IllegalArgumentException if any bit above the low two words is set.
     */
    @Nonnull
    public BigInteger int128ValueExact() {
        for (int i = 2; i < parts.length; i++) {
            Validate.isTrue(parts[i] == 0, "Value does not fit into 128 bits: %s", this);
        }
        return bigIntegerValue();
    }

    @Nonnull
    public BigInteger bigIntegerValue() {
        BigInteger result = BigInteger.ZERO;
        for (int i = parts.length - 1; i >= 0; i--) {
            result = result.shiftLeft(WORD_SIZE).or(toUnsignedBigInteger(parts[i]));
        }
        return result;
    }

    /**
     * Returns a copy of this value narrowed to the specified number of words.
     *
     * @param words the new width, at most the current width.
     * @return the low {@code words} words of this value.
     * @throws IllegalArgumentException if the new width is larger or a dropped word is non-zero.
     */
    @Nonnull
    public BigInt truncate(final int words) {
        Validate.isTrue(words > 0 && words <= parts.length, "Can't truncate %d words to %d words", parts.length, words);
        for (int i = words; i < parts.length; i++) {
            Validate.isTrue(parts[i] == 0, "Truncation to %d words drops significant bits: %s", words, this);
        }
        return new BigInt(Arrays.copyOf(parts, words));
    }

    /**
     * Returns a copy of this value zero-extended to the specified number of words.
     *
     * @param words the new width, at least the current width.
     * @return the extended value.
     */
    @Nonnull
    public BigInt extend(final int words) {
        Validate.isTrue(words >= parts.length, "Can't extend %d words to %d words", parts.length, words);
        return new BigInt(Arrays.copyOf(parts, words));
    }

    public boolean isZero() {
        for (final long part : parts) {
            if (part != 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isEven() {
        return (parts[0] & 1) == 0;
    }

    public boolean isOdd() {
        return !isEven();
    }

    public boolean testBit(final int bit) {
        Validate.isTrue(bit >= 0 && bit < getBitCount(), "Bit index out of range: %d", bit);
        return (parts[bit / WORD_SIZE] & (1L << (bit % WORD_SIZE))) != 0;
    }

    public void setBit(final int bit) {
        Validate.isTrue(bit >= 0 && bit < getBitCount(), "Bit index out of range: %d", bit);
        parts[bit / WORD_SIZE] |= 1L << (bit % WORD_SIZE);
    }

    /**
     * Zeroes all bits at or above the specified bit position.
     *
     * @param bits the number of low bits to keep.
     */
    public void mask(int bits) {
        Validate.isTrue(bits >= 0, "Bit count must not be negative: %d", bits);
        for (int i = 0; i < parts.length; i++) {
            if (bits >= WORD_SIZE) {
                bits -= WORD_SIZE;
                continue;
            }

            if (bits == 0) {
                parts[i] = 0;
                continue;
            }

            parts[i] &= (1L << bits) - 1;
            bits = 0;
        }
    }

    /**
     * Returns the one-based index of the most significant set bit.
     *
     * @return the index of the highest set bit, or zero if no bit is set.
     */
    public int msbIndex() {
        for (int i = parts.length - 1; i >= 0; i--) {
            final long part = parts[i];
            if (part != 0) {
                return i * WORD_SIZE + (WORD_SIZE - Long.numberOfLeadingZeros(part));
            }
        }
        return 0;
    }

    /**
     * Classifies the bits that would be discarded when truncating this value at the specified bit, i.e. when
     * shifting it right by {@code bit} bits.
     *
     * @param bit the number of low bits that would be discarded.
     * @return the fraction lost by the truncation.
     */
    @Nonnull
    public LossFraction getLossForTruncationAt(final int bit) {
        Validate.isTrue(bit >= 0, "Bit count must not be negative: %d", bit);
        if (isZero() || bit == 0) {
            return LossFraction.EXACTLY_ZERO;
        }
        if (bit > getBitCount()) {
            return LossFraction.LESS_THAN_HALF;
        }

        final BigInt remainder = copy();
        remainder.mask(bit);
        if (remainder.isZero()) {
            return LossFraction.EXACTLY_ZERO;
        }

        final BigInt half = one(parts.length);
        half.shiftLeft(bit - 1);
        final int cmp = remainder.compareTo(half);
        if (cmp < 0) {
            return LossFraction.LESS_THAN_HALF;
        } else if (cmp == 0) {
            return LossFraction.EXACTLY_HALF;
        } else {
            return LossFraction.MORE_THAN_HALF;
        }
    }

    /**
     * Adds the specified value to this value.
     *
     * @param other the value to add.
     * @return {@code true} if the result overflowed and was wrapped; {@code false} otherwise.
     */
    public boolean addInPlace(final BigInt other) {
        checkSameWidth(other);
        boolean carry = false;
        for (int i = 0; i < parts.length; i++) {
            final long a = parts[i];
            final long sum = a + other.parts[i];
            final boolean carry0 = Long.compareUnsigned(sum, a) < 0;
            final long result = carry ? sum + 1 : sum;
            final boolean carry1 = carry && result == 0;
            parts[i] = result;
            carry = carry0 || carry1;
        }
        return carry;
    }

    /**
     * Subtracts the specified value from this value.
     *
     * @param other the value to subtract.
     * @return {@code true} if the result underflowed and was wrapped; {@code false} otherwise.
     */
    public boolean subtractInPlace(final BigInt other) {
        checkSameWidth(other);
        boolean borrow = false;
        for (int i = 0; i < parts.length; i++) {
            final long a = parts[i];
            final long b = other.parts[i];
            final long difference = a - b;
            final boolean borrow0 = Long.compareUnsigned(a, b) < 0;
            final boolean borrow1 = borrow && difference == 0;
            parts[i] = borrow ? difference - 1 : difference;
            borrow = borrow0 || borrow1;
        }
        return borrow;
    }

    /**
     * Multiplies this value with the specified value.
     * <p>
     * The full product is computed in a scratch buffer of twice the width, of which the low half is kept.
     *
     * @param other the value to multiply with.
     * @return {@code true} if the product did not fit and was truncated; {@code false} otherwise.
     */
    public boolean multiplyInPlace(final BigInt other) {
        checkSameWidth(other);
        final int words = parts.length;
        final long[] scratch = new long[words * 2];
        for (int i = 0; i < words; i++) {
            final long a = parts[i];
            long carry = 0;
            for (int j = 0; j < words; j++) {
                final long b = other.parts[j];
                long high = unsignedMultiplyHigh(a, b);
                final long low = a * b;

                long sum = scratch[i + j] + low;
                if (Long.compareUnsigned(sum, low) < 0) {
                    high++;
                }
                sum += carry;
                if (Long.compareUnsigned(sum, carry) < 0) {
                    high++;
                }

                scratch[i + j] = sum;
                carry = high;
            }
            scratch[i + words] = carry;
        }

        System.arraycopy(scratch, 0, parts, 0, words);

        boolean overflow = false;
        for (int i = words; i < scratch.length; i++) {
            overflow |= scratch[i] != 0;
        }
        return overflow;
    }

    @Nonnull
    public BigInt add(final BigInt other) {
        final BigInt result = copy();
        result.addInPlace(other);
        return result;
    }

    @Nonnull
    public BigInt subtract(final BigInt other) {
        final BigInt result = copy();
        result.subtractInPlace(other);
        return result;
    }

    @Nonnull
    public BigInt multiply(final BigInt other) {
        final BigInt result = copy();
        result.multiplyInPlace(other);
        return result;
    }

    /**
     * Shifts the bits of this value to the left, filling in zeros at the bottom.
     *
     * @param bits the number of bits to shift by.
     */
    public void shiftLeft(final int bits) {
        Validate.isTrue(bits >= 0, "Shift amount must not be negative: %d", bits);
        if (bits >= getBitCount()) {
            Arrays.fill(parts, 0);
            return;
        }

        final int wordsToShift = bits / WORD_SIZE;
        final int bitsInWord = bits % WORD_SIZE;

        for (int i = parts.length - 1; i >= 0; i--) {
            final int source = i - wordsToShift;
            final long left = source >= 0 ? parts[source] : 0;
            if (bitsInWord == 0) {
                parts[i] = left;
            } else {
                final long right = source > 0 ? parts[source - 1] : 0;
                parts[i] = (left << bitsInWord) | (right >>> (WORD_SIZE - bitsInWord));
            }
        }
    }

    /**
     * Shifts the bits of this value to the right, filling in zeros at the top.
     *
     * @param bits the number of bits to shift by.
     */
    public void shiftRight(final int bits) {
        Validate.isTrue(bits >= 0, "Shift amount must not be negative: %d", bits);
        if (bits >= getBitCount()) {
            Arrays.fill(parts, 0);
            return;
        }

        final int wordsToShift = bits / WORD_SIZE;
        final int bitsInWord = bits % WORD_SIZE;

        for (int i = 0; i < parts.length; i++) {
            final int source = i + wordsToShift;
            final long right = source < parts.length ? parts[source] : 0;
            if (bitsInWord == 0) {
                parts[i] = right;
            } else {
                final long left = source + 1 < parts.length ? parts[source + 1] : 0;
                parts[i] = (right >>> bitsInWord) | (left << (WORD_SIZE - bitsInWord));
            }
        }
    }

    @Override
    public int compareTo(final BigInt other) {
        checkSameWidth(other);
        for (int i = parts.length - 1; i >= 0; i--) {
            final int cmp = Long.compareUnsigned(parts[i], other.parts[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(@Nullable final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final BigInt that = (BigInt) o;
        return Arrays.equals(parts, that.parts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(parts);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int i = parts.length - 1; i >= 0; i--) {
            sb.append('|').append(String.format("%016x", parts[i]));
        }
        return sb.append(']').toString();
    }

    private void checkSameWidth(final BigInt other) {
        Validate.isTrue(other.parts.length == parts.length, "Width mismatch: %d != %d words", parts.length, other.parts.length);
    }

    private static long unsignedMultiplyHigh(final long a, final long b) {
        return Math.multiplyHigh(a, b) + ((a >> (WORD_SIZE - 1)) & b) + ((b >> (WORD_SIZE - 1)) & a);
    }

    private static BigInteger toUnsignedBigInteger(final long value) {
        final BigInteger result = BigInteger.valueOf(value & Long.MAX_VALUE);
        return value < 0 ? result.or(UNSIGNED_LONG_HIGH_BIT) : result;
    }
}
