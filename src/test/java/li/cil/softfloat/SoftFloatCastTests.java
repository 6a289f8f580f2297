package li.cil.softfloat;

import li.cil.softfloat.bigint.BigInt;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public final class SoftFloatCastTests {
    @Test
    public void castThroughDoubleAndBack() {
        final SoftFloat value = SoftFloat.fromBits(FloatFormat.FP64, FloatFormat.FP32, 0x41700000L);
        assertEquals(15.0, value.doubleValue());
        assertEquals(0x41700000L, value.cast(FloatFormat.FP32).toBits());

        final float pi = 355f / 113f;
        assertEquals(pi, SoftFloat.fromFloat(FloatFormat.FP64, pi).floatValue());
        assertEquals((double) pi, SoftFloat.fromFloat(FloatFormat.FP64, pi).doubleValue());

        assertEquals(0x3f8fffffL, SoftFloat.fromBits(FloatFormat.FP64, FloatFormat.FP32, 0x3f8fffffL).cast(FloatFormat.FP32).toBits());
    }

    @Test
    public void floatBitPatternsSurviveWidening() {
        for (long i = 0; i < (1 << 14); i++) {
            final long bits = i << 16;
            final SoftFloat wide = SoftFloat.fromBits(FloatFormat.FP64, FloatFormat.FP32, bits);
            assertEquals(bits, wide.cast(FloatFormat.FP32).toBits(), Long.toHexString(bits));
            assertEquals((double) Float.intBitsToFloat((int) bits), wide.doubleValue(), Long.toHexString(bits));
        }
    }

    @Test
    public void floatBitPatternsSurviveDecodeAndEncode() {
        for (final long bits : new long[]{0x3f8fffffL, 0x40800000L, 0x3f000000L, 0xc60b40ecL, 0xbc675793L}) {
            assertEquals(bits, SoftFloat.fromBits(FloatFormat.FP32, FloatFormat.FP32, bits).toBits());
        }
    }

    @Test
    public void fromIntegers() {
        assertEquals(4294967296f, SoftFloat.fromUnsignedLong(FloatFormat.FP32, 1L << 32).floatValue());
        assertEquals(17179869184f, SoftFloat.fromUnsignedLong(FloatFormat.FP32, 1L << 34).floatValue());
        assertEquals(8388610f, SoftFloat.fromLong(FloatFormat.FP32, 8388610).floatValue());
        assertEquals(0x3f800000L, SoftFloat.fromLong(FloatFormat.FP32, 1).toBits());
        assertEquals(0x3c00L, SoftFloat.fromLong(FloatFormat.FP16, 1).toBits());

        final SoftFloat pi = SoftFloat.fromLong(FloatFormat.FP64, 355);
        assertEquals(355.0 / 133.0, pi.doubleValue() / SoftFloat.fromLong(FloatFormat.FP64, 133).doubleValue());
        final SoftFloat e = SoftFloat.fromLong(FloatFormat.FP32, 193);
        assertEquals(193f / 71f, e.floatValue() / SoftFloat.fromLong(FloatFormat.FP32, 71).floatValue());

        for (long i = 0; i < (1 << 16); i++) {
            final long value = i << 12;
            assertEquals((float) value, SoftFloat.fromLong(FloatFormat.FP32, value).floatValue(), Long.toString(value));
        }

        for (long i = -100; i <= 100; i++) {
            assertEquals((double) i, SoftFloat.fromLong(FloatFormat.FP16, i).doubleValue());
        }

        assertEquals((float) Long.MIN_VALUE, SoftFloat.fromLong(FloatFormat.FP32, Long.MIN_VALUE).floatValue());
        assertEquals(0x1p64f, SoftFloat.fromUnsignedLong(FloatFormat.FP32, -1L).floatValue());
    }

    @Test
    public void fromIntegersIntoHalfPrecision() {
        assertEquals(65504.0, SoftFloat.fromLong(FloatFormat.FP16, 65504).doubleValue());
        assertEquals(Double.POSITIVE_INFINITY, SoftFloat.fromLong(FloatFormat.FP16, 65535).doubleValue());

        assertEquals(65504.0, SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65500).doubleValue());
        assertEquals(65504.0, SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65504).doubleValue());
        assertEquals(65504.0, SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65519).doubleValue());
        assertTrue(SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65520).isInfinite());
        assertTrue(SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65535).isInfinite());
        assertTrue(SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65536).isInfinite());
        assertEquals(0x7c00L, SoftFloat.fromUnsignedLong(FloatFormat.FP16, 65536).toBits());
        assertEquals(0xfc00L, SoftFloat.fromLong(FloatFormat.FP16, -65536).toBits());
    }

    @Test
    public void specialValuesKeepTheirCategory() {
        assertTrue(SoftFloat.fromLong(FloatFormat.FP32, 0).isZero());
        assertFalse(SoftFloat.fromLong(FloatFormat.FP32, 0).isNegative());

        final SoftFloat negativeZero = SoftFloat.fromDouble(FloatFormat.FP32, -0.0);
        assertTrue(negativeZero.isZero());
        assertTrue(negativeZero.isNegative());
        assertEquals(0x80000000L, negativeZero.toBits());
        assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(negativeZero.doubleValue()));

        assertTrue(SoftFloat.fromFloat(FloatFormat.FP64, Float.NaN).isNaN());
        assertTrue(Double.isNaN(SoftFloat.fromFloat(FloatFormat.FP64, Float.NaN).doubleValue()));
        assertEquals(0x7fc00000L, SoftFloat.fromDouble(FloatFormat.FP32, Double.NaN).toBits());
        assertEquals(0xfff8000000000000L, SoftFloat.nan(FloatFormat.FP64, true).toBits());

        assertEquals(Float.POSITIVE_INFINITY, SoftFloat.fromDouble(FloatFormat.FP16, Double.POSITIVE_INFINITY).floatValue());
        assertEquals(Float.NEGATIVE_INFINITY, SoftFloat.fromFloat(FloatFormat.FP128, Float.NEGATIVE_INFINITY).floatValue());
    }

    @Test
    public void narrowingMatchesJava() {
        final double[] values = {
                0.3, 0.1, 14151241515., 14151215., 1e-10, 1e9, -1e-40, 1e-45, 1e39, -1e39,
                Double.MIN_VALUE, Double.MAX_VALUE,
                Float.MIN_VALUE, Float.MIN_VALUE / 2.0, Float.MIN_VALUE * 1.5, Float.MIN_VALUE * 2.5,
                Float.MIN_NORMAL, Math.nextDown((double) Float.MIN_NORMAL),
                Float.MAX_VALUE, Math.nextUp((double) Float.MAX_VALUE),
                (double) Float.MAX_VALUE + 0x1p103, (double) Float.MAX_VALUE + 0x1p102,
        };
        for (final double value : values) {
            final float expected = (float) value;
            final float actual = SoftFloat.fromDouble(FloatFormat.FP64, value).floatValue();
            assertEquals(Float.floatToRawIntBits(expected), Float.floatToRawIntBits(actual), Double.toString(value));
        }
    }

    @Test
    public void subnormalsAreDetected() {
        assertTrue(SoftFloat.fromFloat(FloatFormat.FP32, Float.MIN_VALUE).isSubnormal());
        assertFalse(SoftFloat.fromFloat(FloatFormat.FP32, Float.MIN_NORMAL).isSubnormal());
        assertFalse(SoftFloat.fromFloat(FloatFormat.FP64, Float.MIN_VALUE).isSubnormal());
        assertTrue(SoftFloat.fromDouble(FloatFormat.FP32, Float.MIN_VALUE * 3.0).isSubnormal());
        assertFalse(SoftFloat.fromDouble(FloatFormat.FP32, 1.0).isSubnormal());
        assertFalse(SoftFloat.zero(FloatFormat.FP32, false).isSubnormal());
    }

    @Test
    public void quadPrecisionEncoding() {
        final BigInt one = SoftFloat.fromDouble(FloatFormat.FP128, 1.0).encode();
        assertEquals(2, one.getWordCount());
        assertEquals(BigInteger.valueOf(0x3fff).shiftLeft(112), one.int128ValueExact());

        final BigInt two = BigInt.valueOf(2, 0x4000000000000000L, 0);
        assertEquals(2.0, SoftFloat.decode(FloatFormat.FP64, FloatFormat.FP128, two).doubleValue());
        assertEquals(-2.0, SoftFloat.decode(FloatFormat.FP128, FloatFormat.FP128, BigInt.valueOf(2, 0xc000000000000000L, 0)).doubleValue());

        final BigInt nan = SoftFloat.nan(FloatFormat.FP128, false).encode();
        assertEquals(0x7fff800000000000L, nan.getPart(1));
        assertEquals(0, nan.getPart(0));

        for (final double value : new double[]{Math.PI, -Math.E, Double.MIN_VALUE, Double.MIN_NORMAL, Double.MAX_VALUE, 1e-300}) {
            final SoftFloat quad = SoftFloat.fromDouble(FloatFormat.FP128, value);
            assertFalse(quad.isSubnormal());
            assertEquals(value, quad.doubleValue());
            assertEquals(value, SoftFloat.decode(FloatFormat.FP64, FloatFormat.FP128, quad.encode()).doubleValue());
        }
    }

    @Test
    public void octuplePrecisionEncoding() {
        final BigInt one = SoftFloat.fromLong(FloatFormat.FP256, 1).encode();
        assertEquals(4, one.getWordCount());
        assertEquals(0x3ffff00000000000L, one.getPart(3));
        assertEquals(0, one.getPart(2));
        assertEquals(0, one.getPart(1));
        assertEquals(0, one.getPart(0));

        assertEquals(Math.PI, SoftFloat.fromDouble(FloatFormat.FP256, Math.PI).doubleValue());
        assertEquals((float) Math.PI, SoftFloat.fromDouble(FloatFormat.FP256, Math.PI).floatValue());
        assertEquals(Long.MAX_VALUE, SoftFloat.fromLong(FloatFormat.FP256, Long.MAX_VALUE).cast(FloatFormat.FP128).doubleValue());
    }

    @Test
    public void customFormats() {
        final FloatFormat format = FloatFormat.of(4, 3);
        assertEquals(8, format.getSize());
        // Largest finite value: 1.111b * 2^7.
        assertEquals(240.0, SoftFloat.largest(format, false).doubleValue());
        assertEquals(240.0, SoftFloat.fromLong(format, 240).doubleValue());
        assertTrue(SoftFloat.fromLong(format, 248).isInfinite());
        assertEquals(0x38L, SoftFloat.fromLong(format, 1).toBits());
        assertEquals(1.0, SoftFloat.fromBits(FloatFormat.FP32, format, 0x38L).doubleValue());
    }

    @Test
    public void invalidEncodingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SoftFloat.fromBits(FloatFormat.FP32, FloatFormat.FP128, 0));
        assertThrows(IllegalArgumentException.class, () -> SoftFloat.fromLong(FloatFormat.FP128, 1).toBits());
        assertThrows(IllegalArgumentException.class, () -> SoftFloat.fromBits(FloatFormat.FP32, FloatFormat.FP16, 0x10000L));
    }
}
