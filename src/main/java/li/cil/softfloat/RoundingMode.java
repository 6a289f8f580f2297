package li.cil.softfloat;

/**
 * Rounding policies applied when a value has to be reduced to the precision of its format.
 */
public enum RoundingMode {
    // NB: The encodings must match the RISC-V ones.
    NEAREST_TIES_TO_EVEN(0b000), // Round to nearest, ties to even.
    TOWARD_ZERO(0b001), // Round towards zero.
    TOWARD_NEGATIVE(0b010), // Round down (towards negative infinity).
    TOWARD_POSITIVE(0b011), // Round up (towards positive infinity).
    NEAREST_TIES_TO_AWAY(0b100); // Round to nearest, ties to max magnitude.

    private final int encoding;

    RoundingMode(final int encoding) {
        this.encoding = encoding;
    }

    public int getEncoding() {
        return encoding;
    }

    public static RoundingMode fromEncoding(final int encoding) {
        for (final RoundingMode mode : values()) {
            if (mode.encoding == encoding) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown rounding mode encoding: " + encoding);
    }
}
