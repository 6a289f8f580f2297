package li.cil.softfloat;

/**
 * Classifies the bits discarded by a truncating shift relative to half a unit in the last retained place.
 * <p>
 * This is what rounding decisions are made on: the discarded bits themselves are never kept around.
 */
public enum LossFraction {
    EXACTLY_ZERO, // 0000000
    LESS_THAN_HALF, // 0xxxxxx
    EXACTLY_HALF, // 1000000
    MORE_THAN_HALF; // 1xxxxxx

    public boolean isExactlyZero() {
        return this == EXACTLY_ZERO;
    }

    public boolean isLessThanHalf() {
        return this == LESS_THAN_HALF;
    }

    public boolean isExactlyHalf() {
        return this == EXACTLY_HALF;
    }

    public boolean isMoreThanHalf() {
        return this == MORE_THAN_HALF;
    }

    public boolean isLessThanOrEqualToHalf() {
        return isLessThanHalf() || isExactlyHalf();
    }

    public boolean isGreaterThanOrEqualToHalf() {
        return isMoreThanHalf() || isExactlyHalf();
    }

    /**
     * Returns the loss of the complementary remainder, i.e. what is lost when rounding the other way.
     *
     * @return the inverted loss fraction.
     */
    public LossFraction invert() {
        return switch (this) {
            case LESS_THAN_HALF -> MORE_THAN_HALF;
            case MORE_THAN_HALF -> LESS_THAN_HALF;
            default -> this;
        };
    }

    /**
     * Combines the losses of two successive truncations into the loss of the equivalent single truncation.
     * <p>
     * The {@code msb} loss is the one of the more significant bits (e.g. the alignment shift), the {@code lsb}
     * loss the one of the bits below those (e.g. bits dropped while computing the value in the first place).
     *
     * @param msb the loss of the more significant discarded bits.
     * @param lsb the loss of the less significant discarded bits.
     * @return the combined loss.
     */
    public static LossFraction combine(final LossFraction msb, final LossFraction lsb) {
        if (!lsb.isExactlyZero()) {
            if (msb.isExactlyZero()) {
                return LESS_THAN_HALF;
            } else if (msb.isExactlyHalf()) {
                return MORE_THAN_HALF;
            }
        }
        return msb;
    }
}
