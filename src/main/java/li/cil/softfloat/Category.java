package li.cil.softfloat;

/**
 * The kind of number a {@link SoftFloat} represents.
 * <p>
 * Exponent and mantissa only carry meaning for {@link #NORMAL} values. For all other categories only the sign is
 * relevant.
 */
public enum Category {
    ZERO,
    NORMAL,
    INFINITY,
    NAN,
}
