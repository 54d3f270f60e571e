package jcs;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Canonical number text, as produced by ECMAScript {@code Number.prototype.toString()} for finite doubles
 * (RFC 8785, section 3.2.2.3).
 *
 * <p> The digits are the shortest decimal that reads back as exactly the same double. When two candidates of that
 * length both read back, the one closer to the exact binary value wins, and on a tie the even one. The layout then
 * depends on the decimal exponent {@code n} of the first digit:
 * <ul>
 *     <li>{@code 1e20} formats as {@code 100000000000000000000}, {@code 1e21} as {@code 1e+21}</li>
 *     <li>{@code 0.000001} stays plain, {@code 1e-7} formats as {@code 1e-7}</li>
 *     <li>{@code -0.0} formats as {@code 0}</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class NumberFormatter {

    /**
     * 2^53. Below this every integral double prints as its exact integer value.
     */
    private static final double EXACT_INTEGER_LIMIT = 9007199254740992d;

    private static final int MAX_PLAIN_EXPONENT = 21;
    private static final int MIN_PLAIN_EXPONENT = -6;

    /**
     * Seventeen significant digits always identify a double uniquely.
     */
    private static final int MAX_DIGITS = 17;

    private NumberFormatter() {
        throw new UnsupportedOperationException();
    }

    /**
     * Format a double as canonical JSON number text.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * NumberFormatter.format(1.0);      // -> "1"
     * NumberFormatter.format(1e21);     // -> "1e+21"
     * NumberFormatter.format(0.1 + 0.2) // -> "0.30000000000000004"
     * }</pre>
     *
     * @param value finite double
     * @return canonical text
     * @throws Jcs.CanonicalizationException with {@link Jcs.ErrorKind#INVALID_NUMBER} for NaN and the infinities
     */
    public static String format(double value) {
        var sb = new StringBuilder(25);
        formatTo(sb, value);
        return sb.toString();
    }

    static void formatTo(StringBuilder out, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new Jcs.CanonicalizationException(
                    Jcs.ErrorKind.INVALID_NUMBER, value + " is not a valid JSON number", "$");
        }
        if (value == 0) { // also -0.0
            out.append('0');
            return;
        }
        if (value < 0) {
            out.append('-');
            value = -value;
        }
        if (value < EXACT_INTEGER_LIMIT && value == Math.rint(value)) {
            out.append((long) value);
            return;
        }

        var decimal = shortest(value).stripTrailingZeros();
        var digits = decimal.unscaledValue().toString();
        int k = digits.length();
        int n = k - decimal.scale();

        if (k <= n && n <= MAX_PLAIN_EXPONENT) {
            out.append(digits);
            appendZeros(out, n - k);
        } else if (0 < n && n <= MAX_PLAIN_EXPONENT) {
            out.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (MIN_PLAIN_EXPONENT < n && n <= 0) {
            out.append("0.");
            appendZeros(out, -n);
            out.append(digits);
        } else {
            int e = n - 1;
            out.append(digits.charAt(0));
            if (k > 1) out.append('.').append(digits, 1, k);
            out.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
        }
    }

    /**
     * Shortest decimal that converts back to {@code value}, which must be finite and positive.
     */
    static BigDecimal shortest(double value) {
        var exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_DIGITS; precision++) {
            var down = exact.round(new MathContext(precision, RoundingMode.FLOOR));
            var up = exact.round(new MathContext(precision, RoundingMode.CEILING));
            boolean downOk = down.doubleValue() == value;
            boolean upOk = up.doubleValue() == value;
            if (downOk && upOk) return closer(exact, down, up);
            if (downOk) return down;
            if (upOk) return up;
        }
        return exact.round(new MathContext(MAX_DIGITS, RoundingMode.HALF_EVEN));
    }

    private static BigDecimal closer(BigDecimal exact, BigDecimal down, BigDecimal up) {
        if (down.compareTo(up) == 0) return down;
        int cmp = exact.subtract(down).compareTo(up.subtract(exact));
        if (cmp < 0) return down;
        if (cmp > 0) return up;
        return down.unscaledValue().testBit(0) ? up : down;
    }

    private static void appendZeros(StringBuilder out, int count) {
        for (int i = 0; i < count; i++) out.append('0');
    }
}
