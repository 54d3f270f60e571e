package jcs;

/**
 * Minimal JSON string escaping (RFC 8785, section 3.2.2.2).
 *
 * <p> Only {@code "}, {@code \} and the control characters below U+0020 are escaped. The latter use the short forms
 * {@code \b \f \n \r \t} where JSON has one and lowercase <code>&#92;u00xx</code> otherwise. Everything else, including
 * {@code /}, DEL and all non-ASCII text, is written as is.
 *
 * @since 0.1.0
 */
public final class StringEscaper {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private StringEscaper() {
        throw new UnsupportedOperationException();
    }

    /**
     * Quote and escape a string.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * StringEscaper.escape("a\"b\n€"); // -> "\"a\\\"b\\n€\""
     * }</pre>
     *
     * @param s text, not {@code null}
     * @return quoted JSON string literal
     * @throws Jcs.CanonicalizationException with {@link Jcs.ErrorKind#INVALID_STRING} if {@code s} holds an unpaired
     *                                       surrogate, which has no UTF-8 encoding
     */
    public static String escape(String s) {
        var sb = new StringBuilder(s.length() + 2);
        escapeTo(sb, s);
        return sb.toString();
    }

    static void escapeTo(StringBuilder out, String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
                    } else if (Character.isHighSurrogate(c)
                            && i + 1 < s.length()
                            && Character.isLowSurrogate(s.charAt(i + 1))) {
                        out.append(c).append(s.charAt(++i));
                    } else if (Character.isSurrogate(c)) {
                        throw new Jcs.CanonicalizationException(
                                Jcs.ErrorKind.INVALID_STRING,
                                String.format("Unpaired surrogate U+%04X at index %d", (int) c, i),
                                "$");
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
