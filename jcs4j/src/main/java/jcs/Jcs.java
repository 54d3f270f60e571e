package jcs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * RFC 8785 JSON canonicalization: one deterministic byte sequence per JSON value, for hashing, signing, cache keys
 * and semantic comparison.
 *
 * <p> The static methods use a default {@link Canonicalizer} and report failures as {@link Result} values. Build a
 * {@link Canonicalizer} directly for a different depth limit or for the throwing variants.
 *
 * @since 0.1.0
 */
public final class Jcs {

    private static final Logger LOG = Logger.getLogger(Jcs.class.getName());

    /**
     * System property that overrides the default {@link Canonicalizer#maxDepth} and {@link Reader#maxDepth}.
     */
    public static final String MAX_DEPTH_PROPERTY = "jcs.maxDepth";

    public static final int DEFAULT_MAX_DEPTH = 1000;

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private static final Canonicalizer defaultCanonicalizer = Canonicalizer.builder().build();
    private static final Reader defaultReader = Reader.builder().build();

    private Jcs() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Canonical UTF-8 bytes of a value.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var v = Jcs.parse("{\"b\": 2, \"a\": 1.0}");
     * byte[] bytes = Jcs.canonicalize(v).orElseThrow();
     * // -> {"a":1,"b":2}
     * }</pre>
     *
     * @param value value tree, not {@code null}
     * @return canonical bytes, or the error that stopped canonicalization
     */
    public static Result<byte[]> canonicalize(JsonValue value) {
        return Result.of(() -> defaultCanonicalizer.canonicalize(value));
    }

    /**
     * Canonical form as text; short name for {@link #canonicalize(JsonValue)} decoded as UTF-8.
     */
    public static Result<String> jcs(JsonValue value) {
        return Result.of(() -> defaultCanonicalizer.canonicalizeToString(value));
    }

    /**
     * Lowercase hex digest of the canonical bytes.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Jcs.canonicalHash(Jcs.parse("{}"), "SHA-256").orElseThrow();
     * // -> "44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a"
     * }</pre>
     *
     * @param value     value tree, not {@code null}
     * @param algorithm JCA digest name such as {@code SHA-256}, {@code SHA-512}, {@code SHA3-256}, {@code MD5};
     *                  {@code sha256}-style spellings are accepted
     * @return hex digest, or the error that stopped canonicalization or hashing
     */
    public static Result<String> canonicalHash(JsonValue value, String algorithm) {
        return Result.of(() -> defaultCanonicalizer.digest(value, algorithm).hex());
    }

    /**
     * {@link #canonicalHash(JsonValue, String)} with {@value #DEFAULT_ALGORITHM}.
     */
    public static Result<String> canonicalHash(JsonValue value) {
        return canonicalHash(value, DEFAULT_ALGORITHM);
    }

    /**
     * Whether two values have byte-identical canonical forms.
     *
     * <p> {@code {"a":1,"b":2}} equals {@code {"b":2.0,"a":1}}; the string {@code "1"} never equals the number
     * {@code 1}. A failure on either side is returned as the error; it never turns into {@code false}.
     */
    public static Result<Boolean> canonicallyEqual(JsonValue a, JsonValue b) {
        return Result.of(() -> defaultCanonicalizer.equal(a, b));
    }

    /**
     * Size of the canonical form in UTF-8 bytes.
     */
    public static Result<Integer> canonicalSize(JsonValue value) {
        return Result.of(() -> defaultCanonicalizer.canonicalize(value).length);
    }

    /**
     * Whether {@code json} is already in canonical form, i.e. it parses and canonicalizes back to the same text.
     *
     * @param json JSON text, not {@code null}
     * @return {@code false} for non-canonical or invalid input
     */
    public static boolean isCanonical(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return defaultCanonicalizer.canonicalizeToString(defaultReader.read(json)).equals(json);
        } catch (Exception e) {
            LOG.finer(() -> "Not canonical: " + e.getMessage());
            return false;
        }
    }

    /**
     * Parse JSON text into a value tree. Duplicate object keys are kept and reported later by the canonicalizer.
     *
     * @param json JSON text, not {@code null}
     * @return value tree
     * @throws SyntaxException if the text is not valid JSON
     */
    public static JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        return defaultReader.read(json);
    }

    static Canonicalizer defaultCanonicalizer() {
        return defaultCanonicalizer;
    }

    // ============================================================
    // Canonicalizer
    // ============================================================

    /**
     * Kinds of canonicalization failure.
     */
    public enum ErrorKind {
        /**
         * A number is NaN or infinite.
         */
        INVALID_NUMBER,
        /**
         * An object holds the same key twice.
         */
        DUPLICATE_KEY,
        /**
         * A value outside the six JSON variants reached the canonicalizer.
         */
        UNSUPPORTED_TYPE,
        /**
         * Arrays and objects are nested deeper than the configured limit.
         */
        DEPTH_EXCEEDED,
        /**
         * A string or key contains an unpaired UTF-16 surrogate.
         */
        INVALID_STRING,
        /**
         * The requested digest algorithm is not available.
         */
        UNSUPPORTED_ALGORITHM
    }

    /**
     * Immutable, thread-safe RFC 8785 serializer.
     *
     * <p> The tree is walked with an explicit work stack, so nesting is bounded by {@code maxDepth} rather than by the
     * thread stack size.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var canonicalizer = Jcs.Canonicalizer.builder().maxDepth(64).build();
     * String text = canonicalizer.canonicalizeToString(value);
     * }</pre>
     */
    public static final class Canonicalizer {

        private static final Comparator<JsonObject.Member> KEY_ORDER = Comparator.comparing(JsonObject.Member::key);

        private static final Map<String, String> ALGORITHM_ALIASES = Map.of(
                "sha1", "SHA-1",
                "sha224", "SHA-224",
                "sha256", "SHA-256",
                "sha384", "SHA-384",
                "sha512", "SHA-512");

        private final int maxDepth;

        /**
         * @param maxDepth deepest allowed nesting of arrays and objects, {@code null} for the default
         */
        @Builder(toBuilder = true)
        private Canonicalizer(@Nullable Integer maxDepth) {
            this.maxDepth = maxDepth != null ? maxDepth : defaultMaxDepth();
            if (this.maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + this.maxDepth);
        }

        public int maxDepth() {
            return maxDepth;
        }

        /**
         * @throws CanonicalizationException if the tree violates the JSON data model
         */
        public byte[] canonicalize(JsonValue value) {
            return canonicalizeToString(value).getBytes(StandardCharsets.UTF_8);
        }

        /**
         * @throws CanonicalizationException if the tree violates the JSON data model
         */
        public String canonicalizeToString(JsonValue value) {
            var out = new StringBuilder();
            write(out, value);
            return out.toString();
        }

        /**
         * @throws CanonicalizationException if the tree violates the JSON data model or the algorithm is unknown
         */
        public Digest digest(JsonValue value, String algorithm) {
            Objects.requireNonNull(algorithm, "algorithm");
            var md = messageDigest(algorithm);
            // getAlgorithm() echoes the caller's spelling; JCA names are case-insensitive
            return new Digest(md.getAlgorithm().toUpperCase(Locale.ROOT), md.digest(canonicalize(value)));
        }

        /**
         * @throws CanonicalizationException if either tree violates the JSON data model
         */
        public boolean equal(JsonValue a, JsonValue b) {
            return Arrays.equals(canonicalize(a), canonicalize(b));
        }

        static MessageDigest messageDigest(String algorithm) {
            var name = algorithm.trim();
            try {
                return MessageDigest.getInstance(ALGORITHM_ALIASES.getOrDefault(name.toLowerCase(Locale.ROOT), name));
            } catch (NoSuchAlgorithmException e) {
                throw new CanonicalizationException(
                        ErrorKind.UNSUPPORTED_ALGORITHM, "No digest algorithm named '" + algorithm + "'", "$", e);
            }
        }

        void write(StringBuilder out, JsonValue root) {
            var stack = new ArrayDeque<Frame>();
            int nodes = emit(out, root, stack, null, 0);
            while (!stack.isEmpty()) {
                var top = stack.peek();
                if (top.next == top.size()) {
                    out.append(top.close());
                    stack.pop();
                    continue;
                }
                int i = top.next++;
                if (i > 0) out.append(',');
                if (top instanceof ObjectFrame of) {
                    var member = of.members.get(i);
                    try {
                        StringEscaper.escapeTo(out, member.key());
                    } catch (CanonicalizationException e) {
                        throw e.at(pathOf(top, i));
                    }
                    out.append(':');
                    nodes += emit(out, member.value(), stack, top, i);
                } else {
                    nodes += emit(out, ((ArrayFrame) top).elements.get(i), stack, top, i);
                }
            }
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer("Canonicalized " + nodes + " nodes into " + out.length() + " chars");
            }
        }

        /**
         * Writes a scalar, or the opening bracket of a container and pushes its frame.
         */
        private int emit(StringBuilder out, JsonValue v, ArrayDeque<Frame> stack, @Nullable Frame parent, int index) {
            if (v instanceof JsonNull) {
                out.append("null");
            } else if (v instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
            } else if (v instanceof JsonNumber n) {
                try {
                    NumberFormatter.formatTo(out, n.value());
                } catch (CanonicalizationException e) {
                    throw e.at(pathOf(parent, index));
                }
            } else if (v instanceof JsonString s) {
                try {
                    StringEscaper.escapeTo(out, s.value());
                } catch (CanonicalizationException e) {
                    throw e.at(pathOf(parent, index));
                }
            } else if (v instanceof JsonArray a) {
                checkDepth(stack, parent, index);
                out.append('[');
                stack.push(new ArrayFrame(a.value(), parent, index));
            } else if (v instanceof JsonObject o) {
                checkDepth(stack, parent, index);
                out.append('{');
                stack.push(new ObjectFrame(sortedMembers(o, parent, index), parent, index));
            } else {
                throw new CanonicalizationException(
                        ErrorKind.UNSUPPORTED_TYPE,
                        v == null ? "null reference" : "Unknown value type " + v.getClass().getName(),
                        pathOf(parent, index));
            }
            return 1;
        }

        private void checkDepth(ArrayDeque<Frame> stack, @Nullable Frame parent, int index) {
            if (stack.size() >= maxDepth) {
                throw new CanonicalizationException(
                        ErrorKind.DEPTH_EXCEEDED, "Nesting deeper than " + maxDepth, pathOf(parent, index));
            }
        }

        private static List<JsonObject.Member> sortedMembers(JsonObject o, @Nullable Frame parent, int index) {
            var members = new ArrayList<>(o.value());
            members.sort(KEY_ORDER);
            for (int i = 1; i < members.size(); i++) {
                var key = members.get(i).key();
                if (key.equals(members.get(i - 1).key())) {
                    throw new CanonicalizationException(
                            ErrorKind.DUPLICATE_KEY, "Duplicate key \"" + key + "\"", pathOf(parent, index));
                }
            }
            return members;
        }

        private static String pathOf(@Nullable Frame parent, int index) {
            if (parent == null) return "$";
            var frames = new ArrayDeque<Frame>();
            for (var f = parent; f != null; f = f.parent) frames.push(f);
            var sb = new StringBuilder("$");
            Frame prev = null;
            for (var f : frames) {
                if (prev != null) sb.append(prev.segment(f.indexInParent));
                prev = f;
            }
            return sb.append(parent.segment(index)).toString();
        }

        private static int defaultMaxDepth() {
            return Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH);
        }
    }

    private abstract static class Frame {
        final @Nullable Frame parent;
        final int indexInParent;
        int next;

        Frame(@Nullable Frame parent, int indexInParent) {
            this.parent = parent;
            this.indexInParent = indexInParent;
        }

        abstract int size();

        abstract char close();

        abstract String segment(int index);
    }

    private static final class ArrayFrame extends Frame {
        final List<JsonValue> elements;

        ArrayFrame(List<JsonValue> elements, @Nullable Frame parent, int indexInParent) {
            super(parent, indexInParent);
            this.elements = elements;
        }

        @Override
        int size() {
            return elements.size();
        }

        @Override
        char close() {
            return ']';
        }

        @Override
        String segment(int index) {
            return "[" + index + "]";
        }
    }

    private static final class ObjectFrame extends Frame {
        final List<JsonObject.Member> members;

        ObjectFrame(List<JsonObject.Member> members, @Nullable Frame parent, int indexInParent) {
            super(parent, indexInParent);
            this.members = members;
        }

        @Override
        int size() {
            return members.size();
        }

        @Override
        char close() {
            return '}';
        }

        @Override
        String segment(int index) {
            return keySegment(members.get(index).key());
        }
    }

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    static String childPath(String path, String key) {
        return path + keySegment(key);
    }

    private static String keySegment(String key) {
        if (IDENTIFIER.matcher(key).matches()) return "." + key;
        return "[\"" + key.replace("\\", "\\\\").replace("\"", "\\\"") + "\"]";
    }

    /**
     * A digest of canonical bytes.
     *
     * @param algorithm upper-case JCA name of the digest algorithm
     * @param bytes     raw digest
     */
    public record Digest(String algorithm, byte[] bytes) {
        private static final HexFormat HEX_FORMAT = HexFormat.of();

        public Digest {
            Objects.requireNonNull(algorithm, "algorithm");
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        /**
         * Lowercase hex, the stable textual form returned by {@link Jcs#canonicalHash(JsonValue, String)}.
         */
        public String hex() {
            return HEX_FORMAT.formatHex(bytes);
        }

        public String base64() {
            return Base64.getEncoder().encodeToString(bytes);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Digest other)) return false;
            return algorithm.equals(other.algorithm) && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return algorithm + ":" + hex();
        }
    }

    // ============================================================
    // Lexer / Reader
    // ============================================================

    enum Token {
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COLON,
        COMMA,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EOF
    }

    /**
     * Single-token lookahead scanner. {@link #peek()} answers {@link #END} past the last character, so no read
     * can run off the input.
     */
    static final class Lexer {
        private static final int END = -1;

        private final String text;
        private int pos;
        private int line = 1;
        private int lineStart;
        private Token current;
        private String stringValue;
        private String numberLexeme;

        Lexer(String text) {
            this.text = Objects.requireNonNull(text, "text");
            advance();
        }

        Token current() {
            return current;
        }

        String string() {
            return stringValue;
        }

        String number() {
            return numberLexeme;
        }

        int line() {
            return line;
        }

        int col() {
            return pos - lineStart + 1;
        }

        void advance() {
            skipWhitespace();
            int c = peek();
            if (c == END) {
                current = Token.EOF;
                return;
            }
            var punctuation = punctuation((char) c);
            if (punctuation != null) {
                pos++;
                current = punctuation;
                return;
            }
            switch (c) {
                case '"' -> {
                    stringValue = readString();
                    current = Token.STRING;
                }
                case 't' -> current = literal("true", Token.TRUE);
                case 'f' -> current = literal("false", Token.FALSE);
                case 'n' -> current = literal("null", Token.NULL);
                default -> {
                    if (c != '-' && !isDigit(c)) throw error("Unexpected character '" + (char) c + "'");
                    numberLexeme = readNumber();
                    current = Token.NUMBER;
                }
            }
        }

        private static @Nullable Token punctuation(char c) {
            return switch (c) {
                case '{' -> Token.LBRACE;
                case '}' -> Token.RBRACE;
                case '[' -> Token.LBRACKET;
                case ']' -> Token.RBRACKET;
                case ':' -> Token.COLON;
                case ',' -> Token.COMMA;
                default -> null;
            };
        }

        private void skipWhitespace() {
            for (int c = peek(); c == ' ' || c == '\t' || c == '\r' || c == '\n'; c = peek()) {
                pos++;
                if (c == '\n') {
                    line++;
                    lineStart = pos;
                }
            }
        }

        private String readString() {
            pos++; // opening quote
            var sb = new StringBuilder();
            while (true) {
                int c = next();
                if (c == END) throw error("Unterminated string");
                if (c == '"') return sb.toString();
                if (c == '\\') {
                    readEscape(sb);
                } else if (c < 0x20) {
                    throw error(String.format("Unescaped control character U+%04X in string", c));
                } else {
                    sb.append((char) c);
                }
            }
        }

        private void readEscape(StringBuilder sb) {
            int e = next();
            switch (e) {
                case '"', '\\', '/' -> sb.append((char) e);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> readUnicodeEscape(sb);
                case END -> throw error("Unterminated escape sequence");
                default -> throw error("Invalid escape sequence '\\" + (char) e + "'");
            }
        }

        /**
         * Reads the four hex digits after a backslash-u. A high surrogate must be followed by an escaped low
         * surrogate, because the pair only has a UTF-8 form together.
         */
        private void readUnicodeEscape(StringBuilder sb) {
            char high = readHex4();
            if (!Character.isSurrogate(high)) {
                sb.append(high);
                return;
            }
            if (Character.isLowSurrogate(high)) throw error("Low surrogate escape without a preceding high surrogate");
            if (!lookingAt("\\u")) throw error("High surrogate escape not followed by a low surrogate escape");
            pos += 2;
            char low = readHex4();
            if (!Character.isLowSurrogate(low)) {
                throw error("High surrogate escape not followed by a low surrogate escape");
            }
            sb.append(high).append(low);
        }

        private char readHex4() {
            if (pos + 4 > text.length()) throw error("Truncated \\u escape sequence");
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                int digit = hexDigit(text.charAt(pos++));
                if (digit < 0) throw error("Invalid hex digit in \\u escape sequence");
                cp = cp << 4 | digit;
            }
            return (char) cp;
        }

        private static int hexDigit(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return c - 'a' + 10;
            if (c >= 'A' && c <= 'F') return c - 'A' + 10;
            return -1;
        }

        private Token literal(String word, Token token) {
            if (!lookingAt(word)) throw error("Invalid literal, expected '" + word + "'");
            pos += word.length();
            return token;
        }

        /**
         * RFC 8259 number grammar: no leading zeros, no bare dot, no leading plus.
         */
        private String readNumber() {
            int start = pos;
            if (peek() == '-') pos++;
            if (peek() == '0') pos++;
            else if (!skipDigits()) throw error("Invalid number, expected a digit");
            if (peek() == '.') {
                pos++;
                if (!skipDigits()) throw error("Invalid number, expected a digit after '.'");
            }
            if (peek() == 'e' || peek() == 'E') {
                pos++;
                if (peek() == '+' || peek() == '-') pos++;
                if (!skipDigits()) throw error("Invalid number, expected an exponent digit");
            }
            return text.substring(start, pos);
        }

        private boolean skipDigits() {
            int start = pos;
            while (isDigit(peek())) pos++;
            return pos > start;
        }

        private static boolean isDigit(int c) {
            return c >= '0' && c <= '9';
        }

        private boolean lookingAt(String prefix) {
            return text.startsWith(prefix, pos);
        }

        private int peek() {
            return pos < text.length() ? text.charAt(pos) : END;
        }

        private int next() {
            int c = peek();
            if (c != END) pos++;
            return c;
        }

        private SyntaxException error(String message) {
            return new SyntaxException(message, line, col());
        }
    }

    /**
     * Strict RFC 8259 reader producing {@link JsonValue} trees.
     *
     * <p> Object members keep their order and duplicates. Numbers are read as doubles, so a literal such as
     * {@code 1e400} becomes an infinite {@link JsonNumber} that canonicalization later rejects.
     */
    public static final class Reader {

        private final int maxDepth;

        /**
         * @param maxDepth deepest allowed nesting of arrays and objects, {@code null} for the default
         */
        @Builder(toBuilder = true)
        private Reader(@Nullable Integer maxDepth) {
            this.maxDepth = maxDepth != null ? maxDepth : Canonicalizer.defaultMaxDepth();
            if (this.maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive, got " + this.maxDepth);
        }

        public int maxDepth() {
            return maxDepth;
        }

        /**
         * @throws SyntaxException if the text is not a single valid JSON value
         */
        public JsonValue read(String json) {
            var lexer = new Lexer(json);
            var v = parseValue(lexer, 0);
            if (lexer.current() != Token.EOF) error(lexer, "Trailing data after JSON value");
            return v;
        }

        private JsonValue parseValue(Lexer lexer, int depth) {
            switch (lexer.current()) {
                case LBRACE -> {
                    return parseObject(lexer, enter(lexer, depth));
                }
                case LBRACKET -> {
                    return parseArray(lexer, enter(lexer, depth));
                }
                case STRING -> {
                    var s = lexer.string();
                    lexer.advance();
                    return new JsonString(s);
                }
                case NUMBER -> {
                    var n = lexer.number();
                    lexer.advance();
                    return new JsonNumber(Double.parseDouble(n));
                }
                case TRUE -> {
                    lexer.advance();
                    return new JsonBoolean(true);
                }
                case FALSE -> {
                    lexer.advance();
                    return new JsonBoolean(false);
                }
                case NULL -> {
                    lexer.advance();
                    return new JsonNull();
                }
                default -> {
                    error(lexer, "Unexpected token: " + lexer.current());
                    return null;
                }
            }
        }

        private int enter(Lexer lexer, int depth) {
            if (depth >= maxDepth) error(lexer, "Nesting deeper than " + maxDepth);
            return depth + 1;
        }

        private JsonObject parseObject(Lexer lexer, int depth) {
            expect(lexer, Token.LBRACE);
            var members = new ArrayList<JsonObject.Member>();
            if (accept(lexer, Token.RBRACE)) return new JsonObject(members);
            do {
                if (lexer.current() != Token.STRING) error(lexer, "Expected string key");
                var key = lexer.string();
                lexer.advance();
                expect(lexer, Token.COLON);
                members.add(new JsonObject.Member(key, parseValue(lexer, depth)));
            } while (accept(lexer, Token.COMMA));
            expect(lexer, Token.RBRACE);
            return new JsonObject(members);
        }

        private JsonArray parseArray(Lexer lexer, int depth) {
            expect(lexer, Token.LBRACKET);
            var values = new ArrayList<JsonValue>();
            if (accept(lexer, Token.RBRACKET)) return new JsonArray(values);
            do {
                values.add(parseValue(lexer, depth));
            } while (accept(lexer, Token.COMMA));
            expect(lexer, Token.RBRACKET);
            return new JsonArray(values);
        }

        private static void expect(Lexer lexer, Token t) {
            if (lexer.current() != t) error(lexer, "Expected " + t + " but found " + lexer.current());
            lexer.advance();
        }

        private static boolean accept(Lexer lexer, Token t) {
            if (lexer.current() != t) return false;
            lexer.advance();
            return true;
        }

        private static void error(Lexer lexer, String msg) {
            throw new SyntaxException(msg, lexer.line(), lexer.col());
        }
    }

    // ============================================================
    // Extension point
    // ============================================================

    /**
     * Turns objects of some foreign model into value trees for {@link JsonValue#fromJavaObject(Object)}.
     *
     * <p> Implementations are discovered with {@link ServiceLoader} from
     * {@code META-INF/services/jcs.Jcs$Converter}.
     */
    public interface Converter {
        boolean canConvert(Object o);

        JsonValue convert(Object o);
    }

    static List<Converter> converters() {
        return ConvertersHolder.INSTANCE;
    }

    private static final class ConvertersHolder {
        private static final List<Converter> INSTANCE = loadConverters();
    }

    static List<Converter> loadConverters() {
        var converters = new ArrayList<Converter>();
        for (var c : ServiceLoader.load(Converter.class)) converters.add(c);
        LOG.fine(() -> "Loaded converters: " + converters);
        return List.copyOf(converters);
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name, false, Jcs.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    // ============================================================
    // Result
    // ============================================================

    /**
     * Outcome of a canonicalization call: either {@link Ok} with a value or {@link Err} with the failure.
     *
     * <pre>{@code
     * var result = Jcs.canonicalHash(value);
     * if (result instanceof Jcs.Result.Err<String> err) {
     *     log(err.exception().getKind(), err.exception().getPath());
     * }
     * }</pre>
     *
     * @param <T> value type
     */
    public sealed interface Result<T> permits Result.Ok, Result.Err {

        record Ok<T>(T value) implements Result<T> {}

        record Err<T>(CanonicalizationException exception) implements Result<T> {
            public Err {
                Objects.requireNonNull(exception, "exception");
            }
        }

        static <T> Result<T> of(Supplier<? extends T> body) {
            try {
                return new Ok<>(body.get());
            } catch (CanonicalizationException e) {
                LOG.fine(() -> "Canonicalization failed: " + e.getMessage());
                return new Err<>(e);
            }
        }

        default boolean isOk() {
            return this instanceof Ok;
        }

        /**
         * @throws CanonicalizationException the failure, if this is an {@link Err}
         */
        default T orElseThrow() {
            if (this instanceof Ok<T> ok) return ok.value();
            throw ((Err<T>) this).exception();
        }

        default Optional<CanonicalizationException> error() {
            return this instanceof Err<T> err ? Optional.of(err.exception()) : Optional.empty();
        }

        default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            if (this instanceof Ok<T> ok) return new Ok<>(mapper.apply(ok.value()));
            return new Err<>(((Err<T>) this).exception());
        }
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base of all jcs4j failures.
     *
     * @since 0.1.0
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A value tree that has no canonical form, or a digest that cannot be computed.
     *
     * <p> {@link #getPath()} locates the offending node, e.g. {@code $.items[2].price}.
     *
     * @since 0.1.0
     */
    public static class CanonicalizationException extends Exception {
        private final ErrorKind kind;
        private final String detail;
        private final String path;

        public CanonicalizationException(ErrorKind kind, String detail, String path) {
            super(kind + " at " + path + ": " + detail);
            this.kind = kind;
            this.detail = detail;
            this.path = path;
        }

        public CanonicalizationException(ErrorKind kind, String detail, String path, Throwable cause) {
            super(kind + " at " + path + ": " + detail, cause);
            this.kind = kind;
            this.detail = detail;
            this.path = path;
        }

        public ErrorKind getKind() {
            return kind;
        }

        public String getDetail() {
            return detail;
        }

        public String getPath() {
            return path;
        }

        /**
         * Same failure, reported at {@code path}.
         */
        CanonicalizationException at(String path) {
            return new CanonicalizationException(kind, detail, path, getCause());
        }
    }

    /**
     * JSON text that is not well-formed.
     *
     * @since 0.1.0
     */
    public static class SyntaxException extends Exception {
        private final int line;
        private final int column;

        public SyntaxException(String message, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * A Java object graph that cannot be turned into a value tree.
     *
     * @since 0.1.0
     */
    public static class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
