package jcs;

import static jcs.JsonObject.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JcsTest extends JcsLoggingConfig {

    static final String RFC_INPUT = """
            {
              "numbers": [333333333.33333329, 1E30, 4.50, 2e-3, 0.000000000000000000000000001],
              "string": "\\u20ac$\\u000F\\u000aA'\\u0042\\u0022\\u005c\\\\\\"\\/",
              "literals": [null, true, false]
            }
            """;

    static final String RFC_OUTPUT =
            "{\"literals\":[null,true,false],\"numbers\":[333333333.3333333,1e+30,4.5,0.002,1e-27],"
                    + "\"string\":\"€$\\u000f\\nA'B\\\"\\\\\\\\\\\"/\"}";

    static String canonical(String json) {
        return Jcs.jcs(Jcs.parse(json)).orElseThrow();
    }

    static Jcs.CanonicalizationException failure(Jcs.Result<?> result) {
        assertThat(result.isOk()).as("expected a failed result").isFalse();
        return result.error().orElseThrow();
    }

    static JsonValue nestedArrays(int depth) {
        JsonValue v = new JsonNumber(1);
        for (int i = 0; i < depth; i++) v = JsonArray.of(v);
        return v;
    }

    @Nested
    class CanonicalizeTests {

        @Test
        void canonicalize() {
            // @spotless:off
            var table = new Object[][] {
                    {"null", "null"},
                    {"true", "true"},
                    {"false", "false"},
                    {"1.0", "1"},
                    {"-0.0", "0"},
                    {"1e21", "1e+21"},
                    {"1E-7", "1e-7"},
                    {"\"a\\/b\"", "\"a/b\""},
                    {"\"\\u00e9\"", "\"é\""},
                    {"[]", "[]"},
                    {"{}", "{}"},
                    {" [ 1 , 2 , 3 ] ", "[1,2,3]"},
                    {"[3, 1, 2]", "[3,1,2]"},
                    {"{\"b\": 2, \"a\": 1}", "{\"a\":1,\"b\":2}"},
                    {"{\"a\": 1, \"b\": 2}", "{\"a\":1,\"b\":2}"},
                    {"{\"b\":[1,{\"d\":true,\"c\":null}],\"a\":\"x\"}", "{\"a\":\"x\",\"b\":[1,{\"c\":null,\"d\":true}]}"},
                    {"{\"a\":{},\"b\":[],\"c\":[{}]}", "{\"a\":{},\"b\":[],\"c\":[{}]}"},
                    {"{\"10\":1,\"9\":2,\"A\":3,\"a\":4,\"\":5}", "{\"\":5,\"10\":1,\"9\":2,\"A\":3,\"a\":4}"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(canonical((String) row[0]))
                        .as("Case %d: input=%s", i, row[0])
                        .isEqualTo(row[1]);
            }));
        }

        @Test
        void rfc8785Example() {
            var bytes = Jcs.canonicalize(Jcs.parse(RFC_INPUT)).orElseThrow();
            assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo(RFC_OUTPUT);
        }

        @Test
        void keysSortByUtf16CodeUnits() {
            var v = JsonObject.of(
                    member("\u20ac", new JsonString("Euro Sign")),
                    member("\r", new JsonString("Carriage Return")),
                    member("\ufb33", new JsonString("Hebrew Letter Dalet With Dagesh")),
                    member("1", new JsonString("One")),
                    member("\ud83d\ude00", new JsonString("Emoji: Grinning Face")),
                    member("\u0080", new JsonString("Control")),
                    member("\u00f6", new JsonString("Latin Small Letter O With Diaeresis")));

            // U+1F600 is above U+FB33 as a code point but its high surrogate D83D sorts first
            assertThat(Jcs.jcs(v).orElseThrow())
                    .isEqualTo("{\"\\r\":\"Carriage Return\",\"1\":\"One\",\"\u0080\":\"Control\","
                            + "\"\u00f6\":\"Latin Small Letter O With Diaeresis\",\"\u20ac\":\"Euro Sign\","
                            + "\"\ud83d\ude00\":\"Emoji: Grinning Face\","
                            + "\"\ufb33\":\"Hebrew Letter Dalet With Dagesh\"}");
        }

        @Test
        void outputIsUtf8() {
            var bytes = Jcs.canonicalize(new JsonString("€😀")).orElseThrow();
            assertThat(bytes).containsExactly(
                    0x22, 0xE2, 0x82, 0xAC, 0xF0, 0x9F, 0x98, 0x80, 0x22);
        }

        @Test
        void isDeterministic() {
            var v = Jcs.parse(RFC_INPUT);
            assertThat(Jcs.canonicalize(v).orElseThrow()).isEqualTo(Jcs.canonicalize(v).orElseThrow());
        }

        @Test
        void keyOrderDoesNotMatter() {
            var ab = new LinkedHashMap<String, JsonValue>();
            ab.put("a", new JsonNumber(1));
            ab.put("b", new JsonNumber(2));
            var ba = new LinkedHashMap<String, JsonValue>();
            ba.put("b", new JsonNumber(2));
            ba.put("a", new JsonNumber(1));

            var first = Jcs.canonicalize(JsonObject.of(ab)).orElseThrow();
            var second = Jcs.canonicalize(JsonObject.of(ba)).orElseThrow();
            assertThat(first).isEqualTo(second);
            assertThat(new String(first, StandardCharsets.UTF_8)).isEqualTo("{\"a\":1,\"b\":2}");
        }

        @Test
        void isIdempotent() {
            var once = Jcs.canonicalize(Jcs.parse(RFC_INPUT)).orElseThrow();
            var twice = Jcs.canonicalize(Jcs.parse(new String(once, StandardCharsets.UTF_8))).orElseThrow();
            assertThat(twice).isEqualTo(once);
        }

        @Test
        void stringifyIsCanonical() {
            assertThat(Jcs.parse("{\"b\": [1.0, \"x\"], \"a\": null}").stringify())
                    .isEqualTo("{\"a\":null,\"b\":[1,\"x\"]}");
            assertThat(new JsonNumber(1e21).stringify()).isEqualTo("1e+21");
            assertThat(new JsonString("\t").stringify()).isEqualTo("\"\\t\"");
            assertThat(new JsonBoolean(false).stringify()).isEqualTo("false");
            assertThat(new JsonNull().stringify()).isEqualTo("null");
        }

        @Test
        void deepTreeDoesNotUseThreadStack() {
            var canonicalizer = Jcs.Canonicalizer.builder().maxDepth(200_000).build();
            var text = canonicalizer.canonicalizeToString(nestedArrays(100_000));
            assertThat(text).hasSize(200_001).startsWith("[[[[").endsWith("]]]]");
            assertThat(text.charAt(100_000)).isEqualTo('1');
        }
    }

    @Nested
    class ErrorTests {

        @Test
        void nanIsInvalidNumber() {
            var e = failure(Jcs.canonicalize(JsonObject.of(member("x", new JsonNumber(Double.NaN)))));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.INVALID_NUMBER);
            assertThat(e.getPath()).isEqualTo("$.x");
        }

        @Test
        void nestedInfinityReportsPath() {
            var v = JsonObject.of(member(
                    "a",
                    JsonArray.of(
                            new JsonNumber(1),
                            JsonObject.of(member("odd key", new JsonNumber(Double.NEGATIVE_INFINITY))))));
            var e = failure(Jcs.canonicalize(v));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.INVALID_NUMBER);
            assertThat(e.getPath()).isEqualTo("$.a[1][\"odd key\"]");
            assertThat(e).hasMessage("INVALID_NUMBER at $.a[1][\"odd key\"]: -Infinity is not a valid JSON number");
        }

        @Test
        void overflowingLiteralIsInvalidNumber() {
            var e = failure(Jcs.canonicalize(Jcs.parse("[1e400]")));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.INVALID_NUMBER);
            assertThat(e.getPath()).isEqualTo("$[0]");
        }

        @Test
        void duplicateKeyIsRejected() {
            var e = failure(Jcs.canonicalize(Jcs.parse("{\"a\":1,\"b\":2,\"a\":1}")));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.DUPLICATE_KEY);
            assertThat(e.getPath()).isEqualTo("$");
            assertThat(e.getDetail()).isEqualTo("Duplicate key \"a\"");
        }

        @Test
        void nestedDuplicateKeyReportsPath() {
            var e = failure(Jcs.canonicalize(Jcs.parse("{\"outer\":[{\"k\":1,\"k\":2}]}")));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.DUPLICATE_KEY);
            assertThat(e.getPath()).isEqualTo("$.outer[0]");
        }

        @Test
        void depthBeyondLimitIsRejected() {
            var canonicalizer = Jcs.Canonicalizer.builder().maxDepth(3).build();
            assertThat(canonicalizer.canonicalizeToString(nestedArrays(3))).isEqualTo("[[[1]]]");
            assertThatThrownBy(() -> canonicalizer.canonicalize(nestedArrays(4)))
                    .isInstanceOfSatisfying(Jcs.CanonicalizationException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.DEPTH_EXCEEDED);
                        assertThat(e.getPath()).isEqualTo("$[0][0][0]");
                    });
        }

        @Test
        void defaultDepthLimit() {
            assertThat(Jcs.canonicalize(nestedArrays(Jcs.DEFAULT_MAX_DEPTH)).isOk()).isTrue();
            var e = failure(Jcs.canonicalize(nestedArrays(Jcs.DEFAULT_MAX_DEPTH + 1)));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.DEPTH_EXCEEDED);
        }

        @Test
        void nullReferenceIsUnsupportedType() {
            var e = failure(Jcs.canonicalize(null));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.UNSUPPORTED_TYPE);
            assertThat(e.getPath()).isEqualTo("$");
        }

        @Test
        void unpairedSurrogateInKeyIsInvalidString() {
            var v = JsonObject.of(member("ok", JsonObject.of(member("\uD800", new JsonNull()))));
            var e = failure(Jcs.canonicalize(v));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.INVALID_STRING);
            assertThat(e.getPath()).startsWith("$.ok[");
        }

        @Test
        void resultOrElseThrowRethrows() {
            var result = Jcs.canonicalize(JsonArray.of(new JsonNumber(Double.NaN)));
            assertThat(result).isInstanceOf(Jcs.Result.Err.class);
            assertThatThrownBy(result::orElseThrow)
                    .isInstanceOf(Jcs.CanonicalizationException.class)
                    .hasMessageStartingWith("INVALID_NUMBER at $[0]");
            assertThat(result.map(bytes -> bytes.length).isOk()).isFalse();
        }

        @Test
        void nullMembersAreRefusedAtConstruction() {
            var values = new ArrayList<JsonValue>();
            values.add(null);
            assertThatThrownBy(() -> new JsonArray(values)).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> member(null, new JsonNull())).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class HashTests {

        @Test
        void canonicalHash() {
            // @spotless:off
            var table = new Object[][] {
                    {"{\"b\":2,\"a\":1}", "SHA-256", "43258cff783fe7036d8a43033f830adfc60ec037382473548ac742b888292777"},
                    {"{\"a\":1,\"b\":2.0}", "sha-256", "43258cff783fe7036d8a43033f830adfc60ec037382473548ac742b888292777"},
                    {"{\"a\":1,\"b\":2}", "sha256", "43258cff783fe7036d8a43033f830adfc60ec037382473548ac742b888292777"},
                    {"{ \"id\" : 123 }", "SHA-256", "185a5203b0ed48bd8b816a8355aa98bc2bbf370ca200b42ddc752c241c673c2a"},
                    {"{\"id\":123}", "MD5", "07925d389335c0229b97393df477a438"},
                    {"[ ]", "SHA-256", "4f53cda18c2baa0c0354bb5f9a3ecbe5ed12ab4d8e11ba873c2f11161202b945"},
                    {"1.0", "SHA-256", "6b86b273ff34fce19d6b804eff5a3f5747ada4eaa22f1d49c01e52ddb7875b4b"},
                    {"\"1\"", "SHA-256", "391552c099c101b131feaf24c5795a6a15bc8ec82015424e0d2b4274a369a0bf"},
                    {RFC_INPUT, "SHA-256", "2d5e01a318d0f0879ab568c4be289c8b1f64ef8921a53c6277d5e069978baacb"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(Jcs.canonicalHash(Jcs.parse((String) row[0]), (String) row[1]).orElseThrow())
                        .as("Case %d: input=%s, algorithm=%s", i, row[0], row[1])
                        .isEqualTo(row[2]);
            }));
        }

        @Test
        void defaultAlgorithmIsSha256() {
            var v = Jcs.parse("{\"a\":1,\"b\":2}");
            assertThat(Jcs.canonicalHash(v).orElseThrow())
                    .isEqualTo(Jcs.canonicalHash(v, "SHA-256").orElseThrow());
        }

        @Test
        void sha512() {
            assertThat(Jcs.canonicalHash(Jcs.parse("{\"a\":1,\"b\":2}"), "SHA-512").orElseThrow())
                    .hasSize(128)
                    .startsWith("b5da773f945631ed");
        }

        @Test
        void digestExposesBytesAndBase64() {
            var digest = Jcs.Canonicalizer.builder().build().digest(Jcs.parse("{}"), "SHA-256");
            var expected = HexFormat.of().parseHex("44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a");
            assertThat(digest.algorithm()).isEqualTo("SHA-256");
            assertThat(digest.bytes()).isEqualTo(expected);
            assertThat(digest.base64()).isEqualTo(Base64.getEncoder().encodeToString(expected));
            assertThat(digest).hasToString("SHA-256:" + digest.hex());
            assertThat(digest).isEqualTo(new Jcs.Digest("SHA-256", expected));
        }

        @Test
        void algorithmNameIsNormalized() {
            var canonicalizer = Jcs.Canonicalizer.builder().build();
            var v = Jcs.parse("{\"a\":1}");
            var upper = canonicalizer.digest(v, "SHA-256");

            assertThat(canonicalizer.digest(v, "sha-256")).isEqualTo(upper).hasToString(upper.toString());
            assertThat(canonicalizer.digest(v, "sha256").algorithm()).isEqualTo("SHA-256");
            assertThat(canonicalizer.digest(v, "md5").algorithm()).isEqualTo("MD5");
        }

        @Test
        void unknownAlgorithm() {
            var e = failure(Jcs.canonicalHash(new JsonNull(), "NOPE-1"));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.UNSUPPORTED_ALGORITHM);
            assertThat(e).hasMessageContaining("NOPE-1");
        }

        @Test
        void invalidValueIsNotHashed() {
            var e = failure(Jcs.canonicalHash(JsonArray.of(new JsonNumber(Double.POSITIVE_INFINITY))));
            assertThat(e.getKind()).isEqualTo(Jcs.ErrorKind.INVALID_NUMBER);
        }

        @Test
        void stableAcrossThreads() throws Exception {
            var v = Jcs.parse(RFC_INPUT);
            var pool = Executors.newFixedThreadPool(8);
            try {
                var tasks = new ArrayList<Callable<String>>();
                for (int i = 0; i < 200; i++) {
                    tasks.add(() -> Jcs.canonicalHash(v).orElseThrow());
                }
                var hashes = new HashSet<String>();
                for (Future<String> f : pool.invokeAll(tasks)) hashes.add(f.get());
                assertThat(hashes).containsExactly("2d5e01a318d0f0879ab568c4be289c8b1f64ef8921a53c6277d5e069978baacb");
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    class EqualityTests {

        @Test
        void canonicallyEqual() {
            // @spotless:off
            var table = new Object[][] {
                    {"{\"a\":1,\"b\":2}", "{\"b\":2.0,\"a\":1.0}", true},
                    {"1", "1.0", true},
                    {"100", "1e2", true},
                    {"0", "-0", true},
                    {"\"é\"", "\"\\u00e9\"", true},
                    {"{\"x\":[1,{\"y\":null}]}", "{ \"x\" : [ 1.00 , { \"y\" : null } ] }", true},
                    {"\"1\"", "1", false},
                    {"[1,2]", "[2,1]", false},
                    {"null", "false", false},
                    {"{}", "[]", false},
                    {"{\"a\":1}", "{\"a\":1,\"b\":2}", false},
                    {"0.1", "0.10000000000000001", true},
                    {"0.1", "0.1000000000000001", false},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var result = Jcs.canonicallyEqual(Jcs.parse((String) row[0]), Jcs.parse((String) row[1]));
                assertThat(result.orElseThrow())
                        .as("Case %d: %s vs %s", i, row[0], row[1])
                        .isEqualTo(row[2]);
            }));
        }

        @Test
        void errorsPropagateInsteadOfFalse() {
            var good = Jcs.parse("{\"a\":1}");
            var bad = JsonObject.of(member("a", new JsonNumber(Double.NaN)));
            assertThat(failure(Jcs.canonicallyEqual(good, bad)).getKind()).isEqualTo(Jcs.ErrorKind.INVALID_NUMBER);
            assertThat(failure(Jcs.canonicallyEqual(bad, good)).getPath()).isEqualTo("$.a");
        }
    }

    @Nested
    class ValidationTests {

        @Test
        void isCanonical() {
            // @spotless:off
            var table = new Object[][] {
                    {"{\"a\":1,\"b\":2}", true},
                    {"1", true},
                    {"\"€\"", true},
                    {RFC_OUTPUT, true},
                    {"{\"b\":2,\"a\":1}", false},
                    {"{\"a\": 1}", false},
                    {" 1", false},
                    {"1.0", false},
                    {"1E+21", false},
                    {"\"\\u20ac\"", false},
                    {"\"\\/\"", false},
                    {"{\"a\":1,\"a\":1}", false},
                    {"not json", false},
                    {"", false},
                    {"\"\\ud83d", false},
                    {"\"\\ud83d\\u00", false},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(Jcs.isCanonical((String) row[0]))
                        .as("Case %d: input=%s", i, row[0])
                        .isEqualTo(row[1]);
            }));
        }

        @Test
        void canonicalSizeCountsUtf8Bytes() {
            assertThat(Jcs.canonicalSize(Jcs.parse(RFC_INPUT)).orElseThrow()).isEqualTo(118);
            assertThat(Jcs.canonicalSize(new JsonString("€")).orElseThrow()).isEqualTo(5);
            assertThat(Jcs.canonicalSize(JsonArray.of()).orElseThrow()).isEqualTo(2);
        }
    }

    @Nested
    class ReaderTests {

        @Test
        void duplicatesArePreserved() {
            var v = (JsonObject) Jcs.parse("{\"a\":1,\"a\":2}");
            assertThat(v.value()).extracting(JsonObject.Member::key).containsExactly("a", "a");
        }

        @Test
        void syntaxErrors() {
            // @spotless:off
            var inputs = List.of(
                    "",
                    "{",
                    "[1,]",
                    "{\"a\":1,}",
                    "{a:1}",
                    "01",
                    "1 2",
                    "'x'",
                    "\"\t\"",
                    "\"\\x\"",
                    "\"\\ud800\"",
                    "NaN",
                    "[1 // comment\n]",
                    "\"\\ud83d",
                    "\"\\ud83d\\u00",
                    "\"\\ud83d\\u0041\"",
                    "\"\\udc00\"",
                    "\"\\u12",
                    "\"abc",
                    "\"\\",
                    "-",
                    "1.",
                    "1e+",
                    "tru");
            // @spotless:on

            assertAll(inputs.stream().map(input -> () -> assertThatThrownBy(() -> Jcs.parse(input))
                    .as("input=%s", input)
                    .isInstanceOf(Jcs.SyntaxException.class)));
        }

        @Test
        void syntaxErrorReportsLine() {
            assertThatThrownBy(() -> Jcs.parse("{\n  \"a\": }"))
                    .isInstanceOfSatisfying(Jcs.SyntaxException.class, e -> assertThat(e.getLine())
                            .isEqualTo(2));
        }

        @Test
        void readerDepthLimit() {
            var reader = Jcs.Reader.builder().maxDepth(2).build();
            assertThat(reader.read("[[1]]")).isEqualTo(JsonArray.of(JsonArray.of(new JsonNumber(1))));
            assertThatThrownBy(() -> reader.read("[[[1]]]"))
                    .isInstanceOf(Jcs.SyntaxException.class)
                    .hasMessageContaining("Nesting deeper than 2");
        }

        @Test
        void surrogatePairEscapes() {
            assertThat(Jcs.parse("\"\\ud83d\\ude00\"")).isEqualTo(new JsonString("😀"));
        }
    }

    @Nested
    class ConfigurationTests {

        @Test
        void builderDefaults() {
            assertThat(Jcs.Canonicalizer.builder().build().maxDepth()).isEqualTo(Jcs.DEFAULT_MAX_DEPTH);
            assertThat(Jcs.Reader.builder().build().maxDepth()).isEqualTo(Jcs.DEFAULT_MAX_DEPTH);
        }

        @Test
        void systemPropertyOverridesDefault() {
            System.setProperty(Jcs.MAX_DEPTH_PROPERTY, "5");
            try {
                assertThat(Jcs.Canonicalizer.builder().build().maxDepth()).isEqualTo(5);
                assertThat(Jcs.Canonicalizer.builder().maxDepth(7).build().maxDepth()).isEqualTo(7);
            } finally {
                System.clearProperty(Jcs.MAX_DEPTH_PROPERTY);
            }
        }

        @Test
        void toBuilderCopiesSettings() {
            var base = Jcs.Canonicalizer.builder().maxDepth(9).build();
            assertThat(base.toBuilder().build().maxDepth()).isEqualTo(9);
            assertThat(base.toBuilder().maxDepth(10).build().maxDepth()).isEqualTo(10);
        }

        @Test
        void nonPositiveDepthIsRejected() {
            assertThatThrownBy(() -> Jcs.Canonicalizer.builder().maxDepth(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Jcs.Reader.builder().maxDepth(-1).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
