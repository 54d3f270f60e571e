package jcs;

import java.util.List;

/**
 * An ordered JSON array. Element order is significant and preserved by canonicalization.
 *
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {

    public JsonArray {
        value = List.copyOf(value);
    }

    public static JsonArray of(JsonValue... values) {
        return new JsonArray(List.of(values));
    }

    @Override
    public String stringify() {
        return Jcs.defaultCanonicalizer().canonicalizeToString(this);
    }
}
