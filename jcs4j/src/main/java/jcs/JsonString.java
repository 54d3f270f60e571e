package jcs;

import java.util.Objects;

/**
 *
 *
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        return StringEscaper.escape(value);
    }
}
