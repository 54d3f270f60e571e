package jcs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A JSON object as a list of members.
 *
 * <p> Member order carries no meaning. Keys must be unique, but a list (rather than a map) is kept so that a
 * duplicate coming from a lenient producer reaches the canonicalizer and is reported as
 * {@link Jcs.ErrorKind#DUPLICATE_KEY} instead of being silently resolved.
 *
 * @since 0.1.0
 */
public record JsonObject(List<Member> value) implements JsonValue {

    public JsonObject {
        value = List.copyOf(value);
    }

    public static JsonObject of(Map<String, ? extends JsonValue> members) {
        var list = new ArrayList<Member>(members.size());
        for (var en : members.entrySet()) {
            list.add(new Member(en.getKey(), en.getValue()));
        }
        return new JsonObject(list);
    }

    public static JsonObject of(Member... members) {
        return new JsonObject(List.of(members));
    }

    public static Member member(String key, JsonValue value) {
        return new Member(key, value);
    }

    @Override
    public String stringify() {
        return Jcs.defaultCanonicalizer().canonicalizeToString(this);
    }

    public record Member(String key, JsonValue value) {
        public Member {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }
}
