package jcs;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * The six-variant JSON value tree consumed by {@link Jcs}.
 *
 * <p> The hierarchy is closed: a tree is built from {@link JsonNull}, {@link JsonBoolean}, {@link JsonNumber},
 * {@link JsonString}, {@link JsonArray} and {@link JsonObject} only. All variants are immutable records, so a tree
 * cannot contain a back-reference to one of its ancestors.
 *
 * @since 0.1.0
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    /**
     * Canonical JSON text of this value.
     *
     * @throws Jcs.CanonicalizationException if the value cannot be canonicalized
     */
    String stringify();

    /**
     * Convert a plain Java object graph into a value tree.
     *
     * <p> Registered {@link Jcs.Converter}s are consulted first, at every level of the graph. Then:
     * {@code null} and empty {@link Optional} become {@link JsonNull}; {@link Boolean} becomes {@link JsonBoolean};
     * any {@link Number} becomes a {@link JsonNumber} of its {@code doubleValue()}; {@link CharSequence},
     * {@link Character} and {@link Enum} become {@link JsonString}; arrays and {@link Iterable}s become
     * {@link JsonArray}; {@link Map}s, records and beans become {@link JsonObject}.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Point(int x, int y) {}
     * JsonValue v = JsonValue.fromJavaObject(new Point(42, 21));
     * v.stringify(); // -> {"x":42,"y":21}
     * }</pre>
     *
     * @param o any object, may be {@code null}
     * @return value tree, never {@code null}
     * @throws Jcs.CanonicalizationException with {@link Jcs.ErrorKind#UNSUPPORTED_TYPE} if some object has no JSON shape
     * @throws Jcs.ConversionException       if the graph is cyclic or a property cannot be read
     */
    static JsonValue fromJavaObject(@Nullable Object o) {
        return ObjectAdapter.convert(o, "$", Collections.newSetFromMap(new IdentityHashMap<>()));
    }
}
