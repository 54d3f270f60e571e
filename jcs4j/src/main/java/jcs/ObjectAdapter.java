package jcs;

import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Reflective Java object to {@link JsonValue} conversion behind {@link JsonValue#fromJavaObject(Object)}.
 */
final class ObjectAdapter {

    private ObjectAdapter() {
        throw new UnsupportedOperationException();
    }

    static JsonValue convert(@Nullable Object o, String path, Set<Object> inProgress) {
        if (o == null) return new JsonNull();
        if (o instanceof JsonValue jv) return jv;
        for (var converter : Jcs.converters()) {
            if (converter.canConvert(o)) return converter.convert(o);
        }
        if (o instanceof Boolean b) return new JsonBoolean(b);
        if (o instanceof Number n) return new JsonNumber(n.doubleValue());
        if (o instanceof CharSequence s) return new JsonString(s.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o instanceof Enum<?> e) return new JsonString(e.name());
        if (o instanceof Optional<?> optional) {
            return optional.isPresent() ? convert(optional.get(), path, inProgress) : new JsonNull();
        }

        if (!inProgress.add(o)) {
            throw new Jcs.ConversionException("Cyclic reference at " + path + " (" + o.getClass().getName() + ")");
        }
        try {
            if (o.getClass().isArray()) return convertArray(o, path, inProgress);
            if (o instanceof Iterable<?> iterable) return convertIterable(iterable, path, inProgress);
            if (o instanceof Map<?, ?> map) return convertMap(map, path, inProgress);
            if (o instanceof Record) return convertRecord(o, path, inProgress);
            return convertBean(o, path, inProgress);
        } finally {
            inProgress.remove(o);
        }
    }

    private static JsonArray convertArray(Object array, String path, Set<Object> inProgress) {
        int len = Array.getLength(array);
        var values = new ArrayList<JsonValue>(len);
        for (int i = 0; i < len; i++) {
            values.add(convert(Array.get(array, i), path + "[" + i + "]", inProgress));
        }
        return new JsonArray(values);
    }

    private static JsonArray convertIterable(Iterable<?> iterable, String path, Set<Object> inProgress) {
        var values = new ArrayList<JsonValue>();
        int i = 0;
        for (var e : iterable) {
            values.add(convert(e, path + "[" + i++ + "]", inProgress));
        }
        return new JsonArray(values);
    }

    private static JsonObject convertMap(Map<?, ?> map, String path, Set<Object> inProgress) {
        var members = new ArrayList<JsonObject.Member>(map.size());
        for (var en : map.entrySet()) {
            var key = String.valueOf(en.getKey()); // JSON keys must be strings
            members.add(new JsonObject.Member(key, convert(en.getValue(), Jcs.childPath(path, key), inProgress)));
        }
        return new JsonObject(members);
    }

    private static JsonObject convertRecord(Object record, String path, Set<Object> inProgress) {
        var members = new ArrayList<JsonObject.Member>();
        for (var c : record.getClass().getRecordComponents()) {
            Object v;
            try {
                var accessor = c.getAccessor();
                accessor.trySetAccessible();
                v = accessor.invoke(record);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new Jcs.ConversionException(
                        "Failed to access record component '" + c.getName() + "' of type "
                                + record.getClass().getName(),
                        e);
            }
            members.add(new JsonObject.Member(c.getName(), convert(v, Jcs.childPath(path, c.getName()), inProgress)));
        }
        return new JsonObject(members);
    }

    private static JsonObject convertBean(Object bean, String path, Set<Object> inProgress) {
        PropertyDescriptor[] properties;
        try {
            properties = Introspector.getBeanInfo(bean.getClass()).getPropertyDescriptors();
        } catch (IntrospectionException e) {
            throw new Jcs.ConversionException("Failed to introspect bean of type " + bean.getClass().getName(), e);
        }
        var members = new ArrayList<JsonObject.Member>();
        for (var pd : properties) {
            if (Objects.equals(pd.getName(), "class")) continue;
            var read = pd.getReadMethod();
            if (read == null) continue;
            Object v;
            try {
                read.trySetAccessible();
                v = read.invoke(bean);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new Jcs.ConversionException(
                        "Failed to read bean property '" + pd.getName() + "' of type "
                                + bean.getClass().getName(),
                        e);
            }
            members.add(new JsonObject.Member(pd.getName(), convert(v, Jcs.childPath(path, pd.getName()), inProgress)));
        }
        if (members.isEmpty()) {
            throw new Jcs.CanonicalizationException(
                    Jcs.ErrorKind.UNSUPPORTED_TYPE,
                    "No JSON mapping for " + bean.getClass().getName(),
                    path);
        }
        return new JsonObject(members);
    }
}
