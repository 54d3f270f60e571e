package jcs;

import static jcs.Jcs.isClassPresent;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.ListValueOrBuilder;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.StructOrBuilder;
import com.google.protobuf.Value;
import com.google.protobuf.ValueOrBuilder;
import com.google.protobuf.util.JsonFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts Protocol Buffers messages into value trees, so that a message and the equivalent JSON document
 * canonicalize to the same bytes.
 *
 * <p> {@code google.protobuf.Struct}, {@code ListValue} and {@code Value} map directly onto JSON objects, arrays and
 * scalars. Any other message is rendered with protobuf's JSON mapping ({@link JsonFormat}) and then read back,
 * which means 64-bit integer fields appear as JSON strings.
 *
 * <p> Registered through {@code META-INF/services/jcs.Jcs$Converter}; inactive when protobuf is not on the classpath.
 *
 * @since 0.1.0
 */
public final class ProtobufConverter implements Jcs.Converter {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.MessageOrBuilder")
            && isClassPresent("com.google.protobuf.util.JsonFormat");

    public ProtobufConverter() {}

    @Override
    public boolean canConvert(Object o) {
        return PROTOBUF_PRESENT && isMessageOrBuilder(o);
    }

    @Override
    public JsonValue convert(Object o) {
        return messageToJsonValue((MessageOrBuilder) o);
    }

    @Override
    public String toString() {
        return "ProtobufConverter{present=" + PROTOBUF_PRESENT + '}';
    }

    static boolean isMessageOrBuilder(Object o) {
        return o instanceof MessageOrBuilder;
    }

    static JsonValue messageToJsonValue(MessageOrBuilder message) {
        if (message instanceof StructOrBuilder struct) return structToJsonObject(struct);
        if (message instanceof ListValueOrBuilder list) return listToJsonArray(list);
        if (message instanceof ValueOrBuilder value) return valueToJsonValue(value);
        String json;
        try {
            json = JsonFormat.printer().omittingInsignificantWhitespace().print(message);
        } catch (InvalidProtocolBufferException e) {
            throw new Jcs.ConversionException(
                    "Failed to render protobuf message " + message.getDescriptorForType().getFullName(), e);
        }
        return Jcs.parse(json);
    }

    static JsonObject structToJsonObject(StructOrBuilder struct) {
        var members = new ArrayList<JsonObject.Member>(struct.getFieldsCount());
        for (var entry : struct.getFieldsMap().entrySet()) {
            members.add(new JsonObject.Member(entry.getKey(), valueToJsonValue(entry.getValue())));
        }
        return new JsonObject(members);
    }

    static JsonArray listToJsonArray(ListValueOrBuilder listValue) {
        List<JsonValue> list = new ArrayList<>(listValue.getValuesCount());
        for (Value v : listValue.getValuesList()) list.add(valueToJsonValue(v));
        return new JsonArray(list);
    }

    static JsonValue valueToJsonValue(ValueOrBuilder value) {
        return switch (value.getKindCase()) {
            case NULL_VALUE -> new JsonNull();
            case NUMBER_VALUE -> new JsonNumber(value.getNumberValue());
            case STRING_VALUE -> new JsonString(value.getStringValue());
            case BOOL_VALUE -> new JsonBoolean(value.getBoolValue());
            case STRUCT_VALUE -> structToJsonObject(value.getStructValue());
            case LIST_VALUE -> listToJsonArray(value.getListValue());
            case KIND_NOT_SET -> throw new Jcs.ConversionException("google.protobuf.Value has no kind set");
        };
    }
}
