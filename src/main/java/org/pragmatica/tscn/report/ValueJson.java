package org.pragmatica.tscn.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueVisitor;

import java.util.Map;

/**
 * Converts {@link Value}s to Jackson trees.
 *
 * <p>Constructors become {@code {"type": name, "args": [...]}}, resource references
 * {@code {"extResource": id}} / {@code {"subResource": id}}. Integral numbers are written as
 * integers; {@code inf} and {@code nan} as strings, since JSON has no literal for them.
 */
public final class ValueJson implements ValueVisitor<JsonNode> {
    private static final ValueJson INSTANCE = new ValueJson(JsonNodeFactory.instance);

    private final JsonNodeFactory factory;

    private ValueJson(JsonNodeFactory factory) {
        this.factory = factory;
    }

    public static JsonNode toJson(Value value) {
        return value.accept(INSTANCE);
    }

    public static ObjectNode toJson(Map<String, Value> values) {
        var node = JsonNodeFactory.instance.objectNode();
        values.forEach((key, value) -> node.set(key, toJson(value)));
        return node;
    }

    @Override
    public JsonNode visitString(Value.StringLit value) {
        return factory.textNode(value.value());
    }

    @Override
    public JsonNode visitNumber(Value.NumberLit value) {
        if (value.isIntegral()) {
            return factory.numberNode(value.asLong());
        }
        if (!Double.isFinite(value.value())) {
            return factory.textNode(Double.toString(value.value()));
        }
        return factory.numberNode(value.value());
    }

    @Override
    public JsonNode visitBool(Value.BoolLit value) {
        return factory.booleanNode(value.value());
    }

    @Override
    public JsonNode visitNull(Value.NullLit value) {
        return factory.nullNode();
    }

    @Override
    public JsonNode visitArray(Value.ArrayLit value) {
        var array = factory.arrayNode();
        value.elements()
             .forEach(element -> array.add(element.accept(this)));
        return array;
    }

    @Override
    public JsonNode visitRecord(Value.RecordLit value) {
        var object = factory.objectNode();
        value.entries()
             .forEach((key, entry) -> object.set(key, entry.accept(this)));
        return object;
    }

    @Override
    public JsonNode visitConstructor(Value.Constructor value) {
        var object = factory.objectNode();
        object.put("type", value.name());
        var args = object.putArray("args");
        value.args()
             .forEach(arg -> args.add(arg.accept(this)));
        return object;
    }

    @Override
    public JsonNode visitExtRef(Value.ExtRef value) {
        return factory.objectNode()
                      .put("extResource", value.id());
    }

    @Override
    public JsonNode visitSubRef(Value.SubRef value) {
        return factory.objectNode()
                      .put("subResource", value.id());
    }
}
