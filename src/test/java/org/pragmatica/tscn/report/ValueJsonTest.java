package org.pragmatica.tscn.report;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueParser;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValueJsonTest {

    @Test
    void scalars_mapToJsonScalars() {
        assertEquals("\"hi\"", ValueJson.toJson(Value.string("hi")).toString());
        assertEquals("3", ValueJson.toJson(Value.number(3)).toString());
        assertEquals("0.5", ValueJson.toJson(Value.number(0.5)).toString());
        assertEquals("true", ValueJson.toJson(Value.bool(true)).toString());
        assertTrue(ValueJson.toJson(Value.nullValue()).isNull());
    }

    @Test
    void nonFiniteNumbers_becomeText() {
        assertEquals("Infinity", ValueJson.toJson(Value.number(Double.POSITIVE_INFINITY)).asText());
        assertEquals("NaN", ValueJson.toJson(Value.number(Double.NaN)).asText());
    }

    @Test
    void constructor_becomesTypeAndArgs() {
        var json = ValueJson.toJson(ValueParser.parse("Color(1, 0.5, 0, 1)"));

        assertEquals("{\"type\":\"Color\",\"args\":[1,0.5,0,1]}", json.toString());
    }

    @Test
    void references_becomeTaggedObjects() {
        assertEquals("{\"extResource\":\"1_pl\"}", ValueJson.toJson(Value.extRef("1_pl")).toString());
        assertEquals("{\"subResource\":\"Shape_a\"}", ValueJson.toJson(Value.subRef("Shape_a")).toString());
    }

    @Test
    void containers_nestAndKeepOrder() {
        var json = ValueJson.toJson(ValueParser.parse("{ \"b\": [1, \"x\"], \"a\": { \"c\": null } }"));

        assertEquals("{\"b\":[1,\"x\"],\"a\":{\"c\":null}}", json.toString());
    }

    @Test
    void propertyMap_becomesObject() {
        var properties = new LinkedHashMap<String, Value>();
        properties.put("speed", Value.number(300));
        properties.put("texture", Value.extRef("2_tx"));

        var json = ValueJson.toJson(properties);

        assertThat(json.fieldNames()).toIterable()
                                     .containsExactly("speed", "texture");
        assertEquals(300, json.get("speed").asInt());
    }
}
