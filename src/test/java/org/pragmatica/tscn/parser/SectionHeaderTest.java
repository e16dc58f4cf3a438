package org.pragmatica.tscn.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.ValueParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SectionHeaderTest {

    @Test
    void parse_readsTagAndQuotedAttributes() {
        var header = SectionHeader.parse("[node name=\"Player\" type=\"CharacterBody2D\" parent=\".\"]", 4);

        assertEquals("node", header.tag());
        assertEquals(SourceLocation.at(4, 1), header.location());
        assertThat(header.attributes().asMap()).containsExactly(
            java.util.Map.entry("name", "Player"),
            java.util.Map.entry("type", "CharacterBody2D"),
            java.util.Map.entry("parent", "."));
    }

    @Test
    void parse_keepsRawValuesAsWritten() {
        var header = SectionHeader.parse(
            "[node name=\"Weapon\" parent=\"Player\" instance=ExtResource(\"3_wp\") groups=[\"a\", \"b\"] index=2]", 1);

        var attributes = header.attributes();
        assertEquals("ExtResource(\"3_wp\")", attributes.require("instance"));
        assertEquals("[\"a\", \"b\"]", attributes.require("groups"));
        assertEquals(2, attributes.integer("index").orElseThrow());
    }

    @Test
    void parse_acceptsIndentationAndSpacesAroundEquals() {
        var header = SectionHeader.parse("  [gd_scene load_steps = 2  format=3 ]  ", 1);

        assertEquals("gd_scene", header.tag());
        assertEquals(3, header.attributes().integer("format").orElseThrow());
        assertEquals(2, header.attributes().integer("load_steps").orElseThrow());
    }

    @Test
    void parse_unescapesQuotedValues() {
        var header = SectionHeader.parse("[node name=\"say \\\"hi\\\"\"]", 1);

        assertEquals("say \"hi\"", header.attributes().require("name"));
    }

    @Test
    void parse_decodesEscapesLikePropertyStrings() {
        var header = SectionHeader.parse("[node name=\"a\\nb\\tc\\u00e9\"]", 1);

        assertEquals("a\nb\tc\u00e9", header.attributes().require("name"));
        assertEquals(ValueParser.unescape("a\\nb\\tc\\u00e9"), header.attributes().require("name"));
    }

    @Test
    void parse_rejectsMalformedUnicodeEscape() {
        var thrown = assertThrows(SceneParseException.class,
                                  () -> SectionHeader.parse("[node name=\"a\\uZZZZ\"]", 2));

        assertThat(thrown.error()).isInstanceOf(ParseError.UnexpectedInput.class);
        assertThat(thrown.error().message()).contains("'name'");
    }

    @Test
    void parse_withoutAttributes() {
        var header = SectionHeader.parse("[node]", 1);

        assertEquals("node", header.tag());
        assertEquals(0, header.attributes().size());
    }

    @Test
    void parse_missingClosingBracket_fails() {
        var error = assertThrows(SceneParseException.class, () -> SectionHeader.parse("[node name=\"A\"", 7));

        assertThat(error.error()).isInstanceOf(ParseError.UnexpectedInput.class);
        assertThat(error.getMessage()).startsWith("Parse error at 7:");
    }

    @Test
    void parse_unbalancedRawValue_fails() {
        var error = assertThrows(SceneParseException.class,
                                 () -> SectionHeader.parse("[node name=\"A\" groups=[\"a\"]", 1));

        assertThat(error.getMessage()).contains("Parse error");
    }

    @Test
    void parse_attributeWithoutValue_fails() {
        var error = assertThrows(SceneParseException.class, () -> SectionHeader.parse("[node name]", 2));

        assertThat(error.getMessage()).contains("'=' after attribute 'name'");
    }

    @Test
    void require_missingAttribute_namesSectionAndAttribute() {
        var header = SectionHeader.parse("[ext_resource type=\"Script\" id=\"1\"]", 3);

        var error = assertThrows(SceneParseException.class, () -> header.attributes().require("path"));

        assertEquals(new ParseError.MissingAttribute(SourceLocation.at(3, 1), "ext_resource", "path"), error.error());
    }

    @Test
    void integer_rejectsNonNumericText() {
        var header = SectionHeader.parse("[gd_scene format=three]", 1);

        var error = assertThrows(SceneParseException.class, () -> header.attributes().integer("format"));

        assertThat(error.error()).isInstanceOf(ParseError.InvalidAttribute.class);
    }

    @Test
    void looksLikeHeader_onlyForKnownTags() {
        assertTrue(SectionHeader.looksLikeHeader("[node name=\"A\"]"));
        assertTrue(SectionHeader.looksLikeHeader("  [sub_resource type=\"Gradient\" id=\"1\"]"));
        assertFalse(SectionHeader.looksLikeHeader("[1, 2]"));
        assertFalse(SectionHeader.looksLikeHeader("]"));
        assertFalse(SectionHeader.looksLikeHeader("[resource]"));
        assertFalse(SectionHeader.looksLikeHeader("\"[node]\","));
    }
}
