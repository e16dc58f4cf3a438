package org.pragmatica.tscn.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentAssemblerTest {
    private final DocumentAssembler assembler = DocumentAssembler.create(3);

    private static SectionHeader header(String line) {
        return SectionHeader.parse(line, 1);
    }

    @Test
    void nodes_getDeclarationIndexAsId() {
        assembler.node(header("[node name=\"Root\"]"), Optional.empty(), Map.of());
        assembler.node(header("[node name=\"A\" parent=\".\"]"), Optional.empty(), Map.of());
        var last = assembler.node(header("[node name=\"B\" parent=\"A\"]"), Optional.empty(), Map.of());

        assertEquals(2, last.id());
        assertThat(assembler.assemble().nodes()).extracting(node -> node.id())
                                                .containsExactly(0, 1, 2);
    }

    @Test
    void node_readsOptionalHeaderAttributes() {
        var node = assembler.node(header("[node name=\"Enemy\" parent=\".\" index=\"3\" owner=\"Level\" "
                                         + "instance_placeholder=\"res://enemy.tscn\" groups=[\"enemies\", \"mobs\"] unique_id=77]"),
                                  Optional.empty(),
                                  Map.of("hp", Value.number(10)));

        assertEquals(Optional.of(3), node.index());
        assertEquals(Optional.of("Level"), node.owner());
        assertEquals(Optional.of("res://enemy.tscn"), node.instancePlaceholder());
        assertEquals(List.of("enemies", "mobs"), node.groups());
        assertEquals("77", node.attributes().get("unique_id"));
        assertEquals(Value.number(10), node.properties().get("hp"));
    }

    @Test
    void node_scriptFallsBackToHeaderAttribute() {
        var node = assembler.node(header("[node name=\"A\" script=ExtResource(\"1\")]"), Optional.empty(), Map.of());

        assertEquals(Optional.of("ExtResource(\"1\")"), node.scriptRef());
    }

    @Test
    void connection_readsFlagsAndBinds() {
        assembler.connection(header("[connection signal=\"hit\" from=\"A\" to=\".\" method=\"on_hit\" flags=3 binds=[1, \"x\"]]"));

        var connection = assembler.assemble().connections().get(0);
        assertEquals(Optional.of(3), connection.flags());
        assertEquals(List.of(Value.number(1), Value.string("x")), connection.binds());
    }

    @Test
    void header_keepsLegacyAttributes() {
        assembler.header(header("[gd_scene load_steps=4 format=2 uid_type=\"scene\" custom=\"x\"]"));

        var sceneHeader = assembler.assemble().header();
        assertEquals(2, sceneHeader.formatVersion());
        assertEquals(Optional.of(4), sceneHeader.loadSteps());
        assertEquals(Optional.of("scene"), sceneHeader.uidType());
        assertEquals("x", sceneHeader.attributes().get("custom"));
    }

    @Test
    void withoutHeader_usesDefaultFormatVersion() {
        var document = DocumentAssembler.create(4).assemble();

        assertEquals(4, document.header().formatVersion());
        assertTrue(document.isEmpty());
    }

    @Test
    void duplicateSubResourceId_isRejectedAtHeader() {
        assembler.reserveSubResource(header("[sub_resource type=\"Gradient\" id=\"g\"]"));

        var error = assertThrows(SceneParseException.class,
                                 () -> assembler.reserveSubResource(header("[sub_resource type=\"Curve\" id=\"g\"]")));

        assertThat(error.error()).isInstanceOf(ParseError.Duplicate.class);
        assertThat(error.getMessage()).contains("id 'g'");
    }

    @Test
    void extResourceWithoutPath_isRejected() {
        var error = assertThrows(SceneParseException.class,
                                 () -> assembler.extResource(header("[ext_resource type=\"Script\" id=\"1\"]")));

        assertThat(error.error()).isInstanceOf(ParseError.MissingAttribute.class);
    }

    @Test
    void editableWithoutPath_isRejected() {
        assertThrows(SceneParseException.class, () -> assembler.editable(header("[editable]")));
    }

    @Test
    void malformedGroups_areReportedAsInvalidAttribute() {
        var error = assertThrows(SceneParseException.class,
                                 () -> assembler.node(header("[node name=\"A\" groups=[@]]"), Optional.empty(), Map.of()));

        assertThat(error.error()).isInstanceOf(ParseError.InvalidAttribute.class);
    }
}
