package org.pragmatica.tscn.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.Value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScanStateTest {
    private final DocumentAssembler assembler = DocumentAssembler.create(3);

    @Test
    void initialState_seeksFirstSection() {
        var state = ScanState.initial();

        assertThat(state).isInstanceOf(ScanState.SeekingSection.class);
        assertSame(state, state.accept("", 1, assembler));
        assertSame(state, state.accept("; comment", 2, assembler));
    }

    @Test
    void nodeHeader_entersPropertyState() {
        var state = ScanState.initial()
                             .accept("[node name=\"A\" type=\"Node\"]", 1, assembler);

        assertThat(state).isInstanceOf(ScanState.InProperties.class);
        assertEquals(0, assembler.nodeCount());
    }

    @Test
    void headerOnlySection_entersAttributeState() {
        var state = ScanState.initial()
                             .accept("[ext_resource type=\"Script\" path=\"res://a.gd\" id=\"1\"]", 1, assembler);

        assertThat(state).isInstanceOf(ScanState.InHeaderAttributes.class);
        assertThat(assembler.assemble().extResources()).hasSize(1);
    }

    @Test
    void propertyLines_belongToTheOpenNode() {
        ScanState state = ScanState.initial();
        state = state.accept("[node name=\"A\"]", 1, assembler);
        state = state.accept("speed = 5", 2, assembler);
        state = state.accept("[node name=\"B\" parent=\".\"]", 3, assembler);
        state = state.accept("speed = 7", 4, assembler);
        state.finish(assembler);

        var nodes = assembler.assemble().nodes();
        assertEquals(Value.number(5), nodes.get(0).properties().get("speed"));
        assertEquals(Value.number(7), nodes.get(1).properties().get("speed"));
    }

    @Test
    void nodeIsAssembledWhenNextSectionOpens() {
        var state = ScanState.initial()
                             .accept("[node name=\"A\"]", 1, assembler);
        assertEquals(0, assembler.nodeCount());

        state.accept("[node name=\"B\" parent=\".\"]", 2, assembler);

        assertEquals(1, assembler.nodeCount());
    }

    @Test
    void pendingValue_keepsStateUntilBalanced() {
        var state = ScanState.initial()
                             .accept("[node name=\"A\"]", 1, assembler)
                             .accept("points = [", 2, assembler);

        var block = ((ScanState.InProperties) state).block();
        assertTrue(block.hasPending());

        state = state.accept("1, 2", 3, assembler)
                     .accept("]", 4, assembler);

        assertFalse(((ScanState.InProperties) state).block().hasPending());
    }

    @Test
    void finish_withPendingValueFails() {
        var state = ScanState.initial()
                             .accept("[node name=\"A\"]", 1, assembler)
                             .accept("points = [1,", 2, assembler);

        var error = assertThrows(SceneParseException.class, () -> state.finish(assembler));

        assertThat(error.error()).isInstanceOf(ParseError.UnterminatedValue.class);
    }

    @Test
    void attributeState_rejectsPropertyLines() {
        var state = ScanState.initial()
                             .accept("[connection signal=\"pressed\" from=\".\" to=\".\" method=\"go\"]", 1, assembler);

        var error = assertThrows(SceneParseException.class, () -> state.accept("flags = 3", 2, assembler));

        assertEquals(new ParseError.PropertyOutsideSection(SourceLocation.at(2, 1),
                                                           "flags = 3",
                                                           "in [connection], only [node] and [sub_resource] carry properties"),
                     error.error());
    }

    @Test
    void discardingState_ignoresPropertyLines() {
        var state = ScanState.SeekingSection.DISCARDING;

        assertSame(state, state.accept("speed = 5", 1, assembler));
        assertThat(state.accept("[node name=\"A\"]", 2, assembler)).isInstanceOf(ScanState.InProperties.class);
    }

    @Test
    void startState_rejectsPropertyLines() {
        var error = assertThrows(SceneParseException.class,
                                 () -> ScanState.initial().accept("speed = 5", 1, assembler));

        assertThat(error.error()).isInstanceOf(ParseError.PropertyOutsideSection.class);
    }

    @Test
    void malformedPropertyLine_fails() {
        var state = ScanState.initial()
                             .accept("[node name=\"A\"]", 1, assembler);

        var error = assertThrows(SceneParseException.class, () -> state.accept("just some words", 2, assembler));

        assertThat(error.error()).isInstanceOf(ParseError.UnexpectedInput.class);
    }
}
