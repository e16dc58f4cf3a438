package org.pragmatica.tscn.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.error.Diagnostic;
import org.pragmatica.tscn.error.RecoveryStrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing with {@link RecoveryStrategy#SKIP_SECTION}.
 */
class SectionScannerRecoveryTest {
    private final SectionScanner recovering = SectionScanner.create(ParserConfig.DEFAULT.withRecovery(RecoveryStrategy.SKIP_SECTION));

    @Test
    void brokenNode_isSkippedAndLaterSectionsKept() {
        var text = """
            [gd_scene format=3]
            [node name="Root" type="Node"]
            [node name="Bad" type="Node" parent="."]
            position = Vector2(1, @)
            [node name="Good" type="Node" parent="."]
            """;

        var result = recovering.parseWithDiagnostics(text);

        assertTrue(result.hasDocument());
        assertTrue(result.hasErrors());
        assertFalse(result.isSuccess());
        assertEquals(1, result.errorCount());
        var document = result.document().orElseThrow();
        assertThat(document.nodes()).extracting(node -> node.name())
                                    .containsExactly("Root", "Good");
        assertEquals(1, document.nodes().get(1).id());
    }

    @Test
    void headerSwallowedByUnterminatedValue_stillOpensItsSection() {
        var text = """
            [node name="Root" type="Node"]
            [node name="Bad" parent="."]
            items = [1,
            [node name="Good" parent="."]
            speed = 3
            """;

        var result = recovering.parseWithDiagnostics(text);

        var document = result.document().orElseThrow();
        assertThat(document.nodes()).extracting(node -> node.name())
                                    .containsExactly("Root", "Good");
        assertEquals(3, result.diagnostics().get(0).location().line());
    }

    @Test
    void unknownSection_discardsItsProperties() {
        var text = """
            [node name="Root"]
            [nodee name="Typo" parent="."]
            speed = 3
            [node name="Child" parent="."]
            """;

        var result = recovering.parseWithDiagnostics(text);

        assertEquals(1, result.errorCount());
        assertThat(result.document().orElseThrow().nodes()).extracting(node -> node.name())
                                                           .containsExactly("Root", "Child");
    }

    @Test
    void everyBrokenSection_getsADiagnostic() {
        var text = """
            [ext_resource type="Script" id="1"]
            [node name="Root"]
            a = [
            [node name="Child" parent="."]
            b = Vector2(
            """;

        var result = recovering.parseWithDiagnostics(text);

        assertEquals(3, result.errorCount());
        assertThat(result.diagnostics()).allMatch(diagnostic -> diagnostic.severity() == Diagnostic.Severity.ERROR);
        assertTrue(result.document().orElseThrow().isEmpty());
    }

    @Test
    void cleanInput_hasNoDiagnostics() {
        var result = recovering.parseWithDiagnostics("[node name=\"Root\"]\n");

        assertTrue(result.isSuccess());
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void withoutRecovery_failureLeavesNoDocument() {
        var strict = SectionScanner.create(ParserConfig.DEFAULT);

        var result = strict.parseWithDiagnostics("[node name=\"Root\"]\nitems = [1,\n");

        assertFalse(result.hasDocument());
        assertEquals(1, result.errorCount());
        assertThat(result.diagnostics().get(0).notes()).isEmpty();
    }

    @Test
    void formattedDiagnostics_pointAtTheLine() {
        var text = "[node name=\"Root\"]\nposition = Vector2(1, @)\n";

        var formatted = recovering.parseWithDiagnostics(text)
                                  .formatDiagnostics("level.tscn");

        assertThat(formatted).contains("error: Parse error at 2:11")
                             .contains("--> level.tscn:2:11")
                             .contains("2 | position = Vector2(1, @)")
                             .contains("= note: section skipped");
    }
}
