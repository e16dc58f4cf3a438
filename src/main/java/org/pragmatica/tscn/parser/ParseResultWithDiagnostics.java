package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.Diagnostic;
import org.pragmatica.tscn.scene.SceneDocument;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing with recovery - the best-effort document and the diagnostics collected.
 *
 * <p>When parsing succeeds completely, {@code document} holds every section and {@code diagnostics}
 * holds warnings only, such as a property repeated within a section. With {@link org.pragmatica.tscn.error.RecoveryStrategy#SKIP_SECTION}, sections that failed
 * are missing from {@code document} and each failure has a diagnostic. Without recovery a failure
 * leaves {@code document} empty with a single diagnostic.
 *
 * @param document    The parsed document, possibly partial
 * @param diagnostics Accumulated diagnostics (no errors on full success)
 * @param source      The original text (for formatting diagnostics)
 */
public record ParseResultWithDiagnostics(
    Optional<SceneDocument> document,
    List<Diagnostic> diagnostics,
    String source
) {
    public ParseResultWithDiagnostics {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParseResultWithDiagnostics success(SceneDocument document, String source) {
        return new ParseResultWithDiagnostics(Optional.of(document), List.of(), source);
    }

    public static ParseResultWithDiagnostics withErrors(Optional<SceneDocument> document,
                                                        List<Diagnostic> diagnostics,
                                                        String source) {
        return new ParseResultWithDiagnostics(document, diagnostics, source);
    }

    /**
     * Check if parsing succeeded without any errors; warnings do not count.
     */
    public boolean isSuccess() {
        return document.isPresent() && !hasErrors();
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public boolean hasDocument() {
        return document.isPresent();
    }

    /**
     * Format all diagnostics.
     *
     * @param filename Optional filename for display
     */
    public String formatDiagnostics(String filename) {
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                                .count();
    }
}
