package org.pragmatica.tscn.parser;

/**
 * Parses scene text into a {@link org.pragmatica.tscn.scene.SceneDocument}.
 */
public interface SceneParser {

    /**
     * Parse the full text of one scene file. Never returns a partial document.
     */
    ParseResult parse(String text);

    /**
     * Parse with the configured recovery strategy and return the diagnostics collected.
     * With {@link org.pragmatica.tscn.error.RecoveryStrategy#SKIP_SECTION} the document may be partial.
     */
    ParseResultWithDiagnostics parseWithDiagnostics(String text);
}
