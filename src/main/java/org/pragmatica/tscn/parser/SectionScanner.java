package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.Diagnostic;
import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.RecoveryStrategy;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.scene.SceneDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line-oriented scene parser: folds the lines of the text through {@link ScanState} into a
 * {@link DocumentAssembler}.
 *
 * <p>Stateless between calls and safe to share across threads.
 */
public final class SectionScanner implements SceneParser {
    private static final Logger log = LoggerFactory.getLogger(SectionScanner.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ParserConfig config;

    private SectionScanner(ParserConfig config) {
        this.config = config;
    }

    public static SectionScanner create(ParserConfig config) {
        return new SectionScanner(Objects.requireNonNull(config, "config"));
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String text) {
        var assembler = DocumentAssembler.create(config);
        return scan(text, assembler);
    }

    @Override
    public ParseResultWithDiagnostics parseWithDiagnostics(String text) {
        if (config.recoveryStrategy() != RecoveryStrategy.NONE) {
            return parseRecovering(text);
        }
        var assembler = DocumentAssembler.create(config);
        var result = scan(text, assembler);
        if (result instanceof ParseResult.Failure failure) {
            return ParseResultWithDiagnostics.withErrors(Optional.empty(),
                                                         List.of(Diagnostic.error(failure.cause())),
                                                         text);
        }
        return withWarnings(result.unwrap(), assembler.warnings(), text);
    }

    private ParseResult scan(String text, DocumentAssembler assembler) {
        var oversized = checkSize(text);
        if (oversized.isPresent()) {
            return ParseResult.failure(oversized.get());
        }
        var lines = lines(text);
        try {
            ScanState state = ScanState.initial();
            for (int i = 0; i < lines.length; i++) {
                state = state.accept(lines[i], i + 1, assembler);
            }
            state.finish(assembler);
        } catch (SceneParseException e) {
            log.debug("Scene parse failed: {}", e.getMessage());
            return ParseResult.failure(e.error());
        }
        var document = assembler.assemble();
        assembler.warnings()
                 .forEach(warning -> log.debug("Scene warning: {}", warning.formatSimple()));
        log.debug("Parsed scene: {} node(s), {} ext_resource(s), {} sub_resource(s), {} connection(s)",
                  document.nodes().size(),
                  document.extResources().size(),
                  document.subResources().size(),
                  document.connections().size());
        return ParseResult.success(document);
    }

    private static ParseResultWithDiagnostics withWarnings(SceneDocument document, List<Diagnostic> warnings, String text) {
        return warnings.isEmpty()
               ? ParseResultWithDiagnostics.success(document, text)
               : ParseResultWithDiagnostics.withErrors(Optional.of(document), warnings, text);
    }

    private ParseResultWithDiagnostics parseRecovering(String text) {
        var oversized = checkSize(text);
        if (oversized.isPresent()) {
            return ParseResultWithDiagnostics.withErrors(Optional.empty(),
                                                         List.of(Diagnostic.error(oversized.get())),
                                                         text);
        }
        var lines = lines(text);
        var assembler = DocumentAssembler.create(config);
        var diagnostics = new ArrayList<Diagnostic>();
        ScanState state = ScanState.initial();
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            try {
                state = state.accept(lines[i], lineNumber, assembler);
            } catch (SceneParseException e) {
                state = skip(e, diagnostics);
                // A header that ended an earlier broken section still opens its own section.
                if (ScanState.isHeader(lines[i]) && e.error().location().line() != lineNumber) {
                    state = reopen(lines[i], lineNumber, assembler, diagnostics);
                }
            }
        }
        try {
            state.finish(assembler);
        } catch (SceneParseException e) {
            skip(e, diagnostics);
        }
        SceneDocument document = assembler.assemble();
        if (diagnostics.isEmpty()) {
            return withWarnings(document, assembler.warnings(), text);
        }
        log.warn("Recovered scene with {} error(s); {} node(s) kept", diagnostics.size(), document.nodes().size());
        diagnostics.addAll(assembler.warnings());
        diagnostics.sort(Comparator.comparingInt(diagnostic -> diagnostic.location()
                                                                         .line()));
        return ParseResultWithDiagnostics.withErrors(Optional.of(document), diagnostics, text);
    }

    private static ScanState reopen(String line, int lineNumber, DocumentAssembler assembler, List<Diagnostic> diagnostics) {
        try {
            return ScanState.open(line, lineNumber, assembler);
        } catch (SceneParseException e) {
            return skip(e, diagnostics);
        }
    }

    private static ScanState skip(SceneParseException e, List<Diagnostic> diagnostics) {
        var diagnostic = Diagnostic.error(e.error())
                                   .withNote("section skipped");
        log.debug("Skipping section: {}", diagnostic.formatSimple());
        diagnostics.add(diagnostic);
        return ScanState.SeekingSection.DISCARDING;
    }

    private Optional<ParseError> checkSize(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() <= config.maxInputSize()) {
            return Optional.empty();
        }
        return Optional.of(new ParseError.InputTooLarge(SourceLocation.START, text.length(), config.maxInputSize()));
    }

    private static String[] lines(String text) {
        if (text.isEmpty()) {
            return new String[0];
        }
        var content = text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
        return LINE_BREAK.split(content, -1);
    }
}
