package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueParseException;
import org.pragmatica.tscn.value.ValueParser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Property lines of the {@code [node]} or {@code [sub_resource]} section being scanned.
 *
 * <p>A value whose brackets, parentheses or quotes are still open at the end of its line stays
 * pending, and the following lines are joined to it until the nesting returns to zero.
 */
final class PropertyBlock {
    private static final Pattern PROPERTY_LINE = Pattern.compile("^\\s*([A-Za-z0-9_][A-Za-z0-9_/:.\\-]*)\\s*=(.*)$",
                                                                 Pattern.DOTALL);
    private static final String SCRIPT = "script";

    private final SectionTag tag;
    private final SectionHeader header;
    private final int maxNestingDepth;
    private final Map<String, Value> properties = new LinkedHashMap<>();
    private String scriptRef;
    private boolean scriptSeen;

    private String pendingKey;
    private SourceLocation pendingLocation;
    private StringBuilder pendingText;
    private Nesting pendingNesting;

    PropertyBlock(SectionTag tag, SectionHeader header, int maxNestingDepth) {
        this.tag = tag;
        this.header = header;
        this.maxNestingDepth = maxNestingDepth;
    }

    SectionHeader header() {
        return header;
    }

    boolean hasPending() {
        return pendingKey != null;
    }

    /**
     * Start a {@code key = value} property; commits it at once if the value is complete on this line.
     */
    void begin(String line, int lineNumber, DocumentAssembler assembler) {
        var matcher = PROPERTY_LINE.matcher(line);
        if (!matcher.matches()) {
            throw new SceneParseException(new ParseError.UnexpectedInput(SourceLocation.lineStart(lineNumber),
                                                                         line.strip(),
                                                                         "'key = value' property in [" + header.tag() + "]"));
        }
        pendingKey = matcher.group(1);
        if (properties.containsKey(pendingKey) || (pendingKey.equals(SCRIPT) && scriptSeen)) {
            assembler.warn("property '" + pendingKey + "' repeated in [" + header.tag() + "], last value kept",
                           SourceLocation.at(lineNumber, matcher.start(1) + 1));
        }
        pendingLocation = SourceLocation.at(lineNumber, matcher.start(2) + 1);
        pendingText = new StringBuilder(matcher.group(2));
        pendingNesting = Nesting.empty()
                                .feed(pendingText);
        commitIfComplete();
    }

    /**
     * Append a continuation line to the pending value. A section header ends the value with an
     * error unless it sits inside an open string.
     */
    void append(String line, int lineNumber) {
        if (!pendingNesting.inString() && SectionHeader.looksLikeHeader(line)) {
            throw unterminated();
        }
        pendingText.append('\n')
                   .append(line);
        pendingNesting.feed('\n')
                      .feed(line);
        commitIfComplete();
    }

    /**
     * Fails when a value is still open; there is no more input to complete it.
     */
    void checkComplete() {
        if (hasPending()) {
            throw unterminated();
        }
    }

    Optional<String> scriptRef() {
        return Optional.ofNullable(scriptRef);
    }

    Map<String, Value> properties() {
        return properties;
    }

    void close(DocumentAssembler assembler) {
        checkComplete();
        if (tag == SectionTag.NODE) {
            assembler.node(header, scriptRef(), properties);
        }else {
            assembler.subResource(header, properties);
        }
    }

    private void commitIfComplete() {
        if (!pendingNesting.isBalanced()) {
            return;
        }
        var key = pendingKey;
        var text = pendingText.toString()
                              .strip();
        var location = pendingLocation;
        pendingKey = null;
        pendingText = null;
        pendingNesting = null;
        pendingLocation = null;

        // The node script stays raw text; it is resolved lazily against the ext_resources.
        if (tag == SectionTag.NODE && key.equals(SCRIPT)) {
            if (text.isEmpty()) {
                throw invalid(location, key, "empty value");
            }
            scriptRef = text.equals("null") ? null : text;
            scriptSeen = true;
            return;
        }
        try {
            properties.put(key, ValueParser.parse(text, maxNestingDepth));
        } catch (ValueParseException e) {
            throw invalid(location, key, e.reason() + " near '" + e.fragment() + "'");
        }
    }

    private SceneParseException unterminated() {
        return new SceneParseException(new ParseError.UnterminatedValue(pendingLocation,
                                                                         pendingKey,
                                                                         pendingNesting.describe()));
    }

    private static SceneParseException invalid(SourceLocation location, String key, String reason) {
        return new SceneParseException(new ParseError.InvalidValue(location, key, reason));
    }
}
