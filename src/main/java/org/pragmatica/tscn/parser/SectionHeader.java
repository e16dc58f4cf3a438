package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.ValueParseException;
import org.pragmatica.tscn.value.ValueParser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One bracketed header line: {@code [tag attr="value" attr2=bareword attr3=Ctor(...)]}.
 *
 * @param tag        section tag as written
 * @param attributes header attributes
 * @param location   where the header starts
 */
public record SectionHeader(String tag, HeaderAttributes attributes, SourceLocation location) {
    /**
     * Parse a header line.
     *
     * @param line       the raw line, possibly indented
     * @param lineNumber 1-based line number
     * @throws SceneParseException if the line is not a well-formed header
     */
    public static SectionHeader parse(String line, int lineNumber) {
        return new Scanner(line, lineNumber).scan();
    }

    /**
     * Whether a raw line opens a section. Used to detect a header swallowed by an unterminated value.
     */
    public static boolean looksLikeHeader(String line) {
        var trimmed = line.strip();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '[' || trimmed.charAt(trimmed.length() - 1) != ']') {
            return false;
        }
        int end = 1;
        while (end < trimmed.length() && isTagPart(trimmed.charAt(end))) {
            end++ ;
        }
        return SectionTag.fromTag(trimmed.substring(1, end))
                         .isPresent();
    }

    private static boolean isTagPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isKeyPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '/' || c == '-' || c == '.';
    }

    private static final class Scanner {
        private final String line;
        private final int lineNumber;
        private int pos;
        private int end;

        private Scanner(String line, int lineNumber) {
            this.line = line;
            this.lineNumber = lineNumber;
        }

        private SectionHeader scan() {
            pos = 0;
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                pos++ ;
            }
            end = line.length();
            while (end > pos && Character.isWhitespace(line.charAt(end - 1))) {
                end-- ;
            }
            var start = location();
            if (pos >= end || line.charAt(pos) != '[') {
                throw unexpected("'[' opening a section header");
            }
            if (line.charAt(end - 1) != ']') {
                pos = end - 1;
                throw unexpected("']' closing the section header");
            }
            end-- ;
            pos++ ;
            // skip [
            int tagStart = pos;
            while (pos < end && isTagPart(line.charAt(pos))) {
                pos++ ;
            }
            if (pos == tagStart) {
                throw unexpected("section tag");
            }
            var tag = line.substring(tagStart, pos);
            var values = scanAttributes(tag);
            return new SectionHeader(tag, new HeaderAttributes(tag, start, values), start);
        }

        private Map<String, String> scanAttributes(String tag) {
            var values = new LinkedHashMap<String, String>();
            while (true) {
                skipWhitespace();
                if (pos >= end) {
                    return values;
                }
                int keyStart = pos;
                while (pos < end && isKeyPart(line.charAt(pos))) {
                    pos++ ;
                }
                if (pos == keyStart) {
                    throw unexpected("attribute name in [" + tag + "]");
                }
                var key = line.substring(keyStart, pos);
                skipWhitespace();
                if (pos >= end || line.charAt(pos) != '=') {
                    throw unexpected("'=' after attribute '" + key + "'");
                }
                pos++ ;
                skipWhitespace();
                if (pos >= end) {
                    throw unexpected("value for attribute '" + key + "'");
                }
                values.put(key, line.charAt(pos) == '"' ? scanQuoted(key) : scanRaw(key));
            }
        }

        /**
         * Quoted value with its escapes decoded the same way as quoted property strings.
         */
        private String scanQuoted(String key) {
            int start = pos;
            pos++ ;
            // skip opening quote
            while (pos < end && line.charAt(pos) != '"') {
                if (line.charAt(pos) == '\\' && pos + 1 < end) {
                    pos++ ;
                }
                pos++ ;
            }
            if (pos >= end) {
                pos = start;
                throw unexpected("closing '\"' for attribute '" + key + "'");
            }
            var body = line.substring(start + 1, pos);
            pos++ ;
            // skip closing quote
            try {
                return ValueParser.unescape(body);
            } catch (ValueParseException e) {
                pos = start + 1 + e.offset();
                throw unexpected("valid escape in attribute '" + key + "' (" + e.reason() + ")");
            }
        }

        /**
         * Bare value: runs to the next top-level whitespace, balancing brackets and quotes.
         */
        private String scanRaw(String key) {
            int start = pos;
            var nesting = Nesting.empty();
            while (pos < end) {
                char c = line.charAt(pos);
                if (nesting.isBalanced() && Character.isWhitespace(c)) {
                    break;
                }
                nesting = nesting.feed(c);
                pos++ ;
            }
            if (!nesting.isBalanced()) {
                pos = start;
                throw unexpected("balanced value for attribute '" + key + "' (" + nesting.describe() + ")");
            }
            return line.substring(start, pos);
        }

        private void skipWhitespace() {
            while (pos < end && Character.isWhitespace(line.charAt(pos))) {
                pos++ ;
            }
        }

        private SourceLocation location() {
            return SourceLocation.at(lineNumber, pos + 1);
        }

        private SceneParseException unexpected(String expected) {
            var found = pos < line.length()
                        ? line.substring(pos, Math.min(line.length(), pos + 16))
                        : "end of line";
            return new SceneParseException(new ParseError.UnexpectedInput(location(), found, expected));
        }
    }
}
