package org.pragmatica.tscn.error;

import org.pragmatica.tscn.parser.SourceLocation;

/**
 * Structural error in scene text. Any of these fails the whole parse.
 *
 * <p>Every message starts with {@code "Parse error"} followed by the location, so consumers
 * can recognize and display it directly.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    private static String prefix(SourceLocation location) {
        return "Parse error at " + location + ": ";
    }

    /**
     * Unexpected text where something else was required.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "unexpected '" + found + "', expected " + expected;
        }
    }

    /**
     * Property value whose bracket, parenthesis or quote nesting never returns to zero.
     */
    record UnterminatedValue(
    SourceLocation location,
    String key,
    String reason) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "unterminated value for property '" + key + "' (" + reason + ")";
        }
    }

    /**
     * Property line in a place where no section accepts properties.
     */
    record PropertyOutsideSection(
    SourceLocation location,
    String line,
    String section) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "property '" + line + "' is not allowed " + section;
        }
    }

    /**
     * Section header lacking an attribute it cannot do without.
     */
    record MissingAttribute(
    SourceLocation location,
    String section,
    String attribute) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "[" + section + "] is missing required attribute '" + attribute + "'";
        }
    }

    /**
     * Attribute present but with a value of the wrong shape.
     */
    record InvalidAttribute(
    SourceLocation location,
    String section,
    String attribute,
    String value,
    String reason) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "[" + section + "] attribute " + attribute + "=" + value + " " + reason;
        }
    }

    /**
     * Section tag this parser does not know.
     */
    record UnknownSection(
    SourceLocation location,
    String tag) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "unknown section [" + tag + "]";
        }
    }

    /**
     * Section that may only appear once, or resource id declared twice.
     */
    record Duplicate(
    SourceLocation location,
    String section,
    String what) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "duplicate " + what + " in [" + section + "]";
        }
    }

    /**
     * Property value rejected by the value grammar.
     */
    record InvalidValue(
    SourceLocation location,
    String key,
    String reason) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "invalid value for property '" + key + "': " + reason;
        }
    }

    /**
     * Text longer than the configured limit; nothing of it is scanned.
     */
    record InputTooLarge(
    SourceLocation location,
    int size,
    int limit) implements ParseError {
        @Override
        public String message() {
            return prefix(location) + "input of " + size + " characters exceeds maximum size of " + limit + " characters";
        }
    }
}
