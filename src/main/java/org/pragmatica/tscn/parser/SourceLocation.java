package org.pragmatica.tscn.parser;

/**
 * A position in scene text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    public static SourceLocation lineStart(int line) {
        return new SourceLocation(line, 1);
    }

    public SourceLocation shift(int columns) {
        return new SourceLocation(line, column + columns);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
