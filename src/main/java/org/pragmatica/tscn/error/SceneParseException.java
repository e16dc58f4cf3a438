package org.pragmatica.tscn.error;

/**
 * Thrown by the throwing parse entry points; carries the structural error.
 */
public final class SceneParseException extends RuntimeException {
    private final ParseError error;

    public SceneParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
