package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.scene.SceneDocument;

import java.util.Optional;

/**
 * Result of parsing a scene - either the whole document or the error that stopped it.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The document, or throws {@link SceneParseException} carrying the error.
     */
    SceneDocument unwrap();

    Optional<SceneDocument> document();

    Optional<ParseError> error();

    static ParseResult success(SceneDocument document) {
        return new Success(document);
    }

    static ParseResult failure(ParseError error) {
        return new Failure(error);
    }

    record Success(SceneDocument value) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public SceneDocument unwrap() {
            return value;
        }

        @Override
        public Optional<SceneDocument> document() {
            return Optional.of(value);
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }
    }

    record Failure(ParseError cause) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public SceneDocument unwrap() {
            throw new SceneParseException(cause);
        }

        @Override
        public Optional<SceneDocument> document() {
            return Optional.empty();
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        public String message() {
            return cause.message();
        }
    }
}
