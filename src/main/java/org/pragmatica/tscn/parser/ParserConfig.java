package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.RecoveryStrategy;
import org.pragmatica.tscn.scene.SceneHeader;
import org.pragmatica.tscn.value.ValueParser;

/**
 * Parser configuration options.
 *
 * @param recoveryStrategy     what to do after a structural error
 * @param maxInputSize         largest accepted input, in characters
 * @param defaultFormatVersion format version reported when the text has no {@code [gd_scene]} header
 * @param maxNestingDepth      deepest array, record or argument nesting accepted in a property value
 */
public record ParserConfig(
    RecoveryStrategy recoveryStrategy,
    int maxInputSize,
    int defaultFormatVersion,
    int maxNestingDepth
) {
    public static final int DEFAULT_MAX_INPUT_SIZE = 64 * 1024 * 1024;

    public static final ParserConfig DEFAULT = new ParserConfig(
        RecoveryStrategy.NONE,
        DEFAULT_MAX_INPUT_SIZE,
        SceneHeader.DEFAULT_FORMAT_VERSION,
        ValueParser.DEFAULT_MAX_DEPTH
    );

    public ParserConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive: " + maxInputSize);
        }
        if (defaultFormatVersion <= 0) {
            throw new IllegalArgumentException("defaultFormatVersion must be positive: " + defaultFormatVersion);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public ParserConfig withRecovery(RecoveryStrategy strategy) {
        return new ParserConfig(strategy, maxInputSize, defaultFormatVersion, maxNestingDepth);
    }
}
