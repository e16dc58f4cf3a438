package org.pragmatica.tscn;

import org.pragmatica.tscn.error.RecoveryStrategy;
import org.pragmatica.tscn.parser.ParseResult;
import org.pragmatica.tscn.parser.ParseResultWithDiagnostics;
import org.pragmatica.tscn.parser.ParserConfig;
import org.pragmatica.tscn.parser.SceneParser;
import org.pragmatica.tscn.parser.SectionScanner;
import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.tree.AsciiTreeRenderer;
import org.pragmatica.tscn.tree.NodeTreeBuilder;
import org.pragmatica.tscn.tree.TreeNode;
import org.pragmatica.tscn.tree.TreeResult;

import java.util.Optional;

/**
 * Entry point for reading Godot text scenes.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = TscnParser.parse(text).unwrap();
 * var tree = TscnParser.buildTree(document);
 * tree.map(TscnParser::render).ifPresent(System.out::println);
 * }</pre>
 */
public final class TscnParser {
    private TscnParser() {}

    /**
     * Parse scene text with the default configuration.
     */
    public static ParseResult parse(String text) {
        return parse(text, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(String text, ParserConfig config) {
        return SectionScanner.create(config)
                             .parse(text);
    }

    /**
     * Parse scene text, throwing {@link org.pragmatica.tscn.error.SceneParseException} on a structural error.
     */
    public static SceneDocument parseOrThrow(String text) {
        return parse(text).unwrap();
    }

    /**
     * Parse, skipping broken sections and reporting each one as a diagnostic.
     */
    public static ParseResultWithDiagnostics parseWithDiagnostics(String text) {
        return builder().recovery(RecoveryStrategy.SKIP_SECTION)
                        .build()
                        .parseWithDiagnostics(text);
    }

    public static Optional<TreeNode> buildTree(SceneDocument document) {
        return NodeTreeBuilder.buildTree(document);
    }

    public static Optional<TreeNode> buildTree(SceneDocument document, int maxDepth) {
        return NodeTreeBuilder.buildTree(document, maxDepth);
    }

    /**
     * Build the tree, reporting a missing or ambiguous root instead of guessing.
     */
    public static TreeResult build(SceneDocument document, int maxDepth) {
        return NodeTreeBuilder.build(document, maxDepth);
    }

    public static String render(TreeNode tree) {
        return AsciiTreeRenderer.render(tree);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent construction of a configured {@link SceneParser}.
     */
    public static final class Builder {
        private RecoveryStrategy recoveryStrategy = ParserConfig.DEFAULT.recoveryStrategy();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();
        private int defaultFormatVersion = ParserConfig.DEFAULT.defaultFormatVersion();
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder maxInputSize(int maxInputSize) {
            this.maxInputSize = maxInputSize;
            return this;
        }

        public Builder defaultFormatVersion(int defaultFormatVersion) {
            this.defaultFormatVersion = defaultFormatVersion;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(recoveryStrategy, maxInputSize, defaultFormatVersion, maxNestingDepth);
        }

        public SceneParser build() {
            return SectionScanner.create(config());
        }
    }
}
