package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;

/**
 * State of the section scanner between two lines.
 *
 * <pre>
 * SeekingSection --[header]--> InHeaderAttributes(header)   gd_scene, ext_resource, connection, editable
 *                --[header]--> InProperties(block)          node, sub_resource
 * any state      --[header]--> (closes the current section, opens the new one)
 * </pre>
 * Property lines are accepted only by {@link InProperties}. While a multi-line value is pending
 * there, every line belongs to that value, header-looking or not.
 */
public sealed interface ScanState {

    /**
     * Consume one line and return the next state.
     *
     * @throws org.pragmatica.tscn.error.SceneParseException on a structural error
     */
    ScanState accept(String line, int lineNumber, DocumentAssembler assembler);

    /**
     * Called after the last line.
     */
    void finish(DocumentAssembler assembler);

    static ScanState initial() {
        return SeekingSection.START;
    }

    static boolean isSkippable(String line) {
        var trimmed = line.strip();
        return trimmed.isEmpty() || trimmed.charAt(0) == ';';
    }

    static boolean isHeader(String line) {
        return line.stripLeading()
                   .startsWith("[");
    }

    /**
     * Read a header line, register its section and enter the state that reads its body.
     */
    static ScanState open(String line, int lineNumber, DocumentAssembler assembler) {
        var header = SectionHeader.parse(line, lineNumber);
        var tag = SectionTag.fromTag(header.tag())
                            .orElseThrow(() -> new SceneParseException(new ParseError.UnknownSection(header.location(),
                                                                                                    header.tag())));
        switch (tag) {
            case GD_SCENE -> assembler.header(header);
            case EXT_RESOURCE -> assembler.extResource(header);
            case CONNECTION -> assembler.connection(header);
            case EDITABLE -> assembler.editable(header);
            case SUB_RESOURCE -> assembler.reserveSubResource(header);
            case NODE -> header.attributes()
                               .require("name");
        }
        return tag.carriesProperties()
               ? new InProperties(new PropertyBlock(tag, header, assembler.maxNestingDepth()))
               : new InHeaderAttributes(header);
    }

    private static SceneParseException outside(String line, int lineNumber, String where) {
        return new SceneParseException(new ParseError.PropertyOutsideSection(SourceLocation.lineStart(lineNumber),
                                                                             line.strip(),
                                                                             where));
    }

    /**
     * Before the first section, or after a section dropped during recovery.
     *
     * @param discarding ignore property lines instead of failing on them
     */
    record SeekingSection(boolean discarding) implements ScanState {
        static final SeekingSection START = new SeekingSection(false);
        static final SeekingSection DISCARDING = new SeekingSection(true);

        @Override
        public ScanState accept(String line, int lineNumber, DocumentAssembler assembler) {
            if (isSkippable(line)) {
                return this;
            }
            if (isHeader(line)) {
                return open(line, lineNumber, assembler);
            }
            if (discarding) {
                return this;
            }
            throw outside(line, lineNumber, "before the first section");
        }

        @Override
        public void finish(DocumentAssembler assembler) {}
    }

    /**
     * Inside a section described entirely by its header attributes.
     */
    record InHeaderAttributes(SectionHeader header) implements ScanState {
        @Override
        public ScanState accept(String line, int lineNumber, DocumentAssembler assembler) {
            if (isSkippable(line)) {
                return this;
            }
            if (isHeader(line)) {
                return open(line, lineNumber, assembler);
            }
            throw outside(line, lineNumber, "in [" + header.tag() + "], only [node] and [sub_resource] carry properties");
        }

        @Override
        public void finish(DocumentAssembler assembler) {}
    }

    /**
     * Inside a {@code [node]} or {@code [sub_resource]} section, accumulating its properties.
     */
    record InProperties(PropertyBlock block) implements ScanState {
        @Override
        public ScanState accept(String line, int lineNumber, DocumentAssembler assembler) {
            if (block.hasPending()) {
                block.append(line, lineNumber);
                return this;
            }
            if (isSkippable(line)) {
                return this;
            }
            if (isHeader(line)) {
                block.close(assembler);
                return open(line, lineNumber, assembler);
            }
            block.begin(line, lineNumber, assembler);
            return this;
        }

        @Override
        public void finish(DocumentAssembler assembler) {
            block.close(assembler);
        }
    }
}
