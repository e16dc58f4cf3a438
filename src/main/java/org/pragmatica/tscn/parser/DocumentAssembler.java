package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.Diagnostic;
import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.scene.Connection;
import org.pragmatica.tscn.scene.EditableInstance;
import org.pragmatica.tscn.scene.ExtResource;
import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.scene.SceneHeader;
import org.pragmatica.tscn.scene.SceneNode;
import org.pragmatica.tscn.scene.SubResource;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects scanned sections in declaration order and produces one immutable {@link SceneDocument}.
 */
public final class DocumentAssembler {
    private final int defaultFormatVersion;
    private final int maxNestingDepth;

    private SceneHeader header;
    private final List<ExtResource> extResources = new ArrayList<>();
    private final List<SubResource> subResources = new ArrayList<>();
    private final List<SceneNode> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<EditableInstance> editableInstances = new ArrayList<>();
    private final Set<String> extResourceIds = new HashSet<>();
    private final Set<String> subResourceIds = new HashSet<>();

    private final List<Diagnostic> warnings = new ArrayList<>();

    private DocumentAssembler(int defaultFormatVersion, int maxNestingDepth) {
        this.defaultFormatVersion = defaultFormatVersion;
        this.maxNestingDepth = maxNestingDepth;
    }

    public static DocumentAssembler create(int defaultFormatVersion) {
        return new DocumentAssembler(defaultFormatVersion, ValueParser.DEFAULT_MAX_DEPTH);
    }

    public static DocumentAssembler create(ParserConfig config) {
        return new DocumentAssembler(config.defaultFormatVersion(), config.maxNestingDepth());
    }

    int maxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Record a problem that does not stop the parse.
     */
    void warn(String message, SourceLocation location) {
        warnings.add(Diagnostic.warning(message, location));
    }

    /**
     * Warnings recorded so far, in source order.
     */
    public List<Diagnostic> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * {@code [gd_scene format=3 uid="uid://..."]}. The format attribute is required and positive.
     */
    public void header(SectionHeader section) {
        if (header != null) {
            throw duplicate(section, "scene header");
        }
        var attributes = section.attributes();
        var format = attributes.require("format");
        int formatVersion = attributes.integer("format")
                                      .orElseThrow();
        if (formatVersion <= 0) {
            throw new SceneParseException(new ParseError.InvalidAttribute(section.location(),
                                                                          section.tag(),
                                                                          "format",
                                                                          format,
                                                                          "must be a positive integer"));
        }
        header = new SceneHeader(formatVersion,
                                 attributes.get("uid"),
                                 attributes.integer("load_steps"),
                                 attributes.get("uid_type"),
                                 attributes.asMap());
    }

    public void extResource(SectionHeader section) {
        var attributes = section.attributes();
        var id = attributes.require("id");
        if (!extResourceIds.add(id)) {
            throw duplicate(section, "id '" + id + "'");
        }
        extResources.add(new ExtResource(id,
                                         attributes.getOrDefault("type", ""),
                                         attributes.require("path"),
                                         attributes.get("uid"),
                                         attributes.asMap()));
    }

    /**
     * Register a sub-resource id when its header is read, so a clash is reported at the header.
     */
    public void reserveSubResource(SectionHeader section) {
        var id = section.attributes()
                        .require("id");
        if (!subResourceIds.add(id)) {
            throw duplicate(section, "id '" + id + "'");
        }
    }

    public void subResource(SectionHeader section, Map<String, Value> properties) {
        var attributes = section.attributes();
        subResources.add(new SubResource(attributes.require("id"),
                                         attributes.getOrDefault("type", ""),
                                         properties,
                                         attributes.asMap()));
    }

    /**
     * Add a node; its id is its position among the nodes assembled so far.
     */
    public SceneNode node(SectionHeader section, Optional<String> scriptRef, Map<String, Value> properties) {
        var attributes = section.attributes();
        var node = new SceneNode(nodes.size(),
                                 attributes.require("name"),
                                 attributes.get("type"),
                                 attributes.get("parent"),
                                 scriptRef.or(() -> attributes.get("script")),
                                 properties,
                                 attributes.get("instance"),
                                 attributes.get("instance_placeholder"),
                                 attributes.get("owner"),
                                 attributes.integer("index"),
                                 groups(attributes),
                                 attributes.asMap());
        nodes.add(node);
        return node;
    }

    public void connection(SectionHeader section) {
        var attributes = section.attributes();
        var binds = attributes.value("binds")
                              .map(DocumentAssembler::elements)
                              .orElse(List.of());
        connections.add(new Connection(attributes.getOrDefault("signal", ""),
                                       attributes.getOrDefault("from", ""),
                                       attributes.getOrDefault("to", ""),
                                       attributes.getOrDefault("method", ""),
                                       attributes.integer("flags"),
                                       binds,
                                       attributes.asMap()));
    }

    public void editable(SectionHeader section) {
        editableInstances.add(new EditableInstance(section.attributes()
                                                          .require("path")));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public SceneDocument assemble() {
        return new SceneDocument(header != null ? header : SceneHeader.defaultHeader(defaultFormatVersion),
                                 extResources,
                                 subResources,
                                 nodes,
                                 connections,
                                 editableInstances);
    }

    private static List<String> groups(HeaderAttributes attributes) {
        return attributes.value("groups")
                         .map(DocumentAssembler::elements)
                         .orElse(List.of())
                         .stream()
                         .filter(Value.StringLit.class::isInstance)
                         .map(value -> ((Value.StringLit) value).value())
                         .toList();
    }

    private static List<Value> elements(Value value) {
        return value instanceof Value.ArrayLit array ? array.elements() : List.of(value);
    }

    private static SceneParseException duplicate(SectionHeader section, String what) {
        return new SceneParseException(new ParseError.Duplicate(section.location(), section.tag(), what));
    }
}
