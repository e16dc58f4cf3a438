package org.pragmatica.tscn.tree;

import org.pragmatica.tscn.scene.Connection;
import org.pragmatica.tscn.scene.ExtResource;
import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.scene.SceneNode;
import org.pragmatica.tscn.scene.SubResource;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueParseException;
import org.pragmatica.tscn.value.ValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lookups over a parsed document. Reference misses are reported as empty results, never as errors.
 */
public final class SceneQueries {
    private static final Logger log = LoggerFactory.getLogger(SceneQueries.class);

    private static final String ROOT_ALIAS = "root";

    private SceneQueries() {}

    /**
     * Find a node by its path from the scene root.
     *
     * <p>{@code "."}, {@code ""}, {@code "root"} and the root's own name address the root.
     * A leading {@code "root/"}, {@code "./"} or root-name segment is accepted before a
     * root-relative path such as {@code "Player/Sprite"}.
     */
    public static Optional<SceneNode> findNodeByPath(SceneDocument document, String path) {
        var index = NodeIndex.of(document);
        var root = index.primaryRoot();
        if (root.isEmpty()) {
            return Optional.empty();
        }
        var trimmed = path.strip();
        var rootName = root.get()
                           .name();
        if (trimmed.isEmpty() || trimmed.equals(".") || trimmed.equals(ROOT_ALIAS) || trimmed.equals(rootName)) {
            return root;
        }
        var found = index.walk(trimmed);
        if (found.isPresent()) {
            return found;
        }
        for (var prefix : List.of(ROOT_ALIAS + "/", rootName + "/")) {
            if (trimmed.startsWith(prefix)) {
                found = index.walk(trimmed.substring(prefix.length()));
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public static List<SceneNode> nodesByType(SceneDocument document, String type) {
        return document.nodes()
                       .stream()
                       .filter(node -> node.type()
                                           .filter(type::equals)
                                           .isPresent())
                       .toList();
    }

    public static List<SceneNode> nodesByGroup(SceneDocument document, String group) {
        return document.nodes()
                       .stream()
                       .filter(node -> node.groups()
                                           .contains(group))
                       .toList();
    }

    /**
     * Path of the node from the scene root, as used in {@code parent} and connection attributes.
     */
    public static Optional<String> nodePath(SceneDocument document, SceneNode node) {
        return NodeIndex.of(document)
                        .pathOf(node);
    }

    /**
     * Find an external resource by bare id ({@code "1_abc"}) or by reference text
     * ({@code ExtResource("1_abc")}).
     */
    public static Optional<ExtResource> findExtResource(SceneDocument document, String idOrReference) {
        return referencedId(idOrReference, true).flatMap(document::findExtResource);
    }

    /**
     * Find an inline resource by bare id or by {@code SubResource("id")} text.
     */
    public static Optional<SubResource> findSubResource(SceneDocument document, String idOrReference) {
        return referencedId(idOrReference, false).flatMap(document::findSubResource);
    }

    /**
     * File path of the node's script; empty when the node has none or its reference does not
     * match a declared {@code ext_resource}.
     */
    public static Optional<String> scriptPath(SceneDocument document, SceneNode node) {
        if (node.scriptRef()
                .isEmpty()) {
            return Optional.empty();
        }
        var reference = node.scriptRef()
                            .get();
        var path = findExtResource(document, reference).map(ExtResource::path);
        if (path.isEmpty()) {
            log.debug("Script reference {} of node '{}' does not match any ext_resource", reference, node.name());
        }
        return path;
    }

    /**
     * Connections whose {@code from} is the given node path.
     */
    public static List<Connection> connectionsFrom(SceneDocument document, String path) {
        var normalized = normalize(path);
        return document.connections()
                       .stream()
                       .filter(connection -> normalize(connection.from()).equals(normalized))
                       .toList();
    }

    private static String normalize(String path) {
        var trimmed = path.strip();
        if (trimmed.startsWith("./")) {
            return trimmed.substring(2);
        }
        return trimmed.isEmpty() ? "." : trimmed;
    }

    private static Optional<String> referencedId(String idOrReference, boolean external) {
        var text = idOrReference.strip();
        if (!text.endsWith(")")) {
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        try {
            var value = ValueParser.parse(text);
            if (external && value instanceof Value.ExtRef ref) {
                return Optional.of(ref.id());
            }
            if (!external && value instanceof Value.SubRef ref) {
                return Optional.of(ref.id());
            }
            return Optional.empty();
        } catch (ValueParseException e) {
            log.debug("Unreadable resource reference {}: {}", text, e.getMessage());
            return Optional.empty();
        }
    }
}
