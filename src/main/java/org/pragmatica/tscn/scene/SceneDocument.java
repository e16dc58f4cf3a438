package org.pragmatica.tscn.scene;

import java.util.List;
import java.util.Optional;

/**
 * Parsed scene file. Immutable; sections keep their declaration order.
 */
public record SceneDocument(
    SceneHeader header,
    List<ExtResource> extResources,
    List<SubResource> subResources,
    List<SceneNode> nodes,
    List<Connection> connections,
    List<EditableInstance> editableInstances
) {
    public SceneDocument {
        extResources = List.copyOf(extResources);
        subResources = List.copyOf(subResources);
        nodes = List.copyOf(nodes);
        connections = List.copyOf(connections);
        editableInstances = List.copyOf(editableInstances);
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() != i) {
                throw new IllegalArgumentException("Node '" + nodes.get(i).name() + "' has id " + nodes.get(i).id()
                                                   + " but is declared at position " + i);
            }
        }
    }

    public static SceneDocument empty() {
        return new SceneDocument(SceneHeader.defaultHeader(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public Optional<ExtResource> findExtResource(String id) {
        return extResources.stream()
                           .filter(resource -> resource.id().equals(id))
                           .findFirst();
    }

    public Optional<SubResource> findSubResource(String id) {
        return subResources.stream()
                           .filter(resource -> resource.id().equals(id))
                           .findFirst();
    }

    /**
     * Nodes without a {@code parent} attribute; a well-formed scene has exactly one.
     */
    public List<SceneNode> rootNodes() {
        return nodes.stream()
                    .filter(SceneNode::isRoot)
                    .toList();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
