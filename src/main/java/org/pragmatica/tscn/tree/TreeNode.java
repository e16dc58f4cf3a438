package org.pragmatica.tscn.tree;

import java.util.List;
import java.util.Optional;

/**
 * One node of the reconstructed hierarchy. Derived from a document on every build; never cached.
 *
 * @param name         node name
 * @param type         node class, {@code "Node"} when the scene omits it
 * @param path         names from the root joined by {@code /}; the root itself is {@code "."}
 * @param hasScript    whether the node declares a script
 * @param scriptPath   resolved script file, empty when undeclared or unresolvable
 * @param children     children in declaration order, cut off at the requested depth
 * @param propertyKeys property names only; values stay on the {@link org.pragmatica.tscn.scene.SceneNode}
 */
public record TreeNode(
    String name,
    String type,
    String path,
    boolean hasScript,
    Optional<String> scriptPath,
    List<TreeNode> children,
    List<String> propertyKeys
) {
    public static final String DEFAULT_TYPE = "Node";

    public TreeNode {
        children = List.copyOf(children);
        propertyKeys = List.copyOf(propertyKeys);
    }

    /**
     * This node plus all descendants present in the tree.
     */
    public int nodeCount() {
        int count = 1;
        for (var child : children) {
            count += child.nodeCount();
        }
        return count;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Optional<TreeNode> child(String name) {
        return children.stream()
                       .filter(child -> child.name()
                                             .equals(name))
                       .findFirst();
    }
}
