package org.pragmatica.tscn.tree;

import org.pragmatica.tscn.error.TreeError;
import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.scene.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the node hierarchy of a document as a {@link TreeNode} tree.
 *
 * <p>{@link #build} reports root anomalies as {@link TreeResult.Failure}; {@link #buildTree} keeps
 * going with the first declared root and only gives up on a document without nodes.
 */
public final class NodeTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(NodeTreeBuilder.class);

    public static final int UNLIMITED_DEPTH = Integer.MAX_VALUE;

    private static final String ROOT_PATH = ".";

    private NodeTreeBuilder() {}

    public static TreeResult build(SceneDocument document) {
        return build(document, UNLIMITED_DEPTH);
    }

    /**
     * Build the tree below the single root, omitting nodes deeper than {@code maxDepth}.
     */
    public static TreeResult build(SceneDocument document, int maxDepth) {
        checkDepth(maxDepth);
        if (document.isEmpty()) {
            return new TreeResult.Empty();
        }
        var roots = document.rootNodes();
        if (roots.isEmpty()) {
            return new TreeResult.Failure(new TreeError.NoRootNode(document.nodes()
                                                                           .size()));
        }
        if (roots.size() > 1) {
            return new TreeResult.Failure(new TreeError.MultipleRootNodes(roots.stream()
                                                                               .map(SceneNode::name)
                                                                               .toList()));
        }
        return new TreeResult.Built(assemble(NodeIndex.of(document), roots.get(0), maxDepth));
    }

    public static Optional<TreeNode> buildTree(SceneDocument document) {
        return buildTree(document, UNLIMITED_DEPTH);
    }

    /**
     * Build the tree from the first parentless node, or from the first declared node when every
     * node names a parent. Empty only for a document without nodes.
     */
    public static Optional<TreeNode> buildTree(SceneDocument document, int maxDepth) {
        checkDepth(maxDepth);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        var index = NodeIndex.of(document);
        var root = index.primaryRoot()
                        .orElseGet(() -> document.nodes()
                                                 .get(0));
        if (index.roots()
                 .size() > 1) {
            log.warn("Scene has {} root nodes, using '{}'", index.roots().size(), root.name());
        }
        return Optional.of(assemble(index, root, maxDepth));
    }

    private static TreeNode assemble(NodeIndex index, SceneNode root, int maxDepth) {
        if (!index.orphans()
                  .isEmpty()) {
            log.warn("{} node(s) could not be attached to the tree: {}",
                     index.orphans().size(),
                     index.orphans()
                          .stream()
                          .map(node -> node.name() + " (parent=" + node.parent().orElse("") + ")")
                          .toList());
        }
        var tree = node(index, root, ROOT_PATH, 0, maxDepth);
        log.debug("Built tree from '{}': {} node(s), max depth {}", root.name(), tree.nodeCount(), describe(maxDepth));
        return tree;
    }

    private static TreeNode node(NodeIndex index, SceneNode node, String path, int depth, int maxDepth) {
        var children = new ArrayList<TreeNode>();
        if (depth < maxDepth) {
            for (var child : index.children(node)) {
                var childPath = path.equals(ROOT_PATH) ? child.name() : path + "/" + child.name();
                children.add(node(index, child, childPath, depth + 1, maxDepth));
            }
        }
        return new TreeNode(node.name(),
                            node.type()
                                .orElse(TreeNode.DEFAULT_TYPE),
                            path,
                            node.hasScript(),
                            SceneQueries.scriptPath(index.document(), node),
                            children,
                            List.copyOf(node.properties()
                                            .keySet()));
    }

    private static void checkDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    private static String describe(int maxDepth) {
        return maxDepth == UNLIMITED_DEPTH ? "unlimited" : String.valueOf(maxDepth);
    }
}
