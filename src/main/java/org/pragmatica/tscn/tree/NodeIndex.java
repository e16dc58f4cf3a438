package org.pragmatica.tscn.tree;

import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.scene.SceneNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parent/child links of a document's nodes, resolved once from the name-based {@code parent} paths.
 *
 * <p>A {@code parent} path is walked from the first root through sibling names, so repeated
 * names in different branches resolve correctly. When the walk fails (for example, a node
 * declared before its parent) the last path segment is looked up as a document-wide name;
 * if two nodes share that name the first declared wins. A link that would close a cycle is
 * dropped. Nodes that still cannot be attached are reported as orphans.
 */
public final class NodeIndex {
    private static final int NONE = -1;
    private static final String ROOT_PATH = ".";

    private final SceneDocument document;
    private final List<SceneNode> roots;
    private final int[] parentIds;
    private final List<List<SceneNode>> children;
    private final String[] paths;
    private final List<SceneNode> orphans;

    private NodeIndex(SceneDocument document) {
        this.document = document;
        var nodes = document.nodes();
        this.roots = document.rootNodes();
        this.parentIds = new int[nodes.size()];
        Arrays.fill(parentIds, NONE);
        this.children = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            children.add(new ArrayList<>());
        }
        this.paths = new String[nodes.size()];
        resolveParents();
        this.orphans = collectOrphans();
    }

    public static NodeIndex of(SceneDocument document) {
        return new NodeIndex(document);
    }

    public SceneDocument document() {
        return document;
    }

    /**
     * The first declared node without a parent.
     */
    public Optional<SceneNode> primaryRoot() {
        return roots.isEmpty() ? Optional.empty() : Optional.of(roots.get(0));
    }

    public List<SceneNode> roots() {
        return roots;
    }

    /**
     * Children in declaration order.
     */
    public List<SceneNode> children(SceneNode node) {
        return List.copyOf(children.get(node.id()));
    }

    public Optional<SceneNode> parentOf(SceneNode node) {
        int parentId = parentIds[node.id()];
        return parentId == NONE ? Optional.empty() : Optional.of(document.nodes().get(parentId));
    }

    /**
     * Path from the primary root: {@code "."} for the root itself, {@code "Player/Sprite"} below it.
     * Empty for nodes outside the primary root's subtree.
     */
    public Optional<String> pathOf(SceneNode node) {
        return Optional.ofNullable(paths[node.id()]);
    }

    /**
     * Nodes that are neither roots nor reachable from one.
     */
    public List<SceneNode> orphans() {
        return orphans;
    }

    /**
     * Walk a root-relative path ({@code "Player/Sprite"}) through child names.
     */
    public Optional<SceneNode> walk(String path) {
        var current = primaryRoot();
        for (var segment : path.split("/")) {
            if (current.isEmpty()) {
                break;
            }
            if (segment.isEmpty() || segment.equals(ROOT_PATH)) {
                continue;
            }
            var parent = current.get();
            current = children.get(parent.id())
                              .stream()
                              .filter(child -> child.name()
                                                    .equals(segment))
                              .findFirst();
        }
        return current;
    }

    private void resolveParents() {
        var nodes = document.nodes();
        var firstByName = new HashMap<String, Integer>();
        for (var node : nodes) {
            firstByName.putIfAbsent(node.name(), node.id());
        }
        int primary = roots.isEmpty() ? NONE : roots.get(0).id();
        var childrenByName = new ArrayList<Map<String, Integer>>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            childrenByName.add(new LinkedHashMap<>());
        }
        for (var node : nodes) {
            if (node.isRoot()) {
                continue;
            }
            int parentId = resolve(node, primary, childrenByName, firstByName);
            if (parentId == NONE || closesCycle(node.id(), parentId)) {
                continue;
            }
            parentIds[node.id()] = parentId;
            childrenByName.get(parentId)
                          .putIfAbsent(node.name(), node.id());
        }
        for (var node : nodes) {
            int parentId = parentIds[node.id()];
            if (parentId != NONE) {
                children.get(parentId)
                        .add(node);
            }
        }
        if (primary != NONE) {
            assignPaths(nodes.get(primary));
        }
    }

    private static int resolve(SceneNode node,
                               int primary,
                               List<Map<String, Integer>> childrenByName,
                               Map<String, Integer> firstByName) {
        var parentPath = node.parent()
                             .orElseThrow();
        if (parentPath.equals(SceneNode.ROOT_PARENT)) {
            return primary;
        }
        int current = primary;
        String last = null;
        for (var segment : parentPath.split("/")) {
            if (segment.isEmpty() || segment.equals(ROOT_PATH)) {
                continue;
            }
            last = segment;
            if (current != NONE) {
                current = childrenByName.get(current)
                                        .getOrDefault(segment, NONE);
            }
        }
        if (current != NONE && last != null) {
            return current;
        }
        return last == null ? NONE : firstByName.getOrDefault(last, NONE);
    }

    private boolean closesCycle(int nodeId, int parentId) {
        for (int current = parentId; current != NONE; current = parentIds[current]) {
            if (current == nodeId) {
                return true;
            }
        }
        return false;
    }

    private void assignPaths(SceneNode root) {
        paths[root.id()] = ROOT_PATH;
        var pending = new ArrayDeque<SceneNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            var path = paths[node.id()];
            for (var child : children.get(node.id())) {
                if (paths[child.id()] != null) {
                    continue;
                }
                paths[child.id()] = path.equals(ROOT_PATH) ? child.name() : path + "/" + child.name();
                pending.push(child);
            }
        }
    }

    private List<SceneNode> collectOrphans() {
        var reachable = new boolean[parentIds.length];
        var pending = new ArrayDeque<SceneNode>(roots);
        for (var root : roots) {
            reachable[root.id()] = true;
        }
        while (!pending.isEmpty()) {
            var node = pending.pop();
            for (var child : children.get(node.id())) {
                if (!reachable[child.id()]) {
                    reachable[child.id()] = true;
                    pending.push(child);
                }
            }
        }
        var result = new ArrayList<SceneNode>();
        for (var node : document.nodes()) {
            if (!reachable[node.id()]) {
                result.add(node);
            }
        }
        return List.copyOf(result);
    }
}
