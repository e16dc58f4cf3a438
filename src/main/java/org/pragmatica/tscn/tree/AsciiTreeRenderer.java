package org.pragmatica.tscn.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a tree with box-drawing connectors:
 * <pre>
 * Root (Node2D)
 * ├── Player (CharacterBody2D) [script: res://scripts/player.gd]
 * │   └── Sprite (Sprite2D)
 * └── Camera (Camera2D)
 * </pre>
 */
public final class AsciiTreeRenderer {
    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String CONTINUATION = "│   ";
    private static final String LAST_CONTINUATION = "    ";

    private AsciiTreeRenderer() {}

    public static String render(TreeNode root) {
        var lines = new ArrayList<String>();
        lines.add(label(root));
        renderChildren(root, "", lines);
        return String.join("\n", lines);
    }

    private static void renderChildren(TreeNode node, String prefix, List<String> lines) {
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            boolean last = i == children.size() - 1;
            lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(child));
            renderChildren(child, prefix + (last ? LAST_CONTINUATION : CONTINUATION), lines);
        }
    }

    private static String label(TreeNode node) {
        var label = node.name() + " (" + node.type() + ")";
        if (node.hasScript()) {
            label += " [script: " + node.scriptPath()
                                        .orElse("attached") + "]";
        }
        return label;
    }
}
