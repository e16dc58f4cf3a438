package org.pragmatica.tscn.error;

import java.util.List;

/**
 * Anomaly in the node hierarchy that prevents an unambiguous tree.
 */
public sealed interface TreeError {
    String message();

    /**
     * No node without a {@code parent} attribute.
     */
    record NoRootNode(int nodeCount) implements TreeError {
        @Override
        public String message() {
            return "Scene has " + nodeCount + " node(s) but none without a parent";
        }
    }

    /**
     * More than one node without a {@code parent} attribute.
     */
    record MultipleRootNodes(List<String> rootNames) implements TreeError {
        public MultipleRootNodes {
            rootNames = List.copyOf(rootNames);
        }

        @Override
        public String message() {
            return "Scene has " + rootNames.size() + " root nodes: " + String.join(", ", rootNames);
        }
    }
}
