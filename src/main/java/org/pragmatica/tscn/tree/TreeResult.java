package org.pragmatica.tscn.tree;

import org.pragmatica.tscn.error.TreeError;

import java.util.Optional;

/**
 * Result of building a node tree: a tree, an empty scene, or a hierarchy anomaly.
 */
public sealed interface TreeResult {

    boolean isSuccess();

    Optional<TreeNode> tree();

    /**
     * The root, or throws {@link IllegalStateException} describing why there is none.
     */
    TreeNode unwrap();

    /**
     * Tree built from the single root.
     */
    record Built(TreeNode root) implements TreeResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<TreeNode> tree() {
            return Optional.of(root);
        }

        @Override
        public TreeNode unwrap() {
            return root;
        }

        public int nodeCount() {
            return root.nodeCount();
        }
    }

    /**
     * The document has no nodes.
     */
    record Empty() implements TreeResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<TreeNode> tree() {
            return Optional.empty();
        }

        @Override
        public TreeNode unwrap() {
            throw new IllegalStateException("Scene has no nodes");
        }
    }

    /**
     * The document has nodes but no single root.
     */
    record Failure(TreeError cause) implements TreeResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<TreeNode> tree() {
            return Optional.empty();
        }

        @Override
        public TreeNode unwrap() {
            throw new IllegalStateException(cause.message());
        }
    }
}
