package org.syntree.tree;

/**
 * Callback for a depth-first visitation of a tree, e.g. by an exporter that renders nodes and edges.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * Called before the children of a node are visited.
     * @param node The node.
     * @param depth The depth of the node; the root has depth 0.
     */
    void enter(AstNode node, int depth);

    /**
     * Called after all children of a node were visited.
     * @param node The node.
     * @param depth The depth of the node.
     */
    default void leave(AstNode node, int depth) {
    }
}
