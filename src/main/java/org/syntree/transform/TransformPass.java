package org.syntree.transform;

import org.syntree.tree.AstNode;

/**
 * A named tree rewrite.
 * <p>
 * A pass returns a tree and never mutates its input. Subtrees it does not rewrite may be
 * returned as the same instances, but no node instance may appear twice in the result.
 * A pass that finds nothing to rewrite returns its input.
 */
public interface TransformPass {

    /**
     * @return The name under which the pass is logged, registered and looked up.
     */
    String name();

    /**
     * Rewrites a tree.
     * @param tree The root of the tree.
     * @return The root of the rewritten tree.
     */
    AstNode transform(AstNode tree);
}
