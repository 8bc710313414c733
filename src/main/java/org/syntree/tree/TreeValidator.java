package org.syntree.tree;

import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks the structural invariants every component relies on: the tree is acyclic,
 * every node instance appears under exactly one parent, no child slot is empty and the
 * nesting stays within the traversal limit.
 * <p>
 * Violations are reported, never repaired.
 */
public class TreeValidator {

    private final int maxDepth;

    public TreeValidator() {
        this(TreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth The maximum nesting depth accepted.
     */
    public TreeValidator(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Validates the tree rooted at the given node.
     * @param root The root node.
     * @throws StructuralInvariantViolationException on the first violation found.
     */
    public void validate(AstNode root) {
        if (root == null) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_NULL_CHILD, "Tree root is null");
        }
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<AstNode> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
        check(root, seen, ancestors, 0);
    }

    /**
     * Checks the tree without throwing.
     * @param root The root node.
     * @return {@code true} if all invariants hold.
     */
    public boolean isValid(AstNode root) {
        try {
            validate(root);
            return true;
        } catch (StructuralInvariantViolationException e) {
            return false;
        }
    }

    private void check(AstNode node, Set<AstNode> seen, Set<AstNode> ancestors, int depth) {
        if (depth > maxDepth) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_TOO_DEEP,
                    "Tree is nested deeper than the traversal limit of " + maxDepth);
        }
        if (ancestors.contains(node)) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_CYCLE,
                    "Node " + node.kind().tag() + " is its own ancestor");
        }
        if (!seen.add(node)) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_SHARED_NODE,
                    "Node " + describe(node) + " appears under more than one parent");
        }
        ancestors.add(node);
        for (AstNode child : node.getChildren()) {
            if (child == null) {
                throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_NULL_CHILD,
                        "Node " + node.kind().tag() + " has a null child");
            }
            check(child, seen, ancestors, depth + 1);
        }
        ancestors.remove(node);
    }

    private static String describe(AstNode node) {
        if (node instanceof NameNode name) {
            return "Name(" + name.id() + ")";
        }
        return node.kind().tag();
    }
}
