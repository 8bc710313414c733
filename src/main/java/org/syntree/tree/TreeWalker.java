package org.syntree.tree;

import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A generic class for traversing a syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between analyses and the tree structure.
 * <p>
 * A walker holds no traversal state in its fields, so one instance may be used by
 * several threads over the same unmutated tree. Every traversal enforces the
 * configured maximum depth.
 */
public class TreeWalker {

    /** The default maximum nesting depth accepted by traversals. */
    public static final int DEFAULT_MAX_DEPTH = 2000;

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;
    private final int maxDepth;

    /**
     * Constructs a walker without handlers, for the generic traversals only.
     */
    public TreeWalker() {
        this(Collections.emptyMap(), DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a walker without handlers and with a custom depth limit.
     * @param maxDepth The maximum nesting depth.
     */
    public TreeWalker(int maxDepth) {
        this(Collections.emptyMap(), maxDepth);
    }

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     * @param maxDepth The maximum nesting depth.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.handlers = handlers;
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its children recursively, in pre-order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        walk(node, 0);
    }

    private void walk(AstNode node, int depth) {
        if (node == null) {
            return;
        }
        checkDepth(depth);

        // Execute the handler for the current node if one is registered.
        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        // Descend recursively into ALL children without knowing their type.
        for (AstNode child : node.getChildren()) {
            walk(child, depth + 1);
        }
    }

    /**
     * Visits every node depth-first, reporting entry and exit with the node depth.
     * @param root The root of the tree.
     * @param visitor The visitor.
     */
    public void visit(AstNode root, NodeVisitor visitor) {
        visit(root, visitor, 0);
    }

    private void visit(AstNode node, NodeVisitor visitor, int depth) {
        checkDepth(depth);
        visitor.enter(node, depth);
        for (AstNode child : node.getChildren()) {
            visit(child, visitor, depth + 1);
        }
        visitor.leave(node, depth);
    }

    /**
     * Collects every node satisfying the predicate, parent before children and children in declaration order.
     * @param root The root of the tree.
     * @param predicate The node filter.
     * @return The matching nodes in pre-order.
     */
    public List<AstNode> collect(AstNode root, Predicate<? super AstNode> predicate) {
        List<AstNode> result = new ArrayList<>();
        collect(root, predicate, result, 0);
        return result;
    }

    private void collect(AstNode node, Predicate<? super AstNode> predicate, List<AstNode> result, int depth) {
        checkDepth(depth);
        if (predicate.test(node)) {
            result.add(node);
        }
        for (AstNode child : node.getChildren()) {
            collect(child, predicate, result, depth + 1);
        }
    }

    /**
     * Transforms a tree by replacing nodes according to a replacement map.
     * The map must be keyed by node identity (see {@link java.util.IdentityHashMap}),
     * because structurally equal nodes at different positions are different nodes.
     * @param node The root node to transform.
     * @param replacements A map from old nodes to their replacements.
     * @return The transformed node (may be the same or a new node).
     */
    public AstNode transform(AstNode node, Map<AstNode, AstNode> replacements) {
        return transform(node, replacements, 0);
    }

    private AstNode transform(AstNode node, Map<AstNode, AstNode> replacements, int depth) {
        if (node == null) {
            return null;
        }
        checkDepth(depth);

        // Check if this node should be replaced
        if (replacements.containsKey(node)) {
            return replacements.get(node);
        }

        // Get the children and transform them
        List<AstNode> children = node.getChildren();
        List<AstNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (AstNode child : children) {
            AstNode transformedChild = transform(child, replacements, depth + 1);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        // If children changed, we need to create a new node
        if (childrenChanged) {
            return node.reconstructWithChildren(transformedChildren);
        }

        return node;
    }

    /**
     * Rewrites a tree bottom-up: the children of a node are rewritten first, the node is rebuilt
     * if any child changed, and then the rewrite function is applied to the (possibly rebuilt) node.
     * Untouched subtrees are returned as the same instances.
     * @param node The root node.
     * @param rewrite The rewrite applied to every node; returns its argument when nothing applies.
     * @return The rewritten root.
     */
    public AstNode rewriteBottomUp(AstNode node, UnaryOperator<AstNode> rewrite) {
        return rewriteBottomUp(node, rewrite, 0);
    }

    private AstNode rewriteBottomUp(AstNode node, UnaryOperator<AstNode> rewrite, int depth) {
        checkDepth(depth);
        List<AstNode> children = node.getChildren();
        AstNode current = node;
        if (!children.isEmpty()) {
            List<AstNode> rewritten = new ArrayList<>(children.size());
            boolean changed = false;
            for (AstNode child : children) {
                AstNode result = rewriteBottomUp(child, rewrite, depth + 1);
                changed |= result != child;
                rewritten.add(result);
            }
            if (changed) {
                current = node.reconstructWithChildren(rewritten);
            }
        }
        return rewrite.apply(current);
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_TOO_DEEP,
                    "Tree is nested deeper than the traversal limit of " + maxDepth);
        }
    }
}
