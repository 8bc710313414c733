package org.syntree.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The base interface for all nodes in the syntax tree.
 * <p>
 * The built-in kinds form a closed set of immutable records. {@link OpaqueNode} is the
 * extension variant for kinds contributed from outside; it is a leaf for generic traversal
 * and no component interprets it.
 */
public sealed interface AstNode permits ProgramNode, FunctionDefNode, ClassDefNode, AssignNode, ReturnNode,
        IfNode, ForNode, WhileNode, BinOpNode, UnaryOpNode, CallNode, NameNode, AttributeNode, ConstantNode,
        ImportNode, ImportFromNode, ExprNode, RaiseNode, AssertNode, TryNode, ExceptHandlerNode, WithNode,
        PassNode, BreakNode, ContinueNode, OpaqueNode {

    /**
     * Returns the kind tag of this node.
     * @return The kind tag.
     */
    NodeKind kind();

    /**
     * Returns where this node was parsed from.
     * @return The source position, or {@code null} for nodes built by hand or synthesized by a pass.
     */
    Position position();

    /**
     * Returns a list of the direct child nodes in declaration order.
     * This allows a generic {@link TreeWalker} to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Returns the kind-specific scalar fields of this node, in declaration order.
     * Exporters use this together with {@link #getChildren()} to render a node.
     *
     * @return An ordered, unmodifiable map of field name to value.
     */
    default Map<String, Object> fields() {
        return Collections.emptyMap();
    }

    /**
     * Creates a new instance of this node with the given children, keeping all scalar fields.
     * The list must have the same shape {@link #getChildren()} returned for this node.
     *
     * @param newChildren The new children for this node.
     * @return A new instance of this node, never {@code this}.
     */
    AstNode reconstructWithChildren(List<AstNode> newChildren);
}
