package org.syntree.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A binary operation, e.g. {@code left + right} or {@code left < right}.
 *
 * @param left  The left operand.
 * @param op    The operator symbol, e.g. {@code "+"}, {@code "//"}, {@code "=="}.
 * @param right The right operand.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record BinOpNode(AstNode left, String op, AstNode right, Position position) implements AstNode {

    public BinOpNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }

    public BinOpNode(AstNode left, String op, AstNode right) {
        this(left, op, right, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BIN_OP;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public Map<String, Object> fields() {
        return Map.of("op", op);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 2, kind());
        return new BinOpNode(newChildren.get(0), op, newChildren.get(1), position);
    }
}
