package org.syntree.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unary operation, e.g. {@code -x} or {@code not x}.
 *
 * @param op      The operator symbol: {@code "-"}, {@code "+"}, {@code "~"} or {@code "not"}.
 * @param operand The operand.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record UnaryOpNode(String op, AstNode operand, Position position) implements AstNode {

    public UnaryOpNode {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }

    public UnaryOpNode(String op, AstNode operand) {
        this(op, operand, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public Map<String, Object> fields() {
        return Map.of("op", op);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1, kind());
        return new UnaryOpNode(op, newChildren.get(0), position);
    }
}
