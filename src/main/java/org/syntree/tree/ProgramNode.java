package org.syntree.tree;

import java.util.List;

/**
 * The root of a module.
 *
 * @param body The top-level statements.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ProgramNode(List<AstNode> body, Position position) implements AstNode {

    public ProgramNode {
        body = Children.copy(body);
    }

    public ProgramNode(List<AstNode> body) {
        this(body, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ProgramNode(newChildren, position);
    }
}
