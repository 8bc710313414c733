package org.syntree.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A class definition.
 *
 * @param name  The class name.
 * @param bases The base class expressions.
 * @param body  The statements of the class body.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ClassDefNode(String name, List<AstNode> bases, List<AstNode> body, Position position) implements AstNode {

    public ClassDefNode {
        Objects.requireNonNull(name, "name");
        bases = Children.copy(bases);
        body = Children.copy(body);
    }

    public ClassDefNode(String name, List<AstNode> bases, List<AstNode> body) {
        this(name, bases, body, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(bases, body);
    }

    @Override
    public Map<String, Object> fields() {
        return Map.of("name", name);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, bases.size() + body.size(), kind());
        return new ClassDefNode(name,
                Children.slice(newChildren, 0, bases.size()),
                Children.slice(newChildren, bases.size(), newChildren.size()), position);
    }
}
