package org.syntree.tree;

import java.util.List;

/**
 * A try statement.
 *
 * @param body      The guarded statements.
 * @param handlers  The {@link ExceptHandlerNode} clauses, in source order.
 * @param orElse    The statements run when the body raised nothing.
 * @param finalBody The statements run in every case.
 * @param position  The source position, or {@code null} for a synthesized node.
 */
public record TryNode(List<AstNode> body, List<AstNode> handlers, List<AstNode> orElse,
                      List<AstNode> finalBody, Position position) implements AstNode {

    public TryNode {
        body = Children.copy(body);
        handlers = Children.copy(handlers);
        orElse = Children.copy(orElse);
        finalBody = Children.copy(finalBody);
    }

    public TryNode(List<AstNode> body, List<AstNode> handlers, List<AstNode> orElse, List<AstNode> finalBody) {
        this(body, handlers, orElse, finalBody, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body, handlers, orElse, finalBody);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, body.size() + handlers.size() + orElse.size() + finalBody.size(), kind());
        int a = body.size();
        int b = a + handlers.size();
        int c = b + orElse.size();
        return new TryNode(Children.slice(newChildren, 0, a), Children.slice(newChildren, a, b),
                Children.slice(newChildren, b, c), Children.slice(newChildren, c, newChildren.size()), position);
    }
}
