package org.syntree.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A with statement, e.g. {@code with open(p) as f, lock:}.
 *
 * @param items    The context managers, in source order.
 * @param body     The statements run inside the managed block.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record WithNode(List<Item> items, List<AstNode> body, Position position) implements AstNode {

    /**
     * One context manager.
     *
     * @param contextExpr  The expression producing the manager.
     * @param optionalVars The {@code as} target, or {@code null}.
     */
    public record Item(AstNode contextExpr, AstNode optionalVars) {

        public Item {
            Objects.requireNonNull(contextExpr, "contextExpr");
        }

        int width() {
            return optionalVars == null ? 1 : 2;
        }
    }

    public WithNode {
        items = items == null ? List.of() : List.copyOf(items);
        body = Children.copy(body);
    }

    public WithNode(List<Item> items, List<AstNode> body) {
        this(items, body, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> flat = new ArrayList<>();
        for (Item item : items) {
            flat.add(item.contextExpr());
            if (item.optionalVars() != null) {
                flat.add(item.optionalVars());
            }
        }
        flat.addAll(body);
        return List.copyOf(flat);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int width = items.stream().mapToInt(Item::width).sum();
        Children.requireSize(newChildren, width + body.size(), kind());
        List<Item> rebuilt = new ArrayList<>(items.size());
        int index = 0;
        for (Item item : items) {
            AstNode contextExpr = newChildren.get(index++);
            AstNode optionalVars = item.optionalVars() == null ? null : newChildren.get(index++);
            rebuilt.add(new Item(contextExpr, optionalVars));
        }
        return new WithNode(rebuilt, Children.slice(newChildren, width, newChildren.size()), position);
    }
}
