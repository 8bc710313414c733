package org.syntree.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for flattening node slots into a child list and splitting it back.
 */
final class Children {

    private Children() {}

    /**
     * Concatenates single nodes and node lists into one child list, skipping absent optional slots.
     * @param parts {@link AstNode} or {@code List<AstNode>} elements; {@code null} entries are skipped.
     * @return The flattened list.
     */
    @SuppressWarnings("unchecked")
    static List<AstNode> of(Object... parts) {
        List<AstNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                result.addAll((List<AstNode>) list);
            }
        }
        return List.copyOf(result);
    }

    static List<AstNode> slice(List<AstNode> children, int from, int to) {
        return List.copyOf(children.subList(from, to));
    }

    static void requireSize(List<AstNode> children, int expected, NodeKind kind) {
        if (children.size() != expected) {
            throw new IllegalArgumentException(kind.tag() + " expects " + expected
                    + " children but got " + children.size());
        }
    }

    static List<AstNode> copy(List<AstNode> nodes) {
        return nodes == null ? List.of() : List.copyOf(nodes);
    }
}
