package org.syntree.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An import statement, e.g. {@code import os.path as p, sys}.
 *
 * @param names The imported modules with their optional aliases.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ImportNode(List<Alias> names, Position position) implements AstNode {

    /**
     * One imported module.
     *
     * @param name   The dotted module name.
     * @param asName The alias, or {@code null} when none was given.
     */
    public record Alias(String name, String asName) {

        public Alias {
            Objects.requireNonNull(name, "name");
        }

        /**
         * Returns the name this import binds in the enclosing scope:
         * the alias if present, otherwise the first segment of the dotted name.
         * @return The bound name.
         */
        public String boundName() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    public ImportNode {
        names = names == null ? List.of() : List.copyOf(names);
    }

    public ImportNode(List<Alias> names) {
        this(names, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    @Override
    public Map<String, Object> fields() {
        return Map.of("names", names);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new ImportNode(names, position);
    }
}
