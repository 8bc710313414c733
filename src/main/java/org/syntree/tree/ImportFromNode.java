package org.syntree.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code from ... import} statement, e.g. {@code from ..pkg import a as b, c}.
 *
 * @param module   The module imported from, or {@code null} for {@code from . import x}.
 * @param names    The imported names with their optional aliases; {@code *} for a star import.
 * @param level    The number of leading dots of a relative import; 0 for an absolute one.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ImportFromNode(String module, List<ImportNode.Alias> names, int level, Position position)
        implements AstNode {

    public ImportFromNode {
        names = names == null ? List.of() : List.copyOf(names);
        if (level < 0) {
            throw new IllegalArgumentException("Negative import level " + level);
        }
    }

    public ImportFromNode(String module, List<ImportNode.Alias> names, int level) {
        this(module, names, level, null);
    }

    /**
     * Returns the name a single imported entry binds. Unlike a plain import, the whole
     * imported name is bound, not its first dotted segment.
     * @param alias One of {@link #names()}.
     * @return The alias if present, otherwise the imported name.
     */
    public static String boundName(ImportNode.Alias alias) {
        return alias.asName() != null ? alias.asName() : alias.name();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_FROM;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("module", module);
        fields.put("names", names);
        fields.put("level", level);
        return fields;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new ImportFromNode(module, names, level, position);
    }
}
