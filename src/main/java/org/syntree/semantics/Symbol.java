package org.syntree.semantics;

import org.syntree.tree.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Represents a single named declaration (a parameter, a local binding, a function, a class or an
 * import) together with the places it is declared and read.
 * <p>
 * Declaration and use sites are tracked by node identity: two structurally equal
 * {@code Name("x")} nodes at different positions are different sites.
 */
public final class Symbol {

    /**
     * The kind of declaration that introduced a symbol.
     */
    public enum Kind {
        /** A function parameter. */
        PARAMETER,
        /** A name bound by assignment, a loop target or any other store. */
        LOCAL,
        /** A name bound by a function definition. */
        FUNCTION,
        /** A name bound by a class definition. */
        CLASS,
        /** A name bound by an import. */
        IMPORT
    }

    private final String name;
    private final Kind kind;
    private final int scopeId;
    private final List<AstNode> declarations = new ArrayList<>();
    private final Set<AstNode> declarationSet = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<AstNode> useSites = new ArrayList<>();
    private final Set<AstNode> useSiteSet = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean definedBeforeUse = true;

    Symbol(String name, Kind kind, int scopeId) {
        this.name = name;
        this.kind = kind;
        this.scopeId = scopeId;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public int getScopeId() {
        return scopeId;
    }

    /**
     * @return The nodes that declared this symbol, in the order they were seen.
     */
    public List<AstNode> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    /**
     * @return The nodes that read this symbol, in the order they were seen.
     */
    public List<AstNode> getUseSites() {
        return Collections.unmodifiableList(useSites);
    }

    /**
     * Checks by identity whether the given node is one of the declaration sites.
     * @param node The node.
     * @return {@code true} if the node declared this symbol.
     */
    public boolean isDeclaredBy(AstNode node) {
        return declarationSet.contains(node);
    }

    /**
     * Checks by identity whether the given node is one of the use sites.
     * @param node The node.
     * @return {@code true} if the node reads this symbol.
     */
    public boolean isUsedAt(AstNode node) {
        return useSiteSet.contains(node);
    }

    public int getUseCount() {
        return useSites.size();
    }

    public boolean isUsed() {
        return !useSites.isEmpty();
    }

    /**
     * @return {@code false} if at least one read was only resolved after the walk had passed it,
     *         i.e. the name was read before its declaration was seen.
     */
    public boolean isDefinedBeforeUse() {
        return definedBeforeUse;
    }

    void addDeclaration(AstNode node) {
        if (declarationSet.add(node)) {
            declarations.add(node);
        }
    }

    void addUse(AstNode node) {
        if (useSiteSet.add(node)) {
            useSites.add(node);
        }
    }

    void markUsedBeforeDefinition() {
        this.definedBeforeUse = false;
    }

    @Override
    public String toString() {
        return "Symbol[" + name + ", " + kind + ", scope=" + scopeId + ", uses=" + useSites.size() + "]";
    }
}
