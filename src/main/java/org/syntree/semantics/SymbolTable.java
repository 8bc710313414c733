package org.syntree.semantics;

import org.syntree.tree.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The result of analysing one tree: its scopes, the symbols declared in them and the
 * names that could not be resolved.
 * <p>
 * A table describes the tree it was built from. It becomes stale as soon as a tree derived
 * from that one is analysed instead; there are no incremental updates.
 */
public class SymbolTable {

    /**
     * The kind of lexical region a scope represents.
     */
    public enum ScopeKind {
        /** The module body. */
        MODULE,
        /** A function body. */
        FUNCTION,
        /** A class body. */
        CLASS
    }

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final int id;
        private final ScopeKind kind;
        private final String name;
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(int id, ScopeKind kind, String name, Scope parent) {
            this.id = id;
            this.kind = kind;
            this.name = name;
            this.parent = parent;
        }

        public int getId() {
            return id;
        }

        public ScopeKind getKind() {
            return kind;
        }

        public String getName() {
            return name;
        }

        public Optional<Scope> getParent() {
            return Optional.ofNullable(parent);
        }

        public List<Scope> getChildren() {
            return Collections.unmodifiableList(children);
        }

        /**
         * @return The symbols declared directly in this scope, in declaration order.
         */
        public Map<String, Symbol> getSymbols() {
            return Collections.unmodifiableMap(symbols);
        }

        /**
         * Looks up a name in this scope only.
         * @param name The name.
         * @return The symbol, or empty.
         */
        public Optional<Symbol> lookupLocal(String name) {
            return Optional.ofNullable(symbols.get(name));
        }
    }

    private final List<Scope> scopes = new ArrayList<>();
    private final Scope rootScope;
    private Scope currentScope;
    private final Map<AstNode, Scope> scopeMap = new IdentityHashMap<>();
    private final Set<String> undefined = new LinkedHashSet<>();

    /**
     * Constructs a new symbol table with an empty module scope.
     */
    public SymbolTable() {
        this.rootScope = new Scope(0, ScopeKind.MODULE, "<module>", null);
        this.scopes.add(rootScope);
        this.currentScope = rootScope;
    }

    /**
     * Enters a new scope nested in the current one.
     * @param kind The scope kind.
     * @param name A readable name, e.g. the function name.
     * @param definingNode The node that opens the scope; it can later be mapped back with {@link #scopeFor}.
     * @return The new scope.
     */
    public Scope enterScope(ScopeKind kind, String name, AstNode definingNode) {
        Scope newScope = new Scope(scopes.size(), kind, name, currentScope);
        currentScope.children.add(newScope);
        scopes.add(newScope);
        scopeMap.put(definingNode, newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    /**
     * Associates the module scope with the root node of the analysed tree.
     * @param root The root node.
     */
    public void bindModule(AstNode root) {
        scopeMap.put(root, rootScope);
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    /**
     * Declares a name in the current scope. If the name is already declared there, the existing
     * symbol is kept, together with its recorded uses, and the new declaration site is added to it.
     * @param name The name.
     * @param kind The declaration kind, used only when a new symbol is created.
     * @param declaration The declaring node.
     * @return The symbol the name is bound to.
     */
    public Symbol define(String name, Symbol.Kind kind, AstNode declaration) {
        Symbol symbol = currentScope.symbols.computeIfAbsent(name, n -> new Symbol(n, kind, currentScope.id));
        symbol.addDeclaration(declaration);
        return symbol;
    }

    /**
     * Resolves a name from the current scope outwards.
     * @param name The name.
     * @return The nearest symbol, or empty.
     */
    public Optional<Symbol> resolve(String name) {
        return resolve(currentScope, name);
    }

    /**
     * Resolves a name from the given scope outwards to the module scope.
     * @param scope The innermost scope to search.
     * @param name The name.
     * @return The nearest symbol, or empty.
     */
    public Optional<Symbol> resolve(Scope scope, String name) {
        for (Scope s = scope; s != null; s = s.parent) {
            Symbol symbol = s.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Records a use site for a resolved symbol.
     * @param symbol The symbol.
     * @param useSite The reading node.
     * @param seenBeforeDefinition Whether the read was walked before the declaration.
     */
    public void recordUse(Symbol symbol, AstNode useSite, boolean seenBeforeDefinition) {
        symbol.addUse(useSite);
        if (seenBeforeDefinition) {
            symbol.markUsedBeforeDefinition();
        }
    }

    /**
     * Records a name that did not resolve in any enclosing scope.
     * @param name The name.
     */
    public void recordUndefined(String name) {
        undefined.add(name);
    }

    /**
     * Returns every symbol that is never read. Functions and classes declared in the module
     * scope are excluded: they form the module's exported surface and are assumed to be used
     * from outside.
     * @return The unused symbols, by scope creation order and then declaration order.
     */
    public List<Symbol> getUnusedVariables() {
        List<Symbol> unused = new ArrayList<>();
        for (Scope scope : scopes) {
            for (Symbol symbol : scope.symbols.values()) {
                if (symbol.isUsed()) {
                    continue;
                }
                boolean exported = scope == rootScope
                        && (symbol.getKind() == Symbol.Kind.FUNCTION || symbol.getKind() == Symbol.Kind.CLASS);
                if (!exported) {
                    unused.add(symbol);
                }
            }
        }
        return unused;
    }

    /**
     * @return The names read without a declaration in any enclosing scope, deduplicated, in first-seen order.
     */
    public List<String> getUndefinedVariables() {
        return List.copyOf(undefined);
    }

    /**
     * @return All scopes in creation order; the module scope comes first and has id 0.
     */
    public List<Scope> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public Scope getModuleScope() {
        return rootScope;
    }

    /**
     * @param id The scope id.
     * @return The scope with that id, or empty.
     */
    public Optional<Scope> getScope(int id) {
        return id >= 0 && id < scopes.size() ? Optional.of(scopes.get(id)) : Optional.empty();
    }

    /**
     * Maps a scope-opening node (program, function or class definition) to its scope.
     * The lookup is by node identity.
     * @param definingNode The node.
     * @return The scope it opened, or empty if the node is not part of the analysed tree.
     */
    public Optional<Scope> scopeFor(AstNode definingNode) {
        return Optional.ofNullable(scopeMap.get(definingNode));
    }

    /**
     * Collects every name visible from a scope, i.e. declared in it or any enclosing scope.
     * @param scope The scope.
     * @return The visible names.
     */
    public Set<String> visibleNames(Scope scope) {
        Set<String> names = new LinkedHashSet<>();
        for (Scope s = scope; s != null; s = s.parent) {
            names.addAll(s.symbols.keySet());
        }
        return names;
    }

    /**
     * Builds the annotation view used by exporters: scope id to symbol name to kind and use count.
     * @return An ordered, unmodifiable view.
     */
    public Map<Integer, Map<String, SymbolSummary>> toExportView() {
        Map<Integer, Map<String, SymbolSummary>> view = new LinkedHashMap<>();
        for (Scope scope : scopes) {
            Map<String, SymbolSummary> symbols = new LinkedHashMap<>();
            scope.symbols.forEach((name, symbol) ->
                    symbols.put(name, new SymbolSummary(symbol.getKind(), symbol.getUseCount())));
            view.put(scope.id, Collections.unmodifiableMap(symbols));
        }
        return Collections.unmodifiableMap(view);
    }
}
