package org.syntree.semantics.analysis;

import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.semantics.Symbol;
import org.syntree.semantics.SymbolTable;
import org.syntree.tree.AstNode;
import org.syntree.tree.NameNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The state of one symbol table construction. A context is created per analysed tree
 * and is never shared, which keeps the builder itself free of per-call state.
 */
public final class AnalysisContext {

    private record PendingReference(SymbolTable.Scope scope, NameNode node) {}

    private final SymbolTable symbolTable;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers;
    private final int maxDepth;
    private final List<PendingReference> pending = new ArrayList<>();
    private int depth = 0;

    /**
     * @param symbolTable The table to fill.
     * @param handlers The handlers by node class; nodes without a handler have their children walked.
     * @param maxDepth The maximum nesting depth.
     */
    public AnalysisContext(SymbolTable symbolTable, Map<Class<? extends AstNode>, IAnalysisHandler> handlers, int maxDepth) {
        this.symbolTable = symbolTable;
        this.handlers = handlers;
        this.maxDepth = maxDepth;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    /**
     * Walks a node: dispatches it to its handler, or walks its children if it has none.
     * @param node The node, ignored if {@code null}.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }
        if (++depth > maxDepth) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_TOO_DEEP,
                    "Tree is nested deeper than the traversal limit of " + maxDepth);
        }
        try {
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, this);
            } else {
                walkAll(node.getChildren());
            }
        } finally {
            depth--;
        }
    }

    /**
     * Walks a list of nodes in order.
     * @param nodes The nodes.
     */
    public void walkAll(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Resolves a read of a name in the current scope chain and records the use site.
     * A read that does not resolve yet is kept and retried by {@link #resolvePending} once the
     * whole tree has been walked, since the declaration may follow the read.
     * @param name The reading name node.
     */
    public void reference(NameNode name) {
        Optional<Symbol> symbol = symbolTable.resolve(name.id());
        if (symbol.isPresent()) {
            symbolTable.recordUse(symbol.get(), name, false);
        } else {
            pending.add(new PendingReference(symbolTable.getCurrentScope(), name));
        }
    }

    /**
     * Resolves the deferred reads against the completed scopes. Names that still do not
     * resolve and are not builtins are recorded as undefined, in the order they were read.
     * @param builtins Names provided by the runtime that need no declaration.
     */
    public void resolvePending(Set<String> builtins) {
        for (PendingReference ref : pending) {
            Optional<Symbol> symbol = symbolTable.resolve(ref.scope(), ref.node().id());
            if (symbol.isPresent()) {
                symbolTable.recordUse(symbol.get(), ref.node(), true);
            } else if (!builtins.contains(ref.node().id())) {
                symbolTable.recordUndefined(ref.node().id());
            }
        }
        pending.clear();
    }
}
