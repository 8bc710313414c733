package org.syntree.semantics;

import org.syntree.semantics.analysis.AnalysisContext;
import org.syntree.semantics.analysis.AssignAnalysisHandler;
import org.syntree.semantics.analysis.ClassDefAnalysisHandler;
import org.syntree.semantics.analysis.ExceptHandlerAnalysisHandler;
import org.syntree.semantics.analysis.ForAnalysisHandler;
import org.syntree.semantics.analysis.FunctionDefAnalysisHandler;
import org.syntree.semantics.analysis.IAnalysisHandler;
import org.syntree.semantics.analysis.ImportAnalysisHandler;
import org.syntree.semantics.analysis.ImportFromAnalysisHandler;
import org.syntree.semantics.analysis.NameAnalysisHandler;
import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ExceptHandlerNode;
import org.syntree.tree.ForNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.ImportFromNode;
import org.syntree.tree.ImportNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link SymbolTable} for a tree in a single depth-first walk.
 * It dispatches nodes to handlers registered per node class; nodes without a handler
 * simply have their children walked.
 * <p>
 * Analysis never fails on unresolved names: they end up in
 * {@link SymbolTable#getUndefinedVariables()}. The builder keeps no per-call state,
 * so several threads may analyse the same unmutated tree at once.
 */
public class SymbolTableBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTableBuilder.class);

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Set<String> builtins;
    private final int maxDepth;

    /**
     * Constructs a builder that knows no builtin names.
     */
    public SymbolTableBuilder() {
        this(Set.of(), TreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a builder.
     * @param builtins Names that are never reported as undefined, e.g. {@code print}.
     * @param maxDepth The maximum nesting depth accepted.
     */
    public SymbolTableBuilder(Set<String> builtins, int maxDepth) {
        this.builtins = Set.copyOf(builtins);
        this.maxDepth = maxDepth;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(FunctionDefNode.class, new FunctionDefAnalysisHandler());
        handlers.put(ClassDefNode.class, new ClassDefAnalysisHandler());
        handlers.put(AssignNode.class, new AssignAnalysisHandler());
        handlers.put(ForNode.class, new ForAnalysisHandler());
        handlers.put(ImportNode.class, new ImportAnalysisHandler());
        handlers.put(ImportFromNode.class, new ImportFromAnalysisHandler());
        handlers.put(ExceptHandlerNode.class, new ExceptHandlerAnalysisHandler());
        handlers.put(NameNode.class, new NameAnalysisHandler());
    }

    /**
     * Replaces or adds the handler for a node class. Must not be called while analyses run.
     * @param nodeClass The node class.
     * @param handler The handler.
     */
    public void registerHandler(Class<? extends AstNode> nodeClass, IAnalysisHandler handler) {
        handlers.put(nodeClass, handler);
    }

    /**
     * Analyzes the given tree. This is the main entry point for scope and usage analysis.
     * @param tree The root of the tree, normally a program node.
     * @return A fresh symbol table describing the tree.
     */
    public SymbolTable analyze(AstNode tree) {
        SymbolTable symbolTable = new SymbolTable();
        symbolTable.bindModule(tree);
        AnalysisContext context = new AnalysisContext(symbolTable, handlers, maxDepth);
        context.walk(tree);
        context.resolvePending(builtins);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Analysed tree: {} scopes, {} unused, {} undefined",
                    symbolTable.getScopes().size(),
                    symbolTable.getUnusedVariables().size(),
                    symbolTable.getUndefinedVariables().size());
        }
        return symbolTable;
    }
}
