package org.syntree.semantics.analysis;

import org.syntree.tree.AstNode;

/**
 * Interface for specialized handlers in symbol table construction.
 * Each handler is responsible for one node class and decides how the walk descends
 * into the children of that node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single node.
     * @param node The node to analyze.
     * @param context The walk state: the symbol table under construction and the descent callbacks.
     */
    void analyze(AstNode node, AnalysisContext context);
}
