package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.tree.AstNode;
import org.syntree.tree.ImportNode;

/**
 * Binds every imported module under its alias or the first segment of its dotted name.
 */
public class ImportAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        ImportNode importNode = (ImportNode) node;
        for (ImportNode.Alias alias : importNode.names()) {
            context.symbolTable().define(alias.boundName(), Symbol.Kind.IMPORT, importNode);
        }
    }
}
