package org.syntree.semantics.analysis;

import org.syntree.semantics.Symbol;
import org.syntree.tree.AstNode;
import org.syntree.tree.ImportFromNode;
import org.syntree.tree.ImportNode;

/**
 * Binds every name imported from a module. Star imports bind nothing that can be named.
 */
public class ImportFromAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        ImportFromNode importFrom = (ImportFromNode) node;
        for (ImportNode.Alias alias : importFrom.names()) {
            if (!"*".equals(alias.name())) {
                context.symbolTable().define(ImportFromNode.boundName(alias), Symbol.Kind.IMPORT, importFrom);
            }
        }
    }
}
