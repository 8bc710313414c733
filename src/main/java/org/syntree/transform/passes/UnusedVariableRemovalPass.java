package org.syntree.transform.passes;

import org.syntree.semantics.Symbol;
import org.syntree.semantics.SymbolTable;
import org.syntree.semantics.SymbolTableBuilder;
import org.syntree.transform.TransformPass;
import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.ExprNode;
import org.syntree.tree.PassNode;
import org.syntree.tree.TreeWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Removes assignments to local variables that are never read.
 * <p>
 * Only single-target assignments are touched. If the assigned value may have side effects
 * (it contains a call or an extension node), the assignment is replaced by the bare expression.
 * The pass runs once: an assignment that only becomes unused through this removal stays.
 */
public class UnusedVariableRemovalPass implements TransformPass {

    public static final String NAME = "unused_variable_removal";

    private final SymbolTableBuilder symbolTableBuilder;
    private final TreeWalker walker;

    public UnusedVariableRemovalPass() {
        this(new SymbolTableBuilder(), new TreeWalker());
    }

    public UnusedVariableRemovalPass(SymbolTableBuilder symbolTableBuilder, TreeWalker walker) {
        this.symbolTableBuilder = symbolTableBuilder;
        this.walker = walker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstNode transform(AstNode tree) {
        SymbolTable symbolTable = symbolTableBuilder.analyze(tree);
        Set<AstNode> unusedSites = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Symbol symbol : symbolTable.getUnusedVariables()) {
            if (symbol.getKind() == Symbol.Kind.LOCAL) {
                unusedSites.addAll(symbol.getDeclarations());
            }
        }
        if (unusedSites.isEmpty()) {
            return tree;
        }
        return walker.rewriteBottomUp(tree, node -> StatementBlocks.rewrite(node,
                (statements, required) -> removeUnused(statements, required, unusedSites)));
    }

    private static List<AstNode> removeUnused(List<AstNode> statements, boolean required, Set<AstNode> unusedSites) {
        List<AstNode> result = new ArrayList<>(statements.size());
        for (AstNode statement : statements) {
            if (statement instanceof AssignNode assign && assign.targets().size() == 1
                    && unusedSites.contains(assign.targets().get(0))) {
                if (AstNodes.mayHaveSideEffects(assign.value())) {
                    result.add(new ExprNode(assign.value(), assign.position()));
                }
            } else {
                result.add(statement);
            }
        }
        if (required && result.isEmpty() && !statements.isEmpty()) {
            result.add(new PassNode());
        }
        return StatementBlocks.unchangedOr(statements, result);
    }
}
