package org.syntree.transform.passes;

import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.semantics.Symbol;
import org.syntree.semantics.SymbolTable;
import org.syntree.semantics.SymbolTableBuilder;
import org.syntree.transform.TransformPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.CallNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.ExprContext;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.NodeKind;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.ReturnNode;
import org.syntree.tree.TreeWalker;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces calls of trivial module-level functions by the returned expression.
 * <p>
 * A function qualifies when its body is a single {@code return} with a value, its parameter names
 * are distinct, its name is bound only once and the returned expression neither calls the
 * function itself nor holds an extension node. A call is inlined only if it keeps its meaning:
 * <ul>
 *     <li>the callee name resolves to the qualifying function and the argument count matches,</li>
 *     <li>no parameter name is visible at the call site,</li>
 *     <li>every other name in the expression resolves at the call site as it does in the function,</li>
 *     <li>an argument that may have side effects is substituted exactly once.</li>
 * </ul>
 * Calls that do not qualify stay unchanged.
 */
public class FunctionInliningPass implements TransformPass {

    public static final String NAME = "function_inlining";

    private record Candidate(FunctionDefNode function, Symbol symbol, SymbolTable.Scope scope, AstNode expression) {}

    private final SymbolTableBuilder symbolTableBuilder;
    private final TreeWalker walker;

    public FunctionInliningPass() {
        this(new SymbolTableBuilder(), new TreeWalker());
    }

    public FunctionInliningPass(SymbolTableBuilder symbolTableBuilder, TreeWalker walker) {
        this.symbolTableBuilder = symbolTableBuilder;
        this.walker = walker;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstNode transform(AstNode tree) {
        if (!(tree instanceof ProgramNode program)) {
            return tree;
        }
        SymbolTable symbolTable = symbolTableBuilder.analyze(tree);
        Map<String, Candidate> candidates = findCandidates(program, symbolTable);
        if (candidates.isEmpty()) {
            return tree;
        }

        Map<AstNode, AstNode> replacements = new IdentityHashMap<>();
        collectInlinableCalls(tree, symbolTable.getModuleScope(), symbolTable, candidates, replacements, 0);
        if (replacements.isEmpty()) {
            return tree;
        }
        return walker.transform(tree, replacements);
    }

    private Map<String, Candidate> findCandidates(ProgramNode program, SymbolTable symbolTable) {
        Map<String, Candidate> candidates = new HashMap<>();
        for (AstNode statement : program.body()) {
            if (!(statement instanceof FunctionDefNode function)
                    || function.body().size() != 1
                    || !(function.body().get(0) instanceof ReturnNode ret)
                    || ret.value() == null
                    || new HashSet<>(function.args()).size() != function.args().size()
                    || callsItself(function.name(), ret.value())
                    || AstNodes.containsKind(ret.value(), NodeKind.EXTENSION)) {
                continue;
            }
            Optional<Symbol> symbol = symbolTable.getModuleScope().lookupLocal(function.name());
            Optional<SymbolTable.Scope> scope = symbolTable.scopeFor(function);
            if (symbol.isEmpty() || scope.isEmpty() || symbol.get().getDeclarations().size() != 1) {
                continue;
            }
            candidates.put(function.name(), new Candidate(function, symbol.get(), scope.get(), ret.value()));
        }
        return candidates;
    }

    private boolean callsItself(String name, AstNode expression) {
        return !walker.collect(expression, n -> n instanceof CallNode call
                && AstNodes.calleeName(call).filter(name::equals).isPresent()).isEmpty();
    }

    private void collectInlinableCalls(AstNode node, SymbolTable.Scope scope, SymbolTable symbolTable,
                                       Map<String, Candidate> candidates, Map<AstNode, AstNode> replacements, int depth) {
        if (depth > walker.getMaxDepth()) {
            throw new StructuralInvariantViolationException(SyntreeErrorCode.TREE_TOO_DEEP,
                    "Tree is nested deeper than the traversal limit of " + walker.getMaxDepth());
        }
        if (node instanceof CallNode call && call.func() instanceof NameNode callee) {
            Candidate candidate = candidates.get(callee.id());
            if (candidate != null && candidate.symbol().isUsedAt(callee)) {
                inline(call, candidate, scope, symbolTable).ifPresent(expr -> replacements.put(call, expr));
            }
        }

        if (node instanceof FunctionDefNode function) {
            SymbolTable.Scope inner = symbolTable.scopeFor(function).orElse(scope);
            for (AstNode child : function.body()) {
                collectInlinableCalls(child, inner, symbolTable, candidates, replacements, depth + 1);
            }
        } else if (node instanceof ClassDefNode classDef) {
            for (AstNode base : classDef.bases()) {
                collectInlinableCalls(base, scope, symbolTable, candidates, replacements, depth + 1);
            }
            SymbolTable.Scope inner = symbolTable.scopeFor(classDef).orElse(scope);
            for (AstNode child : classDef.body()) {
                collectInlinableCalls(child, inner, symbolTable, candidates, replacements, depth + 1);
            }
        } else {
            for (AstNode child : node.getChildren()) {
                collectInlinableCalls(child, scope, symbolTable, candidates, replacements, depth + 1);
            }
        }
    }

    private Optional<AstNode> inline(CallNode call, Candidate candidate, SymbolTable.Scope callScope, SymbolTable symbolTable) {
        List<String> params = candidate.function().args();
        if (call.args().size() != params.size()) {
            return Optional.empty();
        }
        for (String param : params) {
            if (symbolTable.resolve(callScope, param).isPresent()) {
                return Optional.empty();
            }
        }

        Map<String, Integer> occurrences = new HashMap<>();
        for (AstNode n : walker.collect(candidate.expression(), n -> n instanceof NameNode)) {
            String id = ((NameNode) n).id();
            if (params.contains(id)) {
                occurrences.merge(id, 1, Integer::sum);
            } else if (!sameBinding(id, candidate.scope(), callScope, symbolTable)) {
                return Optional.empty();
            }
        }

        Map<String, AstNode> arguments = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            AstNode argument = call.args().get(i);
            if (AstNodes.mayHaveSideEffects(argument) && occurrences.getOrDefault(params.get(i), 0) != 1) {
                return Optional.empty();
            }
            arguments.put(params.get(i), argument);
        }

        return Optional.of(walker.rewriteBottomUp(AstNodes.deepCopy(candidate.expression()), node -> {
            if (node instanceof NameNode name && name.ctx() == ExprContext.LOAD && arguments.containsKey(name.id())) {
                return AstNodes.deepCopy(arguments.get(name.id()));
            }
            return node;
        }));
    }

    private static boolean sameBinding(String name, SymbolTable.Scope definitionScope, SymbolTable.Scope callScope,
                                       SymbolTable symbolTable) {
        Optional<Symbol> atDefinition = symbolTable.resolve(definitionScope, name);
        Optional<Symbol> atCall = symbolTable.resolve(callScope, name);
        if (atDefinition.isEmpty() || atCall.isEmpty()) {
            return atDefinition.isEmpty() && atCall.isEmpty();
        }
        return atDefinition.get() == atCall.get();
    }
}
