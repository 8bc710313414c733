package org.syntree.query;

import org.syntree.api.QuerySyntaxException;
import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.CallNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Finds nodes in a tree. All results are in pre-order: a parent precedes its children and
 * children are visited in declaration order, so repeated queries over the same tree return
 * identical lists.
 * <p>
 * Matching never mutates the tree and keeps no per-call state in fields, so one matcher can
 * serve several threads reading the same tree.
 */
public class TreeMatcher {

    private final TreeWalker walker;
    private final PatternCompiler compiler = new PatternCompiler();
    private final Map<String, Pattern> registeredPatterns = new ConcurrentHashMap<>();

    public TreeMatcher() {
        this(TreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth The maximum nesting depth accepted during traversal.
     */
    public TreeMatcher(int maxDepth) {
        this.walker = new TreeWalker(maxDepth);
    }

    /**
     * Stores a pattern under a name, replacing any previous pattern of that name.
     * @param name The name usable in {@link #findMatches(AstNode, String)}.
     * @param pattern The pattern.
     */
    public void registerPattern(String name, Pattern pattern) {
        registeredPatterns.put(name, pattern);
    }

    /**
     * @param name The registered name.
     * @return The pattern registered under the name.
     */
    public Optional<Pattern> getPattern(String name) {
        return Optional.ofNullable(registeredPatterns.get(name));
    }

    /**
     * Returns all nodes matching the pattern.
     * @param tree The root of the tree.
     * @param pattern The pattern.
     * @return The matching nodes in pre-order; empty if nothing matches.
     */
    public List<AstNode> findMatches(AstNode tree, Pattern pattern) {
        return walker.collect(tree, pattern::test);
    }

    /**
     * Returns all nodes matching a registered pattern name or, if no pattern is registered
     * under that name, the compiled query.
     * @param tree The root of the tree.
     * @param patternOrQuery A registered name or a query string.
     * @return The matching nodes in pre-order.
     * @throws QuerySyntaxException if the string is not registered and does not compile.
     */
    public List<AstNode> findMatches(AstNode tree, String patternOrQuery) throws QuerySyntaxException {
        Pattern pattern = registeredPatterns.get(patternOrQuery);
        if (pattern == null) {
            pattern = compiler.compile(patternOrQuery);
        }
        return findMatches(tree, pattern);
    }

    public List<FunctionDefNode> findFunctions(AstNode tree) {
        return collectTyped(tree, FunctionDefNode.class, f -> true);
    }

    public List<ClassDefNode> findClasses(AstNode tree) {
        return collectTyped(tree, ClassDefNode.class, c -> true);
    }

    public List<CallNode> findCalls(AstNode tree) {
        return collectTyped(tree, CallNode.class, c -> true);
    }

    /**
     * @param tree The root of the tree.
     * @param name The exact dotted callee path, e.g. {@code print} or {@code os.path.join}.
     * @return The calls of that callee.
     */
    public List<CallNode> findCalls(AstNode tree, String name) {
        Pattern pattern = new Pattern.CallPattern(new NameMatcher.Exact(name));
        return collectTyped(tree, CallNode.class, pattern::test);
    }

    public List<AssignNode> findAssignments(AstNode tree) {
        return collectTyped(tree, AssignNode.class, a -> true);
    }

    /**
     * @param tree The root of the tree.
     * @param name The name of a plain target.
     * @return The assignments binding that name.
     */
    public List<AssignNode> findAssignments(AstNode tree, String name) {
        Pattern pattern = new Pattern.AssignPattern(new NameMatcher.Exact(name));
        return collectTyped(tree, AssignNode.class, pattern::test);
    }

    public List<NameNode> findNames(AstNode tree) {
        return collectTyped(tree, NameNode.class, n -> true);
    }

    public List<NameNode> findNames(AstNode tree, String name) {
        return collectTyped(tree, NameNode.class, n -> n.id().equals(name));
    }

    /**
     * Returns all nodes accepted by an arbitrary predicate.
     * @param tree The root of the tree.
     * @param predicate The predicate.
     * @return The accepted nodes in pre-order.
     */
    public List<AstNode> query(AstNode tree, Predicate<? super AstNode> predicate) {
        return walker.collect(tree, predicate);
    }

    public int countMatches(AstNode tree, Pattern pattern) {
        return findMatches(tree, pattern).size();
    }

    public int countMatches(AstNode tree, String patternOrQuery) throws QuerySyntaxException {
        return findMatches(tree, patternOrQuery).size();
    }

    public boolean hasMatch(AstNode tree, Pattern pattern) {
        return !findMatches(tree, pattern).isEmpty();
    }

    public boolean hasMatch(AstNode tree, String patternOrQuery) throws QuerySyntaxException {
        return !findMatches(tree, patternOrQuery).isEmpty();
    }

    private <T extends AstNode> List<T> collectTyped(AstNode tree, Class<T> type, Predicate<? super T> filter) {
        List<T> result = new ArrayList<>();
        for (AstNode node : walker.collect(tree, n -> type.isInstance(n) && filter.test(type.cast(n)))) {
            result.add(type.cast(node));
        }
        return result;
    }
}
