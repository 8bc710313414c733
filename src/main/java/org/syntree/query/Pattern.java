package org.syntree.query;

import org.syntree.tree.AssignNode;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.CallNode;
import org.syntree.tree.ClassDefNode;
import org.syntree.tree.FunctionDefNode;
import org.syntree.tree.NameNode;

/**
 * A compiled, immutable predicate over single nodes. Patterns hold no mutable state and
 * can be shared between threads and reused across trees.
 * <p>
 * Patterns are usually produced by {@link PatternCompiler}, but the records can also be
 * composed directly.
 */
public sealed interface Pattern permits Pattern.WildcardPattern, Pattern.CallPattern, Pattern.AssignPattern,
        Pattern.NamePattern, Pattern.DefPattern, Pattern.ClassPattern, Pattern.AndPattern, Pattern.OrPattern,
        Pattern.NotPattern {

    /**
     * Tests a single node. Children are not inspected.
     * @param node The node.
     * @return {@code true} if the node matches.
     */
    boolean test(AstNode node);

    /** Matches every node. */
    record WildcardPattern() implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return true;
        }
    }

    /**
     * Matches calls by the dotted path of their callee. A callee that is not a name or
     * attribute chain only satisfies {@link NameMatcher.Any}.
     * @param callee The matcher for the callee path.
     */
    record CallPattern(NameMatcher callee) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return node instanceof CallNode call && callee.matches(AstNodes.calleeName(call).orElse(null));
        }
    }

    /**
     * Matches assignments having at least one plain name target that satisfies the matcher.
     * @param target The matcher for the target name.
     */
    record AssignPattern(NameMatcher target) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            if (!(node instanceof AssignNode assign)) {
                return false;
            }
            for (AstNode t : assign.targets()) {
                if (t instanceof NameNode name && target.matches(name.id())) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Matches identifier references in any context.
     * @param name The matcher for the identifier.
     */
    record NamePattern(NameMatcher name) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return node instanceof NameNode n && name.matches(n.id());
        }
    }

    /**
     * Matches function definitions by name.
     * @param name The matcher for the function name.
     */
    record DefPattern(NameMatcher name) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return node instanceof FunctionDefNode f && name.matches(f.name());
        }
    }

    /**
     * Matches class definitions by name.
     * @param name The matcher for the class name.
     */
    record ClassPattern(NameMatcher name) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return node instanceof ClassDefNode c && name.matches(c.name());
        }
    }

    /** Conjunction; the right side is only evaluated if the left side matched. */
    record AndPattern(Pattern left, Pattern right) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return left.test(node) && right.test(node);
        }
    }

    /** Disjunction; the right side is only evaluated if the left side did not match. */
    record OrPattern(Pattern left, Pattern right) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return left.test(node) || right.test(node);
        }
    }

    /** Negation; note that {@code not call *} matches every node that is not a call. */
    record NotPattern(Pattern inner) implements Pattern {
        @Override
        public boolean test(AstNode node) {
            return !inner.test(node);
        }
    }
}
