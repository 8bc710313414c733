package org.syntree.query;

/**
 * Decides whether a name satisfies the operand of a simple query.
 */
public sealed interface NameMatcher permits NameMatcher.Any, NameMatcher.Exact, NameMatcher.Regex {

    /**
     * @param name The name to test, or {@code null} when the tested node has no resolvable name.
     * @return {@code true} if the name is accepted.
     */
    boolean matches(String name);

    /**
     * Accepts every name, including an unresolvable one.
     */
    record Any() implements NameMatcher {
        @Override
        public boolean matches(String name) {
            return true;
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    /**
     * Accepts exactly one literal name.
     * @param literal The accepted name.
     */
    record Exact(String literal) implements NameMatcher {
        @Override
        public boolean matches(String name) {
            return literal.equals(name);
        }

        @Override
        public String toString() {
            return literal;
        }
    }

    /**
     * Accepts names whose beginning matches the regex.
     * @param regex The compiled regex.
     */
    record Regex(java.util.regex.Pattern regex) implements NameMatcher {
        @Override
        public boolean matches(String name) {
            return name != null && regex.matcher(name).lookingAt();
        }

        @Override
        public String toString() {
            return "/" + regex.pattern() + "/";
        }
    }
}
