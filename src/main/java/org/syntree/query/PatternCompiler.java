package org.syntree.query;

import org.syntree.api.QuerySyntaxException;
import org.syntree.api.SyntreeErrorCode;

import java.util.List;
import java.util.function.Function;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles query strings into {@link Pattern}s.
 * <pre>
 * query   := orExpr
 * orExpr  := andExpr ( "or" andExpr )*
 * andExpr := simple ( "and" simple )*
 * simple  := "not" simple | "*" | verb operand
 * verb    := "call" | "assign" | "name" | "def" | "class"
 * operand := "*" | identifier | "/" regex "/"
 * </pre>
 * {@code not} binds tightest, then {@code and}, then {@code or}; the binary operators associate
 * to the left. Identifiers may contain any Unicode letter.
 * A compiler instance keeps no state between calls.
 */
public class PatternCompiler {

    /**
     * Compiles a query.
     * @param query The query string.
     * @return The compiled pattern.
     * @throws QuerySyntaxException if the query is malformed; no partial pattern is produced.
     */
    public Pattern compile(String query) throws QuerySyntaxException {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException(SyntreeErrorCode.QUERY_EMPTY, "Query is empty", String.valueOf(query), 0);
        }
        return new Parser(query, new QueryLexer(query).scanTokens()).parse();
    }

    /**
     * Recursive-descent parser over the token list of one query.
     */
    private static final class Parser {
        private final String query;
        private final List<QueryToken> tokens;
        private int current = 0;

        Parser(String query, List<QueryToken> tokens) {
            this.query = query;
            this.tokens = tokens;
        }

        Pattern parse() throws QuerySyntaxException {
            Pattern pattern = orExpr();
            if (peek().type() != QueryTokenType.END_OF_QUERY) {
                throw error(SyntreeErrorCode.QUERY_TRAILING_INPUT, "Unexpected trailing input '" + peek().text() + "'", peek());
            }
            return pattern;
        }

        private Pattern orExpr() throws QuerySyntaxException {
            Pattern left = andExpr();
            while (match(QueryTokenType.OR)) {
                left = new Pattern.OrPattern(left, andExpr());
            }
            return left;
        }

        private Pattern andExpr() throws QuerySyntaxException {
            Pattern left = simple();
            while (match(QueryTokenType.AND)) {
                left = new Pattern.AndPattern(left, simple());
            }
            return left;
        }

        private Pattern simple() throws QuerySyntaxException {
            if (match(QueryTokenType.NOT)) {
                return new Pattern.NotPattern(simple());
            }
            QueryToken token = advance();
            if (token.type() == QueryTokenType.STAR) {
                return new Pattern.WildcardPattern();
            }
            if (token.type() != QueryTokenType.IDENTIFIER) {
                String found = token.type() == QueryTokenType.END_OF_QUERY ? "end of query" : "'" + token.text() + "'";
                throw error(SyntreeErrorCode.QUERY_UNEXPECTED_TOKEN, "Expected a query verb but found " + found, token);
            }
            Function<NameMatcher, Pattern> verb = switch (token.text()) {
                case "call" -> Pattern.CallPattern::new;
                case "assign" -> Pattern.AssignPattern::new;
                case "name" -> Pattern.NamePattern::new;
                case "def" -> Pattern.DefPattern::new;
                case "class" -> Pattern.ClassPattern::new;
                default -> null;
            };
            if (verb == null) {
                throw error(SyntreeErrorCode.QUERY_UNKNOWN_VERB, "Unknown query verb '" + token.text() + "'", token);
            }
            return verb.apply(operand(token));
        }

        private NameMatcher operand(QueryToken verb) throws QuerySyntaxException {
            QueryToken token = peek();
            switch (token.type()) {
                case STAR:
                    advance();
                    return new NameMatcher.Any();
                case IDENTIFIER:
                    advance();
                    return new NameMatcher.Exact(token.value());
                case REGEX:
                    advance();
                    try {
                        return new NameMatcher.Regex(java.util.regex.Pattern.compile(token.value()));
                    } catch (PatternSyntaxException e) {
                        throw new QuerySyntaxException(SyntreeErrorCode.QUERY_INVALID_REGEX,
                                "Invalid regex '" + token.value() + "': " + e.getDescription(), query, token.column(), e);
                    }
                default:
                    throw error(SyntreeErrorCode.QUERY_MISSING_OPERAND,
                            "Verb '" + verb.text() + "' needs an operand", token);
            }
        }

        private boolean match(QueryTokenType type) {
            if (peek().type() == type) {
                advance();
                return true;
            }
            return false;
        }

        private QueryToken advance() {
            QueryToken token = tokens.get(current);
            if (token.type() != QueryTokenType.END_OF_QUERY) {
                current++;
            }
            return token;
        }

        private QueryToken peek() {
            return tokens.get(current);
        }

        private QuerySyntaxException error(SyntreeErrorCode code, String message, QueryToken at) {
            return new QuerySyntaxException(code, message, query, at.column());
        }
    }
}
