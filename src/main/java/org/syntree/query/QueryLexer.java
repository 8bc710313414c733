package org.syntree.query;

import org.syntree.api.QuerySyntaxException;
import org.syntree.api.SyntreeErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a query string into a sequence of tokens. Whitespace separates tokens and is
 * otherwise ignored.
 */
public class QueryLexer {

    private final String source;
    private final List<QueryToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new lexer.
     * @param source The query string.
     */
    public QueryLexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire query.
     * @return The recognized tokens, always terminated by {@link QueryTokenType#END_OF_QUERY}.
     * @throws QuerySyntaxException if a character cannot start a token or a regex is not closed.
     */
    public List<QueryToken> scanTokens() throws QuerySyntaxException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new QueryToken(QueryTokenType.END_OF_QUERY, "", "", source.length()));
        return tokens;
    }

    private void scanToken() throws QuerySyntaxException {
        char c = advance();
        switch (c) {
            case '*': addToken(QueryTokenType.STAR, "*"); break;
            case '/': regex(); break;
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isAlpha(c)) {
                    identifier();
                } else {
                    throw new QuerySyntaxException(SyntreeErrorCode.QUERY_UNEXPECTED_TOKEN,
                            "Unexpected character '" + c + "'", source, start);
                }
                break;
        }
    }

    private void identifier() throws QuerySyntaxException {
        while (isAlphaNumeric(peek())) advance();
        while (peek() == '.') {
            advance();
            if (!isAlpha(peek())) {
                throw new QuerySyntaxException(SyntreeErrorCode.QUERY_UNEXPECTED_TOKEN,
                        "Expected an identifier after '.'", source, current);
            }
            while (isAlphaNumeric(peek())) advance();
        }

        String text = source.substring(start, current);
        QueryTokenType type = switch (text) {
            case "and" -> QueryTokenType.AND;
            case "or" -> QueryTokenType.OR;
            case "not" -> QueryTokenType.NOT;
            default -> QueryTokenType.IDENTIFIER;
        };
        addToken(type, text);
    }

    private void regex() throws QuerySyntaxException {
        StringBuilder regex = new StringBuilder();
        while (!isAtEnd() && peek() != '/') {
            char c = advance();
            // "\/" is a literal slash; every other escape is handed to the regex engine.
            if (c == '\\' && peek() == '/') {
                regex.append(advance());
            } else {
                regex.append(c);
            }
        }
        if (isAtEnd()) {
            throw new QuerySyntaxException(SyntreeErrorCode.QUERY_UNTERMINATED_REGEX,
                    "Regex operand is missing its closing '/'", source, start);
        }
        advance();
        addToken(QueryTokenType.REGEX, regex.toString());
    }

    private void addToken(QueryTokenType type, String value) {
        tokens.add(new QueryToken(type, source.substring(start, current), value, start));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
