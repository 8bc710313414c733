package org.syntree.query;

/**
 * Represents a single token extracted from a query by the {@link QueryLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the query.
 * @param value The processed value: the regex source for {@link QueryTokenType#REGEX}, otherwise the text.
 * @param column The 0-based column where the token begins.
 */
public record QueryToken(QueryTokenType type, String text, String value, int column) {
}
