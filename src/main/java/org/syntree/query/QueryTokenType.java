package org.syntree.query;

/**
 * Defines the different types of tokens that the {@link QueryLexer} can recognize.
 */
public enum QueryTokenType {
    /** The '*' character, matching anything. */
    STAR,
    /** A bare word or dotted path, such as {@code call} or {@code os.path.join}. */
    IDENTIFIER,
    /** A regex operand between '/' delimiters; the token value is the regex source. */
    REGEX,
    /** The {@code and} keyword. */
    AND,
    /** The {@code or} keyword. */
    OR,
    /** The {@code not} keyword. */
    NOT,
    /** Represents the end of the query. */
    END_OF_QUERY
}
