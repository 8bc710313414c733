package org.syntree.api;

/**
 * Thrown when a query string does not conform to the query grammar.
 * Compilation never yields a partial pattern; callers are expected to recover from this exception.
 */
public class QuerySyntaxException extends Exception {

    private final SyntreeErrorCode code;
    private final String query;
    private final int column;

    /**
     * Constructs a new query syntax exception.
     * @param code The error code.
     * @param message The detail message.
     * @param query The offending query string.
     * @param column The 0-based column at which the problem was detected.
     */
    public QuerySyntaxException(SyntreeErrorCode code, String message, String query, int column) {
        this(code, message, query, column, null);
    }

    /**
     * Constructs a new query syntax exception with a cause.
     * @param code The error code.
     * @param message The detail message.
     * @param query The offending query string.
     * @param column The 0-based column at which the problem was detected.
     * @param cause The underlying cause, e.g. a regex compilation failure.
     */
    public QuerySyntaxException(SyntreeErrorCode code, String message, String query, int column, Throwable cause) {
        super(String.format("%s at column %d in query '%s'", message, column, query), cause);
        this.code = code;
        this.query = query;
        this.column = column;
    }

    public SyntreeErrorCode getCode() {
        return code;
    }

    public String getQuery() {
        return query;
    }

    public int getColumn() {
        return column;
    }
}
