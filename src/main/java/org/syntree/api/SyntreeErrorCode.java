package org.syntree.api;

/**
 * Defines unique, testable error codes for all errors the library reports.
 * This decouples test logic from message wording.
 */
public enum SyntreeErrorCode {
    // region Query Errors
    /** The query string was empty or contained only whitespace. */
    QUERY_EMPTY,
    /** A simple query started with a word that is not a known verb. */
    QUERY_UNKNOWN_VERB,
    /** A verb was not followed by an operand. */
    QUERY_MISSING_OPERAND,
    /** A regex operand was opened with '/' but never closed. */
    QUERY_UNTERMINATED_REGEX,
    /** A regex operand did not compile. */
    QUERY_INVALID_REGEX,
    /** A character or token appeared where the grammar does not allow it. */
    QUERY_UNEXPECTED_TOKEN,
    /** The query was complete but input remained. */
    QUERY_TRAILING_INPUT,
    // endregion

    // region Tree Structure Errors
    /** A node instance is reachable from more than one parent position. */
    TREE_SHARED_NODE,
    /** A node is its own ancestor. */
    TREE_CYCLE,
    /** The tree is nested deeper than the configured traversal limit. */
    TREE_TOO_DEEP,
    /** A node has a null child where the model requires a node. */
    TREE_NULL_CHILD,
    // endregion

    // region Transformation Errors
    /** A pass failed with an unexpected runtime error. */
    PASS_FAILED,
    /** A pass name was not found in the registry. */
    PASS_UNKNOWN,
    // endregion

    // region Serialization Errors
    /** The JSON text could not be read as a tree. */
    JSON_MALFORMED,
    /** The tree could not be written as JSON. */
    JSON_WRITE_FAILED
    // endregion
}
