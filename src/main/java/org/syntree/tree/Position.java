package org.syntree.tree;

/**
 * A location in the source text a node was parsed from.
 *
 * @param line   The 1-based line.
 * @param column The 0-based column within the line.
 * @param offset The 0-based character offset from the start of the source.
 */
public record Position(int line, int column, int offset) {

    public Position {
        if (line < 1 || column < 0 || offset < 0) {
            throw new IllegalArgumentException("Invalid position " + line + ":" + column + " @" + offset);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
