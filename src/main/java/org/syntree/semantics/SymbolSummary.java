package org.syntree.semantics;

/**
 * Read-only view of a symbol for exporters that annotate rendered trees.
 *
 * @param kind The declaration kind.
 * @param useCount The number of recorded use sites.
 */
public record SymbolSummary(Symbol.Kind kind, int useCount) {
}
