package soup.tadpole.engine.search.transpositiontable;

/** How far a cached score can be trusted. */
public enum NodeType {
    /** Exact score. */
    PV,
    /** Upper bound: no move raised alpha. */
    ALL,
    /** Lower bound: a move caused a beta cutoff. */
    CUT
}
