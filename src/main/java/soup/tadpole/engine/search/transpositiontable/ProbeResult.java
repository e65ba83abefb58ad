package soup.tadpole.engine.search.transpositiontable;

import soup.tadpole.engine.movegen.Move;

/** Outcome of a {@link TranspositionTable#probe}. */
public sealed interface ProbeResult {

    /** Position not in the table: a full search is required. */
    record Miss() implements ProbeResult {}

    /** Position known but not deep or tight enough: search its move first. */
    record OrderingHint(Move move) implements ProbeResult {}

    /** Stored knowledge is good enough to replace the search of the subtree. */
    record SearchResult(Move move, int score) implements ProbeResult {}

    ProbeResult MISS = new Miss();
}
