package soup.tadpole.engine.search;

import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.utils.notations.MoveIOUtils;

/**
 * Outcome of a search: the chosen move and its score from the mover's point of view.
 * {@code depth} is the last completed depth, 0 when only the fallback move was scored.
 */
public record SearchResult(Move move, int score, int depth, long nodes, long timeMs) {

    public long nps() {
        return nodes * 1000L / Math.max(1, timeMs);
    }

    @Override
    public String toString() {
        return "SearchResult\n" +
                "best move: " + MoveIOUtils.writeAlgebraicNotation(move) + "\n" +
                "score: " + score + "\n" +
                "depth: " + depth + "\n" +
                "search time (ms): " + timeMs + "\n" +
                "nodes/sec: " + nps();
    }

    public String toUCIInfo() {
        return "info" +
                " depth " + depth +
                " score cp " + score +
                " nodes " + nodes +
                " nps " + nps() +
                " time " + timeMs +
                " pv " + MoveIOUtils.writeAlgebraicNotation(move);
    }
}
