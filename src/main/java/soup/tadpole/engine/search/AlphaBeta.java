package soup.tadpole.engine.search;

import soup.tadpole.engine.game.GameStatus;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.search.evaluator.PositionEvaluator;
import soup.tadpole.engine.search.transpositiontable.NodeType;
import soup.tadpole.engine.search.transpositiontable.ProbeResult;
import soup.tadpole.engine.search.transpositiontable.TableEntry;

import java.util.List;
import java.util.OptionalInt;

/**
 * Negamax alpha-beta, fail-hard: the returned score is always clamped to [alpha, beta].
 * Safe to run from several threads at once on the same {@link SearchContext}.
 */
public final class AlphaBeta {

    private AlphaBeta() {}

    /**
     * @param depth    plies already played from the root
     * @param maxDepth depth ceiling, the node is a leaf when {@code depth == maxDepth}
     * @return the score from the side to move in {@code position}, or empty if the search was stopped
     */
    public static OptionalInt search(int alpha, int beta, int depth, int maxDepth, Position position, SearchContext ctx) {
        if (ctx.stopped()) return OptionalInt.empty();
        ctx.nodes.increment();

        if (depth == maxDepth) {
            return OptionalInt.of(PositionEvaluator.evaluate(position));
        }
        final List<Move> legalMoves = position.getLegalMoves();
        if (position.status(legalMoves) != GameStatus.ONGOING) {
            return OptionalInt.of(PositionEvaluator.evaluate(position));
        }

        final int draft = maxDepth - depth;
        final List<Move> moves = MoveOrdering.capturesFirst(position, legalMoves);
        ProbeResult probe = ctx.tt.probe(position, draft, alpha, beta);
        if (probe instanceof ProbeResult.SearchResult hit) {
            return OptionalInt.of(Math.max(alpha, Math.min(beta, hit.score())));
        }
        if (probe instanceof ProbeResult.OrderingHint hint) {
            MoveOrdering.moveToFront(hint.move(), moves);
        }

        final int originalAlpha = alpha;
        Move alphaMove = null;
        Move bestMove = null;
        int bestScore = -SearchConstants.INF - 1;
        for (Move move : moves) {
            OptionalInt child = search(-beta, -alpha, depth + 1, maxDepth, position.play(move), ctx);
            if (child.isEmpty()) return child;
            int score = -child.getAsInt();

            if (score >= beta) {
                ctx.tt.insert(position, new TableEntry(move, draft, score, NodeType.CUT));
                return OptionalInt.of(beta);
            }
            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (score > alpha) {
                alpha = score;
                alphaMove = move;
            }
        }

        if (alphaMove != null) {
            ctx.tt.insert(position, new TableEntry(alphaMove, draft, alpha, NodeType.PV));
        } else {
            // Every move failed low: the true score is at most the original alpha
            ctx.tt.insert(position, new TableEntry(bestMove, draft, originalAlpha, NodeType.ALL));
        }
        return OptionalInt.of(alpha);
    }
}
