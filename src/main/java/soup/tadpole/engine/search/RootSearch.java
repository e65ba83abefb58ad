package soup.tadpole.engine.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.search.transpositiontable.ProbeResult;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One depth of the root: probe the cache, search the hinted move first, then fan the other moves out
 * on the worker pool and pick the move leaving the opponent the lowest score.
 */
final class RootSearch {

    /** Score of the position after {@code move}, from the opponent's point of view. */
    record RootScore(Move move, int childScore, int order) {}

    /** Move picked for a depth and its score for the side to move. {@code fromCache} when the depth was skipped. */
    record Choice(Move move, int score, boolean fromCache) {}

    private static final Comparator<RootScore> BEST_FIRST =
            Comparator.comparingInt(RootScore::childScore).thenComparingInt(RootScore::order);

    private RootSearch() {}

    /**
     * @return the choice for this depth, or empty when the search was stopped before every root move was scored
     */
    static Optional<Choice> searchAtDepth(Position root, List<Move> rootMoves, SearchContext ctx, ExecutorService pool,
                                          int depth, int alpha, int beta) {
        if (ctx.stopped()) return Optional.empty();

        ProbeResult probe = ctx.tt.probe(root, depth, alpha, beta);
        if (probe instanceof ProbeResult.SearchResult hit && rootMoves.contains(hit.move())) {
            return Optional.of(new Choice(hit.move(), hit.score(), true));
        }

        final List<Move> moves = MoveOrdering.capturesFirst(root, rootMoves);
        final ObjectArrayList<RootScore> scored = new ObjectArrayList<>(moves.size());
        int first = 0;
        int siblingAlpha = alpha;
        if (probe instanceof ProbeResult.OrderingHint hint && MoveOrdering.moveToFront(hint.move(), moves)) {
            // The hinted move is searched alone so that its score narrows the window of its siblings
            Move hinted = moves.get(0);
            OptionalInt childScore = AlphaBeta.search(-beta, -alpha, 1, depth, root.play(hinted), ctx);
            if (childScore.isEmpty()) return Optional.empty();
            int score = -childScore.getAsInt();
            if (score >= beta) {
                return Optional.of(new Choice(hinted, score, false));
            }
            scored.add(new RootScore(hinted, childScore.getAsInt(), 0));
            siblingAlpha = Math.max(alpha, score);
            first = 1;
        }

        final int windowAlpha = siblingAlpha;
        final List<Callable<OptionalInt>> tasks = new ObjectArrayList<>(moves.size() - first);
        for (int i = first; i < moves.size(); i++) {
            final Move move = moves.get(i);
            tasks.add(() -> AlphaBeta.search(-beta, -windowAlpha, 1, depth, root.play(move), ctx));
        }

        final List<Future<OptionalInt>> futures;
        try {
            futures = pool.invokeAll(tasks);
        } catch (InterruptedException e) {
            // Shutting down: same outcome as a stop
            Thread.currentThread().interrupt();
            ctx.stop.set(true);
            return Optional.empty();
        }

        boolean cancelled = false;
        for (int i = 0; i < futures.size(); i++) {
            OptionalInt childScore = join(futures.get(i));
            if (childScore.isEmpty()) {
                cancelled = true;
            } else {
                scored.add(new RootScore(moves.get(first + i), childScore.getAsInt(), first + i));
            }
        }
        if (cancelled || scored.isEmpty()) return Optional.empty();

        scored.sort(BEST_FIRST);
        RootScore best = scored.get(0);
        return Optional.of(new Choice(best.move(), -best.childScore(), false));
    }

    private static OptionalInt join(Future<OptionalInt> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Root move search failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OptionalInt.empty();
        }
    }
}
