package soup.tadpole.engine.search;

import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.search.transpositiontable.NodeType;
import soup.tadpole.engine.search.transpositiontable.TableEntry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static soup.tadpole.engine.search.SearchConstants.INF;

final class IterativeDeepening {

    private IterativeDeepening() {}

    /**
     * Searches depth 1, 2, ... up to {@code maxDepth} and returns the result of the last completed depth.
     * Stopping never loses the answer: before depth 1 the first legal move is scored statically.
     *
     * @throws IllegalStateException if the side to move has no legal move
     */
    static SearchResult run(Position root, SearchContext ctx, ExecutorService pool, int maxDepth, Consumer<String> out) {
        final long start = System.nanoTime();
        final List<Move> rootMoves = root.getLegalMoves();
        if (rootMoves.isEmpty()) {
            throw new IllegalStateException("no legal moves");
        }

        // Fallback answer, available even if a stop comes before depth 1 completes
        SearchResult last = SearchFacade.fallback(root);

        final int asp = ctx.cfg.aspirationCp;
        for (int depth = 1; depth <= maxDepth; depth++) {
            if (ctx.stopped()) break;

            int alpha = (depth == 1) ? -INF : last.score() - asp;
            int beta  = (depth == 1) ?  INF : last.score() + asp;

            Optional<RootSearch.Choice> choice;
            while (true) {
                choice = RootSearch.searchAtDepth(root, rootMoves, ctx, pool, depth, alpha, beta);
                if (choice.isEmpty() || !ctx.cfg.aspirationResearch) break;
                int score = choice.get().score();
                if (score <= alpha && alpha > -INF) {
                    alpha -= asp + asp;
                    if (alpha < -INF / 2) alpha = -INF;
                } else if (score >= beta && beta < INF) {
                    beta += asp + asp;
                    if (beta > INF / 2) beta = INF;
                } else {
                    break;
                }
                if (ctx.cfg.debug) {
                    System.err.println("aspiration re-search at depth " + depth + " window [" + alpha + ", " + beta + "]");
                }
            }
            if (choice.isEmpty()) break;

            RootSearch.Choice picked = choice.get();
            if (!picked.fromCache()) {
                ctx.tt.insert(root, new TableEntry(picked.move(), depth, picked.score(), NodeType.PV));
            }
            last = new SearchResult(picked.move(), picked.score(), depth, ctx.nodes.sum(), elapsedMs(start));
            out.accept(last.toUCIInfo());
        }
        return last;
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
