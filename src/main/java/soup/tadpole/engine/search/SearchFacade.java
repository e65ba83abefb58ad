package soup.tadpole.engine.search;

import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.search.evaluator.PositionEvaluator;
import soup.tadpole.engine.search.transpositiontable.TranspositionTable;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point of the search. Owns the threads: one running the iterative deepening loop, and a fixed
 * pool sized by {@link SearchConfig#threads} on which the root moves are searched.
 */
public final class SearchFacade implements AutoCloseable {

    private final SearchConfig cfg;
    private final ExecutorService searchExecutor;
    private final ExecutorService rootPool;

    public SearchFacade(SearchConfig cfg) {
        this.cfg = cfg;
        this.searchExecutor = Executors.newSingleThreadExecutor(daemonThreads("search"));
        this.rootPool = Executors.newFixedThreadPool(cfg.threads, daemonThreads("search-worker"));
    }

    public SearchConfig config() {
        return cfg;
    }

    /**
     * Searches {@code position} on the calling thread until {@code maxDepth} is completed or {@code stop} is set.
     *
     * @throws IllegalStateException if the position has no legal move
     */
    public SearchResult findBestMove(Position position, TranspositionTable tt, AtomicBoolean stop,
                                     int maxDepth, Consumer<String> out) {
        SearchContext ctx = new SearchContext(tt, cfg, stop);
        tt.resetCounters();
        SearchResult sr = IterativeDeepening.run(position, ctx, rootPool, maxDepth, out);
        out.accept(tt.toInfoStringForUCI());

        if (cfg.debug) {
            // Verify bestMove legality in the searched position
            if (!position.getLegalMoves().contains(sr.move())) {
                throw new IllegalStateException("Illegal bestMove: " + sr.move() + " in " + position);
            }
            System.err.println(sr);
        }
        return sr;
    }

    /** Same as {@link #findBestMove} on the search thread. */
    public Future<SearchResult> submit(Position position, TranspositionTable tt, AtomicBoolean stop,
                                       int maxDepth, Consumer<String> out) {
        return searchExecutor.submit(() -> findBestMove(position, tt, stop, maxDepth, out));
    }

    /**
     * Answer given when no search result is available: the first legal move scored statically,
     * or no move at all with the position's own score when the game is over.
     */
    public static SearchResult fallback(Position position) {
        List<Move> moves = position.getLegalMoves();
        if (moves.isEmpty()) {
            return new SearchResult(null, PositionEvaluator.evaluate(position), 0, 0, 0);
        }
        Move first = moves.get(0);
        return new SearchResult(first, -PositionEvaluator.evaluate(position.play(first)), 0, 0, 0);
    }

    @Override
    public void close() {
        searchExecutor.shutdownNow();
        rootPool.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
