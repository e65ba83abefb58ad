package soup.tadpole.engine.search;

import soup.tadpole.engine.search.transpositiontable.TranspositionTable;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Everything one search shares between its threads: the cache, the configuration and the stop flag.
 * Built once per {@code go}; the workers only read it, apart from the node counter and the cache.
 */
public final class SearchContext {
    public final TranspositionTable tt;
    public final SearchConfig cfg;
    public final AtomicBoolean stop;

    // Counters
    public final LongAdder nodes = new LongAdder();

    public SearchContext(TranspositionTable tt, SearchConfig cfg, AtomicBoolean stop) {
        this.tt = tt;
        this.cfg = cfg;
        this.stop = stop;
    }

    public boolean stopped() {
        return stop.get();
    }
}
