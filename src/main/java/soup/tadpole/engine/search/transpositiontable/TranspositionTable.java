package soup.tadpole.engine.search.transpositiontable;

import soup.tadpole.engine.game.Position;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Position → best known search result, shared by every search thread without external locking.
 * <p>
 * Replacement is depth-preferred: an entry is only overwritten by one searched at least as deep.
 * Entries are aged once per search ({@link #age()}); when the table gets close to its ceiling,
 * {@link #insert} prunes the entries older than the oldest acceptable age.
 * <p>
 * Positions are keyed without their halfmove clock. Nothing is stored or answered for a search that
 * could reach the fifty-move rule, since its score would depend on the clock.
 */
public final class TranspositionTable {
    // Rough footprint of one entry: the position key, the entry record and the map node
    public static final int BYTES_PER_ENTRY = 256;
    public static final int DEFAULT_MAX_AGE = 4;
    // Halfmove clock at which the fifty-move rule draws the game
    static final int FIFTY_MOVE_PLIES = 100;

    private final ConcurrentHashMap<Position, TableEntry> table;
    private final int maxEntries;
    private final int maxAge;
    private final AtomicInteger oldestAcceptableAge;
    private final AtomicBoolean pruning = new AtomicBoolean(false);
    // Set when a prune at age 0 freed nothing: until the next search, new keys are dropped without a scan
    private final AtomicBoolean exhausted = new AtomicBoolean(false);

    // ----- metrics -----
    public static final class Stats {
        final LongAdder probes = new LongAdder();
        final LongAdder hits = new LongAdder();
        final LongAdder usableHits = new LongAdder();
        final LongAdder stores = new LongAdder();
        final LongAdder replacements = new LongAdder();
        final LongAdder evictions = new LongAdder();
        final LongAdder dropped = new LongAdder();
        final LongAdder prunes = new LongAdder();

        public long probes() { return probes.sum(); }
        public long hits() { return hits.sum(); }
        public long usableHits() { return usableHits.sum(); }
        public long stores() { return stores.sum(); }
        public long replacements() { return replacements.sum(); }
        public long evictions() { return evictions.sum(); }
        public long dropped() { return dropped.sum(); }
        public long prunes() { return prunes.sum(); }

        void clear() {
            probes.reset(); hits.reset(); usableHits.reset();
            stores.reset(); replacements.reset(); evictions.reset(); dropped.reset(); prunes.reset();
        }
    }
    private final Stats stats = new Stats();

    public TranspositionTable(int maxEntries) {
        this(maxEntries, DEFAULT_MAX_AGE);
    }

    /**
     * @param maxEntries ceiling on the number of stored positions
     * @param maxAge     oldest age (in searches) an entry may reach before it becomes eligible for pruning
     */
    public TranspositionTable(int maxEntries, int maxAge) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Table needs room for at least one entry");
        }
        if (maxAge < 0) {
            throw new IllegalArgumentException("Max age cannot be negative");
        }
        this.maxEntries = maxEntries;
        this.maxAge = maxAge;
        this.oldestAcceptableAge = new AtomicInteger(maxAge);
        this.table = new ConcurrentHashMap<>(Math.min(maxEntries, 1 << 16));
    }

    /**
     * Looks the position up for a search of {@code requestedDepth} remaining plies in window [alpha, beta].
     * <ul>
     *     <li>no entry: {@link ProbeResult.Miss}</li>
     *     <li>entry shallower than requested: {@link ProbeResult.OrderingHint}</li>
     *     <li>{@link NodeType#PV}: the stored score</li>
     *     <li>{@link NodeType#ALL}: alpha if the stored upper bound is ≤ alpha, a hint otherwise</li>
     *     <li>{@link NodeType#CUT}: beta if the stored lower bound is ≥ beta, a hint otherwise</li>
     * </ul>
     */
    public ProbeResult probe(Position position, int requestedDepth, int alpha, int beta) {
        stats.probes.increment();
        if (fiftyMoveRuleInReach(position, requestedDepth)) {
            return ProbeResult.MISS;
        }
        TableEntry entry = table.get(position);
        if (entry == null) {
            return ProbeResult.MISS;
        }
        stats.hits.increment();
        if (entry.depth() < requestedDepth) {
            return new ProbeResult.OrderingHint(entry.bestResponse());
        }
        ProbeResult result = switch (entry.node()) {
            case PV -> new ProbeResult.SearchResult(entry.bestResponse(), entry.score());
            case ALL -> entry.score() <= alpha
                    ? new ProbeResult.SearchResult(entry.bestResponse(), alpha)
                    : new ProbeResult.OrderingHint(entry.bestResponse());
            case CUT -> entry.score() >= beta
                    ? new ProbeResult.SearchResult(entry.bestResponse(), beta)
                    : new ProbeResult.OrderingHint(entry.bestResponse());
        };
        if (result instanceof ProbeResult.SearchResult) {
            stats.usableHits.increment();
        }
        return result;
    }

    /** The stored entry, if any, without touching the statistics. */
    public TableEntry peek(Position position) {
        return table.get(position);
    }

    /**
     * Stores an entry, keeping the existing one if it was searched deeper. A new position arriving when the
     * table is full triggers a prune first, and is dropped if the prune could not make room. Once the table
     * holds nothing but entries of the running search, new keys are dropped without pruning until {@link #age()}.
     * With concurrent writers the ceiling can be overshot by at most one entry per writer.
     */
    public void insert(Position position, TableEntry entry) {
        stats.stores.increment();
        if (fiftyMoveRuleInReach(position, entry.depth())) {
            return;
        }
        if (table.size() >= maxEntries && !table.containsKey(position)) {
            if (!exhausted.get()) {
                prune();
            }
            if (table.size() >= maxEntries) {
                stats.dropped.increment();
                return;
            }
        }
        table.merge(position, entry, this::preferDeeper);
    }

    // Keys ignore the halfmove clock, so only scores the fifty-move rule cannot have touched are shared
    private static boolean fiftyMoveRuleInReach(Position position, int depth) {
        return position.halfMoveClock + depth >= FIFTY_MOVE_PLIES;
    }

    private TableEntry preferDeeper(TableEntry stored, TableEntry incoming) {
        if (incoming.depth() >= stored.depth()) {
            stats.replacements.increment();
            return incoming;
        }
        return stored;
    }

    /**
     * Called once per search: every entry gets one search older, and the oldest acceptable age moves
     * one step back towards its configured value if a prune had to tighten it.
     */
    public void age() {
        table.replaceAll((position, entry) -> entry.aged());
        oldestAcceptableAge.updateAndGet(threshold -> Math.min(maxAge, threshold + 1));
        exhausted.set(false);
    }

    /**
     * Removes every entry older than the oldest acceptable age. If that was not enough to get under the
     * ceiling, the threshold is tightened by one for the next pass. It never goes below zero, so entries
     * stored during the current search survive. Only one thread prunes at a time; others return at once.
     *
     * @return number of evicted entries
     */
    public int prune() {
        if (!pruning.compareAndSet(false, true)) {
            return 0;
        }
        try {
            stats.prunes.increment();
            final int threshold = oldestAcceptableAge.get();
            final int before = table.size();
            table.values().removeIf(entry -> entry.age() > threshold);
            final int evicted = Math.max(0, before - table.size());
            stats.evictions.add(evicted);
            if (table.size() >= maxEntries) {
                if (threshold == 0) {
                    exhausted.set(true);
                }
                oldestAcceptableAge.updateAndGet(t -> Math.max(0, t - 1));
            }
            return evicted;
        } finally {
            pruning.set(false);
        }
    }

    public void clear() {
        table.clear();
        oldestAcceptableAge.set(maxAge);
        exhausted.set(false);
        stats.clear();
    }

    public int size() {
        return table.size();
    }

    public int capacity() {
        return maxEntries;
    }

    public int oldestAcceptableAge() {
        return oldestAcceptableAge.get();
    }

    public Stats stats() {
        return stats;
    }

    /** Reset counters (not occupancy) at the start of a search. */
    public void resetCounters() {
        stats.clear();
    }

    /** Share of probes that found the position, in percent. */
    public double hitRate() {
        long probes = stats.probes();
        return probes == 0 ? 0 : (100.0 * stats.hits() / probes);
    }

    public double loadFactor() {
        return 100.0 * table.size() / maxEntries;
    }

    public String toInfoStringForUCI() {
        return String.format(java.util.Locale.ROOT,
                "info string tt probes %d hits %d (%.1f%%) usable %d stores %d replaced %d evicted %d dropped %d prunes %d load %.1f%%",
                stats.probes(), stats.hits(), hitRate(), stats.usableHits(), stats.stores(),
                stats.replacements(), stats.evictions(), stats.dropped(), stats.prunes(), loadFactor());
    }
}
