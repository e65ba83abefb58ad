package soup.tadpole.engine.search;

import soup.tadpole.engine.search.transpositiontable.TranspositionTable;

public final class SearchConfig {

    public final boolean debug;

    // Iterative deepening
    public final int maxDepth;

    // Aspiration window
    public final int aspirationCp;
    public final boolean aspirationResearch; // false: accept a boundary score as final for the depth

    // TT
    public final int ttSizeMb;
    public final int ttMaxEntries; // -1: derived from ttSizeMb
    public final int ttMaxAge;

    // Root fan-out
    public final int threads;

    // Actor
    public final long pollIntervalMs;

    private SearchConfig(Builder b) {
        debug = b.debug;
        maxDepth = b.maxDepth;
        aspirationCp = b.aspirationCp;
        aspirationResearch = b.aspirationResearch;
        ttSizeMb = b.ttSizeMb;
        ttMaxEntries = b.ttMaxEntries;
        ttMaxAge = b.ttMaxAge;
        threads = b.threads;
        pollIntervalMs = b.pollIntervalMs;
    }

    /** Entry ceiling of the cache, either given explicitly or computed from its size in MB. */
    public int ttEntries() {
        if (ttMaxEntries > 0) return ttMaxEntries;
        long entries = ((long) ttSizeMb << 20) / TranspositionTable.BYTES_PER_ENTRY;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, entries));
    }

    public TranspositionTable newTranspositionTable() {
        return new TranspositionTable(ttEntries(), ttMaxAge);
    }

    public Builder toBuilder() {
        return new Builder()
                .debug(debug)
                .maxDepth(maxDepth)
                .aspirationCp(aspirationCp)
                .aspirationResearch(aspirationResearch)
                .ttSizeMb(ttSizeMb)
                .ttMaxEntries(ttMaxEntries)
                .ttMaxAge(ttMaxAge)
                .threads(threads)
                .pollIntervalMs(pollIntervalMs);
    }

    /** Defaults overridden by {@code -Ddebug}, {@code -Dsearch.depth}, {@code -Dtt.size}, {@code -Dtt.entries}, {@code -Dthreads}. */
    public static SearchConfig fromSystemProperties() {
        return new Builder()
                .debug(Boolean.parseBoolean(System.getProperty("debug", "false")))
                .maxDepth(Integer.parseInt(System.getProperty("search.depth", "7")))
                .ttSizeMb(Integer.parseInt(System.getProperty("tt.size", "64")))
                .ttMaxEntries(Integer.parseInt(System.getProperty("tt.entries", "-1")))
                .threads(Integer.parseInt(System.getProperty("threads",
                        String.valueOf(Runtime.getRuntime().availableProcessors()))))
                .build();
    }

    public static class Builder {
        private boolean debug = false;
        private int maxDepth = 7;
        private int aspirationCp = 100;
        private boolean aspirationResearch = true;
        private int ttSizeMb = 64;
        private int ttMaxEntries = -1;
        private int ttMaxAge = TranspositionTable.DEFAULT_MAX_AGE;
        private int threads = Runtime.getRuntime().availableProcessors();
        private long pollIntervalMs = 5;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder aspirationCp(int v){aspirationCp=v;return this;}
        public Builder aspirationResearch(boolean v){aspirationResearch=v;return this;}
        public Builder ttSizeMb(int v){ttSizeMb=v;return this;}
        public Builder ttMaxEntries(int v){ttMaxEntries=v;return this;}
        public Builder ttMaxAge(int v){ttMaxAge=v;return this;}
        public Builder threads(int v){threads=v;return this;}
        public Builder pollIntervalMs(long v){pollIntervalMs=v;return this;}

        public SearchConfig build() {
            if (maxDepth < 1 || maxDepth > SearchConstants.MAX_DEPTH) {
                throw new IllegalArgumentException("Depth must be within 1.." + SearchConstants.MAX_DEPTH + ", got " + maxDepth);
            }
            if (aspirationCp < 1) throw new IllegalArgumentException("Aspiration window must be positive");
            if (ttSizeMb < 1) throw new IllegalArgumentException("Hash size must be at least 1 MB");
            if (threads < 1) throw new IllegalArgumentException("At least one search thread is needed");
            if (pollIntervalMs < 1) throw new IllegalArgumentException("Poll interval must be at least 1 ms");
            return new SearchConfig(this);
        }
    }
}
