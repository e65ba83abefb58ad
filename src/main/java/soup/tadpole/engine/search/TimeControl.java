package soup.tadpole.engine.search;

/** Turns UCI clock parameters into a time budget for one move. */
public final class TimeControl {
    // Keep a safety margin for the reply to reach the GUI
    private static final long MARGIN_MS = 10;

    private TimeControl() {}

    /**
     * Fixed movetime wins. Otherwise the mover's clock is split over {@code movestogo} moves when known,
     * or 2% of it is used, plus half the increment; never more than the clock minus the margin.
     *
     * @return the budget in milliseconds, or 0 when there is no time limit
     */
    public static long computeBudgetMs(boolean whiteToMove, long movetime, long wtime, long btime,
                                       long winc, long binc, int movestogo) {
        long ms = movetime;
        if (ms != -1) {
            if (ms <= MARGIN_MS) ms = MARGIN_MS;
            else ms -= MARGIN_MS;
            return ms;
        }
        ms = whiteToMove ? wtime : btime;
        if (ms == -1) return 0;

        long inc = Math.max(0, whiteToMove ? winc : binc);
        long budget = movestogo > 0 ? ms / movestogo : 2L * ms / 100L;
        budget += inc / 2;
        return Math.max(1, Math.min(budget, ms - MARGIN_MS));
    }
}
