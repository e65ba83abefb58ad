package soup.tadpole.engine.actor;

/**
 * Budget of one {@code go}.
 *
 * @param depth      depth ceiling, 0 for the configured default
 * @param moveTimeMs time budget in milliseconds, 0 for none
 */
public record SearchLimits(int depth, long moveTimeMs) {

    public static final SearchLimits DEFAULT = new SearchLimits(0, 0);

    public SearchLimits {
        if (depth < 0) throw new IllegalArgumentException("Negative depth: " + depth);
        if (moveTimeMs < 0) throw new IllegalArgumentException("Negative move time: " + moveTimeMs);
    }

    public static SearchLimits depth(int depth) {
        return new SearchLimits(depth, 0);
    }

    public static SearchLimits moveTime(long moveTimeMs) {
        return new SearchLimits(0, moveTimeMs);
    }

    public boolean hasDeadline() {
        return moveTimeMs > 0;
    }
}
