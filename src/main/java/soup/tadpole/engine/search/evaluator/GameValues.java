package soup.tadpole.engine.search.evaluator;

public final class GameValues {
    // Decisive results dominate any heuristic sum
    public static final int CHECKMATE_VALUE = 20000;
    public static final int DRAW_VALUE = 0;
    public static final int PAT_VALUE = DRAW_VALUE;

    private GameValues() {}
}
