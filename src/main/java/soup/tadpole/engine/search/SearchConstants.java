package soup.tadpole.engine.search;

public class SearchConstants {
    // Above any reachable score, including mates
    public static final int INF = 30000;

    // Hard ceiling for "go infinite" and the Depth option
    public static final int MAX_DEPTH = 64;
}
