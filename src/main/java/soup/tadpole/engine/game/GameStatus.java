package soup.tadpole.engine.game;

/**
 * Outcome of a position, seen from the side to move. {@link #WON} means the game has been won by the
 * side that just moved: the side to move is checkmated.
 */
public enum GameStatus {
    ONGOING, WON, DRAWN
}
