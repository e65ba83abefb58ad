package soup.tadpole.engine.game;

import soup.tadpole.engine.utils.notations.FENUtils;

public final class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private BoardGenerator() {}

    public static Position newStandardGameBoard() {
        return FENUtils.getPositionFrom(STANDARD_GAME);
    }

    public static Position from(String fen) {
        return FENUtils.getPositionFrom(fen);
    }
}
