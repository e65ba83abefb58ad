package soup.tadpole.engine.search.evaluator;

import soup.tadpole.engine.game.GameStatus;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.movegen.MoveGenerator;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.List;

/**
 * Static evaluation in centipawns, always from the point of view of the side to move: a positive score
 * is good for the player about to play, and the opponent would see the same quantity negated.
 */
public final class PositionEvaluator {

    private PositionEvaluator() {}

    public static int evaluate(Position position) {
        final List<Move> legalMoves = MoveGenerator.generateLegalMoves(position);
        final GameStatus status = position.status(legalMoves);
        if (status == GameStatus.WON) {
            // The side to move has been mated
            return -GameValues.CHECKMATE_VALUE;
        }
        if (status == GameStatus.DRAWN) {
            return GameValues.DRAW_VALUE;
        }
        return material(position) + mobility(position, legalMoves.size());
    }

    static int material(Position position) {
        int score = 0;
        for (int sq = 0; sq < 64; sq++) {
            byte square = position.squareAt(sq);
            if (PieceUtils.isEmpty(square)) continue;
            int value = PieceValues.valueOf(square);
            score += PieceUtils.toColor(square) == position.currentPlayer ? value : -value;
        }
        return score;
    }

    // Opponent mobility is counted on the passed position; it is unknown while in check
    static int mobility(Position position, int ownMoves) {
        Position passed = position.playNullMove();
        if (passed == null) {
            return 0;
        }
        return (ownMoves - MoveGenerator.countLegalMoves(passed)) * PieceValues.MOBILITY_WEIGHT;
    }
}
