package soup.tadpole.engine.search.evaluator;

import org.junit.jupiter.api.Test;
import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.MoveGenerator;

import static org.junit.jupiter.api.Assertions.*;

public class PositionEvaluatorTest {

    @Test
    public void startingPositionIsBalanced() {
        assertEquals(0, PositionEvaluator.evaluate(BoardGenerator.newStandardGameBoard()));
    }

    @Test
    public void matedSideGetsTheLowestScore() {
        Position foolsMate = BoardGenerator.from("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3");
        assertEquals(-GameValues.CHECKMATE_VALUE, PositionEvaluator.evaluate(foolsMate));
    }

    @Test
    public void drawsAreWorthNothing() {
        // Stalemate, even a queen up
        assertEquals(GameValues.PAT_VALUE, PositionEvaluator.evaluate(BoardGenerator.from("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1")));
        assertEquals(GameValues.DRAW_VALUE, PositionEvaluator.evaluate(BoardGenerator.from("4k3/8/8/8/8/8/4P3/4K3 w - - 100 80")));
    }

    @Test
    public void materialIsSeenFromTheSideToMove() {
        Position whiteToMove = BoardGenerator.from("4k3/8/8/8/8/8/8/3QK3 w - - 0 1");
        Position blackToMove = BoardGenerator.from("4k3/8/8/8/8/8/8/3QK3 b - - 0 1");

        assertEquals(PieceValues.QUEEN_VALUE, PositionEvaluator.material(whiteToMove));
        assertEquals(-PieceValues.QUEEN_VALUE, PositionEvaluator.material(blackToMove));
        assertTrue(PositionEvaluator.evaluate(whiteToMove) > PieceValues.QUEEN_VALUE);
        assertTrue(PositionEvaluator.evaluate(blackToMove) < -PieceValues.ROOK_VALUE);
    }

    @Test
    public void mobilityComparesBothSides() {
        // Given
        Position position = BoardGenerator.from("4k3/8/8/8/8/8/8/3QK3 w - - 0 1");
        int ownMoves = MoveGenerator.countLegalMoves(position);
        int opponentMoves = MoveGenerator.countLegalMoves(position.playNullMove());

        // When
        int mobility = PositionEvaluator.mobility(position, ownMoves);

        // Then
        assertEquals((ownMoves - opponentMoves) * PieceValues.MOBILITY_WEIGHT, mobility);
        assertTrue(mobility > 0);
    }

    @Test
    public void noMobilityTermWhenInCheck() {
        Position inCheck = BoardGenerator.from("4k3/8/8/8/8/8/8/r3K3 w - - 0 1");
        assertEquals(0, PositionEvaluator.mobility(inCheck, MoveGenerator.countLegalMoves(inCheck)));
        assertEquals(-PieceValues.ROOK_VALUE, PositionEvaluator.evaluate(inCheck));
    }
}
