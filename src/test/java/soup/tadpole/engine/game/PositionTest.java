package soup.tadpole.engine.game;

import org.junit.jupiter.api.Test;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;
import soup.tadpole.engine.utils.notations.FENUtils;
import soup.tadpole.engine.utils.notations.MoveIOUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PositionTest {

    @Test
    public void transpositionsAreEqualWhateverTheClocks() {
        // Given
        Position start = BoardGenerator.newStandardGameBoard();

        // When
        Position knightsBackHome = FENUtils.getPositionFrom(BoardGenerator.STANDARD_GAME,
                List.of("g1f3", "g8f6", "f3g1", "f6g8"));

        // Then
        assertEquals(start, knightsBackHome);
        assertEquals(start.hashCode(), knightsBackHome.hashCode());
        assertEquals(start.zobristKey(), knightsBackHome.zobristKey());
        assertEquals(4, knightsBackHome.halfMoveClock);
        assertEquals(3, knightsBackHome.fullMoveClock);
    }

    @Test
    public void castlingRightsArePartOfTheIdentity() {
        Position start = BoardGenerator.newStandardGameBoard();
        Position noWhiteKingSide = BoardGenerator.from("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w Qkq - 0 1");
        assertNotEquals(start, noWhiteKingSide);
        assertNotEquals(start.zobristKey(), noWhiteKingSide.zobristKey());
    }

    @Test
    public void playLeavesTheOriginalUntouched() {
        Position start = BoardGenerator.newStandardGameBoard();
        Position afterE4 = start.play(Move.fromAlgebraicNotation("e2e4"));

        assertEquals(BoardGenerator.STANDARD_GAME, start.toString());
        assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1", afterE4.toString());
        assertEquals(ColorUtils.BLACK, afterE4.currentPlayer);
    }

    @Test
    public void enPassantSquareOnlyWhenCapturable() {
        Position withNeighbour = BoardGenerator.from("4k3/8/8/8/3p4/8/4P3/4K3 w - - 0 1");
        Position afterE4 = withNeighbour.play(Move.fromAlgebraicNotation("e2e4"));
        assertEquals(MoveIOUtils.getIndexFromSquare("e3"), afterE4.enPassantIndex);

        Position captured = afterE4.play(FENUtils.resolveMove(afterE4, "d4e3"));
        assertTrue(PieceUtils.isEmpty(captured.squareAt(MoveIOUtils.getIndexFromSquare("e4"))));
        assertEquals("4k3/8/8/8/8/4p3/8/4K3 w - - 0 2", captured.toString());

        Position alone = BoardGenerator.newStandardGameBoard().play(Move.fromAlgebraicNotation("e2e4"));
        assertEquals(-1, alone.enPassantIndex);
    }

    @Test
    public void castlingMovesTheRookAndDropsRights() {
        Position position = BoardGenerator.from("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");
        Position castled = position.play(Move.fromAlgebraicNotation("e1g1"));
        assertEquals("r3k2r/8/8/8/8/8/8/R4RK1 b kq - 1 1", castled.toString());

        Position rookTaken = castled.play(Move.fromAlgebraicNotation("a8a1"));
        assertFalse(rookTaken.canCastle(Position.BLACK_QUEEN_SIDE));
        assertTrue(rookTaken.canCastle(Position.BLACK_KING_SIDE));
    }

    @Test
    public void promotion() {
        Position position = BoardGenerator.from("8/P6k/8/8/8/8/8/K7 w - - 0 1");
        Position promoted = position.play(Move.fromAlgebraicNotation("a7a8n"));
        assertEquals(PieceUtils.encode(PieceUtils.KNIGHT, ColorUtils.WHITE), promoted.squareAt(56));
    }

    @Test
    public void nullMove() {
        // Given
        Position afterE4 = BoardGenerator.from("4k3/8/8/8/3p4/8/4P3/4K3 w - - 0 1")
                .play(Move.fromAlgebraicNotation("e2e4"));

        // When
        Position passed = afterE4.playNullMove();

        // Then
        assertNotNull(passed);
        assertEquals(ColorUtils.WHITE, passed.currentPlayer);
        assertEquals(-1, passed.enPassantIndex);
        assertEquals("4k3/8/8/8/3pP3/8/8/4K3 w - - 1 2", passed.toString());

        Position inCheck = BoardGenerator.from("4k3/8/8/8/8/8/8/r3K3 w - - 0 1");
        assertTrue(inCheck.inCheck());
        assertNull(inCheck.playNullMove());
    }

    @Test
    public void status() {
        assertEquals(GameStatus.ONGOING, BoardGenerator.newStandardGameBoard().status());
        // Fool's mate, white to move is mated
        assertEquals(GameStatus.WON, BoardGenerator.from("rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3").status());
        // Stalemate
        assertEquals(GameStatus.DRAWN, BoardGenerator.from("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1").status());
        // Fifty moves
        assertEquals(GameStatus.DRAWN, BoardGenerator.from("4k3/8/8/8/8/8/4P3/4K3 w - - 100 80").status());
        assertEquals(GameStatus.ONGOING, BoardGenerator.from("4k3/8/8/8/8/8/4P3/4K3 w - - 99 80").status());
        // Insufficient material
        assertEquals(GameStatus.DRAWN, BoardGenerator.from("4k3/8/8/8/8/8/8/2B1K3 w - - 0 1").status());
        assertEquals(GameStatus.ONGOING, BoardGenerator.from("4k3/8/8/8/8/8/8/1NB1K3 w - - 0 1").status());
    }

    @Test
    public void needsOneKingPerSide() {
        byte[] squares = new byte[64];
        squares[4] = PieceUtils.KING;
        assertThrows(IllegalArgumentException.class,
                () -> Position.of(squares, ColorUtils.WHITE, 0, -1, 0, 1));
    }
}
