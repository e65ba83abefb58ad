package soup.tadpole.engine.utils.notations;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FENUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 b - - 12 47",
    })
    public void writesBackWhatItReads(String fen) {
        assertEquals(fen, FENUtils.getFENFromPosition(FENUtils.getPositionFrom(fen)));
    }

    @Test
    public void readsPiecesAndState() {
        // When
        Position position = FENUtils.getPositionFrom("rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3");

        // Then
        assertEquals(ColorUtils.WHITE, position.currentPlayer);
        assertEquals(MoveIOUtils.getIndexFromSquare("f6"), position.enPassantIndex);
        assertEquals(PieceUtils.encode(PieceUtils.KING, ColorUtils.BLACK), position.squareAt(MoveIOUtils.getIndexFromSquare("e8")));
        assertEquals(PieceUtils.encode(PieceUtils.PAWN, ColorUtils.WHITE), position.squareAt(MoveIOUtils.getIndexFromSquare("e5")));
        assertTrue(position.getLegalMoves().contains(Move.fromAlgebraicNotation("e5f6")));
        assertEquals(3, position.fullMoveClock);
    }

    @Test
    public void clocksMayBeOmitted() {
        Position position = FENUtils.getPositionFrom("4k3/8/8/8/8/8/4P3/4K3 b - -");
        assertEquals(0, position.halfMoveClock);
        assertEquals(1, position.fullMoveClock);
        assertEquals(ColorUtils.BLACK, position.currentPlayer);
    }

    @Test
    public void appliesUciMoves() {
        Position position = FENUtils.getPositionFrom(BoardGenerator.STANDARD_GAME, List.of("e2e4", "e7e5", "g1f3"));
        assertEquals("rnbqkbnr/pppp1ppp/8/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R b KQkq - 1 2", position.toString());
    }

    @Test
    public void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getPositionFrom("not a fen"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getPositionFrom("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP w KQkq - 0 1"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getPositionFrom("rnbqkbnr/pppppppp/9/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getPositionFrom("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR x KQkq - 0 1"));
        assertThrows(IllegalArgumentException.class,
                () -> FENUtils.getPositionFrom(BoardGenerator.STANDARD_GAME, List.of("e2e5")));
        assertThrows(IllegalArgumentException.class,
                () -> FENUtils.getPositionFrom(BoardGenerator.STANDARD_GAME, List.of("e2")));
    }

    @Test
    public void moveNotation() {
        assertEquals("e7e8q", MoveIOUtils.writeAlgebraicNotation(Move.promote(52, 60, PieceUtils.QUEEN)));
        assertEquals(new Move(12, 28), MoveIOUtils.readAlgebraicNotation("e2e4"));
        assertEquals(MoveIOUtils.NULL_MOVE, MoveIOUtils.writeAlgebraicNotation(null));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.readAlgebraicNotation("e7e8k"));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.readAlgebraicNotation("i2i4"));
    }
}
