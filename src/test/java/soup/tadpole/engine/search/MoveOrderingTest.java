package soup.tadpole.engine.search;

import org.junit.jupiter.api.Test;
import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MoveOrderingTest {

    @Test
    public void capturesFirstMostValuableVictimLeastValuableAttacker() {
        // Given
        Position position = BoardGenerator.from("4k3/8/8/3q4/4P3/8/8/3QK3 w - - 0 1");
        List<Move> generated = position.getLegalMoves();

        // When
        List<Move> ordered = MoveOrdering.capturesFirst(position, generated);

        // Then
        assertEquals(Move.fromAlgebraicNotation("e4d5"), ordered.get(0));
        assertEquals(Move.fromAlgebraicNotation("d1d5"), ordered.get(1));
        assertEquals(generated.size(), ordered.size());
        // Quiet moves keep their generation order
        List<Move> quiets = new ArrayList<>(generated);
        quiets.removeAll(ordered.subList(0, 2));
        assertEquals(quiets, ordered.subList(2, ordered.size()));
    }

    @Test
    public void enPassantIsACapture() {
        Position position = BoardGenerator.from("rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3");
        assertTrue(MoveOrdering.isCapture(position, Move.fromAlgebraicNotation("e5f6")));
        assertFalse(MoveOrdering.isCapture(position, Move.fromAlgebraicNotation("e5e6")));
    }

    @Test
    public void moveToFront() {
        List<Move> moves = new ArrayList<>(List.of(
                Move.fromAlgebraicNotation("a2a3"),
                Move.fromAlgebraicNotation("b2b3"),
                Move.fromAlgebraicNotation("c2c3")));

        assertTrue(MoveOrdering.moveToFront(Move.fromAlgebraicNotation("c2c3"), moves));
        assertEquals(List.of(Move.fromAlgebraicNotation("c2c3"), Move.fromAlgebraicNotation("a2a3"),
                Move.fromAlgebraicNotation("b2b3")), moves);
        assertFalse(MoveOrdering.moveToFront(Move.fromAlgebraicNotation("h2h4"), moves));
        assertFalse(MoveOrdering.moveToFront(null, moves));
    }
}
