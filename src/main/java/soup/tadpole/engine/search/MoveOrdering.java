package soup.tadpole.engine.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.search.evaluator.PieceValues;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.Comparator;
import java.util.List;

/**
 * Move ordering helpers. Everything is static and pure: the input list is never modified.
 */
final class MoveOrdering {

    private MoveOrdering() {}

    /**
     * Captures first, most valuable victim then least valuable attacker, followed by the quiet moves
     * in generation order. Equal captures keep their generation order too.
     */
    static List<Move> capturesFirst(Position position, List<Move> moves) {
        ObjectArrayList<Move> captures = new ObjectArrayList<>();
        ObjectArrayList<Move> quiets = new ObjectArrayList<>(moves.size());
        for (Move move : moves) {
            if (isCapture(position, move)) captures.add(move);
            else quiets.add(move);
        }
        // List.sort is stable
        captures.sort(Comparator.comparingInt((Move m) -> scoreCaptureMVVLVA(position, m)).reversed());
        captures.addAll(quiets);
        return captures;
    }

    /**
     * Moves {@code move} to the front of the list, keeping the relative order of the others.
     *
     * @return false when the move is not in the list (a stale hint), which is then left as is
     */
    static boolean moveToFront(Move move, List<Move> moves) {
        if (move == null) return false;
        int index = moves.indexOf(move);
        if (index < 0) return false;
        if (index > 0) {
            moves.remove(index);
            moves.add(0, move);
        }
        return true;
    }

    static boolean isCapture(Position position, Move move) {
        if (!PieceUtils.isEmpty(position.squareAt(move.endPosition()))) return true;
        // En passant lands on an empty square
        return move.endPosition() == position.enPassantIndex
                && PieceUtils.toPieceCode(position.squareAt(move.startPosition())) == PieceUtils.PAWN;
    }

    /** MVV-LVA scoring: the victim dominates, the attacker breaks ties. */
    private static int scoreCaptureMVVLVA(Position position, Move move) {
        byte victim = position.squareAt(move.endPosition());
        int victimValue = PieceUtils.isEmpty(victim) ? PieceValues.PAWN_VALUE : PieceValues.valueOf(victim);
        int attacker = PieceUtils.toPieceCode(position.squareAt(move.startPosition()));
        return (victimValue << 4) - attacker;
    }
}
