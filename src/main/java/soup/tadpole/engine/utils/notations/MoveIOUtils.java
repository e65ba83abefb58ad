package soup.tadpole.engine.utils.notations;

import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.utils.PieceUtils;

/** UCI long algebraic notation: {@code e2e4}, {@code e7e8q}, {@code 0000} for the null move. */
public final class MoveIOUtils {
    public static final String NULL_MOVE = "0000";

    private MoveIOUtils() {}

    public static String writeAlgebraicNotation(Move move) {
        if (move == null) {
            return NULL_MOVE;
        }
        String initialPosition = getSquareFromIndex(move.startPosition());
        String targetPosition = getSquareFromIndex(move.endPosition());
        String promotedPiece = move.isPromotion() ? String.valueOf(PieceUtils.toLetter(move.promotion())) : "";
        return initialPosition + targetPosition + promotedPiece;
    }

    public static Move readAlgebraicNotation(String notation) {
        if (notation == null || (notation.length() != 4 && notation.length() != 5)) {
            throw new IllegalArgumentException("Cannot parse algebraic notation " + notation);
        }
        int startPosition = getIndexFromSquare(notation.substring(0, 2));
        int endPosition = getIndexFromSquare(notation.substring(2, 4));
        if (notation.length() == 4) {
            return new Move(startPosition, endPosition);
        }
        byte promotion = PieceUtils.fromLetter(notation.charAt(4));
        if (promotion == PieceUtils.PAWN || promotion == PieceUtils.KING) {
            throw new IllegalArgumentException("Cannot promote to " + notation.charAt(4));
        }
        return Move.promote(startPosition, endPosition, promotion);
    }

    public static String getSquareFromIndex(int index) {
        if (index < 0 || index > 63) {
            throw new IllegalArgumentException("square index should be in [0-63], got " + index);
        }
        return String.valueOf((char) ('a' + (index & 7))) + (char) ('1' + (index >>> 3));
    }

    public static int getIndexFromSquare(String square) {
        if (square.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1', got " + square);
        }
        int file = square.charAt(0) - 'a';
        int rank = square.charAt(1) - '1';
        if (file < 0 || file > 7) {
            throw new IllegalArgumentException("square letter should be in [a-h], got " + square);
        }
        if (rank < 0 || rank > 7) {
            throw new IllegalArgumentException("square digit should be in [1-8], got " + square);
        }
        return file + 8 * rank;
    }
}
