package soup.tadpole.engine.movegen;

import soup.tadpole.engine.utils.PieceUtils;
import soup.tadpole.engine.utils.notations.MoveIOUtils;

/**
 * A transition between two squares (flat index {@code file + 8 * rank}, a1 = 0), with an optional
 * promotion piece code. Castling is encoded as the king's two-square move, en passant as the pawn's
 * diagonal move onto the en-passant square.
 */
public record Move(int startPosition, int endPosition, byte promotion) {

    public Move(int startPosition, int endPosition) {
        this(startPosition, endPosition, PieceUtils.NONE);
    }

    public static Move promote(int startPosition, int endPosition, byte pieceType) {
        return new Move(startPosition, endPosition, pieceType);
    }

    public static Move fromAlgebraicNotation(String notation) {
        return MoveIOUtils.readAlgebraicNotation(notation);
    }

    public boolean isPromotion() {
        return promotion != PieceUtils.NONE;
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
