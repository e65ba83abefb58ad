package soup.tadpole.engine.search.evaluator;

import soup.tadpole.engine.utils.PieceUtils;

public final class PieceValues {
    public static final int PAWN_VALUE = 100;
    public static final int KNIGHT_VALUE = 320;
    public static final int BISHOP_VALUE = 330;
    public static final int ROOK_VALUE = 500;
    public static final int QUEEN_VALUE = 900;
    // Kings are never traded, they do not count as material
    public static final int KING_VALUE = 0;

    // cp per legal move
    public static final int MOBILITY_WEIGHT = 2;

    // Indexed by piece code (cheap access)
    static final int[] VAL = {
            0,
            PAWN_VALUE,
            KNIGHT_VALUE,
            BISHOP_VALUE,
            ROOK_VALUE,
            QUEEN_VALUE,
            KING_VALUE
    };

    private PieceValues() {}

    public static int valueOf(byte piece) {
        return VAL[PieceUtils.toPieceCode(piece)];
    }
}
