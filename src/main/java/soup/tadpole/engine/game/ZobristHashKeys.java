package soup.tadpole.engine.game;

import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.SplittableRandom;

public final class ZobristHashKeys {
    // Fixed seed so keys are stable from one run to the next
    private static final long SEED = 0x50_0B_7A_D9_01E5L;

    // [color][piece][square]
    private static final long[][][] PIECE_SQUARE = new long[2][7][64];
    private static final long[] CASTLING = new long[16];
    private static final long[] EN_PASSANT_FILE = new long[8];
    private static final long BLACK_TO_MOVE;

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (int c = 0; c < 2; c++) {
            for (int p = PieceUtils.PAWN; p <= PieceUtils.KING; p++) {
                for (int sq = 0; sq < 64; sq++) {
                    PIECE_SQUARE[c][p][sq] = random.nextLong();
                }
            }
        }
        for (int i = 0; i < CASTLING.length; i++) CASTLING[i] = random.nextLong();
        for (int i = 0; i < EN_PASSANT_FILE.length; i++) EN_PASSANT_FILE[i] = random.nextLong();
        BLACK_TO_MOVE = random.nextLong();
    }

    private ZobristHashKeys() {}

    static long getHashKey(byte[] squares, int currentPlayer, int castlingRights, int enPassantIndex) {
        long key = 0L;
        for (int sq = 0; sq < 64; sq++) {
            byte square = squares[sq];
            if (square != PieceUtils.NONE) {
                key ^= PIECE_SQUARE[ColorUtils.index(PieceUtils.toColor(square))][PieceUtils.toPieceCode(square)][sq];
            }
        }
        key ^= CASTLING[castlingRights & 0xF];
        if (enPassantIndex >= 0) {
            key ^= EN_PASSANT_FILE[enPassantIndex & 7];
        }
        if (ColorUtils.isBlack(currentPlayer)) {
            key ^= BLACK_TO_MOVE;
        }
        return key;
    }
}
