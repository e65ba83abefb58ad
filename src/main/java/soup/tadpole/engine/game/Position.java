package soup.tadpole.engine.game;

import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.movegen.MoveGenerator;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;
import soup.tadpole.engine.utils.notations.FENUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable game state: piece placement, side to move, castling rights, en-passant square and clocks.
 * Playing a move returns a new instance, so a position can be shared freely between search threads.
 * <p>
 * Equality covers placement, side to move, castling rights and the en-passant square. The clocks are
 * left out so that transpositions reached through different move orders meet in the cache.
 */
public final class Position {
    public static final int WHITE_KING_SIDE = 1;
    public static final int WHITE_QUEEN_SIDE = 1 << 1;
    public static final int BLACK_KING_SIDE = 1 << 2;
    public static final int BLACK_QUEEN_SIDE = 1 << 3;

    // Castling rights left after something moves from or to a square
    private static final int[] CASTLING_MASK = new int[64];
    static {
        Arrays.fill(CASTLING_MASK, 0xF);
        CASTLING_MASK[0] &= ~WHITE_QUEEN_SIDE;
        CASTLING_MASK[7] &= ~WHITE_KING_SIDE;
        CASTLING_MASK[4] &= ~(WHITE_KING_SIDE | WHITE_QUEEN_SIDE);
        CASTLING_MASK[56] &= ~BLACK_QUEEN_SIDE;
        CASTLING_MASK[63] &= ~BLACK_KING_SIDE;
        CASTLING_MASK[60] &= ~(BLACK_KING_SIDE | BLACK_QUEEN_SIDE);
    }

    private final byte[] squares;
    public final int currentPlayer;
    public final int castlingRights;
    public final int enPassantIndex;
    public final int halfMoveClock;
    public final int fullMoveClock;

    private final int whiteKingIndex;
    private final int blackKingIndex;
    private final long zobristKey;

    private Position(byte[] squares, int currentPlayer, int castlingRights, int enPassantIndex,
                     int halfMoveClock, int fullMoveClock) {
        this.squares = squares;
        this.currentPlayer = currentPlayer;
        this.castlingRights = castlingRights & 0xF;
        this.enPassantIndex = enPassantIndex;
        this.halfMoveClock = halfMoveClock;
        this.fullMoveClock = fullMoveClock;

        int whiteKing = -1, blackKing = -1;
        for (int sq = 0; sq < 64; sq++) {
            if (PieceUtils.toPieceCode(squares[sq]) == PieceUtils.KING) {
                if (PieceUtils.toColor(squares[sq]) == ColorUtils.WHITE) whiteKing = sq;
                else blackKing = sq;
            }
        }
        this.whiteKingIndex = whiteKing;
        this.blackKingIndex = blackKing;
        this.zobristKey = ZobristHashKeys.getHashKey(squares, currentPlayer, this.castlingRights, enPassantIndex);
    }

    /**
     * Builds a position from a 64-square array ({@link PieceUtils#encode} codes, a1 = 0). The array is copied.
     *
     * @throws IllegalArgumentException if either side does not have exactly one king
     */
    public static Position of(byte[] squares, int currentPlayer, int castlingRights, int enPassantIndex,
                              int halfMoveClock, int fullMoveClock) {
        if (squares.length != 64) {
            throw new IllegalArgumentException("A board has 64 squares, got " + squares.length);
        }
        int whiteKings = 0, blackKings = 0;
        for (byte square : squares) {
            if (PieceUtils.toPieceCode(square) == PieceUtils.KING) {
                if (PieceUtils.toColor(square) == ColorUtils.WHITE) whiteKings++;
                else blackKings++;
            }
        }
        if (whiteKings != 1 || blackKings != 1) {
            throw new IllegalArgumentException("Each side needs exactly one king");
        }
        return new Position(squares.clone(), currentPlayer, castlingRights, enPassantIndex, halfMoveClock, fullMoveClock);
    }

    public byte squareAt(int index) {
        return squares[index];
    }

    /** Copy of the board, for callers that need to scan or simulate on it. */
    public byte[] squares() {
        return squares.clone();
    }

    public int kingIndex(int color) {
        return ColorUtils.isWhite(color) ? whiteKingIndex : blackKingIndex;
    }

    public long zobristKey() {
        return zobristKey;
    }

    public boolean canCastle(int right) {
        return (castlingRights & right) != 0;
    }

    public boolean inCheck() {
        return MoveGenerator.isSquareAttacked(squares, kingIndex(currentPlayer), ColorUtils.switchColor(currentPlayer));
    }

    public List<Move> getLegalMoves() {
        return MoveGenerator.generateLegalMoves(this);
    }

    /**
     * Plays a legal move and returns the resulting position. This instance is left untouched.
     * The move is not validated; feeding an illegal move gives an undefined position.
     */
    public Position play(Move move) {
        final int from = move.startPosition();
        final int to = move.endPosition();
        final byte[] next = squares.clone();
        final byte moving = next[from];
        final byte piece = PieceUtils.toPieceCode(moving);
        final boolean capture = next[to] != PieceUtils.NONE;

        int nextEnPassant = -1;
        int nextHalfMoveClock = (piece == PieceUtils.PAWN || capture) ? 0 : halfMoveClock + 1;

        byte placed = moving;
        if (piece == PieceUtils.PAWN) {
            if (to == enPassantIndex && (from & 7) != (to & 7)) {
                // The captured pawn sits behind the en-passant square
                int capturedIndex = ColorUtils.isWhite(currentPlayer) ? to - 8 : to + 8;
                next[capturedIndex] = PieceUtils.NONE;
            } else if (Math.abs(to - from) == 16 && hasAdjacentEnemyPawn(next, to)) {
                nextEnPassant = (from + to) >>> 1;
            }
            if (move.isPromotion()) {
                placed = PieceUtils.encode(move.promotion(), currentPlayer);
            }
        } else if (piece == PieceUtils.KING && Math.abs(to - from) == 2) {
            // Castling: bring the rook over the king
            if (to > from) {
                next[from + 1] = next[from + 3];
                next[from + 3] = PieceUtils.NONE;
            } else {
                next[from - 1] = next[from - 4];
                next[from - 4] = PieceUtils.NONE;
            }
        }
        next[to] = placed;
        next[from] = PieceUtils.NONE;

        int nextCastlingRights = castlingRights & CASTLING_MASK[from] & CASTLING_MASK[to];
        int nextFullMoveClock = ColorUtils.isBlack(currentPlayer) ? fullMoveClock + 1 : fullMoveClock;
        return new Position(next, ColorUtils.switchColor(currentPlayer), nextCastlingRights, nextEnPassant,
                nextHalfMoveClock, nextFullMoveClock);
    }

    /**
     * The same placement with the turn passed to the opponent and no en-passant square.
     *
     * @return the passed position, or {@code null} when the side to move is in check
     */
    public Position playNullMove() {
        if (inCheck()) {
            return null;
        }
        int nextFullMoveClock = ColorUtils.isBlack(currentPlayer) ? fullMoveClock + 1 : fullMoveClock;
        return new Position(squares, ColorUtils.switchColor(currentPlayer), castlingRights, -1,
                halfMoveClock + 1, nextFullMoveClock);
    }

    public GameStatus status() {
        return status(MoveGenerator.hasLegalMove(this));
    }

    /** Same as {@link #status()} for callers that already generated the legal moves. */
    public GameStatus status(List<Move> legalMoves) {
        return status(!legalMoves.isEmpty());
    }

    private GameStatus status(boolean hasLegalMove) {
        if (!hasLegalMove) {
            return inCheck() ? GameStatus.WON : GameStatus.DRAWN;
        }
        // 50-moves rule
        if (halfMoveClock >= 100 || isInsufficientMaterial()) {
            return GameStatus.DRAWN;
        }
        return GameStatus.ONGOING;
    }

    public boolean isInsufficientMaterial() {
        int minors = 0;
        for (byte square : squares) {
            switch (PieceUtils.toPieceCode(square)) {
                case PieceUtils.PAWN, PieceUtils.ROOK, PieceUtils.QUEEN -> { return false; }
                case PieceUtils.KNIGHT, PieceUtils.BISHOP -> minors++;
                default -> { }
            }
        }
        return minors <= 1;
    }

    private boolean hasAdjacentEnemyPawn(byte[] board, int pawnIndex) {
        byte enemyPawn = PieceUtils.encode(PieceUtils.PAWN, ColorUtils.switchColor(currentPlayer));
        int file = pawnIndex & 7;
        return (file > 0 && board[pawnIndex - 1] == enemyPawn)
                || (file < 7 && board[pawnIndex + 1] == enemyPawn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position other)) return false;
        return zobristKey == other.zobristKey
                && currentPlayer == other.currentPlayer
                && castlingRights == other.castlingRights
                && enPassantIndex == other.enPassantIndex
                && Arrays.equals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(zobristKey);
    }

    @Override
    public String toString() {
        return FENUtils.getFENFromPosition(this);
    }
}
