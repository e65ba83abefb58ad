package soup.tadpole.engine.utils;

public final class PieceUtils {
    // 4th bit is the color, set for black pieces
    private static final byte COLOR_MASK = 0b0001000;
    private static final byte PIECE_TYPE_MASK = 0b0000111;

    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte KNIGHT = 2;
    public static final byte BISHOP = 3;
    public static final byte ROOK = 4;
    public static final byte QUEEN = 5;
    public static final byte KING = 6;

    private PieceUtils() {}

    public static byte toPieceCode(int square) { return (byte) (square & PIECE_TYPE_MASK); }

    public static int toColor(int square) {
        return (square & COLOR_MASK) != 0 ? ColorUtils.BLACK : ColorUtils.WHITE;
    }

    public static boolean isEmpty(int square) {
        return square == NONE;
    }

    public static boolean isOwnedBy(int square, int color) {
        return square != NONE && toColor(square) == color;
    }

    public static byte encode(byte piece, int color) {
        return (byte) (ColorUtils.isBlack(color) ? (piece | COLOR_MASK) : piece);
    }

    public static char toLetter(byte piece) {
        return switch (piece) {
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case ROOK -> 'r';
            case QUEEN -> 'q';
            case KING -> 'k';
            default -> throw new IllegalArgumentException("No letter for piece code " + piece);
        };
    }

    public static byte fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
