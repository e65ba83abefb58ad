package soup.tadpole.engine.utils.notations;

import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.movegen.Move;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.List;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {

    private FENUtils() {}

    /**
     * Parses a FEN record. The two clock fields may be omitted, as some GUIs do.
     *
     * @throws IllegalArgumentException on a malformed record
     */
    public static Position getPositionFrom(String fen) {
        String[] fenFields = fen.trim().split("\\s+");
        if (fenFields.length != 6 && fenFields.length != 4) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        byte[] squares = readPiecePlacement(fenFields[0]);
        int currentPlayer = readCurrentTurn(fenFields[1]);
        int castlingRights = readCastlingRights(fenFields[2]);
        int enPassantIndex = "-".equals(fenFields[3]) ? -1 : MoveIOUtils.getIndexFromSquare(fenFields[3]);
        int halfMoveClock = fenFields.length == 6 ? parseClock(fenFields[4]) : 0;
        int fullMoveClock = fenFields.length == 6 ? Math.max(1, parseClock(fenFields[5])) : 1;

        return Position.of(squares, currentPlayer, castlingRights, enPassantIndex, halfMoveClock, fullMoveClock);
    }

    /** Parses a FEN record and plays the given UCI moves on top of it. */
    public static Position getPositionFrom(String fen, List<String> uciMoves) {
        Position position = getPositionFrom(fen);
        for (String uciMove : uciMoves) {
            position = position.play(resolveMove(position, uciMove));
        }
        return position;
    }

    /**
     * Matches a UCI move against the legal moves of the position, so that a malformed or illegal move
     * coming from a GUI is rejected instead of corrupting the board.
     */
    public static Move resolveMove(Position position, String uciMove) {
        Move parsed = MoveIOUtils.readAlgebraicNotation(uciMove);
        for (Move legal : position.getLegalMoves()) {
            if (legal.equals(parsed)) {
                return legal;
            }
        }
        throw new IllegalArgumentException("Illegal move " + uciMove + " in " + getFENFromPosition(position));
    }

    public static String getFENFromPosition(Position position) {
        StringBuilder fen = new StringBuilder();
        writePiecePlacement(position, fen);
        fen.append(' ').append(ColorUtils.isBlack(position.currentPlayer) ? 'b' : 'w');
        fen.append(' ');
        writeCastlingRights(position, fen);
        fen.append(' ');
        if (position.enPassantIndex != -1) {
            fen.append(MoveIOUtils.getSquareFromIndex(position.enPassantIndex));
        } else {
            fen.append('-');
        }
        fen.append(' ').append(position.halfMoveClock);
        fen.append(' ').append(position.fullMoveClock);
        return fen.toString();
    }

    private static void writePiecePlacement(Position position, StringBuilder fen) {
        for (int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if (rank != 7) {
                fen.append('/');
            }
            for (int file = 0; file < 8; file++) {
                byte square = position.squareAt(rank * 8 + file);
                if (PieceUtils.isEmpty(square)) {
                    emptySpaceCounter++;
                    continue;
                }
                if (emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                char letter = PieceUtils.toLetter(PieceUtils.toPieceCode(square));
                fen.append(ColorUtils.isWhite(PieceUtils.toColor(square)) ? Character.toUpperCase(letter) : letter);
            }
            if (emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void writeCastlingRights(Position position, StringBuilder fen) {
        StringBuilder castlingRights = new StringBuilder();
        if (position.canCastle(Position.WHITE_KING_SIDE)) castlingRights.append('K');
        if (position.canCastle(Position.WHITE_QUEEN_SIDE)) castlingRights.append('Q');
        if (position.canCastle(Position.BLACK_KING_SIDE)) castlingRights.append('k');
        if (position.canCastle(Position.BLACK_QUEEN_SIDE)) castlingRights.append('q');
        if (castlingRights.length() == 0) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static byte[] readPiecePlacement(String piecePlacement) {
        String[] rows = piecePlacement.split("/");
        if (rows.length != 8) {
            throw new IllegalArgumentException("Piece placement needs 8 ranks: " + piecePlacement);
        }
        byte[] squares = new byte[64];
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char character : rows[i].toCharArray()) {
                if (character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if (file > 7) {
                    throw new IllegalArgumentException("Rank overflow in " + piecePlacement);
                }
                int color = Character.isUpperCase(character) ? ColorUtils.WHITE : ColorUtils.BLACK;
                squares[rank * 8 + file] = PieceUtils.encode(PieceUtils.fromLetter(character), color);
                file++;
            }
            if (file != 8) {
                throw new IllegalArgumentException("Rank " + (rank + 1) + " does not have 8 files: " + piecePlacement);
            }
        }
        return squares;
    }

    private static int readCurrentTurn(String currentTurn) {
        return switch (currentTurn) {
            case "w" -> ColorUtils.WHITE;
            case "b" -> ColorUtils.BLACK;
            default -> throw new IllegalArgumentException("Unexpected side to move " + currentTurn);
        };
    }

    private static int readCastlingRights(String castlingRights) {
        int rights = 0;
        for (char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> rights |= Position.WHITE_KING_SIDE;
                case 'Q' -> rights |= Position.WHITE_QUEEN_SIDE;
                case 'k' -> rights |= Position.BLACK_KING_SIDE;
                case 'q' -> rights |= Position.BLACK_QUEEN_SIDE;
                case '-' -> { }
                default -> throw new IllegalArgumentException("Unexpected castling letter " + character);
            }
        }
        return rights;
    }

    private static int parseClock(String clock) {
        try {
            return Integer.parseInt(clock);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid clock " + clock, e);
        }
    }
}
