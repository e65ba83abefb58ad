package soup.tadpole.engine.movegen;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.PieceUtils;

import java.util.List;

/**
 * Legal move generation on {@link Position}. Stateless: every call works on its own buffers so the
 * generator can be used from several search threads at once.
 * <p>
 * Moves are generated pseudo-legally square by square (a1 to h8), then filtered by simulating each
 * move on a scratch board and checking that the mover's king is not attacked.
 */
public final class MoveGenerator {
    // According to literature, no position has more than 218 legal moves
    private static final int MAX_LEGAL_MOVES = 218;

    private static final int[][] KNIGHT_DELTAS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_DELTAS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] ORTHOGONAL = {{1, 0}, {0, 1}, {-1, 0}, {0, -1}};
    private static final int[][] DIAGONAL = {{1, 1}, {-1, 1}, {-1, -1}, {1, -1}};
    private static final byte[] PROMOTIONS = {PieceUtils.QUEEN, PieceUtils.ROOK, PieceUtils.BISHOP, PieceUtils.KNIGHT};

    private MoveGenerator() {}

    public static List<Move> generateLegalMoves(Position position) {
        ObjectArrayList<Move> pseudoLegal = new ObjectArrayList<>(MAX_LEGAL_MOVES);
        generatePseudoLegalMoves(position, pseudoLegal);

        ObjectArrayList<Move> legal = new ObjectArrayList<>(pseudoLegal.size());
        byte[] board = position.squares();
        byte[] scratch = new byte[64];
        for (Move move : pseudoLegal) {
            if (isLegal(position, board, scratch, move)) {
                legal.add(move);
            }
        }
        return legal;
    }

    // Useful for mobility and perft leaf counts
    public static int countLegalMoves(Position position) {
        return generateLegalMoves(position).size();
    }

    public static boolean hasLegalMove(Position position) {
        ObjectArrayList<Move> pseudoLegal = new ObjectArrayList<>(MAX_LEGAL_MOVES);
        generatePseudoLegalMoves(position, pseudoLegal);
        byte[] board = position.squares();
        byte[] scratch = new byte[64];
        for (Move move : pseudoLegal) {
            if (isLegal(position, board, scratch, move)) {
                return true;
            }
        }
        return false;
    }

    /** Whether any piece of {@code byColor} attacks {@code index} on the given board. */
    public static boolean isSquareAttacked(byte[] board, int index, int byColor) {
        final int file = index & 7;
        final int rank = index >>> 3;

        // Pawns attack diagonally forward, so look one rank behind the target from their point of view
        final int pawnRank = ColorUtils.isWhite(byColor) ? rank - 1 : rank + 1;
        final byte pawn = PieceUtils.encode(PieceUtils.PAWN, byColor);
        if (pawnRank >= 0 && pawnRank < 8) {
            if (file > 0 && board[pawnRank * 8 + file - 1] == pawn) return true;
            if (file < 7 && board[pawnRank * 8 + file + 1] == pawn) return true;
        }

        if (attackedByStepper(board, file, rank, KNIGHT_DELTAS, PieceUtils.encode(PieceUtils.KNIGHT, byColor))) return true;
        if (attackedByStepper(board, file, rank, KING_DELTAS, PieceUtils.encode(PieceUtils.KING, byColor))) return true;

        final byte queen = PieceUtils.encode(PieceUtils.QUEEN, byColor);
        if (attackedBySlider(board, file, rank, ORTHOGONAL, PieceUtils.encode(PieceUtils.ROOK, byColor), queen)) return true;
        return attackedBySlider(board, file, rank, DIAGONAL, PieceUtils.encode(PieceUtils.BISHOP, byColor), queen);
    }

    private static boolean attackedByStepper(byte[] board, int file, int rank, int[][] deltas, byte attacker) {
        for (int[] d : deltas) {
            int f = file + d[0], r = rank + d[1];
            if (f >= 0 && f < 8 && r >= 0 && r < 8 && board[r * 8 + f] == attacker) return true;
        }
        return false;
    }

    private static boolean attackedBySlider(byte[] board, int file, int rank, int[][] directions, byte slider, byte queen) {
        for (int[] d : directions) {
            int f = file + d[0], r = rank + d[1];
            while (f >= 0 && f < 8 && r >= 0 && r < 8) {
                byte square = board[r * 8 + f];
                if (square != PieceUtils.NONE) {
                    if (square == slider || square == queen) return true;
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
        return false;
    }

    private static void generatePseudoLegalMoves(Position position, List<Move> out) {
        final int side = position.currentPlayer;
        for (int from = 0; from < 64; from++) {
            byte square = position.squareAt(from);
            if (!PieceUtils.isOwnedBy(square, side)) continue;
            switch (PieceUtils.toPieceCode(square)) {
                case PieceUtils.PAWN -> generatePawnMoves(position, from, side, out);
                case PieceUtils.KNIGHT -> generateStepperMoves(position, from, side, KNIGHT_DELTAS, out);
                case PieceUtils.BISHOP -> generateSliderMoves(position, from, side, DIAGONAL, out);
                case PieceUtils.ROOK -> generateSliderMoves(position, from, side, ORTHOGONAL, out);
                case PieceUtils.QUEEN -> {
                    generateSliderMoves(position, from, side, ORTHOGONAL, out);
                    generateSliderMoves(position, from, side, DIAGONAL, out);
                }
                case PieceUtils.KING -> {
                    generateStepperMoves(position, from, side, KING_DELTAS, out);
                    generateCastlingMoves(position, from, side, out);
                }
                default -> throw new IllegalStateException("Unexpected piece on square " + from);
            }
        }
    }

    private static void generatePawnMoves(Position position, int from, int side, List<Move> out) {
        final boolean white = ColorUtils.isWhite(side);
        final int forward = white ? 8 : -8;
        final int startRank = white ? 1 : 6;
        final int lastRank = white ? 7 : 0;
        final int file = from & 7;

        int oneStep = from + forward;
        if (oneStep < 0 || oneStep > 63) return;
        if (position.squareAt(oneStep) == PieceUtils.NONE) {
            addPawnMove(from, oneStep, lastRank, out);
            int twoSteps = oneStep + forward;
            if ((from >>> 3) == startRank && position.squareAt(twoSteps) == PieceUtils.NONE) {
                out.add(new Move(from, twoSteps));
            }
        }
        for (int df = -1; df <= 1; df += 2) {
            int targetFile = file + df;
            if (targetFile < 0 || targetFile > 7) continue;
            int to = oneStep + df;
            byte target = position.squareAt(to);
            if (PieceUtils.isOwnedBy(target, ColorUtils.switchColor(side)) || to == position.enPassantIndex) {
                addPawnMove(from, to, lastRank, out);
            }
        }
    }

    private static void addPawnMove(int from, int to, int lastRank, List<Move> out) {
        if ((to >>> 3) == lastRank) {
            for (byte promotion : PROMOTIONS) {
                out.add(Move.promote(from, to, promotion));
            }
        } else {
            out.add(new Move(from, to));
        }
    }

    private static void generateStepperMoves(Position position, int from, int side, int[][] deltas, List<Move> out) {
        final int file = from & 7, rank = from >>> 3;
        for (int[] d : deltas) {
            int f = file + d[0], r = rank + d[1];
            if (f < 0 || f > 7 || r < 0 || r > 7) continue;
            int to = r * 8 + f;
            if (!PieceUtils.isOwnedBy(position.squareAt(to), side)) {
                out.add(new Move(from, to));
            }
        }
    }

    private static void generateSliderMoves(Position position, int from, int side, int[][] directions, List<Move> out) {
        final int file = from & 7, rank = from >>> 3;
        for (int[] d : directions) {
            int f = file + d[0], r = rank + d[1];
            while (f >= 0 && f < 8 && r >= 0 && r < 8) {
                int to = r * 8 + f;
                byte target = position.squareAt(to);
                if (target == PieceUtils.NONE) {
                    out.add(new Move(from, to));
                } else {
                    if (!PieceUtils.isOwnedBy(target, side)) out.add(new Move(from, to));
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
    }

    private static void generateCastlingMoves(Position position, int from, int side, List<Move> out) {
        final boolean white = ColorUtils.isWhite(side);
        final int home = white ? 4 : 60;
        if (from != home) return;
        final int kingSide = white ? Position.WHITE_KING_SIDE : Position.BLACK_KING_SIDE;
        final int queenSide = white ? Position.WHITE_QUEEN_SIDE : Position.BLACK_QUEEN_SIDE;
        final byte rook = PieceUtils.encode(PieceUtils.ROOK, side);
        final int enemy = ColorUtils.switchColor(side);
        final byte[] board = position.squares();

        if (position.canCastle(kingSide)
                && board[home + 3] == rook
                && board[home + 1] == PieceUtils.NONE && board[home + 2] == PieceUtils.NONE
                && !isSquareAttacked(board, home, enemy)
                && !isSquareAttacked(board, home + 1, enemy)
                && !isSquareAttacked(board, home + 2, enemy)) {
            out.add(new Move(home, home + 2));
        }
        if (position.canCastle(queenSide)
                && board[home - 4] == rook
                && board[home - 1] == PieceUtils.NONE && board[home - 2] == PieceUtils.NONE
                && board[home - 3] == PieceUtils.NONE
                && !isSquareAttacked(board, home, enemy)
                && !isSquareAttacked(board, home - 1, enemy)
                && !isSquareAttacked(board, home - 2, enemy)) {
            out.add(new Move(home, home - 2));
        }
    }

    private static boolean isLegal(Position position, byte[] board, byte[] scratch, Move move) {
        final int side = position.currentPlayer;
        final int from = move.startPosition();
        final int to = move.endPosition();
        System.arraycopy(board, 0, scratch, 0, 64);

        final byte moving = scratch[from];
        final byte piece = PieceUtils.toPieceCode(moving);
        if (piece == PieceUtils.PAWN && to == position.enPassantIndex && (from & 7) != (to & 7)) {
            scratch[ColorUtils.isWhite(side) ? to - 8 : to + 8] = PieceUtils.NONE;
        }
        scratch[to] = moving;
        scratch[from] = PieceUtils.NONE;

        int kingIndex = piece == PieceUtils.KING ? to : position.kingIndex(side);
        return !isSquareAttacked(scratch, kingIndex, ColorUtils.switchColor(side));
    }
}
