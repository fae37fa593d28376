package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;

public final class Pawn {
    private static final int[] CAPTURE_COLUMNS = {-1, 1};

    /**
     * Forward pushes onto empty squares (two from the home row when both are empty)
     * and diagonal captures onto enemy pieces. En passant is not a pseudo-legal move.
     */
    public static void addPseudoLegalMoves(Piece pawn, Board board, IntArrayList moves) {
        Color color = pawn.color();
        Square from = pawn.square();
        int direction = color.pawnDirection();

        Square oneStep = from.offset(direction, 0);
        if(oneStep != null && board.isEmpty(oneStep)) {
            moves.add(oneStep.index());
            if(from.row() == color.pawnHomeRow()) {
                Square twoSteps = from.offset(2 * direction, 0);
                if(twoSteps != null && board.isEmpty(twoSteps)) {
                    moves.add(twoSteps.index());
                }
            }
        }

        for(int colDelta : CAPTURE_COLUMNS) {
            Square target = from.offset(direction, colDelta);
            if(target == null) {
                continue;
            }
            Color targetColor = board.getColorAt(target);
            if(targetColor != null && targetColor != color) {
                moves.add(target.index());
            }
        }
    }

    /**
     * @return true when a pawn of {@code color} standing on {@code pawnSquare} attacks {@code target}
     */
    public static boolean attacks(Square pawnSquare, Color color, Square target) {
        return target.row() - pawnSquare.row() == color.pawnDirection()
                && Math.abs(target.col() - pawnSquare.col()) == 1;
    }

    /** Shape of an en passant capture: one step diagonally forward onto the current target square. */
    public static boolean isEnPassantCapture(Game game, Piece pawn, Square to) {
        if(pawn.type() != PieceType.PAWN) {
            return false;
        }
        Square enPassantTarget = game.getEnPassantTarget();
        return enPassantTarget != null
                && to == enPassantTarget
                && attacks(pawn.square(), pawn.color(), to)
                && game.getPieceAt(to) == null;
    }

    public static boolean isEnPassantLegal(Game game, Piece pawn, Square to) {
        if(!isEnPassantCapture(game, pawn, to)) {
            return false;
        }
        Square captured = getEnPassantCapturedSquare(pawn.color(), to);
        Piece bypassed = game.getPieceAt(captured);
        return bypassed != null && bypassed.is(PieceType.PAWN, pawn.color().getOppositeColor());
    }

    /** The square of the pawn taken en passant: same rank as the capturing pawn, file of the target. */
    public static Square getEnPassantCapturedSquare(Color mover, Square to) {
        return Square.of(to.row() - mover.pawnDirection(), to.col());
    }

    public static boolean isDoubleStep(Piece pawn, Square from, Square to) {
        return pawn.type() == PieceType.PAWN && Math.abs(to.row() - from.row()) == 2;
    }

    public static boolean isPromotion(Piece pawn, Square to) {
        return pawn.type() == PieceType.PAWN && to.row() == pawn.color().promotionRow();
    }

    private Pawn() {}
}
