package sam.chess.engine.movegen.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.pieces.King;
import sam.chess.engine.movegen.pieces.Knight;

public final class CheckUtils {
    private static final Logger log = LoggerFactory.getLogger(CheckUtils.class);

    /**
     * Looks outwards from the square: knight jumps, pawn diagonals, adjacent king, then the first
     * blocker on each ray, which attacks only if it slides along that ray's orientation.
     */
    public static boolean isSquareAttacked(Board board, Square square, Color byColor) {
        for(int[] offset : Knight.KNIGHT_OFFSETS) {
            if(isPieceAt(board, square.offset(offset[0], offset[1]), PieceType.KNIGHT, byColor)) {
                return true;
            }
        }

        // An attacking pawn sits one step behind the square, from its own point of view
        int pawnRow = -byColor.pawnDirection();
        if(isPieceAt(board, square.offset(pawnRow, -1), PieceType.PAWN, byColor)
                || isPieceAt(board, square.offset(pawnRow, 1), PieceType.PAWN, byColor)) {
            return true;
        }

        for(int[] offset : King.KING_OFFSETS) {
            if(isPieceAt(board, square.offset(offset[0], offset[1]), PieceType.KING, byColor)) {
                return true;
            }
        }

        for(int[] direction : SlidingMoveUtils.ALL_DIRECTIONS) {
            Piece blocker = SlidingMoveUtils.firstPieceAlong(board, square, direction);
            if(blocker == null || blocker.color() != byColor) {
                continue;
            }
            PieceType type = blocker.type();
            if(type == PieceType.QUEEN) {
                return true;
            }
            if(SlidingMoveUtils.isOrthogonal(direction) ? type == PieceType.ROOK : type == PieceType.BISHOP) {
                return true;
            }
        }
        return false;
    }

    /** A board without a king of that color counts as in check, which keeps corrupted states unplayable. */
    public static boolean isInCheck(Board board, Color color) {
        Square kingSquare = board.findKing(color);
        if(kingSquare == null) {
            log.debug("No {} king on the board, treating it as in check", color);
            return true;
        }
        return isSquareAttacked(board, kingSquare, color.getOppositeColor());
    }

    private static boolean isPieceAt(Board board, Square square, PieceType type, Color color) {
        if(square == null) {
            return false;
        }
        Piece piece = board.getPieceAt(square);
        return piece != null && piece.is(type, color);
    }

    private CheckUtils() {}
}
