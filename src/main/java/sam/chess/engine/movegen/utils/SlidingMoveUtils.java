package sam.chess.engine.movegen.utils;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;

public final class SlidingMoveUtils {
    // {rowDelta, colDelta}
    public static final int[][] ORTHOGONAL_DIRECTIONS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    public static final int[][] DIAGONAL_DIRECTIONS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    public static final int[][] ALL_DIRECTIONS = {
            {-1, 0}, {1, 0}, {0, -1}, {0, 1},
            {-1, -1}, {-1, 1}, {1, -1}, {1, 1}
    };

    public static boolean isOrthogonal(int[] direction) {
        return direction[0] == 0 || direction[1] == 0;
    }

    /**
     * Casts a ray per direction. A ray stops at the board edge, includes the first enemy piece met
     * and excludes the first friendly one.
     */
    public static void addRayMoves(Piece piece, Board board, int[][] directions, IntArrayList moves) {
        Square from = piece.square();
        for(int[] direction : directions) {
            Square current = from.offset(direction[0], direction[1]);
            while(current != null) {
                Piece blocker = board.getPieceAt(current);
                if(blocker == null) {
                    moves.add(current.index());
                } else {
                    if(blocker.color() != piece.color()) {
                        moves.add(current.index());
                    }
                    break;
                }
                current = current.offset(direction[0], direction[1]);
            }
        }
    }

    /**
     * @return the first piece met from {@code from} along the direction, or null if the ray is empty
     */
    public static Piece firstPieceAlong(Board board, Square from, int[] direction) {
        Square current = from.offset(direction[0], direction[1]);
        while(current != null) {
            Piece piece = board.getPieceAt(current);
            if(piece != null) {
                return piece;
            }
            current = current.offset(direction[0], direction[1]);
        }
        return null;
    }

    /** True when every square strictly between the two squares of one row is empty. */
    public static boolean isRowPathClear(Board board, Square from, Square to) {
        int step = Integer.signum(to.col() - from.col());
        for(int col = from.col() + step; col != to.col(); col += step) {
            if(board.getPieceAt(from.row(), col) != null) {
                return false;
            }
        }
        return true;
    }

    private SlidingMoveUtils() {}
}
