package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.utils.CheckUtils;
import sam.chess.engine.movegen.utils.SlidingMoveUtils;

public final class King {
    public static final int HOME_COL = 4;
    public static final int KING_SIDE_ROOK_COL = 7;
    public static final int QUEEN_SIDE_ROOK_COL = 0;

    // {rowDelta, colDelta}
    public static final int[][] KING_OFFSETS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1}, {0, 1},
            {1, -1}, {1, 0}, {1, 1}
    };

    /** Rook relocation that goes with a castling king move. */
    public record CastleRookMove(Square from, Square to) {}

    /** Adjacent squares only, castling is validated separately. */
    public static void addPseudoLegalMoves(Piece king, Board board, IntArrayList moves) {
        Knight.addStepMoves(king, board, KING_OFFSETS, moves);
    }

    /** Shape of a castle: the king leaves its home square for a square two files away on its back row. */
    public static boolean isCastleMove(Piece king, Square to) {
        Square from = king.square();
        return king.type() == PieceType.KING
                && from.row() == king.color().backRow()
                && from.col() == HOME_COL
                && to.row() == from.row()
                && Math.abs(to.col() - from.col()) == 2;
    }

    public static boolean isCastleKingSide(Square kingTo) {
        return kingTo.col() > HOME_COL;
    }

    public static CastleRookMove getCastleRookMove(Square kingFrom, Square kingTo) {
        int row = kingFrom.row();
        if(isCastleKingSide(kingTo)) {
            return new CastleRookMove(Square.of(row, KING_SIDE_ROOK_COL), Square.of(row, HOME_COL + 1));
        }
        return new CastleRookMove(Square.of(row, QUEEN_SIDE_ROOK_COL), Square.of(row, HOME_COL - 1));
    }

    /**
     * Castling needs the right for that side, the rook on its corner, nothing between king and rook,
     * and the king's start, transit and destination squares all free from enemy attack.
     */
    public static boolean isCastleLegal(Game game, Piece king, Square to) {
        if(!isCastleMove(king, to)) {
            return false;
        }
        Color color = king.color();
        boolean kingSide = isCastleKingSide(to);
        boolean hasRight = kingSide ? game.canCastleKingSide(color) : game.canCastleQueenSide(color);
        if(!hasRight) {
            return false;
        }

        Board board = game.board();
        Square from = king.square();
        CastleRookMove rookMove = getCastleRookMove(from, to);
        Piece rook = board.getPieceAt(rookMove.from());
        if(rook == null || !rook.is(PieceType.ROOK, color)) {
            return false;
        }
        if(!SlidingMoveUtils.isRowPathClear(board, from, rookMove.from())) {
            return false;
        }

        Color opponent = color.getOppositeColor();
        int step = kingSide ? 1 : -1;
        for(int col = from.col(); col != to.col() + step; col += step) {
            if(CheckUtils.isSquareAttacked(board, Square.of(from.row(), col), opponent)) {
                return false;
            }
        }
        return true;
    }

    private King() {}
}
