package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.utils.SlidingMoveUtils;

public final class Bishop {
    public static void addPseudoLegalMoves(Piece bishop, Board board, IntArrayList moves) {
        SlidingMoveUtils.addRayMoves(bishop, board, SlidingMoveUtils.DIAGONAL_DIRECTIONS, moves);
    }

    private Bishop() {}
}
