package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.utils.SlidingMoveUtils;

public final class Rook {
    public static void addPseudoLegalMoves(Piece rook, Board board, IntArrayList moves) {
        SlidingMoveUtils.addRayMoves(rook, board, SlidingMoveUtils.ORTHOGONAL_DIRECTIONS, moves);
    }

    private Rook() {}
}
