package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.utils.SlidingMoveUtils;

public final class Queen {
    public static void addPseudoLegalMoves(Piece queen, Board board, IntArrayList moves) {
        SlidingMoveUtils.addRayMoves(queen, board, SlidingMoveUtils.ALL_DIRECTIONS, moves);
    }

    private Queen() {}
}
