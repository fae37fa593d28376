package sam.chess.engine.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;

public final class Knight {
    // {rowDelta, colDelta}
    public static final int[][] KNIGHT_OFFSETS = {
            {-2, -1}, {-2, 1}, {2, -1}, {2, 1},
            {-1, -2}, {-1, 2}, {1, -2}, {1, 2}
    };

    public static void addPseudoLegalMoves(Piece knight, Board board, IntArrayList moves) {
        addStepMoves(knight, board, KNIGHT_OFFSETS, moves);
    }

    // Shared with the king: a single step per offset, onto empty or enemy squares
    static void addStepMoves(Piece piece, Board board, int[][] offsets, IntArrayList moves) {
        Square from = piece.square();
        for(int[] offset : offsets) {
            Square target = from.offset(offset[0], offset[1]);
            if(target == null) {
                continue;
            }
            Color targetColor = board.getColorAt(target);
            if(targetColor != piece.color()) {
                moves.add(target.index());
            }
        }
    }

    private Knight() {}
}
