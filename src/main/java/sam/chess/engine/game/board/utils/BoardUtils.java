package sam.chess.engine.game.board.utils;

import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.pieces.King;
import sam.chess.engine.movegen.pieces.Pawn;

public class BoardUtils {
    /**
     * Moves the piece on {@code from} to {@code to}, dragging the rook along for a castle and
     * lifting the bypassed pawn for an en passant capture. Promotion is left to the caller.
     * The move is assumed legal.
     *
     * @return the piece captured by the move, or null
     */
    public static Piece playMove(Board board, Square from, Square to, boolean castle, boolean enPassant) {
        Piece moving = board.getPieceAt(from);
        Piece captured;
        if(enPassant) {
            captured = board.remove(Pawn.getEnPassantCapturedSquare(moving.color(), to));
            board.relocate(from, to);
        } else {
            captured = board.relocate(from, to);
        }

        if(castle) {
            King.CastleRookMove rookMove = King.getCastleRookMove(from, to);
            board.relocate(rookMove.from(), rookMove.to());
        }
        return captured;
    }
}
