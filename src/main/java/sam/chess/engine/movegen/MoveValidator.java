package sam.chess.engine.movegen;

import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.game.board.utils.BoardUtils;
import sam.chess.engine.movegen.pieces.King;
import sam.chess.engine.movegen.pieces.Pawn;
import sam.chess.engine.movegen.utils.CheckUtils;

public final class MoveValidator {

    public static boolean isLegalMove(Game game, Square from, Square to) {
        return validate(game, from, to) == MoveLegality.LEGAL;
    }

    /**
     * Ownership checks first, then the movement pattern, then castling and en passant.
     * A rule-legal move is finally played on a copy of the board, and refused if it leaves
     * the mover's king attacked. The live board is never touched.
     */
    public static MoveLegality validate(Game game, Square from, Square to) {
        Board board = game.board();
        Piece piece = board.getPieceAt(from);
        if(piece == null) {
            return MoveLegality.NO_PIECE;
        }
        Color mover = piece.color();
        if(mover != game.getCurrentPlayer()) {
            return MoveLegality.NOT_YOUR_TURN;
        }
        if(board.getColorAt(to) == mover) {
            return MoveLegality.OWN_PIECE_ON_TARGET;
        }

        boolean castle = false;
        boolean enPassant = false;
        boolean ruleLegal = MoveGenerator.getPseudoLegalMoves(piece, board).contains(to.index());
        if(!ruleLegal && piece.type() == PieceType.KING) {
            castle = King.isCastleLegal(game, piece, to);
            ruleLegal = castle;
        }
        if(!ruleLegal && piece.type() == PieceType.PAWN) {
            enPassant = Pawn.isEnPassantLegal(game, piece, to);
            ruleLegal = enPassant;
        }
        if(!ruleLegal) {
            return MoveLegality.NOT_REACHABLE;
        }

        Board simulated = board.copy();
        BoardUtils.playMove(simulated, from, to, castle, enPassant);
        if(CheckUtils.isInCheck(simulated, mover)) {
            return MoveLegality.LEAVES_KING_IN_CHECK;
        }
        return MoveLegality.LEGAL;
    }

    private MoveValidator() {}
}
