package sam.chess.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.movegen.pieces.Bishop;
import sam.chess.engine.movegen.pieces.King;
import sam.chess.engine.movegen.pieces.Knight;
import sam.chess.engine.movegen.pieces.Pawn;
import sam.chess.engine.movegen.pieces.Queen;
import sam.chess.engine.movegen.pieces.Rook;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class MoveGenerator {
    // Upper bound for a queen in the middle of an empty board
    private static final int MAX_PIECE_MOVES = 27;

    /**
     * Squares the piece could move to by its movement pattern alone, as square indices.
     * Nothing here looks at the safety of its own king.
     */
    public static IntArrayList getPseudoLegalMoves(Piece piece, Board board) {
        IntArrayList moves = new IntArrayList(MAX_PIECE_MOVES);
        switch (piece.type()) {
            case PAWN -> Pawn.addPseudoLegalMoves(piece, board, moves);
            case KNIGHT -> Knight.addPseudoLegalMoves(piece, board, moves);
            case BISHOP -> Bishop.addPseudoLegalMoves(piece, board, moves);
            case ROOK -> Rook.addPseudoLegalMoves(piece, board, moves);
            case QUEEN -> Queen.addPseudoLegalMoves(piece, board, moves);
            case KING -> King.addPseudoLegalMoves(piece, board, moves);
        }
        return moves;
    }

    /**
     * Every (from, to) pair of {@code color} accepted by {@link MoveValidator#isLegalMove}, scanning
     * origins then destinations from a8 to h1. Empty for the side not to move and once the game is over.
     */
    public static List<Move> getAllLegalMoves(Game game, Color color) {
        ObjectArrayList<Move> moves = new ObjectArrayList<>();
        if(color != game.getCurrentPlayer() || game.getStatus().isTerminal()) {
            return moves;
        }
        Board board = game.board();
        for(int fromIndex = 0; fromIndex < 64; fromIndex++) {
            Square from = Square.of(fromIndex);
            if(board.getColorAt(from) != color) {
                continue;
            }
            for(int toIndex = 0; toIndex < 64; toIndex++) {
                Square to = Square.of(toIndex);
                if(MoveValidator.isLegalMove(game, from, to)) {
                    moves.add(new Move(from, to));
                }
            }
        }
        return moves;
    }

    public static boolean hasLegalMove(Game game, Color color) {
        if(color != game.getCurrentPlayer() || game.getStatus().isTerminal()) {
            return false;
        }
        Board board = game.board();
        for(int fromIndex = 0; fromIndex < 64; fromIndex++) {
            Square from = Square.of(fromIndex);
            if(board.getColorAt(from) != color) {
                continue;
            }
            for(int toIndex = 0; toIndex < 64; toIndex++) {
                if(MoveValidator.isLegalMove(game, from, Square.of(toIndex))) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Legal targets of the piece on {@code from}, derived from the full legal move list. */
    public static Set<Square> getLegalDestinations(Game game, Square from) {
        Set<Square> destinations = new LinkedHashSet<>();
        Piece piece = game.getPieceAt(from);
        if(piece == null) {
            return destinations;
        }
        for(Move move : getAllLegalMoves(game, piece.color())) {
            if(move.from() == from) {
                destinations.add(move.to());
            }
        }
        return destinations;
    }

    private MoveGenerator() {}
}
