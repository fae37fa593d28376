package sam.chess.engine.game;

import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Piece;

/** History entry, kept for display. {@code piece} is the mover as it stood before the move. */
public record MovePlayed(Square from, Square to, Piece piece) {
    @Override
    public String toString() {
        return piece.symbol() + " " + from + "-" + to;
    }
}
