package sam.chess.engine.game.board;

import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;

import java.util.Objects;

public record Piece(PieceType type, Color color, Square square) {
    public Piece {
        Objects.requireNonNull(type);
        Objects.requireNonNull(color);
        Objects.requireNonNull(square);
    }

    public Piece moveTo(Square target) {
        return new Piece(type, color, target);
    }

    public Piece promoteTo(PieceType promotion) {
        return new Piece(promotion, color, square);
    }

    public boolean is(PieceType pieceType, Color pieceColor) {
        return type == pieceType && color == pieceColor;
    }

    /** FEN letter, uppercase for white. */
    public char symbol() {
        return type.letter(color);
    }

    @Override
    public String toString() {
        return symbol() + "@" + square;
    }
}
