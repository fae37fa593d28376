package sam.chess.engine.game.board;

import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;

/**
 * 8x8 grid of pieces, indexed by {@link Square#index()}.
 * A piece always stores the square of the cell holding it.
 */
public class Board {
    private final Piece[] pieceAt;

    public Board() {
        this.pieceAt = new Piece[64];
    }

    private Board(Board other) {
        // Pieces are immutable, cloning the cells is enough for independence
        this.pieceAt = other.pieceAt.clone();
    }

    public Board copy() {
        return new Board(this);
    }

    public Piece getPieceAt(Square square) {
        return pieceAt[square.index()];
    }

    public Piece getPieceAt(int row, int col) {
        return pieceAt[row * 8 + col];
    }

    public boolean isEmpty(Square square) {
        return pieceAt[square.index()] == null;
    }

    public Color getColorAt(Square square) {
        Piece piece = pieceAt[square.index()];
        return piece == null ? null : piece.color();
    }

    /**
     * Places a piece on its own square, replacing whatever stood there.
     * @throws IllegalStateException when it would put a second king of one color on the board
     */
    public void put(Piece piece) {
        if(piece.type() == PieceType.KING) {
            Square existingKing = findKing(piece.color());
            if(existingKing != null && existingKing != piece.square()) {
                throw new IllegalStateException("A " + piece.color() + " king already stands on " + existingKing);
            }
        }
        pieceAt[piece.square().index()] = piece;
    }

    public Piece remove(Square square) {
        Piece removed = pieceAt[square.index()];
        pieceAt[square.index()] = null;
        return removed;
    }

    /**
     * Moves whatever stands on {@code from} onto {@code to}, dropping any piece on {@code to}.
     * @return the piece that was on {@code to}, or null
     */
    public Piece relocate(Square from, Square to) {
        Piece moving = pieceAt[from.index()];
        Piece taken = pieceAt[to.index()];
        pieceAt[from.index()] = null;
        pieceAt[to.index()] = moving == null ? null : moving.moveTo(to);
        return taken;
    }

    public Square findKing(Color color) {
        for(Piece piece : pieceAt) {
            if(piece != null && piece.is(PieceType.KING, color)) {
                return piece.square();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for(int row = 0; row < 8; row++) {
            sb.append(8 - row).append("  ");
            for(int col = 0; col < 8; col++) {
                Piece piece = getPieceAt(row, col);
                sb.append(piece == null ? '.' : piece.symbol()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
