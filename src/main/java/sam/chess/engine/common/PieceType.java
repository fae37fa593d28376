package sam.chess.engine.common;

public enum PieceType {
    PAWN('p'), KNIGHT('n'), BISHOP('b'), ROOK('r'), QUEEN('q'), KING('k');

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    /** Lowercase FEN letter of this kind. */
    public char letter() {
        return letter;
    }

    public char letter(Color color) {
        return color.isWhite() ? Character.toUpperCase(letter) : letter;
    }

    public boolean isPromotionTarget() {
        return this == QUEEN || this == ROOK || this == BISHOP || this == KNIGHT;
    }

    /**
     * @return the kind for a FEN letter in either case, or null when the letter names no piece
     */
    public static PieceType fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> null;
        };
    }
}
