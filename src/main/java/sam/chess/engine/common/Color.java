package sam.chess.engine.common;

public enum Color {
    WHITE('w'), BLACK('b');

    private final char fenLetter;

    Color(char fenLetter) {
        this.fenLetter = fenLetter;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    // Rows grow towards rank 1, so white pawns walk up the board with a negative step
    public int pawnDirection() {
        return this == WHITE ? -1 : 1;
    }

    public int pawnHomeRow() {
        return this == WHITE ? 6 : 1;
    }

    public int promotionRow() {
        return this == WHITE ? 0 : 7;
    }

    public int backRow() {
        return this == WHITE ? 7 : 0;
    }

    public char fenLetter() {
        return fenLetter;
    }

    public static Color fromFenLetter(char letter) {
        return switch (letter) {
            case 'w' -> WHITE;
            case 'b' -> BLACK;
            default -> throw new IllegalArgumentException("Unknown side to move " + letter);
        };
    }
}
