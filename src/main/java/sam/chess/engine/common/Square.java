package sam.chess.engine.common;

/**
 * A board coordinate. Row 0 is rank 8 and column 0 is file a, so "a8" is (0,0) and "h1" is (7,7).
 * Instances are cached, there are exactly 64 of them.
 */
public final class Square {
    private static final String FILES = "abcdefgh";
    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int row = 0; row < 8; row++) {
            for(int col = 0; col < 8; col++) {
                SQUARE_CACHE[row * 8 + col] = new Square(row, col);
            }
        }
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < 8 && col >= 0 && col < 8;
    }

    public static Square of(int row, int col) {
        if(!isOnBoard(row, col)) {
            throw new IllegalArgumentException("Square out of the board: (" + row + "," + col + ")");
        }
        return SQUARE_CACHE[row * 8 + col];
    }

    public static Square of(int index) {
        if(index < 0 || index >= 64) {
            throw new IllegalArgumentException("Square index out of the board: " + index);
        }
        return SQUARE_CACHE[index];
    }

    public static SquareResult fromCoordinates(int row, int col) {
        if(!isOnBoard(row, col)) {
            return new SquareResult.Invalid("(" + row + "," + col + ")", "square coordinates out of bounds");
        }
        return new SquareResult.Valid(SQUARE_CACHE[row * 8 + col]);
    }

    public static SquareResult parse(String name) {
        if(name == null || name.length() != 2) {
            return new SquareResult.Invalid(name, "square should be format 'a1'");
        }
        int col = FILES.indexOf(name.charAt(0));
        if(col < 0) {
            return new SquareResult.Invalid(name, "square letter should be in [a-h]");
        }
        char rankChar = name.charAt(1);
        if(rankChar < '1' || rankChar > '8') {
            return new SquareResult.Invalid(name, "square digit should be in [1-8]");
        }
        return new SquareResult.Valid(SQUARE_CACHE[('8' - rankChar) * 8 + col]);
    }

    private final int row;
    private final int col;
    private final String name;

    private Square(int row, int col) {
        this.row = row;
        this.col = col;
        this.name = String.valueOf(FILES.charAt(col)) + (8 - row);
    }

    public int row() {
        return row;
    }

    public int col() {
        return col;
    }

    public int index() {
        return row * 8 + col;
    }

    public String name() {
        return name;
    }

    /**
     * @return the square shifted by the given offsets, or null if that falls off the board
     */
    public Square offset(int rowDelta, int colDelta) {
        int newRow = row + rowDelta;
        int newCol = col + colDelta;
        return isOnBoard(newRow, newCol) ? SQUARE_CACHE[newRow * 8 + newCol] : null;
    }

    @Override
    public String toString() {
        return name;
    }
}
