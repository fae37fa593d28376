package sam.chess.engine.utils.notations;

import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.common.SquareResult;
import sam.chess.engine.movegen.Move;

public class MoveIOUtils {
    /** "e2e4", with a lowercase promotion letter appended when one is set ("e7e8q"). */
    public static String writeAlgebraicNotation(Move move) {
        String notation = move.from().name() + move.to().name();
        if(move.promotion() != null) {
            notation += move.promotion().letter();
        }
        return notation;
    }

    /**
     * Reads "e2e4" or "e7e8q". The promotion letter may be in either case.
     * @throws IllegalArgumentException on anything else
     */
    public static Move readAlgebraicNotation(String notation) {
        if(notation == null || (notation.length() != 4 && notation.length() != 5)) {
            throw new IllegalArgumentException("Cannot parse algebraic notation " + notation);
        }
        Square from = readSquare(notation.substring(0, 2));
        Square to = readSquare(notation.substring(2, 4));
        if(notation.length() == 4) {
            return new Move(from, to);
        }
        PieceType promotion = PieceType.fromLetter(notation.charAt(4));
        if(promotion == null || !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("Unknown promotion letter " + notation.charAt(4));
        }
        return new Move(from, to, promotion);
    }

    private static Square readSquare(String name) {
        SquareResult result = Square.parse(name);
        if(result instanceof SquareResult.Invalid invalid) {
            throw new IllegalArgumentException("Invalid square '" + invalid.input() + "': " + invalid.reason());
        }
        return result.square();
    }
}
