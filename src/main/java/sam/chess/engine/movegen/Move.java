package sam.chess.engine.movegen;

import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.utils.notations.MoveIOUtils;

import java.util.Objects;

/**
 * A from-to pair, optionally carrying the piece kind a pawn should promote to.
 * Legal move lists never set the promotion, pawns reaching the last rank default to a queen.
 */
public record Move(Square from, Square to, PieceType promotion) {
    public Move {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
    }

    public Move(Square from, Square to) {
        this(from, to, null);
    }

    public static Move fromAlgebraicNotation(String notation) {
        return MoveIOUtils.readAlgebraicNotation(notation);
    }

    public Move withoutPromotion() {
        return promotion == null ? this : new Move(from, to);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
