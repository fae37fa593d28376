package sam.chess.engine.search.evaluator;

import sam.chess.engine.common.PieceType;

public class PieceValues {
    public static final int PAWN_VALUE = 1;
    public static final int KNIGHT_VALUE = 3;
    public static final int BISHOP_VALUE = 3;
    public static final int ROOK_VALUE = 5;
    public static final int QUEEN_VALUE = 9;
    // Never counted, losing it ends the game
    public static final int KING_VALUE = 0;

    public static int pieceTypeToValue(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN -> PAWN_VALUE;
            case KNIGHT -> KNIGHT_VALUE;
            case BISHOP -> BISHOP_VALUE;
            case ROOK -> ROOK_VALUE;
            case QUEEN -> QUEEN_VALUE;
            case KING -> KING_VALUE;
        };
    }
}
