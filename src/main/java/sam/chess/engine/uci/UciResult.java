package sam.chess.engine.uci;

/** Answer to "go": a move in coordinate notation, or the null move when there is nothing to play. */
public record UciResult(String bestMove) {
    public static final String NULL_MOVE = "0000";

    public static UciResult best(String move) {
        return new UciResult(move);
    }

    public static UciResult none() {
        return new UciResult(NULL_MOVE);
    }

    public boolean hasMove() {
        return bestMove != null && !bestMove.isEmpty() && !NULL_MOVE.equals(bestMove);
    }
}
