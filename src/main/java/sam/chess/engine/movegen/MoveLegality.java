package sam.chess.engine.movegen;

/** Verdict of {@link MoveValidator#validate}, in the order the checks run. */
public enum MoveLegality {
    LEGAL("Legal move"),
    NO_PIECE("No piece on the start square"),
    NOT_YOUR_TURN("Piece does not belong to the side to move"),
    OWN_PIECE_ON_TARGET("Target square holds a piece of the same color"),
    NOT_REACHABLE("Piece cannot reach the target square"),
    LEAVES_KING_IN_CHECK("Move would leave the king in check");

    private final String description;

    MoveLegality(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
