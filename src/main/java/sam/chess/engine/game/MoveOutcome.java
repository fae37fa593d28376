package sam.chess.engine.game;

import sam.chess.engine.movegen.MoveLegality;

/**
 * Result of a move attempt. {@code reason} explains a refusal by the validator and is null otherwise.
 */
public record MoveOutcome(boolean success, String message, MoveLegality reason) {
    public static final String MOVE_SUCCESSFUL = "Move Successful";
    public static final String ILLEGAL_MOVE = "Illegal Move";
    public static final String GAME_OVER = "Game Over";
    public static final String INVALID_SQUARE = "Invalid square coordinates: ";

    private static final MoveOutcome SUCCESS = new MoveOutcome(true, MOVE_SUCCESSFUL, null);
    private static final MoveOutcome GAME_OVER_OUTCOME = new MoveOutcome(false, GAME_OVER, null);

    public static MoveOutcome succeeded() {
        return SUCCESS;
    }

    public static MoveOutcome gameOver() {
        return GAME_OVER_OUTCOME;
    }

    public static MoveOutcome illegal(MoveLegality reason) {
        return new MoveOutcome(false, ILLEGAL_MOVE, reason);
    }

    public static MoveOutcome invalidSquare(String input, String reason) {
        return new MoveOutcome(false, INVALID_SQUARE + "'" + input + "' " + reason, null);
    }
}
