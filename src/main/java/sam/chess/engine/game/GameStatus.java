package sam.chess.engine.game;

import sam.chess.engine.common.Color;

public enum GameStatus {
    IN_PROGRESS("In Progress"),
    WHITE_WINS("White Wins!"),
    BLACK_WINS("Black Wins!"),
    DRAW_STALEMATE("Draw - Stalemate");

    private final String displayText;

    GameStatus(String displayText) {
        this.displayText = displayText;
    }

    public String displayText() {
        return displayText;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static GameStatus winFor(Color winner) {
        return winner.isWhite() ? WHITE_WINS : BLACK_WINS;
    }
}
