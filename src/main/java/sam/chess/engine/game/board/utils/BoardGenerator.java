package sam.chess.engine.game.board.utils;

import sam.chess.engine.game.Game;
import sam.chess.engine.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_PLACEMENT = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR";
    public static final String STANDARD_GAME = STANDARD_PLACEMENT + " w KQkq - 0 1";

    public static Game newStandardGameBoard() {
        return FENUtils.getGameFromPlacement(STANDARD_PLACEMENT);
    }

    public static Game from(String FEN) {
        return FENUtils.getGameFrom(FEN);
    }
}
