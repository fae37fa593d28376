package sam.chess.engine;

import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.common.SquareResult;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.GameStatus;
import sam.chess.engine.game.MoveOutcome;
import sam.chess.engine.game.board.utils.BoardGenerator;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.search.MoveSelector;
import sam.chess.engine.utils.notations.FENUtils;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Entry points for a caller driving a game by square names: set up, ask where a piece can go,
 * try a move, read the status, or let a selector pick the next move.
 */
public final class ChessEngine {
    private ChessEngine() {
    }

    public static Game newGame() {
        return BoardGenerator.newStandardGameBoard();
    }

    /**
     * @param placement FEN piece placement field; the other FEN fields are ignored if present
     * @throws sam.chess.engine.utils.notations.FenParseException on a malformed placement
     */
    public static Game newGame(String placement) {
        return FENUtils.getGameFromPlacement(placement);
    }

    /** Empty for a malformed square name or an empty square. */
    public static Set<Square> legalDestinations(Game game, String square) {
        SquareResult result = Square.parse(square);
        if(!result.isValid()) {
            return Collections.emptySet();
        }
        return game.getLegalDestinations(result.square());
    }

    public static MoveOutcome attemptMove(Game game, String from, String to) {
        return game.makeMove(from, to);
    }

    public static MoveOutcome attemptMove(Game game, String from, String to, PieceType promotion) {
        return game.makeMove(from, to, promotion);
    }

    public static GameStatus status(Game game) {
        return game.getStatus();
    }

    public static Optional<Move> selectMove(MoveSelector selector, Game game) {
        if(game.getStatus().isTerminal()) {
            return Optional.empty();
        }
        return selector.selectMove(game);
    }
}
