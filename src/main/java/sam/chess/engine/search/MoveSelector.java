package sam.chess.engine.search;

import sam.chess.engine.game.Game;
import sam.chess.engine.movegen.Move;

import java.util.Optional;

/** Picks a move for the side to move. Empty means that side has no legal move. */
public interface MoveSelector {
    Optional<Move> selectMove(Game game);
}
