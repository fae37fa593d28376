package sam.chess.engine.search;

import sam.chess.engine.game.Game;
import sam.chess.engine.movegen.Move;

import java.util.List;
import java.util.Optional;
import java.util.Random;

public class RandomSearch implements MoveSelector {
    private final Random random;

    public RandomSearch() {
        this(new Random());
    }

    public RandomSearch(Random random) {
        this.random = random;
    }

    @Override
    public Optional<Move> selectMove(Game game) {
        List<Move> moves = game.getLegalMoves();
        if(moves.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(moves.get(random.nextInt(moves.size())));
    }
}
