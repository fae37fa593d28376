package sam.chess.engine.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sam.chess.engine.common.Color;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.MoveOutcome;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.search.evaluator.PositionEvaluator;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Plays every legal move on a copy of the game and keeps the one whose resulting position scores best
 * for the mover. Ties keep the move generated first.
 */
public class GreedySearch implements MoveSelector {
    private static final Logger log = LoggerFactory.getLogger(GreedySearch.class);
    // Marks a candidate whose copy refused the move
    static final int NOT_EVALUATED = Integer.MIN_VALUE;

    private final RandomSearch fallback;
    private final boolean parallelEvaluation;

    public GreedySearch(RandomSearch fallback) {
        this(fallback, false);
    }

    public GreedySearch(RandomSearch fallback, boolean parallelEvaluation) {
        this.fallback = fallback;
        this.parallelEvaluation = parallelEvaluation;
    }

    @Override
    public Optional<Move> selectMove(Game game) {
        List<Move> moves = game.getLegalMoves();
        if(moves.isEmpty()) {
            return Optional.empty();
        }

        IntArrayList scores = scoreMoves(game, moves);

        Move bestMove = null;
        int bestScore = NOT_EVALUATED;
        for(int i = 0; i < moves.size(); i++) {
            int score = scores.getInt(i);
            if(score != NOT_EVALUATED && (bestMove == null || score > bestScore)) {
                bestScore = score;
                bestMove = moves.get(i);
            }
        }

        if(bestMove == null) {
            log.warn("No candidate move could be played on a copy, picking at random");
            return fallback.selectMove(game);
        }
        return Optional.of(bestMove);
    }

    IntArrayList scoreMoves(Game game, List<Move> moves) {
        Color mover = game.getCurrentPlayer();
        int[] scores = new int[moves.size()];
        IntStream indexes = IntStream.range(0, moves.size());
        if(parallelEvaluation) {
            indexes = indexes.parallel();
        }
        indexes.forEach(i -> scores[i] = scoreMove(game, moves.get(i), mover));
        return IntArrayList.wrap(scores);
    }

    private static int scoreMove(Game game, Move move, Color mover) {
        Game copy = game.copy();
        MoveOutcome outcome = copy.makeMove(move);
        if(!outcome.success()) {
            return NOT_EVALUATED;
        }
        return PositionEvaluator.evaluatePosition(copy, mover);
    }
}
