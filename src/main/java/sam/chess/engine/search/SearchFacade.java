package sam.chess.engine.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sam.chess.engine.game.Game;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.search.evaluator.PositionEvaluator;

import java.util.List;
import java.util.Optional;
import java.util.Random;

public final class SearchFacade {
    private static final Logger log = LoggerFactory.getLogger(SearchFacade.class);

    private final SearchConfig cfg;
    private final MoveSelector selector;

    public SearchFacade(SearchConfig cfg) {
        this.cfg = cfg;
        this.selector = createSelector(cfg);
    }

    public static MoveSelector createSelector(SearchConfig cfg) {
        Random random = cfg.seed == null ? new Random() : new Random(cfg.seed);
        RandomSearch randomSearch = new RandomSearch(random);
        return switch (cfg.strategy) {
            case RANDOM -> randomSearch;
            case GREEDY -> new GreedySearch(randomSearch, cfg.parallelEvaluation);
        };
    }

    public SearchConfig config() {
        return cfg;
    }

    public MoveSelector selector() {
        return selector;
    }

    public SearchResult findBestMove(Game game) {
        long start = System.nanoTime();
        List<Move> legalMoves = game.getLegalMoves();
        Optional<Move> selected = selector.selectMove(game);
        long timeMs = (System.nanoTime() - start) / 1_000_000;

        if(selected.isEmpty()) {
            log.debug("No move for {}, game status {}", game.getCurrentPlayer(), game.getStatus().displayText());
            return new SearchResult(null, 0, 0, timeMs);
        }

        Move move = selected.get();
        if(cfg.debug && !legalMoves.contains(move.withoutPromotion())) {
            throw new IllegalStateException("Illegal bestMove " + move + " for " + game.getCurrentPlayer());
        }

        Game after = game.copy();
        after.makeMove(move);
        int score = PositionEvaluator.evaluatePosition(after, game.getCurrentPlayer());
        SearchResult result = new SearchResult(move, score, legalMoves.size(), timeMs);
        log.debug("{} picked {} (score {}, {} moves, {} ms)", cfg.strategy, move, score, legalMoves.size(), timeMs);
        return result;
    }
}
