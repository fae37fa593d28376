package sam.chess.engine.uci;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.MoveOutcome;
import sam.chess.engine.game.board.utils.BoardGenerator;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.search.SearchConfig;
import sam.chess.engine.search.SearchFacade;
import sam.chess.engine.search.SearchResult;
import sam.chess.engine.utils.notations.FENUtils;
import sam.chess.engine.utils.notations.MoveIOUtils;

import java.util.List;
import java.util.function.Consumer;

public class UciEngineImpl implements UciEngine {
    private static final Logger log = LoggerFactory.getLogger(UciEngineImpl.class);

    private Game game;

    private SearchConfig cfg;
    private SearchFacade engine;

    public UciEngineImpl() {
        this(new SearchConfig.Builder()
                .strategy(SearchConfig.parseStrategy(System.getProperty("search.strategy", "greedy")))
                .seed(parseSeed(System.getProperty("search.seed")))
                .debug(Boolean.parseBoolean(System.getProperty("debug", "false")))
                .parallelEvaluation(Boolean.parseBoolean(System.getProperty("search.parallel", "false")))
                .build());
    }

    public UciEngineImpl(SearchConfig cfg) {
        this.cfg = cfg;
        this.engine = new SearchFacade(cfg);
        log.debug("Engine configured with {}", cfg);
    }

    public SearchConfig config() {
        return cfg;
    }

    @Override
    public void newGame() {
        game = null;
        // Same seed, same game
        engine = new SearchFacade(cfg);
    }

    @Override
    public List<String> options() {
        return List.of(
                "option name Strategy type combo default " + cfg.strategy.name().toLowerCase()
                        + " var random var greedy",
                "option name Seed type string default " + (cfg.seed == null ? "<empty>" : cfg.seed),
                "option name Debug type check default " + cfg.debug);
    }

    @Override
    public void setOption(String name, String value) {
        SearchConfig.Builder builder = cfg.toBuilder();
        try {
            switch (name.toLowerCase()) {
                case "strategy" -> builder.strategy(SearchConfig.parseStrategy(value));
                case "seed" -> builder.seed(parseSeed(value));
                case "debug" -> builder.debug(Boolean.parseBoolean(value));
                case "parallel" -> builder.parallelEvaluation(Boolean.parseBoolean(value));
                default -> {
                    log.debug("Unknown option {}", name);
                    return;
                }
            }
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value '{}' for option {}", value, name);
            return;
        }
        cfg = builder.build();
        engine = new SearchFacade(cfg);
        log.debug("Engine configured with {}", cfg);
    }

    @Override
    public void setPositionStartpos(List<String> uciMoves) {
        setPositionFEN(BoardGenerator.STANDARD_GAME, uciMoves);
    }

    @Override
    public void setPositionFEN(String fen, List<String> uciMoves) {
        Game position = FENUtils.getGameFrom(fen);
        for(String uciMove : uciMoves) {
            MoveOutcome outcome = position.makeMove(Move.fromAlgebraicNotation(uciMove));
            if(!outcome.success()) {
                throw new IllegalArgumentException("Cannot play " + uciMove + ": " + outcome.message());
            }
        }
        game = position;
    }

    @Override
    public UciResult search(Consumer<String> infoSink) {
        if(game == null) {
            return UciResult.none();
        }
        SearchResult searchResult = engine.findBestMove(game);
        if(!searchResult.hasMove()) {
            return UciResult.none();
        }
        infoSink.accept(searchResult.toUCIInfo());
        return UciResult.best(MoveIOUtils.writeAlgebraicNotation(searchResult.move()));
    }

    @Override
    public void debugDump(Consumer<String> out) {
        if(game == null) {
            out.accept("info string no position set");
            return;
        }
        for(String line : game.toString().split("\n")) {
            out.accept(line);
        }
        out.accept("Fen: " + FENUtils.getFENFromGame(game));
        out.accept("Status: " + game.getStatus().displayText());
    }

    private static Long parseSeed(String value) {
        if(value == null || value.isBlank() || value.equals("<empty>")) {
            return null;
        }
        return Long.parseLong(value.trim());
    }
}
