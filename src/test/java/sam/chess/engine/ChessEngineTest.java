package sam.chess.engine;

import org.junit.jupiter.api.Test;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.GameStatus;
import sam.chess.engine.game.MoveOutcome;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.search.GreedySearch;
import sam.chess.engine.search.MoveSelector;
import sam.chess.engine.search.RandomSearch;
import sam.chess.engine.utils.notations.FenParseException;

import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ChessEngineTest {
    private static Square sq(String name) {
        return Square.parse(name).square();
    }

    @Test
    public void legalDestinationsShouldBeListedBySquareName() {
        Game game = ChessEngine.newGame();

        assertEquals(Set.of(sq("e3"), sq("e4")), ChessEngine.legalDestinations(game, "e2"));
        assertEquals(Set.of(sq("a3"), sq("c3")), ChessEngine.legalDestinations(game, "b1"));
        assertTrue(ChessEngine.legalDestinations(game, "e5").isEmpty());
        assertTrue(ChessEngine.legalDestinations(game, "x5").isEmpty());
        // Black is not to move
        assertTrue(ChessEngine.legalDestinations(game, "e7").isEmpty());
    }

    @Test
    public void attemptMoveShouldReportOutcomes() {
        Game game = ChessEngine.newGame();

        assertEquals("Move Successful", ChessEngine.attemptMove(game, "e2", "e4").message());
        assertEquals("Illegal Move", ChessEngine.attemptMove(game, "e4", "e5").message());
        assertTrue(ChessEngine.attemptMove(game, "e9", "e5").message().startsWith("Invalid square coordinates"));
        assertEquals(GameStatus.IN_PROGRESS, ChessEngine.status(game));
    }

    @Test
    public void legalDestinationsShouldBeEmptyOnceTheGameIsOver() {
        Game game = ChessEngine.newGame();
        ChessEngine.attemptMove(game, "f2", "f3");
        ChessEngine.attemptMove(game, "e7", "e5");
        ChessEngine.attemptMove(game, "g2", "g4");
        ChessEngine.attemptMove(game, "d8", "h4");

        assertEquals(GameStatus.BLACK_WINS, ChessEngine.status(game));
        assertTrue(ChessEngine.legalDestinations(game, "e1").isEmpty());
        assertTrue(ChessEngine.legalDestinations(game, "a2").isEmpty());
        assertEquals("Game Over", ChessEngine.attemptMove(game, "a2", "a3").message());
    }

    @Test
    public void newGameFromPlacementShouldAllowPromotionChoice() {
        Game game = ChessEngine.newGame("4k3/1P6/8/8/8/8/8/4K3");

        MoveOutcome outcome = ChessEngine.attemptMove(game, "b7", "b8", PieceType.BISHOP);

        assertTrue(outcome.success());
        assertEquals(PieceType.BISHOP, game.getPieceAt(sq("b8")).type());
        assertThrows(FenParseException.class, () -> ChessEngine.newGame("8/8/8"));
    }

    @Test
    public void selectorsShouldPlayAFullGameToTheEnd() {
        // Given
        Game game = ChessEngine.newGame();
        MoveSelector white = new GreedySearch(new RandomSearch(new Random(11)));
        MoveSelector black = new RandomSearch(new Random(12));

        // When two selectors play until a result or a move cap
        int plies = 0;
        while(ChessEngine.status(game) == GameStatus.IN_PROGRESS && plies < 120) {
            MoveSelector selector = plies % 2 == 0 ? white : black;
            Optional<Move> move = ChessEngine.selectMove(selector, game);
            assertTrue(move.isPresent());
            assertTrue(game.makeMove(move.get()).success());
            plies++;
        }

        // Then
        assertEquals(plies, game.getMoveHistory().size());
        if(ChessEngine.status(game).isTerminal()) {
            assertTrue(ChessEngine.selectMove(white, game).isEmpty());
            assertTrue(ChessEngine.selectMove(black, game).isEmpty());
        }
    }
}
