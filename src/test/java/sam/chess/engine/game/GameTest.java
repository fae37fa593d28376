package sam.chess.engine.game;

import org.junit.jupiter.api.Test;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.game.board.utils.BoardGenerator;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.movegen.MoveLegality;
import sam.chess.engine.utils.notations.FENUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GameTest {
    private static Square sq(String name) {
        return Square.parse(name).square();
    }

    @Test
    public void newGameShouldStartWithWhiteToMove() {
        Game game = BoardGenerator.newStandardGameBoard();

        assertEquals(Color.WHITE, game.getCurrentPlayer());
        assertEquals(GameStatus.IN_PROGRESS, game.getStatus());
        assertEquals(20, game.getLegalMoves().size());
        assertNull(game.getEnPassantTarget());
        assertTrue(game.canCastleKingSide(Color.WHITE));
        assertTrue(game.canCastleQueenSide(Color.BLACK));
        assertTrue(game.getMoveHistory().isEmpty());
    }

    @Test
    public void doublePawnStepShouldSetTheEnPassantTarget() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();

        // When
        MoveOutcome outcome = game.makeMove("e2", "e4");

        // Then
        assertTrue(outcome.success());
        assertEquals(MoveOutcome.MOVE_SUCCESSFUL, outcome.message());
        assertEquals(Color.BLACK, game.getCurrentPlayer());
        assertEquals(sq("e3"), game.getEnPassantTarget());
        assertEquals(20, game.getAllLegalMoves(Color.BLACK).size());
        assertTrue(game.getAllLegalMoves(Color.WHITE).isEmpty());

        // The target only lasts one move
        game.makeMove("g8", "f6");
        assertNull(game.getEnPassantTarget());
    }

    @Test
    public void enPassantShouldRemoveTheBypassedPawn() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        game.makeMove("e2", "e4");
        game.makeMove("a7", "a6");
        game.makeMove("e4", "e5");
        game.makeMove("d7", "d5");

        // When
        MoveOutcome outcome = game.makeMove("e5", "d6");

        // Then
        assertTrue(outcome.success());
        assertNull(game.getPieceAt(sq("d5")));
        assertNull(game.getPieceAt(sq("e5")));
        assertEquals(new Piece(PieceType.PAWN, Color.WHITE, sq("d6")), game.getPieceAt(sq("d6")));
        assertEquals(List.of(PieceType.PAWN), game.capturedBy(Color.WHITE));
        assertTrue(game.capturedBy(Color.BLACK).isEmpty());
    }

    @Test
    public void enPassantShouldExpireAfterOneMove() {
        Game game = BoardGenerator.newStandardGameBoard();
        game.makeMove("e2", "e4");
        game.makeMove("a7", "a6");
        game.makeMove("e4", "e5");
        game.makeMove("d7", "d5");
        game.makeMove("h2", "h3");
        game.makeMove("h7", "h6");

        MoveOutcome outcome = game.makeMove("e5", "d6");

        assertFalse(outcome.success());
        assertEquals(MoveLegality.NOT_REACHABLE, outcome.reason());
    }

    @Test
    public void kingSideCastleShouldMoveTheRook() {
        // Given
        Game game = FENUtils.getGameFromPlacement("r3k2r/8/8/8/8/8/8/R3K2R");

        // When
        MoveOutcome outcome = game.makeMove("e1", "g1");

        // Then
        assertTrue(outcome.success());
        assertEquals(PieceType.KING, game.getPieceAt(sq("g1")).type());
        assertEquals(PieceType.ROOK, game.getPieceAt(sq("f1")).type());
        assertNull(game.getPieceAt(sq("h1")));
        assertNull(game.getPieceAt(sq("e1")));
        assertFalse(game.canCastleKingSide(Color.WHITE));
        assertFalse(game.canCastleQueenSide(Color.WHITE));
        assertTrue(game.canCastleKingSide(Color.BLACK));
        assertTrue(game.canCastleQueenSide(Color.BLACK));
    }

    @Test
    public void queenSideCastleShouldMoveTheRook() {
        Game game = FENUtils.getGameFromPlacement("r3k2r/8/8/8/8/8/8/R3K2R");
        game.makeMove("a1", "b1");

        MoveOutcome outcome = game.makeMove("e8", "c8");

        assertTrue(outcome.success());
        assertEquals(PieceType.KING, game.getPieceAt(sq("c8")).type());
        assertEquals(PieceType.ROOK, game.getPieceAt(sq("d8")).type());
        assertNull(game.getPieceAt(sq("a8")));
        assertFalse(game.canCastleQueenSide(Color.WHITE));
        assertTrue(game.canCastleKingSide(Color.WHITE));
        assertFalse(game.canCastleKingSide(Color.BLACK));
    }

    @Test
    public void rookMoveShouldOnlyClearItsOwnSide() {
        Game game = FENUtils.getGameFromPlacement("r3k2r/8/8/8/8/8/8/R3K2R");

        game.makeMove("h1", "h2");
        // Moving back does not restore the right
        game.makeMove("a8", "a7");
        game.makeMove("h2", "h1");

        assertFalse(game.canCastleKingSide(Color.WHITE));
        assertTrue(game.canCastleQueenSide(Color.WHITE));
        assertFalse(game.canCastleQueenSide(Color.BLACK));
        assertTrue(game.canCastleKingSide(Color.BLACK));
        assertFalse(game.isLegalMove(sq("e8"), sq("c8")));
    }

    @Test
    public void capturingARookOnItsCornerShouldClearTheRight() {
        Game game = FENUtils.getGameFromPlacement("r3k2r/8/8/8/8/8/8/R3K2R");

        MoveOutcome outcome = game.makeMove("a1", "a8");

        assertTrue(outcome.success());
        assertEquals(List.of(PieceType.ROOK), game.capturedBy(Color.WHITE));
        assertFalse(game.canCastleQueenSide(Color.BLACK));
        assertTrue(game.canCastleKingSide(Color.BLACK));
        assertFalse(game.canCastleQueenSide(Color.WHITE));
    }

    @Test
    public void foolsMateShouldEndTheGame() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();

        // When
        game.makeMove("f2", "f3");
        game.makeMove("e7", "e5");
        game.makeMove("g2", "g4");
        MoveOutcome outcome = game.makeMove("d8", "h4");

        // Then
        assertTrue(outcome.success());
        assertEquals(GameStatus.BLACK_WINS, game.getStatus());
        assertEquals("Black Wins!", game.getStatus().displayText());
        assertTrue(game.isInCheck(Color.WHITE));
        assertTrue(game.getLegalMoves().isEmpty());

        MoveOutcome afterEnd = game.makeMove("a2", "a3");
        assertFalse(afterEnd.success());
        assertEquals(MoveOutcome.GAME_OVER, afterEnd.message());
        assertEquals(4, game.getMoveHistory().size());
    }

    @Test
    public void capturingAKingShouldEndTheGameWithoutPassingTheTurn() {
        // Should be unreachable under correct legality filtering. An imported position where the
        // side not to move is already in check lets the rook take the king directly.
        Game game = FENUtils.getGameFrom("4k3/8/8/8/8/8/8/4R1K1 w - - 0 1");

        // When
        MoveOutcome outcome = game.makeMove("e1", "e8");

        // Then
        assertTrue(outcome.success());
        assertEquals(GameStatus.WHITE_WINS, game.getStatus());
        assertEquals(Color.WHITE, game.getCurrentPlayer());
        assertEquals(List.of(PieceType.KING), game.capturedBy(Color.WHITE));
        assertEquals(List.of(new MovePlayed(sq("e1"), sq("e8"), new Piece(PieceType.ROOK, Color.WHITE, sq("e1")))),
                game.getMoveHistory());

        MoveOutcome afterEnd = game.makeMove("g1", "g2");
        assertEquals(MoveOutcome.GAME_OVER, afterEnd.message());
        assertTrue(game.getLegalMoves().isEmpty());
        assertTrue(game.getLegalDestinations(sq("g1")).isEmpty());
    }

    @Test
    public void finishedGameShouldListNoDestinations() {
        Game game = BoardGenerator.newStandardGameBoard();
        game.makeMove("f2", "f3");
        game.makeMove("e7", "e5");
        game.makeMove("g2", "g4");
        game.makeMove("d8", "h4");

        // White is mated and black has won, nobody moves any more
        assertTrue(game.getAllLegalMoves(Color.BLACK).isEmpty());
        assertTrue(game.getLegalDestinations(sq("h4")).isEmpty());
        assertTrue(game.getLegalDestinations(sq("a2")).isEmpty());
    }

    @Test
    public void boardSnapshotShouldNotChangeTheGame() {
        Game game = BoardGenerator.newStandardGameBoard();
        String before = FENUtils.getFENFromGame(game);

        // When
        Board snapshot = game.board();
        snapshot.remove(sq("e2"));
        snapshot.put(new Piece(PieceType.QUEEN, Color.WHITE, sq("e4")));

        // Then
        assertEquals(before, FENUtils.getFENFromGame(game));
        assertEquals(PieceType.PAWN, game.getPieceAt(sq("e2")).type());
        assertNull(game.getPieceAt(sq("e4")));
    }

    @Test
    public void gameFromPositionShouldOwnItsBoard() {
        Board board = new Board();
        board.put(new Piece(PieceType.KING, Color.WHITE, sq("e1")));
        board.put(new Piece(PieceType.KING, Color.BLACK, sq("e8")));
        board.put(new Piece(PieceType.ROOK, Color.WHITE, sq("h1")));

        // When
        Game game = Game.fromPosition(board, Color.BLACK, true, false, false, false, null);
        board.remove(sq("h1"));

        // Then
        assertEquals(PieceType.ROOK, game.getPieceAt(sq("h1")).type());
        assertEquals(Color.BLACK, game.getCurrentPlayer());
        assertTrue(game.canCastleKingSide(Color.WHITE));
        assertFalse(game.canCastleQueenSide(Color.WHITE));
        assertEquals("4k3/8/8/8/8/8/8/4K2R b K - 0 1", FENUtils.getFENFromGame(game));
    }

    @Test
    public void stalemateShouldBeADraw() {
        // Given the black king on h8 with the white king on f7
        Game game = FENUtils.getGameFromPlacement("7k/5K2/8/6Q1/8/8/8/8");

        // When
        MoveOutcome outcome = game.makeMove("g5", "g6");

        // Then
        assertTrue(outcome.success());
        assertFalse(game.isInCheck(Color.BLACK));
        assertEquals(GameStatus.DRAW_STALEMATE, game.getStatus());
        assertEquals("Draw - Stalemate", game.getStatus().displayText());
    }

    @Test
    public void promotionShouldDefaultToAQueen() {
        Game game = FENUtils.getGameFromPlacement("4k3/P7/8/8/8/8/8/4K3");

        MoveOutcome outcome = game.makeMove("a7", "a8");

        assertTrue(outcome.success());
        assertEquals(new Piece(PieceType.QUEEN, Color.WHITE, sq("a8")), game.getPieceAt(sq("a8")));
        assertTrue(game.isInCheck(Color.BLACK));
    }

    @Test
    public void promotionShouldHonorAValidChoice() {
        Game knight = FENUtils.getGameFromPlacement("4k3/P7/8/8/8/8/8/4K3");
        knight.makeMove("a7", "a8", PieceType.KNIGHT);
        assertEquals(PieceType.KNIGHT, knight.getPieceAt(sq("a8")).type());

        // Neither a king nor a pawn is a valid choice
        Game king = FENUtils.getGameFromPlacement("4k3/P7/8/8/8/8/8/4K3");
        king.makeMove(new Move(sq("a7"), sq("a8"), PieceType.KING));
        assertEquals(PieceType.QUEEN, king.getPieceAt(sq("a8")).type());
    }

    @Test
    public void blackPawnShouldPromoteOnTheFirstRank() {
        Game game = FENUtils.getGameFrom("4k3/8/8/8/8/8/7p/K7 b - - 0 1");

        MoveOutcome outcome = game.makeMove("h2", "h1", PieceType.ROOK);

        assertTrue(outcome.success());
        assertEquals(new Piece(PieceType.ROOK, Color.BLACK, sq("h1")), game.getPieceAt(sq("h1")));
        assertTrue(game.isInCheck(Color.WHITE));
    }

    @Test
    public void illegalMoveShouldLeaveTheStateUntouched() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        String before = FENUtils.getFENFromGame(game);

        // When
        MoveOutcome outcome = game.makeMove("e2", "e5");

        // Then
        assertFalse(outcome.success());
        assertEquals(MoveOutcome.ILLEGAL_MOVE, outcome.message());
        assertEquals(MoveLegality.NOT_REACHABLE, outcome.reason());
        assertEquals(before, FENUtils.getFENFromGame(game));
        assertTrue(game.getMoveHistory().isEmpty());
    }

    @Test
    public void movingTheOpponentPieceShouldBeRefused() {
        Game game = BoardGenerator.newStandardGameBoard();

        MoveOutcome outcome = game.makeMove("e7", "e5");

        assertFalse(outcome.success());
        assertEquals(MoveLegality.NOT_YOUR_TURN, outcome.reason());
        assertEquals(Color.WHITE, game.getCurrentPlayer());
    }

    @Test
    public void malformedSquareShouldBeReported() {
        Game game = BoardGenerator.newStandardGameBoard();

        MoveOutcome outcome = game.makeMove("z9", "e4");

        assertFalse(outcome.success());
        assertTrue(outcome.message().startsWith(MoveOutcome.INVALID_SQUARE));
        assertTrue(outcome.message().contains("z9"));
        assertNull(outcome.reason());

        MoveOutcome badTarget = game.makeMove("e2", "e44");
        assertTrue(badTarget.message().startsWith("Invalid square coordinates"));
    }

    @Test
    public void copyShouldBeIndependent() {
        // Given
        Game game = BoardGenerator.newStandardGameBoard();
        game.makeMove("e2", "e4");

        // When
        Game copy = game.copy();
        copy.makeMove("e7", "e5");
        copy.makeMove("g1", "f3");

        // Then
        assertEquals(Color.BLACK, game.getCurrentPlayer());
        assertEquals(1, game.getMoveHistory().size());
        assertNotNull(game.getPieceAt(sq("e7")));
        assertNotNull(game.getPieceAt(sq("g1")));
        assertEquals(sq("e3"), game.getEnPassantTarget());
        assertEquals(3, copy.getMoveHistory().size());
        assertEquals(Color.BLACK, copy.getCurrentPlayer());
    }

    @Test
    public void historyShouldRecordTheMoverBeforeTheMove() {
        Game game = BoardGenerator.newStandardGameBoard();
        game.makeMove("g1", "f3");

        MovePlayed played = game.getMoveHistory().get(0);

        assertEquals(sq("g1"), played.from());
        assertEquals(sq("f3"), played.to());
        assertEquals(new Piece(PieceType.KNIGHT, Color.WHITE, sq("g1")), played.piece());
        assertEquals("N g1-f3", played.toString());
        assertThrows(UnsupportedOperationException.class, () -> game.getMoveHistory().clear());
    }
}
