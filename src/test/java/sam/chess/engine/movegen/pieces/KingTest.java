package sam.chess.engine.movegen.pieces;

import org.junit.jupiter.api.Test;
import sam.chess.engine.game.Game;
import sam.chess.engine.utils.notations.FENUtils;

import static org.junit.jupiter.api.Assertions.*;
import static sam.chess.engine.movegen.pieces.PieceMovesTestUtils.*;

public class KingTest {

    @Test
    public void kingShouldStepToAdjacentSquaresOnly() {
        Game game = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/8/R3K2R");

        // Castling squares are not part of the step pattern
        assertEquals(names("d1", "d2", "e2", "f2", "f1"), pseudoLegalTargets(game, "e1"));
    }

    @Test
    public void castleShapeShouldStartFromTheHomeSquare() {
        Game game = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/8/R3K2R");

        assertTrue(King.isCastleMove(game.getPieceAt(sq("e1")), sq("g1")));
        assertTrue(King.isCastleMove(game.getPieceAt(sq("e1")), sq("c1")));
        assertFalse(King.isCastleMove(game.getPieceAt(sq("e1")), sq("f1")));

        Game offHome = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/8/R2K3R");
        assertFalse(King.isCastleMove(offHome.getPieceAt(sq("d1")), sq("f1")));
    }

    @Test
    public void castleRookMoveShouldMatchTheSide() {
        assertEquals(new King.CastleRookMove(sq("h1"), sq("f1")), King.getCastleRookMove(sq("e1"), sq("g1")));
        assertEquals(new King.CastleRookMove(sq("a1"), sq("d1")), King.getCastleRookMove(sq("e1"), sq("c1")));
        assertEquals(new King.CastleRookMove(sq("h8"), sq("f8")), King.getCastleRookMove(sq("e8"), sq("g8")));
        assertEquals(new King.CastleRookMove(sq("a8"), sq("d8")), King.getCastleRookMove(sq("e8"), sq("c8")));
    }

    @Test
    public void castleShouldBeRefusedThroughAnAttackedSquare() {
        // Given a black rook on f2 covering f1
        Game game = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/5r2/R3K2R");

        // Then
        assertFalse(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("g1")));
        assertTrue(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("c1")));
    }

    @Test
    public void castleShouldBeRefusedOutOfCheck() {
        Game game = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/4r3/R3K2R");

        assertFalse(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("g1")));
        assertFalse(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("c1")));
    }

    @Test
    public void castleShouldNeedAClearPathAndTheRook() {
        Game blocked = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/8/RN2K1NR");
        assertFalse(King.isCastleLegal(blocked, blocked.getPieceAt(sq("e1")), sq("g1")));
        assertFalse(King.isCastleLegal(blocked, blocked.getPieceAt(sq("e1")), sq("c1")));

        Game noRook = FENUtils.getGameFromPlacement("4k3/8/8/8/8/8/8/4K3");
        assertFalse(King.isCastleLegal(noRook, noRook.getPieceAt(sq("e1")), sq("g1")));
    }

    @Test
    public void castleShouldNeedTheRight() {
        Game game = FENUtils.getGameFrom("4k3/8/8/8/8/8/8/R3K2R w Q - 0 1");

        assertFalse(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("g1")));
        assertTrue(King.isCastleLegal(game, game.getPieceAt(sq("e1")), sq("c1")));
    }
}
