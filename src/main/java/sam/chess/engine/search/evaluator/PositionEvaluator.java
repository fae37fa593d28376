package sam.chess.engine.search.evaluator;

import sam.chess.engine.common.Color;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;

/**
 * Single-ply score of a position from one side's point of view: material balance plus mobility balance.
 * Mobility is the number of legal moves a side has right now, so the side not on move always counts zero.
 */
public class PositionEvaluator {
    public static int evaluatePosition(Game game, Color color) {
        Color opponent = color.getOppositeColor();
        int materialScore = getMaterial(game.board(), color) - getMaterial(game.board(), opponent);
        int mobilityScore = getMobility(game, color) - getMobility(game, opponent);
        return materialScore + mobilityScore;
    }

    public static int getMaterial(Board board, Color color) {
        int material = 0;
        for(int row = 0; row < 8; row++) {
            for(int col = 0; col < 8; col++) {
                Piece piece = board.getPieceAt(row, col);
                if(piece != null && piece.color() == color) {
                    material += PieceValues.pieceTypeToValue(piece.type());
                }
            }
        }
        return material;
    }

    public static int getMobility(Game game, Color color) {
        return game.getAllLegalMoves(color).size();
    }
}
