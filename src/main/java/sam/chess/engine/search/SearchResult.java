package sam.chess.engine.search;

import sam.chess.engine.movegen.Move;
import sam.chess.engine.utils.notations.MoveIOUtils;

/**
 * @param move chosen move, null when the side to move has none
 * @param score evaluation of the position after the move, for the mover
 * @param evaluatedMoves legal moves considered
 */
public record SearchResult(Move move, int score, int evaluatedMoves, long timeMs) {
    public boolean hasMove() {
        return move != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("best move: ").append(hasMove() ? MoveIOUtils.writeAlgebraicNotation(move) : "none").append("\n")
            .append("score: ").append(score).append("\n")
            .append("moves evaluated: ").append(evaluatedMoves).append("\n")
            .append("search time (ms): ").append(timeMs);
        return sb.toString();
    }

    public String toUCIInfo() {
        StringBuilder sb = new StringBuilder("info")
            .append(" depth 1")
            .append(" time ").append(timeMs)
            .append(" score cp ").append(score)
            .append(" nodes ").append(evaluatedMoves);
        if(hasMove()) {
            sb.append(" pv ").append(MoveIOUtils.writeAlgebraicNotation(move));
        }
        return sb.toString();
    }
}
