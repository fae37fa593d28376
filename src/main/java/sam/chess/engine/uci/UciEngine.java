package sam.chess.engine.uci;

import java.util.List;
import java.util.function.Consumer;

/**
 * What {@link UciServer} drives: a current position, a set of named options and a move picker.
 * Positions given with move lists are replayed from their start; a move that cannot be played
 * rejects the whole position with an {@link IllegalArgumentException}.
 */
public interface UciEngine {
    /** Forgets the current position and restarts selection from the configured seed. */
    void newGame();

    default void onIsReady() {}

    /** Unknown names and unusable values are ignored. */
    default void setOption(String name, String value) {}

    /** The "option ..." lines announced in answer to "uci". */
    default List<String> options() {
        return List.of();
    }

    void setPositionStartpos(List<String> moves);

    void setPositionFEN(String fen, List<String> moves);

    /**
     * Picks a move for the side to move in the current position, the null move when there is no
     * position or nothing to play.
     *
     * @param infoSink receives "info ..." lines about the choice
     */
    UciResult search(Consumer<String> infoSink);

    default void debugDump(Consumer<String> out) {}
}
