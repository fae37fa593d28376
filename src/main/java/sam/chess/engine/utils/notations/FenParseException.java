package sam.chess.engine.utils.notations;

public class FenParseException extends IllegalArgumentException {
    public FenParseException(String message) {
        super(message);
    }
}
