package sam.chess.engine.common;

/**
 * Outcome of turning user input into a {@link Square}.
 * Malformed input is a value the caller must look at, never an exception.
 */
public sealed interface SquareResult permits SquareResult.Valid, SquareResult.Invalid {

    boolean isValid();

    /**
     * @throws IllegalStateException when the input did not name a square
     */
    Square square();

    record Valid(Square square) implements SquareResult {
        @Override
        public boolean isValid() {
            return true;
        }
    }

    record Invalid(String input, String reason) implements SquareResult {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Square square() {
            throw new IllegalStateException("Invalid square name '" + input + "': " + reason);
        }
    }
}
