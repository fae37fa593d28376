package sam.chess.engine.utils.notations;

import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.common.SquareResult;
import sam.chess.engine.game.Game;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public class FENUtils {

    /**
     * Builds a game from the piece placement field alone. Anything after the first space is ignored:
     * white moves first, every castling right is granted and there is no en passant target.
     */
    public static Game getGameFromPlacement(String fen) {
        if(fen == null || fen.isBlank()) {
            throw new FenParseException("Empty FEN record");
        }
        Board board = readPiecePlacement(fen.trim().split("\\s+")[0]);
        return Game.fromPosition(board, Color.WHITE, true, true, true, true, null);
    }

    /** Full six-field import. The move clocks are checked but not kept. */
    public static Game getGameFrom(String fen) {
        if(fen == null) {
            throw new FenParseException("Empty FEN record");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length != 6) {
            throw new FenParseException("Invalid FEN record, expected 6 fields: " + fen);
        }
        Board board = readPiecePlacement(fenFields[0]);
        Color currentPlayer = readCurrentTurn(fenFields[1]);
        String castlingRights = readCastlingRights(fenFields[2]);
        Square enPassantTarget = readEnPassantSquare(fenFields[3]);
        checkClock(fenFields[4], "half move clock");
        checkClock(fenFields[5], "full move number");
        return Game.fromPosition(board, currentPlayer,
                castlingRights.indexOf('K') >= 0, castlingRights.indexOf('Q') >= 0,
                castlingRights.indexOf('k') >= 0, castlingRights.indexOf('q') >= 0,
                enPassantTarget);
    }

    public static String getFENFromGame(Game game) {
        StringBuilder fen = new StringBuilder();
        appendPiecePlacement(game, fen);
        fen.append(' ').append(game.getCurrentPlayer().fenLetter());
        appendCastlingRights(game, fen);
        fen.append(' ');
        Square enPassantTarget = game.getEnPassantTarget();
        fen.append(enPassantTarget == null ? "-" : enPassantTarget.name());
        // Clocks are not tracked
        fen.append(" 0 1");
        return fen.toString();
    }

    private static Board readPiecePlacement(String piecePlacement) {
        String[] rows = piecePlacement.split("/");
        if(rows.length != 8) {
            throw new FenParseException("Piece placement should have 8 ranks: " + piecePlacement);
        }
        Board board = new Board();
        for(int row = 0; row < 8; row++) {
            int col = 0;
            for(char character : rows[row].toCharArray()) {
                if(Character.isDigit(character)) {
                    col += character - '0';
                    continue;
                }
                PieceType pieceType = PieceType.fromLetter(character);
                if(pieceType == null) {
                    throw new FenParseException("Unknown piece letter " + character);
                }
                if(col >= 8) {
                    throw new FenParseException("Rank " + (8 - row) + " overflows: " + rows[row]);
                }
                Color color = Character.isUpperCase(character) ? Color.WHITE : Color.BLACK;
                try {
                    board.put(new Piece(pieceType, color, Square.of(row, col)));
                } catch (IllegalStateException e) {
                    throw new FenParseException(e.getMessage());
                }
                col++;
            }
            if(col != 8) {
                throw new FenParseException("Rank " + (8 - row) + " should describe 8 squares: " + rows[row]);
            }
        }
        return board;
    }

    private static Color readCurrentTurn(String currentTurn) {
        if(currentTurn.length() != 1) {
            throw new FenParseException("Invalid side to move " + currentTurn);
        }
        try {
            return Color.fromFenLetter(currentTurn.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new FenParseException(e.getMessage());
        }
    }

    /** The validated field, "" when no side may castle. */
    private static String readCastlingRights(String castlingRights) {
        if("-".equals(castlingRights)) {
            return "";
        }
        for(char character : castlingRights.toCharArray()) {
            if("KQkq".indexOf(character) < 0 || castlingRights.indexOf(character) != castlingRights.lastIndexOf(character)) {
                throw new FenParseException("Invalid castling rights " + castlingRights);
            }
        }
        return castlingRights;
    }

    private static Square readEnPassantSquare(String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            return null;
        }
        SquareResult result = Square.parse(enPassantSquare);
        if(result instanceof SquareResult.Invalid invalid) {
            throw new FenParseException("Invalid en passant square " + invalid.input() + ": " + invalid.reason());
        }
        return result.square();
    }

    private static void checkClock(String value, String name) {
        try {
            if(Integer.parseInt(value) < 0) {
                throw new FenParseException("Negative " + name + ": " + value);
            }
        } catch (NumberFormatException e) {
            throw new FenParseException("Invalid " + name + ": " + value);
        }
    }

    private static void appendPiecePlacement(Game game, StringBuilder fen) {
        Board board = game.board();
        for(int row = 0; row < 8; row++) {
            if(row != 0) {
                fen.append('/');
            }
            int emptySpaceCounter = 0;
            for(int col = 0; col < 8; col++) {
                Piece piece = board.getPieceAt(row, col);
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.symbol());
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void appendCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(game.canCastleKingSide(Color.WHITE)) {
            castlingRights.append('K');
        }
        if(game.canCastleQueenSide(Color.WHITE)) {
            castlingRights.append('Q');
        }
        if(game.canCastleKingSide(Color.BLACK)) {
            castlingRights.append('k');
        }
        if(game.canCastleQueenSide(Color.BLACK)) {
            castlingRights.append('q');
        }
        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }
}
