package sam.chess.engine.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sam.chess.engine.common.Color;
import sam.chess.engine.common.PieceType;
import sam.chess.engine.common.Square;
import sam.chess.engine.common.SquareResult;
import sam.chess.engine.game.board.Board;
import sam.chess.engine.game.board.Piece;
import sam.chess.engine.game.board.utils.BoardUtils;
import sam.chess.engine.movegen.Move;
import sam.chess.engine.movegen.MoveGenerator;
import sam.chess.engine.movegen.MoveLegality;
import sam.chess.engine.movegen.MoveValidator;
import sam.chess.engine.movegen.pieces.King;
import sam.chess.engine.movegen.pieces.Pawn;
import sam.chess.engine.movegen.utils.CheckUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The live game: board, side to move, castling rights, en passant target, history, capture ledgers
 * and status. {@link #makeMove} is the only way a position changes once play has started.
 */
public class Game {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Board board;
    private Color currentPlayer = Color.WHITE;
    private GameStatus status = GameStatus.IN_PROGRESS;

    private boolean whiteCanCastleKingSide = true;
    private boolean whiteCanCastleQueenSide = true;
    private boolean blackCanCastleKingSide = true;
    private boolean blackCanCastleQueenSide = true;

    private Square enPassantTarget;

    private final List<MovePlayed> moveHistory;
    // black kinds taken by white, and white kinds taken by black
    private final List<PieceType> capturedByWhite;
    private final List<PieceType> capturedByBlack;

    private Game(Board board, Color currentPlayer, Square enPassantTarget) {
        this.board = board;
        this.currentPlayer = currentPlayer;
        this.enPassantTarget = enPassantTarget;
        this.moveHistory = new ArrayList<>();
        this.capturedByWhite = new ArrayList<>();
        this.capturedByBlack = new ArrayList<>();
    }

    /**
     * A game starting from an arbitrary position, with an empty history. The board is copied, so the
     * caller keeps no handle on the live position.
     */
    public static Game fromPosition(Board board, Color currentPlayer,
                                    boolean whiteKingSide, boolean whiteQueenSide,
                                    boolean blackKingSide, boolean blackQueenSide,
                                    Square enPassantTarget) {
        Game game = new Game(board.copy(), currentPlayer, enPassantTarget);
        game.whiteCanCastleKingSide = whiteKingSide;
        game.whiteCanCastleQueenSide = whiteQueenSide;
        game.blackCanCastleKingSide = blackKingSide;
        game.blackCanCastleQueenSide = blackQueenSide;
        return game;
    }

    private Game(Game other) {
        this.board = other.board.copy();
        this.currentPlayer = other.currentPlayer;
        this.status = other.status;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.enPassantTarget = other.enPassantTarget;
        this.moveHistory = new ArrayList<>(other.moveHistory);
        this.capturedByWhite = new ArrayList<>(other.capturedByWhite);
        this.capturedByBlack = new ArrayList<>(other.capturedByBlack);
    }

    /** Independent copy: nothing mutable is shared with this game. */
    public Game copy() {
        return new Game(this);
    }

    public MoveOutcome makeMove(String from, String to) {
        return makeMove(from, to, null);
    }

    public MoveOutcome makeMove(String from, String to, PieceType promotion) {
        if(status.isTerminal()) {
            return MoveOutcome.gameOver();
        }
        SquareResult fromResult = Square.parse(from);
        if(fromResult instanceof SquareResult.Invalid invalid) {
            return MoveOutcome.invalidSquare(invalid.input(), invalid.reason());
        }
        SquareResult toResult = Square.parse(to);
        if(toResult instanceof SquareResult.Invalid invalid) {
            return MoveOutcome.invalidSquare(invalid.input(), invalid.reason());
        }
        return makeMove(fromResult.square(), toResult.square(), promotion);
    }

    public MoveOutcome makeMove(Move move) {
        return makeMove(move.from(), move.to(), move.promotion());
    }

    /**
     * Plays the move if it is legal. A refused move leaves every part of the state untouched.
     *
     * @param promotion kind for a pawn reaching the last rank, a queen when null or not a valid choice
     */
    public MoveOutcome makeMove(Square from, Square to, PieceType promotion) {
        if(status.isTerminal()) {
            return MoveOutcome.gameOver();
        }
        MoveLegality legality = MoveValidator.validate(this, from, to);
        if(legality != MoveLegality.LEGAL) {
            log.debug("Refused {}-{}: {}", from, to, legality.description());
            return MoveOutcome.illegal(legality);
        }

        Piece piece = board.getPieceAt(from);
        Color mover = piece.color();
        // We have to assume the special moves from their shape, as the move is legal
        boolean castle = King.isCastleMove(piece, to);
        boolean enPassant = Pawn.isEnPassantCapture(this, piece, to);

        enPassantTarget = null;
        Piece captured = BoardUtils.playMove(board, from, to, castle, enPassant);
        if(Pawn.isDoubleStep(piece, from, to)) {
            enPassantTarget = Square.of((from.row() + to.row()) / 2, from.col());
        }

        moveHistory.add(new MovePlayed(from, to, piece));

        if(captured != null) {
            getCapturedBy(mover).add(captured.type());
            if(captured.type() == PieceType.KING) {
                // Only an imported position with the side not to move in check gets here
                log.warn("{} king captured on {}, ending the game", captured.color(), to);
                status = GameStatus.winFor(mover);
                return MoveOutcome.succeeded();
            }
        }

        updateCastlingRights(piece, from, captured, to);

        if(Pawn.isPromotion(piece, to)) {
            PieceType promotedTo = promotion != null && promotion.isPromotionTarget() ? promotion : PieceType.QUEEN;
            board.put(board.getPieceAt(to).promoteTo(promotedTo));
        }

        currentPlayer = mover.getOppositeColor();
        updateStatus(mover);
        return MoveOutcome.succeeded();
    }

    private void updateCastlingRights(Piece moved, Square from, Piece captured, Square to) {
        if(moved.type() == PieceType.KING) {
            revokeCastlingRights(moved.color(), true, true);
        }
        if(moved.type() == PieceType.ROOK) {
            revokeRookCastlingRight(moved.color(), from);
        }
        if(captured != null && captured.type() == PieceType.ROOK) {
            revokeRookCastlingRight(captured.color(), to);
        }
    }

    private void revokeRookCastlingRight(Color rookColor, Square rookSquare) {
        if(rookSquare.row() != rookColor.backRow()) {
            return;
        }
        if(rookSquare.col() == King.KING_SIDE_ROOK_COL) {
            revokeCastlingRights(rookColor, true, false);
        } else if(rookSquare.col() == King.QUEEN_SIDE_ROOK_COL) {
            revokeCastlingRights(rookColor, false, true);
        }
    }

    // Rights only ever go from true to false
    private void revokeCastlingRights(Color color, boolean kingSide, boolean queenSide) {
        if(color.isWhite()) {
            whiteCanCastleKingSide &= !kingSide;
            whiteCanCastleQueenSide &= !queenSide;
        } else {
            blackCanCastleKingSide &= !kingSide;
            blackCanCastleQueenSide &= !queenSide;
        }
    }

    private void updateStatus(Color mover) {
        if(MoveGenerator.hasLegalMove(this, currentPlayer)) {
            return;
        }
        if(isInCheck(currentPlayer)) {
            status = GameStatus.winFor(mover);
        } else {
            status = GameStatus.DRAW_STALEMATE;
        }
        log.debug("Game over after {} moves: {}", moveHistory.size(), status.displayText());
    }

    public boolean isLegalMove(Square from, Square to) {
        return MoveValidator.isLegalMove(this, from, to);
    }

    public List<Move> getAllLegalMoves(Color color) {
        return MoveGenerator.getAllLegalMoves(this, color);
    }

    public List<Move> getLegalMoves() {
        return MoveGenerator.getAllLegalMoves(this, currentPlayer);
    }

    public Set<Square> getLegalDestinations(Square from) {
        return MoveGenerator.getLegalDestinations(this, from);
    }

    public boolean isInCheck(Color color) {
        return CheckUtils.isInCheck(board, color);
    }

    public boolean inCheck() {
        return isInCheck(currentPlayer);
    }

    /** A snapshot of the position. Changing it has no effect on this game. */
    public Board board() {
        return board.copy();
    }

    public Piece getPieceAt(Square square) {
        return board.getPieceAt(square);
    }

    public Color getCurrentPlayer() {
        return currentPlayer;
    }

    public GameStatus getStatus() {
        return status;
    }

    public Square getEnPassantTarget() {
        return enPassantTarget;
    }

    public boolean canCastleKingSide(Color color) {
        return color.isWhite() ? whiteCanCastleKingSide : blackCanCastleKingSide;
    }

    public boolean canCastleQueenSide(Color color) {
        return color.isWhite() ? whiteCanCastleQueenSide : blackCanCastleQueenSide;
    }

    public List<MovePlayed> getMoveHistory() {
        return Collections.unmodifiableList(moveHistory);
    }

    /** Kinds captured by {@code color}, in capture order. */
    public List<PieceType> capturedBy(Color color) {
        return Collections.unmodifiableList(getCapturedBy(color));
    }

    private List<PieceType> getCapturedBy(Color color) {
        return color.isWhite() ? capturedByWhite : capturedByBlack;
    }

    @Override
    public String toString() {
        return board.toString();
    }
}
