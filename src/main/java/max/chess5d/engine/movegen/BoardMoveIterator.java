package max.chess5d.engine.movegen;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;

/**
 * Chains the moves of every piece of the board's active color, by increasing square index.
 * Empty and enemy squares are skipped in a plain loop so sparse boards cost no stack.
 */
public final class BoardMoveIterator extends LazyMoveIterator {
    private final Game game;
    private final PartialGame partialGame;
    private final Board board;
    private final Color color;

    private int squareIndex = 0;
    private PieceMoveIterator currentPiece;

    BoardMoveIterator(Game game, PartialGame partialGame, Board board) {
        this.game = game;
        this.partialGame = partialGame;
        this.board = board;
        this.color = board.activeColor();
    }

    @Override
    protected Move computeNext() {
        while(true) {
            if(currentPiece != null) {
                if(currentPiece.hasNext()) {
                    return currentPiece.next();
                }
                currentPiece = null;
                squareIndex++;
            }

            while(squareIndex < board.size() && !isOwnPiece(board.get(squareIndex))) {
                squareIndex++;
            }
            if(squareIndex >= board.size()) {
                return null;
            }

            Piece piece = board.get(squareIndex);
            currentPiece = new PieceMoveGenerator(piece, board.coordinatesOf(squareIndex))
                    .generateMoves(game, partialGame)
                    .orElseThrow(() -> new IllegalStateException("No piece at square " + squareIndex
                            + " of board " + board.l() + "T" + board.t() + " in the partial game"));
        }
    }

    private boolean isOwnPiece(Piece piece) {
        return piece != null && piece.color() == color;
    }
}
