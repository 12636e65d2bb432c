package max.chess5d.engine.movegen;

import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;

import java.util.Optional;

/**
 * Moves of every piece of a board belonging to the color to move on that board.
 * Moves are only pseudo-legal: king safety is checked once a whole moveset is played.
 */
public record BoardMoveGenerator(Board board) implements GenMoves<BoardMoveIterator> {

    @Override
    public Optional<BoardMoveIterator> generateMoves(Game game, PartialGame partialGame) {
        // A board superseded in the partial game has nothing left to play
        if(!board.equals(partialGame.getBoard(board.l(), board.t()))) {
            return Optional.empty();
        }
        return Optional.of(new BoardMoveIterator(game, partialGame, board));
    }

    @Override
    public boolean validateMove(Game game, PartialGame partialGame, Move move) {
        if(board.l() != move.from().l() || board.t() != move.from().t()) {
            return false;
        }
        if(!board.contains(move.from().x(), move.from().y())) {
            return false;
        }
        Piece piece = board.get(move.from());
        if(piece == null || piece.color() != board.activeColor()) {
            return false;
        }
        return new PieceMoveGenerator(piece, move.from()).validateMove(game, partialGame, move);
    }
}
