package max.chess5d.engine.movegen;

import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.pieces.PieceMovements;
import max.chess5d.engine.movegen.utils.MovementVectors;

import java.util.Optional;

/**
 * Moves of a piece standing on a given square.
 *
 * @param piece the piece expected on the square
 * @param position square of the piece
 */
public record PieceMoveGenerator(Piece piece, Coordinates position) implements GenMoves<PieceMoveIterator> {

    @Override
    public Optional<PieceMoveIterator> generateMoves(Game game, PartialGame partialGame) {
        Board board = getBoardIfPieceStillThere(partialGame);
        if(board == null) {
            return Optional.empty();
        }
        return Optional.of(new PieceMoveIterator(game, partialGame, board, piece, position));
    }

    @Override
    public boolean validateMove(Game game, PartialGame partialGame, Move move) {
        if(!move.from().equals(position) || !move.piece().equals(piece)) {
            return false;
        }
        Board board = getBoardIfPieceStillThere(partialGame);
        if(board == null) {
            return false;
        }
        if(move.type() != MoveType.NORMAL || piece.type().isPawnLike()) {
            return PieceMoveIterator.getSpecialMoves(game, partialGame, board, piece, position).contains(move);
        }
        return validateVectorMove(game, partialGame, move);
    }

    private boolean validateVectorMove(Game game, PartialGame partialGame, Move move) {
        Coordinates to = move.to();
        int dl = to.l() - position.l();
        int dt = to.t() - position.t();
        int dx = to.x() - position.x();
        int dy = to.y() - position.y();
        // boards of the same color are two turn indexes apart
        if(dt % 2 != 0) {
            return false;
        }
        dt /= 2;
        if(!game.rules().allowTimeTravel && (dl != 0 || dt != 0)) {
            return false;
        }

        int[][] vectors = PieceMovements.vectors(piece.type());
        if(PieceMovements.slides(piece.type())) {
            int distance = Math.max(Math.max(Math.abs(dl), Math.abs(dt)), Math.max(Math.abs(dx), Math.abs(dy)));
            if(distance == 0 || !isMultipleOf(distance, dl, dt, dx, dy)) {
                return false;
            }
            int ul = dl / distance, ut = dt / distance, ux = dx / distance, uy = dy / distance;
            if(!MovementVectors.contains(vectors, ul, ut, ux, uy)) {
                return false;
            }
            // the path must be free up to the destination
            for(int step = 1; step < distance; step++) {
                Coordinates crossed = position.offset(ul * step, ut * 2 * step, ux * step, uy * step);
                Board crossedBoard = partialGame.getBoard(crossed);
                if(crossedBoard == null || !crossedBoard.contains(crossed.x(), crossed.y())
                        || crossedBoard.get(crossed) != null) {
                    return false;
                }
            }
        } else if(!MovementVectors.contains(vectors, dl, dt, dx, dy)) {
            return false;
        }

        Board target = partialGame.getBoard(to);
        if(target == null || !target.contains(to.x(), to.y())) {
            return false;
        }
        Piece occupant = target.get(to);
        if(occupant == null) {
            return move.captured() == null;
        }
        return occupant.color() != piece.color() && occupant.equals(move.captured());
    }

    private static boolean isMultipleOf(int distance, int... components) {
        for(int component : components) {
            if(component != 0 && Math.abs(component) != distance) {
                return false;
            }
        }
        return true;
    }

    private Board getBoardIfPieceStillThere(PartialGame partialGame) {
        Board board = partialGame.getBoard(position);
        if(board == null || !board.contains(position.x(), position.y()) || !piece.equals(board.get(position))) {
            return null;
        }
        return board;
    }
}
