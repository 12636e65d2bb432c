package max.chess5d.engine.movegen;

import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.pieces.King;
import max.chess5d.engine.movegen.pieces.Pawn;
import max.chess5d.engine.movegen.pieces.PieceMovements;
import max.chess5d.engine.movegen.utils.MovementVectors;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy moves of one piece. Vector moves come first, in vector table order and by increasing distance,
 * then the special moves (pawn moves, castling) which are only computed once the vectors are exhausted.
 */
public final class PieceMoveIterator extends LazyMoveIterator {
    private final Game game;
    private final PartialGame partialGame;
    private final Piece piece;
    private final Coordinates from;
    private final Board board;
    private final int[][] vectors;
    private final boolean slides;
    private final boolean allowTimeTravel;

    private int vectorIndex = 0;
    private int distance = 0;
    private Iterator<Move> specialMoves;

    PieceMoveIterator(Game game, PartialGame partialGame, Board board, Piece piece, Coordinates from) {
        this.game = game;
        this.partialGame = partialGame;
        this.board = board;
        this.piece = piece;
        this.from = from;
        this.vectors = PieceMovements.vectors(piece.type());
        this.slides = PieceMovements.slides(piece.type());
        this.allowTimeTravel = game.rules().allowTimeTravel;
    }

    @Override
    protected Move computeNext() {
        while(vectorIndex < vectors.length) {
            int[] vector = vectors[vectorIndex];
            if(!allowTimeTravel && !MovementVectors.isOnBoard(vector)) {
                nextVector();
                continue;
            }

            distance++;
            Coordinates to = from.offset(
                    vector[MovementVectors.L] * distance,
                    vector[MovementVectors.T] * 2 * distance,
                    vector[MovementVectors.X] * distance,
                    vector[MovementVectors.Y] * distance);
            Board target = partialGame.getBoard(to);
            if(target == null || !target.contains(to.x(), to.y())) {
                nextVector();
                continue;
            }

            Piece occupant = target.get(to);
            if(occupant == null) {
                if(!slides) {
                    nextVector();
                }
                return Move.of(piece, from, to, null);
            }
            nextVector();
            if(occupant.color() != piece.color()) {
                return Move.of(piece, from, to, occupant);
            }
        }

        if(specialMoves == null) {
            specialMoves = getSpecialMoves(game, partialGame, board, piece, from).iterator();
        }
        return specialMoves.hasNext() ? specialMoves.next() : null;
    }

    private void nextVector() {
        vectorIndex++;
        distance = 0;
    }

    static List<Move> getSpecialMoves(Game game, PartialGame partialGame, Board board, Piece piece, Coordinates from) {
        return switch (piece.type()) {
            case PAWN, BRAWN -> Pawn.getMoves(partialGame, piece, from, game.rules().allowTimeTravel);
            case KING -> game.rules().allowCastling ? King.getCastleMoves(board, piece, from) : Collections.emptyList();
            default -> Collections.emptyList();
        };
    }
}
