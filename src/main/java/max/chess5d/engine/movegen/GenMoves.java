package max.chess5d.engine.movegen;

import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;

import java.util.Iterator;
import java.util.Optional;

/**
 * Anything able to produce candidate moves for the player to move: a whole board or a single piece.
 *
 * @param <I> type of the lazy move sequence
 */
public interface GenMoves<I extends Iterator<Move>> {

    /**
     * Returns a lazy, one-shot sequence of moves, or nothing when this generator no longer matches the
     * overlay (the board was superseded, the piece left its square).
     */
    Optional<I> generateMoves(Game game, PartialGame partialGame);

    /**
     * Checks a single move without enumerating every candidate.
     */
    boolean validateMove(Game game, PartialGame partialGame, Move move);
}
