package max.chess5d.engine.moveset;

import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.movegen.BoardMoveGenerator;
import max.chess5d.engine.movegen.BoardMoveIterator;
import max.chess5d.engine.movegen.CacheMoves;
import max.chess5d.engine.movegen.Move;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Enumerates every combination of one move per board, as an odometer whose digits are the boards and whose
 * bases are their (lazily discovered) move counts. The last board varies fastest and the first one slowest.
 * <p>
 * Moves are pulled from each board only when a combination needs them, and cached so that a digit can rewind
 * without generating its moves again. Combinations are only checked for how they spread over the boards:
 * king safety is left to {@link Moveset#generatePartialGame}, see {@link LegalMovesetIterator}.
 */
public final class GenMovesetIter implements Iterator<ValidityResult<Moveset>> {
    public static long CANDIDATES = 0;
    public static long ACCEPTED = 0;
    public static final long[] REJECTED = new long[MovesetValidityErr.values().length];

    private final Game game;
    private final PartialGame partialGame;
    private final List<CacheMoves<BoardMoveIterator>> digits;
    private final int[] cursors;

    private boolean started = false;
    private boolean exhausted = false;
    // set once a candidate is emitted, the cursors move on only when the next one is asked for
    private boolean advancePending = false;

    public GenMovesetIter(List<Board> ownBoards, Game game, PartialGame partialGame) {
        this.game = game;
        this.partialGame = partialGame;
        this.digits = new ArrayList<>(ownBoards.size());
        this.cursors = new int[ownBoards.size()];
        for(Board board : ownBoards) {
            Optional<CacheMoves<BoardMoveIterator>> digit = CacheMoves.of(new BoardMoveGenerator(board), game, partialGame);
            if(digit.isEmpty()) {
                // a superseded board has no move, hence no combination
                exhausted = true;
                break;
            }
            digits.add(digit.get());
        }
    }

    public static GenMovesetIter ownBoards(Game game, PartialGame partialGame) {
        return new GenMovesetIter(partialGame.ownBoards(), game, partialGame);
    }

    @Override
    public boolean hasNext() {
        if(!started) {
            started = true;
            if(digits.isEmpty()) {
                exhausted = true;
            }
            for(int i = 0; i < digits.size() && !exhausted; i++) {
                if(digits.get(i).get(0).isEmpty()) {
                    exhausted = true;
                }
            }
        } else if(advancePending) {
            advancePending = false;
            advance();
        }
        return !exhausted;
    }

    @Override
    public ValidityResult<Moveset> next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        List<Move> moves = new ArrayList<>(digits.size());
        for(int i = 0; i < digits.size(); i++) {
            int digit = i;
            moves.add(digits.get(i).get(cursors[i])
                    .orElseThrow(() -> new IllegalStateException("Cursor " + cursors[digit] + " of board " + digit + " past its moves")));
        }
        advancePending = true;

        CANDIDATES++;
        ValidityResult<Moveset> candidate = Moveset.of(moves, game, partialGame);
        candidate.error().ifPresent(GenMovesetIter::countRejected);
        return candidate;
    }

    // Increments the last digit, an exhausted digit goes back to its first move and carries to the previous one
    private void advance() {
        for(int i = cursors.length - 1; i >= 0; i--) {
            cursors[i]++;
            if(digits.get(i).get(cursors[i]).isPresent()) {
                return;
            }
            // the cache mirrors a fresh sequence of the board, reading it again from 0 rewinds the digit
            cursors[i] = 0;
        }
        exhausted = true;
    }

    // Current move index of every board, first board first
    public int[] cursors() {
        return cursors.clone();
    }

    // Number of moves pulled so far from every board, first board first
    public int[] generatedMoves() {
        int[] generated = new int[digits.size()];
        for(int i = 0; i < generated.length; i++) {
            generated[i] = digits.get(i).cachedCount();
        }
        return generated;
    }

    static void countAccepted() {
        ACCEPTED++;
    }

    static void countRejected(MovesetValidityErr error) {
        REJECTED[error.ordinal()]++;
    }

    public static void printGeneratorReport() {
        System.out.println("********************");
        System.out.println("MOVESET GENERATOR REPORT");
        System.out.println("\tCANDIDATES: " + CANDIDATES);
        System.out.println("\tACCEPTED: " + ACCEPTED);
        for(MovesetValidityErr error : MovesetValidityErr.values()) {
            System.out.println("\tREJECTED " + error + ": " + REJECTED[error.ordinal()]);
        }
        System.out.println("********************");
    }

    public static void clearGeneratorReport() {
        CANDIDATES = 0;
        ACCEPTED = 0;
        Arrays.fill(REJECTED, 0);
    }
}
