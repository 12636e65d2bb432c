package max.chess5d.engine.moveset;

import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;

import java.util.Iterator;
import java.util.NoSuchElementException;

// Keeps the candidates of a GenMovesetIter which can be played, along with the partial game they lead to
public final class LegalMovesetIterator implements Iterator<LegalMoveset> {
    private final Game game;
    private final PartialGame partialGame;
    private final GenMovesetIter candidates;

    private LegalMoveset nextMoveset;

    public LegalMovesetIterator(GenMovesetIter candidates, Game game, PartialGame partialGame) {
        this.candidates = candidates;
        this.game = game;
        this.partialGame = partialGame;
    }

    public static LegalMovesetIterator of(Game game, PartialGame partialGame) {
        return new LegalMovesetIterator(GenMovesetIter.ownBoards(game, partialGame), game, partialGame);
    }

    @Override
    public boolean hasNext() {
        while(nextMoveset == null && candidates.hasNext()) {
            ValidityResult<Moveset> candidate = candidates.next();
            if(candidate.isErr()) {
                continue;
            }
            Moveset moveset = candidate.get();
            ValidityResult<PartialGame> played = moveset.generatePartialGame(game, partialGame);
            if(played.isOk()) {
                GenMovesetIter.countAccepted();
                nextMoveset = new LegalMoveset(moveset, played.get());
            } else {
                played.error().ifPresent(GenMovesetIter::countRejected);
            }
        }
        return nextMoveset != null;
    }

    @Override
    public LegalMoveset next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        LegalMoveset moveset = nextMoveset;
        nextMoveset = null;
        return moveset;
    }
}
