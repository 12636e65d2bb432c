package max.chess5d.engine.movegen;

import java.util.Iterator;
import java.util.NoSuchElementException;

// Move iterator computing one move ahead, subclasses return null from computeNext() once exhausted
public abstract class LazyMoveIterator implements Iterator<Move> {
    private Move nextMove;
    private boolean exhausted = false;

    protected abstract Move computeNext();

    @Override
    public boolean hasNext() {
        if(nextMove == null && !exhausted) {
            nextMove = computeNext();
            exhausted = nextMove == null;
        }
        return nextMove != null;
    }

    @Override
    public Move next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        Move move = nextMove;
        nextMove = null;
        return move;
    }
}
