package max.chess5d.engine.movegen;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;

import java.util.Iterator;
import java.util.Optional;

/**
 * Wraps a move iterator and remembers every move it yields, so that the same sequence can be read again,
 * indexed or searched without generating it twice. The cache only grows, in iteration order.
 *
 * @param <I> type of the wrapped iterator
 */
public final class CacheMoves<I extends Iterator<Move>> implements Iterator<Move> {
    public static long CACHE_HIT = 0;
    public static long CACHE_MISS = 0;

    private final I iterator;
    private final ObjectArrayList<Move> cache = new ObjectArrayList<>();

    public CacheMoves(I iterator) {
        this.iterator = iterator;
    }

    /**
     * Creates a cache over the moves of {@code generator}, or nothing when the generator has no sequence to offer.
     */
    public static <I extends Iterator<Move>> Optional<CacheMoves<I>> of(GenMoves<I> generator, Game game,
                                                                       PartialGame partialGame) {
        return generator.generateMoves(game, partialGame).map(CacheMoves::new);
    }

    @Override
    public boolean hasNext() {
        return iterator.hasNext();
    }

    // Yields the next move of the wrapped iterator and caches it
    @Override
    public Move next() {
        Move move = iterator.next();
        cache.add(move);
        return move;
    }

    /**
     * Looks for the move among the moves yielded so far, without querying the iterator.
     * Returning false doesn't mean the move is invalid, only that it wasn't generated yet:
     * {@link #validateMove(Move)} gives a definitive answer.
     */
    public boolean validateMoveCached(Move move) {
        return cache.contains(move);
    }

    /**
     * Looks for the move in the cache, then consumes the iterator until the move is found or the
     * iterator is exhausted. Prefer {@link GenMoves#validateMove} for one-off checks.
     */
    public boolean validateMove(Move move) {
        if(validateMoveCached(move)) {
            CACHE_HIT++;
            return true;
        }
        CACHE_MISS++;
        while(hasNext()) {
            if(next().equals(move)) {
                return true;
            }
        }
        return false;
    }

    // n-th move of the sequence if it was already yielded, the iterator is not queried
    public Optional<Move> getCached(int n) {
        if(n >= 0 && n < cache.size()) {
            return Optional.of(cache.get(n));
        }
        return Optional.empty();
    }

    // n-th move of the sequence, consuming the iterator up to it when it is not cached yet
    public Optional<Move> get(int n) {
        if(n >= 0 && n < cache.size()) {
            CACHE_HIT++;
            return Optional.of(cache.get(n));
        }
        CACHE_MISS++;
        while(n >= cache.size() && hasNext()) {
            next();
        }
        return getCached(n);
    }

    public ObjectList<Move> cachedMoves() {
        return ObjectLists.unmodifiable(cache);
    }

    public int cachedCount() {
        return cache.size();
    }

    public static void printCacheReport() {
        System.out.println("********************");
        System.out.println("MOVE CACHE REPORT");
        System.out.println("\tHIT: " + CACHE_HIT);
        System.out.println("\tMISS: " + CACHE_MISS);
        System.out.println("********************");
    }

    public static void clearCacheReport() {
        CACHE_HIT = 0;
        CACHE_MISS = 0;
    }
}
