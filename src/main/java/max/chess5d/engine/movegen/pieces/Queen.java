package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

// Also used by the royal queen
public final class Queen {
    public static final int[][] VECTORS = MovementVectors.concat(Rook.VECTORS, Bishop.VECTORS, Unicorn.VECTORS, Dragon.VECTORS);
    public static final boolean SLIDES = true;

    private Queen() {}
}
