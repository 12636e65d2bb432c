package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

// Equal distance along two axes
public final class Bishop {
    public static final int[][] VECTORS = MovementVectors.axisCombinations(2);
    public static final boolean SLIDES = true;

    private Bishop() {}
}
