package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

// Equal distance along all four axes
public final class Dragon {
    public static final int[][] VECTORS = MovementVectors.axisCombinations(4);
    public static final boolean SLIDES = true;

    private Dragon() {}
}
