package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

// One square or more along a single axis
public final class Rook {
    public static final int[][] VECTORS = MovementVectors.axisCombinations(1);
    public static final boolean SLIDES = true;

    private Rook() {}
}
