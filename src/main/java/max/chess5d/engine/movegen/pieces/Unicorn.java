package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

// Equal distance along three axes
public final class Unicorn {
    public static final int[][] VECTORS = MovementVectors.axisCombinations(3);
    public static final boolean SLIDES = true;

    private Unicorn() {}
}
