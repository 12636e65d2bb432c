package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

public final class Knight {
    public static final int[][] VECTORS = MovementVectors.knightJumps();
    public static final boolean SLIDES = false;

    private Knight() {}
}
