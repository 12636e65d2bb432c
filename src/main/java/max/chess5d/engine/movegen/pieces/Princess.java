package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.movegen.utils.MovementVectors;

public final class Princess {
    public static final int[][] VECTORS = MovementVectors.concat(Rook.VECTORS, Bishop.VECTORS);
    public static final boolean SLIDES = true;

    private Princess() {}
}
