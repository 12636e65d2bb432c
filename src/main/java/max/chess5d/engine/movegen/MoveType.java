package max.chess5d.engine.movegen;

public enum MoveType {
    NORMAL,
    // Pawn-like first move of two squares, on the rank or the timeline axis
    DOUBLE_STEP,
    // Pawn-like piece reaching the last rank, always promoted to a queen
    PROMOTION,
    CASTLE_KING_SIDE,
    CASTLE_QUEEN_SIDE;

    public boolean isCastle() {
        return this == CASTLE_KING_SIDE || this == CASTLE_QUEEN_SIDE;
    }
}
