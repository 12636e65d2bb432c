package max.chess5d.engine.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // Boards alternate colors along a timeline: white plays on even turn indexes, black on odd ones
    public static Color toMoveAt(int turn) {
        return Math.floorMod(turn, 2) == 0 ? WHITE : BLACK;
    }

    // Direction of a forward step on the rank axis
    public int rankForward() {
        return this == WHITE ? 1 : -1;
    }

    // Direction of a forward step on the timeline axis, white pawns head towards black's timelines
    public int timelineForward() {
        return this == WHITE ? -1 : 1;
    }
}
