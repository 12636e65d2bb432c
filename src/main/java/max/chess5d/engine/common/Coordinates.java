package max.chess5d.engine.common;

/**
 * A square on a given board of the multiverse.
 *
 * @param l timeline index
 * @param t turn index, counted in half-moves
 * @param x file
 * @param y rank
 */
public record Coordinates(int l, int t, int x, int y) {

    public static long boardKey(int l, int t) {
        return ((long) l << 32) | (t & 0xFFFFFFFFL);
    }

    public long boardKey() {
        return boardKey(l, t);
    }

    public boolean isOnSameBoard(Coordinates other) {
        return l == other.l && t == other.t;
    }

    public Coordinates offset(int dl, int dt, int dx, int dy) {
        return new Coordinates(l + dl, t + dt, x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + l + "T" + t + ")" + (char) ('a' + x) + (y + 1);
    }
}
