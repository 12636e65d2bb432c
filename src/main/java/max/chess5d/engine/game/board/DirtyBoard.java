package max.chess5d.engine.game.board;

import max.chess5d.engine.common.Coordinates;

// A scratch board used while playing a moveset or reading a board notation.
// It is frozen into an immutable Board with toBoard() and must not be touched afterwards
public final class DirtyBoard {
    private final int l;
    private final int t;
    private final int width;
    private final int height;
    private final Piece[] pieces;

    public DirtyBoard(int l, int t, int width, int height) {
        this(l, t, width, height, new Piece[width * height]);
    }

    DirtyBoard(int l, int t, int width, int height, Piece[] pieces) {
        this.l = l;
        this.t = t;
        this.width = width;
        this.height = height;
        this.pieces = pieces;
    }

    public int l() {
        return l;
    }

    public int t() {
        return t;
    }

    public long boardKey() {
        return Coordinates.boardKey(l, t);
    }

    public Piece get(int x, int y) {
        return pieces[x + y * width];
    }

    public void set(int x, int y, Piece piece) {
        pieces[x + y * width] = piece;
    }

    public Piece remove(int x, int y) {
        Piece removed = pieces[x + y * width];
        pieces[x + y * width] = null;
        return removed;
    }

    public Board toBoard() {
        return new Board(l, t, width, height, pieces.clone());
    }
}
