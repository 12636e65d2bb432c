package max.chess5d.engine.game.board;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.utils.notations.BoardNotation;

import java.util.Arrays;

// Boards are never mutated once built, every move produces fresh boards through a DirtyBoard
public final class Board {
    private final int l;
    private final int t;
    private final int width;
    private final int height;
    // null means empty square, indexed by x + y * width
    private final Piece[] pieces;

    Board(int l, int t, int width, int height, Piece[] pieces) {
        if(pieces.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " squares, got " + pieces.length);
        }
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

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int size() {
        return pieces.length;
    }

    public long boardKey() {
        return Coordinates.boardKey(l, t);
    }

    // Color of the player who moves on this board
    public Color activeColor() {
        return Color.toMoveAt(t);
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public Piece get(int x, int y) {
        return pieces[x + y * width];
    }

    public Piece get(int squareIndex) {
        return pieces[squareIndex];
    }

    public Piece get(Coordinates coordinates) {
        return get(coordinates.x(), coordinates.y());
    }

    public boolean isEmpty(int x, int y) {
        return get(x, y) == null;
    }

    public Coordinates coordinatesOf(int squareIndex) {
        return new Coordinates(l, t, squareIndex % width, squareIndex / width);
    }

    public DirtyBoard dirtyCopy(int l, int t) {
        return new DirtyBoard(l, t, width, height, pieces.clone());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Board other)) {
            return false;
        }
        return l == other.l && t == other.t && width == other.width && height == other.height
                && Arrays.equals(pieces, other.pieces);
    }

    @Override
    public int hashCode() {
        int result = 31 * Long.hashCode(boardKey()) + width;
        result = 31 * result + height;
        return 31 * result + Arrays.hashCode(pieces);
    }

    @Override
    public String toString() {
        return "Board{" + "l=" + l + ", t=" + t + ", " + BoardNotation.write(this) + '}';
    }
}
