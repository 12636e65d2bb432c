package max.chess5d.engine.game.board;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.PieceType;

public record Piece(PieceType type, Color color, boolean moved) {

    public static Piece of(PieceType type, Color color) {
        return new Piece(type, color, true);
    }

    public static Piece unmoved(PieceType type, Color color) {
        return new Piece(type, color, false);
    }

    public Piece withMoved() {
        return moved ? this : new Piece(type, color, true);
    }

    public boolean isRoyal() {
        return type.royal;
    }

    public char letter() {
        return color == Color.WHITE ? type.letter : Character.toLowerCase(type.letter);
    }

    @Override
    public String toString() {
        return moved ? String.valueOf(letter()) : letter() + "*";
    }
}
