package max.chess5d.engine.movegen;

import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.utils.notations.MoveNotation;

/**
 * @param piece the moving piece, as it stands on its source square
 * @param from source square
 * @param to destination square, possibly on another board
 * @param captured the piece standing on the destination square, null when it is empty
 * @param type special move flag
 */
public record Move(Piece piece, Coordinates from, Coordinates to, Piece captured, MoveType type) {

    public static Move of(Piece piece, Coordinates from, Coordinates to, Piece captured) {
        return new Move(piece, from, to, captured, MoveType.NORMAL);
    }

    public boolean isCapture() {
        return captured != null;
    }

    // The piece leaves its board, towards another timeline and/or back in time
    public boolean isJump() {
        return !from.isOnSameBoard(to);
    }

    public boolean isCastle() {
        return type.isCastle();
    }

    @Override
    public String toString() {
        return MoveNotation.write(this);
    }
}
