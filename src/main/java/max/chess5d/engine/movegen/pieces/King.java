package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.common.PieceType;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.Move;
import max.chess5d.engine.movegen.MoveType;
import max.chess5d.engine.movegen.utils.CheckUtils;
import max.chess5d.engine.movegen.utils.MovementVectors;

import java.util.ArrayList;
import java.util.List;

// Also used by the common king, which cannot castle
public final class King {
    public static final int[][] VECTORS = MovementVectors.concat(
            MovementVectors.axisCombinations(1),
            MovementVectors.axisCombinations(2),
            MovementVectors.axisCombinations(3),
            MovementVectors.axisCombinations(4));
    public static final boolean SLIDES = false;

    private King() {}

    public static List<Move> getCastleMoves(Board board, Piece king, Coordinates kingPosition) {
        List<Move> castleMoves = new ArrayList<>(2);
        if(king.type() != PieceType.KING || king.moved()) {
            return castleMoves;
        }
        int x = kingPosition.x();
        int y = kingPosition.y();
        if(CheckUtils.isAttackedOnBoard(board, x, y, king.color().getOppositeColor())) {
            return castleMoves;
        }

        if(isCastleLegal(board, king, x, y, board.width() - 1, 1)) {
            castleMoves.add(new Move(king, kingPosition, kingPosition.offset(0, 0, 2, 0), null, MoveType.CASTLE_KING_SIDE));
        }
        if(isCastleLegal(board, king, x, y, 0, -1)) {
            castleMoves.add(new Move(king, kingPosition, kingPosition.offset(0, 0, -2, 0), null, MoveType.CASTLE_QUEEN_SIDE));
        }
        return castleMoves;
    }

    // x of the rook after castling, next to the king on the side it came from
    public static int getCastledRookX(Move castle) {
        return castle.type() == MoveType.CASTLE_KING_SIDE ? castle.to().x() - 1 : castle.to().x() + 1;
    }

    public static int getCastlingRookX(Board board, Move castle) {
        return castle.type() == MoveType.CASTLE_KING_SIDE ? board.width() - 1 : 0;
    }

    private static boolean isCastleLegal(Board board, Piece king, int kingX, int y, int rookX, int direction) {
        // The king travels two squares and the rook must stay beyond them
        if((rookX - kingX) * direction <= 2) {
            return false;
        }
        Piece rook = board.get(rookX, y);
        if(rook == null || rook.type() != PieceType.ROOK || rook.color() != king.color() || rook.moved()) {
            return false;
        }
        for(int x = kingX + direction; x != rookX; x += direction) {
            if(!board.isEmpty(x, y)) {
                return false;
            }
        }
        // passage and landing squares
        for(int step = 1; step <= 2; step++) {
            if(CheckUtils.isAttackedOnBoard(board, kingX + step * direction, y, king.color().getOppositeColor())) {
                return false;
            }
        }
        return true;
    }
}
