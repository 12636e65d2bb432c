package max.chess5d.engine.utils.notations;

import max.chess5d.engine.movegen.Move;
import max.chess5d.engine.movegen.MoveType;

// Readable form of a move, e.g. "N(0T0)b1-(0T0)c3", "P(0T2)e4x(-1T2)e4", "K(0T0)e1-(0T0)g1 O-O"
public class MoveNotation {

    public static String write(Move move) {
        StringBuilder notation = new StringBuilder()
                .append(move.piece().type().letter)
                .append(move.from())
                .append(move.isCapture() ? 'x' : '-')
                .append(move.to());
        if(move.type() == MoveType.PROMOTION) {
            notation.append("=Q");
        } else if(move.type() == MoveType.CASTLE_KING_SIDE) {
            notation.append(" O-O");
        } else if(move.type() == MoveType.CASTLE_QUEEN_SIDE) {
            notation.append(" O-O-O");
        }
        return notation.toString();
    }
}
