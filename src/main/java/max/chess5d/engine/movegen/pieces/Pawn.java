package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.common.PieceType;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.Move;
import max.chess5d.engine.movegen.MoveType;

import java.util.ArrayList;
import java.util.List;

// Pawns and brawns. Forward is the rank axis (towards the opponent's back rank) and the timeline axis
// (towards the opponent's timelines). Time steps are full turns, hence +-2 on the turn index.
public final class Pawn {
    private Pawn() {}

    public static List<Move> getMoves(PartialGame partialGame, Piece pawn, Coordinates from, boolean allowTimeTravel) {
        List<Move> moves = new ArrayList<>();
        Color color = pawn.color();
        int forward = color.rankForward();
        int timelineForward = color.timelineForward();

        // pushes
        addPush(moves, partialGame, pawn, from, 0, forward);
        if(allowTimeTravel) {
            addPush(moves, partialGame, pawn, from, timelineForward, 0);
        }

        // captures on the board
        addCapture(moves, partialGame, pawn, from, from.offset(0, 0, -1, forward));
        addCapture(moves, partialGame, pawn, from, from.offset(0, 0, 1, forward));

        if(allowTimeTravel) {
            // captures across timelines, one turn back or forward
            addCapture(moves, partialGame, pawn, from, from.offset(timelineForward, -2, 0, 0));
            addCapture(moves, partialGame, pawn, from, from.offset(timelineForward, 2, 0, 0));
        }

        if(pawn.type() == PieceType.BRAWN) {
            addBrawnCaptures(moves, partialGame, pawn, from, allowTimeTravel);
        }
        return moves;
    }

    private static void addBrawnCaptures(List<Move> moves, PartialGame partialGame, Piece brawn, Coordinates from,
                                         boolean allowTimeTravel) {
        if(!allowTimeTravel) {
            return;
        }
        int forward = brawn.color().rankForward();
        int timelineForward = brawn.color().timelineForward();

        // rank forward combined with a time step
        addCapture(moves, partialGame, brawn, from, from.offset(0, -2, 0, forward));
        addCapture(moves, partialGame, brawn, from, from.offset(0, 2, 0, forward));
        // timeline forward combined with a file step
        addCapture(moves, partialGame, brawn, from, from.offset(timelineForward, 0, -1, 0));
        addCapture(moves, partialGame, brawn, from, from.offset(timelineForward, 0, 1, 0));
        // both forward axes
        addCapture(moves, partialGame, brawn, from, from.offset(timelineForward, 0, 0, forward));
    }

    private static void addPush(List<Move> moves, PartialGame partialGame, Piece pawn, Coordinates from, int dl, int dy) {
        Coordinates to = from.offset(dl, 0, 0, dy);
        if(!isEmptySquare(partialGame, to)) {
            return;
        }
        moves.add(new Move(pawn, from, to, null, isLastRank(partialGame, pawn, to) ? MoveType.PROMOTION : MoveType.NORMAL));

        if(!pawn.moved()) {
            Coordinates doubleStep = to.offset(dl, 0, 0, dy);
            if(isEmptySquare(partialGame, doubleStep)) {
                moves.add(new Move(pawn, from, doubleStep, null,
                        isLastRank(partialGame, pawn, doubleStep) ? MoveType.PROMOTION : MoveType.DOUBLE_STEP));
            }
        }
    }

    private static void addCapture(List<Move> moves, PartialGame partialGame, Piece pawn, Coordinates from, Coordinates to) {
        Board board = partialGame.getBoard(to);
        if(board == null || !board.contains(to.x(), to.y())) {
            return;
        }
        Piece target = board.get(to);
        if(target != null && target.color() != pawn.color()) {
            moves.add(new Move(pawn, from, to, target,
                    isLastRank(partialGame, pawn, to) ? MoveType.PROMOTION : MoveType.NORMAL));
        }
    }

    private static boolean isEmptySquare(PartialGame partialGame, Coordinates coordinates) {
        Board board = partialGame.getBoard(coordinates);
        return board != null && board.contains(coordinates.x(), coordinates.y()) && board.get(coordinates) == null;
    }

    private static boolean isLastRank(PartialGame partialGame, Piece pawn, Coordinates to) {
        int lastRank = pawn.color() == Color.WHITE ? partialGame.game().height() - 1 : 0;
        return to.y() == lastRank;
    }
}
