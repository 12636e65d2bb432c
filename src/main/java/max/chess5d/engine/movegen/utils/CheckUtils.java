package max.chess5d.engine.movegen.utils;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.TimelineInfo;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.BoardMoveGenerator;
import max.chess5d.engine.movegen.Move;
import max.chess5d.engine.movegen.pieces.PieceMovements;

import java.util.Iterator;

public final class CheckUtils {
    public static int KING_SAFETY_SCANS = 0;
    public static int KING_CAPTURES_FOUND = 0;

    private CheckUtils() {}

    /**
     * Whether a royal piece of {@code victim} could be captured by a move of {@code attacker}, on any board the
     * attacker may play on, whatever the timeline. Moves jumping to other timelines or to the past count too.
     */
    public static boolean canCaptureRoyal(Game game, PartialGame partialGame, Color attacker, Color victim) {
        KING_SAFETY_SCANS++;
        for(TimelineInfo timeline : partialGame.timelines().values()) {
            Board board = partialGame.getBoard(timeline.index(), timeline.lastTurn());
            if(board.activeColor() != attacker) {
                continue;
            }
            Iterator<Move> moves = new BoardMoveGenerator(board).generateMoves(game, partialGame)
                    .orElseThrow(() -> new IllegalStateException("Last board of timeline " + timeline.index()
                            + " is missing from the partial game"));
            while(moves.hasNext()) {
                Piece captured = moves.next().captured();
                if(captured != null && captured.isRoyal() && captured.color() == victim) {
                    KING_CAPTURES_FOUND++;
                    return true;
                }
            }
        }
        return false;
    }

    // Whether a piece of the given color could move to (x, y) without leaving the board, as if it was its turn
    public static boolean isAttackedOnBoard(Board board, int x, int y, Color by) {
        for(int squareIndex = 0; squareIndex < board.size(); squareIndex++) {
            Piece piece = board.get(squareIndex);
            if(piece == null || piece.color() != by) {
                continue;
            }
            int pieceX = squareIndex % board.width();
            int pieceY = squareIndex / board.width();
            if(attacksOnBoard(board, piece, pieceX, pieceY, x, y)) {
                return true;
            }
        }
        return false;
    }

    private static boolean attacksOnBoard(Board board, Piece piece, int pieceX, int pieceY, int x, int y) {
        int dx = x - pieceX;
        int dy = y - pieceY;
        if(dx == 0 && dy == 0) {
            return false;
        }
        if(piece.type().isPawnLike()) {
            return Math.abs(dx) == 1 && dy == piece.color().rankForward();
        }

        int[][] vectors = PieceMovements.vectors(piece.type());
        if(!PieceMovements.slides(piece.type())) {
            return MovementVectors.contains(vectors, 0, 0, dx, dy);
        }

        int distance = Math.max(Math.abs(dx), Math.abs(dy));
        if((dx != 0 && Math.abs(dx) != distance) || (dy != 0 && Math.abs(dy) != distance)) {
            return false;
        }
        int ux = dx / distance;
        int uy = dy / distance;
        if(!MovementVectors.contains(vectors, 0, 0, ux, uy)) {
            return false;
        }
        for(int step = 1; step < distance; step++) {
            if(!board.isEmpty(pieceX + ux * step, pieceY + uy * step)) {
                return false;
            }
        }
        return true;
    }

    public static void printChecksReport() {
        System.out.println("*************************");
        System.out.println("CHECK REPORT");
        System.out.println("KING SAFETY SCANS: " + KING_SAFETY_SCANS);
        System.out.println("KING CAPTURES FOUND: " + KING_CAPTURES_FOUND);
        System.out.println("*************************");
    }

    public static void clearChecksReport() {
        KING_SAFETY_SCANS = 0;
        KING_CAPTURES_FOUND = 0;
    }
}
