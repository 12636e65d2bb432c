package max.chess5d.engine.moveset;

import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.movegen.Move;

final class DebugChecks {
    private DebugChecks() {}

    static void assertMovesetPlayed(PartialGame before, PartialGame after, Moveset moveset) {
        if(after.parent() != before || after.activePlayer() != before.activePlayer().getOppositeColor()) {
            throw new IllegalStateException("Partial game not derived from the one the moveset was played on");
        }
        for(Move move : moveset.moves()) {
            Board successor = after.getBoard(move.from().l(), move.from().t() + 1);
            if(successor == null || !after.isLastBoard(successor)) {
                throw new IllegalStateException("Board played by " + move + " has no successor");
            }
            if(successor.get(move.from()) != null && !move.isCastle()) {
                throw new IllegalStateException("Piece still on its source square after " + move);
            }
        }
        for(Board ownBoard : before.ownBoards()) {
            if(after.isLastBoard(ownBoard)) {
                throw new IllegalStateException("Board " + ownBoard.l() + "T" + ownBoard.t() + " was not played");
            }
        }
    }
}
