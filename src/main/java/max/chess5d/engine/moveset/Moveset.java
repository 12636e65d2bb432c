package max.chess5d.engine.moveset;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.common.PieceType;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.DirtyBoard;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.movegen.BoardMoveGenerator;
import max.chess5d.engine.movegen.Move;
import max.chess5d.engine.movegen.MoveType;
import max.chess5d.engine.movegen.pieces.King;
import max.chess5d.engine.movegen.utils.CheckUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complete candidate turn: one move per board the player has to play.
 * <p>
 * Building a moveset with {@link #of} only checks how the moves are spread over the boards. Whether the
 * moves are legal and leave no royal piece capturable is only known from {@link #generatePartialGame}.
 */
public final class Moveset {
    private final List<Move> moves;

    private Moveset(List<Move> moves) {
        this.moves = moves;
    }

    public static ValidityResult<Moveset> of(List<Move> moves, Game game, PartialGame partialGame) {
        MovesetValidityErr error = checkBoards(moves, partialGame);
        if(error != null) {
            return ValidityResult.err(error);
        }
        return ValidityResult.ok(new Moveset(Collections.unmodifiableList(new ArrayList<>(moves))));
    }

    public List<Move> moves() {
        return moves;
    }

    public int size() {
        return moves.size();
    }

    /**
     * Plays the moveset on top of {@code partialGame}.
     *
     * @return the resulting partial game, in which the opponent is to move, or the reason the moveset is rejected
     */
    public ValidityResult<PartialGame> generatePartialGame(Game game, PartialGame partialGame) {
        MovesetValidityErr error = checkBoards(moves, partialGame);
        if(error != null) {
            return ValidityResult.err(error);
        }

        for(Move move : moves) {
            Board source = partialGame.getBoard(move.from());
            if(!new BoardMoveGenerator(source).validateMove(game, partialGame, move)) {
                return ValidityResult.err(MovesetValidityErr.ILLEGAL_MOVE);
            }
        }

        Color mover = partialGame.activePlayer();
        Long2ObjectLinkedOpenHashMap<DirtyBoard> successors = new Long2ObjectLinkedOpenHashMap<>();
        Int2ObjectMap<Coordinates> newTimelineOrigins = new Int2ObjectOpenHashMap<>();
        int nextWhiteTimeline = partialGame.maxTimeline() + 1;
        int nextBlackTimeline = partialGame.minTimeline() - 1;

        for(Move move : moves) {
            Coordinates from = move.from();
            Coordinates to = move.to();
            DirtyBoard source = getSuccessor(successors, partialGame.getBoard(from));
            source.remove(from.x(), from.y());

            if(!move.isJump()) {
                playOnBoard(source, partialGame.getBoard(from), move);
                continue;
            }

            Board target = partialGame.getBoard(to);
            DirtyBoard destination;
            if(partialGame.isLastBoard(target)) {
                destination = getSuccessor(successors, target);
            } else {
                // landing on a past board branches off a new timeline
                int newTimeline = mover == Color.WHITE ? nextWhiteTimeline++ : nextBlackTimeline--;
                if(Math.abs(newTimeline) > game.rules().maxTimelines || partialGame.timeline(newTimeline) != null) {
                    return ValidityResult.err(MovesetValidityErr.INCONSISTENT_TIMELINE_CREATION);
                }
                destination = target.dirtyCopy(newTimeline, to.t() + 1);
                successors.put(destination.boardKey(), destination);
                newTimelineOrigins.put(newTimeline, to);
            }
            destination.set(to.x(), to.y(), movedPiece(move));
        }

        List<Board> newBoards = new ArrayList<>(successors.size());
        for(DirtyBoard successor : successors.values()) {
            newBoards.add(successor.toBoard());
        }
        PartialGame next = partialGame.derive(newBoards, newTimelineOrigins);

        if(CheckUtils.canCaptureRoyal(game, next, mover.getOppositeColor(), mover)) {
            return ValidityResult.err(MovesetValidityErr.KING_IN_CHECK);
        }
        if(game.rules().debug) {
            DebugChecks.assertMovesetPlayed(partialGame, next, this);
        }
        return ValidityResult.ok(next);
    }

    // Boards consumed by a moveset: every source board, and the last boards reached by a jump
    private static MovesetValidityErr checkBoards(List<Move> moves, PartialGame partialGame) {
        List<Board> ownBoards = partialGame.ownBoards();
        if(moves.isEmpty()) {
            return ownBoards.isEmpty() ? null : MovesetValidityErr.NO_MOVES;
        }

        LongSet consumed = new LongOpenHashSet(moves.size() * 2);
        for(Move move : moves) {
            Board source = partialGame.getBoard(move.from());
            if(source == null || !partialGame.isPlayable(source)) {
                return MovesetValidityErr.ILLEGAL_MOVE;
            }
            if(!consumed.add(source.boardKey())) {
                return MovesetValidityErr.DUPLICATE_OR_MISSING_BOARD;
            }
            if(move.isJump()) {
                Board target = partialGame.getBoard(move.to());
                if(target != null && partialGame.isLastBoard(target) && !consumed.add(target.boardKey())) {
                    return MovesetValidityErr.DUPLICATE_OR_MISSING_BOARD;
                }
            }
        }
        for(Board ownBoard : ownBoards) {
            if(!consumed.contains(ownBoard.boardKey())) {
                return MovesetValidityErr.DUPLICATE_OR_MISSING_BOARD;
            }
        }
        return null;
    }

    private static DirtyBoard getSuccessor(Long2ObjectLinkedOpenHashMap<DirtyBoard> successors, Board board) {
        DirtyBoard successor = successors.get(board.boardKey());
        if(successor == null) {
            successor = board.dirtyCopy(board.l(), board.t() + 1);
            successors.put(board.boardKey(), successor);
        }
        return successor;
    }

    private static void playOnBoard(DirtyBoard successor, Board board, Move move) {
        Coordinates to = move.to();
        successor.set(to.x(), to.y(), movedPiece(move));
        if(move.isCastle()) {
            int rookX = King.getCastlingRookX(board, move);
            Piece rook = successor.remove(rookX, to.y());
            if(rook == null) {
                throw new IllegalStateException("No rook to castle with at " + rookX + " on " + move);
            }
            successor.set(King.getCastledRookX(move), to.y(), rook.withMoved());
        }
    }

    private static Piece movedPiece(Move move) {
        if(move.type() == MoveType.PROMOTION) {
            return Piece.of(PieceType.QUEEN, move.piece().color());
        }
        return move.piece().withMoved();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        return o instanceof Moveset other && moves.equals(other.moves);
    }

    @Override
    public int hashCode() {
        return moves.hashCode();
    }

    @Override
    public String toString() {
        return "Moveset" + moves;
    }
}
