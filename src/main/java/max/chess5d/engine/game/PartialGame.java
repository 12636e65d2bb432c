package max.chess5d.engine.game;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.board.Board;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Speculative view of the multiverse for the turn being built.
 * <p>
 * An overlay owns the boards produced by its own moveset and falls back to its parent overlay, then to the
 * {@link Game}, for every other board. It never writes through to either of them. Timeline metadata is kept
 * whole in every overlay as there are few timelines compared to boards.
 */
public final class PartialGame {
    private final Game game;
    private final PartialGame parent;
    private final Color activePlayer;
    private final Long2ObjectMap<Board> boards;
    private final Int2ObjectSortedMap<TimelineInfo> timelines;
    private final int depth;

    private List<Board> ownBoards;

    private PartialGame(Game game, PartialGame parent, Color activePlayer, Long2ObjectMap<Board> boards,
                        Int2ObjectSortedMap<TimelineInfo> timelines) {
        this.game = game;
        this.parent = parent;
        this.activePlayer = activePlayer;
        this.boards = boards;
        this.timelines = Int2ObjectSortedMaps.unmodifiable(timelines);
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    // Starting point of every turn enumeration: no tentative move, every board is read from the game
    public static PartialGame noPartialGame(Game game) {
        return new PartialGame(game, null, game.activePlayer(), new Long2ObjectLinkedOpenHashMap<>(),
                new Int2ObjectRBTreeMap<>(game.timelines()));
    }

    /**
     * Builds the overlay following this one once the given boards are played. The color to move switches.
     *
     * @param newBoards boards produced by the moveset, each one extending its timeline by one turn
     * @param newTimelineOrigins origin of every timeline created by the moveset, keyed by timeline index
     */
    public PartialGame derive(Collection<Board> newBoards, Int2ObjectMap<Coordinates> newTimelineOrigins) {
        Long2ObjectMap<Board> derivedBoards = new Long2ObjectLinkedOpenHashMap<>(newBoards.size());
        Int2ObjectSortedMap<TimelineInfo> derivedTimelines = new Int2ObjectRBTreeMap<>(timelines);

        for(Board board : newBoards) {
            if(getBoard(board.l(), board.t()) != null || derivedBoards.put(board.boardKey(), board) != null) {
                throw new IllegalStateException("Board " + board.l() + "T" + board.t() + " already exists");
            }
            TimelineInfo timeline = derivedTimelines.get(board.l());
            if(timeline == null) {
                Coordinates origin = newTimelineOrigins.get(board.l());
                if(origin == null) {
                    throw new IllegalStateException("Timeline " + board.l() + " created without origin");
                }
                derivedTimelines.put(board.l(), new TimelineInfo(board.l(), board.t(), board.t(), origin));
            } else if(timeline.lastTurn() + 1 == board.t()) {
                derivedTimelines.put(board.l(), timeline.withLastTurn(board.t()));
            } else {
                throw new IllegalStateException("Board " + board.l() + "T" + board.t()
                        + " does not extend timeline ending at turn " + timeline.lastTurn());
            }
        }

        return new PartialGame(game, this, activePlayer.getOppositeColor(), derivedBoards, derivedTimelines);
    }

    public Game game() {
        return game;
    }

    // null for the overlay built by noPartialGame
    public PartialGame parent() {
        return parent;
    }

    // Number of movesets separating this overlay from the game
    public int depth() {
        return depth;
    }

    public Color activePlayer() {
        return activePlayer;
    }

    public Board getBoard(int l, int t) {
        Board board = boards.get(Coordinates.boardKey(l, t));
        if(board != null) {
            return board;
        }
        return parent != null ? parent.getBoard(l, t) : game.getBoard(l, t);
    }

    public Board getBoard(Coordinates coordinates) {
        return getBoard(coordinates.l(), coordinates.t());
    }

    // Boards owned by this overlay, in the order the moveset produced them
    public Collection<Board> newBoards() {
        return Collections.unmodifiableCollection(boards.values());
    }

    public TimelineInfo timeline(int l) {
        return timelines.get(l);
    }

    public Int2ObjectSortedMap<TimelineInfo> timelines() {
        return timelines;
    }

    public int minTimeline() {
        return timelines.firstIntKey();
    }

    public int maxTimeline() {
        return timelines.lastIntKey();
    }

    public int whiteTimelinesCreated() {
        return Math.max(0, maxTimeline());
    }

    public int blackTimelinesCreated() {
        return Math.max(0, -minTimeline());
    }

    // Timelines only stay active while the other player has created about as many
    public boolean isActive(int l) {
        TimelineInfo timeline = timelines.get(l);
        if(timeline == null) {
            return false;
        }
        return Math.abs(l) <= Math.min(whiteTimelinesCreated(), blackTimelinesCreated()) + 1;
    }

    public boolean isLastBoard(Board board) {
        TimelineInfo timeline = timelines.get(board.l());
        return timeline != null && timeline.lastTurn() == board.t();
    }

    // Turn index of the earliest last board among active timelines
    public int present() {
        int present = Integer.MAX_VALUE;
        for(TimelineInfo timeline : timelines.values()) {
            if(isActive(timeline.index())) {
                present = Math.min(present, timeline.lastTurn());
            }
        }
        return present;
    }

    public boolean isPlayable(Board board) {
        return board.activeColor() == activePlayer && isLastBoard(board)
                && board.equals(getBoard(board.l(), board.t()));
    }

    // Last boards of every timeline on which the player to move may play
    public List<Board> playableBoards() {
        List<Board> playable = new ArrayList<>();
        for(TimelineInfo timeline : timelines.values()) {
            Board last = getBoard(timeline.index(), timeline.lastTurn());
            if(last.activeColor() == activePlayer) {
                playable.add(last);
            }
        }
        return playable;
    }

    // Boards the player to move has to play on this turn, by increasing timeline index. Playable boards
    // ahead of the present may be played too but are never mandatory
    public List<Board> ownBoards() {
        if(ownBoards == null) {
            int present = present();
            List<Board> own = new ArrayList<>();
            for(Board board : playableBoards()) {
                if(isActive(board.l()) && board.t() == present) {
                    own.add(board);
                }
            }
            ownBoards = Collections.unmodifiableList(own);
        }
        return ownBoards;
    }

    @Override
    public String toString() {
        return "PartialGame{" +
                "depth=" + depth +
                ", activePlayer=" + activePlayer +
                ", newBoards=" + boards.size() +
                ", timelines=" + timelines.size() +
                '}';
    }
}
