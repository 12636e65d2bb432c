package max.chess5d.engine.game;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.utils.notations.BoardNotation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Baseline state of a multiverse game: dimensions, player to move, every board played so far and
 * the timelines they belong to. Built once from parsed input and read-only afterwards, tentative
 * moves live in {@link PartialGame} overlays.
 */
public final class Game {
    private final int width;
    private final int height;
    private final Color activePlayer;
    private final RulesConfig rules;
    private final Long2ObjectMap<Board> boards;
    private final Int2ObjectSortedMap<TimelineInfo> timelines;

    private Game(Builder builder, Long2ObjectMap<Board> boards, Int2ObjectSortedMap<TimelineInfo> timelines) {
        this.width = builder.width;
        this.height = builder.height;
        this.activePlayer = builder.activePlayer;
        this.rules = builder.rules;
        this.boards = boards;
        this.timelines = Int2ObjectSortedMaps.unmodifiable(timelines);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public Color activePlayer() {
        return activePlayer;
    }

    public RulesConfig rules() {
        return rules;
    }

    public Board getBoard(int l, int t) {
        return boards.get(Coordinates.boardKey(l, t));
    }

    public Collection<Board> boards() {
        return Collections.unmodifiableCollection(boards.values());
    }

    public TimelineInfo timeline(int l) {
        return timelines.get(l);
    }

    // Sorted by timeline index
    public Int2ObjectSortedMap<TimelineInfo> timelines() {
        return timelines;
    }

    public int minTimeline() {
        return timelines.firstIntKey();
    }

    public int maxTimeline() {
        return timelines.lastIntKey();
    }

    public static class Builder {
        private int width = -1;
        private int height = -1;
        private Color activePlayer = Color.WHITE;
        private RulesConfig rules = RulesConfig.DEFAULT;
        private final List<Board> boards = new ArrayList<>();
        private final Int2ObjectMap<Coordinates> origins = new Int2ObjectOpenHashMap<>();

        public Builder activePlayer(Color v){activePlayer=v;return this;}
        public Builder rules(RulesConfig v){rules=v;return this;}
        public Builder origin(int l, Coordinates v){origins.put(l, v);return this;}

        public Builder board(Board board) {
            if(width == -1) {
                width = board.width();
                height = board.height();
            } else if(board.width() != width || board.height() != height) {
                throw new IllegalArgumentException("Board " + board.l() + "T" + board.t() + " is "
                        + board.width() + "x" + board.height() + ", expected " + width + "x" + height);
            }
            boards.add(board);
            return this;
        }

        public Builder board(int l, int t, String placement) {
            return board(BoardNotation.parse(placement, l, t));
        }

        public Game build() {
            if(boards.isEmpty()) {
                throw new IllegalStateException("A game needs at least one board");
            }

            Long2ObjectMap<Board> boardMap = new Long2ObjectOpenHashMap<>(boards.size());
            Int2ObjectSortedMap<TimelineInfo> timelineMap = new Int2ObjectRBTreeMap<>();
            for(Board board : boards) {
                if(boardMap.put(board.boardKey(), board) != null) {
                    throw new IllegalStateException("Two boards at " + board.l() + "T" + board.t());
                }
                TimelineInfo timeline = timelineMap.get(board.l());
                if(timeline == null) {
                    timelineMap.put(board.l(), new TimelineInfo(board.l(), board.t(), board.t(), origins.get(board.l())));
                } else {
                    timelineMap.put(board.l(), new TimelineInfo(board.l(), Math.min(timeline.firstTurn(), board.t()),
                            Math.max(timeline.lastTurn(), board.t()), timeline.origin()));
                }
            }

            // A timeline is a contiguous run of turns
            for(TimelineInfo timeline : timelineMap.values()) {
                for(int t = timeline.firstTurn(); t <= timeline.lastTurn(); t++) {
                    if(!boardMap.containsKey(Coordinates.boardKey(timeline.index(), t))) {
                        throw new IllegalStateException("Timeline " + timeline.index() + " has no board at turn " + t);
                    }
                }
            }
            return new Game(this, boardMap, timelineMap);
        }
    }
}
