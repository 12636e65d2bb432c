package max.chess5d.engine.game;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.utils.notations.BoardNotation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PartialGameTest {

    // Timeline 0 from turn 0 to 2, timeline 1 from turn 1 to 2, timeline 2 at turn 1 only
    private static Game threeTimelinesGame() {
        return new Game.Builder()
                .board(0, 0, "K")
                .board(0, 1, "K")
                .board(0, 2, "K")
                .origin(1, new Coordinates(0, 0, 0, 0))
                .board(1, 1, "1")
                .board(1, 2, "1")
                .origin(2, new Coordinates(0, 0, 0, 0))
                .board(2, 1, "1")
                .build();
    }

    @Test
    public void noPartialGame_shouldReadEverythingFromTheGame() {
        // Given
        Game game = threeTimelinesGame();

        // When
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // Then
        assertNull(partialGame.parent());
        assertEquals(0, partialGame.depth());
        assertSame(game, partialGame.game());
        assertEquals(Color.WHITE, partialGame.activePlayer());
        assertSame(game.getBoard(0, 1), partialGame.getBoard(0, 1));
        assertNull(partialGame.getBoard(0, 3));
        assertTrue(partialGame.newBoards().isEmpty());
        assertEquals(0, partialGame.minTimeline());
        assertEquals(2, partialGame.maxTimeline());
    }

    @Test
    public void timelines_shouldOnlyBeActiveWhileTheOpponentKeepsUp() {
        // Given
        PartialGame partialGame = PartialGame.noPartialGame(threeTimelinesGame());

        // Then
        assertEquals(2, partialGame.whiteTimelinesCreated());
        assertEquals(0, partialGame.blackTimelinesCreated());
        assertTrue(partialGame.isActive(0));
        assertTrue(partialGame.isActive(1));
        assertFalse(partialGame.isActive(2));
        assertFalse(partialGame.isActive(-1));
        // the inactive timeline 2 does not hold the present back
        assertEquals(2, partialGame.present());
    }

    @Test
    public void ownBoards_shouldBeTheActivePlayableBoards() {
        // Given
        Game game = threeTimelinesGame();
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        List<Board> ownBoards = partialGame.ownBoards();

        // Then
        assertEquals(List.of(game.getBoard(0, 2), game.getBoard(1, 2)), ownBoards);
        assertTrue(partialGame.isPlayable(game.getBoard(0, 2)));
        // past board
        assertFalse(partialGame.isPlayable(game.getBoard(0, 1)));
        // black board
        assertFalse(partialGame.isPlayable(game.getBoard(2, 1)));
        assertEquals(2, partialGame.playableBoards().size());
    }

    @Test
    public void ownBoards_shouldOnlyHoldBoardsAtThePresent() {
        // Given
        // Timeline -1 waits at turn 0 while timeline 0 already reached turn 2
        Game game = new Game.Builder()
                .board(0, 0, "K3")
                .board(0, 1, "K3")
                .board(0, 2, "K3")
                .origin(-1, new Coordinates(0, 0, 0, 0))
                .board(-1, 0, "3K")
                .build();
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        List<Board> ownBoards = partialGame.ownBoards();

        // Then
        assertTrue(partialGame.isActive(-1));
        assertTrue(partialGame.isActive(0));
        assertEquals(0, partialGame.present());
        assertEquals(List.of(game.getBoard(-1, 0)), ownBoards);
        assertEquals(List.of(game.getBoard(-1, 0), game.getBoard(0, 2)), partialGame.playableBoards());
        assertTrue(partialGame.isPlayable(game.getBoard(0, 2)));
    }

    @Test
    public void derive_shouldExtendTimelinesWithoutTouchingTheGame() {
        // Given
        Game game = threeTimelinesGame();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Board next = BoardNotation.parse("1", 0, 3);

        // When
        PartialGame derived = partialGame.derive(List.of(next), Int2ObjectMaps.emptyMap());

        // Then
        assertSame(partialGame, derived.parent());
        assertEquals(1, derived.depth());
        assertEquals(Color.BLACK, derived.activePlayer());
        assertSame(next, derived.getBoard(0, 3));
        assertSame(game.getBoard(0, 2), derived.getBoard(0, 2));
        assertEquals(3, derived.timeline(0).lastTurn());
        assertTrue(derived.isLastBoard(next));
        assertFalse(derived.isLastBoard(game.getBoard(0, 2)));

        assertNull(game.getBoard(0, 3));
        assertEquals(2, game.timeline(0).lastTurn());
        assertNull(partialGame.getBoard(0, 3));
        assertEquals(2, partialGame.timeline(0).lastTurn());
    }

    @Test
    public void derive_shouldCreateTimelinesFromTheirOrigin() {
        // Given
        PartialGame partialGame = PartialGame.noPartialGame(threeTimelinesGame());
        Coordinates origin = new Coordinates(0, 0, 0, 0);
        Int2ObjectMap<Coordinates> origins = new Int2ObjectOpenHashMap<>();
        origins.put(3, origin);

        // When
        PartialGame derived = partialGame.derive(List.of(BoardNotation.parse("K", 3, 1)), origins);

        // Then
        TimelineInfo timeline = derived.timeline(3);
        assertEquals(new TimelineInfo(3, 1, 1, origin), timeline);
        assertEquals(3, derived.maxTimeline());
        assertNull(partialGame.timeline(3));
    }

    @Test
    public void overlays_shouldChain() {
        // Given
        PartialGame partialGame = PartialGame.noPartialGame(threeTimelinesGame());
        Board first = BoardNotation.parse("1", 0, 3);
        Board second = BoardNotation.parse("K", 0, 4);

        // When
        PartialGame derived = partialGame.derive(List.of(first), Int2ObjectMaps.emptyMap())
                .derive(List.of(second), Int2ObjectMaps.emptyMap());

        // Then
        assertEquals(2, derived.depth());
        assertEquals(Color.WHITE, derived.activePlayer());
        assertSame(first, derived.getBoard(0, 3));
        assertSame(second, derived.getBoard(0, 4));
        assertEquals(List.of(second), List.copyOf(derived.newBoards()));
    }

    @Test
    public void derive_shouldRejectInconsistentBoards() {
        // Given
        PartialGame partialGame = PartialGame.noPartialGame(threeTimelinesGame());

        // Then
        // already played
        assertThrows(IllegalStateException.class,
                () -> partialGame.derive(List.of(BoardNotation.parse("1", 0, 2)), Int2ObjectMaps.emptyMap()));
        // a turn is skipped
        assertThrows(IllegalStateException.class,
                () -> partialGame.derive(List.of(BoardNotation.parse("1", 0, 4)), Int2ObjectMaps.emptyMap()));
        // new timeline without origin
        assertThrows(IllegalStateException.class,
                () -> partialGame.derive(List.of(BoardNotation.parse("1", -1, 1)), Int2ObjectMaps.emptyMap()));
    }
}
