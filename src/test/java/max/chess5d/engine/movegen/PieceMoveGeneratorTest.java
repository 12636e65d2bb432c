package max.chess5d.engine.movegen;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.Coordinates;
import max.chess5d.engine.common.PieceType;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.PartialGame;
import max.chess5d.engine.game.RulesConfig;
import max.chess5d.engine.game.board.Piece;
import max.chess5d.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PieceMoveGeneratorTest {
    private static final RulesConfig NO_TIME_TRAVEL = new RulesConfig.Builder().allowTimeTravel(false).build();

    @Test
    public void rookInTheCornerOfAnEmptyBoard_shouldHave14Moves() {
        // Given
        Game game = BoardGenerator.from("8/8/8/8/8/8/8/R7", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece rook = Piece.of(PieceType.ROOK, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, rook, new Coordinates(0, 0, 0, 0));

        // Then
        assertEquals(14, moves.size());
        // vector order then increasing distance: along x first, then along y
        assertEquals(new Coordinates(0, 0, 1, 0), moves.get(0).to());
        assertEquals(new Coordinates(0, 0, 7, 0), moves.get(6).to());
        assertEquals(new Coordinates(0, 0, 0, 1), moves.get(7).to());
    }

    @Test
    public void slidingPiece_shouldStopOnItsOwnPieces_andCaptureEnemyOnes() {
        // Given
        // Rook on a1, own pawn on a3, enemy knight on d1
        Game game = BoardGenerator.from("8/8/8/8/8/P7/8/R2n4", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece rook = Piece.of(PieceType.ROOK, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, rook, new Coordinates(0, 0, 0, 0));

        // Then
        // b1, c1, xd1 and a2
        assertEquals(4, moves.size());
        assertEquals(Piece.of(PieceType.KNIGHT, Color.BLACK), moves.get(2).captured());
        assertEquals(new Coordinates(0, 0, 0, 1), moves.get(3).to());
    }

    @Test
    public void knightInTheMiddleOfTheBoard_shouldHave8Moves() {
        // Given
        Game game = BoardGenerator.from("8/8/8/8/3N4/8/8/8");
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        // Time travel is allowed but there is no other board to jump to
        List<Move> moves = generate(game, partialGame, Piece.of(PieceType.KNIGHT, Color.WHITE), new Coordinates(0, 0, 3, 3));

        // Then
        assertEquals(8, moves.size());
        for(Move move : moves) {
            assertFalse(move.isJump());
        }
    }

    @Test
    public void pieceNoLongerOnItsSquare_shouldHaveNoMoveSequence() {
        // Given
        Game game = BoardGenerator.from("8/8/8/8/3N4/8/8/8");
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        PieceMoveGenerator wrongSquare = new PieceMoveGenerator(Piece.of(PieceType.KNIGHT, Color.WHITE), new Coordinates(0, 0, 4, 3));
        PieceMoveGenerator wrongPiece = new PieceMoveGenerator(Piece.of(PieceType.BISHOP, Color.WHITE), new Coordinates(0, 0, 3, 3));
        PieceMoveGenerator wrongBoard = new PieceMoveGenerator(Piece.of(PieceType.KNIGHT, Color.WHITE), new Coordinates(0, 2, 3, 3));

        // Then
        assertTrue(wrongSquare.generateMoves(game, partialGame).isEmpty());
        assertTrue(wrongPiece.generateMoves(game, partialGame).isEmpty());
        assertTrue(wrongBoard.generateMoves(game, partialGame).isEmpty());
    }

    @Test
    public void rook_shouldTravelBackInTime() {
        // Given
        // The rook stands on b1 of the board at turn 2 and the square b1 is empty at turn 0
        Game game = new Game.Builder()
                .board(0, 0, "3")
                .board(0, 1, "1R1")
                .board(0, 2, "1R1")
                .build();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece rook = Piece.of(PieceType.ROOK, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, rook, new Coordinates(0, 2, 1, 0));

        // Then
        // one full turn back, then a1 and c1
        assertEquals(3, moves.size());
        assertEquals(new Coordinates(0, 0, 1, 0), moves.get(0).to());
        assertTrue(moves.get(0).isJump());
        assertEquals(new Coordinates(0, 2, 0, 0), moves.get(1).to());
        assertEquals(new Coordinates(0, 2, 2, 0), moves.get(2).to());
    }

    @Test
    public void king_shouldJumpAndCaptureAcrossTimelines() {
        // Given
        Game game = twoTimelinesGame();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece king = Piece.of(PieceType.KING, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, king, new Coordinates(0, 0, 0, 0));

        // Then
        assertEquals(3, moves.size());
        assertEquals(new Coordinates(1, 0, 0, 0), moves.get(0).to());
        assertEquals(new Coordinates(0, 0, 1, 0), moves.get(1).to());
        assertEquals(new Coordinates(1, 0, 1, 0), moves.get(2).to());
        assertEquals(Piece.of(PieceType.ROOK, Color.BLACK), moves.get(2).captured());
    }

    @Test
    public void unmovedPawn_shouldPushOnceOrTwice_andAlongTimelines() {
        // Given
        Game game = new Game.Builder()
                .board(-1, 0, "1/1/1/1")
                .board(0, 0, "1/1/P*/1")
                .build();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece pawn = Piece.unmoved(PieceType.PAWN, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, pawn, new Coordinates(0, 0, 0, 1));

        // Then
        assertEquals(3, moves.size());
        assertEquals(new Coordinates(0, 0, 0, 2), moves.get(0).to());
        assertEquals(MoveType.NORMAL, moves.get(0).type());
        assertEquals(new Coordinates(0, 0, 0, 3), moves.get(1).to());
        assertEquals(MoveType.PROMOTION, moves.get(1).type());
        assertEquals(new Coordinates(-1, 0, 0, 1), moves.get(2).to());
    }

    @Test
    public void brawn_shouldCaptureSidewaysAcrossTimelines() {
        // Given
        Game game = new Game.Builder()
                .board(-1, 0, "2/2/1n/2")
                .board(0, 0, "2/2/W1/2")
                .build();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece brawn = Piece.of(PieceType.BRAWN, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, brawn, new Coordinates(0, 0, 0, 1));

        // Then
        assertEquals(3, moves.size());
        assertEquals(new Coordinates(0, 0, 0, 2), moves.get(0).to());
        assertEquals(new Coordinates(-1, 0, 0, 1), moves.get(1).to());
        assertEquals(new Coordinates(-1, 0, 1, 1), moves.get(2).to());
        assertEquals(Piece.of(PieceType.KNIGHT, Color.BLACK), moves.get(2).captured());
    }

    @Test
    public void pawnReachingTheLastRank_shouldPromote() {
        // Given
        Game game = BoardGenerator.from("8/4P3/8/8/8/8/8/8");
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        List<Move> moves = generate(game, partialGame, Piece.of(PieceType.PAWN, Color.WHITE), new Coordinates(0, 0, 4, 6));

        // Then
        assertEquals(1, moves.size());
        assertEquals(MoveType.PROMOTION, moves.get(0).type());
        assertEquals("P(0T0)e7-(0T0)e8=Q", moves.get(0).toString());
    }

    @Test
    public void king_shouldCastleOnBothSides() {
        // Given
        Game game = BoardGenerator.from("r*3k*2r*/8/8/8/8/8/8/R*3K*2R*", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece king = Piece.unmoved(PieceType.KING, Color.WHITE);

        // When
        List<Move> moves = generate(game, partialGame, king, new Coordinates(0, 0, 4, 0));

        // Then
        List<Move> castles = moves.stream().filter(Move::isCastle).toList();
        assertEquals(2, castles.size());
        assertEquals(MoveType.CASTLE_KING_SIDE, castles.get(0).type());
        assertEquals(new Coordinates(0, 0, 6, 0), castles.get(0).to());
        assertEquals(MoveType.CASTLE_QUEEN_SIDE, castles.get(1).type());
        assertEquals(new Coordinates(0, 0, 2, 0), castles.get(1).to());
    }

    @Test
    public void king_shouldNotCastleThroughAnAttackedSquare() {
        // Given
        // The black rook on f8 covers f1
        Game game = BoardGenerator.from("r*3kr2/8/8/8/8/8/8/R*3K*2R*", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        List<Move> moves = generate(game, partialGame, Piece.unmoved(PieceType.KING, Color.WHITE), new Coordinates(0, 0, 4, 0));

        // Then
        List<Move> castles = moves.stream().filter(Move::isCastle).toList();
        assertEquals(1, castles.size());
        assertEquals(MoveType.CASTLE_QUEEN_SIDE, castles.get(0).type());
    }

    @Test
    public void castling_shouldBeTurnedOffByTheRules() {
        // Given
        RulesConfig rules = new RulesConfig.Builder().allowCastling(false).build();
        Game game = BoardGenerator.from("r*3k*2r*/8/8/8/8/8/8/R*3K*2R*", 0, rules);
        PartialGame partialGame = PartialGame.noPartialGame(game);

        // When
        List<Move> moves = generate(game, partialGame, Piece.unmoved(PieceType.KING, Color.WHITE), new Coordinates(0, 0, 4, 0));

        // Then
        assertTrue(moves.stream().noneMatch(Move::isCastle));
    }

    @Test
    public void everyGeneratedMove_shouldBeValidated() {
        // Given
        Game game = twoTimelinesGame();
        PartialGame partialGame = PartialGame.noPartialGame(game);
        PieceMoveGenerator rook = new PieceMoveGenerator(Piece.of(PieceType.ROOK, Color.WHITE), new Coordinates(1, 0, 3, 0));
        PieceMoveGenerator king = new PieceMoveGenerator(Piece.of(PieceType.KING, Color.WHITE), new Coordinates(0, 0, 0, 0));

        // When
        List<Move> rookMoves = collect(rook.generateMoves(game, partialGame).orElseThrow());
        List<Move> kingMoves = collect(king.generateMoves(game, partialGame).orElseThrow());

        // Then
        assertEquals(3, rookMoves.size());
        for(Move move : rookMoves) {
            assertTrue(rook.validateMove(game, partialGame, move), move.toString());
        }
        for(Move move : kingMoves) {
            assertTrue(king.validateMove(game, partialGame, move), move.toString());
        }
    }

    @Test
    public void forgedMoves_shouldNotBeValidated() {
        // Given
        Game game = BoardGenerator.from("8/8/8/8/8/P7/8/R2n4", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Piece rook = Piece.of(PieceType.ROOK, Color.WHITE);
        Coordinates a1 = new Coordinates(0, 0, 0, 0);
        PieceMoveGenerator generator = new PieceMoveGenerator(rook, a1);

        // When
        Move diagonal = Move.of(rook, a1, new Coordinates(0, 0, 1, 1), null);
        Move throughOwnPawn = Move.of(rook, a1, new Coordinates(0, 0, 0, 4), null);
        Move ontoOwnPawn = Move.of(rook, a1, new Coordinates(0, 0, 0, 2), Piece.of(PieceType.PAWN, Color.WHITE));
        Move missingCapture = Move.of(rook, a1, new Coordinates(0, 0, 3, 0), null);
        Move wrongPiece = Move.of(Piece.of(PieceType.QUEEN, Color.WHITE), a1, new Coordinates(0, 0, 1, 0), null);
        Move capture = Move.of(rook, a1, new Coordinates(0, 0, 3, 0), Piece.of(PieceType.KNIGHT, Color.BLACK));

        // Then
        assertFalse(generator.validateMove(game, partialGame, diagonal));
        assertFalse(generator.validateMove(game, partialGame, throughOwnPawn));
        assertFalse(generator.validateMove(game, partialGame, ontoOwnPawn));
        assertFalse(generator.validateMove(game, partialGame, missingCapture));
        assertFalse(generator.validateMove(game, partialGame, wrongPiece));
        assertTrue(generator.validateMove(game, partialGame, capture));
    }

    @Test
    public void exhaustedIterator_shouldThrow() {
        // Given
        Game game = BoardGenerator.from("1K1", 0, NO_TIME_TRAVEL);
        PartialGame partialGame = PartialGame.noPartialGame(game);
        Iterator<Move> moves = new PieceMoveGenerator(Piece.of(PieceType.KING, Color.WHITE), new Coordinates(0, 0, 1, 0))
                .generateMoves(game, partialGame).orElseThrow();

        // When
        moves.next();
        moves.next();

        // Then
        assertFalse(moves.hasNext());
        assertThrows(NoSuchElementException.class, moves::next);
    }

    // White king on a1 of timeline 0, black rook on b1 and white rook on d1 of timeline 1
    static Game twoTimelinesGame() {
        return new Game.Builder()
                .board(0, 0, "K3")
                .board(1, 0, "1r1R")
                .build();
    }

    private static List<Move> generate(Game game, PartialGame partialGame, Piece piece, Coordinates position) {
        return collect(new PieceMoveGenerator(piece, position).generateMoves(game, partialGame).orElseThrow());
    }

    static List<Move> collect(Iterator<Move> iterator) {
        List<Move> moves = new ArrayList<>();
        iterator.forEachRemaining(moves::add);
        return moves;
    }
}
