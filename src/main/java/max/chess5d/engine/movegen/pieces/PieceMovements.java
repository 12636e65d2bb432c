package max.chess5d.engine.movegen.pieces;

import max.chess5d.engine.common.PieceType;

public final class PieceMovements {
    private static final int[][] NO_VECTORS = new int[0][];

    private PieceMovements() {}

    // Pawn-like pieces have no vector, all their moves are special moves
    public static int[][] vectors(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN, BRAWN -> NO_VECTORS;
            case KNIGHT -> Knight.VECTORS;
            case BISHOP -> Bishop.VECTORS;
            case ROOK -> Rook.VECTORS;
            case QUEEN, ROYAL_QUEEN -> Queen.VECTORS;
            case KING, COMMON_KING -> King.VECTORS;
            case UNICORN -> Unicorn.VECTORS;
            case DRAGON -> Dragon.VECTORS;
            case PRINCESS -> Princess.VECTORS;
        };
    }

    public static boolean slides(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN, BRAWN -> false;
            case KNIGHT -> Knight.SLIDES;
            case BISHOP -> Bishop.SLIDES;
            case ROOK -> Rook.SLIDES;
            case QUEEN, ROYAL_QUEEN -> Queen.SLIDES;
            case KING, COMMON_KING -> King.SLIDES;
            case UNICORN -> Unicorn.SLIDES;
            case DRAGON -> Dragon.SLIDES;
            case PRINCESS -> Princess.SLIDES;
        };
    }
}
