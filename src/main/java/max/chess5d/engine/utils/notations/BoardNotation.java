package max.chess5d.engine.utils.notations;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.common.PieceType;
import max.chess5d.engine.game.board.Board;
import max.chess5d.engine.game.board.DirtyBoard;
import max.chess5d.engine.game.board.Piece;

import java.util.ArrayList;
import java.util.List;

// FEN-like piece placement of a single board: ranks from the top one down separated by '/', runs of empty
// squares as numbers, upper case for white. A '*' after a piece marks it as not moved yet, e.g. "r*3k*2r*/8/..."
public class BoardNotation {

    public static Board parse(String placement, int l, int t) {
        String[] ranks = placement.split("/");
        int height = ranks.length;
        List<List<Piece>> rows = new ArrayList<>(height);
        int width = -1;
        for(String rank : ranks) {
            List<Piece> row = parseRank(rank);
            if(width == -1) {
                width = row.size();
            } else if(row.size() != width) {
                throw new IllegalArgumentException("Rank '" + rank + "' has " + row.size() + " squares, expected " + width);
            }
            rows.add(row);
        }
        if(width <= 0) {
            throw new IllegalArgumentException("Empty board placement '" + placement + "'");
        }

        DirtyBoard board = new DirtyBoard(l, t, width, height);
        for(int i = 0; i < height; i++) {
            // first rank in the notation is the top one
            int y = height - 1 - i;
            List<Piece> row = rows.get(i);
            for(int x = 0; x < width; x++) {
                board.set(x, y, row.get(x));
            }
        }
        return board.toBoard();
    }

    private static List<Piece> parseRank(String rank) {
        List<Piece> row = new ArrayList<>();
        int i = 0;
        while(i < rank.length()) {
            char c = rank.charAt(i);
            if(Character.isDigit(c)) {
                int end = i;
                while(end < rank.length() && Character.isDigit(rank.charAt(end))) {
                    end++;
                }
                int emptySquares = Integer.parseInt(rank.substring(i, end));
                for(int j = 0; j < emptySquares; j++) {
                    row.add(null);
                }
                i = end;
                continue;
            }
            Color color = Character.isUpperCase(c) ? Color.WHITE : Color.BLACK;
            PieceType pieceType = PieceType.fromLetter(c);
            boolean unmoved = i + 1 < rank.length() && rank.charAt(i + 1) == '*';
            row.add(new Piece(pieceType, color, !unmoved));
            i += unmoved ? 2 : 1;
        }
        return row;
    }

    public static String write(Board board) {
        StringBuilder placement = new StringBuilder();
        for(int y = board.height() - 1; y >= 0; y--) {
            if(y != board.height() - 1) {
                placement.append('/');
            }
            int emptySpaceCounter = 0;
            for(int x = 0; x < board.width(); x++) {
                Piece piece = board.get(x, y);
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    placement.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                placement.append(piece);
            }
            if(emptySpaceCounter != 0) {
                placement.append(emptySpaceCounter);
            }
        }
        return placement.toString();
    }
}
