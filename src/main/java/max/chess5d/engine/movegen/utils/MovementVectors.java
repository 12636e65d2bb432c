package max.chess5d.engine.movegen.utils;

import java.util.ArrayList;
import java.util.List;

// Movement vectors are {dl, dt, dx, dy}, dt being counted in full turns (two boards of a timeline)
public final class MovementVectors {
    public static final int L = 0;
    public static final int T = 1;
    public static final int X = 2;
    public static final int Y = 3;
    public static final int AXES = 4;

    private MovementVectors() {}

    // Every unit vector moving along exactly `axes` axes, axis sets ordered l, t, x, y, negative sign first
    public static int[][] axisCombinations(int axes) {
        List<int[]> vectors = new ArrayList<>();
        for(int mask = 0b1111; mask > 0; mask--) {
            if(Integer.bitCount(mask) != axes) {
                continue;
            }
            for(int signs = 0; signs < (1 << axes); signs++) {
                int[] vector = new int[AXES];
                int signIndex = 0;
                for(int axis = 0; axis < AXES; axis++) {
                    if((mask & (0b1000 >> axis)) != 0) {
                        vector[axis] = (signs & (1 << (axes - 1 - signIndex))) == 0 ? -1 : 1;
                        signIndex++;
                    }
                }
                vectors.add(vector);
            }
        }
        return vectors.toArray(new int[0][]);
    }

    // Two steps along one axis and one along another
    public static int[][] knightJumps() {
        List<int[]> vectors = new ArrayList<>();
        for(int longAxis = 0; longAxis < AXES; longAxis++) {
            for(int shortAxis = 0; shortAxis < AXES; shortAxis++) {
                if(longAxis == shortAxis) {
                    continue;
                }
                for(int longSign = -1; longSign <= 1; longSign += 2) {
                    for(int shortSign = -1; shortSign <= 1; shortSign += 2) {
                        int[] vector = new int[AXES];
                        vector[longAxis] = 2 * longSign;
                        vector[shortAxis] = shortSign;
                        vectors.add(vector);
                    }
                }
            }
        }
        return vectors.toArray(new int[0][]);
    }

    public static int[][] concat(int[][]... tables) {
        List<int[]> vectors = new ArrayList<>();
        for(int[][] table : tables) {
            vectors.addAll(List.of(table));
        }
        return vectors.toArray(new int[0][]);
    }

    public static boolean contains(int[][] table, int dl, int dt, int dx, int dy) {
        for(int[] vector : table) {
            if(vector[L] == dl && vector[T] == dt && vector[X] == dx && vector[Y] == dy) {
                return true;
            }
        }
        return false;
    }

    public static boolean isOnBoard(int[] vector) {
        return vector[L] == 0 && vector[T] == 0;
    }
}
