package max.chess5d.engine.game.board.utils;

import max.chess5d.engine.common.Color;
import max.chess5d.engine.game.Game;
import max.chess5d.engine.game.RulesConfig;

public class BoardGenerator {
    public static final String STANDARD_BOARD = "r*nbqk*bnr*/p*p*p*p*p*p*p*p*/8/8/8/8/P*P*P*P*P*P*P*P*/R*NBQK*BNR*";

    public static Game newStandardGame() {
        return newStandardGame(RulesConfig.DEFAULT);
    }

    public static Game newStandardGame(RulesConfig rules) {
        return new Game.Builder()
                .rules(rules)
                .activePlayer(Color.WHITE)
                .board(0, 0, STANDARD_BOARD)
                .build();
    }

    // One board on a single timeline, the color to move follows from the turn index
    public static Game from(String placement, int t, RulesConfig rules) {
        return new Game.Builder()
                .rules(rules)
                .activePlayer(Color.toMoveAt(t))
                .board(0, t, placement)
                .build();
    }

    public static Game from(String placement) {
        return from(placement, 0, RulesConfig.DEFAULT);
    }
}
