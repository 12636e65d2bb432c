package max.chess5d.engine.moveset;

import max.chess5d.engine.game.PartialGame;

/**
 * @param moveset an accepted turn
 * @param partialGame the multiverse once the turn is played
 */
public record LegalMoveset(Moveset moveset, PartialGame partialGame) {
}
