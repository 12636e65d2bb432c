package max.chess5d.engine.game;

import max.chess5d.engine.common.Coordinates;

/**
 * Metadata of one timeline.
 *
 * @param index timeline index, negative for timelines created by black
 * @param firstTurn turn index of the first board of the timeline
 * @param lastTurn turn index of the last (playable) board of the timeline
 * @param origin the board the timeline branched from, null for starting timelines
 */
public record TimelineInfo(int index, int firstTurn, int lastTurn, Coordinates origin) {

    public TimelineInfo withLastTurn(int lastTurn) {
        return new TimelineInfo(index, firstTurn, lastTurn, origin);
    }
}
