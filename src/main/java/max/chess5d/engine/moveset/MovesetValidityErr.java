package max.chess5d.engine.moveset;

// Why a candidate turn was rejected. Always recoverable: the caller moves on to the next candidate
public enum MovesetValidityErr {
    // No move at all while boards are waiting to be played
    NO_MOVES,
    // A board played or landed on twice, or a board that had to be played left untouched
    DUPLICATE_OR_MISSING_BOARD,
    // A move which its piece cannot make, or made from a board that cannot be played
    ILLEGAL_MOVE,
    // Once played, a royal piece of the mover can be captured somewhere in the multiverse
    KING_IN_CHECK,
    // A new timeline that cannot be created (index already taken, timeline limit reached)
    INCONSISTENT_TIMELINE_CREATION
}
