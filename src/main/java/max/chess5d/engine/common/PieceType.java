package max.chess5d.engine.common;

public enum PieceType {
    PAWN('P', false),
    BRAWN('W', false),
    KNIGHT('N', false),
    BISHOP('B', false),
    ROOK('R', false),
    QUEEN('Q', false),
    KING('K', true),
    UNICORN('U', false),
    DRAGON('D', false),
    PRINCESS('S', false),
    COMMON_KING('C', false),
    ROYAL_QUEEN('Y', true);

    public static final PieceType[] VALUES = PieceType.values();

    public final char letter;
    // Royal pieces are the ones a player must never leave capturable
    public final boolean royal;

    PieceType(char letter, boolean royal) {
        this.letter = letter;
        this.royal = royal;
    }

    public boolean isPawnLike() {
        return this == PAWN || this == BRAWN;
    }

    public static PieceType fromLetter(char letter) {
        char upper = Character.toUpperCase(letter);
        for(PieceType pieceType : VALUES) {
            if(pieceType.letter == upper) {
                return pieceType;
            }
        }
        throw new IllegalArgumentException("Unknown piece letter " + letter);
    }
}
