package max.chess5d.engine.game;

public final class RulesConfig {

    public static final RulesConfig DEFAULT = new Builder().build();

    public final boolean debug;

    // Moves leaving the source board (other timeline and/or back in time)
    public final boolean allowTimeTravel;
    public final boolean allowCastling;

    // Highest number of timelines a single player may create
    public final int maxTimelines;

    private RulesConfig(Builder b) {
        debug = b.debug;
        allowTimeTravel = b.allowTimeTravel;
        allowCastling = b.allowCastling;
        maxTimelines = b.maxTimelines;
    }

    @Override
    public String toString() {
        return "RulesConfig{" +
                "debug=" + debug +
                ", allowTimeTravel=" + allowTimeTravel +
                ", allowCastling=" + allowCastling +
                ", maxTimelines=" + maxTimelines +
                '}';
    }

    public static class Builder {
        private boolean debug = false;
        private boolean allowTimeTravel = true;
        private boolean allowCastling = true;
        private int maxTimelines = Integer.MAX_VALUE;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder allowTimeTravel(boolean v){allowTimeTravel=v;return this;}
        public Builder allowCastling(boolean v){allowCastling=v;return this;}
        public Builder maxTimelines(int v){
            if(v < 0) {
                throw new IllegalArgumentException("maxTimelines must be positive, got " + v);
            }
            maxTimelines=v;
            return this;
        }

        public RulesConfig build() {
            return new RulesConfig(this);
        }
    }
}
