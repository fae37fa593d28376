package sam.chess.engine.search;

public final class SearchConfig {
    public enum Strategy { RANDOM, GREEDY }

    public final Strategy strategy;
    // null seeds the random source from the clock
    public final Long seed;
    public final boolean debug;
    // Greedy only, scores candidates on the common pool
    public final boolean parallelEvaluation;

    private SearchConfig(Builder b) {
        strategy = b.strategy;
        seed = b.seed;
        debug = b.debug;
        parallelEvaluation = b.parallelEvaluation;
    }

    public Builder toBuilder() {
        return new Builder().strategy(strategy).seed(seed).debug(debug).parallelEvaluation(parallelEvaluation);
    }

    @Override
    public String toString() {
        return "SearchConfig{strategy=" + strategy + ", seed=" + seed + ", debug=" + debug
                + ", parallelEvaluation=" + parallelEvaluation + "}";
    }

    public static class Builder {
        private Strategy strategy = Strategy.GREEDY;
        private Long seed = null;
        private boolean debug = false;
        private boolean parallelEvaluation = false;

        public Builder strategy(Strategy v){strategy=v;return this;}
        public Builder seed(Long v){seed=v;return this;}
        public Builder debug(boolean v){debug=v;return this;}
        public Builder parallelEvaluation(boolean v){parallelEvaluation=v;return this;}

        public SearchConfig build() {
            if (strategy == null) throw new IllegalArgumentException("strategy must be set");
            return new SearchConfig(this);
        }
    }

    /** Reads a strategy name in any case, "random" or "greedy". */
    public static Strategy parseStrategy(String name) {
        return Strategy.valueOf(name.trim().toUpperCase());
    }
}
