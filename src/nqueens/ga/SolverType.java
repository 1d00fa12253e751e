package nqueens.ga;

import java.util.Locale;

/**
 * The available controllers, with the names the driver accepts.
 */
public enum SolverType {
    GENETIC("Genetic") {
        @Override
        public SolverConfig defaultConfig() {
            return SolverConfig.adamEve();
        }

        @Override
        public AbstractSolver create(SolverConfig config) {
            return new AdamEveSolver(config);
        }
    },
    TOURNAMENT("Tournament") {
        @Override
        public SolverConfig defaultConfig() {
            return SolverConfig.tournament();
        }

        @Override
        public AbstractSolver create(SolverConfig config) {
            return new TournamentSolver(config);
        }
    };

    private final String label;

    SolverType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract SolverConfig defaultConfig();

    public abstract AbstractSolver create(SolverConfig config);

    public AbstractSolver create() {
        return create(defaultConfig());
    }

    /**
     * Accepts "Genetic"/"Tournament" (any case) or "1"/"2".
     */
    public static SolverType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Algorithm name is required");
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals("1") || v.equals("GENETIC") || v.equals("GA")) {
            return GENETIC;
        }
        if (v.equals("2") || v.equals("TOURNAMENT")) {
            return TOURNAMENT;
        }
        throw new IllegalArgumentException("Unknown algorithm: " + value + " (expected Genetic or Tournament)");
    }
}
