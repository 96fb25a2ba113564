package RPT.Model;

/**
 * Thresholds decide below which input length the property tester simulates the automaton exactly
 * instead of sampling fragments.
 */
public interface ExactThreshold {
    /** Constant for multi-letter fragments. */
    double DEFAULT_CONSTANT = 12;
    /** Constant used with single-letter fragments only. */
    double SINGLE_LETTER_CONSTANT = 3;

    /**
     * Shortest input length for which sampling is used.
     */
    long threshold(SamplingParameters params);

    String getName();

    String getParam();

    default boolean isShortInput(int n, SamplingParameters params) {
        return n < threshold(params);
    }

    static ExactThreshold standard() {
        return scaled(DEFAULT_CONSTANT);
    }

    /**
     * scaled(c): T = max(c * gamma * ceil(ln gamma), ceil(k / beta))
     * @param constant - factor c applied to gamma * ceil(ln gamma)
     */
    static ExactThreshold scaled(double constant) {
        if (!(constant > 0) || Double.isInfinite(constant)) {
            throw new IllegalArgumentException("threshold constant must be positive and finite: " + constant);
        }
        return new ExactThreshold() {
            @Override
            public long threshold(SamplingParameters params) {
                final double sampled = constant * params.gamma() * params.logGamma();
                final double components = Math.ceil(params.numScc() / params.beta());
                return (long) Math.ceil(Math.max(sampled, components));
            }

            @Override
            public String getName() {
                return "scaled";
            }

            @Override
            public String getParam() {
                return String.valueOf(constant);
            }
        };
    }

    /**
     * alwaysExact(): every input is simulated exactly.
     */
    static ExactThreshold alwaysExact() {
        return new ExactThreshold() {
            @Override
            public long threshold(SamplingParameters params) {
                return Long.MAX_VALUE;
            }

            @Override
            public String getName() {
                return "exact";
            }

            @Override
            public String getParam() {
                return "";
            }
        };
    }

    /**
     * neverExact(): every non-empty input is sampled, however short.
     */
    static ExactThreshold neverExact() {
        return new ExactThreshold() {
            @Override
            public long threshold(SamplingParameters params) {
                return 1;
            }

            @Override
            public String getName() {
                return "sampled";
            }

            @Override
            public String getParam() {
                return "";
            }
        };
    }
}
