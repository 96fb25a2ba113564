package RPT.Model;

/**
 * Parameters of the property tester derived from the automaton structure and the requested precision.
 *
 * @param eps - distance fraction: words at edit distance >= eps * n must be rejected
 * @param errorProba - allowed probability of accepting such a word
 * @param numStates - m, number of automaton states
 * @param numScc - k, number of strongly connected components
 * @param beta - eps / (6m)
 * @param gamma - ceil(2 / beta), saturating at Long.MAX_VALUE
 * @param logGamma - ceil(ln gamma)
 * @param logConfidence - ln(6 * k * 2^k / errorProba)
 * @param levels - ceil(log2 gamma), number of doubling levels of fragment lengths
 */
public record SamplingParameters(double eps,
                                 double errorProba,
                                 int numStates,
                                 int numScc,
                                 double beta,
                                 long gamma,
                                 int logGamma,
                                 double logConfidence,
                                 int levels) {

    public static SamplingParameters derive(int numScc, int numStates, double eps, double errorProba) {
        if (numStates <= 0 || numScc <= 0 || numScc > numStates) {
            throw new IllegalArgumentException(
                "invalid automaton shape: " + numStates + " states, " + numScc + " components");
        }
        if (!(eps > 0 && eps <= 1) || !(errorProba > 0 && errorProba <= 1)) {
            throw new IllegalArgumentException("eps and errorProba must be in (0,1]: " + eps + ", " + errorProba);
        }
        final double beta = eps / (6.0 * numStates);
        // 2 / beta, with a single rounding
        final long gamma = (long) Math.ceil(12.0 * numStates / eps);
        final int logGamma = (int) Math.ceil(Math.log(gamma));
        // ln(6k * 2^k / p), without computing 2^k
        final double logConfidence = Math.log(6.0 * numScc / errorProba) + numScc * Math.log(2);
        final int levels = 64 - Long.numberOfLeadingZeros(gamma - 1);
        return new SamplingParameters(eps, errorProba, numStates, numScc, beta, gamma, logGamma, logConfidence, levels);
    }

    /**
     * Number of unit-length fragments, saturating at Long.MAX_VALUE.
     */
    public long lambda() {
        return (long) Math.ceil(2 * logConfidence / beta);
    }

    /**
     * Number of fragments of length 2^(level+1), saturating at Long.MAX_VALUE.
     */
    public long alpha(int level) {
        if (level < 0 || level >= levels) {
            throw new IndexOutOfBoundsException("level " + level + " not in [0, " + levels + ")");
        }
        return (long) Math.ceil(3 * logConfidence * gamma * logGamma / (double) (1L << level));
    }

    /**
     * 2^(level+1), saturating at Long.MAX_VALUE from level 62 on.
     */
    public static long fragmentLength(int level) {
        if (level < 0) {
            throw new IndexOutOfBoundsException("negative level " + level);
        }
        return level >= Long.SIZE - 2 ? Long.MAX_VALUE : 2L << level;
    }

    /**
     * Sum of lambda and every alpha_i, saturating at Long.MAX_VALUE.
     */
    public long totalFragments() {
        long total = lambda();
        for (int i = 0; i < levels; i++) {
            try {
                total = Math.addExact(total, alpha(i));
            } catch (ArithmeticException ex) {
                return Long.MAX_VALUE;
            }
        }
        return total;
    }
}
