package RPT;

import java.util.List;
import java.util.Objects;
import java.util.Random;

import RPT.Model.ExactThreshold;
import RPT.Model.SamplingParameters;
import RPT.Sampling.BlockingTester;
import RPT.Sampling.Fragment;
import RPT.Sampling.FragmentScheduler;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * eps-property tester for regular languages (Bathie and Starikovskaya, 2020).
 * <p>
 * Returns true for every word of the language. Returns false with probability at least
 * 1 - errorProba for every word at edit distance at least eps * n from the language.
 * For words strictly in between, either answer may be returned.
 * <p>
 * Short words, below the {@link ExactThreshold}, are simulated exactly.
 */
public class PropertyTester {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertyTester.class);

    private final ExactThreshold threshold;
    private final FragmentScheduler scheduler;

    public PropertyTester(Random random) {
        this(ExactThreshold.standard(), random);
    }

    public PropertyTester(ExactThreshold threshold, Random random) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.scheduler = new FragmentScheduler(random);
    }

    public static <I> boolean propertyTest(AutomatonGraph<I> automaton, Word<I> u,
                                           double eps, double errorProba, Random random) {
        return new PropertyTester(random).test(automaton, u, eps, errorProba);
    }

    /**
     * @param automaton - automaton defining the language
     * @param u - input word
     * @param eps - distance fraction, in (0,1]
     * @param errorProba - probability of accepting a far word, in (0,1]
     * @return - true if u may belong to the language, false if u is certainly not a member
     */
    public <I> boolean test(AutomatonGraph<I> automaton, Word<I> u, double eps, double errorProba) {
        checkProbability("eps", eps);
        checkProbability("errorProba", errorProba);

        final int n = u.length();
        final int m = automaton.numStates();
        if (m == 0) {
            return false;
        }
        final int k = automaton.numScc();
        final SamplingParameters params = SamplingParameters.derive(k, m, eps, errorProba);

        if (threshold.isShortInput(n, params)) {
            LOGGER.debug("n={} below {} threshold {}, simulating exactly", n, threshold.getName(), threshold.threshold(params));
            return automaton.accepts(u);
        }

        LOGGER.debug("n={}, m={}, k={}: beta={}, gamma={}, lambda={}, levels={}",
            n, m, k, params.beta(), params.gamma(), params.lambda(), params.levels());
        final List<Fragment<I>> fragments = scheduler.schedule(u, params);
        return !BlockingTester.isBlocking(fragments, automaton, n);
    }

    public ExactThreshold getThreshold() {
        return threshold;
    }

    private static void checkProbability(String name, double value) {
        if (!(value > 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " must be in (0,1]: " + value);
        }
    }
}
