package RPT.Sampling;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import RPT.Model.SamplingParameters;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws the random fragments read by the property tester.
 * <p>
 * lambda single letters, then for every doubling level i, alpha_i fragments of length 2^(i+1).
 * Every start is drawn independently and uniformly in [0, n), with replacement; fragments running
 * past the end of the word are cut at n.
 * The number of fragments depends on the parameters only, never on n.
 */
public class FragmentScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentScheduler.class);

    private final Random random;

    public FragmentScheduler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public <I> List<Fragment<I>> schedule(Word<I> u, SamplingParameters params) {
        final int n = u.length();
        if (n <= 0) {
            throw new IllegalArgumentException("cannot sample fragments of an empty word");
        }
        final long total = params.totalFragments();
        if (total > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("too many fragments to sample: " + total);
        }

        final List<Fragment<I>> fragments = new ArrayList<>((int) total);
        final long lambda = params.lambda();
        for (long j = 0; j < lambda; j++) {
            fragments.add(Fragment.of(u, random.nextInt(n), 1));
        }

        for (int i = 0; i < params.levels(); i++) {
            final long length = SamplingParameters.fragmentLength(i);
            final long alpha = params.alpha(i);
            for (long j = 0; j < alpha; j++) {
                fragments.add(Fragment.of(u, random.nextInt(n), length));
            }
        }

        LOGGER.debug("Scheduled {} fragments over {} levels for n={}", fragments.size(), params.levels(), n);
        return fragments;
    }
}
