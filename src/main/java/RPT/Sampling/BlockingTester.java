package RPT.Sampling;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import RPT.AutomatonGraph;
import RPT.StateSet;

/**
 * Decides whether a set of fragments is blocking for an automaton, i.e. whether no final state
 * can be reached by any word that agrees with the input on every sampled position.
 * <p>
 * Positions covered by no fragment are unconstrained; a single star closure accounts for a gap of
 * any length, since starReach is idempotent. The resulting state set over-approximates the states
 * reachable on the real input, so a member of the language is never blocking.
 */
public class BlockingTester {
    private BlockingTester() {
    }

    /**
     * @param fragments - sampled fragments, in any order
     * @param automaton - automaton to test against
     * @param n - length of the input word
     * @return true if the fragments are blocking (reject), false otherwise (accept)
     */
    public static <I> boolean isBlocking(List<Fragment<I>> fragments, AutomatonGraph<I> automaton, int n) {
        final List<Fragment<I>> sorted = new ArrayList<>(fragments);
        sorted.sort(Comparator.comparingInt(Fragment::start));

        StateSet reachable = automaton.initialStates();
        int fragIdx = 0;
        int pos = 0;
        while (pos < n) {
            if (reachable.isEmpty()) {
                // nothing can be reached anymore
                return true;
            }
            if (fragIdx >= sorted.size() || sorted.get(fragIdx).start() >= n) {
                // unobserved suffix
                reachable = automaton.starReach(reachable);
                break;
            }
            final Fragment<I> current = sorted.get(fragIdx);
            if (pos < current.start()) {
                reachable = automaton.starReach(reachable);
                pos = current.start();
            } else if (pos < current.end()) {
                reachable = automaton.letterReach(reachable, current.symbolAt(pos));
                pos++;
            } else {
                fragIdx++;
            }
        }

        return !reachable.intersects(automaton.finalStates());
    }
}
