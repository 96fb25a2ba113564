package RPT;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.automaton.concept.StateIDs;
import net.automatalib.automaton.fsa.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nondeterministic finite automaton over states {@code 0 .. numStates-1}.
 * Labels can be of any type; they are compared with {@link Object#equals(Object)}.
 * <p>
 * States are fixed at construction; transitions, initial and final states are added incrementally.
 * The number of strongly connected components is cached and only recomputed after the transition
 * relation changes.
 * <p>
 * Not thread-safe while mutable. After {@link #freeze()} the instance rejects mutation and may be
 * shared between concurrent readers.
 *
 * @param <I> - Input symbol type, e.g., Character
 */
public class AutomatonGraph<I> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonGraph.class);

    private final int numStates;
    private final StateSet initialStates;
    private final StateSet finalStates;
    // adjacency list, keyed by source state
    private final List<List<Transition<I>>> transitions;
    private int numTransitions;

    private OptionalInt sccCount = OptionalInt.empty();
    private boolean frozen;

    public AutomatonGraph(int numStates) {
        if (numStates < 0) {
            throw new IllegalArgumentException("numStates < 0: " + numStates);
        }
        this.numStates = numStates;
        this.initialStates = new StateSet(numStates);
        this.finalStates = new StateSet(numStates);
        this.transitions = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            transitions.add(new ArrayList<>());
        }
    }

    /**
     * Copy an AutomataLib NFA. States are numbered by {@link NFA#stateIDs()}.
     * @param nfa - Original NFA
     * @param inputs - Input symbols whose transitions are copied
     * @return - AutomatonGraph accepting the same language over inputs
     */
    public static <S, I> AutomatonGraph<I> fromNFA(NFA<S, I> nfa, Collection<? extends I> inputs) {
        final StateIDs<S> ids = nfa.stateIDs();
        final AutomatonGraph<I> result = new AutomatonGraph<>(nfa.size());
        final Set<S> inits = nfa.getInitialStates();

        for (S s : nfa.getStates()) {
            final int id = ids.getStateId(s);
            if (inits.contains(s)) {
                result.setInitial(id);
            }
            if (nfa.isAccepting(s)) {
                result.setFinal(id);
            }
            for (I i : inputs) {
                for (S t : nfa.getTransitions(s, i)) {
                    result.addTransition(id, i, ids.getStateId(t));
                }
            }
        }
        return result;
    }

    public int numStates() {
        return numStates;
    }

    public int numTransitions() {
        return numTransitions;
    }

    public void addTransition(int from, I label, int to) {
        checkMutable();
        Objects.checkIndex(from, numStates);
        Objects.checkIndex(to, numStates);
        transitions.get(from).add(new Transition<>(label, to));
        numTransitions++;
        sccCount = OptionalInt.empty();
    }

    public void setInitial(int state) {
        checkMutable();
        initialStates.set(Objects.checkIndex(state, numStates));
    }

    public void setFinal(int state) {
        checkMutable();
        finalStates.set(Objects.checkIndex(state, numStates));
    }

    public boolean isInitial(int state) {
        return initialStates.get(Objects.checkIndex(state, numStates));
    }

    public boolean isFinal(int state) {
        return finalStates.get(Objects.checkIndex(state, numStates));
    }

    /**
     * Linear in the out-degree of {@code from}.
     */
    public boolean isTransition(int from, I label, int to) {
        Objects.checkIndex(from, numStates);
        Objects.checkIndex(to, numStates);
        for (Transition<I> t : transitions.get(from)) {
            if (t.target() == to && Objects.equals(t.label(), label)) {
                return true;
            }
        }
        return false;
    }

    public StateSet initialStates() {
        return initialStates.copy();
    }

    public StateSet finalStates() {
        return finalStates.copy();
    }

    /**
     * Compute the number of strongly connected components (Kosaraju).
     * Linear time, or constant time if no transition was added since the last call.
     */
    public int numScc() {
        if (sccCount.isPresent()) {
            return sccCount.getAsInt();
        }
        final int count = kosaraju();
        LOGGER.trace("Recomputed SCC count: {} states, {} transitions, {} components",
            numStates, numTransitions, count);
        sccCount = OptionalInt.of(count);
        return count;
    }

    /**
     * Compute the SCC count once and forbid further mutation.
     * A frozen automaton is read-only and can be shared between threads.
     */
    public AutomatonGraph<I> freeze() {
        numScc();
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * States reachable from any state in {@code from} with zero or more transitions, whatever their labels.
     * The result always contains {@code from}.
     */
    public StateSet starReach(StateSet from) {
        checkLength(from);
        final StateSet seen = from.copy();
        final IntArrayList stack = new IntArrayList();
        for (int i = from.nextSetBit(0); i >= 0; i = from.nextSetBit(i + 1)) {
            stack.push(i);
        }

        while (!stack.isEmpty()) {
            final int q = stack.popInt();
            for (Transition<I> t : transitions.get(q)) {
                if (!seen.get(t.target())) {
                    seen.set(t.target());
                    stack.push(t.target());
                }
            }
        }
        return seen;
    }

    /**
     * States reachable from any state in {@code from} with exactly one transition labeled {@code a}.
     */
    public StateSet letterReach(StateSet from, I a) {
        checkLength(from);
        final StateSet succ = new StateSet(numStates);
        for (int i = from.nextSetBit(0); i >= 0; i = from.nextSetBit(i + 1)) {
            for (Transition<I> t : transitions.get(i)) {
                if (Objects.equals(t.label(), a)) {
                    succ.set(t.target());
                }
            }
        }
        return succ;
    }

    /**
     * Tests whether u belongs to the language by simulating the automaton.
     */
    public boolean accepts(Iterable<? extends I> u) {
        StateSet current = initialStates.copy();
        for (I symbol : u) {
            if (current.isEmpty()) {
                return false;
            }
            current = letterReach(current, symbol);
        }
        return current.intersects(finalStates);
    }

    private int kosaraju() {
        // First pass: post-order on the original graph, building the transpose along the way.
        final IntArrayList[] transpose = new IntArrayList[numStates];
        for (int i = 0; i < numStates; i++) {
            transpose[i] = new IntArrayList();
        }
        final int[] order = new int[numStates];
        int orderSize = 0;
        final boolean[] seen = new boolean[numStates];
        final int[] nextEdge = new int[numStates];
        final IntArrayList stack = new IntArrayList();

        for (int root = 0; root < numStates; root++) {
            if (seen[root]) {
                continue;
            }
            seen[root] = true;
            stack.push(root);
            while (!stack.isEmpty()) {
                final int v = stack.topInt();
                final List<Transition<I>> out = transitions.get(v);
                if (nextEdge[v] < out.size()) {
                    final int w = out.get(nextEdge[v]++).target();
                    transpose[w].add(v);
                    if (!seen[w]) {
                        seen[w] = true;
                        stack.push(w);
                    }
                } else {
                    stack.popInt();
                    order[orderSize++] = v;
                }
            }
        }

        // Second pass: each tree of the transpose, in reverse finishing order, is one component.
        Arrays.fill(seen, false);
        int count = 0;
        for (int idx = orderSize - 1; idx >= 0; idx--) {
            final int v = order[idx];
            if (seen[v]) {
                continue;
            }
            count++;
            seen[v] = true;
            stack.push(v);
            while (!stack.isEmpty()) {
                final IntArrayList preds = transpose[stack.popInt()];
                for (int j = 0; j < preds.size(); j++) {
                    final int u = preds.getInt(j);
                    if (!seen[u]) {
                        seen[u] = true;
                        stack.push(u);
                    }
                }
            }
        }
        return count;
    }

    private void checkLength(StateSet set) {
        if (set.length() != numStates) {
            throw new IllegalArgumentException(
                "StateSet over " + set.length() + " states used with automaton of " + numStates + " states");
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Automaton is frozen");
        }
    }

    private record Transition<I>(I label, int target) { }
}
