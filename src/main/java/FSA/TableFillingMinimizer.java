package FSA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

import FSA.Exceptions.InvalidStateException;
import FSA.Exceptions.MinimizationException;
import FSA.Model.Automaton;
import FSA.Model.PruneStrategy;
import FSA.Model.State;
import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * DFA minimization by table filling (Moore's algorithm).
 * <p>
 * The automaton is pruned and normalized, a pairwise distinguishability table is relaxed to a fixed point, the
 * indistinguishable pairs are joined into equivalence classes and every class collapses onto its smallest state.
 * The result carries the minimal flag, so minimizing it again is a no-op.
 * States defining different symbols are never merged, so the result is minimal only for complete DFAs.
 */
public class TableFillingMinimizer {
    public static boolean DEBUG = false;

    private final PruneStrategy pruneStrategy;

    public TableFillingMinimizer() {
        this(PruneStrategy.fromStart());
    }

    /**
     * @param pruneStrategy - how unreachable states are removed before the table is built
     */
    public TableFillingMinimizer(PruneStrategy pruneStrategy) {
        this.pruneStrategy = pruneStrategy;
    }

    /**
     * Minimize with breadth-first pruning from the start state.
     */
    public static Automaton minimize(Automaton automaton) {
        return new TableFillingMinimizer().apply(automaton);
    }

    /**
     * Main minimization loop.
     * An automaton without start state (e.g. one whose start state was pruned by target membership) cannot be
     * walked from its start, so it is pruned by {@link PruneStrategy#targetMembership()} instead.
     * @param automaton - DFA to minimize; a transition with several targets is rejected
     * @return - normalized minimal DFA, or {@code automaton} itself if it is already flagged minimal
     * @throws MinimizationException on nondeterministic transitions or a broken internal invariant
     */
    public Automaton apply(Automaton automaton) {
        if (automaton.isMinimal()) {
            return automaton;
        }
        final PruneStrategy strategy = automaton.hasStartState() ? pruneStrategy : PruneStrategy.targetMembership();
        final Automaton normalized = Normalizer.normalize(ReachabilityPruner.prune(automaton, strategy));
        final State[] states = normalized.getStates().toArray(new State[0]);
        final int n = states.length;
        for (int i = 0; i < n; i++) {
            if (states[i].id() != i) {
                throw new MinimizationException("state " + states[i].label() + " found at index " + i);
            }
            for (Map.Entry<String, Transition> e : states[i].transitions().entrySet()) {
                target(states[i], e.getKey(), e.getValue(), n);
            }
        }

        final BitSet[] table = initializeTable(states);
        final int passes = fillTable(states, table);
        final List<IntSortedSet> classes = mergeOverlapping(similarityPairs(table, n));
        final Int2IntMap redundant = redundancyMapping(classes);
        final Automaton merged = mergeEquivalentStates(states, redundant);
        final Automaton result = Normalizer.normalize(merged);

        if (DEBUG) {
            System.out.println("DEBUG: Table filling: " + automaton.size() + " -> " + n + " reachable -> "
                + result.size() + " states (" + passes + " passes, " + classes.size() + " merged classes)");
        }
        return result;
    }

    /**
     * Pairs are distinguishable up front when exactly one of them accepts. Pairs whose defined symbols differ are
     * marked as well, so that partial DFAs never lose a transition when states merge.
     * @param states - states indexed by id
     * @return symmetric table; {@code table[i].get(j)} iff i and j are known to be distinguishable
     */
    static BitSet[] initializeTable(State[] states) {
        final int n = states.length;
        final BitSet[] table = new BitSet[n];
        for (int i = 0; i < n; i++) {
            table[i] = new BitSet(n);
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                if (states[i].accept() != states[j].accept()
                    || !states[i].transitions().keySet().equals(states[j].transitions().keySet())) {
                    table[i].set(j);
                    table[j].set(i);
                }
            }
        }
        return table;
    }

    /**
     * Relax the table until a full scan marks no new pair. Every effectful scan marks at least one of the at most
     * n*n entries, so this terminates.
     * @return number of scans
     */
    static int fillTable(State[] states, BitSet[] table) {
        final int n = states.length;
        if (table.length != n) {
            throw new MinimizationException("table has " + table.length + " rows for " + n + " states");
        }
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            passes++;
            for (int row = 0; row < n; row++) {
                for (int col = 0; col < n; col++) {
                    if (row == col || table[row].get(col)) {
                        continue;
                    }
                    for (Map.Entry<String, Transition> e : states[row].transitions().entrySet()) {
                        final Transition other = states[col].getTransition(e.getKey());
                        if (other == null) {
                            continue;
                        }
                        final int a = target(states[row], e.getKey(), e.getValue(), n);
                        final int b = target(states[col], e.getKey(), other, n);
                        if (table[a].get(b)) {
                            table[row].set(col);
                            table[col].set(row);
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }
        return passes;
    }

    private static int target(State state, String symbol, Transition transition, int n) {
        if (transition.targets().size() != 1) {
            throw new MinimizationException("state " + state.label() + " has " + transition.targets().size()
                + " targets on '" + symbol + "'; only DFAs can be minimized");
        }
        final int target = transition.targets().getInt(0);
        if (target < 0 || target >= n) {
            throw new MinimizationException("target " + Automaton.label(target) + " of " + state.label()
                + " is outside 0.." + (n - 1));
        }
        return target;
    }

    /**
     * @return one two-element group per indistinguishable pair {@code row < col}
     */
    static List<IntSortedSet> similarityPairs(BitSet[] table, int n) {
        final List<IntSortedSet> pairs = new ArrayList<>();
        for (int row = 0; row < n; row++) {
            for (int col = row + 1; col < n; col++) {
                if (!table[row].get(col)) {
                    IntSortedSet pair = new IntRBTreeSet();
                    pair.add(row);
                    pair.add(col);
                    pairs.add(pair);
                }
            }
        }
        return pairs;
    }

    /**
     * Join groups that share a state until all groups are pairwise disjoint.
     * States in no group are implicitly their own class.
     * @param groups - groups to join; they are mutated
     * @return disjoint equivalence classes with at least two members
     */
    static List<IntSortedSet> mergeOverlapping(List<IntSortedSet> groups) {
        boolean unmerged = true;
        while (unmerged) {
            unmerged = false;
            final List<IntSortedSet> results = new ArrayList<>();
            while (!groups.isEmpty()) {
                final IntSortedSet common = groups.get(0);
                final List<IntSortedSet> rest = new ArrayList<>();
                for (IntSortedSet group : groups.subList(1, groups.size())) {
                    if (disjoint(group, common)) {
                        rest.add(group);
                    } else {
                        common.addAll(group);
                        unmerged = true;
                    }
                }
                results.add(common);
                groups = rest;
            }
            groups = results;
        }
        return groups;
    }

    private static boolean disjoint(IntSet a, IntSet b) {
        for (int x : a) {
            if (b.contains(x)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return non-representative member to the smallest member of its class
     */
    static Int2IntMap redundancyMapping(List<IntSortedSet> classes) {
        final Int2IntMap redundant = new Int2IntOpenHashMap();
        redundant.defaultReturnValue(Automaton.NO_STATE);
        for (IntSortedSet equivClass : classes) {
            final int representative = equivClass.firstInt();
            for (int member : equivClass) {
                if (member != representative) {
                    redundant.put(member, representative);
                }
            }
        }
        return redundant;
    }

    /**
     * Drop redundant states and redirect every target to its representative.
     * A representative takes over the start flag of any member it replaces.
     */
    private static Automaton mergeEquivalentStates(State[] states, Int2IntMap redundant) {
        final IntSet inheritsStart = new IntOpenHashSet();
        for (State s : states) {
            if (s.start() && redundant.containsKey(s.id())) {
                inheritsStart.add(redundant.get(s.id()));
            }
        }

        final List<State> kept = new ArrayList<>(states.length - redundant.size());
        for (State s : states) {
            if (redundant.containsKey(s.id())) {
                continue;
            }
            final State rewritten = s.renumber(s.id(), t -> redundant.containsKey(t) ? redundant.get(t) : t);
            kept.add(rewritten.withStart(s.start() || inheritsStart.contains(s.id())));
        }
        try {
            return Automaton.fromStates(kept, true);
        } catch (InvalidStateException e) {
            throw new MinimizationException("merged automaton references a removed state", e);
        }
    }
}
