package FSA;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Exceptions.InvalidStateException;
import FSA.Model.Automaton;
import FSA.Model.CombinedState;
import FSA.Model.State;
import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Manual NFA-state union: several states of an automaton are combined into one detached entry.
 * The source automaton is only read.
 */
public class StateMerger {
    private StateMerger() {}

    /**
     * @param automaton source automaton
     * @param labels at least two state labels, e.g. {@code "S1", "S2"}
     * @throws InvalidStateException if a label is malformed or not a state of {@code automaton}
     */
    public static CombinedState combine(Automaton automaton, String... labels) {
        int[] ids = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            ids[i] = Automaton.parseLabel(labels[i]);
        }
        return combine(automaton, ids);
    }

    /**
     * Combine states by id.
     * For each symbol of the merged states, a single distinct target stays {@link Transition.Single}; several become
     * a {@link Transition.Multiple} sorted by id. Start and accept flags are or-ed.
     * @param automaton source automaton
     * @param ids at least two distinct state ids
     * @return new entry labelled {@code {S<i>,S<j>,...}} with ids ascending
     * @throws InvalidStateException if an id is not a state of {@code automaton}
     */
    public static CombinedState combine(Automaton automaton, int... ids) {
        final IntSortedSet merged = new IntRBTreeSet(ids);
        if (merged.size() < 2) {
            throw new IllegalArgumentException("At least two distinct states are needed to combine, got " + merged);
        }
        final List<State> states = new ArrayList<>(merged.size());
        for (int id : merged) {
            states.add(automaton.getState(id));
        }

        final SortedSet<String> symbols = new TreeSet<>(SymbolOrder.INSTANCE);
        boolean start = false;
        boolean accept = false;
        for (State s : states) {
            symbols.addAll(s.transitions().keySet());
            start |= s.start();
            accept |= s.accept();
        }

        final Map<String, Transition> transitions = new LinkedHashMap<>();
        for (String symbol : symbols) {
            final IntSortedSet targets = new IntRBTreeSet();
            for (State s : states) {
                final Transition t = s.getTransition(symbol);
                if (t != null) {
                    targets.addAll(t.targets());
                }
            }
            transitions.put(symbol, targets.size() == 1
                ? Transition.single(targets.firstInt())
                : Transition.multiple(new IntArrayList(targets)));
        }

        final List<String> labels = new ArrayList<>(merged.size());
        for (int id : merged) {
            labels.add(Automaton.label(id));
        }
        return new CombinedState("{" + String.join(",", labels) + "}", transitions, start, accept);
    }
}
