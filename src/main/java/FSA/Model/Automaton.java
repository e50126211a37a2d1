package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Exceptions.InvalidFSADefinitionException;
import FSA.Exceptions.InvalidStateException;
import FSA.Normalizer;
import FSA.Run;
import FSA.SymbolOrder;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMaps;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * Immutable transition table of a finite automaton.
 * States are keyed by integer id; after normalization the ids are exactly {@code 0..n-1}.
 * Structural operations (normalize, prune, minimize) return new instances.
 */
public final class Automaton {
    public static final int NO_STATE = -1;
    public static final String LABEL_PREFIX = "S";

    private final Int2ObjectSortedMap<State> states;
    private final int startState;
    private final boolean minimal;

    private Automaton(Int2ObjectSortedMap<State> states, int startState, boolean minimal) {
        this.states = Int2ObjectSortedMaps.unmodifiable(states);
        this.startState = startState;
        this.minimal = minimal;
    }

    /**
     * Load a raw definition, validating it and assigning canonical ids.
     * If several states are flagged as start, the one with the smallest canonical id is kept as the start state and
     * the flag is cleared on the others.
     * @throws InvalidFSADefinitionException empty definition, missing flags, unorderable labels, or no start state
     * @throws InvalidStateException a transition target that is not a state of the definition
     */
    public static Automaton of(AutomatonDefinition definition) {
        if (definition.size() == 0) {
            throw new InvalidFSADefinitionException("FSA definition cannot be empty");
        }
        for (String label : definition.labels()) {
            AutomatonDefinition.StateDefinition def = definition.get(label);
            if (def.getStart() == null || def.getAccept() == null) {
                throw new InvalidFSADefinitionException("State '" + label + "' must have 'start' and 'accept' fields");
            }
            for (List<String> targets : def.getTargets().values()) {
                for (String target : targets) {
                    if (!definition.contains(target)) {
                        throw new InvalidStateException(target,
                            "Transition from '" + label + "' references non-existent state '" + target + "'");
                    }
                }
            }
        }

        final Object2IntMap<String> index = Normalizer.canonicalIndex(definition.labels());
        final Int2ObjectSortedMap<State> states = new Int2ObjectRBTreeMap<>();
        int start = NO_STATE;
        for (Object2IntMap.Entry<String> entry : index.object2IntEntrySet()) {
            final String label = entry.getKey();
            final int id = entry.getIntValue();
            final AutomatonDefinition.StateDefinition def = definition.get(label);

            Map<String, Transition> transitions = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> t : def.getTargets().entrySet()) {
                IntList targets = new IntArrayList(t.getValue().size());
                for (String target : t.getValue()) {
                    targets.add(index.getInt(target));
                }
                String symbol = t.getKey();
                transitions.put(symbol, def.isListValued(symbol)
                    ? Transition.multiple(targets)
                    : Transition.single(targets.getInt(0)));
            }
            // canonical order is ascending id, so the first start flag seen wins
            boolean isStart = def.getStart() && start == NO_STATE;
            if (isStart) {
                start = id;
            }
            states.put(id, new State(id, isStart, def.getAccept(), transitions));
        }
        if (start == NO_STATE) {
            throw new InvalidFSADefinitionException("FSA must have a start state");
        }
        return new Automaton(states, start, false);
    }

    /**
     * Assemble an automaton from already numbered states.
     * @param states states with distinct ids; at most one may be flagged as start
     * @param minimal whether the states are known to form a minimal DFA
     * @throws InvalidStateException a target that is not among {@code states}
     */
    public static Automaton fromStates(Collection<State> states, boolean minimal) {
        final Int2ObjectSortedMap<State> table = new Int2ObjectRBTreeMap<>();
        int start = NO_STATE;
        for (State s : states) {
            if (table.put(s.id(), s) != null) {
                throw new IllegalArgumentException("Duplicate state id " + s.id());
            }
            if (s.start()) {
                if (start != NO_STATE) {
                    throw new InvalidFSADefinitionException(
                        "FSA must have at most one start state, found " + label(start) + " and " + s.label());
                }
                start = s.id();
            }
        }
        for (State s : table.values()) {
            for (Transition t : s.transitions().values()) {
                for (int target : t.targets()) {
                    if (!table.containsKey(target)) {
                        throw new InvalidStateException(label(target),
                            "Transition from '" + s.label() + "' references non-existent state");
                    }
                }
            }
        }
        return new Automaton(table, start, minimal);
    }

    public static String label(int id) {
        return LABEL_PREFIX + id;
    }

    /**
     * Inverse of {@link #label(int)}.
     * @throws InvalidStateException if the label is not exactly {@code S} followed by a decimal index without
     * sign or leading zero
     */
    public static int parseLabel(String label) {
        if (label == null || !label.startsWith(LABEL_PREFIX) || label.length() == LABEL_PREFIX.length()) {
            throw new InvalidStateException(String.valueOf(label));
        }
        final String digits = label.substring(LABEL_PREFIX.length());
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new InvalidStateException(label);
        }
        long id = 0;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidStateException(label);
            }
            id = id * 10 + (c - '0');
            if (id > Integer.MAX_VALUE) {
                throw new InvalidStateException(label);
            }
        }
        return (int) id;
    }

    public int size() {
        return states.size();
    }

    /**
     * @return states in ascending id order
     */
    public Collection<State> getStates() {
        return states.values();
    }

    public IntSortedSet getStateIds() {
        return states.keySet();
    }

    public boolean containsState(int id) {
        return states.containsKey(id);
    }

    /**
     * @throws InvalidStateException if there is no such state
     */
    public State getState(int id) {
        State s = states.get(id);
        if (s == null) {
            throw new InvalidStateException(label(id));
        }
        return s;
    }

    /**
     * @return the start state id, or {@link #NO_STATE} if it has been pruned away
     */
    public int getStartState() {
        return startState;
    }

    public boolean hasStartState() {
        return startState != NO_STATE;
    }

    public boolean isAccepting(int id) {
        return getState(id).accept();
    }

    /**
     * Transition value of {@code symbol} on state {@code id}, or {@code null} if undefined.
     */
    public Transition getTransition(int id, String symbol) {
        return getState(id).getTransition(symbol);
    }

    public boolean isMinimal() {
        return minimal;
    }

    /**
     * Whether ids are exactly {@code 0..n-1}.
     */
    public boolean isNormalized() {
        return states.isEmpty() || (states.firstIntKey() == 0 && states.lastIntKey() == states.size() - 1);
    }

    /**
     * Whether no transition has more than one target.
     */
    public boolean isDeterministic() {
        for (State s : states.values()) {
            for (Transition t : s.transitions().values()) {
                if (t.targets().size() != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return every symbol used by some state, in {@link SymbolOrder}
     */
    public SortedSet<String> getSymbols() {
        SortedSet<String> symbols = new TreeSet<>(SymbolOrder.INSTANCE);
        for (State s : states.values()) {
            symbols.addAll(s.transitions().keySet());
        }
        return Collections.unmodifiableSortedSet(symbols);
    }

    /**
     * New cursor positioned on the start state.
     */
    public Run run() {
        return new Run(this);
    }

    /**
     * Label-keyed form of this automaton; {@code Automaton.of(a.toDefinition())} reproduces a normalized automaton.
     */
    public AutomatonDefinition toDefinition() {
        AutomatonDefinition definition = AutomatonDefinition.create();
        for (State s : states.values()) {
            definition.state(s.label(), s.start(), s.accept());
        }
        for (State s : states.values()) {
            for (Map.Entry<String, Transition> e : s.transitions().entrySet()) {
                Transition t = e.getValue();
                if (t instanceof Transition.Single) {
                    definition.transition(s.label(), e.getKey(), label(((Transition.Single) t).target()));
                } else {
                    List<String> targets = new ArrayList<>(t.targets().size());
                    for (int target : t.targets()) {
                        targets.add(label(target));
                    }
                    definition.transition(s.label(), e.getKey(), targets);
                }
            }
        }
        return definition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) o;
        return startState == other.startState && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        return 31 * states.hashCode() + startState;
    }

    /**
     * One line per state: {@code S0: | 0: S0, 1: S1, start: True , accept: True  |}
     */
    @Override
    public String toString() {
        List<String> lines = new ArrayList<>(states.size());
        for (State s : states.values()) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Transition> e : s.transitions().entrySet()) {
                parts.add(e.getKey() + ": " + e.getValue());
            }
            parts.add("start: " + (s.start() ? "True " : "False"));
            parts.add("accept: " + (s.accept() ? "True " : "False"));
            lines.add(s.label() + ": | " + String.join(", ", parts) + " |");
        }
        return String.join("\n", lines);
    }
}
