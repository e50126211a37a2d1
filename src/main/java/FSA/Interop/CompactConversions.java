package FSA.Interop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Exceptions.InvalidTransitionException;
import FSA.Model.Automaton;
import FSA.Model.AutomatonDefinition;
import FSA.Model.State;
import FSA.Model.Transition;
import FSA.Normalizer;
import FSA.SymbolOrder;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.concept.StateIDs;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;

/**
 * Bridges between {@link Automaton} and AutomataLib's compact automata.
 * State {@code S<i>} of a normalized automaton becomes compact state {@code i} and vice versa.
 */
public class CompactConversions {
    private CompactConversions() {}

    /**
     * @return the automaton's symbols, in {@link SymbolOrder}
     */
    public static Alphabet<String> alphabetOf(Automaton automaton) {
        return Alphabets.fromCollection(automaton.getSymbols());
    }

    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        return toCompactDFA(automaton, alphabetOf(automaton));
    }

    /**
     * @param automaton - deterministic automaton; it is normalized first
     * @param alphabet - must contain every symbol of the automaton
     * @return partial DFA with the same states, flags and transitions
     * @throws InvalidTransitionException if a transition has several targets
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton, Alphabet<String> alphabet) {
        return toCompactDFA(automaton, alphabet, false);
    }

    private static CompactDFA<String> toCompactDFA(Automaton automaton, Alphabet<String> alphabet, boolean complete) {
        final Automaton normalized = Normalizer.normalize(automaton);
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, normalized.size() + 1);
        for (State s : normalized.getStates()) {
            dfa.addState(s.accept());
        }
        if (normalized.hasStartState()) {
            dfa.setInitialState(normalized.getStartState());
        }
        for (State s : normalized.getStates()) {
            for (Map.Entry<String, Transition> e : s.transitions().entrySet()) {
                final String symbol = e.getKey();
                final Transition t = e.getValue();
                if (t.targets().size() != 1) {
                    throw new InvalidTransitionException(s.label(), symbol,
                        "State '" + s.label() + "' has " + t.targets().size() + " targets on '" + symbol
                            + "'; a DFA needs exactly one");
                }
                if (!alphabet.containsSymbol(symbol)) {
                    throw new IllegalArgumentException("Symbol '" + symbol + "' is missing from the alphabet");
                }
                dfa.setTransition(s.id(), alphabet.getSymbolIndex(symbol), t.targets().getInt(0));
            }
        }
        if (complete) {
            // route undefined transitions into a rejecting sink
            int sink = -1;
            for (int q = 0; q < normalized.size(); q++) {
                for (int a = 0; a < alphabet.size(); a++) {
                    if (dfa.getSuccessor(Integer.valueOf(q), alphabet.getSymbol(a)) == null) {
                        if (sink < 0) {
                            sink = dfa.addState(false);
                            for (int b = 0; b < alphabet.size(); b++) {
                                dfa.setTransition(sink, b, sink);
                            }
                        }
                        dfa.setTransition(q, a, sink);
                    }
                }
            }
        }
        return dfa;
    }

    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        return toCompactNFA(automaton, alphabetOf(automaton));
    }

    /**
     * @param automaton - any automaton; it is normalized first
     * @param alphabet - must contain every symbol of the automaton
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton, Alphabet<String> alphabet) {
        final Automaton normalized = Normalizer.normalize(automaton);
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, normalized.size());
        for (State s : normalized.getStates()) {
            nfa.addState(s.accept());
        }
        if (normalized.hasStartState()) {
            nfa.setInitial(normalized.getStartState(), true);
        }
        for (State s : normalized.getStates()) {
            for (Map.Entry<String, Transition> e : s.transitions().entrySet()) {
                for (int target : e.getValue().targets()) {
                    nfa.addTransition(s.id(), e.getKey(), target);
                }
            }
        }
        return nfa;
    }

    /**
     * Read an AutomataLib DFA. State ids are taken from {@link DFA#stateIDs()}.
     * @param dfa - source DFA, must have an initial state
     * @param inputs - symbols to read transitions for
     */
    public static <S, I> Automaton fromDFA(DFA<S, I> dfa, Collection<? extends I> inputs) {
        final StateIDs<S> ids = dfa.stateIDs();
        final S init = dfa.getInitialState();
        final AutomatonDefinition definition = AutomatonDefinition.create();
        for (S s : dfa.getStates()) {
            definition.state(Automaton.label(ids.getStateId(s)), Objects.equals(s, init), dfa.isAccepting(s));
        }
        for (S s : dfa.getStates()) {
            final String from = Automaton.label(ids.getStateId(s));
            for (I i : inputs) {
                final S succ = dfa.getSuccessor(s, i);
                if (succ != null) {
                    definition.transition(from, i, Automaton.label(ids.getStateId(succ)));
                }
            }
        }
        return Automaton.of(definition);
    }

    /**
     * Read an AutomataLib NFA. A symbol with one successor becomes a single transition, several successors a
     * multi-target transition. Of several initial states only the one with the smallest id is kept as start.
     * @param nfa - source NFA, must have an initial state
     * @param inputs - symbols to read transitions for
     */
    public static <S, I> Automaton fromNFA(NFA<S, I> nfa, Collection<? extends I> inputs) {
        final StateIDs<S> ids = nfa.stateIDs();
        final Set<S> inits = nfa.getInitialStates();
        final AutomatonDefinition definition = AutomatonDefinition.create();
        for (S s : nfa.getStates()) {
            definition.state(Automaton.label(ids.getStateId(s)), inits.contains(s), nfa.isAccepting(s));
        }
        for (S s : nfa.getStates()) {
            final String from = Automaton.label(ids.getStateId(s));
            for (I i : inputs) {
                final IntSortedSet targets = new IntRBTreeSet();
                for (S t : nfa.getTransitions(s, i)) {
                    targets.add(ids.getStateId(t));
                }
                if (targets.size() == 1) {
                    definition.transition(from, i, Automaton.label(targets.firstInt()));
                } else if (!targets.isEmpty()) {
                    List<String> labels = new ArrayList<>(targets.size());
                    for (int t : targets) {
                        labels.add(Automaton.label(t));
                    }
                    definition.transition(from, i, labels);
                }
            }
        }
        return Automaton.of(definition);
    }

    /**
     * Language equivalence of two deterministic automata. Undefined transitions reject.
     */
    public static boolean equivalent(Automaton a, Automaton b) {
        final SortedSet<String> symbols = new TreeSet<>(SymbolOrder.INSTANCE);
        symbols.addAll(a.getSymbols());
        symbols.addAll(b.getSymbols());
        final Alphabet<String> alphabet = Alphabets.fromCollection(symbols);
        final CompactDFA<String> dfaA = toCompactDFA(a, alphabet, true);
        final CompactDFA<String> dfaB = toCompactDFA(b, alphabet, true);
        return Automata.testEquivalence(dfaA, dfaB, alphabet);
    }
}
