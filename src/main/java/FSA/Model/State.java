package FSA.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * One row of the transition table. Symbol order is the order the transitions were defined in.
 *
 * @param id state index, displayed as {@code S<id>}
 * @param start whether this is the start state
 * @param accept whether this state accepts
 * @param transitions symbol to transition value
 */
public record State(int id, boolean start, boolean accept, Map<String, Transition> transitions) {
    public State {
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    public String label() {
        return Automaton.label(id);
    }

    public Transition getTransition(String symbol) {
        return transitions.get(symbol);
    }

    /**
     * Copy of this state under a new id, with every target rewritten through {@code mapping}.
     */
    public State renumber(int newId, IntUnaryOperator mapping) {
        Map<String, Transition> mapped = new LinkedHashMap<>();
        for (Map.Entry<String, Transition> e : transitions.entrySet()) {
            mapped.put(e.getKey(), e.getValue().map(mapping));
        }
        return new State(newId, start, accept, mapped);
    }

    public State withStart(boolean newStart) {
        return newStart == start ? this : new State(id, newStart, accept, transitions);
    }
}
