package FSA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detached state produced by merging several states of an automaton. It belongs to no automaton.
 *
 * @param label merged label, e.g. {@code {S1,S2}}
 * @param transitions symbol to merged targets, in symbol order
 * @param start whether any merged state was the start state
 * @param accept whether any merged state accepts
 */
public record CombinedState(String label, Map<String, Transition> transitions, boolean start, boolean accept) {
    public CombinedState {
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Transition> e : transitions.entrySet()) {
            parts.add(e.getKey() + ": " + e.getValue());
        }
        parts.add("start: " + start);
        parts.add("accept: " + accept);
        return label + ": {" + String.join(", ", parts) + "}";
    }
}
