package FSA.Display;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import FSA.Model.Automaton;
import FSA.Model.Transition;

/**
 * A state whose symbols leading to the same target are folded into one edge label.
 *
 * @param id state id
 * @param start start flag, copied
 * @param accept accept flag, copied
 * @param edges combined label, e.g. {@code "0,2,4"}, to target
 */
public record CompressedState(int id, boolean start, boolean accept, Map<String, Transition> edges) {
    public CompressedState {
        edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    public String label() {
        return Automaton.label(id);
    }
}
