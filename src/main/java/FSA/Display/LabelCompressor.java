package FSA.Display;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.Transition;
import FSA.SymbolOrder;

/**
 * Display-only transform: symbols of a state that lead to the identical target become one comma-joined label.
 * Not useful for small alphabets; it only shortens what a renderer has to draw.
 */
public class LabelCompressor {
    private LabelCompressor() {}

    public static List<CompressedState> compress(Automaton automaton) {
        return compress(automaton, false);
    }

    /**
     * @param automaton source, left untouched
     * @param addSpaces join symbols with {@code ", "} instead of {@code ","}
     * @return one entry per state, in id order; labels list symbols in {@link SymbolOrder}
     */
    public static List<CompressedState> compress(Automaton automaton, boolean addSpaces) {
        final String separator = addSpaces ? ", " : ",";
        final List<CompressedState> result = new ArrayList<>(automaton.size());
        for (State s : automaton.getStates()) {
            // targets keep the order in which they first appear
            final Map<Transition, List<String>> byTarget = new LinkedHashMap<>();
            for (Map.Entry<String, Transition> e : s.transitions().entrySet()) {
                byTarget.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
            }
            final Map<String, Transition> edges = new LinkedHashMap<>();
            for (Map.Entry<Transition, List<String>> e : byTarget.entrySet()) {
                final List<String> symbols = e.getValue();
                symbols.sort(SymbolOrder.INSTANCE);
                edges.put(String.join(separator, symbols), e.getKey());
            }
            result.add(new CompressedState(s.id(), s.start(), s.accept(), edges));
        }
        return result;
    }
}
