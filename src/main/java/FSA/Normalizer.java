package FSA;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import FSA.Exceptions.InvalidFSADefinitionException;
import FSA.Model.Automaton;
import FSA.Model.State;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * Canonical state naming: states are renumbered to {@code 0..n-1}, keeping their relative order.
 */
public class Normalizer {
    private Normalizer() {}

    /**
     * Order raw labels for canonical numbering.
     * Labels of the form {@code <prefix><digits>} are ordered by their numeric suffix; if no label has such a suffix,
     * insertion order is kept.
     * @param labels labels in definition order
     * @return labels in canonical order; position i becomes state {@code S<i>}
     * @throws InvalidFSADefinitionException if only some labels carry a numeric suffix, or two labels share one
     */
    public static List<String> canonicalOrder(Collection<String> labels) {
        Int2ObjectRBTreeMap<String> byKey = new Int2ObjectRBTreeMap<>();
        String unordered = null;
        for (String label : labels) {
            int key = orderingKey(label);
            if (key < 0) {
                if (unordered == null) {
                    unordered = label;
                }
                continue;
            }
            String clash = byKey.put(key, label);
            if (clash != null) {
                throw new InvalidFSADefinitionException(
                    "labels '" + clash + "' and '" + label + "' have the same ordering key " + key);
            }
        }
        if (byKey.isEmpty()) {
            return new ArrayList<>(labels);
        }
        if (unordered != null) {
            throw new InvalidFSADefinitionException(
                "label '" + unordered + "' has no numeric suffix to order it by");
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Map each label to its canonical index.
     */
    public static Object2IntMap<String> canonicalIndex(Collection<String> labels) {
        Object2IntMap<String> index = new Object2IntLinkedOpenHashMap<>();
        index.defaultReturnValue(Automaton.NO_STATE);
        int i = 0;
        for (String label : canonicalOrder(labels)) {
            index.put(label, i++);
        }
        return index;
    }

    /**
     * Numeric suffix after the first character, or -1 when the label has none.
     */
    static int orderingKey(String label) {
        if (label.length() < 2 || label.length() > 10) {
            return -1;
        }
        long key = 0;
        for (int i = 1; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            key = key * 10 + (c - '0');
        }
        return key > Integer.MAX_VALUE ? -1 : (int) key;
    }

    /**
     * Renumber states to {@code 0..n-1} in ascending id order and rewrite every target accordingly.
     * An automaton that is already dense is returned as is.
     */
    public static Automaton normalize(Automaton automaton) {
        if (automaton.isNormalized()) {
            return automaton;
        }
        final Int2IntOpenHashMap mapping = new Int2IntOpenHashMap(automaton.size());
        mapping.defaultReturnValue(Automaton.NO_STATE);
        int next = 0;
        for (State s : automaton.getStates()) {
            mapping.put(s.id(), next++);
        }

        List<State> renamed = new ArrayList<>(automaton.size());
        for (State s : automaton.getStates()) {
            renamed.add(s.renumber(mapping.get(s.id()), mapping::get));
        }
        if (TableFillingMinimizer.DEBUG) {
            System.out.println("DEBUG: Normalized " + automaton.size() + " states, max id "
                + automaton.getStateIds().lastInt() + " -> " + (next - 1));
        }
        return Automaton.fromStates(renamed, automaton.isMinimal());
    }
}
