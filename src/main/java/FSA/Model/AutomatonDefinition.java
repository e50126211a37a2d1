package FSA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Exceptions.InvalidFSADefinitionException;

/**
 * Raw, label-keyed automaton definition, as exchanged with callers.
 * Nothing is validated here; {@link Automaton#of(AutomatonDefinition)} does that when loading it.
 */
public class AutomatonDefinition {
    public static final String START = "start";
    public static final String ACCEPT = "accept";

    private final Map<String, StateDefinition> states = new LinkedHashMap<>();

    public static AutomatonDefinition create() {
        return new AutomatonDefinition();
    }

    /**
     * Declare (or redeclare the flags of) a state.
     */
    public AutomatonDefinition state(String label, boolean start, boolean accept) {
        StateDefinition def = getOrCreate(label);
        def.start = start;
        def.accept = accept;
        return this;
    }

    public AutomatonDefinition transition(String from, Object symbol, String target) {
        getOrCreate(from).put(String.valueOf(symbol), List.of(target), false);
        return this;
    }

    public AutomatonDefinition transition(String from, Object symbol, List<String> targets) {
        getOrCreate(from).put(String.valueOf(symbol), targets, true);
        return this;
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(states.keySet());
    }

    public StateDefinition get(String label) {
        return states.get(label);
    }

    public boolean contains(String label) {
        return states.containsKey(label);
    }

    public int size() {
        return states.size();
    }

    private StateDefinition getOrCreate(String label) {
        return states.computeIfAbsent(label, k -> new StateDefinition());
    }

    /**
     * Read the map form: label to attributes, where {@code start}/{@code accept} hold booleans and every other key is
     * a transition symbol whose value is a target label or a list of target labels.
     */
    public static AutomatonDefinition fromMap(Map<String, ? extends Map<?, ?>> raw) {
        AutomatonDefinition definition = new AutomatonDefinition();
        for (Map.Entry<String, ? extends Map<?, ?>> stateEntry : raw.entrySet()) {
            String label = stateEntry.getKey();
            StateDefinition def = definition.getOrCreate(label);
            if (stateEntry.getValue() == null) {
                throw new InvalidFSADefinitionException("State '" + label + "' definition must be a map");
            }
            for (Map.Entry<?, ?> attr : stateEntry.getValue().entrySet()) {
                String key = String.valueOf(attr.getKey());
                Object value = attr.getValue();
                if (START.equals(key) || ACCEPT.equals(key)) {
                    if (!(value instanceof Boolean)) {
                        throw new InvalidFSADefinitionException(
                            "State '" + label + "' field '" + key + "' must be a boolean, got " + value);
                    }
                    boolean flag = (Boolean) value;
                    if (START.equals(key)) {
                        def.start = flag;
                    } else {
                        def.accept = flag;
                    }
                } else if (value instanceof List) {
                    List<?> list = (List<?>) value;
                    List<String> targets = new ArrayList<>(list.size());
                    for (Object o : list) {
                        targets.add(String.valueOf(o));
                    }
                    def.put(key, targets, true);
                } else if (value instanceof String) {
                    def.put(key, List.of((String) value), false);
                } else {
                    throw new InvalidFSADefinitionException(
                        "State '" + label + "' transition '" + key + "' must target a label or list of labels, got " + value);
                }
            }
        }
        return definition;
    }

    /**
     * Inverse of {@link #fromMap(Map)}.
     */
    public Map<String, Map<String, Object>> toMap() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, StateDefinition> e : states.entrySet()) {
            StateDefinition def = e.getValue();
            Map<String, Object> attrs = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> t : def.targets.entrySet()) {
                String symbol = t.getKey();
                attrs.put(symbol, def.listValued.contains(symbol) ? t.getValue() : t.getValue().get(0));
            }
            if (def.start != null) {
                attrs.put(START, def.start);
            }
            if (def.accept != null) {
                attrs.put(ACCEPT, def.accept);
            }
            out.put(e.getKey(), attrs);
        }
        return out;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    /**
     * Attributes of one state. Flags stay {@code null} until declared.
     */
    public static class StateDefinition {
        private Boolean start;
        private Boolean accept;
        private final Map<String, List<String>> targets = new LinkedHashMap<>();
        private final Set<String> listValued = new HashSet<>();

        private void put(String symbol, List<String> symbolTargets, boolean asList) {
            if (START.equals(symbol) || ACCEPT.equals(symbol)) {
                throw new InvalidFSADefinitionException("'" + symbol + "' is reserved and cannot be a transition symbol");
            }
            targets.put(symbol, List.copyOf(symbolTargets));
            if (asList) {
                listValued.add(symbol);
            } else {
                listValued.remove(symbol);
            }
        }

        public Boolean getStart() {
            return start;
        }

        public Boolean getAccept() {
            return accept;
        }

        /**
         * @return symbol to target labels, in definition order
         */
        public Map<String, List<String>> getTargets() {
            return Collections.unmodifiableMap(targets);
        }

        /**
         * Whether the symbol was defined with a list of targets rather than a single label.
         */
        public boolean isListValued(String symbol) {
            return listValued.contains(symbol);
        }
    }
}
