package FSA.Display;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import FSA.Model.Automaton;
import FSA.Model.State;
import FSA.Model.Transition;

/**
 * Read-only node/edge view of an automaton, handed to a renderer. Nothing here lays out or draws anything.
 *
 * @param nodes one node per state, in id order
 * @param edges edges grouped by source, in node order
 */
public record GraphProjection(List<Node> nodes, List<Edge> edges) {
    public GraphProjection {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * @param label state label, e.g. {@code S0}
     * @param accept is this an accepting state?
     * @param start is this the start state?
     */
    public record Node(String label, boolean accept, boolean start) { }

    /**
     * @param source label of the state the edge leaves
     * @param target label of the state the edge enters
     * @param label symbol, or comma-joined symbols when compressed
     */
    public record Edge(String source, String target, String label) { }

    /**
     * Projection with compressed edge labels.
     */
    public static GraphProjection of(Automaton automaton) {
        return of(automaton, true, false);
    }

    /**
     * @param compress fold symbols with the same target into one edge ({@link LabelCompressor})
     * @param addSpaces separate folded symbols with {@code ", "}
     */
    public static GraphProjection of(Automaton automaton, boolean compress, boolean addSpaces) {
        final List<Node> nodes = new ArrayList<>(automaton.size());
        final List<Edge> edges = new ArrayList<>();
        if (compress) {
            for (CompressedState s : LabelCompressor.compress(automaton, addSpaces)) {
                nodes.add(new Node(s.label(), s.accept(), s.start()));
                addEdges(s.label(), s.edges(), edges);
            }
        } else {
            for (State s : automaton.getStates()) {
                nodes.add(new Node(s.label(), s.accept(), s.start()));
                addEdges(s.label(), s.transitions(), edges);
            }
        }
        return new GraphProjection(nodes, edges);
    }

    // a multi-target transition becomes one edge per target
    private static void addEdges(String source, Map<String, Transition> transitions, List<Edge> edges) {
        for (Map.Entry<String, Transition> e : transitions.entrySet()) {
            for (int target : e.getValue().targets()) {
                edges.add(new Edge(source, Automaton.label(target), e.getKey()));
            }
        }
    }

    public Optional<Node> startNode() {
        return nodes.stream().filter(Node::start).findFirst();
    }
}
