package FSA.Display;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import FSA.Model.Automaton;

/**
 * Writes a {@link GraphProjection} as DOT source: left to right, accepting states as double circles, and an
 * invisible node pointing at the start state. Layout is left to whoever renders the text.
 */
public class DotFormat {
    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private DotFormat() {}

    public static String toDot(Automaton automaton) {
        return toDot(GraphProjection.of(automaton), false);
    }

    public static String toDot(GraphProjection graph, boolean circularLayout) {
        StringBuilder sb = new StringBuilder();
        try {
            write(graph, sb, circularLayout);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * @param graph - projection to write
     * @param out - destination
     * @param circularLayout - ask the renderer for the circo layout
     */
    public static void write(GraphProjection graph, Appendable out, boolean circularLayout) throws IOException {
        final Map<String, List<GraphProjection.Edge>> bySource = new LinkedHashMap<>();
        for (GraphProjection.Edge edge : graph.edges()) {
            bySource.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
        }

        out.append("digraph {\n");
        out.append("\trankdir=LR size=\"8,5\"").append(circularLayout ? " layout=circo" : "").append('\n');
        out.append("\t\"\" [height=0 shape=none width=0]\n");
        for (GraphProjection.Node node : graph.nodes()) {
            final String id = escapeId(node.label());
            out.append('\t').append(id).append(" [shape=").append(node.accept() ? "doublecircle" : "circle")
                .append("]\n");
            if (node.start()) {
                out.append("\t\"\" -> ").append(id).append(" [arrowsize=0.75]\n");
            }
            for (GraphProjection.Edge edge : bySource.getOrDefault(node.label(), List.of())) {
                out.append('\t').append(id).append(" -> ").append(escapeId(edge.target()))
                    .append(" [label=").append(quote(edge.label())).append(" arrowsize=0.75]\n");
            }
        }
        out.append("}\n");
    }

    private static String escapeId(String id) {
        return PLAIN_ID.matcher(id).matches() ? id : quote(id);
    }

    private static String quote(String str) {
        return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
