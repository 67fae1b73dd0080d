package org.satpath.graph;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stampa testuale di un grafo e dei percorsi evidenziati.
 * Solo output: nessun valore di ritorno influenza la ricerca.
 */
public final class GraphPrinter {

    private GraphPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Rappresentazione del grafo, una riga per nodo.
     * Formato: {@code Node 3: Connected to [1, 4]} oppure, se pesato, {@code [1(w=2), 4(w=7)]}.
     */
    public static String render(Graph graph) {
        StringBuilder output = new StringBuilder();
        output.append("Graph:\n");

        for (int node = 0; node < graph.nodeCount(); node++) {
            output.append("Node ").append(node).append(": Connected to ");
            output.append(renderNeighbors(graph, node)).append('\n');
        }

        return output.toString();
    }

    private static String renderNeighbors(Graph graph, int node) {
        if (!graph.isWeighted()) {
            return graph.neighbors(node).toString();
        }
        return graph.neighbors(node).stream()
                .map(neighbor -> neighbor + "(w=" + graph.weight(node, neighbor) + ")")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * @return percorso nel formato {@code 0 -> 3 -> 2}
     */
    public static String renderPath(List<Integer> path) {
        return path.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    }

    /**
     * Rappresentazione del grafo seguita dai percorsi evidenziati, etichettati.
     */
    public static String render(Graph graph, Map<String, List<Integer>> highlightedPaths) {
        StringBuilder output = new StringBuilder(render(graph));
        for (Map.Entry<String, List<Integer>> entry : highlightedPaths.entrySet()) {
            output.append('\n').append(entry.getKey()).append(": ");
            output.append(entry.getValue().isEmpty() ? "nessun percorso" : renderPath(entry.getValue()));
        }
        return output.toString();
    }

    public static void print(Graph graph, Map<String, List<Integer>> highlightedPaths) {
        System.out.println(render(graph, highlightedPaths));
    }
}
