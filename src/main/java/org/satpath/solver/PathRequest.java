package org.satpath.solver;

import org.satpath.encoding.ViaConstraint;
import org.satpath.graph.Graph;
import org.satpath.graph.MalformedGraphException;

/**
 * Richiesta di percorso validata: grafo, estremi e vincolo sui nodi intermedi.
 *
 * La costruzione fallisce con MalformedGraphException se source/target o i nodi via
 * sono fuori range, se un nodo via coincide con un estremo, o se un nodo è sia
 * richiesto che vietato.
 */
public record PathRequest(Graph graph, int source, int target, ViaConstraint via) {

    public PathRequest {
        if (graph == null) {
            throw new IllegalArgumentException("Grafo non può essere null");
        }
        if (via == null) {
            via = ViaConstraint.none();
        }
        checkNode(graph, source, "Sorgente");
        checkNode(graph, target, "Destinazione");

        for (int node : via.required()) {
            checkNode(graph, node, "Nodo via");
            checkNotEndpoint(node, source, target);
            if (via.forbidden().contains(node)) {
                throw new MalformedGraphException("Nodo " + node + " sia richiesto che vietato");
            }
        }
        for (int node : via.forbidden()) {
            checkNode(graph, node, "Nodo vietato");
            checkNotEndpoint(node, source, target);
        }
    }

    public static PathRequest of(Graph graph, int source, int target) {
        return new PathRequest(graph, source, target, ViaConstraint.none());
    }

    /**
     * Lunghezza minima (numero di posizioni) che può ospitare un percorso valido:
     * 1 se source == target senza nodi richiesti, altrimenti 2 più i nodi richiesti.
     */
    public int minimumPathLength() {
        if (source == target && via.required().isEmpty()) {
            return 1;
        }
        return 2 + via.required().size();
    }

    private static void checkNode(Graph graph, int node, String role) {
        if (!graph.containsNode(node)) {
            throw new MalformedGraphException(role + " " + node + " fuori dal range 0.." + (graph.nodeCount() - 1));
        }
    }

    private static void checkNotEndpoint(int node, int source, int target) {
        if (node == source || node == target) {
            throw new MalformedGraphException("Nodo via " + node + " coincide con sorgente o destinazione");
        }
    }
}
