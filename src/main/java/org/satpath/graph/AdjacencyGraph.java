package org.satpath.graph;

import java.util.*;
import java.util.logging.Logger;

/**
 * GRAFO A LISTE DI ADIACENZA - Rappresentazione non orientata con pesi opzionali
 *
 * Ogni nodo possiede una mappa ordinata vicino → peso. Per la variante non pesata
 * tutti i pesi valgono 1 e la mappa si comporta come un insieme di vicini.
 *
 * INVARIANTI:
 * - Simmetria: (a, b) presente ⇔ (b, a) presente con lo stesso peso
 * - Nessun self-loop, pesi sempre > 0
 * - Vicini iterati in ordine crescente (codifiche deterministiche)
 */
public class AdjacencyGraph implements Graph {

    private static final Logger LOGGER = Logger.getLogger(AdjacencyGraph.class.getName());

    /** Peso implicito degli archi nei grafi non pesati */
    public static final int UNIT_WEIGHT = 1;

    //region STRUTTURE DATI

    private final List<NavigableMap<Integer, Integer>> adjacency;

    private final boolean weighted;

    private int edgeCount;

    private long totalWeight;

    //endregion

    //region COSTRUZIONE

    private AdjacencyGraph(int nodeCount, boolean weighted) {
        if (nodeCount < 1) {
            throw new MalformedGraphException("Il grafo deve contenere almeno un nodo, ricevuto: " + nodeCount);
        }

        this.weighted = weighted;
        this.adjacency = new ArrayList<>(nodeCount);
        for (int node = 0; node < nodeCount; node++) {
            adjacency.add(new TreeMap<>());
        }
    }

    /**
     * Crea un grafo non pesato senza archi.
     *
     * @param nodeCount numero di nodi (≥ 1)
     */
    public static AdjacencyGraph unweighted(int nodeCount) {
        return new AdjacencyGraph(nodeCount, false);
    }

    /**
     * Crea un grafo pesato senza archi.
     *
     * @param nodeCount numero di nodi (≥ 1)
     */
    public static AdjacencyGraph weighted(int nodeCount) {
        return new AdjacencyGraph(nodeCount, true);
    }

    /**
     * Aggiunge un arco non orientato di peso unitario.
     *
     * @return true se l'arco è nuovo, false se era già presente
     */
    public boolean addEdge(int a, int b) {
        return addEdge(a, b, UNIT_WEIGHT);
    }

    /**
     * Aggiunge un arco non orientato con peso esplicito.
     *
     * @return true se l'arco è nuovo, false se era già presente (peso invariato)
     * @throws MalformedGraphException per nodi fuori range, self-loop, pesi non positivi
     *         o pesi diversi da 1 in un grafo non pesato
     */
    public boolean addEdge(int a, int b, int weight) {
        validateEdge(a, b, weight);

        if (adjacency.get(a).containsKey(b)) {
            LOGGER.finest("Arco duplicato ignorato: " + a + " -- " + b);
            return false;
        }

        adjacency.get(a).put(b, weight);
        adjacency.get(b).put(a, weight);
        edgeCount++;
        totalWeight += weight;
        return true;
    }

    private void validateEdge(int a, int b, int weight) {
        if (!containsNode(a) || !containsNode(b)) {
            throw new MalformedGraphException(String.format(
                    "Arco %d -- %d fuori dal range dei nodi [0, %d)", a, b, nodeCount()));
        }
        if (a == b) {
            throw new MalformedGraphException("Self-loop non ammesso sul nodo " + a);
        }
        if (weight <= 0) {
            throw new MalformedGraphException(String.format(
                    "Peso non positivo sull'arco %d -- %d: %d", a, b, weight));
        }
        if (!weighted && weight != UNIT_WEIGHT) {
            throw new MalformedGraphException(String.format(
                    "Grafo non pesato: l'arco %d -- %d non può avere peso %d", a, b, weight));
        }
    }

    //endregion

    //region INTERROGAZIONE

    @Override
    public int nodeCount() {
        return adjacency.size();
    }

    @Override
    public Set<Integer> neighbors(int node) {
        checkNode(node);
        return Collections.unmodifiableSet(adjacency.get(node).navigableKeySet());
    }

    @Override
    public int weight(int a, int b) {
        checkNode(a);
        Integer weight = adjacency.get(a).get(b);
        if (weight == null) {
            throw new IllegalArgumentException("Arco inesistente: " + a + " -- " + b);
        }
        return weight;
    }

    @Override
    public boolean hasEdge(int a, int b) {
        return containsNode(a) && adjacency.get(a).containsKey(b);
    }

    @Override
    public boolean isWeighted() {
        return weighted;
    }

    @Override
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public long totalWeight() {
        return totalWeight;
    }

    /**
     * Elenca gli archi non orientati una sola volta (from &lt; to), in ordine crescente.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (int from = 0; from < adjacency.size(); from++) {
            for (Map.Entry<Integer, Integer> entry : adjacency.get(from).tailMap(from, false).entrySet()) {
                edges.add(new Edge(from, entry.getKey(), entry.getValue()));
            }
        }
        return edges;
    }

    private void checkNode(int node) {
        if (!containsNode(node)) {
            throw new IllegalArgumentException(String.format(
                    "Nodo %d fuori dal range [0, %d)", node, nodeCount()));
        }
    }

    //endregion

    @Override
    public String toString() {
        return String.format("AdjacencyGraph{nodi=%d, archi=%d, pesato=%s}", nodeCount(), edgeCount, weighted);
    }

    /**
     * Arco non orientato con peso.
     */
    public record Edge(int from, int to, int weight) {}
}
