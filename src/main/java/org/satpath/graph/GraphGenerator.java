package org.satpath.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * GENERATORE GRAFI CASUALI - Istanze connesse riproducibili
 *
 * Costruisce grafi connessi a partire da un albero ricoprente casuale, poi aggiunge
 * N tentativi di archi extra (i duplicati vengono scartati). La sorgente di casualità
 * è sempre passata esplicitamente: lo stesso seme produce sempre lo stesso grafo.
 *
 * PROCESSO:
 * 1. Permutazione casuale dei nodi
 * 2. Collegamento dei nodi consecutivi nella permutazione (albero ricoprente)
 * 3. N coppie casuali distinte aggiunte se non già collegate
 * 4. Pesi uniformi in 1..maxWeight per la variante pesata
 */
public class GraphGenerator {

    private static final Logger LOGGER = Logger.getLogger(GraphGenerator.class.getName());

    /** Peso massimo di default per la variante pesata */
    public static final int DEFAULT_MAX_WEIGHT = 10;

    private final Random random;

    /**
     * @param random sorgente di casualità, tipicamente {@code new Random(seed)}
     */
    public GraphGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random non può essere null");
        }
        this.random = random;
    }

    /**
     * Genera un grafo connesso non pesato.
     *
     * @param nodeCount numero di nodi (≥ 1)
     */
    public AdjacencyGraph connected(int nodeCount) {
        AdjacencyGraph graph = AdjacencyGraph.unweighted(nodeCount);
        populate(graph, 1);
        return graph;
    }

    /**
     * Genera un grafo connesso con pesi interi positivi.
     *
     * @param nodeCount numero di nodi (≥ 1)
     * @param maxWeight peso massimo (≥ 1)
     */
    public AdjacencyGraph connectedWeighted(int nodeCount, int maxWeight) {
        if (maxWeight < 1) {
            throw new IllegalArgumentException("Peso massimo deve essere >= 1, ricevuto: " + maxWeight);
        }
        AdjacencyGraph graph = AdjacencyGraph.weighted(nodeCount);
        populate(graph, maxWeight);
        return graph;
    }

    /**
     * Genera un grafo con due componenti connesse: nodi 0..splitAt-1 e splitAt..N-1.
     * Nessun arco collega le due componenti.
     */
    public AdjacencyGraph disconnected(int nodeCount, int splitAt) {
        if (splitAt < 1 || splitAt >= nodeCount) {
            throw new IllegalArgumentException(String.format(
                    "splitAt deve essere in [1, %d), ricevuto: %d", nodeCount, splitAt));
        }

        AdjacencyGraph graph = AdjacencyGraph.unweighted(nodeCount);
        linkComponent(graph, 0, splitAt);
        linkComponent(graph, splitAt, nodeCount);
        return graph;
    }

    private void populate(AdjacencyGraph graph, int maxWeight) {
        int nodeCount = graph.nodeCount();

        List<Integer> nodes = new ArrayList<>(nodeCount);
        for (int node = 0; node < nodeCount; node++) {
            nodes.add(node);
        }
        Collections.shuffle(nodes, random);

        // Albero ricoprente: garantisce la connessione
        for (int i = 0; i < nodeCount - 1; i++) {
            graph.addEdge(nodes.get(i), nodes.get(i + 1), drawWeight(graph, maxWeight));
        }

        // Archi extra: un tentativo per nodo
        int added = 0;
        if (nodeCount >= 2) {
            for (int attempt = 0; attempt < nodeCount; attempt++) {
                int u = random.nextInt(nodeCount);
                int v = random.nextInt(nodeCount - 1);
                if (v >= u) {
                    v++;
                }
                if (!graph.hasEdge(u, v) && graph.addEdge(u, v, drawWeight(graph, maxWeight))) {
                    added++;
                }
            }
        }

        LOGGER.fine(String.format("Grafo generato: %d nodi, %d archi (%d extra)",
                nodeCount, graph.edgeCount(), added));
    }

    private void linkComponent(AdjacencyGraph graph, int fromInclusive, int toExclusive) {
        List<Integer> nodes = new ArrayList<>();
        for (int node = fromInclusive; node < toExclusive; node++) {
            nodes.add(node);
        }
        Collections.shuffle(nodes, random);
        for (int i = 0; i < nodes.size() - 1; i++) {
            graph.addEdge(nodes.get(i), nodes.get(i + 1));
        }
    }

    private int drawWeight(AdjacencyGraph graph, int maxWeight) {
        return graph.isWeighted() ? 1 + random.nextInt(maxWeight) : AdjacencyGraph.UNIT_WEIGHT;
    }
}
