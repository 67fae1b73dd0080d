package org.satpath.baseline;

import org.satpath.graph.Graph;
import org.satpath.graph.MalformedGraphException;

import java.util.*;
import java.util.logging.Logger;

/**
 * DIJKSTRA - Algoritmo di riferimento indipendente dalla codifica CNF
 *
 * Rilassamento con coda di priorità su pesi non negativi, terminazione anticipata
 * all'estrazione della destinazione, ricostruzione tramite predecessori. Con
 * unitWeights ogni arco vale 1 e la distanza è il numero di archi.
 */
public class DijkstraShortestPath {

    private static final Logger LOGGER = Logger.getLogger(DijkstraShortestPath.class.getName());

    private static final int NO_PREDECESSOR = -1;

    private final boolean unitWeights;

    /**
     * @param unitWeights true per ignorare i pesi e contare gli archi
     */
    public DijkstraShortestPath(boolean unitWeights) {
        this.unitWeights = unitWeights;
    }

    public DijkstraShortestPath() {
        this(false);
    }

    private record QueueEntry(int node, long distance) {}

    /**
     * @throws MalformedGraphException se source o target sono fuori range
     */
    public ShortestPath shortestPath(Graph graph, int source, int target) {
        if (!graph.containsNode(source) || !graph.containsNode(target)) {
            throw new MalformedGraphException("Estremi fuori range 0.." + (graph.nodeCount() - 1)
                    + ": " + source + " -> " + target);
        }
        long startTime = System.nanoTime();
        int n = graph.nodeCount();

        Distance[] distances = new Distance[n];
        Arrays.fill(distances, Distance.unreached());
        int[] predecessors = new int[n];
        Arrays.fill(predecessors, NO_PREDECESSOR);
        boolean[] settled = new boolean[n];

        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(Comparator.comparingLong(QueueEntry::distance));
        distances[source] = Distance.reached(0);
        queue.add(new QueueEntry(source, 0));

        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            int node = entry.node();
            if (settled[node]) {
                continue;
            }
            settled[node] = true;
            if (node == target) {
                break;
            }

            for (int neighbor : graph.neighbors(node)) {
                if (settled[neighbor]) {
                    continue;
                }
                Distance candidate = distances[node].plus(unitWeights ? 1 : graph.weight(node, neighbor));
                if (candidate.compareTo(distances[neighbor]) < 0) {
                    distances[neighbor] = candidate;
                    predecessors[neighbor] = node;
                    queue.add(new QueueEntry(neighbor, candidate.value()));
                }
            }
        }

        List<Integer> path = reconstruct(predecessors, source, target);
        long elapsed = System.nanoTime() - startTime;
        if (path.isEmpty()) {
            LOGGER.fine(() -> "Dijkstra: nessun percorso " + source + " -> " + target);
            return ShortestPath.none(elapsed);
        }
        return new ShortestPath(path, distances[target], elapsed);
    }

    /**
     * @return percorso da source a target, vuoto se la catena di predecessori non parte da source
     */
    private static List<Integer> reconstruct(int[] predecessors, int source, int target) {
        LinkedList<Integer> path = new LinkedList<>();
        int current = target;
        while (current != NO_PREDECESSOR) {
            path.addFirst(current);
            if (current == source) {
                return path;
            }
            current = predecessors[current];
        }
        return List.of();
    }
}
