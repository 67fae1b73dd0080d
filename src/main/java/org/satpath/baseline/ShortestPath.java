package org.satpath.baseline;

import org.satpath.graph.GraphPrinter;

import java.util.List;

/**
 * Esito di un algoritmo di riferimento: percorso (vuoto se non esiste) e distanza.
 */
public record ShortestPath(List<Integer> path, Distance distance, long elapsedNanos) {

    public ShortestPath {
        path = List.copyOf(path);
        if (path.isEmpty() == distance.isReached()) {
            throw new IllegalArgumentException("Percorso e distanza incoerenti: " + path + " / " + distance);
        }
    }

    public static ShortestPath none(long elapsedNanos) {
        return new ShortestPath(List.of(), Distance.unreached(), elapsedNanos);
    }

    public boolean isFound() {
        return distance.isReached();
    }

    /**
     * @throws IllegalStateException se nessun percorso esiste
     */
    public int hopCount() {
        if (!isFound()) {
            throw new IllegalStateException("Nessun percorso");
        }
        return path.size() - 1;
    }

    @Override
    public String toString() {
        return isFound()
                ? GraphPrinter.renderPath(path) + " (distanza " + distance + ")"
                : "nessun percorso";
    }
}
