package org.satpath.solver;

import org.satpath.cdcl.SATResult;
import org.satpath.encoding.VariableIndexer;
import org.satpath.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodifica di un modello SAT in un percorso: per ogni posizione il nodo il cui
 * letterale di posizione è vero.
 */
public final class PathDecoder {

    private PathDecoder() {
    }

    /**
     * @return L nodi nell'ordine delle posizioni
     * @throws IllegalArgumentException se il risultato è UNSAT
     * @throws IllegalStateException se una posizione non ha esattamente un nodo vero
     */
    public static List<Integer> decode(SATResult result, VariableIndexer indexer) {
        if (!result.isSatisfiable()) {
            throw new IllegalArgumentException("Impossibile decodificare un risultato UNSAT");
        }
        List<Integer> path = new ArrayList<>(indexer.pathLength());

        for (int j = 0; j < indexer.pathLength(); j++) {
            int occupant = -1;
            for (int i = 0; i < indexer.nodeCount(); i++) {
                if (result.isTrue(indexer.literal(i, j))) {
                    if (occupant != -1) {
                        throw new IllegalStateException("Posizione " + j + " occupata da " + occupant + " e " + i);
                    }
                    occupant = i;
                }
            }
            if (occupant == -1) {
                throw new IllegalStateException("Nessun nodo in posizione " + j);
            }
            path.add(occupant);
        }
        return path;
    }

    /**
     * Somma dei pesi degli archi consecutivi del percorso.
     *
     * @throws IllegalArgumentException se due nodi consecutivi non sono adiacenti
     */
    public static long pathWeight(Graph graph, List<Integer> path) {
        long total = 0;
        for (int j = 0; j + 1 < path.size(); j++) {
            total += graph.weight(path.get(j), path.get(j + 1));
        }
        return total;
    }
}
