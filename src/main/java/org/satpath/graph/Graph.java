package org.satpath.graph;

import java.util.Set;

/**
 * GRAFO NON ORIENTATO - Accesso in sola lettura richiesto dal core
 *
 * I nodi sono interi contigui 0..N-1. Per i grafi non pesati ogni arco ha peso 1.
 * Il grafo appartiene al chiamante: codificatori e solutori lo interrogano soltanto.
 */
public interface Graph {

    /**
     * @return numero di nodi N
     */
    int nodeCount();

    /**
     * @param node nodo in 0..N-1
     * @return insieme immutabile dei vicini del nodo
     */
    Set<Integer> neighbors(int node);

    /**
     * Peso dell'arco (a, b).
     *
     * @return peso positivo, 1 per grafi non pesati
     * @throws IllegalArgumentException se l'arco non esiste
     */
    int weight(int a, int b);

    boolean hasEdge(int a, int b);

    /**
     * @return true se almeno un arco ha un peso esplicito
     */
    boolean isWeighted();

    /**
     * @return numero di archi non orientati
     */
    int edgeCount();

    /**
     * Somma dei pesi di tutti gli archi, ciascuno contato una volta.
     * Nessun percorso semplice può superare questo valore.
     */
    long totalWeight();

    /**
     * @return true se node appartiene a 0..N-1
     */
    default boolean containsNode(int node) {
        return node >= 0 && node < nodeCount();
    }
}
