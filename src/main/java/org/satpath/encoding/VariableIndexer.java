package org.satpath.encoding;

/**
 * INDICIZZATORE VARIABILI - Biiezione (nodo, posizione) ↔ letterale CNF
 *
 * Per una lunghezza di percorso L fissata e N nodi: literal(i, j) = i·L + j + 1,
 * quindi i letterali di posizione occupano esattamente 1..N·L. L'inversa è
 * aritmetica: nodo = (v-1) / L, posizione = (v-1) % L.
 *
 * La mappatura vale solo per un'istanza con quella L: letterali di istanze diverse
 * non vanno mai mescolati. Immutabile, un nuovo indicizzatore per ogni L.
 */
public final class VariableIndexer {

    private final int nodeCount;

    private final int pathLength;

    /**
     * @param nodeCount numero di nodi N (≥ 1)
     * @param pathLength numero di posizioni L (≥ 1)
     * @throws IllegalArgumentException se i parametri non sono positivi o N·L eccede int
     */
    public VariableIndexer(int nodeCount, int pathLength) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("Numero nodi deve essere >= 1, ricevuto: " + nodeCount);
        }
        if (pathLength < 1) {
            throw new IllegalArgumentException("Lunghezza percorso deve essere >= 1, ricevuto: " + pathLength);
        }
        if ((long) nodeCount * pathLength >= Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Troppe variabili di posizione: " + nodeCount + " x " + pathLength);
        }
        this.nodeCount = nodeCount;
        this.pathLength = pathLength;
    }

    /**
     * @return letterale positivo della proposizione "il nodo occupa la posizione"
     */
    public int literal(int node, int position) {
        if (node < 0 || node >= nodeCount) {
            throw new IllegalArgumentException("Nodo fuori range 0.." + (nodeCount - 1) + ": " + node);
        }
        if (position < 0 || position >= pathLength) {
            throw new IllegalArgumentException("Posizione fuori range 0.." + (pathLength - 1) + ": " + position);
        }
        return node * pathLength + position + 1;
    }

    public int nodeOf(int literal) {
        return (checkedVariable(literal) - 1) / pathLength;
    }

    public int positionOf(int literal) {
        return (checkedVariable(literal) - 1) % pathLength;
    }

    /**
     * @return true se la variabile (in valore assoluto) è un letterale di posizione
     */
    public boolean isPositionLiteral(int variable) {
        int abs = Math.abs(variable);
        return abs >= 1 && abs <= positionVariableCount();
    }

    /**
     * @return N·L, l'ultima variabile riservata ai letterali di posizione
     */
    public int positionVariableCount() {
        return nodeCount * pathLength;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int pathLength() {
        return pathLength;
    }

    private int checkedVariable(int literal) {
        if (!isPositionLiteral(literal)) {
            throw new IllegalArgumentException("Letterale non di posizione: " + literal);
        }
        return Math.abs(literal);
    }

    @Override
    public String toString() {
        return "VariableIndexer[N=" + nodeCount + ", L=" + pathLength + "]";
    }
}
