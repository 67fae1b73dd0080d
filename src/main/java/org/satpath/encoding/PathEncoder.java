package org.satpath.encoding;

import org.satpath.graph.Graph;
import org.satpath.support.CNFFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CODIFICATORE CNF - "Esiste un percorso di L posizioni da source a target?"
 *
 * VINCOLI GENERATI (variabile x(i,j) = "il nodo i occupa la posizione j"):
 * • Copertura: ogni posizione ha almeno un nodo (una clausola) e al più un nodo (coppie negative)
 * • Unicità del nodo: un nodo non occupa due posizioni (tutte le coppie oppure solo consecutive)
 * • Adiacenza: per ogni j e ogni coppia ordinata (i,k) che non è un arco, ¬x(i,j) ∨ ¬x(k,j+1)
 * • Estremi: x(source,0) e x(target,L-1) come clausole unitarie
 * • Via (opzionale): nodi richiesti in una posizione intermedia, nodi vietati ovunque
 *
 * Il codificatore è privo di stato: ogni chiamata produce una formula nuova e immutabile,
 * con clausole in ordine deterministico.
 */
public class PathEncoder {

    private static final Logger LOGGER = Logger.getLogger(PathEncoder.class.getName());

    private final NodeRepetitionPolicy repetitionPolicy;

    public PathEncoder() {
        this(NodeRepetitionPolicy.FULL_PAIRWISE);
    }

    public PathEncoder(NodeRepetitionPolicy repetitionPolicy) {
        if (repetitionPolicy == null) {
            throw new IllegalArgumentException("Politica di ripetizione non può essere null");
        }
        this.repetitionPolicy = repetitionPolicy;

        if (repetitionPolicy == NodeRepetitionPolicy.ADJACENT_ONLY) {
            LOGGER.warning("Unicità dei nodi solo tra posizioni consecutive: i percorsi decodificati possono non essere semplici");
        }
    }

    public NodeRepetitionPolicy getRepetitionPolicy() {
        return repetitionPolicy;
    }

    /**
     * Codifica il problema per una lunghezza fissata.
     *
     * @param graph grafo da interrogare (sola lettura)
     * @param source nodo in posizione 0
     * @param target nodo in posizione L-1
     * @param pathLength numero di posizioni L (≥ 1)
     * @param via vincolo sui nodi intermedi
     * @return formula CNF con variabili 1..N·L
     */
    public CNFFormula encode(Graph graph, int source, int target, int pathLength, ViaConstraint via) {
        VariableIndexer indexer = new VariableIndexer(graph.nodeCount(), pathLength);
        CNFFormula.Builder builder = CNFFormula.builder().reserveVariables(indexer.positionVariableCount());

        addStructuralClauses(builder, indexer, graph, source, target, via);

        CNFFormula formula = builder.build();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Codifica L=%d: %d variabili, %d clausole",
                    pathLength, formula.getVariableCount(), formula.getClausesCount()));
        }
        return formula;
    }

    /**
     * Aggiunge i vincoli strutturali del percorso al builder, che deve avere riservato
     * le variabili di posizione dell'indicizzatore.
     */
    void addStructuralClauses(CNFFormula.Builder builder, VariableIndexer indexer,
                              Graph graph, int source, int target, ViaConstraint via) {
        addPositionCoverage(builder, indexer);
        addNodeUniqueness(builder, indexer);
        addAdjacency(builder, indexer, graph);
        addEndpoints(builder, indexer, source, target);
        addVia(builder, indexer, via);
    }

    //region VINCOLI STRUTTURALI

    /**
     * Exactly-one per posizione: at-least-one + at-most-one a coppie.
     */
    private void addPositionCoverage(CNFFormula.Builder builder, VariableIndexer indexer) {
        int n = indexer.nodeCount();

        for (int j = 0; j < indexer.pathLength(); j++) {
            List<Integer> atLeastOne = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                atLeastOne.add(indexer.literal(i, j));
            }
            builder.addClause(atLeastOne);

            for (int i = 0; i < n; i++) {
                for (int k = i + 1; k < n; k++) {
                    builder.addClause(-indexer.literal(i, j), -indexer.literal(k, j));
                }
            }
        }
    }

    private void addNodeUniqueness(CNFFormula.Builder builder, VariableIndexer indexer) {
        int length = indexer.pathLength();

        for (int i = 0; i < indexer.nodeCount(); i++) {
            for (int j = 0; j < length; j++) {
                if (repetitionPolicy == NodeRepetitionPolicy.ADJACENT_ONLY) {
                    if (j + 1 < length) {
                        builder.addClause(-indexer.literal(i, j), -indexer.literal(i, j + 1));
                    }
                } else {
                    for (int h = j + 1; h < length; h++) {
                        builder.addClause(-indexer.literal(i, j), -indexer.literal(i, h));
                    }
                }
            }
        }
    }

    /**
     * Termine dominante, O(L·N²). La coppia (i,i) non è mai un arco e viene esclusa.
     */
    private void addAdjacency(CNFFormula.Builder builder, VariableIndexer indexer, Graph graph) {
        int n = indexer.nodeCount();

        for (int j = 0; j + 1 < indexer.pathLength(); j++) {
            for (int i = 0; i < n; i++) {
                for (int k = 0; k < n; k++) {
                    if (!graph.hasEdge(i, k)) {
                        builder.addClause(-indexer.literal(i, j), -indexer.literal(k, j + 1));
                    }
                }
            }
        }
    }

    private void addEndpoints(CNFFormula.Builder builder, VariableIndexer indexer, int source, int target) {
        builder.addClause(indexer.literal(source, 0));
        builder.addClause(indexer.literal(target, indexer.pathLength() - 1));
    }

    private void addVia(CNFFormula.Builder builder, VariableIndexer indexer, ViaConstraint via) {
        if (via == null || via.isEmpty()) {
            return;
        }
        int length = indexer.pathLength();

        for (int node : via.required()) {
            if (length < 3) {
                // Nessuna posizione intermedia: istanza insoddisfacibile
                int anchor = indexer.literal(node, 0);
                builder.addClause(anchor);
                builder.addClause(-anchor);
                continue;
            }
            List<Integer> somewhere = new ArrayList<>(length - 2);
            for (int j = 1; j < length - 1; j++) {
                somewhere.add(indexer.literal(node, j));
            }
            builder.addClause(somewhere);
        }

        for (int node : via.forbidden()) {
            for (int j = 0; j < length; j++) {
                builder.addClause(-indexer.literal(node, j));
            }
        }
    }

    //endregion
}
