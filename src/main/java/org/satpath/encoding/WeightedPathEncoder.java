package org.satpath.encoding;

import org.satpath.graph.Graph;
import org.satpath.support.CNFFormula;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CODIFICATORE CNF PESATO - Vincoli strutturali più limite sul peso totale
 *
 * STRUTTURA:
 * • Vincoli del PathEncoder con unicità dei nodi su tutte le coppie di posizioni
 * • Letterali di selezione arco e(j,i,k) ↔ x(i,j) ∧ x(k,j+1), numerati dopo i letterali di posizione
 * • Limite B secondo la WeightBoundPolicy
 *
 * CONTATORE SEQUENZIALE PESATO (ENFORCED):
 * • d(j,w): "il passo j usa un arco di peso w", implicato da ogni e(j,i,k) con peso w
 * • p(j,s): "peso cumulato dopo il passo j ≥ s", per 1 ≤ s ≤ B
 * • Base:      d(j,w) → p(j,t) per t ≤ w
 * • Riporto:   p(j-1,s) → p(j,s)
 * • Incremento: d(j,w) ∧ p(j-1,s) → p(j,s+w)
 * • Overflow:  ¬d(j,w) ∨ ¬p(j-1,B+1-w), oppure ¬d(j,w) se w > B
 *
 * Con B ≥ peso totale del grafo il vincolo è banalmente soddisfatto e il contatore
 * non viene generato: un percorso semplice usa archi distinti.
 */
public class WeightedPathEncoder {

    private static final Logger LOGGER = Logger.getLogger(WeightedPathEncoder.class.getName());

    private final WeightBoundPolicy boundPolicy;

    private final PathEncoder structuralEncoder = new PathEncoder(NodeRepetitionPolicy.FULL_PAIRWISE);

    public WeightedPathEncoder() {
        this(WeightBoundPolicy.ENFORCED);
    }

    public WeightedPathEncoder(WeightBoundPolicy boundPolicy) {
        if (boundPolicy == null) {
            throw new IllegalArgumentException("Politica del limite di peso non può essere null");
        }
        this.boundPolicy = boundPolicy;
    }

    public WeightBoundPolicy getBoundPolicy() {
        return boundPolicy;
    }

    /**
     * Codifica "percorso di L posizioni con peso totale ≤ bound".
     *
     * @param bound limite di peso B (con HEURISTIC non vincola la formula)
     * @return formula con variabili di posizione 1..N·L seguite dalle ausiliarie
     */
    public CNFFormula encode(Graph graph, int source, int target, int pathLength, ViaConstraint via, long bound) {
        VariableIndexer indexer = new VariableIndexer(graph.nodeCount(), pathLength);
        CNFFormula.Builder builder = CNFFormula.builder().reserveVariables(indexer.positionVariableCount());

        structuralEncoder.addStructuralClauses(builder, indexer, graph, source, target, via);
        List<StepEdge> stepEdges = addEdgeSelection(builder, indexer, graph);

        switch (boundPolicy) {
            case HEURISTIC -> addHeuristicExclusion(builder, stepEdges, graph.totalWeight());
            case ENFORCED -> addWeightCounter(builder, stepEdges, pathLength - 1, bound, graph.totalWeight());
        }

        CNFFormula formula = builder.build();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Codifica pesata L=%d B=%d (%s): %d variabili, %d clausole",
                    pathLength, bound, boundPolicy, formula.getVariableCount(), formula.getClausesCount()));
        }
        return formula;
    }

    //region SELEZIONE ARCHI

    /**
     * Letterale di selezione per il passo step sull'arco orientato (from, to).
     */
    private record StepEdge(int step, int from, int to, int weight, int literal) {}

    private List<StepEdge> addEdgeSelection(CNFFormula.Builder builder, VariableIndexer indexer, Graph graph) {
        List<StepEdge> stepEdges = new ArrayList<>();

        for (int j = 0; j + 1 < indexer.pathLength(); j++) {
            for (int i = 0; i < graph.nodeCount(); i++) {
                for (int k : graph.neighbors(i)) {
                    int edge = builder.newVariable();
                    int here = indexer.literal(i, j);
                    int next = indexer.literal(k, j + 1);

                    builder.addClause(-edge, here);
                    builder.addClause(-edge, next);
                    builder.addClause(-here, -next, edge);

                    stepEdges.add(new StepEdge(j, i, k, graph.weight(i, k), edge));
                }
            }
        }
        return stepEdges;
    }

    //endregion

    //region LIMITE DI PESO

    /**
     * Esclude gli archi il cui peso supera la somma di tutti i pesi: nessun arco
     * soddisfa la condizione, quindi non viene aggiunta alcuna clausola.
     */
    private void addHeuristicExclusion(CNFFormula.Builder builder, List<StepEdge> stepEdges, long totalWeight) {
        int excluded = 0;
        for (StepEdge stepEdge : stepEdges) {
            if (stepEdge.weight() > totalWeight) {
                builder.addClause(-stepEdge.literal());
                excluded++;
            }
        }
        LOGGER.finest("Esclusione euristica: " + excluded + " archi esclusi");
    }

    private void addWeightCounter(CNFFormula.Builder builder, List<StepEdge> stepEdges,
                                  int steps, long bound, long totalWeight) {
        if (steps == 0) {
            if (bound < 0) {
                addContradiction(builder);
            }
            return;
        }
        if (bound >= totalWeight) {
            LOGGER.finest(() -> "Limite " + bound + " >= peso totale " + totalWeight + ": contatore omesso");
            return;
        }
        if (bound < 1) {
            // Ogni passo costa almeno 1
            addContradiction(builder);
            return;
        }
        int limit = Math.toIntExact(bound);

        // Classi di peso per passo, in ordine crescente di peso
        List<SortedMap<Integer, Integer>> weightClasses = new ArrayList<>(steps);
        for (int j = 0; j < steps; j++) {
            weightClasses.add(new TreeMap<>());
        }
        for (StepEdge stepEdge : stepEdges) {
            SortedMap<Integer, Integer> classes = weightClasses.get(stepEdge.step());
            Integer classLiteral = classes.get(stepEdge.weight());
            if (classLiteral == null) {
                classLiteral = builder.newVariable();
                classes.put(stepEdge.weight(), classLiteral);
            }
            builder.addClause(-stepEdge.literal(), classLiteral);
        }

        int[] previous = null;
        for (int j = 0; j < steps; j++) {
            boolean lastStep = j == steps - 1;
            int[] current = lastStep ? null : allocateThresholds(builder, limit);

            for (Map.Entry<Integer, Integer> entry : weightClasses.get(j).entrySet()) {
                int weight = entry.getKey();
                int classLiteral = entry.getValue();

                if (weight > limit) {
                    builder.addClause(-classLiteral);
                    continue;
                }
                if (previous != null) {
                    builder.addClause(-classLiteral, -previous[limit + 1 - weight]);
                }
                if (current == null) {
                    continue;
                }
                for (int t = 1; t <= weight; t++) {
                    builder.addClause(-classLiteral, current[t]);
                }
                if (previous != null) {
                    for (int s = 1; s + weight <= limit; s++) {
                        builder.addClause(-classLiteral, -previous[s], current[s + weight]);
                    }
                }
            }

            if (current != null && previous != null) {
                for (int s = 1; s <= limit; s++) {
                    builder.addClause(-previous[s], current[s]);
                }
            }
            previous = current;
        }
    }

    /**
     * @return letterali p(s) indicizzati da 1 a limit (indice 0 inutilizzato)
     */
    private static int[] allocateThresholds(CNFFormula.Builder builder, int limit) {
        int[] thresholds = new int[limit + 1];
        for (int s = 1; s <= limit; s++) {
            thresholds[s] = builder.newVariable();
        }
        return thresholds;
    }

    private static void addContradiction(CNFFormula.Builder builder) {
        builder.addClause(1);
        builder.addClause(-1);
    }

    //endregion
}
