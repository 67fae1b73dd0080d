package org.satpath.encoding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.oracle.CdclOracle;
import org.satpath.support.CNFFormula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathEncoderTest {

    /** Ciclo 0-1-2-3-0 */
    private static AdjacencyGraph fourCycle() {
        AdjacencyGraph graph = AdjacencyGraph.unweighted(4);
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(2, 3);
        graph.addEdge(3, 0);
        return graph;
    }

    /** Percorso lineare 0-1-2-...-(n-1) */
    private static AdjacencyGraph line(int nodes) {
        AdjacencyGraph graph = AdjacencyGraph.unweighted(nodes);
        for (int node = 0; node + 1 < nodes; node++) {
            graph.addEdge(node, node + 1);
        }
        return graph;
    }

    private static boolean satisfiable(CNFFormula formula) {
        return new CdclOracle().solve(formula).isSatisfiable();
    }

    @Nested
    @DisplayName("Struttura della formula")
    class StructureTests {

        @Test
        @DisplayName("Estremi fissati con clausole unitarie")
        void endpointsArePinned() {
            VariableIndexer indexer = new VariableIndexer(4, 3);
            CNFFormula formula = new PathEncoder().encode(fourCycle(), 0, 2, 3, ViaConstraint.none());

            assertAll(
                    () -> assertTrue(formula.getClauses().contains(List.of(indexer.literal(0, 0)))),
                    () -> assertTrue(formula.getClauses().contains(List.of(indexer.literal(2, 2)))),
                    () -> assertEquals(12, formula.getVariableCount())
            );
        }

        @Test
        @DisplayName("Numero di clausole con unicità completa")
        void clauseCountFullPairwise() {
            int n = 4;
            int length = 3;
            AdjacencyGraph graph = fourCycle();
            CNFFormula formula = new PathEncoder().encode(graph, 0, 2, length, ViaConstraint.none());

            int coverage = length * (1 + n * (n - 1) / 2);
            int uniqueness = n * length * (length - 1) / 2;
            int adjacency = (length - 1) * (n * n - 2 * graph.edgeCount());
            int endpoints = 2;

            assertEquals(coverage + uniqueness + adjacency + endpoints, formula.getClausesCount());
        }

        @Test
        @DisplayName("Numero di clausole con unicità solo consecutiva")
        void clauseCountAdjacentOnly() {
            int n = 4;
            int length = 4;
            AdjacencyGraph graph = fourCycle();
            CNFFormula formula = new PathEncoder(NodeRepetitionPolicy.ADJACENT_ONLY)
                    .encode(graph, 0, 3, length, ViaConstraint.none());

            int coverage = length * (1 + n * (n - 1) / 2);
            int uniqueness = n * (length - 1);
            int adjacency = (length - 1) * (n * n - 2 * graph.edgeCount());

            assertEquals(coverage + uniqueness + adjacency + 2, formula.getClausesCount());
        }

        @Test
        @DisplayName("Codifiche ripetute producono formule identiche")
        void encodingIsIdempotent() {
            PathEncoder encoder = new PathEncoder();
            ViaConstraint via = ViaConstraint.of(List.of(1), List.of(3));

            CNFFormula first = encoder.encode(fourCycle(), 0, 2, 3, via);
            CNFFormula second = encoder.encode(fourCycle(), 0, 2, 3, via);

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Soddisfacibilità")
    class SatisfiabilityTests {

        @Test
        @DisplayName("Sul ciclo di 4 nodi, 0 -> 2 richiede 3 posizioni")
        void fourCycleLengths() {
            PathEncoder encoder = new PathEncoder();

            assertAll(
                    () -> assertFalse(satisfiable(encoder.encode(fourCycle(), 0, 2, 2, ViaConstraint.none()))),
                    () -> assertTrue(satisfiable(encoder.encode(fourCycle(), 0, 2, 3, ViaConstraint.none()))),
                    () -> assertFalse(satisfiable(encoder.encode(fourCycle(), 0, 2, 4, ViaConstraint.none())))
            );
        }

        @Test
        @DisplayName("L = 1 è soddisfacibile solo con sorgente uguale a destinazione")
        void singlePosition() {
            PathEncoder encoder = new PathEncoder();

            assertTrue(satisfiable(encoder.encode(fourCycle(), 1, 1, 1, ViaConstraint.none())));
            assertFalse(satisfiable(encoder.encode(fourCycle(), 0, 1, 1, ViaConstraint.none())));
        }

        @Test
        @DisplayName("Unicità solo consecutiva ammette percorsi non semplici")
        void adjacentOnlyAllowsRevisits() {
            // 0-1-0-1-2 su una linea: 5 posizioni, nodo 0 e 1 ripetuti a distanza 2
            AdjacencyGraph graph = line(3);

            assertFalse(satisfiable(new PathEncoder().encode(graph, 0, 2, 5, ViaConstraint.none())));
            assertTrue(satisfiable(new PathEncoder(NodeRepetitionPolicy.ADJACENT_ONLY)
                    .encode(graph, 0, 2, 5, ViaConstraint.none())));
        }

        @Test
        @DisplayName("Nodo via richiesto forza il percorso alternativo")
        void requiredViaNode() {
            PathEncoder encoder = new PathEncoder();
            VariableIndexer indexer = new VariableIndexer(4, 3);
            CNFFormula formula = encoder.encode(fourCycle(), 0, 2, 3, ViaConstraint.requiring(List.of(3)));

            var result = new CdclOracle().solve(formula);

            assertTrue(result.isSatisfiable());
            assertTrue(result.isTrue(indexer.literal(3, 1)));
        }

        @Test
        @DisplayName("Nodi vietati su entrambe le alternative rendono l'istanza UNSAT")
        void forbiddenViaNodes() {
            CNFFormula formula = new PathEncoder().encode(fourCycle(), 0, 2, 3,
                    ViaConstraint.of(List.of(), List.of(1, 3)));

            assertFalse(satisfiable(formula));
        }

        @Test
        @DisplayName("Nodo richiesto senza posizioni intermedie: UNSAT")
        void requiredViaWithoutIntermediatePositions() {
            CNFFormula formula = new PathEncoder().encode(fourCycle(), 0, 1, 2, ViaConstraint.requiring(List.of(3)));

            assertFalse(satisfiable(formula));
        }
    }
}
