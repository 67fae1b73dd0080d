package org.satpath.encoding;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.satpath.cdcl.SATResult;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.oracle.CdclOracle;
import org.satpath.oracle.Sat4jOracle;
import org.satpath.solver.PathDecoder;
import org.satpath.support.CNFFormula;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeightedPathEncoderTest {

    private AdjacencyGraph diamond;

    /**
     * Da 0 a 3 con due archi: via 1 (peso 2), via 2 (peso 10), via 4 (peso 10).
     */
    @BeforeEach
    void setUp() {
        diamond = AdjacencyGraph.weighted(5);
        diamond.addEdge(0, 1, 1);
        diamond.addEdge(1, 3, 1);
        diamond.addEdge(0, 2, 5);
        diamond.addEdge(2, 3, 5);
        diamond.addEdge(0, 4, 1);
        diamond.addEdge(4, 3, 9);
    }

    private static SATResult solve(CNFFormula formula) {
        return new CdclOracle().solve(formula);
    }

    @Nested
    @DisplayName("Limite codificato (ENFORCED)")
    class EnforcedTests {

        private final WeightedPathEncoder encoder = new WeightedPathEncoder(WeightBoundPolicy.ENFORCED);

        @Test
        @DisplayName("Sotto il peso minimo la formula è UNSAT")
        void belowMinimumIsUnsatisfiable() {
            assertTrue(solve(encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 1)).isUnsatisfiable());
            assertTrue(solve(encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 0)).isUnsatisfiable());
        }

        @Test
        @DisplayName("Al peso minimo resta solo il percorso leggero")
        void atMinimumOnlyLightPath() {
            SATResult result = solve(encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 2));

            assertTrue(result.isSatisfiable());
            assertEquals(List.of(0, 1, 3), PathDecoder.decode(result, new VariableIndexer(5, 3)));
        }

        @Test
        @DisplayName("Ogni modello rispetta il limite")
        void everyModelRespectsBound() {
            for (long bound = 2; bound <= 12; bound++) {
                SATResult result = new Sat4jOracle().solve(encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), bound));
                List<Integer> path = PathDecoder.decode(result, new VariableIndexer(5, 3));

                assertTrue(PathDecoder.pathWeight(diamond, path) <= bound, "Limite " + bound + " violato da " + path);
            }
        }

        @Test
        @DisplayName("Vincolo via combinato con il limite")
        void viaWithBound() {
            ViaConstraint avoidLight = ViaConstraint.of(List.of(), List.of(1));

            assertTrue(solve(encoder.encode(diamond, 0, 3, 3, avoidLight, 9)).isUnsatisfiable());
            assertTrue(solve(encoder.encode(diamond, 0, 3, 3, avoidLight, 10)).isSatisfiable());
        }

        @Test
        @DisplayName("Con L = 1 nessun passo: limite zero ammesso")
        void singlePositionHasNoSteps() {
            assertTrue(solve(encoder.encode(diamond, 2, 2, 1, ViaConstraint.none(), 0)).isSatisfiable());
        }

        @Test
        @DisplayName("Limite oltre il peso totale: contatore omesso")
        void boundAboveTotalSkipsCounter() {
            CNFFormula loose = encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), diamond.totalWeight());
            CNFFormula tight = encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 5);

            assertTrue(tight.getVariableCount() > loose.getVariableCount());
            assertTrue(tight.getClausesCount() > loose.getClausesCount());
        }
    }

    @Nested
    @DisplayName("Limite euristico (HEURISTIC)")
    class HeuristicTests {

        private final WeightedPathEncoder encoder = new WeightedPathEncoder(WeightBoundPolicy.HEURISTIC);

        @Test
        @DisplayName("Il limite non vincola la formula")
        void boundDoesNotConstrain() {
            CNFFormula zero = encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 0);
            CNFFormula large = encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 100);

            assertEquals(zero, large);
            assertTrue(solve(zero).isSatisfiable());
        }

        @Test
        @DisplayName("Stesse clausole della codifica con limite non vincolante")
        void sameClausesAsLooseEnforcedEncoding() {
            CNFFormula heuristic = encoder.encode(diamond, 0, 3, 3, ViaConstraint.none(), 0);
            CNFFormula enforced = new WeightedPathEncoder(WeightBoundPolicy.ENFORCED)
                    .encode(diamond, 0, 3, 3, ViaConstraint.none(), diamond.totalWeight());

            assertEquals(enforced, heuristic);
        }
    }

    @Test
    @DisplayName("Letterali di selezione arco dopo i letterali di posizione")
    void edgeLiteralsFollowPositionLiterals() {
        CNFFormula formula = new WeightedPathEncoder(WeightBoundPolicy.HEURISTIC)
                .encode(diamond, 0, 3, 3, ViaConstraint.none(), 0);

        // 5 nodi x 3 posizioni + 2 passi x 12 archi orientati
        assertEquals(15 + 2 * 12, formula.getVariableCount());
    }
}
