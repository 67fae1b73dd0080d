package org.satpath.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.satpath.baseline.BruteForcePathEnumerator;
import org.satpath.baseline.DijkstraShortestPath;
import org.satpath.encoding.ViaConstraint;
import org.satpath.encoding.WeightBoundPolicy;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.GraphGenerator;
import org.satpath.oracle.Sat4jOracle;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WeightedIterativePathSolverTest {

    private static PathSearchConfiguration configuration(WeightBoundPolicy policy) {
        return PathSearchConfiguration.builder().boundPolicy(policy).build();
    }

    /**
     * 0 -- 3 diretto con peso 20, oppure 0 -- 1 -- 2 -- 3 con peso 3.
     */
    private static AdjacencyGraph heavyShortcut() {
        AdjacencyGraph graph = AdjacencyGraph.weighted(4);
        graph.addEdge(0, 3, 20);
        graph.addEdge(0, 1, 1);
        graph.addEdge(1, 2, 1);
        graph.addEdge(2, 3, 1);
        return graph;
    }

    @ParameterizedTest(name = "seme {0}")
    @ValueSource(longs = {1, 2, 3, 4, 5, 6})
    @DisplayName("ENFORCED: peso minimo tra i percorsi con il minimo numero di archi")
    void enforcedFindsMinimumWeightAtFirstFeasibleLength(long seed) {
        Random random = new Random(seed);
        AdjacencyGraph graph = new GraphGenerator(random).connectedWeighted(8, 10);
        int source = random.nextInt(8);
        int target = (source + 1 + random.nextInt(7)) % 8;

        PathResult result = new WeightedIterativePathSolver(configuration(WeightBoundPolicy.ENFORCED))
                .solve(PathRequest.of(graph, source, target));

        BruteForcePathEnumerator bruteForce = new BruteForcePathEnumerator(graph);
        int hops = bruteForce.minimumHopCount(source, target, ViaConstraint.none()).orElseThrow();
        long expectedWeight = bruteForce.minimumWeight(source, target, ViaConstraint.none(), hops + 1).orElseThrow();

        assertAll(
                () -> assertTrue(result.isFound()),
                () -> assertEquals(hops, result.getHopCount()),
                () -> assertEquals(expectedWeight, result.getWeight()),
                () -> assertEquals(expectedWeight, PathDecoder.pathWeight(graph, result.getPath())),
                () -> assertTrue(result.getWeight() >= new DijkstraShortestPath().shortestPath(graph, source, target)
                        .distance().value())
        );
    }

    @Test
    @DisplayName("Il primo L con un candidato vince anche se un percorso più lungo è più leggero")
    void firstFeasibleLengthWins() {
        PathResult result = new WeightedIterativePathSolver().solve(PathRequest.of(heavyShortcut(), 0, 3));

        assertEquals(List.of(0, 3), result.getPath());
        assertEquals(20, result.getWeight());
        assertEquals(3, new DijkstraShortestPath().shortestPath(heavyShortcut(), 0, 3).distance().value());
    }

    @Test
    @DisplayName("HEURISTIC: percorso valido con il minimo numero di archi")
    void heuristicReturnsValidPath() {
        Random random = new Random(99);
        AdjacencyGraph graph = new GraphGenerator(random).connectedWeighted(9, 10);

        PathResult result = new WeightedIterativePathSolver(PathSearchConfiguration.builder()
                .boundPolicy(WeightBoundPolicy.HEURISTIC)
                .oracle(new Sat4jOracle())
                .build()).solve(PathRequest.of(graph, 0, 8));

        int hops = new BruteForcePathEnumerator(graph).minimumHopCount(0, 8, ViaConstraint.none()).orElseThrow();
        assertAll(
                () -> assertTrue(result.isFound()),
                () -> assertEquals(hops, result.getHopCount()),
                () -> assertEquals(PathDecoder.pathWeight(graph, result.getPath()), result.getWeight()),
                () -> assertTrue(result.getProbes().stream().allMatch(ProbeRecord::hasBound))
        );
    }

    @Test
    @DisplayName("HEURISTIC: il limite non esclude nulla, ogni probe della lunghezza trovata è SAT")
    void heuristicProbesAreAllSatisfiableAtFoundLength() {
        PathResult result = new WeightedIterativePathSolver(configuration(WeightBoundPolicy.HEURISTIC))
                .solve(PathRequest.of(heavyShortcut(), 0, 3));

        assertTrue(result.getProbes().stream()
                .filter(probe -> probe.pathLength() == 2)
                .allMatch(ProbeRecord::satisfiable));
    }

    @Test
    @DisplayName("Grafo pesato disconnesso: nessun percorso")
    void disconnectedWeightedGraph() {
        AdjacencyGraph graph = AdjacencyGraph.weighted(4);
        graph.addEdge(0, 1, 3);
        graph.addEdge(2, 3, 4);

        PathResult result = new WeightedIterativePathSolver().solve(PathRequest.of(graph, 0, 3));

        assertFalse(result.isFound());
        assertThrows(IllegalStateException.class, result::getWeight);
    }
}
