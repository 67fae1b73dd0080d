package org.satpath.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.satpath.baseline.BruteForcePathEnumerator;
import org.satpath.baseline.DijkstraShortestPath;
import org.satpath.baseline.ShortestPath;
import org.satpath.cdcl.SATResult;
import org.satpath.encoding.NodeRepetitionPolicy;
import org.satpath.encoding.ViaConstraint;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.Graph;
import org.satpath.graph.GraphGenerator;
import org.satpath.oracle.OracleFailureException;
import org.satpath.oracle.Sat4jOracle;
import org.satpath.oracle.SatOracle;
import org.satpath.support.CNFFormula;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IterativePathSolverTest {

    private static AdjacencyGraph fourCycle() {
        AdjacencyGraph graph = AdjacencyGraph.unweighted(4);
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(2, 3);
        graph.addEdge(3, 0);
        return graph;
    }

    private static void assertValidPath(Graph graph, int source, int target, List<Integer> path) {
        assertAll("Percorso " + path,
                () -> assertEquals(source, path.get(0), "Sorgente"),
                () -> assertEquals(target, path.get(path.size() - 1), "Destinazione"),
                () -> assertEquals(path.size(), new HashSet<>(path).size(), "Nodi ripetuti"),
                () -> {
                    for (int j = 0; j + 1 < path.size(); j++) {
                        assertTrue(graph.hasEdge(path.get(j), path.get(j + 1)),
                                "Arco mancante " + path.get(j) + " -- " + path.get(j + 1));
                    }
                }
        );
    }

    @Nested
    @DisplayName("Esempi di riferimento")
    class ReferenceExamples {

        @Test
        @DisplayName("Ciclo di 4 nodi: 0 -> 2 in 2 archi")
        void fourCycle_sourceZeroTargetTwo() {
            PathResult result = new IterativePathSolver().solve(PathRequest.of(fourCycle(), 0, 2));
            ShortestPath dijkstra = new DijkstraShortestPath(true).shortestPath(fourCycle(), 0, 2);

            assertAll(
                    () -> assertTrue(result.isFound()),
                    () -> assertEquals(2, result.getHopCount()),
                    () -> assertTrue(List.of(List.of(0, 1, 2), List.of(0, 3, 2)).contains(result.getPath())),
                    () -> assertEquals(2, dijkstra.hopCount()),
                    () -> assertTrue(List.of(List.of(0, 1, 2), List.of(0, 3, 2)).contains(dijkstra.path()))
            );
        }

        @Test
        @DisplayName("Grafo disconnesso: nessun percorso dopo aver esaurito L fino a N")
        void disconnectedGraph() {
            AdjacencyGraph graph = new GraphGenerator(new Random(3)).disconnected(6, 3);

            PathResult result = new IterativePathSolver().solve(PathRequest.of(graph, 0, 5));

            assertAll(
                    () -> assertFalse(result.isFound()),
                    () -> assertTrue(result.getPath().isEmpty()),
                    () -> assertEquals(5, result.getProbeCount(), "Probe per L = 2..6"),
                    () -> assertTrue(result.getProbes().stream().noneMatch(ProbeRecord::satisfiable)),
                    () -> assertThrows(IllegalStateException.class, result::getHopCount),
                    () -> assertFalse(new DijkstraShortestPath().shortestPath(graph, 0, 5).isFound())
            );
        }

        @Test
        @DisplayName("Sorgente uguale a destinazione: percorso di un nodo")
        void sourceEqualsTarget() {
            PathResult result = new IterativePathSolver().solve(PathRequest.of(fourCycle(), 2, 2));

            assertEquals(List.of(2), result.getPath());
            assertEquals(0, result.getHopCount());
        }
    }

    @Nested
    @DisplayName("Proprietà su grafi casuali")
    class RandomGraphProperties {

        @ParameterizedTest(name = "seme {0}")
        @ValueSource(longs = {1, 2, 3, 5, 8, 13, 21, 34})
        @DisplayName("Numero di archi uguale a Dijkstra, percorso valido")
        void matchesDijkstra(long seed) {
            Random random = new Random(seed);
            AdjacencyGraph graph = new GraphGenerator(random).connected(12);
            int source = random.nextInt(12);
            int target = (source + 1 + random.nextInt(11)) % 12;

            PathResult result = new IterativePathSolver().solve(PathRequest.of(graph, source, target));
            ShortestPath dijkstra = new DijkstraShortestPath(true).shortestPath(graph, source, target);

            assertTrue(result.isFound());
            assertEquals(dijkstra.hopCount(), result.getHopCount());
            assertValidPath(graph, source, target, result.getPath());
            // Nessuna lunghezza precedente era soddisfacibile
            List<ProbeRecord> probes = result.getProbes();
            assertTrue(probes.subList(0, probes.size() - 1).stream().noneMatch(ProbeRecord::satisfiable));
        }

        @ParameterizedTest(name = "seme {0}")
        @ValueSource(longs = {4, 9, 16})
        @DisplayName("Ricerca parallela equivalente a quella sequenziale")
        void parallelMatchesSequential(long seed) {
            Random random = new Random(seed);
            AdjacencyGraph graph = new GraphGenerator(random).connected(14);
            PathRequest request = PathRequest.of(graph, 0, 13);

            PathResult sequential = new IterativePathSolver().solve(request);
            PathResult parallel = new IterativePathSolver(PathSearchConfiguration.builder()
                    .oracle(new Sat4jOracle())
                    .parallelism(3)
                    .build()).solve(request);

            assertEquals(sequential.getHopCount(), parallel.getHopCount());
            assertValidPath(graph, 0, 13, parallel.getPath());
        }

        @Test
        @DisplayName("Nodi via: lunghezza pari al minimo della ricerca esaustiva")
        void viaConstraintMatchesBruteForce() {
            Random random = new Random(77);
            AdjacencyGraph graph = new GraphGenerator(random).connected(9);
            ViaConstraint via = ViaConstraint.of(List.of(4), List.of(6));
            PathRequest request = new PathRequest(graph, 0, 8, via);

            PathResult result = new IterativePathSolver().solve(request);
            var expected = new BruteForcePathEnumerator(graph).minimumHopCount(0, 8, via);

            assertEquals(expected.isPresent(), result.isFound());
            if (result.isFound()) {
                assertEquals(expected.getAsInt(), result.getHopCount());
                assertTrue(result.getPath().contains(4));
                assertFalse(result.getPath().contains(6));
                assertValidPath(graph, 0, 8, result.getPath());
            }
        }
    }

    @Test
    @DisplayName("Unicità solo consecutiva: stessa lunghezza minima")
    void adjacentOnlyFindsSameHopCount() {
        AdjacencyGraph graph = new GraphGenerator(new Random(11)).connected(10);
        PathSearchConfiguration configuration = PathSearchConfiguration.builder()
                .repetitionPolicy(NodeRepetitionPolicy.ADJACENT_ONLY)
                .build();

        PathResult weak = new IterativePathSolver(configuration).solve(PathRequest.of(graph, 1, 7));
        PathResult full = new IterativePathSolver().solve(PathRequest.of(graph, 1, 7));

        assertEquals(full.getHopCount(), weak.getHopCount());
    }

    @Test
    @DisplayName("Il fallimento dell'oracolo non viene trattato come UNSAT")
    void oracleFailurePropagates() {
        SatOracle failing = new SatOracle() {
            @Override
            public SATResult solve(CNFFormula formula) {
                throw new OracleFailureException("memoria esaurita");
            }

            @Override
            public String name() {
                return "failing";
            }
        };
        IterativePathSolver solver = new IterativePathSolver(PathSearchConfiguration.builder().oracle(failing).build());

        assertThrows(OracleFailureException.class, () -> solver.solve(PathRequest.of(fourCycle(), 0, 2)));
    }

    @Test
    @DisplayName("Fallimento in modalità parallela propagato al chiamante")
    void oracleFailurePropagatesInParallel() {
        SatOracle failing = new SatOracle() {
            @Override
            public SATResult solve(CNFFormula formula) {
                throw new IllegalStateException("errore interno");
            }

            @Override
            public String name() {
                return "failing";
            }
        };
        IterativePathSolver solver = new IterativePathSolver(PathSearchConfiguration.builder()
                .oracle(failing)
                .parallelism(2)
                .build());

        assertThrows(OracleFailureException.class, () -> solver.solve(PathRequest.of(fourCycle(), 0, 2)));
    }

    @Test
    @DisplayName("Ricerca parallela: i probe più lunghi ancora in corso vengono interrotti")
    void parallelSearchInterruptsSlowerProbes() throws InterruptedException {
        AtomicInteger started = new AtomicInteger();
        AtomicInteger stopped = new AtomicInteger();
        SatOracle slowBeyondShortest = new SatOracle() {
            private final Sat4jOracle delegate = new Sat4jOracle();

            @Override
            public SATResult solve(CNFFormula formula) {
                // 4 nodi x L=2: solo il probe più corto risponde subito
                if (formula.getVariableCount() <= 8) {
                    return delegate.solve(formula);
                }
                started.incrementAndGet();
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    stopped.incrementAndGet();
                    Thread.currentThread().interrupt();
                    throw new OracleFailureException("Probe annullato", e);
                }
                throw new IllegalStateException("Probe non annullato");
            }

            @Override
            public String name() {
                return "slow";
            }
        };
        IterativePathSolver solver = new IterativePathSolver(PathSearchConfiguration.builder()
                .oracle(slowBeyondShortest)
                .parallelism(3)
                .build());

        PathResult result = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> solver.solve(PathRequest.of(fourCycle(), 0, 1)));

        long deadline = System.currentTimeMillis() + 5_000;
        while (stopped.get() < started.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertAll(
                () -> assertEquals(List.of(0, 1), result.getPath()),
                () -> assertEquals(started.get(), stopped.get())
        );
    }
}
