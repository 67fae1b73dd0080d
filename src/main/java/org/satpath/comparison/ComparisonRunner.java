package org.satpath.comparison;

import org.satpath.baseline.DijkstraShortestPath;
import org.satpath.baseline.ShortestPath;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.GraphGenerator;
import org.satpath.solver.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * ESECUTORE DEL CONFRONTO - Stessa richiesta risolta via SAT e con Dijkstra
 *
 * Misura il tempo di parete di entrambe le ricerche con System.nanoTime e produce un
 * ComparisonReport. In modalità batch genera istanze connesse riproducibili a partire
 * da un seme, una per esecuzione.
 */
public class ComparisonRunner {

    private static final Logger LOGGER = Logger.getLogger(ComparisonRunner.class.getName());

    private final PathSearchConfiguration configuration;

    public ComparisonRunner(PathSearchConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
    }

    /**
     * @param weighted true per la ricerca pesata, false per il numero di archi
     */
    public ComparisonReport compare(PathRequest request, boolean weighted) {
        long satStart = System.nanoTime();
        PathResult sat = weighted
                ? new WeightedIterativePathSolver(configuration).solve(request)
                : new IterativePathSolver(configuration).solve(request);
        long satNanos = System.nanoTime() - satStart;

        long dijkstraStart = System.nanoTime();
        ShortestPath dijkstra = new DijkstraShortestPath(!weighted)
                .shortestPath(request.graph(), request.source(), request.target());
        long dijkstraNanos = System.nanoTime() - dijkstraStart;

        ComparisonReport report = new ComparisonReport(sat, dijkstra, weighted, !request.via().isEmpty(),
                satNanos, dijkstraNanos);
        if (!report.agrees()) {
            LOGGER.warning("Disaccordo SAT / Dijkstra su " + request.source() + " -> " + request.target()
                    + ": " + sat + " vs " + dijkstra);
        }
        return report;
    }

    /**
     * Confronta runs istanze casuali. L'istanza i usa il seme seed + i sia per il grafo
     * che per la scelta degli estremi.
     *
     * @param maxWeight peso massimo per le istanze pesate (ignorato se non pesato)
     */
    public BatchSummary runBatch(int runs, int nodeCount, long seed, boolean weighted, int maxWeight) {
        if (runs < 1) {
            throw new IllegalArgumentException("Numero di esecuzioni deve essere >= 1, ricevuto: " + runs);
        }
        if (nodeCount < 2) {
            throw new IllegalArgumentException("Servono almeno 2 nodi, ricevuto: " + nodeCount);
        }

        List<ComparisonReport> reports = new ArrayList<>(runs);
        for (int run = 0; run < runs; run++) {
            Random random = new Random(seed + run);
            GraphGenerator generator = new GraphGenerator(random);
            AdjacencyGraph graph = weighted
                    ? generator.connectedWeighted(nodeCount, maxWeight)
                    : generator.connected(nodeCount);

            int source = random.nextInt(nodeCount);
            int target = random.nextInt(nodeCount - 1);
            if (target >= source) {
                target++;
            }

            ComparisonReport report = compare(PathRequest.of(graph, source, target), weighted);
            LOGGER.fine(String.format("Esecuzione %d/%d: %d -> %d, accordo=%s", run + 1, runs, source, target, report.agrees()));
            reports.add(report);
        }

        BatchSummary summary = new BatchSummary(reports);
        LOGGER.info(summary.toString());
        return summary;
    }
}
