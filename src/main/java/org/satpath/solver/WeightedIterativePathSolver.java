package org.satpath.solver;

import org.satpath.cdcl.SATResult;
import org.satpath.encoding.VariableIndexer;
import org.satpath.encoding.WeightBoundPolicy;
import org.satpath.encoding.WeightedPathEncoder;
import org.satpath.oracle.OracleFailureException;
import org.satpath.support.CNFFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE ITERATIVO PESATO - Lunghezza crescente e ricerca binaria sul limite di peso
 *
 * ALGORITMO:
 * 1. Per L crescente fino a N, ricerca binaria di B in [0, peso totale del grafo]
 * 2. SAT: decodifica, calcola il peso reale e aggiorna il migliore; il limite superiore scende
 * 3. UNSAT: il limite inferiore sale
 * 4. Al primo L con almeno un candidato restituisce il migliore trovato per quella L
 *
 * Il risultato ha il minimo numero di archi e, con WeightBoundPolicy.ENFORCED, il peso
 * minimo tra i percorsi di quella lunghezza. Un percorso più lungo ma più leggero non
 * viene considerato.
 */
public class WeightedIterativePathSolver {

    private static final Logger LOGGER = Logger.getLogger(WeightedIterativePathSolver.class.getName());

    private final PathSearchConfiguration configuration;

    private final WeightedPathEncoder encoder;

    public WeightedIterativePathSolver(PathSearchConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
        this.encoder = new WeightedPathEncoder(configuration.getBoundPolicy());
    }

    public WeightedIterativePathSolver() {
        this(PathSearchConfiguration.defaults());
    }

    /**
     * @return percorso con il minimo numero di archi e il miglior peso trovato, oppure PathResult.noPath
     * @throws OracleFailureException se l'oracolo fallisce su un probe
     */
    public PathResult solve(PathRequest request) {
        long startTime = System.currentTimeMillis();
        List<ProbeRecord> probes = new ArrayList<>();
        int maxLength = request.graph().nodeCount();
        long totalWeight = request.graph().totalWeight();
        String solverName = configuration.getOracle().name();

        LOGGER.fine(() -> String.format("Ricerca pesata %d -> %d su %d nodi, peso totale %d (%s)",
                request.source(), request.target(), maxLength, totalWeight, configuration));

        for (int length = request.minimumPathLength(); length <= maxLength; length++) {
            Candidate best = searchBound(request, length, totalWeight, probes);

            if (best != null) {
                LOGGER.info(String.format("Percorso pesato trovato: L=%d, peso %d, %d probe",
                        length, best.weight(), probes.size()));
                return PathResult.found(best.path(), best.weight(), probes,
                        System.currentTimeMillis() - startTime, solverName);
            }
        }

        LOGGER.info(String.format("Nessun percorso pesato %d -> %d dopo %d probe",
                request.source(), request.target(), probes.size()));
        return PathResult.noPath(probes, System.currentTimeMillis() - startTime, solverName);
    }

    private record Candidate(List<Integer> path, long weight) {}

    /**
     * Ricerca binaria del limite per una lunghezza fissata.
     *
     * @return miglior candidato per la lunghezza, null se nessun probe è soddisfacibile
     */
    private Candidate searchBound(PathRequest request, int length, long totalWeight, List<ProbeRecord> probes) {
        VariableIndexer indexer = new VariableIndexer(request.graph().nodeCount(), length);
        Candidate best = null;
        long low = 0;
        long high = totalWeight;

        while (low <= high) {
            long bound = low + (high - low) / 2;
            long start = System.currentTimeMillis();

            CNFFormula formula = encoder.encode(request.graph(), request.source(), request.target(),
                    length, request.via(), bound);
            SATResult result = configuration.getOracle().solve(formula);

            ProbeRecord record = new ProbeRecord(length, bound, result.isSatisfiable(),
                    formula.getVariableCount(), formula.getClausesCount(), System.currentTimeMillis() - start);
            probes.add(record);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Probe " + record);
            }

            if (result.isUnsatisfiable()) {
                low = bound + 1;
                continue;
            }

            List<Integer> path = PathDecoder.decode(result, indexer);
            long weight = PathDecoder.pathWeight(request.graph(), path);
            if (best == null || weight < best.weight()) {
                best = new Candidate(path, weight);
            }

            if (encoder.getBoundPolicy() == WeightBoundPolicy.ENFORCED) {
                high = Math.min(bound, weight) - 1;
            } else {
                high = bound - 1;
            }
        }
        return best;
    }
}
