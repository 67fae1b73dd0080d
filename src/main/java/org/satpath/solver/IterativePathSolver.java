package org.satpath.solver;

import org.satpath.cdcl.SATResult;
import org.satpath.encoding.PathEncoder;
import org.satpath.encoding.VariableIndexer;
import org.satpath.oracle.OracleFailureException;
import org.satpath.oracle.SatOracle;
import org.satpath.support.CNFFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE ITERATIVO NON PESATO - Ricerca della lunghezza minima per tentativi crescenti
 *
 * ALGORITMO:
 * 1. L parte dalla lunghezza minima ammessa dalla richiesta (2 per estremi distinti)
 * 2. Codifica e risolve: il primo L soddisfacibile è per costruzione il più corto
 * 3. Se nessun L fino a N è soddisfacibile il risultato è "nessun percorso"
 *
 * MODALITÀ PARALLELA:
 * Con parallelismo p > 1 i probe di una finestra di p lunghezze consecutive vengono
 * eseguiti insieme; vince il più piccolo L soddisfacibile della finestra e le finestre
 * avanzano in ordine crescente, quindi il risultato coincide con la ricerca sequenziale.
 *
 * Un fallimento dell'oracolo interrompe la ricerca e viene propagato al chiamante.
 */
public class IterativePathSolver {

    private static final Logger LOGGER = Logger.getLogger(IterativePathSolver.class.getName());

    private final PathSearchConfiguration configuration;

    private final PathEncoder encoder;

    public IterativePathSolver(PathSearchConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
        this.encoder = new PathEncoder(configuration.getRepetitionPolicy());
    }

    public IterativePathSolver() {
        this(PathSearchConfiguration.defaults());
    }

    /**
     * @return percorso più corto per numero di archi, oppure PathResult.noPath
     * @throws OracleFailureException se l'oracolo fallisce su un probe
     */
    public PathResult solve(PathRequest request) {
        long startTime = System.currentTimeMillis();
        List<ProbeRecord> probes = new ArrayList<>();
        int maxLength = request.graph().nodeCount();

        LOGGER.fine(() -> String.format("Ricerca %d -> %d su %d nodi (%s)",
                request.source(), request.target(), maxLength, configuration));

        List<Integer> path = configuration.isParallel()
                ? searchParallel(request, maxLength, probes)
                : searchSequential(request, maxLength, probes);

        long elapsed = System.currentTimeMillis() - startTime;
        String solverName = configuration.getOracle().name();

        if (path == null) {
            LOGGER.info(String.format("Nessun percorso %d -> %d dopo %d probe", request.source(), request.target(), probes.size()));
            return PathResult.noPath(probes, elapsed, solverName);
        }

        LOGGER.info(String.format("Percorso di %d archi trovato alla lunghezza L=%d dopo %d probe",
                path.size() - 1, path.size(), probes.size()));
        return PathResult.found(path, PathDecoder.pathWeight(request.graph(), path), probes, elapsed, solverName);
    }

    //region RICERCA SEQUENZIALE

    private List<Integer> searchSequential(PathRequest request, int maxLength, List<ProbeRecord> probes) {
        for (int length = request.minimumPathLength(); length <= maxLength; length++) {
            Probe probe = probe(request, length);
            probes.add(probe.record());

            if (probe.result().isSatisfiable()) {
                return decode(request, length, probe.result());
            }
        }
        return null;
    }

    //endregion

    //region RICERCA PARALLELA

    private List<Integer> searchParallel(PathRequest request, int maxLength, List<ProbeRecord> probes) {
        int window = configuration.getParallelism();
        ExecutorService executor = Executors.newFixedThreadPool(window);

        try {
            for (int first = request.minimumPathLength(); first <= maxLength; first += window) {
                int last = Math.min(first + window - 1, maxLength);

                List<Future<Probe>> futures = new ArrayList<>(window);
                for (int length = first; length <= last; length++) {
                    final int probeLength = length;
                    futures.add(executor.submit(() -> probe(request, probeLength)));
                }

                for (int index = 0; index < futures.size(); index++) {
                    Probe probe = await(futures.get(index));
                    probes.add(probe.record());

                    if (probe.result().isSatisfiable()) {
                        cancelRemaining(futures, index + 1);
                        return decode(request, probe.record().pathLength(), probe.result());
                    }
                }
            }
            return null;

        } finally {
            executor.shutdownNow();
        }
    }

    private static Probe await(Future<Probe> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleFailureException("Ricerca parallela interrotta", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OracleFailureException) {
                throw (OracleFailureException) cause;
            }
            throw new OracleFailureException("Probe fallito: " + cause.getMessage(), cause);
        }
    }

    private static void cancelRemaining(List<Future<Probe>> futures, int fromIndex) {
        for (int index = fromIndex; index < futures.size(); index++) {
            futures.get(index).cancel(true);
        }
    }

    //endregion

    //region PROBE E DECODIFICA

    private record Probe(ProbeRecord record, SATResult result) {}

    private Probe probe(PathRequest request, int length) {
        long start = System.currentTimeMillis();
        SatOracle oracle = configuration.getOracle();

        CNFFormula formula = encoder.encode(request.graph(), request.source(), request.target(), length, request.via());
        SATResult result = oracle.solve(formula);

        ProbeRecord record = new ProbeRecord(length, ProbeRecord.NO_BOUND, result.isSatisfiable(),
                formula.getVariableCount(), formula.getClausesCount(), System.currentTimeMillis() - start);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Probe " + record + " " + result.getStatistics().toCompactString());
        }
        return new Probe(record, result);
    }

    private List<Integer> decode(PathRequest request, int length, SATResult result) {
        VariableIndexer indexer = new VariableIndexer(request.graph().nodeCount(), length);
        return PathDecoder.decode(result, indexer);
    }

    //endregion
}
