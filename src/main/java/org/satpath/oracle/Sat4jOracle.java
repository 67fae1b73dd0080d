package org.satpath.oracle;

import org.satpath.cdcl.SATResult;
import org.satpath.cdcl.SATStatistics;
import org.satpath.support.CNFFormula;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Oracolo basato su SAT4J (solver di default in stile MiniSat).
 *
 * Un nuovo ISolver per ogni chiamata. Una ContradictionException durante il caricamento
 * delle clausole significa formula banalmente insoddisfacibile; un TimeoutException
 * di SAT4J è invece un fallimento dell'oracolo.
 */
public class Sat4jOracle implements SatOracle {

    private static final Logger LOGGER = Logger.getLogger(Sat4jOracle.class.getName());

    public static final String SOLVER_NAME = "SAT4J";

    private final int timeoutSeconds;

    /**
     * @param timeoutSeconds timeout per chiamata in secondi, 0 per il default di SAT4J
     */
    public Sat4jOracle(int timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout negativo: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    public Sat4jOracle() {
        this(0);
    }

    @Override
    public SATResult solve(CNFFormula formula) {
        SATStatistics statistics = new SATStatistics();
        ISolver solver = SolverFactory.newDefault();
        if (timeoutSeconds > 0) {
            solver.setTimeout(timeoutSeconds);
        }

        try {
            solver.newVar(formula.getVariableCount());
            solver.setExpectedNumberOfClauses(formula.getClausesCount());

            for (List<Integer> clause : formula.getClauses()) {
                solver.addClause(new VecInt(toArray(clause)));
            }
        } catch (ContradictionException e) {
            LOGGER.fine("Contraddizione rilevata durante il caricamento delle clausole");
            statistics.stopTimer();
            return SATResult.unsatisfiable(statistics, SOLVER_NAME);
        }

        return search(solver, statistics, formula);
    }

    /**
     * Esegue isSatisfiable su un thread dedicato. SAT4J non risponde all'interruzione del
     * thread: se il chiamante viene interrotto (es. probe annullato) il solver viene fermato
     * con expireTimeout.
     */
    private SATResult search(ISolver solver, SATStatistics statistics, CNFFormula formula) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        boolean completed = false;
        Future<Boolean> future = executor.submit(() -> solver.isSatisfiable());
        try {
            boolean satisfiable = future.get();
            completed = true;
            statistics.stopTimer();

            if (!satisfiable) {
                return SATResult.unsatisfiable(statistics, SOLVER_NAME);
            }
            return SATResult.satisfiable(solver.model(), statistics, SOLVER_NAME);

        } catch (InterruptedException e) {
            future.cancel(true);
            solver.expireTimeout();
            Thread.currentThread().interrupt();
            throw new OracleFailureException("Risoluzione SAT4J interrotta", e);
        } catch (ExecutionException e) {
            completed = true;
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new OracleFailureException("Timeout SAT4J raggiunto su " + formula, cause);
            }
            if (cause instanceof OutOfMemoryError) {
                throw new OracleFailureException("Memoria esaurita durante la risoluzione SAT4J di " + formula, cause);
            }
            LOGGER.log(Level.SEVERE, "Errore interno SAT4J", cause);
            throw new OracleFailureException("Errore interno SAT4J: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
            // Dopo expireTimeout il thread di ricerca può essere ancora attivo
            if (completed) {
                solver.reset();
            }
        }
    }

    private static int[] toArray(List<Integer> clause) {
        int[] literals = new int[clause.size()];
        for (int i = 0; i < literals.length; i++) {
            literals[i] = clause.get(i);
        }
        return literals;
    }

    @Override
    public String name() {
        return SOLVER_NAME;
    }

    @Override
    public String toString() {
        return "Sat4jOracle[timeout=" + timeoutSeconds + "s]";
    }
}
