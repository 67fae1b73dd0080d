package org.satpath.oracle;

import org.satpath.cdcl.CDCLSolver;
import org.satpath.cdcl.SATResult;
import org.satpath.support.CNFFormula;

import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Oracolo basato sul solver CDCL interno.
 *
 * Ogni chiamata crea un nuovo CDCLSolver. Con un timeout positivo la risoluzione
 * viene eseguita su un thread dedicato e interrotta allo scadere del tempo.
 */
public class CdclOracle implements SatOracle {

    private static final Logger LOGGER = Logger.getLogger(CdclOracle.class.getName());

    private final boolean enableRestart;

    private final int timeoutSeconds;

    /**
     * @param enableRestart attiva i restart guidati dai conflitti
     * @param timeoutSeconds timeout per chiamata in secondi, 0 per nessun limite
     */
    public CdclOracle(boolean enableRestart, int timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout negativo: " + timeoutSeconds);
        }
        this.enableRestart = enableRestart;
        this.timeoutSeconds = timeoutSeconds;
    }

    public CdclOracle() {
        this(true, 0);
    }

    @Override
    public SATResult solve(CNFFormula formula) {
        CDCLSolver solver = new CDCLSolver(formula, enableRestart);
        try {
            return timeoutSeconds > 0 ? solveWithTimeout(solver) : solver.solve();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleFailureException("Risoluzione CDCL interrotta", e);
        } catch (OutOfMemoryError e) {
            throw new OracleFailureException("Memoria esaurita durante la risoluzione CDCL di " + formula, e);
        } catch (OracleFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore critico durante la risoluzione CDCL", e);
            throw new OracleFailureException("Errore critico nella risoluzione CDCL: " + e.getMessage(), e);
        }
    }

    /**
     * Esegue la risoluzione con controllo temporale su un ExecutorService dedicato.
     */
    private SATResult solveWithTimeout(CDCLSolver solver) throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SATResult> future = executor.submit(solver::solve);
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            solver.interrupt();
            throw new OracleFailureException("Timeout CDCL raggiunto dopo " + timeoutSeconds + " secondi", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw new OracleFailureException("Risoluzione CDCL interrotta", cause);
            }
            if (cause instanceof OutOfMemoryError) {
                throw (OutOfMemoryError) cause;
            }
            throw new OracleFailureException("Errore nella risoluzione CDCL: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    @Override
    public String name() {
        return CDCLSolver.SOLVER_NAME;
    }

    @Override
    public String toString() {
        return "CdclOracle[restart=" + enableRestart + ", timeout=" + timeoutSeconds + "s]";
    }
}
