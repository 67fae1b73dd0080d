package org.satpath.cdcl;

import java.util.logging.Logger;

/**
 * TECNICA DI RESTART - Reinizio periodico della ricerca guidato dai conflitti
 *
 * Dopo una soglia di conflitti il solver torna al livello 0 mantenendo le clausole
 * apprese e le attività VSIDS. La soglia cresce geometricamente dopo ogni restart,
 * così la completezza della ricerca è preservata.
 */
public class RestartTechnique {

    private static final Logger LOGGER = Logger.getLogger(RestartTechnique.class.getName());

    //region CONFIGURAZIONE E SOGLIE

    /** Conflitti prima del primo restart */
    private static final int DEFAULT_CONFLICT_THRESHOLD = 100;

    /** Fattore di crescita della soglia dopo ogni restart */
    private static final double DEFAULT_GROWTH_FACTOR = 1.5;

    private final double growthFactor;

    private double conflictThreshold;

    //endregion

    //region STATO

    private int currentConflictCount;

    private int totalRestarts;

    //endregion

    public RestartTechnique() {
        this(DEFAULT_CONFLICT_THRESHOLD, DEFAULT_GROWTH_FACTOR);
    }

    /**
     * @param conflictThreshold conflitti prima del primo restart (≥ 1)
     * @param growthFactor fattore di crescita della soglia (≥ 1.0)
     * @throws IllegalArgumentException se i parametri sono fuori range
     */
    public RestartTechnique(int conflictThreshold, double growthFactor) {
        if (conflictThreshold < 1) {
            throw new IllegalArgumentException("Soglia conflitti deve essere >= 1, ricevuto: " + conflictThreshold);
        }
        if (growthFactor < 1.0) {
            throw new IllegalArgumentException("Fattore di crescita deve essere >= 1.0, ricevuto: " + growthFactor);
        }

        this.conflictThreshold = conflictThreshold;
        this.growthFactor = growthFactor;
        LOGGER.fine("RestartTechnique inizializzata con soglia " + conflictThreshold + " conflitti");
    }

    /**
     * Registra un conflitto e verifica se la soglia è stata raggiunta.
     * Chiamato dal CDCLSolver ad ogni conflitto.
     *
     * @return true se il solver deve eseguire un restart
     */
    public boolean registerConflictAndCheckRestart() {
        currentConflictCount++;
        return currentConflictCount >= conflictThreshold;
    }

    /**
     * Registra un restart eseguito: azzera il contatore e aumenta la soglia.
     */
    public void executeRestart() {
        totalRestarts++;
        currentConflictCount = 0;
        conflictThreshold *= growthFactor;

        LOGGER.finer(String.format("Restart #%d, prossima soglia %.0f conflitti", totalRestarts, conflictThreshold));
    }

    public int getTotalRestarts() {
        return totalRestarts;
    }

    public int getCurrentConflictCount() {
        return currentConflictCount;
    }

    public double getConflictThreshold() {
        return conflictThreshold;
    }

    @Override
    public String toString() {
        return String.format("RestartTechnique[restart=%d, soglia=%.0f]", totalRestarts, conflictThreshold);
    }
}
