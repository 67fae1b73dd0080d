package org.satpath.cdcl;

/**
 * STATISTICHE SAT - Metriche di esecuzione di una singola risoluzione
 *
 * Raccoglie contatori e tempi di una chiamata all'oracolo. Le implementazioni
 * esterne (SAT4J) valorizzano solo il tempo di esecuzione.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    /** Decisioni euristiche prese durante la ricerca */
    private long decisions = 0;

    /** Propagazioni unitarie eseguite */
    private long propagations = 0;

    /** Conflitti rilevati */
    private long conflicts = 0;

    /** Clausole apprese tramite conflict analysis */
    private long learnedClauses = 0;

    /** Backjump non cronologici di più di un livello */
    private long backjumps = 0;

    /** Restart eseguiti */
    private long restarts = 0;

    //endregion

    //region TIMING

    private final long startTime;

    private long executionTimeMs = 0;

    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche avviando il cronometro.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public void incrementDecisions() {
        decisions++;
    }

    public void incrementPropagations() {
        propagations++;
    }

    public void incrementConflicts() {
        conflicts++;
    }

    public void incrementLearnedClauses() {
        learnedClauses++;
    }

    public void incrementBackjumps() {
        backjumps++;
    }

    public void incrementRestarts() {
        restarts++;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma il cronometro. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo di esecuzione (parziale se il cronometro è ancora attivo)
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public long getDecisions() {
        return decisions;
    }

    public long getPropagations() {
        return propagations;
    }

    public long getConflicts() {
        return conflicts;
    }

    public long getLearnedClauses() {
        return learnedClauses;
    }

    public long getBackjumps() {
        return backjumps;
    }

    public long getRestarts() {
        return restarts;
    }

    /**
     * @return conflitti per decisione (0 se nessuna decisione)
     */
    public double getConflictRate() {
        return decisions == 0 ? 0.0 : (double) conflicts / decisions;
    }

    //endregion

    //region OUTPUT

    /**
     * Output compatto su singola linea per i log.
     */
    public String toCompactString() {
        if (restarts > 0) {
            return String.format("Stats[Dec:%d, Conf:%d, Restart:%d, Prop:%d, Learn:%d, Time:%dms]",
                    decisions, conflicts, restarts, propagations, learnedClauses, getExecutionTimeMs());
        } else {
            return String.format("Stats[Dec:%d, Conf:%d, Prop:%d, Learn:%d, Time:%dms]",
                    decisions, conflicts, propagations, learnedClauses, getExecutionTimeMs());
        }
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("======================================[ SEARCH STATS ]=======================================\n");
        output.append("    Decisioni: ").append(decisions).append("\n");
        output.append("    Conflitti: ").append(conflicts).append("\n");
        output.append("    Propagazioni: ").append(propagations).append("\n");
        output.append("    Clausole apprese: ").append(learnedClauses).append("\n");

        if (restarts > 0) {
            output.append("    Restart:   ").append(restarts).append("\n");
        }

        output.append("    Tempo:     ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================================\n");
        return output.toString();
    }

    //endregion
}
