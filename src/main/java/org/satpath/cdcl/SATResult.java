package org.satpath.cdcl;

import java.util.Arrays;

/**
 * RISULTATO SAT - Contenitore immutabile per l'esito di una chiamata all'oracolo
 *
 * COMPONENTI:
 * • Esito: SAT (soddisfacibile) vs UNSAT (insoddisfacibile)
 * • Modello: per SAT, letterali con segno in formato DIMACS (il segno indica il valore)
 * • Statistiche: metriche di esecuzione
 * • Nome del solver che ha prodotto il risultato
 *
 * Un UNSAT è un esito normale e non un errore: i fallimenti dell'oracolo vengono
 * segnalati con eccezioni, mai come risultati UNSAT.
 */
public final class SATResult {

    //region ATTRIBUTI CORE

    private final boolean satisfiable;

    /**
     * Modello per SAT, null per UNSAT.
     */
    private final int[] model;

    /**
     * Valori indicizzati per variabile, derivati dal modello (indice 0 inutilizzato).
     */
    private final boolean[] truth;

    private final SATStatistics statistics;

    private final String solverName;

    //endregion

    //region COSTRUZIONE

    private SATResult(boolean satisfiable, int[] model, SATStatistics statistics, String solverName) {
        this.satisfiable = satisfiable;
        this.model = model;
        this.statistics = statistics != null ? statistics : new SATStatistics();
        this.solverName = solverName;
        this.truth = satisfiable ? indexModel(model) : null;
    }

    private static boolean[] indexModel(int[] model) {
        int maxVariable = 0;
        for (int literal : model) {
            if (literal == 0) {
                throw new IllegalArgumentException("Modello SAT contiene letterale 0");
            }
            maxVariable = Math.max(maxVariable, Math.abs(literal));
        }

        boolean[] values = new boolean[maxVariable + 1];
        for (int literal : model) {
            values[Math.abs(literal)] = literal > 0;
        }
        return values;
    }

    /**
     * Crea risultato SAT con modello e statistiche.
     *
     * @param model letterali con segno, uno per variabile (non null)
     * @param statistics metriche di esecuzione
     * @param solverName nome del solver che ha prodotto il modello
     * @throws IllegalArgumentException se il modello è null
     */
    public static SATResult satisfiable(int[] model, SATStatistics statistics, String solverName) {
        if (model == null) {
            throw new IllegalArgumentException("Modello SAT non può essere null");
        }
        return new SATResult(true, model.clone(), statistics, solverName);
    }

    /**
     * Crea risultato UNSAT con statistiche.
     */
    public static SATResult unsatisfiable(SATStatistics statistics, String solverName) {
        return new SATResult(false, null, statistics, solverName);
    }

    //endregion

    //region ACCESSORS E QUERY

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return copia del modello per SAT, null per UNSAT
     */
    public int[] getModel() {
        return model != null ? model.clone() : null;
    }

    /**
     * Valore di una variabile nel modello. Le variabili non presenti valgono false.
     *
     * @param variable ID variabile (> 0)
     * @throws IllegalStateException se il risultato è UNSAT
     */
    public boolean isTrue(int variable) {
        if (!satisfiable) {
            throw new IllegalStateException("Nessun modello disponibile per un risultato UNSAT");
        }
        return variable > 0 && variable < truth.length && truth[variable];
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    public String getSolverName() {
        return solverName;
    }

    public int getModelSize() {
        return model != null ? model.length : 0;
    }

    //endregion

    //region OUTPUT

    /**
     * Rappresentazione compatta per i log.
     */
    public String toCompactString() {
        return String.format("SATResult{%s, solver=%s, vars=%d, time=%dms}",
                satisfiable ? "SAT" : "UNSAT",
                solverName,
                getModelSize(),
                statistics.getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return toCompactString();
    }

    /**
     * Uguaglianza basata su esito e modello (ignora statistiche e solver).
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SATResult other = (SATResult) obj;
        return satisfiable == other.satisfiable && Arrays.equals(model, other.model);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(satisfiable) + Arrays.hashCode(model);
    }

    //endregion
}
