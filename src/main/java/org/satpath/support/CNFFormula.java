package org.satpath.support;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF NUMERICA - Insieme immutabile di clausole in formato DIMACS
 *
 * Rappresentazione consumata dall'oracolo di soddisfacibilità: ogni clausola è una
 * lista di interi non nulli (positivo = letterale vero, negativo = letterale negato),
 * la formula è la congiunzione di tutte le clausole.
 *
 * INVARIANTI MANTENUTE:
 * - Ogni clausola è non vuota
 * - Ogni letterale è ≠ 0 e |letterale| ≤ variableCount
 * - Lista clausole immutabile dopo costruzione
 * - Ordine delle clausole preservato (codifiche deterministiche)
 */
public class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    //region STRUTTURE DATI CORE

    /**
     * Clausole in formato numerico. Ogni clausola è immutabile.
     */
    private final List<List<Integer>> clauses;

    /**
     * Numero di variabili dichiarate: gli ID validi sono 1..variableCount.
     * Può superare il massimo ID usato (variabili libere ammesse).
     */
    private final int variableCount;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Costruisce la formula validando ogni clausola.
     *
     * @param clauses clausole in formato DIMACS
     * @param variableCount numero di variabili dichiarate (≥ 0)
     * @throws IllegalArgumentException se una clausola è vuota o contiene letterali fuori range
     */
    public CNFFormula(List<List<Integer>> clauses, int variableCount) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole non può essere null");
        }
        if (variableCount < 0) {
            throw new IllegalArgumentException("Numero variabili negativo: " + variableCount);
        }

        this.variableCount = variableCount;

        List<List<Integer>> validated = new ArrayList<>(clauses.size());
        for (int clauseIndex = 0; clauseIndex < clauses.size(); clauseIndex++) {
            validated.add(validateClause(clauses.get(clauseIndex), clauseIndex));
        }
        this.clauses = Collections.unmodifiableList(validated);

        logConversionStatistics();
    }

    /**
     * Valida range e consistenza dei letterali di una clausola.
     */
    private List<Integer> validateClause(List<Integer> clause, int clauseIndex) {
        if (clause == null || clause.isEmpty()) {
            throw new IllegalArgumentException("Clausola " + clauseIndex + " vuota o null");
        }

        for (int literalIndex = 0; literalIndex < clause.size(); literalIndex++) {
            Integer literal = clause.get(literalIndex);

            if (literal == null || literal == 0) {
                throw new IllegalArgumentException("Letterale non valido in clausola " + clauseIndex +
                        "[" + literalIndex + "]: " + literal);
            }

            if (Math.abs(literal) > variableCount) {
                throw new IllegalArgumentException("Letterale fuori range in clausola " + clauseIndex +
                        "[" + literalIndex + "]: |" + literal + "| > " + variableCount);
            }
        }

        return List.copyOf(clause);
    }

    //endregion

    //region STATISTICHE E LOGGING

    /**
     * Registra statistiche sulla formula costruita.
     */
    private void logConversionStatistics() {
        if (!LOGGER.isLoggable(Level.FINE)) {
            return;
        }

        long totalLiterals = clauses.stream().mapToLong(List::size).sum();
        double avgClauseLength = clauses.isEmpty() ? 0.0 : (double) totalLiterals / clauses.size();

        LOGGER.fine(String.format("Formula CNF: %d clausole, %d variabili, %.1f letterali/clausola",
                clauses.size(), variableCount, avgClauseLength));

        if (LOGGER.isLoggable(Level.FINEST)) {
            Map<Integer, Long> lengthDistribution = clauses.stream()
                    .collect(Collectors.groupingBy(List::size, TreeMap::new, Collectors.counting()));
            LOGGER.finest("Distribuzione lunghezza clausole: " + lengthDistribution);
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return vista immutabile delle clausole
     */
    public List<List<Integer>> getClauses() {
        return clauses;
    }

    /**
     * @return numero di variabili dichiarate
     */
    public int getVariableCount() {
        return variableCount;
    }

    /**
     * @return numero di clausole nella formula
     */
    public int getClausesCount() {
        return clauses.size();
    }

    /**
     * Verifica se un modello (letterali con segno, formato DIMACS) soddisfa ogni clausola.
     * Le variabili assenti dal modello sono considerate false.
     *
     * @param model letterali veri/falsi, uno per variabile
     * @return true se tutte le clausole contengono almeno un letterale vero
     */
    public boolean isSatisfiedBy(int[] model) {
        boolean[] truth = new boolean[variableCount + 1];
        for (int literal : model) {
            int variable = Math.abs(literal);
            if (variable <= variableCount) {
                truth[variable] = literal > 0;
            }
        }

        for (List<Integer> clause : clauses) {
            boolean satisfied = false;
            for (int literal : clause) {
                if (truth[Math.abs(literal)] == (literal > 0)) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("CNFFormula{clausole=%d, variabili=%d}", clauses.size(), variableCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        CNFFormula other = (CNFFormula) obj;
        return variableCount == other.variableCount && clauses.equals(other.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauses, variableCount);
    }

    //endregion

    //region COSTRUZIONE INCREMENTALE

    /**
     * Accumulatore di clausole con allocazione progressiva di variabili ausiliarie.
     * Non thread-safe: un builder per ogni codifica.
     */
    public static final class Builder {

        private final List<List<Integer>> clauses = new ArrayList<>();

        private int variableCount;

        private Builder() {
        }

        /**
         * Riserva le variabili 1..count (es. i letterali di posizione).
         */
        public Builder reserveVariables(int count) {
            if (count < variableCount) {
                throw new IllegalStateException("Variabili già allocate oltre " + count + ": " + variableCount);
            }
            this.variableCount = count;
            return this;
        }

        /**
         * @return ID della nuova variabile ausiliaria
         */
        public int newVariable() {
            return ++variableCount;
        }

        public Builder addClause(Integer... literals) {
            clauses.add(List.of(literals));
            return this;
        }

        public Builder addClause(List<Integer> literals) {
            clauses.add(List.copyOf(literals));
            return this;
        }

        public int variableCount() {
            return variableCount;
        }

        public int clauseCount() {
            return clauses.size();
        }

        public CNFFormula build() {
            return new CNFFormula(clauses, variableCount);
        }
    }

    //endregion
}
