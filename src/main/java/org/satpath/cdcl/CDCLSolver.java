package org.satpath.cdcl;

import org.satpath.support.AssignedLiteral;
import org.satpath.support.CNFFormula;
import org.satpath.support.DecisionStack;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE CDCL (Conflict-Driven Clause Learning)
 *
 * Risolve una CNFFormula numerica e restituisce SAT con modello completo oppure UNSAT.
 *
 * COMPONENTI ALGORITMICI:
 * 1. Unit propagation con due letterali osservati per clausola (watched literals)
 * 2. Conflict analysis al primo punto di implicazione unico (1-UIP)
 * 3. Apprendimento della clausola e backjumping non cronologico
 * 4. Euristica VSIDS con decadimento delle attività e salvataggio della fase
 * 5. Restart opzionali guidati dai conflitti (RestartTechnique)
 *
 * L'istanza risolve una sola formula; l'interruzione del thread chiamante (o
 * {@link #interrupt()}) termina la ricerca con InterruptedException.
 */
public class CDCLSolver {

    private static final Logger LOGGER = Logger.getLogger(CDCLSolver.class.getName());

    public static final String SOLVER_NAME = "CDCL";

    private static final int NO_CONFLICT = -1;

    private static final double ACTIVITY_DECAY = 0.95;

    private static final double ACTIVITY_RESCALE_LIMIT = 1e100;

    /** Ogni quante iterazioni del loop principale si controlla l'interruzione */
    private static final int INTERRUPTION_CHECK_MASK = 0xFF;

    //region STRUTTURE DATI CORE - ALGORITMO CDCL

    private final CNFFormula formula;

    private final int variableCount;

    /** Clausole originali non unitarie e clausole apprese, referenziate per indice */
    private final List<int[]> clauseDatabase;

    /** Liste di osservazione indicizzate per letterale (vedi watchIndex) */
    private final List<List<Integer>> watches;

    private final DecisionStack decisionStack;

    /** Valore per variabile: 1 vero, -1 falso, 0 non assegnata */
    private final int[] values;

    private final int[] levels;

    /** Fase salvata: ultimo valore assunto dalla variabile, usato come polarità di decisione */
    private final boolean[] savedPhase;

    /** Contatori VSIDS */
    private final double[] activity;

    private double activityIncrement = 1.0;

    private int propagationHead = 0;

    //endregion

    //region STATO ESECUZIONE E MONITORAGGIO

    private final RestartTechnique restartTechnique;

    private SATStatistics statistics;

    private volatile boolean interrupted = false;

    private boolean solved = false;

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * Prepara il solver per la formula indicata.
     *
     * @param formula formula CNF da risolvere
     * @param enableRestart true per attivare i restart guidati dai conflitti
     */
    public CDCLSolver(CNFFormula formula, boolean enableRestart) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        this.formula = formula;
        this.variableCount = formula.getVariableCount();
        this.clauseDatabase = new ArrayList<>(formula.getClausesCount());
        this.watches = new ArrayList<>(2 * variableCount + 2);
        for (int i = 0; i < 2 * variableCount + 2; i++) {
            watches.add(new ArrayList<>());
        }
        this.decisionStack = new DecisionStack();
        this.values = new int[variableCount + 1];
        this.levels = new int[variableCount + 1];
        this.savedPhase = new boolean[variableCount + 1];
        this.activity = new double[variableCount + 1];
        this.restartTechnique = enableRestart ? new RestartTechnique() : null;
    }

    public CDCLSolver(CNFFormula formula) {
        this(formula, true);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Esegue la risoluzione completa.
     *
     * @return SAT con modello (un letterale per ogni variabile 1..N) oppure UNSAT
     * @throws InterruptedException se il thread viene interrotto durante la ricerca
     * @throws IllegalStateException se il solver è già stato usato
     */
    public SATResult solve() throws InterruptedException {
        if (solved) {
            throw new IllegalStateException("CDCLSolver già utilizzato: creare una nuova istanza per ogni formula");
        }
        solved = true;
        this.statistics = new SATStatistics();

        LOGGER.fine(() -> "Avvio risoluzione CDCL: " + formula);

        boolean satisfiable;
        try {
            satisfiable = executeCDCLMainAlgorithm();
        } finally {
            statistics.stopTimer();
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine((satisfiable ? "SAT " : "UNSAT ") + statistics.toCompactString());
        }

        return satisfiable
                ? SATResult.satisfiable(generateSatisfiableModel(), statistics, SOLVER_NAME)
                : SATResult.unsatisfiable(statistics, SOLVER_NAME);
    }

    /**
     * Richiede l'interruzione cooperativa della ricerca.
     */
    public void interrupt() {
        this.interrupted = true;
    }

    //endregion

    //region ALGORITMO CDCL PRINCIPALE

    /**
     * Loop principale: propagazione, analisi dei conflitti, decisione.
     *
     * @return true se la formula è soddisfacibile
     */
    private boolean executeCDCLMainAlgorithm() throws InterruptedException {
        if (!initializeLevel0WithClauses()) {
            return false;
        }

        long iterations = 0;
        while (true) {
            if ((++iterations & INTERRUPTION_CHECK_MASK) == 0) {
                checkForInterruption();
            }

            int conflict = executeUnitPropagation();
            if (conflict != NO_CONFLICT) {
                statistics.incrementConflicts();

                // Conflitto senza decisioni: formula insoddisfacibile
                if (decisionStack.getLevel() == 0) {
                    return false;
                }

                ConflictAnalysisResult analysis = resolveConflict(conflict);
                executeLearningAndBacktrack(analysis);
                decayActivities();

                if (restartTechnique != null && restartTechnique.registerConflictAndCheckRestart()) {
                    executeRestart();
                }
            } else {
                int variable = findBestUnassignedVariable();
                if (variable == 0) {
                    return true;                                    // Tutte le variabili assegnate senza conflitti
                }
                statistics.incrementDecisions();
                decisionStack.addDecision(variable, savedPhase[variable]);
                assignVariable(variable, savedPhase[variable]);
            }
        }
    }

    /**
     * Carica le clausole: le unitarie vengono assegnate al livello 0, le altre osservate.
     *
     * @return false se le clausole unitarie sono già contraddittorie
     */
    private boolean initializeLevel0WithClauses() {
        for (List<Integer> original : formula.getClauses()) {
            int[] clause = normalizeClause(original);
            if (clause == null) {
                continue;                                           // Tautologia: sempre soddisfatta
            }

            int index = clauseDatabase.size();
            clauseDatabase.add(clause);

            if (clause.length == 1) {
                int literal = clause[0];
                int value = valueOf(literal);
                if (value < 0) {
                    LOGGER.fine("Clausole unitarie contraddittorie sulla variabile " + Math.abs(literal));
                    return false;
                }
                if (value == 0) {
                    enqueue(literal, index);
                }
            } else {
                watchClause(index, clause);
            }
        }
        return true;
    }

    /**
     * Elimina letterali duplicati.
     *
     * @return clausola normalizzata, null se tautologica
     */
    private static int[] normalizeClause(List<Integer> clause) {
        LinkedHashSet<Integer> literals = new LinkedHashSet<>(clause);
        for (Integer literal : literals) {
            if (literals.contains(-literal)) {
                return null;
            }
        }
        return literals.stream().mapToInt(Integer::intValue).toArray();
    }

    //endregion

    //region UNIT PROPAGATION

    /**
     * Propaga tutti gli assegnamenti non ancora processati.
     *
     * Per ogni letterale reso falso si visitano solo le clausole che lo osservano:
     * se esiste un altro letterale non falso l'osservazione si sposta, altrimenti la
     * clausola è unitaria (implicazione) oppure in conflitto.
     *
     * @return indice della clausola in conflitto, NO_CONFLICT altrimenti
     */
    private int executeUnitPropagation() {
        while (propagationHead < decisionStack.size()) {
            int trueLiteral = decisionStack.get(propagationHead++).toDIMACSLiteral();
            int falseLiteral = -trueLiteral;
            List<Integer> watchList = watches.get(watchIndex(falseLiteral));

            int read = 0;
            int write = 0;
            while (read < watchList.size()) {
                int clauseIndex = watchList.get(read++);
                int[] clause = clauseDatabase.get(clauseIndex);

                // Il letterale falso osservato va in posizione 1
                if (clause[0] == falseLiteral) {
                    clause[0] = clause[1];
                    clause[1] = falseLiteral;
                }

                if (valueOf(clause[0]) > 0) {
                    watchList.set(write++, clauseIndex);            // Clausola già soddisfatta
                    continue;
                }

                if (moveWatch(clause, clauseIndex)) {
                    continue;
                }

                watchList.set(write++, clauseIndex);
                if (valueOf(clause[0]) < 0) {
                    // Conflitto: conserva le osservazioni non ancora visitate
                    while (read < watchList.size()) {
                        watchList.set(write++, watchList.get(read++));
                    }
                    watchList.subList(write, watchList.size()).clear();
                    propagationHead = decisionStack.size();
                    return clauseIndex;
                }

                statistics.incrementPropagations();
                enqueue(clause[0], clauseIndex);
            }
            watchList.subList(write, watchList.size()).clear();
        }
        return NO_CONFLICT;
    }

    /**
     * Cerca un letterale non falso oltre le prime due posizioni e ne fa il nuovo osservato.
     */
    private boolean moveWatch(int[] clause, int clauseIndex) {
        for (int k = 2; k < clause.length; k++) {
            if (valueOf(clause[k]) >= 0) {
                int swap = clause[1];
                clause[1] = clause[k];
                clause[k] = swap;
                watches.get(watchIndex(clause[1])).add(clauseIndex);
                return true;
            }
        }
        return false;
    }

    private void watchClause(int index, int[] clause) {
        watches.get(watchIndex(clause[0])).add(index);
        watches.get(watchIndex(clause[1])).add(index);
    }

    //endregion

    //region CONFLICT ANALYSIS

    /**
     * Analisi 1-UIP: risolve la clausola in conflitto con le clausole ancestrali dei
     * letterali del livello corrente, a ritroso sul trail, finché ne resta uno solo.
     *
     * @param conflictIndex indice della clausola falsificata
     * @return clausola appresa (letterale asserito in posizione 0) e livello di backjump
     */
    private ConflictAnalysisResult resolveConflict(int conflictIndex) {
        int currentLevel = decisionStack.getLevel();
        boolean[] seen = new boolean[variableCount + 1];
        List<Integer> learned = new ArrayList<>();
        learned.add(0);                                             // Posto per il letterale asserito

        int pathCount = 0;
        int pivot = 0;
        int trailIndex = decisionStack.size() - 1;
        int clauseIndex = conflictIndex;

        do {
            int[] clause = clauseDatabase.get(clauseIndex);
            for (int literal : clause) {
                int variable = Math.abs(literal);
                if (pivot != 0 && variable == Math.abs(pivot)) {
                    continue;
                }
                if (!seen[variable] && levels[variable] > 0) {
                    seen[variable] = true;
                    bumpActivity(variable);
                    if (levels[variable] >= currentLevel) {
                        pathCount++;
                    } else {
                        learned.add(literal);
                    }
                }
            }

            // Prossimo letterale marcato del livello corrente, a ritroso sul trail
            while (!seen[decisionStack.get(trailIndex).getVariable()]) {
                trailIndex--;
            }
            AssignedLiteral assigned = decisionStack.get(trailIndex--);
            pivot = assigned.toDIMACSLiteral();
            seen[assigned.getVariable()] = false;
            pathCount--;
            clauseIndex = assigned.getAncestorClause();
        } while (pathCount > 0);

        learned.set(0, -pivot);

        int[] learnedClause = learned.stream().mapToInt(Integer::intValue).toArray();
        int backtrackLevel = findBacktrackLevel(learnedClause);
        return new ConflictAnalysisResult(learnedClause, backtrackLevel);
    }

    /**
     * Livello di backjump: il massimo livello tra i letterali diversi dall'asserito.
     * Il letterale corrispondente viene spostato in posizione 1 per l'osservazione.
     */
    private int findBacktrackLevel(int[] clause) {
        if (clause.length == 1) {
            return 0;
        }

        int maxIndex = 1;
        for (int i = 2; i < clause.length; i++) {
            if (levels[Math.abs(clause[i])] > levels[Math.abs(clause[maxIndex])]) {
                maxIndex = i;
            }
        }
        int swap = clause[1];
        clause[1] = clause[maxIndex];
        clause[maxIndex] = swap;
        return levels[Math.abs(clause[1])];
    }

    //endregion

    //region LEARNING E BACKTRACKING

    private void executeLearningAndBacktrack(ConflictAnalysisResult analysis) {
        int[] clause = analysis.learnedClause();

        if (decisionStack.getLevel() - analysis.backtrackLevel() > 1) {
            statistics.incrementBackjumps();
        }
        performBacktrack(analysis.backtrackLevel());

        int index = clauseDatabase.size();
        clauseDatabase.add(clause);
        statistics.incrementLearnedClauses();

        if (clause.length > 1) {
            watchClause(index, clause);
        }
        enqueue(clause[0], index);
    }

    private void performBacktrack(int targetLevel) {
        for (AssignedLiteral removed : decisionStack.backtrackToLevel(targetLevel)) {
            int variable = removed.getVariable();
            savedPhase[variable] = removed.getValue();
            values[variable] = 0;
        }
        // Gli assegnamenti rimasti ancora da propagare (es. un'asserzione al livello 0) restano in coda
        propagationHead = Math.min(propagationHead, decisionStack.size());
    }

    //endregion

    //region RESTART

    private void executeRestart() {
        performBacktrack(0);
        restartTechnique.executeRestart();
        statistics.incrementRestarts();
    }

    //endregion

    //region ASSEGNAMENTI

    /**
     * Registra un'implicazione al livello corrente.
     */
    private void enqueue(int literal, int ancestorClause) {
        decisionStack.addImpliedLiteral(literal, ancestorClause);
        assignVariable(Math.abs(literal), literal > 0);
    }

    private void assignVariable(int variable, boolean value) {
        values[variable] = value ? 1 : -1;
        levels[variable] = decisionStack.getLevel();
    }

    /**
     * @return 1 se il letterale è vero, -1 se falso, 0 se non assegnato
     */
    private int valueOf(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    private static int watchIndex(int literal) {
        return literal > 0 ? 2 * literal : -2 * literal + 1;
    }

    //endregion

    //region FASE DI DECISIONE (VSIDS)

    /**
     * @return variabile non assegnata con attività massima, 0 se tutte assegnate
     */
    private int findBestUnassignedVariable() {
        int best = 0;
        double bestActivity = -1.0;
        for (int variable = 1; variable <= variableCount; variable++) {
            if (values[variable] == 0 && activity[variable] > bestActivity) {
                best = variable;
                bestActivity = activity[variable];
            }
        }
        return best;
    }

    private void bumpActivity(int variable) {
        activity[variable] += activityIncrement;
        if (activity[variable] > ACTIVITY_RESCALE_LIMIT) {
            for (int v = 1; v <= variableCount; v++) {
                activity[v] /= ACTIVITY_RESCALE_LIMIT;
            }
            activityIncrement /= ACTIVITY_RESCALE_LIMIT;
        }
    }

    private void decayActivities() {
        activityIncrement /= ACTIVITY_DECAY;
    }

    //endregion

    //region GESTIONE DEI RISULTATI

    /**
     * @return modello DIMACS: un letterale con segno per ogni variabile 1..N
     */
    private int[] generateSatisfiableModel() {
        int[] model = new int[variableCount];
        for (int variable = 1; variable <= variableCount; variable++) {
            model[variable - 1] = values[variable] > 0 ? variable : -variable;
        }
        return model;
    }

    private void checkForInterruption() throws InterruptedException {
        if (Thread.currentThread().isInterrupted() || interrupted) {
            throw new InterruptedException("Solver CDCL interrotto");
        }
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    /**
     * Clausola appresa e livello di backjump prodotti dalla conflict analysis.
     */
    private record ConflictAnalysisResult(int[] learnedClause, int backtrackLevel) {}
}
