package org.satpath.support;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * STACK DECISIONALE - Traccia cronologica degli assegnamenti organizzata per livelli
 *
 * Mantiene tutti gli assegnamenti in ordine cronologico (trail) insieme all'indice
 * di inizio di ciascun livello decisionale. Il livello 0 contiene le implicazioni
 * delle clausole unitarie e non viene mai rimosso.
 *
 * STRUTTURA:
 * • trail: sequenza piatta di AssignedLiteral, percorribile all'indietro dalla conflict analysis
 * • levelStarts: levelStarts.get(i) è la posizione nel trail della decisione del livello i+1
 *
 * INVARIANTI:
 * • getLevel() = levelStarts.size() ≥ 0
 * • ogni livello > 0 inizia con una decisione, seguita dalle sue implicazioni
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    //region STRUTTURA DATI

    private final List<AssignedLiteral> trail;

    private final List<Integer> levelStarts;

    //endregion

    public DecisionStack() {
        this.trail = new ArrayList<>();
        this.levelStarts = new ArrayList<>();
    }

    //region OPERAZIONI DI AGGIUNTA

    /**
     * Aggiunge una decisione euristica aprendo un nuovo livello.
     *
     * @return livello della nuova decisione
     */
    public int addDecision(int variable, boolean value) {
        levelStarts.add(trail.size());
        trail.add(AssignedLiteral.decision(variable, value));

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Decisione: var=%d, val=%s, livello=%d", variable, value, getLevel()));
        }
        return getLevel();
    }

    /**
     * Aggiunge un'implicazione al livello corrente.
     *
     * @param literal letterale reso vero (formato DIMACS)
     * @param ancestorClause indice della clausola che lo implica
     */
    public void addImpliedLiteral(int literal, int ancestorClause) {
        trail.add(AssignedLiteral.implication(literal, ancestorClause));
    }

    //endregion

    //region BACKTRACKING

    /**
     * Backtracking non cronologico: rimuove tutti i livelli sopra targetLevel.
     *
     * @param targetLevel livello di destinazione (0 ≤ targetLevel ≤ getLevel())
     * @return assegnamenti rimossi, dal più recente al più vecchio
     * @throws IllegalArgumentException se targetLevel non valido
     */
    public List<AssignedLiteral> backtrackToLevel(int targetLevel) {
        int currentLevel = getLevel();
        if (targetLevel < 0 || targetLevel > currentLevel) {
            throw new IllegalArgumentException(
                    String.format("Target level %d fuori range [0, %d]", targetLevel, currentLevel));
        }
        if (targetLevel == currentLevel) {
            return List.of();
        }

        int cut = levelStarts.get(targetLevel);
        List<AssignedLiteral> removed = new ArrayList<>(trail.size() - cut);
        for (int index = trail.size() - 1; index >= cut; index--) {
            removed.add(trail.remove(index));
        }
        levelStarts.subList(targetLevel, levelStarts.size()).clear();

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Backjump %d → %d, %d assegnamenti rimossi",
                    currentLevel, targetLevel, removed.size()));
        }
        return removed;
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return livello decisionale corrente (0 se nessuna decisione)
     */
    public int getLevel() {
        return levelStarts.size();
    }

    /**
     * @return numero totale di assegnamenti nel trail
     */
    public int size() {
        return trail.size();
    }

    /**
     * @param index posizione cronologica nel trail
     */
    public AssignedLiteral get(int index) {
        return trail.get(index);
    }

    public boolean isEmpty() {
        return trail.isEmpty();
    }

    /**
     * @return copia degli assegnamenti del livello richiesto
     */
    public List<AssignedLiteral> getAssignmentsAtLevel(int level) {
        if (level < 0 || level > getLevel()) {
            throw new IndexOutOfBoundsException(
                    String.format("Level %d fuori range [0, %d]", level, getLevel()));
        }
        int from = level == 0 ? 0 : levelStarts.get(level - 1);
        int to = level == getLevel() ? trail.size() : levelStarts.get(level);
        return new ArrayList<>(trail.subList(from, to));
    }

    //endregion

    @Override
    public String toString() {
        return String.format("DecisionStack{livello=%d, assegnamenti=%d}", getLevel(), trail.size());
    }
}
