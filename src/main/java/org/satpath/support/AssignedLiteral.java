package org.satpath.support;

import java.util.Objects;

/**
 * LETTERALE ASSEGNATO - Variabile assegnata con metadata genealogici
 *
 * Rappresenta una variabile assegnata durante l'algoritmo CDCL con le informazioni
 * necessarie per backtracking e analisi dei conflitti.
 *
 * INFORMAZIONI MEMORIZZATE:
 * • Identificazione variabile e valore assegnato
 * • Tipo assegnamento (decisione euristica vs implicazione)
 * • Indice della clausola ancestrale per le implicazioni (genealogia)
 *
 * Le clausole ancestrali sono referenziate per indice nel database del solver:
 * copiare la clausola ad ogni implicazione renderebbe la propagazione quadratica.
 */
public final class AssignedLiteral {

    /** Valore di ancestorClause per le decisioni */
    public static final int NO_ANCESTOR = -1;

    //region ATTRIBUTI CORE DELL'ASSEGNAMENTO

    /**
     * ID numerico della variabile assegnata (sempre > 0).
     */
    private final int variable;

    /**
     * Valore booleano assegnato alla variabile.
     */
    private final boolean value;

    /**
     * true per decisioni euristiche, false per implicazioni da unit propagation.
     */
    private final boolean decision;

    /**
     * Indice della clausola che ha causato l'implicazione, NO_ANCESTOR per le decisioni.
     */
    private final int ancestorClause;

    //endregion

    //region COSTRUZIONE CON VALIDAZIONE

    /**
     * @param variable ID numerico variabile (> 0)
     * @param value valore booleano assegnato
     * @param decision true se decisione, false se implicazione
     * @param ancestorClause indice clausola causante (≥ 0 per implicazioni, NO_ANCESTOR per decisioni)
     * @throws IllegalArgumentException se parametri inconsistenti
     */
    public AssignedLiteral(int variable, boolean value, boolean decision, int ancestorClause) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        if (!decision && ancestorClause < 0) {
            throw new IllegalArgumentException("Implicazioni richiedono clausola ancestrale");
        }
        if (decision && ancestorClause != NO_ANCESTOR) {
            throw new IllegalArgumentException("Decisioni non dovrebbero avere clausola ancestrale");
        }

        this.variable = variable;
        this.value = value;
        this.decision = decision;
        this.ancestorClause = ancestorClause;
    }

    public static AssignedLiteral decision(int variable, boolean value) {
        return new AssignedLiteral(variable, value, true, NO_ANCESTOR);
    }

    public static AssignedLiteral implication(int literal, int ancestorClause) {
        return new AssignedLiteral(Math.abs(literal), literal > 0, false, ancestorClause);
    }

    //endregion

    //region ACCESSORS

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public boolean isDecision() {
        return decision;
    }

    public boolean isImplication() {
        return !decision;
    }

    /**
     * @return indice clausola ancestrale, NO_ANCESTOR per le decisioni
     */
    public int getAncestorClause() {
        return ancestorClause;
    }

    /**
     * Converte l'assegnamento in letterale DIMACS.
     * @return ID positivo se variabile vera, negativo se falsa
     */
    public int toDIMACSLiteral() {
        return value ? variable : -variable;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder description = new StringBuilder();
        description.append("AssignedLiteral{");
        description.append("var=").append(variable);
        description.append(", val=").append(value);
        description.append(", type=").append(decision ? "DECISION" : "IMPLICATION");

        if (!decision) {
            description.append(", ancestor=#").append(ancestorClause);
        }

        description.append('}');
        return description.toString();
    }

    /**
     * Uguaglianza basata su variabile, valore e tipo (ignora clausola ancestrale).
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        AssignedLiteral other = (AssignedLiteral) obj;
        return variable == other.variable && value == other.value && decision == other.decision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value, decision);
    }
}
