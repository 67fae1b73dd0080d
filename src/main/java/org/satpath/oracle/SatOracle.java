package org.satpath.oracle;

import org.satpath.cdcl.SATResult;
import org.satpath.support.CNFFormula;

/**
 * Oracolo di soddisfacibilità usato come scatola nera: clausole in ingresso,
 * SAT con assegnamento oppure UNSAT in uscita.
 *
 * Ogni chiamata è indipendente: nessuna semantica incrementale, nessuno stato
 * condiviso tra le chiamate. Le implementazioni devono essere utilizzabili da più
 * thread contemporaneamente.
 *
 * L'interruzione del thread chiamante (probe annullato nella ricerca parallela) deve
 * fermare la ricerca in corso e produrre OracleFailureException.
 */
public interface SatOracle {

    /**
     * @param formula formula CNF da risolvere
     * @return SAT con modello oppure UNSAT
     * @throws OracleFailureException se il solver non produce un esito definito
     */
    SATResult solve(CNFFormula formula);

    /**
     * @return nome leggibile dell'oracolo
     */
    String name();
}
