package org.satpath.encoding;

/**
 * Trattamento del limite di peso B nella codifica pesata.
 */
public enum WeightBoundPolicy {

    /**
     * Vincolo Σ pesi ≤ B codificato con un contatore sequenziale pesato:
     * la ricerca binaria converge al peso minimo per la L corrente.
     */
    ENFORCED,

    /**
     * Comportamento storico: la clausola di esclusione confronta il peso del singolo
     * arco con la somma di tutti i pesi e non elimina nulla. B serve solo a
     * pianificare la ricerca binaria, il confronto avviene dopo la decodifica.
     */
    HEURISTIC
}
