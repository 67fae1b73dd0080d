package org.satpath.encoding;

/**
 * Variante del vincolo "ogni nodo compare al più una volta".
 */
public enum NodeRepetitionPolicy {

    /**
     * Esclusione su tutte le coppie di posizioni: il percorso decodificato è sempre semplice.
     */
    FULL_PAIRWISE,

    /**
     * Esclusione solo tra posizioni consecutive. Variante più debole: un nodo può
     * ricomparire a distanza ≥ 2 e il risultato può non essere un percorso semplice.
     */
    ADJACENT_ONLY
}
