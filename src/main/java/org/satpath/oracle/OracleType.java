package org.satpath.oracle;

import java.util.Locale;

/**
 * Oracoli disponibili da linea di comando.
 */
public enum OracleType {

    /** Solver CDCL interno */
    CDCL,

    /** Solver SAT4J (MiniSat-like) */
    SAT4J;

    /**
     * Crea l'oracolo corrispondente.
     *
     * @param timeoutSeconds timeout per singola chiamata, 0 per nessun limite
     */
    public SatOracle create(int timeoutSeconds) {
        return switch (this) {
            case CDCL -> new CdclOracle(true, timeoutSeconds);
            case SAT4J -> new Sat4jOracle(timeoutSeconds);
        };
    }

    /**
     * @throws IllegalArgumentException se il nome non corrisponde a nessun oracolo
     */
    public static OracleType parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Oracolo sconosciuto: '" + name + "' (valori ammessi: cdcl, sat4j)", e);
        }
    }
}
