package org.satpath.solver;

/**
 * Traccia di una singola chiamata all'oracolo.
 *
 * Un probe UNSAT a una data lunghezza è un esito normale che fa proseguire la ricerca.
 *
 * @param pathLength numero di posizioni L codificate
 * @param bound limite di peso B, {@link #NO_BOUND} per la ricerca non pesata
 * @param satisfiable esito dell'oracolo
 * @param variables variabili della formula
 * @param clauses clausole della formula
 * @param elapsedMs tempo di codifica e risoluzione
 */
public record ProbeRecord(int pathLength, long bound, boolean satisfiable, int variables, int clauses, long elapsedMs) {

    public static final long NO_BOUND = -1;

    public boolean hasBound() {
        return bound != NO_BOUND;
    }

    @Override
    public String toString() {
        return String.format("L=%d%s -> %s (%d var, %d cl, %dms)",
                pathLength, hasBound() ? " B=" + bound : "", satisfiable ? "SAT" : "UNSAT",
                variables, clauses, elapsedMs);
    }
}
