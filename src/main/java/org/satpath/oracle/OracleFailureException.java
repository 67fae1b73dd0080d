package org.satpath.oracle;

/**
 * Fallimento dell'oracolo di soddisfacibilità: timeout, interruzione, esaurimento
 * risorse o errore interno del solver.
 *
 * Non equivale mai a un UNSAT: chi la riceve deve propagarla invece di proseguire
 * la ricerca con la lunghezza successiva.
 */
public class OracleFailureException extends RuntimeException {

    public OracleFailureException(String message) {
        super(message);
    }

    public OracleFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
