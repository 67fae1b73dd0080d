package org.satpath.graph;

/**
 * Segnala un grafo o una richiesta di percorso non validi: nodi fuori range,
 * nodi via coincidenti con sorgente o destinazione, archi malformati o file
 * di descrizione sintatticamente errati.
 *
 * Viene lanciata subito, prima di qualsiasi codifica, invece di produrre un
 * percorso vuoto.
 */
public class MalformedGraphException extends IllegalArgumentException {

    public MalformedGraphException(String message) {
        super(message);
    }

    public MalformedGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
