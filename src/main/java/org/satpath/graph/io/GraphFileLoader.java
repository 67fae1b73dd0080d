package org.satpath.graph.io;

import org.antlr.v4.runtime.*;
import org.satpath.antlr.GraphDescriptionLexer;
import org.satpath.antlr.GraphDescriptionParser;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.MalformedGraphException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Caricamento di grafi da file di testo tramite la pipeline ANTLR
 * Lexing → Parsing → Visitor.
 *
 * Gli errori sintattici non vengono recuperati: il primo errore interrompe il parsing
 * con una MalformedGraphException che riporta riga e colonna.
 */
public final class GraphFileLoader {

    private static final Logger LOGGER = Logger.getLogger(GraphFileLoader.class.getName());

    private GraphFileLoader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge e interpreta un file di descrizione grafo.
     *
     * @param file percorso del file
     * @return grafo descritto
     * @throws IOException se il file non è leggibile
     * @throws MalformedGraphException se il contenuto non è valido
     */
    public static AdjacencyGraph load(Path file) throws IOException {
        LOGGER.info("Lettura grafo da file: " + file);
        return parse(CharStreams.fromPath(file));
    }

    /**
     * Interpreta una descrizione grafo già in memoria.
     */
    public static AdjacencyGraph parse(String description) {
        return parse(CharStreams.fromString(description));
    }

    private static AdjacencyGraph parse(CharStream input) {
        GraphDescriptionLexer lexer = new GraphDescriptionLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        GraphDescriptionParser parser = new GraphDescriptionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        return new GraphFileParser().visit(parser.graph());
    }

    /**
     * Trasforma il primo errore di lexing o parsing in MalformedGraphException.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new MalformedGraphException(String.format(
                    "Descrizione grafo non valida (riga %d:%d): %s", line, charPositionInLine, msg), e);
        }
    }
}
