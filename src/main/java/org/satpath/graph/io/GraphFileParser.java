package org.satpath.graph.io;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.satpath.antlr.GraphDescriptionBaseVisitor;
import org.satpath.antlr.GraphDescriptionParser.EdgeContext;
import org.satpath.antlr.GraphDescriptionParser.GraphContext;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.MalformedGraphException;

import java.util.logging.Logger;

/**
 * PARSER DESCRIZIONE GRAFO - Convertitore da albero sintattico ANTLR ad AdjacencyGraph
 *
 * Visitor sull'albero prodotto dalla grammatica GraphDescription. L'intestazione
 * {@code nodes N} fissa il numero di nodi; ogni riga {@code a -- b [w]} aggiunge un arco.
 *
 * REGOLE SEMANTICHE:
 * - Se almeno un arco dichiara un peso il grafo è pesato; gli archi senza peso valgono 1
 * - Archi ripetuti vengono ignorati (resta il primo peso letto)
 * - Nodi fuori range, self-loop e pesi nulli producono MalformedGraphException con riga e colonna
 */
public class GraphFileParser extends GraphDescriptionBaseVisitor<AdjacencyGraph> {

    private static final Logger LOGGER = Logger.getLogger(GraphFileParser.class.getName());

    /**
     * Punto di ingresso: costruisce il grafo completo dalla radice dell'albero sintattico.
     *
     * @param ctx contesto della regola {@code graph}
     * @return grafo non orientato descritto dal file
     */
    @Override
    public AdjacencyGraph visitGraph(GraphContext ctx) {
        int nodeCount = parseInteger(ctx.header().INT());
        boolean weighted = ctx.edge().stream().anyMatch(edge -> edge.weight() != null);

        AdjacencyGraph graph = weighted ? AdjacencyGraph.weighted(nodeCount) : AdjacencyGraph.unweighted(nodeCount);

        int duplicates = 0;
        for (EdgeContext edge : ctx.edge()) {
            if (!addEdge(graph, edge)) {
                duplicates++;
            }
        }

        if (duplicates > 0) {
            LOGGER.warning("Archi duplicati ignorati: " + duplicates);
        }
        LOGGER.fine("Grafo letto: " + graph);
        return graph;
    }

    private boolean addEdge(AdjacencyGraph graph, EdgeContext edge) {
        int from = parseInteger(edge.INT(0));
        int to = parseInteger(edge.INT(1));
        int weight = edge.weight() != null ? parseInteger(edge.weight().INT()) : AdjacencyGraph.UNIT_WEIGHT;

        try {
            return graph.addEdge(from, to, weight);
        } catch (MalformedGraphException e) {
            throw new MalformedGraphException(position(edge.getStart()) + e.getMessage(), e);
        }
    }

    private int parseInteger(TerminalNode node) {
        try {
            return Integer.parseInt(node.getText());
        } catch (NumberFormatException e) {
            throw new MalformedGraphException(position(node.getSymbol()) + "intero fuori range: " + node.getText(), e);
        }
    }

    private static String position(Token token) {
        return "riga " + token.getLine() + ":" + token.getCharPositionInLine() + " - ";
    }
}
