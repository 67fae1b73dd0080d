package org.satpath.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.satpath.encoding.ViaConstraint;
import org.satpath.graph.AdjacencyGraph;
import org.satpath.graph.MalformedGraphException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathRequestTest {

    private final AdjacencyGraph graph = AdjacencyGraph.unweighted(5);

    @Test
    @DisplayName("Estremi fuori range")
    void endpointsOutOfRange() {
        assertAll(
                () -> assertThrows(MalformedGraphException.class, () -> PathRequest.of(graph, -1, 2)),
                () -> assertThrows(MalformedGraphException.class, () -> PathRequest.of(graph, 0, 5))
        );
    }

    @Test
    @DisplayName("Nodi via non validi")
    void invalidViaNodes() {
        assertAll(
                () -> assertThrows(MalformedGraphException.class,
                        () -> new PathRequest(graph, 0, 4, ViaConstraint.requiring(List.of(7)))),
                () -> assertThrows(MalformedGraphException.class,
                        () -> new PathRequest(graph, 0, 4, ViaConstraint.requiring(List.of(4)))),
                () -> assertThrows(MalformedGraphException.class,
                        () -> new PathRequest(graph, 0, 4, ViaConstraint.of(List.of(), List.of(0)))),
                () -> assertThrows(MalformedGraphException.class,
                        () -> new PathRequest(graph, 0, 4, ViaConstraint.of(List.of(2), List.of(2))))
        );
    }

    @Test
    @DisplayName("Lunghezza minima dipende da estremi e nodi richiesti")
    void minimumPathLength() {
        assertAll(
                () -> assertEquals(1, PathRequest.of(graph, 3, 3).minimumPathLength()),
                () -> assertEquals(2, PathRequest.of(graph, 0, 3).minimumPathLength()),
                () -> assertEquals(4, new PathRequest(graph, 0, 3, ViaConstraint.requiring(List.of(1, 2))).minimumPathLength()),
                () -> assertEquals(2, new PathRequest(graph, 0, 3, ViaConstraint.of(List.of(), List.of(1))).minimumPathLength())
        );
    }

    @Test
    @DisplayName("Vincolo via null equivale a nessun vincolo")
    void nullViaMeansNone() {
        assertTrue(new PathRequest(graph, 0, 1, null).via().isEmpty());
    }
}
