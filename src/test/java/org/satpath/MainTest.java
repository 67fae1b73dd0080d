package org.satpath;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.satpath.encoding.NodeRepetitionPolicy;
import org.satpath.encoding.WeightBoundPolicy;
import org.satpath.graph.MalformedGraphException;
import org.satpath.oracle.OracleType;
import org.satpath.solver.PathSearchConfiguration;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final Main.ArgumentParser parser = new Main.ArgumentParser();

    @Nested
    @DisplayName("Parsing dei parametri")
    class ParsingTests {

        @Test
        @DisplayName("Valori di default")
        void defaults() {
            Main.RunConfiguration config = parser.parse(new String[0]);

            assertAll(
                    () -> assertEquals(Main.DEFAULT_NODES, config.nodeCount),
                    () -> assertNull(config.source),
                    () -> assertEquals(OracleType.CDCL, config.oracleType),
                    () -> assertEquals(WeightBoundPolicy.ENFORCED, config.boundPolicy),
                    () -> assertEquals(NodeRepetitionPolicy.FULL_PAIRWISE, config.repetitionPolicy),
                    () -> assertEquals(Main.DEFAULT_RUNS, config.runs),
                    () -> assertFalse(config.weighted)
            );
        }

        @Test
        @DisplayName("Default pesato più piccolo")
        void weightedDefaults() {
            assertEquals(Main.DEFAULT_WEIGHTED_NODES, parser.parse(new String[]{"-w"}).nodeCount);
        }

        @Test
        @DisplayName("Parametri completi")
        void fullArguments() {
            Main.RunConfiguration config = parser.parse(new String[]{
                    "-n", "12", "-s", "0", "-t", "11", "-via", "3, 5", "-avoid", "7",
                    "-seed", "42", "-oracle", "sat4j", "-bound", "heuristic", "-repeat", "adjacent",
                    "-p", "3", "-timeout", "5"
            });

            assertAll(
                    () -> assertEquals(12, config.nodeCount),
                    () -> assertEquals(0, config.source),
                    () -> assertEquals(11, config.target),
                    () -> assertEquals(List.of(3, 5), config.via),
                    () -> assertEquals(List.of(7), config.avoid),
                    () -> assertEquals(42L, config.seed),
                    () -> assertEquals(OracleType.SAT4J, config.oracleType),
                    () -> assertEquals(WeightBoundPolicy.HEURISTIC, config.boundPolicy),
                    () -> assertEquals(NodeRepetitionPolicy.ADJACENT_ONLY, config.repetitionPolicy),
                    () -> assertEquals(3, config.parallelism),
                    () -> assertEquals(5, config.timeoutSeconds)
            );
        }

        @Test
        @DisplayName("-h restituisce null")
        void help() {
            assertNull(parser.parse(new String[]{"-n", "5", "-h"}));
        }
    }

    @Test
    @DisplayName("Parametri invalidi")
    void invalidArguments() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-x"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-n"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-n", "1"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-n", "abc"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-n", "5", "-t", "5"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-via", ","})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-bound", "strict"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-oracle", "minisat"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-p", "0"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-f", "non-esiste.txt"}))
        );
    }

    @Test
    @DisplayName("-runs non combinabile con estremi espliciti")
    void runsConflicts() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-runs", "3", "-s", "1"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-runs", "3", "-avoid", "2"})),
                () -> assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-runs", "1001"})),
                () -> assertEquals(3, parser.parse(new String[]{"-runs", "3"}).runs)
        );
    }

    @Test
    @DisplayName("Configurazione di ricerca derivata dai parametri")
    void searchConfiguration() {
        Main.RunConfiguration config = parser.parse(new String[]{"-oracle", "sat4j", "-p", "2", "-bound", "heuristic"});

        PathSearchConfiguration search = Main.buildSearchConfiguration(config);

        assertAll(
                () -> assertEquals("SAT4J", search.getOracle().name()),
                () -> assertEquals(2, search.getParallelism()),
                () -> assertEquals(WeightBoundPolicy.HEURISTIC, search.getBoundPolicy())
        );
    }

    @Test
    @DisplayName("Destinazione casuale: distinta dalla sorgente, grafo di un nodo rifiutato")
    void randomTargetSelection() {
        Random random = new Random(5);

        assertAll(
                () -> assertEquals(1, Main.pickDistinct(random, 2, 0)),
                () -> assertEquals(0, Main.pickDistinct(random, 2, 1)),
                () -> assertNotEquals(3, Main.pickDistinct(random, 6, 3)),
                () -> assertThrows(MalformedGraphException.class, () -> Main.pickDistinct(random, 1, 0))
        );
    }
}
