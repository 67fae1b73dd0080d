package org.satpath;

import org.satpath.comparison.BatchSummary;
import org.satpath.comparison.ComparisonReport;
import org.satpath.comparison.ComparisonRunner;
import org.satpath.encoding.*;
import org.satpath.graph.*;
import org.satpath.graph.io.GraphFileLoader;
import org.satpath.oracle.OracleFailureException;
import org.satpath.oracle.OracleType;
import org.satpath.solver.PathRequest;
import org.satpath.solver.PathResult;
import org.satpath.solver.PathSearchConfiguration;
import org.satpath.solver.ProbeRecord;
import org.satpath.support.CNFFormula;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * PERCORSO MINIMO VIA SAT - Confronto tra codifica CNF iterativa e Dijkstra
 *
 * PIPELINE:
 * 1. INPUT: grafo casuale riproducibile (seme) oppure file di descrizione (ANTLR)
 * 2. RICHIESTA: sorgente, destinazione, nodi via richiesti o vietati
 * 3. RICERCA SAT: lunghezza crescente, ricerca binaria sul peso per i grafi pesati
 * 4. RIFERIMENTO: Dijkstra sullo stesso grafo
 * 5. OUTPUT: percorsi, tempi, accordo, esportazione DIMACS dell'ultimo probe
 *
 * MODALITÀ:
 * - Istanza singola (default): un grafo, un confronto
 * - Batch (-runs k): k istanze casuali con semi consecutivi e riepilogo aggregato
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String NODES_PARAM = "-n";
    static final String SOURCE_PARAM = "-s";
    static final String TARGET_PARAM = "-t";
    static final String VIA_PARAM = "-via";
    static final String AVOID_PARAM = "-avoid";
    static final String SEED_PARAM = "-seed";
    static final String WEIGHTED_PARAM = "-w";
    static final String MAX_WEIGHT_PARAM = "-maxw";
    static final String FILE_PARAM = "-f";
    static final String ORACLE_PARAM = "-oracle";
    static final String BOUND_PARAM = "-bound";
    static final String REPEAT_PARAM = "-repeat";
    static final String PARALLEL_PARAM = "-p";
    static final String TIMEOUT_PARAM = "-timeout";
    static final String RUNS_PARAM = "-runs";
    static final String DIMACS_PARAM = "-dimacs";
    static final String PRINT_PARAM = "-print";

    /**
     * Valori di default e limiti
     * */
    static final int DEFAULT_NODES = 30;
    static final int DEFAULT_WEIGHTED_NODES = 15;
    static final int MIN_NODES = 2;
    static final int DEFAULT_TIMEOUT_SECONDS = 0;
    static final int DEFAULT_RUNS = 1;
    static final int MAX_RUNS = 1000;

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO PERCORSO MINIMO VIA SAT <---");

        try {
            RunConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (MalformedGraphException e) {
            System.out.println("[E] Grafo o richiesta non validi: " + e.getMessage());
            System.exit(2);
        } catch (OracleFailureException e) {
            LOGGER.log(Level.SEVERE, "Fallimento dell'oracolo SAT", e);
            System.out.println("[E] Fallimento dell'oracolo SAT: " + e.getMessage());
            System.exit(3);
        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    private static void configureLogging() {
        try (InputStream input = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (input != null) {
                LogManager.getLogManager().readConfiguration(input);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static void executeMainPipeline(RunConfiguration config) throws IOException {
        ComparisonRunner runner = new ComparisonRunner(buildSearchConfiguration(config));

        if (config.runs > 1) {
            System.out.println("[I] Modalità: Batch di " + config.runs + " istanze casuali");
            processBatch(runner, config);
        } else {
            System.out.println("[I] Modalità: Istanza singola");
            processSingleInstance(runner, config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region ELABORAZIONE

    static PathSearchConfiguration buildSearchConfiguration(RunConfiguration config) {
        return PathSearchConfiguration.builder()
                .oracle(config.oracleType.create(config.timeoutSeconds))
                .repetitionPolicy(config.repetitionPolicy)
                .boundPolicy(config.boundPolicy)
                .parallelism(config.parallelism)
                .build();
    }

    private static void processBatch(ComparisonRunner runner, RunConfiguration config) {
        BatchSummary summary = runner.runBatch(config.runs, config.nodeCount, config.seed,
                config.weighted, config.maxWeight);

        System.out.println("\n-->> RIEPILOGO BATCH <<--");
        System.out.println(summary);
        if (!summary.allAgree()) {
            System.out.println("[W] " + (summary.runs() - summary.agreements()) + " istanze in disaccordo con Dijkstra");
        }
    }

    private static void processSingleInstance(ComparisonRunner runner, RunConfiguration config) throws IOException {
        Random random = new Random(config.seed);
        Graph graph = loadOrGenerateGraph(config, random);
        boolean weighted = config.weighted || graph.isWeighted();

        int source = config.source != null ? config.source : random.nextInt(graph.nodeCount());
        int target = config.target != null ? config.target : pickDistinct(random, graph.nodeCount(), source);
        System.out.println("[I] Ricerca " + source + " -> " + target + (weighted ? " (pesata)" : ""));

        PathRequest request = new PathRequest(graph, source, target, ViaConstraint.of(config.via, config.avoid));
        ComparisonReport report = runner.compare(request, weighted);

        System.out.println();
        System.out.print(report.toSummaryString());
        if (!report.agrees()) {
            System.out.println("[W] Il percorso SAT non concorda con Dijkstra");
        }

        if (config.printGraph) {
            Map<String, List<Integer>> paths = new LinkedHashMap<>();
            paths.put("SAT", report.sat().getPath());
            paths.put("Dijkstra", report.dijkstra().path());
            GraphPrinter.print(graph, paths);
        }

        if (config.dimacsPath != null) {
            exportLastProbe(config, request, report.sat(), weighted);
        }
    }

    private static Graph loadOrGenerateGraph(RunConfiguration config, Random random) throws IOException {
        if (config.graphFile != null) {
            System.out.println("[I] Caricamento grafo da " + config.graphFile);
            return GraphFileLoader.load(Path.of(config.graphFile));
        }
        GraphGenerator generator = new GraphGenerator(random);
        System.out.println("[I] Generazione grafo casuale di " + config.nodeCount + " nodi (seme " + config.seed + ")");
        return config.weighted
                ? generator.connectedWeighted(config.nodeCount, config.maxWeight)
                : generator.connected(config.nodeCount);
    }

    /**
     * @throws MalformedGraphException se il grafo ha meno di 2 nodi
     */
    static int pickDistinct(Random random, int nodeCount, int excluded) {
        if (nodeCount < MIN_NODES) {
            throw new MalformedGraphException("Destinazione casuale distinta dalla sorgente: serve almeno "
                    + MIN_NODES + " nodi, il grafo ne ha " + nodeCount);
        }
        int node = random.nextInt(nodeCount - 1);
        return node >= excluded ? node + 1 : node;
    }

    /**
     * Ricostruisce e salva in DIMACS la formula dell'ultimo probe eseguito.
     */
    private static void exportLastProbe(RunConfiguration config, PathRequest request, PathResult result, boolean weighted)
            throws IOException {
        List<ProbeRecord> probes = result.getProbes();
        if (probes.isEmpty()) {
            System.out.println("[W] Nessun probe eseguito: esportazione DIMACS saltata");
            return;
        }
        ProbeRecord last = probes.get(probes.size() - 1);

        CNFFormula formula = weighted
                ? new WeightedPathEncoder(config.boundPolicy).encode(request.graph(), request.source(),
                        request.target(), last.pathLength(), request.via(), last.bound())
                : new PathEncoder(config.repetitionPolicy).encode(request.graph(), request.source(),
                        request.target(), last.pathLength(), request.via());

        DimacsWriter.write(formula, Path.of(config.dimacsPath));
        System.out.println("[I] Formula dell'ultimo probe (" + last + ") salvata in " + config.dimacsPath);
    }

    private static void displayConfigurationSummary(RunConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE <<--");
        System.out.println("Grafo: " + (config.graphFile != null ? "file " + config.graphFile
                : config.nodeCount + " nodi" + (config.weighted ? ", pesato (max " + config.maxWeight + ")" : "")));
        System.out.println("Seme: " + config.seed);
        System.out.println("Oracolo: " + config.oracleType + (config.timeoutSeconds > 0
                ? ", timeout " + config.timeoutSeconds + "s" : ""));
        System.out.println("Unicità nodi: " + config.repetitionPolicy + ", limite di peso: " + config.boundPolicy);
        if (config.parallelism > 1) {
            System.out.println("Parallelismo: " + config.parallelism);
        }
        if (!config.via.isEmpty() || !config.avoid.isEmpty()) {
            System.out.println("Via: " + config.via + ", vietati: " + config.avoid);
        }
        System.out.println();
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static RunConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void printApplicationHelp() {
        System.out.println("""
                USO: java -jar sat-shortest-path.jar [opzioni]

                GRAFO:
                  -n <nodi>            Nodi del grafo casuale (default 30, pesato 15)
                  -w                   Grafo pesato e ricerca con limite di peso
                  -maxw <peso>         Peso massimo degli archi generati (default 10)
                  -f <file>            Carica il grafo da file ('nodes N', 'a -- b [w]')
                  -seed <numero>       Seme per grafo ed estremi casuali
                  -print               Stampa il grafo con i percorsi trovati

                RICHIESTA:
                  -s <nodo>            Sorgente (default casuale)
                  -t <nodo>            Destinazione (default casuale, diversa dalla sorgente)
                  -via <a,b,...>       Nodi che il percorso deve attraversare
                  -avoid <a,b,...>     Nodi che il percorso non deve attraversare

                RICERCA:
                  -oracle cdcl|sat4j   Oracolo SAT (default cdcl)
                  -bound enforced|heuristic   Limite di peso codificato o solo euristico
                  -repeat full|adjacent       Unicità dei nodi su tutte le posizioni o solo consecutive
                  -p <thread>          Lunghezze provate in parallelo (default 1)
                  -timeout <secondi>   Timeout per singolo probe (default nessuno)
                  -runs <k>            Confronto su k istanze casuali
                  -dimacs <file>       Salva in DIMACS la formula dell'ultimo probe

                  -h                   Mostra questo help
                """);
    }

    /**
     * Configurazione di esecuzione ottenuta dalla linea di comando.
     */
    static final class RunConfiguration {
        int nodeCount;
        Integer source;
        Integer target;
        List<Integer> via = new ArrayList<>();
        List<Integer> avoid = new ArrayList<>();
        long seed;
        boolean weighted;
        int maxWeight = GraphGenerator.DEFAULT_MAX_WEIGHT;
        String graphFile;
        OracleType oracleType = OracleType.CDCL;
        WeightBoundPolicy boundPolicy = PathSearchConfiguration.DEFAULT_BOUND_POLICY;
        NodeRepetitionPolicy repetitionPolicy = PathSearchConfiguration.DEFAULT_REPETITION_POLICY;
        int parallelism = PathSearchConfiguration.DEFAULT_PARALLELISM;
        int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        int runs = DEFAULT_RUNS;
        String dimacsPath;
        boolean printGraph;
    }

    /**
     * Parser dei parametri con messaggi di errore informativi.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono invalidi
         */
        RunConfiguration parse(String[] args) {
            RunConfiguration config = new RunConfiguration();
            Integer nodeCount = null;
            Long seed = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case NODES_PARAM -> nodeCount = parseInt(args, ++i, "numero nodi", MIN_NODES);
                    case SOURCE_PARAM -> config.source = parseInt(args, ++i, "nodo sorgente", 0);
                    case TARGET_PARAM -> config.target = parseInt(args, ++i, "nodo destinazione", 0);
                    case VIA_PARAM -> config.via = parseNodeList(args, ++i);
                    case AVOID_PARAM -> config.avoid = parseNodeList(args, ++i);
                    case SEED_PARAM -> seed = parseLong(args, ++i);
                    case WEIGHTED_PARAM -> config.weighted = true;
                    case MAX_WEIGHT_PARAM -> config.maxWeight = parseInt(args, ++i, "peso massimo", 1);
                    case FILE_PARAM -> {
                        config.graphFile = getNextArgument(args, ++i, "file");
                        validateFileExists(config.graphFile);
                    }
                    case ORACLE_PARAM -> config.oracleType = OracleType.parse(getNextArgument(args, ++i, "oracolo"));
                    case BOUND_PARAM -> config.boundPolicy = parseBoundPolicy(getNextArgument(args, ++i, "politica del limite"));
                    case REPEAT_PARAM -> config.repetitionPolicy = parseRepetitionPolicy(getNextArgument(args, ++i, "politica di ripetizione"));
                    case PARALLEL_PARAM -> config.parallelism = parseInt(args, ++i, "parallelismo", PathSearchConfiguration.MIN_PARALLELISM);
                    case TIMEOUT_PARAM -> config.timeoutSeconds = parseInt(args, ++i, "numero secondi", 0);
                    case RUNS_PARAM -> config.runs = parseInt(args, ++i, "numero esecuzioni", 1);
                    case DIMACS_PARAM -> config.dimacsPath = getNextArgument(args, ++i, "file DIMACS");
                    case PRINT_PARAM -> config.printGraph = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            config.nodeCount = nodeCount != null ? nodeCount : (config.weighted ? DEFAULT_WEIGHTED_NODES : DEFAULT_NODES);
            config.seed = seed != null ? seed : System.nanoTime();
            return validateFinalConfiguration(config);
        }

        private RunConfiguration validateFinalConfiguration(RunConfiguration config) {
            if (config.runs > MAX_RUNS) {
                throw new IllegalArgumentException("Numero esecuzioni massimo: " + MAX_RUNS);
            }
            if (config.runs > 1) {
                if (config.graphFile != null) {
                    throw new IllegalArgumentException("-runs non può essere combinato con -f");
                }
                if (config.source != null || config.target != null || !config.via.isEmpty() || !config.avoid.isEmpty()) {
                    throw new IllegalArgumentException("-runs sceglie gli estremi a caso: -s, -t, -via e -avoid non ammessi");
                }
            }
            if (config.graphFile == null) {
                checkInRange(config.source, config.nodeCount, "Sorgente");
                checkInRange(config.target, config.nodeCount, "Destinazione");
            }
            return config;
        }

        private void checkInRange(Integer node, int nodeCount, String role) {
            if (node != null && node >= nodeCount) {
                throw new IllegalArgumentException(role + " " + node + " fuori dal range 0.." + (nodeCount - 1));
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseInt(String[] args, int currentIndex, String argumentType, int minimum) {
            String value = getNextArgument(args, currentIndex, argumentType);
            int parsed;
            try {
                parsed = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + argumentType + ": " + value);
            }
            if (parsed < minimum) {
                throw new IllegalArgumentException("Valore minimo per " + argumentType + ": " + minimum + ", ricevuto: " + parsed);
            }
            return parsed;
        }

        private long parseLong(String[] args, int currentIndex) {
            String value = getNextArgument(args, currentIndex, "seme");
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }

        private List<Integer> parseNodeList(String[] args, int currentIndex) {
            String value = getNextArgument(args, currentIndex, "lista di nodi");
            List<Integer> nodes = new ArrayList<>();
            for (String token : value.split(",")) {
                if (token.isBlank()) {
                    continue;
                }
                try {
                    nodes.add(Integer.parseInt(token.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Nodo non valido nella lista: " + token);
                }
            }
            if (nodes.isEmpty()) {
                throw new IllegalArgumentException("Lista di nodi vuota: " + value);
            }
            return nodes;
        }

        private WeightBoundPolicy parseBoundPolicy(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "enforced" -> WeightBoundPolicy.ENFORCED;
                case "heuristic" -> WeightBoundPolicy.HEURISTIC;
                default -> throw new IllegalArgumentException("Politica del limite sconosciuta: " + value + " (enforced, heuristic)");
            };
        }

        private NodeRepetitionPolicy parseRepetitionPolicy(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "full" -> NodeRepetitionPolicy.FULL_PAIRWISE;
                case "adjacent" -> NodeRepetitionPolicy.ADJACENT_ONLY;
                default -> throw new IllegalArgumentException("Politica di ripetizione sconosciuta: " + value + " (full, adjacent)");
            };
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    //endregion
}
