package org.satpath.solver;

import org.satpath.graph.GraphPrinter;

import java.util.List;

/**
 * RISULTATO DELLA RICERCA - Percorso trovato oppure "nessun percorso"
 *
 * L'assenza di percorso è un valore, non un'eccezione: viene restituita solo dopo
 * aver esaurito tutte le lunghezze fino a N.
 */
public final class PathResult {

    private final List<Integer> path;

    private final long weight;

    private final List<ProbeRecord> probes;

    private final long elapsedMs;

    private final String solverName;

    private PathResult(List<Integer> path, long weight, List<ProbeRecord> probes, long elapsedMs, String solverName) {
        this.path = path;
        this.weight = weight;
        this.probes = List.copyOf(probes);
        this.elapsedMs = elapsedMs;
        this.solverName = solverName;
    }

    /**
     * @param path nodi nell'ordine di attraversamento (non vuoto)
     * @param weight peso totale, pari al numero di archi per la ricerca non pesata
     */
    public static PathResult found(List<Integer> path, long weight, List<ProbeRecord> probes,
                                   long elapsedMs, String solverName) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Percorso trovato non può essere vuoto");
        }
        return new PathResult(List.copyOf(path), weight, probes, elapsedMs, solverName);
    }

    public static PathResult noPath(List<ProbeRecord> probes, long elapsedMs, String solverName) {
        return new PathResult(null, -1, probes, elapsedMs, solverName);
    }

    public boolean isFound() {
        return path != null;
    }

    /**
     * @return percorso trovato, lista vuota se nessun percorso
     */
    public List<Integer> getPath() {
        return path != null ? path : List.of();
    }

    /**
     * @return numero di archi del percorso
     * @throws IllegalStateException se nessun percorso è stato trovato
     */
    public int getHopCount() {
        requireFound();
        return path.size() - 1;
    }

    /**
     * @throws IllegalStateException se nessun percorso è stato trovato
     */
    public long getWeight() {
        requireFound();
        return weight;
    }

    public List<ProbeRecord> getProbes() {
        return probes;
    }

    public int getProbeCount() {
        return probes.size();
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getSolverName() {
        return solverName;
    }

    private void requireFound() {
        if (path == null) {
            throw new IllegalStateException("Nessun percorso trovato");
        }
    }

    @Override
    public String toString() {
        if (!isFound()) {
            return String.format("PathResult{nessun percorso, probe=%d, %dms}", probes.size(), elapsedMs);
        }
        return String.format("PathResult{%s, hop=%d, peso=%d, probe=%d, %dms}",
                GraphPrinter.renderPath(path), getHopCount(), weight, probes.size(), elapsedMs);
    }
}
