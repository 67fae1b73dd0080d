package org.satpath.comparison;

import org.satpath.baseline.ShortestPath;
import org.satpath.graph.GraphPrinter;
import org.satpath.solver.PathResult;

/**
 * CONFRONTO SAT / DIJKSTRA - Esito di una singola istanza
 *
 * CRITERI DI ACCORDO:
 * • Non pesato: stessa esistenza e stesso numero di archi
 * • Pesato: stessa esistenza e peso SAT ≥ peso Dijkstra (il solutore pesato minimizza
 *   prima il numero di archi, quindi il suo peso non può scendere sotto l'ottimo)
 * • Con vincoli via: un percorso SAT implica un percorso Dijkstra non più corto
 *
 * @param dijkstra percorso di riferimento (pesi unitari per il confronto non pesato)
 * @param satNanos tempo di parete della ricerca SAT
 * @param dijkstraNanos tempo di parete di Dijkstra
 */
public record ComparisonReport(PathResult sat, ShortestPath dijkstra, boolean weighted, boolean constrained,
                               long satNanos, long dijkstraNanos) {

    public boolean agrees() {
        if (constrained) {
            if (!sat.isFound()) {
                return true;
            }
            return dijkstra.isFound() && sat.getHopCount() >= dijkstra.hopCount();
        }
        if (sat.isFound() != dijkstra.isFound()) {
            return false;
        }
        if (!sat.isFound()) {
            return true;
        }
        if (weighted) {
            return sat.getWeight() >= dijkstra.distance().value()
                    && sat.getHopCount() <= dijkstra.hopCount();
        }
        return sat.getHopCount() == dijkstra.hopCount();
    }

    /**
     * @return differenza tra peso SAT e peso ottimo, 0 se uno dei due percorsi manca
     */
    public long weightGap() {
        if (!sat.isFound() || !dijkstra.isFound()) {
            return 0;
        }
        return sat.getWeight() - dijkstra.distance().value();
    }

    public double satMillis() {
        return satNanos / 1_000_000.0;
    }

    public double dijkstraMillis() {
        return dijkstraNanos / 1_000_000.0;
    }

    /**
     * Rapporto tra i tempi, 0 se Dijkstra ha impiegato un tempo non misurabile.
     */
    public double slowdown() {
        return dijkstraNanos == 0 ? 0.0 : (double) satNanos / dijkstraNanos;
    }

    public String toSummaryString() {
        StringBuilder output = new StringBuilder();
        output.append("=====================================[ CONFRONTO SAT / DIJKSTRA ]=====================================\n");
        output.append("    SAT (").append(sat.getSolverName()).append("): ")
                .append(sat.isFound() ? describe(sat) : "nessun percorso").append('\n');
        output.append("    Dijkstra: ").append(dijkstra).append('\n');
        output.append("    Probe SAT: ").append(sat.getProbeCount()).append('\n');
        output.append(String.format("    Tempo SAT: %.3f ms, Dijkstra: %.3f ms%n", satMillis(), dijkstraMillis()));
        if (weighted && weightGap() > 0) {
            output.append("    Scarto di peso: ").append(weightGap()).append('\n');
        }
        output.append("    Accordo: ").append(agrees() ? "SI" : "NO").append('\n');
        output.append("======================================================================================================\n");
        return output.toString();
    }

    private static String describe(PathResult result) {
        return String.format("%s (hop %d, peso %d)",
                GraphPrinter.renderPath(result.getPath()), result.getHopCount(), result.getWeight());
    }
}
