package org.satpath.comparison;

import java.util.List;

/**
 * Aggregato di più istanze casuali confrontate.
 */
public record BatchSummary(List<ComparisonReport> reports) {

    public BatchSummary {
        reports = List.copyOf(reports);
    }

    public int runs() {
        return reports.size();
    }

    public long agreements() {
        return reports.stream().filter(ComparisonReport::agrees).count();
    }

    public boolean allAgree() {
        return agreements() == runs();
    }

    public long totalSatNanos() {
        return reports.stream().mapToLong(ComparisonReport::satNanos).sum();
    }

    public long totalDijkstraNanos() {
        return reports.stream().mapToLong(ComparisonReport::dijkstraNanos).sum();
    }

    @Override
    public String toString() {
        return String.format("Istanze: %d, accordo: %d/%d, tempo SAT totale: %.3f ms, Dijkstra totale: %.3f ms",
                runs(), agreements(), runs(), totalSatNanos() / 1_000_000.0, totalDijkstraNanos() / 1_000_000.0);
    }
}
