package org.satpath.baseline;

import org.satpath.encoding.ViaConstraint;
import org.satpath.graph.Graph;
import org.satpath.solver.PathDecoder;

import java.util.*;
import java.util.function.Consumer;

/**
 * Enumerazione esaustiva dei percorsi semplici, usata per validare i risultati
 * su grafi piccoli.
 *
 * Visita in profondità con stack esplicito: ogni frame conserva il nodo e l'iteratore
 * sui vicini; l'insieme dei visitati viene ripristinato quando il frame viene rimosso.
 */
public class BruteForcePathEnumerator {

    private final Graph graph;

    public BruteForcePathEnumerator(Graph graph) {
        this.graph = graph;
    }

    private static final class Frame {
        final int node;
        final Iterator<Integer> neighbors;

        Frame(int node, Iterator<Integer> neighbors) {
            this.node = node;
            this.neighbors = neighbors;
        }
    }

    /**
     * Visita ogni percorso semplice da source a target con al più maxNodes nodi
     * che rispetta il vincolo via.
     */
    public void forEachSimplePath(int source, int target, ViaConstraint via, int maxNodes, Consumer<List<Integer>> action) {
        ViaConstraint constraint = via != null ? via : ViaConstraint.none();
        if (constraint.forbidden().contains(source) || constraint.forbidden().contains(target)) {
            return;
        }
        if (source == target) {
            if (constraint.required().isEmpty() && maxNodes >= 1) {
                action.accept(List.of(source));
            }
            return;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        List<Integer> current = new ArrayList<>();
        boolean[] visited = new boolean[graph.nodeCount()];

        stack.push(new Frame(source, graph.neighbors(source).iterator()));
        current.add(source);
        visited[source] = true;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();

            if (frame.node == target) {
                if (current.containsAll(constraint.required())) {
                    action.accept(List.copyOf(current));
                }
                pop(stack, current, visited);
                continue;
            }
            if (current.size() >= maxNodes || !frame.neighbors.hasNext()) {
                pop(stack, current, visited);
                continue;
            }

            int next = frame.neighbors.next();
            if (visited[next] || constraint.forbidden().contains(next)) {
                continue;
            }
            stack.push(new Frame(next, graph.neighbors(next).iterator()));
            current.add(next);
            visited[next] = true;
        }
    }

    private static void pop(Deque<Frame> stack, List<Integer> current, boolean[] visited) {
        Frame frame = stack.pop();
        visited[frame.node] = false;
        current.remove(current.size() - 1);
    }

    public List<List<Integer>> allSimplePaths(int source, int target, ViaConstraint via) {
        List<List<Integer>> paths = new ArrayList<>();
        forEachSimplePath(source, target, via, graph.nodeCount(), paths::add);
        return paths;
    }

    /**
     * @return minimo numero di archi tra i percorsi semplici, vuoto se nessun percorso
     */
    public OptionalInt minimumHopCount(int source, int target, ViaConstraint via) {
        int[] best = {Integer.MAX_VALUE};
        forEachSimplePath(source, target, via, graph.nodeCount(),
                path -> best[0] = Math.min(best[0], path.size() - 1));
        return best[0] == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best[0]);
    }

    /**
     * @return peso minimo tra i percorsi semplici di esattamente pathLength nodi
     */
    public OptionalLong minimumWeight(int source, int target, ViaConstraint via, int pathLength) {
        long[] best = {Long.MAX_VALUE};
        forEachSimplePath(source, target, via, pathLength, path -> {
            if (path.size() == pathLength) {
                best[0] = Math.min(best[0], PathDecoder.pathWeight(graph, path));
            }
        });
        return best[0] == Long.MAX_VALUE ? OptionalLong.empty() : OptionalLong.of(best[0]);
    }
}
