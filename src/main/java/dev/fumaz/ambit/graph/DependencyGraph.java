package dev.fumaz.ambit.graph;

import dev.fumaz.ambit.injectable.Injectable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link DependencyGraph} is a snapshot of the dependency edges recorded so far, starting from one
 * {@link Injectable}.
 * <p>
 * The snapshot only reflects resolutions that already happened. Later resolutions may add edges to the injectables
 * it contains without changing the snapshot.
 */
public final class DependencyGraph {

    private final @NotNull Injectable<?, ?> root;
    private final Map<Injectable<?, ?>, List<Injectable<?, ?>>> adjacency;

    private DependencyGraph(@NotNull Injectable<?, ?> root, Map<Injectable<?, ?>, List<Injectable<?, ?>>> adjacency) {
        this.root = root;
        this.adjacency = adjacency;
    }

    public static @NotNull DependencyGraph of(@NotNull Injectable<?, ?> root) {
        Objects.requireNonNull(root, "root");

        Map<Injectable<?, ?>, List<Injectable<?, ?>>> adjacency = new LinkedHashMap<>();
        Deque<Injectable<?, ?>> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            Injectable<?, ?> node = pending.pop();

            if (adjacency.containsKey(node)) {
                continue;
            }

            List<Injectable<?, ?>> dependencies = Collections.unmodifiableList(new ArrayList<>(node.getDependencies()));
            adjacency.put(node, dependencies);

            for (int i = dependencies.size() - 1; i >= 0; i--) {
                pending.push(dependencies.get(i));
            }
        }

        return new DependencyGraph(root, Collections.unmodifiableMap(adjacency));
    }

    public @NotNull Injectable<?, ?> getRoot() {
        return root;
    }

    /**
     * Returns every injectable reachable from the root, in depth-first pre-order.
     */
    public @NotNull List<Injectable<?, ?>> nodes() {
        return new ArrayList<>(adjacency.keySet());
    }

    public @NotNull List<Injectable<?, ?>> dependenciesOf(@NotNull Injectable<?, ?> node) {
        return adjacency.getOrDefault(node, Collections.emptyList());
    }

    public boolean contains(@NotNull Injectable<?, ?> node) {
        return adjacency.containsKey(node);
    }

    public int edgeCount() {
        return adjacency.values().stream()
                .mapToInt(List::size)
                .sum();
    }

    /**
     * Finds the first cycle in the snapshot. The returned path starts and ends with the same injectable.
     * <p>
     * Self edges are ignored: a scope entry point records the injectable it resolves as its own dependency.
     */
    public @NotNull Optional<List<Injectable<?, ?>>> findCycle() {
        Map<Injectable<?, ?>, Boolean> onPath = new HashMap<>();
        Deque<Injectable<?, ?>> path = new ArrayDeque<>();

        for (Injectable<?, ?> node : adjacency.keySet()) {
            if (!onPath.containsKey(node)) {
                List<Injectable<?, ?>> cycle = visit(node, onPath, path);

                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }

        return Optional.empty();
    }

    public @NotNull String describe() {
        String lineSeparator = System.lineSeparator();
        StringBuilder builder = new StringBuilder();

        builder.append("Dependency graph of ")
                .append(root)
                .append(" (")
                .append(adjacency.size())
                .append(" nodes, ")
                .append(edgeCount())
                .append(" edges)");

        adjacency.forEach((node, dependencies) -> {
            builder.append(lineSeparator).append(" - ").append(node);

            if (!dependencies.isEmpty()) {
                builder.append(" -> ").append(dependencies);
            }
        });

        findCycle().ifPresent(cycle -> builder.append(lineSeparator).append("Cycle path: ").append(cycle));

        return builder.toString();
    }

    // onPath: TRUE while the node is on the current path, FALSE once fully explored.
    private @Nullable List<Injectable<?, ?>> visit(Injectable<?, ?> node,
                                                   Map<Injectable<?, ?>, Boolean> onPath,
                                                   Deque<Injectable<?, ?>> path) {
        onPath.put(node, Boolean.TRUE);
        path.addLast(node);

        for (Injectable<?, ?> dependency : dependenciesOf(node)) {
            if (dependency == node) {
                continue;
            }

            Boolean state = onPath.get(dependency);

            if (Boolean.TRUE.equals(state)) {
                List<Injectable<?, ?>> ordered = new ArrayList<>(path);
                List<Injectable<?, ?>> cycle = new ArrayList<>(ordered.subList(ordered.indexOf(dependency),
                        ordered.size()));
                cycle.add(dependency);
                return cycle;
            }

            if (state == null) {
                List<Injectable<?, ?>> cycle = visit(dependency, onPath, path);

                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.removeLast();
        onPath.put(node, Boolean.FALSE);
        return null;
    }

    @Override
    public String toString() {
        return describe();
    }
}
