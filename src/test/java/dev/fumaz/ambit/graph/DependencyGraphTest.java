package dev.fumaz.ambit.graph;

import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injectable.InjectableOptions;
import dev.fumaz.ambit.injectable.Lifetime;
import dev.fumaz.ambit.injector.Injector;
import dev.fumaz.ambit.scope.Scopes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @BeforeEach
    void resetRootScope() {
        Scopes.root().reset();
    }

    @Test
    void snapshotsReachableNodesInPreOrder() {
        Injectable<Void, Object> leafA = named("leafA");
        Injectable<Void, Object> leafB = named("leafB");
        Injectable<Void, Object> middle = named("middle", leafA, leafB);
        Injectable<Void, Object> other = named("other", leafB);
        Injectable<Void, Object> root = named("root", middle, other);

        Injector.inject(root);
        DependencyGraph graph = DependencyGraph.of(root);

        assertEquals(List.of(root, middle, leafA, leafB, other), graph.nodes());
        assertEquals(List.of(middle, other), graph.dependenciesOf(root));
        assertEquals(5, graph.edgeCount());
        assertTrue(graph.dependenciesOf(leafA).isEmpty());
        assertFalse(graph.findCycle().isPresent());
    }

    @Test
    void unresolvedInjectableHasNoEdges() {
        Injectable<Void, Object> lonely = named("lonely");

        DependencyGraph graph = DependencyGraph.of(lonely);

        assertEquals(List.of(lonely), graph.nodes());
        assertEquals(0, graph.edgeCount());
        assertFalse(graph.contains(named("stranger")));
    }

    @Test
    void reportsRecordedCycle() {
        AtomicBoolean closeLoop = new AtomicBoolean();
        List<Injectable<?, ?>> cached = new ArrayList<>();
        Injectable<Void, Object> third = Injectable.define(() -> {
            if (closeLoop.get()) {
                Injector.inject(cached.get(0));
            }

            return new Object();
        }, InjectableOptions.builder().transientLifetime().name("third").build());
        Injectable<Void, Object> second = named("second", third);
        Injectable<Void, Object> first = Injectable.define(() -> Injector.inject(second),
                InjectableOptions.builder().singleton().name("first").build());
        cached.add(first);

        Injector.inject(first);
        closeLoop.set(true);
        Injector.inject(third);

        DependencyGraph graph = DependencyGraph.of(first);
        Optional<List<Injectable<?, ?>>> cycle = graph.findCycle();

        assertSame(first, graph.getRoot());
        assertTrue(cycle.isPresent(), "a recorded cycle should be reported");
        assertEquals(List.of(first, second, third, first), cycle.get());
        assertTrue(graph.describe().contains("Cycle path:"));
    }

    @Test
    void ignoresSelfEdgesFromScopeEntryPoints() {
        Injectable<Void, Object> scoped = Injectable.define(Object::new, Lifetime.SCOPED);

        Scopes.create().inject(scoped);

        assertFalse(DependencyGraph.of(scoped).findCycle().isPresent());
    }

    @Test
    void describeListsEveryNode() {
        Injectable<Void, Object> leaf = named("leaf");
        Injectable<Void, Object> root = named("root", leaf);

        Injector.inject(root);
        String description = DependencyGraph.of(root).describe();

        assertTrue(description.contains("2 nodes, 1 edges"), description);
        assertTrue(description.contains("root(transient) -> [leaf(transient)]"), description);
    }

    private static Injectable<Void, Object> named(String name, Injectable<?, ?>... dependencies) {
        return Injectable.define(() -> {
            for (Injectable<?, ?> dependency : dependencies) {
                Injector.inject(dependency);
            }

            return new Object();
        }, InjectableOptions.builder().transientLifetime().name(name).build());
    }
}
