package dev.fumaz.ambit.benchmark;

import dev.fumaz.ambit.container.DependencyContainer;
import dev.fumaz.ambit.container.DependencyId;
import dev.fumaz.ambit.exception.NotFoundException;
import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injectable.Lifetime;
import dev.fumaz.ambit.injector.Injector;
import dev.fumaz.ambit.scope.Scope;
import dev.fumaz.ambit.scope.Scopes;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class InjectorBenchmark {

    @State(org.openjdk.jmh.annotations.Scope.Benchmark)
    public static class InjectorState {

        Injectable<Void, HeavyComputation> heavyComputation;
        Injectable<Void, SingletonService> singletonService;
        Injectable<Void, ExpensiveDependency> expensiveDependency;
        Injectable<Void, TransientService> transientService;
        Injectable<Void, CompositeService> compositeService;
        DependencyContainer container;
        DependencyId<HeavyComputation> unbound;
        Scope scope;

        @Setup(Level.Trial)
        public void setUp() {
            heavyComputation = Injectable.define(HeavyComputation::new, Lifetime.TRANSIENT);
            singletonService = Injectable.define(() -> new SingletonService(Injector.inject(heavyComputation)));
            expensiveDependency = Injectable.define(() -> new ExpensiveDependency(Injector.inject(heavyComputation)),
                    Lifetime.SCOPED);
            transientService = Injectable.define(() -> new TransientService(Injector.inject(expensiveDependency)),
                    Lifetime.TRANSIENT);
            compositeService = Injectable.define(() -> new CompositeService(
                    Injector.inject(singletonService),
                    Injector.inject(transientService),
                    Injector.inject(expensiveDependency)), Lifetime.TRANSIENT);
            container = new DependencyContainer();
            unbound = container.createId("unbound", HeavyComputation.class);
            scope = Scopes.create("benchmark");
        }
    }

    @Benchmark
    public Object injectSingleton(InjectorState state) {
        return Injector.inject(state.singletonService);
    }

    @Benchmark
    public Object injectCompositeGraph(InjectorState state) {
        return Injector.inject(state.compositeService);
    }

    @Benchmark
    public Object injectCompositeGraphInScope(InjectorState state) {
        return state.scope.inject(state.compositeService);
    }

    @Benchmark
    public void unresolvedBindingLookup(InjectorState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.use(state.unbound));
        } catch (NotFoundException exception) {
            blackhole.consume(exception);
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final ExpensiveDependency dependency;

        public TransientService(ExpensiveDependency dependency) {
            this.dependency = dependency;
        }

        public int compute() {
            return dependency.value();
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final TransientService transientService;
        private final ExpensiveDependency expensiveDependency;

        public CompositeService(SingletonService singletonService,
                                TransientService transientService,
                                ExpensiveDependency expensiveDependency) {
            this.singletonService = singletonService;
            this.transientService = transientService;
            this.expensiveDependency = expensiveDependency;
        }

        public int aggregate() {
            return singletonService.compute() + transientService.compute() + expensiveDependency.value();
        }
    }

    public static class ExpensiveDependency {
        private final HeavyComputation heavyComputation;

        public ExpensiveDependency(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int value() {
            return heavyComputation.compute();
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }
}
