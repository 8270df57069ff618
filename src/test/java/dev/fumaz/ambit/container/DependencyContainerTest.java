package dev.fumaz.ambit.container;

import dev.fumaz.ambit.annotation.Scoped;
import dev.fumaz.ambit.annotation.Singleton;
import dev.fumaz.ambit.annotation.Transient;
import dev.fumaz.ambit.exception.ConfigurationException;
import dev.fumaz.ambit.exception.NotFoundException;
import dev.fumaz.ambit.injectable.Injectable;
import dev.fumaz.ambit.injectable.Lifetime;
import dev.fumaz.ambit.scope.Scope;
import dev.fumaz.ambit.scope.Scopes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DependencyContainerTest {

    private DependencyContainer container;

    @BeforeEach
    void setUp() {
        Scopes.root().reset();
        container = new DependencyContainer();
        Game.played.set(0);
    }

    @Test
    void classBindingsAreSingletonsByDefault() {
        DependencyId<GameApi> game = container.createId("game", GameApi.class);
        DependencyId<App> app = container.createId("app", App.class);

        container.bindClass(game, Game.class);
        container.bindClass(app, App.class, game);

        App first = container.use(app);
        App second = container.use(app);

        assertSame(first, second, "singleton bindings should be reused");
        assertSame(container.use(game), first.game, "dependencies should be resolved by id");

        first.start();
        assertEquals(1, Game.played.get());
    }

    @Test
    void transientAnnotationBuildsEveryTime() {
        DependencyId<GameApi> game = container.createId("game", GameApi.class);
        DependencyId<Match> match = container.createId("match", Match.class);

        container.bindClass(game, Game.class);
        container.bindClass(match, Match.class, List.of(game));

        Match first = container.use(match);
        Match second = container.use(match);

        assertNotSame(first, second, "@Transient bindings should be constructed on every lookup");
        assertSame(first.game, second.game, "their singleton dependency should be shared");
    }

    @Test
    void scopedAnnotationFollowsTheGivenScope() {
        DependencyId<Session> session = container.createId("session", Session.class);
        container.bindClass(session, Session.class);
        Scope first = Scopes.create("first");
        Scope second = Scopes.create("second");

        Session a = container.use(session, first);
        Session b = container.use(session, second);

        assertNotSame(a, b);
        assertSame(a, container.use(session, first));
        assertEquals(1, first.size());
        assertEquals(1, second.size());
    }

    @Test
    void explicitLifetimeOverridesAnnotations() {
        DependencyId<Session> session = container.createId("session", Session.class);
        container.bindClass(session, Session.class, List.of(), Lifetime.TRANSIENT);

        assertNotSame(container.use(session), container.use(session));
    }

    @Test
    void supplierBindings() {
        AtomicInteger counter = new AtomicInteger();
        DependencyId<Integer> number = container.createId("number", Integer.class);

        container.bind(number, counter::incrementAndGet, Lifetime.TRANSIENT);

        int first = container.use(number);
        int second = container.use(number);

        assertEquals(1, first);
        assertEquals(2, second);
        assertTrue(container.contains(number));
    }

    @Test
    void rebindingReplacesTheBinding() {
        DependencyId<String> name = container.createId("name", String.class);

        container.bind(name, () -> "first");
        container.bind(name, () -> "second");

        assertEquals("second", container.use(name));
    }

    @Test
    void unboundIdFailsWithItsName() {
        DependencyId<GameApi> game = container.createId("game", GameApi.class);

        NotFoundException exception = assertThrows(NotFoundException.class, () -> container.use(game));

        assertEquals("\"game\" dependency not found", exception.getMessage());
        assertFalse(container.contains(game));
    }

    @Test
    void duplicateNamesStillCreateDistinctIds() {
        DependencyId<String> first = container.createId("same", String.class);
        DependencyId<String> second = container.createId("same", String.class);

        container.bind(first, () -> "first");

        assertNotSame(first, second);
        assertThrows(NotFoundException.class, () -> container.use(second));
    }

    @Test
    void bindingWithoutMatchingConstructorFails() {
        DependencyId<App> app = container.createId("app", App.class);

        assertThrows(ConfigurationException.class, () -> container.bindClass(app, App.class));
    }

    @Test
    void conflictingLifetimeAnnotationsFail() {
        DependencyId<Confused> confused = container.createId("confused", Confused.class);

        assertThrows(ConfigurationException.class, () -> container.bindClass(confused, Confused.class));
    }

    @Test
    void constructorFailurePropagatesUnwrapped() {
        DependencyId<Broken> broken = container.createId("broken", Broken.class);
        container.bindClass(broken, Broken.class);

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> container.use(broken));

        assertEquals("cannot start", exception.getMessage());
    }

    @Test
    void lookupsRecordDependencyEdges() {
        DependencyId<GameApi> game = container.createId("game", GameApi.class);
        DependencyId<App> app = container.createId("app", App.class);
        container.bindClass(game, Game.class);
        container.bindClass(app, App.class, game);

        container.use(app);

        Injectable<Void, App> appInjectable = container.getInjectable(app);
        assertTrue(appInjectable.getDependencies().contains(container.getInjectable(game)));
        assertEquals("app", appInjectable.getName());
    }

    @Test
    void sharedContainerIsAProcessWideInstance() {
        assertSame(DependencyContainer.shared(), DependencyContainer.shared());
    }

    interface GameApi {
        void play();
    }

    static class Game implements GameApi {
        static final AtomicInteger played = new AtomicInteger();

        @Override
        public void play() {
            played.incrementAndGet();
        }
    }

    static class App {
        final GameApi game;

        App(GameApi game) {
            this.game = game;
        }

        void start() {
            game.play();
        }
    }

    @Transient
    static class Match {
        final GameApi game;

        Match(GameApi game) {
            this.game = game;
        }
    }

    @Scoped
    static class Session {
    }

    @Singleton
    @Transient
    static class Confused {
    }

    static class Broken {
        Broken() {
            throw new IllegalStateException("cannot start");
        }
    }
}
