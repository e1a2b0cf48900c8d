package com.launchpad.core.engine;

import com.launchpad.core.llm.AgentPrompt;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchException;
import com.launchpad.core.model.LaunchSequencingException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import com.launchpad.core.model.Phase;
import com.launchpad.core.persistence.InMemoryLaunchRepository;
import com.launchpad.core.registry.HandlerRegistry;
import com.launchpad.core.registry.HandlerSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Several threads racing to start or run the same launch. Handler A holds the winning run
 * until every other caller has been turned away, so the races overlap for real.
 */
class LaunchEngineConcurrencyTest {

    private static final int RACERS = 4;

    private CountDownLatch rejected;
    private EngineFixture fixture;

    @BeforeEach
    void setUp() throws Exception {
        rejected = new CountDownLatch(RACERS - 1);
        HandlerSpec holdingA = new HandlerSpec("A", Phase.RESEARCH, "A role", (launch, context) -> {
            awaitRejections();
            return new AgentPrompt("A", context.render());
        });
        HandlerRegistry registry = HandlerRegistry.of(holdingA, plain("B"), plain("C"));
        fixture = new EngineFixture(new InMemoryLaunchRepository(Clock.systemUTC()), registry);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static HandlerSpec plain(String name) {
        return new HandlerSpec(name, Phase.RESEARCH, name + " role",
                (launch, context) -> new AgentPrompt(name, context.render()));
    }

    private void awaitRejections() {
        try {
            rejected.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<Object> race(Function<String, Launch> call, String launchId) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(RACERS);
        var go = new CountDownLatch(1);
        try {
            Callable<Object> racer = () -> {
                go.await();
                try {
                    return call.apply(launchId);
                } catch (LaunchException e) {
                    rejected.countDown();
                    return e;
                }
            };
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < RACERS; i++) {
                futures.add(pool.submit(racer));
            }
            go.countDown();

            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> future : futures) {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private void assertEachHandlerInvokedOnce() {
        for (String handler : List.of("A", "B", "C")) {
            assertEquals(1, fixture.invoker.callsFor(handler).size(), handler);
        }
    }

    @Test
    @DisplayName("concurrent startAndRun on a pending launch: one run, every other caller rejected")
    void concurrentStartAndRun() throws Exception {
        Launch launch = fixture.engine.create(new NewLaunch("Widget", "desc", "SaaS", "SMB"));

        List<Object> outcomes = race(fixture.engine::startAndRun, launch.id());

        List<Launch> runs = outcomes.stream().filter(Launch.class::isInstance).map(Launch.class::cast).toList();
        assertEquals(1, runs.size());
        assertEquals(LaunchStatus.COMPLETED, runs.get(0).status());
        assertEquals(RACERS - 1, outcomes.stream()
                .filter(o -> o instanceof LaunchSequencingException || o instanceof LaunchConflictException)
                .count());

        assertEachHandlerInvokedOnce();
        assertEquals(1, fixture.eventTypes().stream().filter("launch.started"::equals).count());
        assertEquals(3, fixture.stateMachine.load(launch.id()).agentResults().size());
    }

    @Test
    @DisplayName("concurrent resume of an in-progress launch: the lock admits one run")
    void concurrentResume() throws Exception {
        Launch launch = fixture.engine.create(new NewLaunch("Widget", "desc", "SaaS", "SMB"));
        fixture.stateMachine.start(launch.id());

        List<Object> outcomes = race(fixture.engine::resume, launch.id());

        assertEquals(1, outcomes.stream().filter(Launch.class::isInstance).count());
        assertEquals(RACERS - 1, outcomes.stream().filter(LaunchConflictException.class::isInstance).count());
        assertEachHandlerInvokedOnce();
        assertEquals(LaunchStatus.COMPLETED, fixture.stateMachine.load(launch.id()).status());
    }
}
