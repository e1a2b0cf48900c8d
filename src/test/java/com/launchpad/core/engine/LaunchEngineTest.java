package com.launchpad.core.engine;

import com.launchpad.core.llm.InvocationFailure;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchProgress;
import com.launchpad.core.model.LaunchSequencingException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LaunchEngineTest {

    private EngineFixture fixture;
    private LaunchEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new EngineFixture("A", "B", "C");
        engine = fixture.engine;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private Launch create(String name) {
        return engine.create(new NewLaunch(name, "desc", "SaaS", "SMB"));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("creates a pending launch with no results and publishes launch.created")
        void createsPending() {
            Launch launch = create("Widget");

            assertEquals(LaunchStatus.PENDING, launch.status());
            assertTrue(launch.agentResults().isEmpty());
            assertNull(launch.summary());
            assertEquals(List.of("launch.created"), fixture.eventTypes());
        }

        @Test
        @DisplayName("a blank name is rejected")
        void blankName() {
            assertThrows(IllegalArgumentException.class, () -> engine.create(new NewLaunch(" ", null, null, null)));
        }

        @Test
        @DisplayName("ids are unique")
        void uniqueIds() {
            assertNotEquals(create("One").id(), create("Two").id());
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("inline start runs the launch to completion")
        void inlineStart() {
            Launch launch = create("Widget");

            Launch result = engine.start(launch.id());

            assertEquals(LaunchStatus.COMPLETED, result.status());
            assertEquals(3, result.agentResults().size());
        }

        @Test
        @DisplayName("async start returns in progress and completes in the background")
        void asyncStart() throws Exception {
            fixture.properties.setAsyncStart(true);
            Launch launch = create("Widget");

            Launch started = engine.start(launch.id());
            assertEquals(LaunchStatus.IN_PROGRESS, started.status());

            fixture.runExecutor.shutdown();
            assertTrue(fixture.runExecutor.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals(LaunchStatus.COMPLETED, engine.find(launch.id()).status());
        }

        @Test
        @DisplayName("starting twice is rejected")
        void doubleStart() {
            Launch launch = create("Widget");
            engine.startAndRun(launch.id());

            assertThrows(LaunchSequencingException.class, () -> engine.start(launch.id()));
        }
    }

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        @DisplayName("a pending launch cannot be resumed")
        void pendingCannotResume() {
            Launch launch = create("Widget");

            assertThrows(LaunchSequencingException.class, () -> engine.resume(launch.id()));
        }

        @Test
        @DisplayName("continues after the last recorded result")
        void continuesRun() {
            Launch launch = create("Widget");
            fixture.stateMachine.start(launch.id());
            fixture.stateMachine.recordSuccess(launch.id(), fixture.registry.handlerAt(0), "out_A", 1, 1);

            Launch result = engine.resume(launch.id());

            assertEquals(LaunchStatus.COMPLETED, result.status());
            assertTrue(fixture.invoker.callsFor("A").isEmpty());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("status reports completed out of total handlers")
        void progress() {
            fixture.invoker.failAlways("C", InvocationFailure.PROVIDER_ERROR, "quota exceeded");
            Launch launch = create("Widget");
            engine.startAndRun(launch.id());

            LaunchProgress progress = engine.status(launch.id());

            assertEquals(LaunchStatus.FAILED, progress.status());
            assertEquals(2, progress.completedCount());
            assertEquals(3, progress.totalCount());
        }

        @Test
        @DisplayName("list filters by status")
        void listByStatus() {
            Launch done = create("Done");
            engine.startAndRun(done.id());
            create("Waiting");

            assertEquals(2, engine.list().size());
            assertEquals(List.of("Waiting"),
                    engine.list(LaunchStatus.PENDING).stream().map(Launch::name).toList());
            assertEquals(List.of("Done"),
                    engine.list(LaunchStatus.COMPLETED).stream().map(Launch::name).toList());
            assertEquals(2, engine.list(null).size());
        }

        @Test
        @DisplayName("unknown ids are not found")
        void unknown() {
            assertThrows(LaunchNotFoundException.class, () -> engine.status("missing"));
            assertThrows(LaunchNotFoundException.class, () -> engine.results("missing"));
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes the launch with its results")
        void deletes() {
            Launch launch = create("Widget");
            engine.startAndRun(launch.id());

            engine.delete(launch.id());

            assertTrue(fixture.repository.findById(launch.id()).isEmpty());
            assertTrue(fixture.eventTypes().contains("launch.deleted"));
        }

        @Test
        @DisplayName("deleting an unknown launch is not found")
        void deleteUnknown() {
            assertThrows(LaunchNotFoundException.class, () -> engine.delete("missing"));
        }
    }
}
