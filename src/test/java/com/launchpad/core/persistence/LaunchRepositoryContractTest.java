package com.launchpad.core.persistence;

import com.launchpad.core.model.AgentResult;
import com.launchpad.core.model.AgentResultStatus;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link LaunchRepository} must share. Subclasses supply the store.
 */
abstract class LaunchRepositoryContractTest {

    protected final TickingClock clock = new TickingClock(Instant.parse("2025-03-01T10:00:00Z"));
    protected LaunchRepository repository;

    protected abstract LaunchRepository createRepository(Clock clock) throws Exception;

    @BeforeEach
    void setUpRepository() throws Exception {
        repository = createRepository(clock);
    }

    private Launch inProgress(String name) {
        Launch launch = repository.create(new NewLaunch(name, "desc", "SaaS", "SMB"));
        assertTrue(repository.compareAndSetStatus(launch.id(), LaunchStatus.PENDING, LaunchStatus.IN_PROGRESS, null));
        return launch;
    }

    private AgentResult completed(String agent) {
        return AgentResult.completed(agent, "out_" + agent, clock.instant(), 1, 10);
    }

    @Nested
    @DisplayName("create and read")
    class CreateAndRead {

        @Test
        @DisplayName("a created launch is pending and readable by id")
        void createAndFind() {
            Launch created = repository.create(new NewLaunch("Widget", "A widget", "SaaS", "SMB"));

            Launch found = repository.findById(created.id()).orElseThrow();
            assertEquals("Widget", found.name());
            assertEquals("A widget", found.description());
            assertEquals("SaaS", found.productType());
            assertEquals("SMB", found.targetMarket());
            assertEquals(LaunchStatus.PENDING, found.status());
            assertNull(found.summary());
            assertTrue(found.agentResults().isEmpty());
            assertEquals(created.createdAt(), found.createdAt());
        }

        @Test
        @DisplayName("unknown id is empty")
        void unknown() {
            assertTrue(repository.findById("missing").isEmpty());
        }

        @Test
        @DisplayName("findAll lists newest first and findByStatus filters")
        void listing() {
            Launch first = repository.create(new NewLaunch("First", null, null, null));
            Launch second = inProgress("Second");

            assertEquals(List.of(second.id(), first.id()),
                    repository.findAll().stream().map(Launch::id).toList());
            assertEquals(List.of(second.id()),
                    repository.findByStatus(LaunchStatus.IN_PROGRESS).stream().map(Launch::id).toList());
            assertTrue(repository.findByStatus(LaunchStatus.FAILED).isEmpty());
        }
    }

    @Nested
    @DisplayName("appendAgentResult")
    class Append {

        @Test
        @DisplayName("results come back in append order with every field intact")
        void appendsInOrder() {
            Launch launch = inProgress("Widget");
            AgentResult failed = AgentResult.failed("b", "timeout", clock.instant(), 3, 120);
            repository.appendAgentResult(launch.id(), 0, completed("a"));
            repository.appendAgentResult(launch.id(), 1, failed);

            List<AgentResult> results = repository.findById(launch.id()).orElseThrow().agentResults();

            assertEquals(2, results.size());
            assertEquals(completed("a").output(), results.get(0).output());
            assertEquals(AgentResultStatus.COMPLETED, results.get(0).status());
            assertEquals(failed, results.get(1));
        }

        @Test
        @DisplayName("a taken position is a conflict and leaves the list unchanged")
        void positionTaken() {
            Launch launch = inProgress("Widget");
            repository.appendAgentResult(launch.id(), 0, completed("a"));

            assertThrows(LaunchConflictException.class,
                    () -> repository.appendAgentResult(launch.id(), 0, completed("b")));
            assertThrows(LaunchConflictException.class,
                    () -> repository.appendAgentResult(launch.id(), 2, completed("b")));
            assertEquals(1, repository.findById(launch.id()).orElseThrow().agentResults().size());
        }

        @Test
        @DisplayName("two writers racing for the same position: exactly one wins")
        void racingWriters() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 10; round++) {
                    Launch launch = inProgress("Widget " + round);
                    var go = new CountDownLatch(1);
                    List<Future<Boolean>> writers = new ArrayList<>();
                    for (String agent : List.of("a", "b")) {
                        AgentResult result = completed(agent);
                        writers.add(pool.submit(() -> {
                            go.await();
                            try {
                                repository.appendAgentResult(launch.id(), 0, result);
                                return true;
                            } catch (LaunchConflictException e) {
                                return false;
                            }
                        }));
                    }
                    go.countDown();

                    int wins = 0;
                    for (Future<Boolean> writer : writers) {
                        if (writer.get(10, TimeUnit.SECONDS)) {
                            wins++;
                        }
                    }
                    assertEquals(1, wins, "round " + round);
                    assertEquals(1, repository.findById(launch.id()).orElseThrow().agentResults().size());
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("a second result for the same handler is a conflict")
        void duplicateHandler() {
            Launch launch = inProgress("Widget");
            repository.appendAgentResult(launch.id(), 0, completed("a"));

            assertThrows(LaunchConflictException.class,
                    () -> repository.appendAgentResult(launch.id(), 1, completed("a")));
        }

        @Test
        @DisplayName("only in-progress launches accept results")
        void requiresInProgress() {
            Launch launch = repository.create(new NewLaunch("Widget", null, null, null));

            assertThrows(LaunchConflictException.class,
                    () -> repository.appendAgentResult(launch.id(), 0, completed("a")));
        }

        @Test
        @DisplayName("unknown launch is not found")
        void unknownLaunch() {
            assertThrows(LaunchNotFoundException.class,
                    () -> repository.appendAgentResult("missing", 0, completed("a")));
        }

        @Test
        @DisplayName("appending refreshes updatedAt")
        void touchesUpdatedAt() {
            Launch launch = inProgress("Widget");
            Instant before = repository.findById(launch.id()).orElseThrow().updatedAt();

            repository.appendAgentResult(launch.id(), 0, completed("a"));

            assertTrue(repository.findById(launch.id()).orElseThrow().updatedAt().isAfter(before));
        }
    }

    @Nested
    @DisplayName("compareAndSetStatus")
    class CompareAndSet {

        @Test
        @DisplayName("applies only from the expected status")
        void conditional() {
            Launch launch = repository.create(new NewLaunch("Widget", null, null, null));

            assertFalse(repository.compareAndSetStatus(launch.id(), LaunchStatus.IN_PROGRESS, LaunchStatus.COMPLETED, "s"));
            assertTrue(repository.compareAndSetStatus(launch.id(), LaunchStatus.PENDING, LaunchStatus.IN_PROGRESS, null));
            assertFalse(repository.compareAndSetStatus(launch.id(), LaunchStatus.PENDING, LaunchStatus.IN_PROGRESS, null));
            assertEquals(LaunchStatus.IN_PROGRESS, repository.findById(launch.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("writes the summary together with the status")
        void writesSummary() {
            Launch launch = inProgress("Widget");

            assertTrue(repository.compareAndSetStatus(launch.id(), LaunchStatus.IN_PROGRESS, LaunchStatus.COMPLETED, "done"));

            Launch found = repository.findById(launch.id()).orElseThrow();
            assertEquals(LaunchStatus.COMPLETED, found.status());
            assertEquals("done", found.summary());
        }

        @Test
        @DisplayName("unknown launch is simply not swapped")
        void unknown() {
            assertFalse(repository.compareAndSetStatus("missing", LaunchStatus.PENDING, LaunchStatus.IN_PROGRESS, null));
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes the launch and its results")
        void deletes() {
            Launch launch = inProgress("Widget");
            repository.appendAgentResult(launch.id(), 0, completed("a"));

            assertTrue(repository.delete(launch.id()));

            assertTrue(repository.findById(launch.id()).isEmpty());
            assertFalse(repository.delete(launch.id()));
        }
    }

    /**
     * Clock that advances one second on every read, so creation order is strict.
     */
    static final class TickingClock extends Clock {

        private Instant current;

        TickingClock(Instant start) {
            this.current = start;
        }

        @Override
        public synchronized Instant instant() {
            current = current.plus(Duration.ofSeconds(1));
            return current;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
