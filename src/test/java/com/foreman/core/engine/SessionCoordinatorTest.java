package com.foreman.core.engine;

import com.foreman.core.MutableClock;
import com.foreman.core.error.InvalidTransitionException;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.events.EventBus;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.Agent;
import com.foreman.core.model.Assignment;
import com.foreman.core.model.CompletionSignal;
import com.foreman.core.model.Outcome;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Role;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskSpec;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.InMemoryProjectStore;
import com.foreman.core.persistence.SessionIdGenerator;
import com.foreman.core.qualitygate.QualityGate;
import com.foreman.core.qualitygate.QualityPredicate;
import com.foreman.core.qualitygate.QualityPredicates;
import com.foreman.core.report.Reporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SessionCoordinatorTest {

    /** Builder work is accepted only once the agent reports it validated its output. */
    private static final QualityPredicate BUILDER_NEEDS_VALIDATION = (task, claimed) ->
            claimed != null && claimed.contains("validated")
                    ? QualityPredicate.Result.accept()
                    : QualityPredicate.Result.reject("missing validation");

    private InMemoryProjectStore store;
    private MutableClock clock;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<Assignment> submitted;
    private List<ForemanEvent> events;

    @BeforeEach
    void setUp() {
        store = new InMemoryProjectStore();
        clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        submitted = new CopyOnWriteArrayList<>();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(events::add);
    }

    private SessionEngine engine(QualityPredicates predicates, int retryCeiling) {
        return engine(predicates, retryCeiling, (assignment, channel) -> submitted.add(assignment));
    }

    private SessionEngine engine(QualityPredicates predicates, int retryCeiling, AgentExecutor executor) {
        var context = new CoordinatorContext(store, new QualityGate(predicates, retryCeiling),
                new Reporter(store, clock, Duration.ofMinutes(30)), executor, eventBus,
                new ForemanMetrics(meterRegistry), clock, 4);
        return new SessionEngine(context, new SessionIdGenerator(clock));
    }

    private static CompletionSignal plan(List<TaskSpec> tasks) {
        return new CompletionSignal("PLAN-001", Outcome.SUCCESS, "Plan with " + tasks.size() + " tasks", tasks);
    }

    private static List<String> ids(List<Assignment> assignments) {
        return assignments.stream().map(Assignment::taskId).toList();
    }

    private List<ForemanEvent> eventsOfType(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).toList();
    }

    @Test
    @DisplayName("end to end: plan, reject once, accept, parallel dependents, advance to quality check")
    void endToEndScenario() {
        var predicates = QualityPredicates.acceptAll().with(Role.BUILDER, BUILDER_NEEDS_VALIDATION);
        SessionCoordinator coordinator = engine(predicates, 3).start("X");

        List<Assignment> planning = coordinator.dispatch();
        assertEquals(List.of("PLAN-001"), ids(planning));
        assertEquals(Role.PLANNER, planning.get(0).role());

        coordinator.signal(plan(List.of(
                new TaskSpec("T1", Role.BUILDER, "Build core", List.of()),
                new TaskSpec("T2", Role.BUILDER, "Build API", List.of("T1")),
                new TaskSpec("T3", Role.BUILDER, "Build CLI", List.of("T1")),
                new TaskSpec("Q1", Role.QUALITY_CHECKER, "Review", List.of("T2", "T3")))));
        List<Assignment> afterPlan = coordinator.processPending();

        assertEquals(Phase.IMPLEMENTATION, coordinator.phase());
        assertEquals(List.of("T1"), ids(afterPlan));
        assertEquals("builder_001", afterPlan.get(0).agentId());
        assertEquals(List.of("builder_001"), coordinator.activeAgents().stream().map(Agent::id).toList());

        coordinator.signal(CompletionSignal.success("T1", "core implemented"));
        List<Assignment> retry = coordinator.processPending();

        Task t1 = coordinator.task("T1");
        assertEquals(1, t1.retryCount());
        assertTrue(t1.history().contains("rejected: missing validation"));
        assertEquals(List.of("T1"), ids(retry));
        assertTrue(retry.get(0).description().contains("missing validation"));

        coordinator.signal(CompletionSignal.success("T1", "core implemented and validated"));
        List<Assignment> parallel = coordinator.processPending();

        assertEquals(TaskStatus.COMPLETED, coordinator.task("T1").status());
        assertEquals(List.of("T2", "T3"), ids(parallel));
        assertEquals(TaskStatus.IN_PROGRESS, coordinator.task("T2").status());
        assertEquals(TaskStatus.IN_PROGRESS, coordinator.task("T3").status());

        coordinator.signal(CompletionSignal.success("T2", "API validated"));
        coordinator.signal(CompletionSignal.success("T3", "CLI validated"));
        List<Assignment> review = coordinator.processPending();

        assertEquals(Phase.QUALITY_CHECK, coordinator.phase());
        assertEquals(List.of("Q1"), ids(review));
        assertTrue(eventsOfType("phase.advanced").stream().anyMatch(e ->
                e.payload().equals(Map.of("from", "implementation", "to", "quality_check"))));
        assertEquals(List.of("quality_checker_001"), coordinator.activeAgents().stream().map(Agent::id).toList());
    }

    @Test
    @DisplayName("validating roles receive dependency artifacts; other roles only descriptions")
    void dependencyContext() {
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
        coordinator.dispatch();
        coordinator.signal(plan(List.of(
                new TaskSpec("B1", Role.BUILDER, "Build", List.of()),
                new TaskSpec("B2", Role.BUILDER, "Extend", List.of("B1")),
                new TaskSpec("Q1", Role.QUALITY_CHECKER, "Review", List.of("B2")))));
        coordinator.processPending();
        coordinator.signal(CompletionSignal.success("B1", "built module A"));
        Assignment b2 = coordinator.processPending().get(0);

        assertEquals("B2", b2.taskId());
        assertEquals(new Assignment.DependencyContext("B1", "Build", null), b2.dependencyContext().get(0));

        coordinator.signal(CompletionSignal.success("B2", "extended module A"));
        Assignment q1 = coordinator.processPending().get(0);

        assertEquals("Q1", q1.taskId());
        assertEquals("extended module A", q1.dependencyContext().get(0).artifactSummary());
    }

    @Nested
    @DisplayName("planning")
    class Planning {

        @Test
        @DisplayName("planner runs before any other role is spawned")
        void planBeforeBuild() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.appendTask(new TaskSpec("EARLY", Role.BUILDER, "eager build", List.of()));

            List<Assignment> issued = coordinator.dispatch();

            assertEquals(List.of("PLAN-001"), ids(issued));
            assertEquals(Phase.PLANNING, coordinator.phase());
            assertTrue(coordinator.agents().stream().allMatch(a -> a.role() == Role.PLANNER));
            assertEquals(TaskStatus.PENDING, coordinator.task("EARLY").status());
        }

        @Test
        @DisplayName("planning phase does not advance while the graph is empty")
        void emptyPlanningSeedsTask() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");

            coordinator.dispatch();

            assertEquals(Phase.PLANNING, coordinator.phase());
            assertEquals(TaskStatus.IN_PROGRESS, coordinator.task("PLAN-001").status());
            assertTrue(coordinator.task("PLAN-001").description().contains("X"));
        }

        @Test
        @DisplayName("a plan with no tasks is rejected")
        void emptyPlanRejected() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.dispatch();

            var disposition = coordinator.handle(plan(List.of()));

            assertEquals(SessionCoordinator.Disposition.REJECTED, disposition);
            assertEquals(Phase.PLANNING, coordinator.phase());
        }

        @Test
        @DisplayName("a cyclic plan is rejected and nothing is inserted")
        void cyclicPlanRejected() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.dispatch();

            var disposition = coordinator.handle(plan(List.of(
                    new TaskSpec("T1", Role.BUILDER, "a", List.of("T2")),
                    new TaskSpec("T2", Role.BUILDER, "b", List.of("T1")))));

            assertEquals(SessionCoordinator.Disposition.REJECTED, disposition);
            assertEquals(1, coordinator.tasks().size());
            assertTrue(coordinator.task("PLAN-001").history().get(0).contains("Cyclic dependency"));
        }
    }

    @Nested
    @DisplayName("quality gate loop")
    class GateLoop {

        @Test
        @DisplayName("task blocks exactly on the Nth rejection and stays blocked")
        void blockedOnNthRejection() {
            var predicates = QualityPredicates.acceptAll()
                    .with(Role.BUILDER, (task, claimed) -> QualityPredicate.Result.reject("still wrong"));
            SessionCoordinator coordinator = engine(predicates, 2).start("X");
            coordinator.dispatch();
            coordinator.signal(plan(List.of(new TaskSpec("T1", Role.BUILDER, "flaky", List.of()))));
            coordinator.processPending();

            assertEquals(SessionCoordinator.Disposition.REJECTED,
                    coordinator.handle(CompletionSignal.success("T1", "try 1")));
            assertEquals(TaskStatus.PENDING, coordinator.task("T1").status());
            coordinator.dispatch();

            assertEquals(SessionCoordinator.Disposition.BLOCKED,
                    coordinator.handle(CompletionSignal.success("T1", "try 2")));
            assertEquals(TaskStatus.BLOCKED, coordinator.task("T1").status());
            assertEquals(1.0, meterRegistry.find("foreman.escalations.total")
                    .tag("reason", "retry_ceiling").counter().count());
            assertEquals(1, eventsOfType("task.blocked").size());

            coordinator.dispatch();
            assertEquals(TaskStatus.BLOCKED, coordinator.task("T1").status());
            assertEquals(SessionCoordinator.Disposition.IGNORED,
                    coordinator.handle(CompletionSignal.success("T1", "late success")));
            assertEquals(TaskStatus.BLOCKED, coordinator.task("T1").status());
        }

        @Test
        @DisplayName("unblock returns the task to pending with a fresh retry budget")
        void unblockOverride() {
            var predicates = QualityPredicates.acceptAll()
                    .with(Role.BUILDER, (task, claimed) -> QualityPredicate.Result.reject("still wrong"));
            SessionCoordinator coordinator = engine(predicates, 1).start("X");
            coordinator.dispatch();
            coordinator.signal(plan(List.of(new TaskSpec("T1", Role.BUILDER, "flaky", List.of()))));
            coordinator.processPending();
            coordinator.handle(CompletionSignal.success("T1", "nope"));
            coordinator.dispatch();
            assertEquals(TaskStatus.BLOCKED, coordinator.task("T1").status());

            coordinator.unblock("T1");
            List<Assignment> issued = coordinator.dispatch();

            assertEquals(List.of("T1"), ids(issued));
            assertEquals(0, coordinator.task("T1").retryCount());
            assertEquals(Phase.IMPLEMENTATION, coordinator.phase());
        }

        @Test
        @DisplayName("a blocked task holds its phase and surfaces in a report until unblocked")
        void blockedTaskHoldsPhase() {
            var predicates = QualityPredicates.acceptAll()
                    .with(Role.BUILDER, (task, claimed) -> QualityPredicate.Result.reject("still wrong"));
            SessionCoordinator coordinator = engine(predicates, 1).start("X");
            coordinator.dispatch();
            coordinator.signal(plan(List.of(
                    new TaskSpec("T1", Role.BUILDER, "build", List.of()),
                    new TaskSpec("Q1", Role.QUALITY_CHECKER, "review", List.of("T1")))));
            coordinator.processPending();

            assertEquals(SessionCoordinator.Disposition.BLOCKED,
                    coordinator.handle(CompletionSignal.success("T1", "nope")));
            assertTrue(coordinator.dispatch().isEmpty());
            coordinator.dispatch();

            assertEquals(Phase.IMPLEMENTATION, coordinator.phase());
            assertTrue(coordinator.isHeld());
            assertEquals(TaskStatus.BLOCKED, coordinator.task("Q1").status());
            assertEquals(1, eventsOfType("session.held").size());
            assertEquals(1.0, meterRegistry.find("foreman.escalations.total")
                    .tag("reason", "held").counter().count());
            var reports = store.listReports(coordinator.sessionId());
            var blockers = (List<?>) reports.get(reports.size() - 1).payload().get("blockers");
            assertEquals(2, blockers.size());

            List<Task> released = coordinator.unblock("T1");

            assertEquals(List.of("T1", "Q1"), released.stream().map(Task::id).toList());
            assertFalse(coordinator.isHeld());
            assertEquals(List.of("T1"), ids(coordinator.dispatch()));
            assertEquals(Phase.IMPLEMENTATION, coordinator.phase());
        }

        @Test
        @DisplayName("an execution failure counts as a rejection")
        void failureIsRejection() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.dispatch();
            coordinator.signal(plan(List.of(new TaskSpec("T1", Role.BUILDER, "a", List.of()))));
            coordinator.processPending();

            var disposition = coordinator.handle(CompletionSignal.failure("T1", "sandbox crashed"));

            assertEquals(SessionCoordinator.Disposition.REJECTED, disposition);
            assertEquals(List.of("rejected: execution failed: sandbox crashed"), coordinator.task("T1").history());
        }

        @Test
        @DisplayName("completion for an unknown task fails with NotFound")
        void unknownTask() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");

            assertThrows(NotFoundException.class,
                    () -> coordinator.handle(CompletionSignal.success("NOPE", "done")));
        }
    }

    @Nested
    @DisplayName("pause and resume")
    class PauseResume {

        @Test
        @DisplayName("pause keeps in-progress work and stops dispatch")
        void pauseKeepsInProgress() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.dispatch();

            coordinator.pause();
            coordinator.pause();

            assertTrue(store.loadSession(coordinator.sessionId()).paused());
            assertEquals(TaskStatus.IN_PROGRESS, coordinator.task("PLAN-001").status());
            assertTrue(coordinator.dispatch().isEmpty());
            assertEquals(1, store.listReports(coordinator.sessionId()).size());
            assertEquals(1, eventsOfType("session.paused").size());
        }

        @Test
        @DisplayName("resume after restart re-issues in-progress work and tolerates redelivery")
        void resumeAfterRestart() {
            SessionCoordinator original = engine(QualityPredicates.acceptAll(), 3).start("X");
            original.dispatch();
            original.pause();
            submitted.clear();

            SessionCoordinator resumed = engine(QualityPredicates.acceptAll(), 3).resume(original.sessionId());

            assertFalse(resumed.session().paused());
            assertEquals(Phase.PLANNING, resumed.phase());
            assertEquals(List.of("PLAN-001"), ids(submitted));

            CompletionSignal result = plan(List.of(new TaskSpec("T1", Role.BUILDER, "a", List.of())));
            assertEquals(SessionCoordinator.Disposition.ACCEPTED, resumed.handle(result));
            assertEquals(SessionCoordinator.Disposition.IGNORED, resumed.handle(result));
            assertEquals(2, resumed.tasks().size());
        }

        @Test
        @DisplayName("resuming twice re-issues the same assignments without changing state")
        void resumeIdempotent() {
            SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
            coordinator.dispatch();
            List<Task> before = coordinator.tasks();

            List<Assignment> first = coordinator.resume();
            List<Assignment> second = coordinator.resume();

            assertEquals(first, second);
            assertEquals(before, coordinator.tasks());
        }

        @Test
        @DisplayName("a result redelivered from an earlier attempt does not count as another rejection")
        void staleAttemptIgnored() {
            SessionCoordinator original = engine(QualityPredicates.acceptAll(), 2).start("X");
            original.dispatch();
            original.handle(plan(List.of(new TaskSpec("T1", Role.BUILDER, "a", List.of()))));
            original.dispatch();
            original.pause();
            submitted.clear();

            SessionCoordinator resumed = engine(QualityPredicates.acceptAll(), 2).resume(original.sessionId());
            Assignment reissued = submitted.get(0);
            assertEquals("T1", reissued.taskId());
            assertEquals(1, reissued.attempt());
            CompletionSignal crash = CompletionSignal.failure(reissued, "crash");

            assertEquals(SessionCoordinator.Disposition.REJECTED, resumed.handle(crash));
            Assignment retry = resumed.dispatch().get(0);
            assertEquals(2, retry.attempt());
            assertEquals(SessionCoordinator.Disposition.IGNORED, resumed.handle(crash));

            Task t1 = resumed.task("T1");
            assertEquals(TaskStatus.IN_PROGRESS, t1.status());
            assertEquals(1, t1.retryCount());
            assertEquals(SessionCoordinator.Disposition.ACCEPTED,
                    resumed.handle(CompletionSignal.success(retry, "done")));
        }

        @Test
        @DisplayName("reload from the store reproduces the ready set")
        void readySetSurvivesRestart() {
            SessionEngine engine = engine(QualityPredicates.acceptAll(), 3);
            SessionCoordinator coordinator = engine.start("X");
            coordinator.dispatch();
            coordinator.handle(plan(List.of(
                    new TaskSpec("T1", Role.BUILDER, "a", List.of()),
                    new TaskSpec("T2", Role.BUILDER, "b", List.of("T1")),
                    new TaskSpec("T3", Role.BUILDER, "c", List.of("T1")))));
            coordinator.dispatch();
            coordinator.handle(CompletionSignal.success("T1", "done"));
            List<Task> ready = coordinator.readyTasks();

            SessionCoordinator reloaded = engine(QualityPredicates.acceptAll(), 3).reload(coordinator.sessionId());

            assertEquals(ready, reloaded.readyTasks());
            assertEquals(List.of("T2", "T3"), reloaded.readyTasks().stream().map(Task::id).toList());
        }
    }

    @Test
    @DisplayName("work waiting on a later phase stays pending and runs once that phase arrives")
    void laterPhaseDependencyIsDeferred() {
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
        coordinator.dispatch();
        coordinator.signal(plan(List.of(
                new TaskSpec("TT1", Role.TESTER, "write tests", List.of()),
                new TaskSpec("B1", Role.BUILDER, "fix failures", List.of("TT1")))));
        List<Assignment> issued = coordinator.processPending();

        assertEquals(Phase.TESTING, coordinator.phase());
        assertEquals(List.of("TT1"), ids(issued));
        assertEquals(TaskStatus.PENDING, coordinator.task("B1").status());

        coordinator.signal(CompletionSignal.success("TT1", "tests written"));
        List<Assignment> fixes = coordinator.processPending();

        assertEquals(List.of("B1"), ids(fixes));
        assertEquals(Role.BUILDER, fixes.get(0).role());
        assertEquals(Phase.TESTING, coordinator.phase());
        assertFalse(coordinator.isHeld());
    }

    @Test
    @DisplayName("done is terminal: agents retired, no further changes accepted")
    void doneIsTerminal() {
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3).start("X");
        coordinator.dispatch();
        coordinator.signal(plan(List.of(new TaskSpec("D1", Role.DOCUMENTER, "write README", List.of()))));
        coordinator.processPending();
        assertEquals(Phase.DOCUMENTATION, coordinator.phase());

        coordinator.signal(CompletionSignal.success("D1", "README written"));
        coordinator.processPending();

        assertTrue(coordinator.isDone());
        assertTrue(coordinator.activeAgents().isEmpty());
        assertEquals(1, eventsOfType("session.done").size());
        assertTrue(coordinator.dispatch().isEmpty());
        assertThrows(InvalidTransitionException.class,
                () -> coordinator.appendTask(new TaskSpec("late", Role.BUILDER, "late", List.of())));
    }

    @Test
    @DisplayName("runUntilDone drives a session with an asynchronous executor to completion")
    void runUntilDone() {
        AgentExecutor executor = (assignment, channel) -> new Thread(() -> {
            if (assignment.role() == Role.PLANNER) {
                channel.complete(plan(List.of(
                        new TaskSpec("B1", Role.BUILDER, "build", List.of()),
                        new TaskSpec("D1", Role.DOCUMENTER, "document", List.of("B1")))));
            } else {
                channel.complete(CompletionSignal.success(assignment.taskId(), "done"));
            }
        }).start();
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3, executor).start("X");

        var session = coordinator.runUntilDone(Duration.ofMillis(20));

        assertEquals(Phase.DONE, session.phase());
        assertTrue(coordinator.tasks().stream().allMatch(t -> t.status() == TaskStatus.COMPLETED));
        assertEquals(5, eventsOfType("phase.advanced").size());
    }

    @Test
    @DisplayName("executor refusal is fed back as a failed execution")
    void executorRefusal() {
        AgentExecutor refusing = (assignment, channel) -> {
            throw new IllegalStateException("no capacity");
        };
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 3, refusing).start("X");

        coordinator.dispatch();
        assertEquals(1, coordinator.pendingSignals());
        coordinator.processPending();

        assertEquals(1, coordinator.task("PLAN-001").retryCount());
    }

    @Test
    @DisplayName("runUntilDone stops in the planning phase when the planning task is blocked")
    void runUntilDoneStopsOnBlockedPlan() {
        AgentExecutor refusing = (assignment, channel) -> {
            throw new IllegalStateException("no capacity");
        };
        SessionCoordinator coordinator = engine(QualityPredicates.acceptAll(), 2, refusing).start("X");

        var session = coordinator.runUntilDone(Duration.ofMillis(5));

        assertEquals(Phase.PLANNING, session.phase());
        assertTrue(coordinator.isHeld());
        assertEquals(List.of("PLAN-001"), coordinator.tasks().stream().map(Task::id).toList());
        assertEquals(TaskStatus.BLOCKED, coordinator.task("PLAN-001").status());
        assertTrue(eventsOfType("session.done").isEmpty());
    }
}
