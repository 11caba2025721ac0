package com.foreman.core.engine;

import com.foreman.core.error.CyclicDependencyException;
import com.foreman.core.error.InvalidTransitionException;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.graph.TaskGraph;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.model.Agent;
import com.foreman.core.model.Assignment;
import com.foreman.core.model.CompletionSignal;
import com.foreman.core.model.Outcome;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskSpec;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.qualitygate.QualityVerdict;
import com.foreman.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State machine for one session: owns the phase, dispatches ready tasks to agents,
 * routes completions through the quality gate and emits reports.
 * <p>
 * All state changes run under a single per-session lock. Completions arrive as messages:
 * {@link #signal} only enqueues, and the queue is drained on the serialized path by
 * {@link #processPending} or {@link #runUntilDone}. Assignments are handed to the
 * {@link AgentExecutor} after the lock is released, so a slow executor never stalls
 * other roles.
 * <p>
 * The task graph and agent registry are loaded from the store when the coordinator is
 * created; a restarted process builds a new coordinator rather than trusting old state.
 */
public class SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    static final String PLANNING_TASK_ID = "PLAN-001";

    /** How a completion signal was disposed of. */
    public enum Disposition {
        ACCEPTED,
        REJECTED,
        BLOCKED,
        /** The task was not in progress: a duplicate or late delivery. */
        IGNORED
    }

    private final CoordinatorContext context;
    private final TaskGraph graph;
    private final AgentRegistry registry;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedBlockingQueue<CompletionSignal> inbox = new LinkedBlockingQueue<>();
    private volatile Session session;
    private volatile boolean held;

    private SessionCoordinator(Session session, CoordinatorContext context) {
        this.session = session;
        this.context = context;
        this.graph = TaskGraph.load(session.id(), context.store(), context.clock());
        this.registry = AgentRegistry.load(session.id(), context.store(), context.clock());
    }

    /**
     * Build a coordinator from the store's current state for the session.
     *
     * @throws NotFoundException if the session does not exist
     */
    public static SessionCoordinator load(String sessionId, CoordinatorContext context) {
        Session session = context.store().loadSession(sessionId);
        return new SessionCoordinator(session, context);
    }

    // --- Queries ---

    public String sessionId() {
        return session.id();
    }

    public Session session() {
        return session;
    }

    public Phase phase() {
        return session.phase();
    }

    public boolean isDone() {
        return session.phase().isTerminal();
    }

    /**
     * Whether the last dispatch found nothing to run but blocked tasks in the current or an
     * earlier phase. The session stays in its phase until an operator unblocks them.
     */
    public boolean isHeld() {
        return held;
    }

    public List<Task> tasks() {
        return locked(graph::all);
    }

    public Task task(String taskId) {
        return locked(() -> graph.get(taskId));
    }

    public List<Task> readyTasks() {
        return locked(() -> graph.readyTasks());
    }

    public List<Agent> agents() {
        return registry.all();
    }

    public List<Agent> activeAgents() {
        return registry.active();
    }

    /** Completion signals received but not yet processed. */
    public int pendingSignals() {
        return inbox.size();
    }

    // --- Dispatch ---

    /**
     * One dispatch pass: seeds the planning task when needed, advances through finished
     * phases and assigns ready tasks to the active agents of the relevant roles. A phase
     * whose remaining work is blocked is held rather than advanced. Does nothing while
     * paused or done.
     *
     * @return the assignments issued to the executor
     */
    public List<Assignment> dispatch() {
        List<Assignment> issued = locked(this::dispatchLocked);
        submitAll(issued);
        return issued;
    }

    private List<Assignment> dispatchLocked() {
        if (session.paused()) {
            log.debug("Session {} is paused; nothing dispatched", session.id());
            return List.of();
        }
        var issued = new ArrayList<Assignment>();
        while (!isDone()) {
            seedPlanningTask();
            Set<Role> roles = relevantRoles();
            List<Task> deferred = graph.deferredTasks(session.phase());
            boolean workLeft = graph.openTasks(roles).stream().anyMatch(t -> !deferred.contains(t));

            if (!workLeft) {
                List<Task> blocked = graph.blockedTasks(roles);
                if (blocked.isEmpty()) {
                    advancePhase();
                    continue;
                }
                hold(blocked);
                break;
            }
            held = false;
            for (Role role : roles) {
                assignReady(role, issued);
            }
            break;
        }
        return issued;
    }

    private void hold(List<Task> blocked) {
        if (held) {
            return;
        }
        held = true;
        context.metrics().incrementEscalations("held");
        List<String> ids = blocked.stream().map(Task::id).toList();
        log.warn("Session {} held in phase {}: waiting on operator for blocked task(s) {}",
                session.id(), session.phase().key(), ids);
        appendReport();
        publish("session.held", null, Map.of("phase", session.phase().key(), "blocked", ids));
    }

    /** Plan before build: a session without planner work gets its planning task before any other role runs. */
    private void seedPlanningTask() {
        if (session.phase() == Phase.PLANNING && graph.all().stream().noneMatch(t -> t.role() == Role.PLANNER)) {
            graph.insert(new TaskSpec(PLANNING_TASK_ID, Role.PLANNER,
                    "Break the project goal down into tasks for each role: " + session.goal(), List.of(), 0));
            log.info("Seeded planning task {} for session {}", PLANNING_TASK_ID, session.id());
        }
    }

    /**
     * Roles of the current phase plus roles of earlier phases with unfinished tasks,
     * e.g. a builder task appended while quality checking.
     */
    Set<Role> relevantRoles() {
        Set<Role> roles = session.phase().roles();
        for (Role role : Role.values()) {
            if (Phase.of(role).ordinal() < session.phase().ordinal() && graph.hasUnfinishedWork(role)) {
                roles.add(role);
            }
        }
        return roles;
    }

    private void assignReady(Role role, List<Assignment> issued) {
        List<Task> ready = graph.readyTasks(role);
        if (ready.isEmpty()) {
            return;
        }
        int capacity = context.maxInFlightPerRole() - graph.inProgress(role).size();
        if (capacity <= 0) {
            log.debug("Role {} is at its in-flight limit; {} ready task(s) wait", role.key(), ready.size());
            return;
        }
        Agent agent = registry.ensureActive(role);
        for (Task task : ready.subList(0, Math.min(capacity, ready.size()))) {
            Task started = graph.markInProgress(task.id(), agent.id());
            issued.add(assignmentFor(started, agent.id()));
            context.metrics().recordDispatch(role.key());
            publish("task.dispatched", started.id(), Map.of("role", role.key(), "agent_id", agent.id()));
            log.info("Dispatched task {} to {}", started.id(), agent.id());
        }
    }

    private Assignment assignmentFor(Task task, String agentId) {
        var description = new StringBuilder(task.description() == null ? "" : task.description());
        List<String> feedback = task.history().stream()
                .filter(h -> h.startsWith("rejected: "))
                .map(h -> h.substring("rejected: ".length()))
                .toList();
        if (!feedback.isEmpty()) {
            description.append("\n\nAddress feedback from earlier attempts:");
            feedback.forEach(f -> description.append("\n- ").append(f));
        }
        var dependencyContext = new ArrayList<Assignment.DependencyContext>();
        for (String dep : task.dependencies()) {
            Task dependency = graph.get(dep);
            dependencyContext.add(new Assignment.DependencyContext(dependency.id(), dependency.description(),
                    task.role().validates() ? dependency.artifactSummary() : null));
        }
        return new Assignment(session.id(), task.id(), task.role(), agentId, task.attempt(),
                description.toString(), dependencyContext);
    }

    private void submitAll(List<Assignment> assignments) {
        for (Assignment assignment : assignments) {
            try {
                context.executor().submit(assignment, this::signal);
            } catch (RuntimeException e) {
                log.warn("Executor refused assignment {}: {}", assignment.taskId(), e.getMessage(), e);
                signal(CompletionSignal.failure(assignment, "executor refused assignment: " + e.getMessage()));
            }
        }
    }

    private void advancePhase() {
        Phase from = session.phase();
        Phase to = from.next();
        Session advanced = session.withPhase(to);
        context.store().updateSession(advanced);
        session = advanced;

        Set<Role> needed = to.roles();
        for (Agent agent : registry.active()) {
            if (!needed.contains(agent.role())) {
                registry.retire(agent.id());
            }
        }
        context.metrics().recordPhaseTransition(to.key());
        log.info("Session {} advanced from {} to {}", session.id(), from.key(), to.key());
        appendReport();
        publish("phase.advanced", null, Map.of("from", from.key(), "to", to.key()));
        if (to.isTerminal()) {
            publish("session.done", null, Map.of());
        }
    }

    // --- Completions ---

    /**
     * Enqueue a completion from the execution collaborator. Safe from any thread.
     */
    public void signal(CompletionSignal signal) {
        inbox.offer(signal);
    }

    /**
     * Process every queued completion, then dispatch.
     *
     * @return the assignments issued by the trailing dispatch
     */
    public List<Assignment> processPending() {
        CompletionSignal signal;
        while ((signal = inbox.poll()) != null) {
            handle(signal);
        }
        return dispatch();
    }

    /**
     * Apply one completion: run the quality gate and commit the verdict.
     * A failure outcome counts as a rejection. A signal naming an attempt other than the
     * task's current one is a late delivery from an earlier execution and is ignored.
     *
     * @throws NotFoundException if the task is unknown in this session
     */
    public Disposition handle(CompletionSignal signal) {
        return locked(() -> handleLocked(signal));
    }

    private Disposition handleLocked(CompletionSignal signal) {
        Task task = graph.get(signal.taskId());
        MdcContext.setTask(session.id(), task.id(), task.role().key());
        try {
            if (task.status() != TaskStatus.IN_PROGRESS) {
                log.info("Ignoring completion for task {} in status {}", task.id(), task.status().key());
                return Disposition.IGNORED;
            }
            if (signal.attempt() != null && signal.attempt() != task.attempt()) {
                log.info("Ignoring completion for task {} from attempt {}; current attempt is {}",
                        task.id(), signal.attempt(), task.attempt());
                return Disposition.IGNORED;
            }
            if (signal.outcome() == Outcome.FAILURE) {
                String reason = signal.artifactSummary() == null ? "no reason given" : signal.artifactSummary();
                return rejectTask(task, "execution failed: " + reason);
            }

            QualityVerdict verdict = context.gate().review(task, signal.artifactSummary());
            context.metrics().recordGateVerdict(verdict.accepted());
            if (verdict instanceof QualityVerdict.Rejected rejected) {
                return rejectTask(task, rejected.feedback());
            }

            List<TaskSpec> produced = signal.producedTasks();
            if (!produced.isEmpty() && !task.role().producesTasks()) {
                log.warn("Role {} cannot produce tasks; dropping {} proposed task(s)", task.role().key(), produced.size());
                produced = List.of();
            }
            if (task.role().producesTasks() && produced.isEmpty() && onlyPlannerTasks()) {
                return rejectTask(task, "no tasks were produced for the project goal");
            }
            List<Task> inserted;
            try {
                inserted = graph.markCompleted(task.id(), (QualityVerdict.Accepted) verdict,
                        signal.artifactSummary(), produced);
            } catch (CyclicDependencyException | NotFoundException | IllegalArgumentException e) {
                return rejectTask(task, "produced tasks rejected: " + e.getMessage());
            }
            var payload = new HashMap<String, Object>();
            payload.put("role", task.role().key());
            if (!inserted.isEmpty()) {
                payload.put("produced_tasks", inserted.stream().map(Task::id).toList());
            }
            publish("task.accepted", task.id(), payload);
            return Disposition.ACCEPTED;
        } finally {
            MdcContext.clearTask();
        }
    }

    private boolean onlyPlannerTasks() {
        return graph.all().stream().allMatch(t -> t.role().producesTasks());
    }

    private Disposition rejectTask(Task task, String feedback) {
        List<Task> changed = graph.reject(task.id(), feedback, context.gate().getRetryCeiling());
        Task updated = changed.get(0);
        if (updated.status() == TaskStatus.BLOCKED) {
            context.metrics().incrementEscalations("retry_ceiling");
            for (Task blocked : changed) {
                publish("task.blocked", blocked.id(), Map.of("reason", blocked.blockedReason()));
            }
            return Disposition.BLOCKED;
        }
        publish("task.rejected", task.id(), Map.of("feedback", feedback, "retry_count", updated.retryCount()));
        return Disposition.REJECTED;
    }

    /**
     * Dispatch and process completions until the session is done, paused, held on blocked
     * tasks or the thread is interrupted. Waits up to {@code pollInterval} for a completion
     * before re-checking.
     *
     * @return the session as it stands when the loop exits
     */
    public Session runUntilDone(Duration pollInterval) {
        dispatch();
        while (!isDone() && !session.paused() && !held) {
            CompletionSignal signal;
            try {
                signal = inbox.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Coordinator loop for session {} interrupted", session.id());
                break;
            }
            if (signal != null) {
                handle(signal);
            }
            processPending();
        }
        return session;
    }

    // --- Session lifecycle ---

    /**
     * Pause the session. In-progress tasks stay in progress. Pausing twice is a no-op.
     */
    public void pause() {
        locked(() -> {
            if (session.paused()) {
                return null;
            }
            Session paused = session.withPaused(true);
            context.store().updateSession(paused);
            session = paused;
            log.info("Session {} paused in phase {}", session.id(), session.phase().key());
            appendReport();
            publish("session.paused", null, Map.of("phase", session.phase().key()));
            return null;
        });
    }

    /**
     * Resume in the phase the session paused from and re-issue every in-progress
     * assignment under its current attempt. Safe to repeat: a redelivered assignment that
     * completes twice is judged once.
     *
     * @return the re-issued assignments
     */
    public List<Assignment> resume() {
        List<Assignment> reissued = locked(() -> {
            if (session.paused()) {
                Session resumed = session.withPaused(false);
                context.store().updateSession(resumed);
                session = resumed;
            }
            var out = new ArrayList<Assignment>();
            for (Task task : graph.withStatus(TaskStatus.IN_PROGRESS)) {
                String agentId = registry.all().stream()
                        .filter(a -> a.id().equals(task.assignedAgentId()) && a.isActive())
                        .map(Agent::id)
                        .findFirst()
                        .orElseGet(() -> registry.ensureActive(task.role()).id());
                out.add(assignmentFor(task, agentId));
            }
            log.info("Session {} resumed in phase {}; re-issuing {} in-progress assignment(s)",
                    session.id(), session.phase().key(), out.size());
            publish("session.resumed", null, Map.of("phase", session.phase().key(), "reissued", out.size()));
            return out;
        });
        submitAll(reissued);
        return reissued;
    }

    /**
     * Add a task mid-run.
     *
     * @throws InvalidTransitionException if the session is done
     */
    public Task appendTask(TaskSpec spec) {
        return locked(() -> {
            requireNotDone("append tasks to");
            Task task = graph.insert(spec);
            if (task.status() == TaskStatus.BLOCKED) {
                publish("task.blocked", task.id(), Map.of("reason", task.blockedReason()));
            }
            return task;
        });
    }

    /**
     * Operator override for a blocked task. Releases a held session on the next dispatch.
     *
     * @return every task released, the given one first
     */
    public List<Task> unblock(String taskId) {
        return locked(() -> {
            requireNotDone("unblock tasks in");
            List<Task> released = graph.unblock(taskId);
            held = false;
            publish("task.unblocked", taskId, Map.of("released", released.stream().map(Task::id).toList()));
            return released;
        });
    }

    /**
     * Generate a progress report and append it to the session record.
     */
    public Report report() {
        return locked(this::appendReport);
    }

    private Report appendReport() {
        Report report = context.reporter().summarize(session.id());
        context.store().appendReport(report);
        return report;
    }

    private void requireNotDone(String action) {
        if (isDone()) {
            throw new InvalidTransitionException("Cannot " + action + " session " + session.id() + ": it is done");
        }
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        context.eventBus().publish(new ForemanEvent(type, session.id(), taskId, payload, context.clock().instant()));
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        MdcContext.setSession(session.id());
        try {
            return action.get();
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }
}
