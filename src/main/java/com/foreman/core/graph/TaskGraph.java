package com.foreman.core.graph;

import com.foreman.core.error.CyclicDependencyException;
import com.foreman.core.error.InvalidTransitionException;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Role;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskSpec;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.ProjectStore;
import com.foreman.core.qualitygate.QualityVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scheduling cache over the tasks of one session.
 * <p>
 * Every mutation is written to the {@link ProjectStore} first and applied to the cache
 * only after the write succeeded, so a failed write leaves both unchanged. Tasks refer
 * to each other by id only. Not thread-safe: the owning coordinator serializes access.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    /** Reason prefix for tasks blocked because a dependency is blocked. */
    public static final String DEPENDENCY_BLOCKED_PREFIX = "dependency blocked: ";

    /**
     * Priority descending, then creation time ascending. Sorting is stable, so tasks
     * created together keep their insertion order.
     */
    public static final Comparator<Task> SCHEDULING_ORDER = Comparator
            .comparingInt(Task::priority).reversed()
            .thenComparing(Task::createdAt);

    private static final Pattern GENERATED_ID = Pattern.compile("TASK-(\\d+)");

    private final String sessionId;
    private final ProjectStore store;
    private final Clock clock;
    private final Map<String, Task> tasks = new LinkedHashMap<>();

    private TaskGraph(String sessionId, ProjectStore store, Clock clock) {
        this.sessionId = sessionId;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Rebuild the graph for a session from the store.
     */
    public static TaskGraph load(String sessionId, ProjectStore store, Clock clock) {
        var graph = new TaskGraph(sessionId, store, clock);
        for (Task task : store.listTasks(sessionId)) {
            graph.tasks.put(task.id(), task);
        }
        log.debug("Loaded task graph for session {} with {} tasks", sessionId, graph.tasks.size());
        return graph;
    }

    // --- Queries ---

    public Task get(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw NotFoundException.task(taskId);
        }
        return task;
    }

    /** All tasks in insertion order. */
    public List<Task> all() {
        return List.copyOf(tasks.values());
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * Pending tasks whose every dependency is completed, in scheduling order.
     */
    public List<Task> readyTasks() {
        return readyTasks(tasks.values(), tasks::get);
    }

    public List<Task> readyTasks(Role role) {
        return readyTasks().stream().filter(t -> t.role() == role).toList();
    }

    /**
     * Ready tasks among {@code candidates}, resolving dependencies through {@code lookup}.
     * Shared with the reporter, which works from store snapshots.
     */
    public static List<Task> readyTasks(Collection<Task> candidates, Function<String, Task> lookup) {
        return candidates.stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> dependenciesCompleted(t, lookup))
                .sorted(SCHEDULING_ORDER)
                .toList();
    }

    public static boolean dependenciesCompleted(Task task, Function<String, Task> lookup) {
        for (String dep : task.dependencies()) {
            Task dependency = lookup.apply(dep);
            if (dependency == null || dependency.status() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    public List<Task> withStatus(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).toList();
    }

    public List<Task> inProgress(Role role) {
        return tasks.values().stream()
                .filter(t -> t.role() == role && t.status() == TaskStatus.IN_PROGRESS)
                .toList();
    }

    /** Pending or in-progress tasks owned by any of the given roles. */
    public List<Task> openTasks(Set<Role> roles) {
        return tasks.values().stream()
                .filter(t -> roles.contains(t.role()) && t.status().isOpen())
                .toList();
    }

    public List<Task> blockedTasks(Set<Role> roles) {
        return tasks.values().stream()
                .filter(t -> roles.contains(t.role()) && t.status() == TaskStatus.BLOCKED)
                .toList();
    }

    /** Whether the role owns any task that is not completed yet, blocked ones included. */
    public boolean hasUnfinishedWork(Role role) {
        return tasks.values().stream().anyMatch(t -> t.role() == role && t.status() != TaskStatus.COMPLETED);
    }

    /**
     * Pending tasks that cannot become ready before a later phase: one of their unfinished
     * dependencies, directly or transitively, belongs to a role of a phase after {@code current}.
     */
    public List<Task> deferredTasks(Phase current) {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.PENDING && waitsOnLaterPhase(t, current, new HashSet<>()))
                .toList();
    }

    private boolean waitsOnLaterPhase(Task task, Phase current, Set<String> seen) {
        for (String dep : task.dependencies()) {
            Task dependency = tasks.get(dep);
            if (dependency == null || dependency.status() == TaskStatus.COMPLETED || !seen.add(dep)) {
                continue;
            }
            if (Phase.of(dependency.role()).ordinal() > current.ordinal()
                    || waitsOnLaterPhase(dependency, current, seen)) {
                return true;
            }
        }
        return false;
    }

    // --- Insertion ---

    public Task insert(TaskSpec spec) {
        return insertAll(List.of(spec)).get(0);
    }

    /**
     * Insert a batch of tasks atomically.
     * <p>
     * Tasks inside the batch may depend on each other. A task depending on a blocked
     * task is inserted blocked.
     *
     * @throws IllegalArgumentException   if an id is already taken
     * @throws NotFoundException          if a dependency id is unknown
     * @throws CyclicDependencyException  if the batch would introduce a cycle
     */
    public List<Task> insertAll(List<TaskSpec> specs) {
        List<Task> prepared = prepare(specs);
        commit(prepared);
        log.info("Inserted {} task(s) into session {}: {}", prepared.size(), sessionId,
                prepared.stream().map(Task::id).toList());
        return prepared;
    }

    private List<Task> prepare(List<TaskSpec> specs) {
        var now = clock.instant();
        var batch = new LinkedHashMap<String, Task>();
        int nextGenerated = nextGeneratedNumber();
        for (TaskSpec spec : specs) {
            if (spec.role() == null) {
                throw new IllegalArgumentException("Task " + spec.id() + " has no role");
            }
            String id = spec.id();
            if (id == null || id.isBlank()) {
                id = String.format("TASK-%03d", nextGenerated++);
            }
            if (tasks.containsKey(id) || batch.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate task id: " + id);
            }
            batch.put(id, Task.pending(sessionId, id, spec.role(), spec.description(),
                    spec.dependencies(), spec.priority(), now));
        }

        Function<String, Task> lookup = id -> batch.containsKey(id) ? batch.get(id) : tasks.get(id);
        for (Task task : batch.values()) {
            for (String dep : task.dependencies()) {
                if (dep.equals(task.id())) {
                    throw new CyclicDependencyException(List.of(task.id(), task.id()));
                }
                if (lookup.apply(dep) == null) {
                    throw NotFoundException.task(dep);
                }
            }
        }
        // Existing tasks cannot depend on new ids, so any cycle lies inside the batch.
        for (Task task : batch.values()) {
            List<String> cycle = findCycle(task.id(), lookup);
            if (cycle != null) {
                throw new CyclicDependencyException(cycle);
            }
        }

        var result = new ArrayList<Task>();
        for (Task task : batch.values()) {
            Optional<String> blockedDep = task.dependencies().stream()
                    .filter(dep -> lookup.apply(dep).status() == TaskStatus.BLOCKED)
                    .findFirst();
            if (blockedDep.isPresent()) {
                task = task.blocked(DEPENDENCY_BLOCKED_PREFIX + blockedDep.get());
                batch.put(task.id(), task);
            }
            result.add(task);
        }
        return result;
    }

    /**
     * Reachability check from {@code start} through its dependencies back to itself.
     *
     * @return the cycle as a path starting and ending with {@code start}, or null
     */
    private static List<String> findCycle(String start, Function<String, Task> lookup) {
        var path = new ArrayList<String>();
        path.add(start);
        return walk(start, start, lookup, path, new HashSet<>());
    }

    private static List<String> walk(String start, String current, Function<String, Task> lookup,
                                     List<String> path, Set<String> visited) {
        Task task = lookup.apply(current);
        if (task == null) {
            return null;
        }
        for (String dep : task.dependencies()) {
            if (dep.equals(start)) {
                var cycle = new ArrayList<>(path);
                cycle.add(start);
                return cycle;
            }
            if (visited.add(dep)) {
                path.add(dep);
                List<String> found = walk(start, dep, lookup, path, visited);
                if (found != null) {
                    return found;
                }
                path.remove(path.size() - 1);
            }
        }
        return null;
    }

    private int nextGeneratedNumber() {
        int max = 0;
        for (String id : tasks.keySet()) {
            Matcher m = GENERATED_ID.matcher(id);
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max + 1;
    }

    // --- Transitions ---

    /**
     * @throws InvalidTransitionException if the task is not pending or a dependency is not completed
     */
    public Task markInProgress(String taskId, String agentId) {
        Task task = get(taskId);
        if (task.status() != TaskStatus.PENDING) {
            throw new InvalidTransitionException(
                    "Task " + taskId + " is " + task.status().key() + ", expected pending");
        }
        if (!dependenciesCompleted(task, tasks::get)) {
            List<String> open = task.dependencies().stream()
                    .filter(dep -> get(dep).status() != TaskStatus.COMPLETED)
                    .toList();
            throw new InvalidTransitionException(
                    "Task " + taskId + " has incomplete dependencies: " + open);
        }
        Task started = task.startedBy(agentId, clock.instant());
        commit(List.of(started));
        return started;
    }

    /**
     * Commit an accepted completion. The verdict must have been issued for this task.
     * Tasks produced by the completing role are inserted in the same store transaction;
     * if they fail validation nothing is written.
     *
     * @return the tasks inserted along with the completion
     */
    public List<Task> markCompleted(String taskId, QualityVerdict.Accepted verdict, String artifactSummary,
                                    List<TaskSpec> produced) {
        if (!verdict.taskId().equals(taskId)) {
            throw new IllegalArgumentException(
                    "Verdict was issued for " + verdict.taskId() + ", not " + taskId);
        }
        Task task = get(taskId);
        if (task.status() != TaskStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(
                    "Task " + taskId + " is " + task.status().key() + ", expected in_progress");
        }
        List<Task> inserted = produced == null || produced.isEmpty() ? List.of() : prepare(produced);
        var batch = new ArrayList<Task>();
        batch.add(task.completed(artifactSummary, clock.instant()));
        batch.addAll(inserted);
        commit(batch);
        return inserted;
    }

    public List<Task> markCompleted(String taskId, QualityVerdict.Accepted verdict, String artifactSummary) {
        return markCompleted(taskId, verdict, artifactSummary, List.of());
    }

    /**
     * Send an in-progress task back to pending with feedback. When the retry count reaches
     * {@code retryCeiling} the task is blocked instead and the block propagates.
     *
     * @return every task whose status changed, the rejected one first
     */
    public List<Task> reject(String taskId, String feedback, int retryCeiling) {
        Task task = get(taskId);
        if (task.status() != TaskStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(
                    "Task " + taskId + " is " + task.status().key() + ", expected in_progress");
        }
        Task rejected = task.rejected(feedback);
        if (rejected.retryCount() < retryCeiling) {
            commit(List.of(rejected));
            return List.of(rejected);
        }
        Task blocked = rejected.blocked(
                "retry ceiling reached after " + rejected.retryCount() + " rejection(s): " + feedback);
        var batch = new ArrayList<Task>();
        batch.add(blocked);
        batch.addAll(propagateBlock(blocked));
        commit(batch);
        log.warn("Task {} blocked after {} rejection(s)", taskId, rejected.retryCount());
        return batch;
    }

    /**
     * Block a task and, transitively, every open task depending on it.
     * Blocking an already blocked task is a no-op.
     *
     * @return every task whose status changed, the given one first
     * @throws InvalidTransitionException if the task is completed
     */
    public List<Task> markBlocked(String taskId, String reason) {
        Task task = get(taskId);
        if (task.status() == TaskStatus.BLOCKED) {
            return List.of();
        }
        if (task.status() == TaskStatus.COMPLETED) {
            throw new InvalidTransitionException("Task " + taskId + " is completed and cannot be blocked");
        }
        Task blocked = task.blocked(reason);
        var batch = new ArrayList<Task>();
        batch.add(blocked);
        batch.addAll(propagateBlock(blocked));
        commit(batch);
        log.warn("Task {} blocked: {} ({} dependent(s) blocked with it)", taskId, reason, batch.size() - 1);
        return batch;
    }

    private List<Task> propagateBlock(Task root) {
        var changed = new ArrayList<Task>();
        var queue = new ArrayDeque<String>();
        var seen = new HashSet<String>();
        queue.add(root.id());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Task dependent : dependentsOf(current)) {
                if (!seen.add(dependent.id()) || !dependent.status().isOpen()) {
                    continue;
                }
                changed.add(dependent.blocked(DEPENDENCY_BLOCKED_PREFIX + current));
                queue.add(dependent.id());
            }
        }
        return changed;
    }

    /**
     * Operator override: return a blocked task to pending with a clean retry count.
     * Dependents that were blocked only through this task are released as well.
     *
     * @return every task whose status changed, the given one first
     * @throws InvalidTransitionException if the task is not blocked
     */
    public List<Task> unblock(String taskId) {
        Task task = get(taskId);
        if (task.status() != TaskStatus.BLOCKED) {
            throw new InvalidTransitionException(
                    "Task " + taskId + " is " + task.status().key() + ", only blocked tasks can be unblocked");
        }
        var working = new LinkedHashMap<String, Task>();
        working.put(taskId, task.unblocked("unblocked by operator"));
        Function<String, Task> lookup = id -> working.containsKey(id) ? working.get(id) : tasks.get(id);

        var queue = new ArrayDeque<String>();
        queue.add(taskId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Task dependent : dependentsOf(current)) {
                Task latest = lookup.apply(dependent.id());
                if (latest.status() != TaskStatus.BLOCKED || latest.blockedReason() == null
                        || !latest.blockedReason().startsWith(DEPENDENCY_BLOCKED_PREFIX)) {
                    continue;
                }
                boolean stillBlocked = latest.dependencies().stream()
                        .anyMatch(dep -> lookup.apply(dep).status() == TaskStatus.BLOCKED);
                if (!stillBlocked) {
                    working.put(latest.id(), latest.unblocked("unblocked with " + taskId));
                    queue.add(latest.id());
                }
            }
        }
        var batch = new ArrayList<>(working.values());
        commit(batch);
        log.info("Task {} unblocked by operator ({} dependent(s) released)", taskId, batch.size() - 1);
        return batch;
    }

    private List<Task> dependentsOf(String taskId) {
        return tasks.values().stream().filter(t -> t.dependencies().contains(taskId)).toList();
    }

    private void commit(List<Task> changed) {
        if (changed.isEmpty()) {
            return;
        }
        store.upsertTasks(changed);
        for (Task task : changed) {
            tasks.put(task.id(), task);
        }
    }
}
