package com.foreman.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.engine.SessionCoordinator;
import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.events.SessionEventLog;
import com.foreman.core.model.CompletionSignal;
import com.foreman.core.model.Outcome;
import com.foreman.core.model.TaskSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman complete &lt;session-id&gt; &lt;task-id&gt;
 * <p>
 * Reports an agent's result for an in-progress task. The result goes through the
 * quality gate; the command then dispatches whatever became ready.
 * <p>
 * A planner completion can attach the tasks it produced with {@code --tasks-file},
 * a JSON array of {@code {"id", "role", "description", "depends_on", "priority"}} objects.
 */
@Command(name = "complete", mixinStandardHelpOptions = true, description = "Report the result of a task")
@Component
public class CompleteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    @Option(names = {"--outcome", "-o"}, description = "success or failure (default: ${DEFAULT-VALUE})",
            defaultValue = "success")
    private String outcome;

    @Option(names = {"--summary", "-s"}, description = "Artifact summary or failure reason")
    private String summary;

    @Option(names = "--tasks-file", description = "JSON file with the tasks produced by a planner")
    private Path tasksFile;

    @Option(names = "--attempt", description = "Attempt number from the assignment; results for older attempts are ignored")
    private Integer attempt;

    private final SessionEngine sessionEngine;
    private final ObjectMapper objectMapper;
    private final SessionEventLog eventLog;

    public CompleteCommand(SessionEngine sessionEngine, ObjectMapper objectMapper, SessionEventLog eventLog) {
        this.sessionEngine = sessionEngine;
        this.objectMapper = objectMapper;
        this.eventLog = eventLog;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Outcome parsedOutcome;
        List<TaskSpec> produced;
        try {
            parsedOutcome = Outcome.fromKey(outcome);
            produced = tasksFile == null ? List.of()
                    : objectMapper.readValue(tasksFile.toFile(), new TypeReference<List<TaskSpec>>() {});
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid outcome: " + outcome + ". Valid outcomes: success, failure");
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read tasks file " + tasksFile + ": " + e.getMessage());
            return 1;
        }

        try {
            SessionCoordinator coordinator = sessionEngine.open(sessionId);
            var signal = new CompletionSignal(taskId, parsedOutcome, summary, produced, attempt);
            switch (coordinator.handle(signal)) {
                case ACCEPTED -> ConsoleOutput.success("Task " + taskId + " accepted");
                case REJECTED -> ConsoleOutput.error("Task " + taskId + " rejected: "
                        + lastFeedback(coordinator, taskId));
                case BLOCKED -> ConsoleOutput.error("Task " + taskId + " blocked: "
                        + coordinator.task(taskId).blockedReason() + ". Human input needed; unblock when resolved");
                case IGNORED -> ConsoleOutput.info("Task " + taskId
                        + " is not in progress under that attempt; result ignored");
            }
            ConsoleOutput.assignments(coordinator.dispatch());
            ConsoleOutput.events(eventLog.drain(sessionId));
            if (coordinator.isHeld()) {
                ConsoleOutput.held(coordinator.phase().key());
            }
            ConsoleOutput.info("Phase: " + coordinator.phase().key());
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private static String lastFeedback(SessionCoordinator coordinator, String taskId) {
        List<String> history = coordinator.task(taskId).history();
        return history.isEmpty() ? "-" : history.get(history.size() - 1);
    }
}
