package com.foreman.dispatch.cli;

import com.foreman.core.error.ForemanException;
import com.foreman.core.model.Agent;
import com.foreman.core.model.Session;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.ProjectQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman status &lt;session-id&gt;
 * <p>
 * Read-only view of a session: phase, active agents and the task table.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show session status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--status", "-s"}, description = "Only tasks with this status")
    private String statusFilter;

    private final ProjectQueryService queryService;

    public StatusCommand(ProjectQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            TaskStatus filter = statusFilter == null ? null : TaskStatus.fromKey(statusFilter);
            Session session = queryService.getSession(sessionId);

            System.out.println();
            System.out.println("SESSION " + session.id());
            System.out.println("Goal: " + session.goal());
            if (session.phase().isTerminal()) {
                ConsoleOutput.success("Phase: " + session.phase().key());
            } else {
                ConsoleOutput.info("Phase: " + session.phase().key() + (session.paused() ? " (paused)" : ""));
            }

            var active = queryService.listActiveAgents(sessionId);
            ConsoleOutput.info("Active agents: " + (active.isEmpty() ? "none"
                    : String.join(", ", active.stream().map(Agent::id).toList())));

            Map<TaskStatus, Integer> counts = queryService.taskCounts(sessionId);
            ConsoleOutput.info(String.format("Tasks: %d pending, %d in progress, %d completed, %d blocked",
                    counts.get(TaskStatus.PENDING), counts.get(TaskStatus.IN_PROGRESS),
                    counts.get(TaskStatus.COMPLETED), counts.get(TaskStatus.BLOCKED)));
            System.out.println();
            ConsoleOutput.taskTable(queryService.listTasks(sessionId, filter));
            return 0;
        } catch (ForemanException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
