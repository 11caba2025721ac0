package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.model.Role;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman add-task &lt;session-id&gt; --role builder --description "..."
 */
@Command(name = "add-task", mixinStandardHelpOptions = true, description = "Append a task to a running session")
@Component
public class AddTaskCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = "--id", description = "Task ID (generated when omitted)")
    private String taskId;

    @Option(names = {"--role", "-r"}, required = true,
            description = "Owning role: planner, builder, quality_checker, tester, documenter")
    private String role;

    @Option(names = {"--description", "-d"}, required = true, description = "What the task should accomplish")
    private String description;

    @Option(names = "--depends-on", split = ",", description = "Comma-separated IDs of prerequisite tasks")
    private List<String> dependsOn = new ArrayList<>();

    @Option(names = {"--priority", "-p"}, defaultValue = "0", description = "Higher runs first (default: ${DEFAULT-VALUE})")
    private int priority;

    private final SessionEngine sessionEngine;

    public AddTaskCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Role parsedRole = Role.fromKey(role);
            Task task = sessionEngine.open(sessionId)
                    .appendTask(new TaskSpec(taskId, parsedRole, description, dependsOn, priority));
            ConsoleOutput.success("Added task " + task.id() + " [" + task.role().key() + "] as " + task.status().key());
            return 0;
        } catch (ForemanException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
