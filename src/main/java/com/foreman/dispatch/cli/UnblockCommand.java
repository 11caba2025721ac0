package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman unblock &lt;session-id&gt; &lt;task-id&gt;
 * <p>
 * Human override for a blocked task: back to pending with a fresh retry budget.
 */
@Command(name = "unblock", mixinStandardHelpOptions = true, description = "Return a blocked task to pending")
@Component
public class UnblockCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    private final SessionEngine sessionEngine;

    public UnblockCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            List<Task> released = sessionEngine.open(sessionId).unblock(taskId);
            ConsoleOutput.success("Unblocked " + released.stream().map(Task::id).toList());
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
