package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionCoordinator;
import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: foreman start "&lt;goal&gt;"
 * <p>
 * Creates a new session in the planning phase and dispatches the planning task.
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a new project session")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project goal")
    private String goal;

    @Option(names = "--no-dispatch", description = "Create the session without dispatching the planning task")
    private boolean noDispatch;

    private final SessionEngine sessionEngine;

    public StartCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            SessionCoordinator coordinator = sessionEngine.start(goal);
            ConsoleOutput.success("Session " + coordinator.sessionId() + " started");
            ConsoleOutput.info("Goal: " + goal);
            if (!noDispatch) {
                ConsoleOutput.assignments(coordinator.dispatch());
            }
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
