package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionCoordinator;
import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.model.Assignment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman resume &lt;session-id&gt;
 * <p>
 * Reloads the session from the store, re-issues in-progress assignments and dispatches
 * whatever became ready. An unknown id is an error; nothing is created.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a paused or interrupted session")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final SessionEngine sessionEngine;

    public ResumeCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            SessionCoordinator coordinator = sessionEngine.reload(sessionId);
            List<Assignment> reissued = coordinator.resume();
            ConsoleOutput.success("Session " + sessionId + " resumed in phase " + coordinator.phase().key());
            if (!reissued.isEmpty()) {
                ConsoleOutput.info("Re-issued " + reissued.size() + " in-progress assignment(s):");
                reissued.forEach(ConsoleOutput::assignment);
            }
            ConsoleOutput.assignments(coordinator.dispatch());
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
