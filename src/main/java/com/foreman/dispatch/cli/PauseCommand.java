package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionCoordinator;
import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: foreman pause &lt;session-id&gt;
 */
@Command(name = "pause", mixinStandardHelpOptions = true,
        description = "Pause a session; in-progress tasks are kept for resume")
@Component
public class PauseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final SessionEngine sessionEngine;

    public PauseCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            SessionCoordinator coordinator = sessionEngine.open(sessionId);
            coordinator.pause();
            ConsoleOutput.success("Session " + sessionId + " paused in phase " + coordinator.phase().key());
            ConsoleOutput.info("Resume with: foreman resume " + sessionId);
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
