package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionCoordinator;
import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.events.SessionEventLog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: foreman dispatch &lt;session-id&gt;
 * <p>
 * Runs one dispatch pass: advances finished phases and assigns ready tasks. Prints the
 * events the pass produced and warns when the session is held on blocked work.
 */
@Command(name = "dispatch", mixinStandardHelpOptions = true, description = "Assign ready tasks to agents")
@Component
public class DispatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final SessionEngine sessionEngine;
    private final SessionEventLog eventLog;

    public DispatchCommand(SessionEngine sessionEngine, SessionEventLog eventLog) {
        this.sessionEngine = sessionEngine;
        this.eventLog = eventLog;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            SessionCoordinator coordinator = sessionEngine.open(sessionId);
            if (coordinator.session().paused()) {
                ConsoleOutput.error("Session " + sessionId + " is paused; resume it first");
                return 1;
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
}
