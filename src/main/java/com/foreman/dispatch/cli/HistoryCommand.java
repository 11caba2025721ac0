package com.foreman.dispatch.cli;

import com.foreman.core.model.Session;
import com.foreman.core.persistence.ProjectQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman history
 * <p>
 * Lists the sessions of this project as a table: Session ID | Phase | Goal (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List sessions of this project")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ProjectQueryService queryService;

    public HistoryCommand(ProjectQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Session> sessions = queryService.listSessions();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return 0;
        }

        List<Session> display = sessions.size() > limit
                ? sessions.subList(sessions.size() - limit, sessions.size())
                : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-16s %s%n", "SESSION ID", "PHASE", "GOAL");
        System.out.println("  " + "-".repeat(76));
        for (Session session : display) {
            String phase = session.phase().key() + (session.paused() ? " (p)" : "");
            System.out.printf("  %-24s %-16s %s%n", session.id(), phase, ConsoleOutput.truncate(session.goal(), 34));
        }
        return 0;
    }
}
