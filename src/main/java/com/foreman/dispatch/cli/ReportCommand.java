package com.foreman.dispatch.cli;

import com.foreman.core.engine.SessionEngine;
import com.foreman.core.error.ForemanException;
import com.foreman.core.model.Report;
import com.foreman.core.persistence.ProjectQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman report &lt;session-id&gt;
 * <p>
 * Generates a new progress report, or lists earlier ones with {@code --list}.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Generate or list progress reports")
@Component
public class ReportCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--list", "-l"}, description = "Show stored reports instead of generating one")
    private boolean list;

    private final SessionEngine sessionEngine;
    private final ProjectQueryService queryService;

    public ReportCommand(SessionEngine sessionEngine, ProjectQueryService queryService) {
        this.sessionEngine = sessionEngine;
        this.queryService = queryService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            if (list) {
                List<Report> reports = queryService.listReports(sessionId);
                if (reports.isEmpty()) {
                    ConsoleOutput.info("No reports for session " + sessionId);
                }
                reports.forEach(ConsoleOutput::report);
                return 0;
            }
            ConsoleOutput.report(sessionEngine.open(sessionId).report());
            return 0;
        } catch (ForemanException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
