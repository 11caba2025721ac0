package com.foreman.core.engine;

import com.foreman.core.model.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default executor for operator-driven runs: records each assignment and leaves the
 * work to an outside agent, whose result is reported later through the CLI.
 */
public class LoggingAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingAgentExecutor.class);

    @Override
    public void submit(Assignment assignment, CompletionChannel channel) {
        log.info("Assignment {} (attempt {}) -> {} [{}]: {}", assignment.taskId(), assignment.attempt(),
                assignment.agentId(), assignment.role().key(), firstLine(assignment.description()));
        if (!assignment.dependencyContext().isEmpty()) {
            log.debug("Assignment {} builds on {}", assignment.taskId(),
                    assignment.dependencyContext().stream().map(Assignment.DependencyContext::taskId).toList());
        }
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
