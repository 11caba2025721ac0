package com.foreman.core.engine;

import com.foreman.core.model.Assignment;

/**
 * External collaborator that actually performs the work of an assignment.
 * <p>
 * {@link #submit} must return promptly; the outcome is reported later, possibly from
 * another thread, through the supplied {@link CompletionChannel}. Delivery may repeat:
 * the coordinator ignores completions for tasks that are no longer in progress.
 */
public interface AgentExecutor {

    void submit(Assignment assignment, CompletionChannel channel);
}
