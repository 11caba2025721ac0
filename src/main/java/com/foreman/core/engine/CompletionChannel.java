package com.foreman.core.engine;

import com.foreman.core.model.CompletionSignal;

/**
 * Response channel on which the execution collaborator reports finished assignments.
 * Implementations only enqueue; processing happens on the coordinator's serialized path.
 */
@FunctionalInterface
public interface CompletionChannel {

    void complete(CompletionSignal signal);
}
