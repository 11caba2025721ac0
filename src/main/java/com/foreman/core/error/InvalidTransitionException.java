package com.foreman.core.error;

/**
 * A status change that the task or session state machine does not allow.
 */
public class InvalidTransitionException extends ForemanException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
