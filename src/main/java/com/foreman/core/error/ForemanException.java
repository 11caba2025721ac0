package com.foreman.core.error;

/**
 * Root of the coordinator's error taxonomy. All subclasses are unchecked: they signal
 * a rejected operation whose state change was not applied.
 */
public class ForemanException extends RuntimeException {

    public ForemanException(String message) {
        super(message);
    }

    public ForemanException(String message, Throwable cause) {
        super(message, cause);
    }
}
