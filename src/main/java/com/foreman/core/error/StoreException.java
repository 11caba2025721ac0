package com.foreman.core.error;

/**
 * Persistent store I/O failure (disk, lock, constraint). The underlying exception is kept
 * as the cause; the operation that raised it has not been applied.
 */
public class StoreException extends ForemanException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
