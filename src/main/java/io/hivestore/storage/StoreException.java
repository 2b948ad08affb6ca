package io.hivestore.storage;

/**
 * Failure of a store operation. Carries the operation key so callers can tell
 * which cataloged statement failed without parsing the driver message.
 */
public final class StoreException extends RuntimeException {
    private final String operation;

    public StoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public StoreException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
