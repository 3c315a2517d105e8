package org.rostilos.prwizard.core.exception;

/**
 * The pending annotation store could not complete an operation (connection failure,
 * transaction timeout, unexpected database error).
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String code, Throwable cause) {
        super(String.format("Pending annotation store failed during %s%s: %s",
                operation, code != null ? " (code " + code + ")" : "", cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
