package org.rostilos.prwizard.core.exception;

/**
 * Thrown when a code is inserted while another annotation with the same code is still pending.
 * Callers are expected to draw a new code and try again.
 */
public class DuplicateCodeException extends RuntimeException {

    private final String code;

    public DuplicateCodeException(String code, Throwable cause) {
        super("Annotation code already pending: " + code, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
