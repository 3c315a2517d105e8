package org.rostilos.prwizard.pipelineagent.generic.exception;

/**
 * No free annotation code was found within the configured number of attempts.
 */
public class CodeAllocationFailedException extends RuntimeException {

    public CodeAllocationFailedException(int attempts, Throwable lastFailure) {
        super("No free annotation code after " + attempts + " attempts", lastFailure);
    }
}
