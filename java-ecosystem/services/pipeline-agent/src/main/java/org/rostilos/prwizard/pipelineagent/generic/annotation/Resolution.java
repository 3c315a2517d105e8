package org.rostilos.prwizard.pipelineagent.generic.annotation;

/**
 * Outcome of one reconciliation attempt.
 */
public enum Resolution {
    ACCEPTED,
    REJECTED,
    EXPIRED,
    /** The code was not pending, or another resolver removed it first. */
    NOT_FOUND
}
