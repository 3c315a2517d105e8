package org.rostilos.prwizard.pipelineagent.generic.command;

public enum CommandType {
    ACCEPT,
    REJECT,
    WIZARD_REVIEW;

    public boolean isDecision() {
        return this == ACCEPT || this == REJECT;
    }
}
