package org.rostilos.prwizard.pipelineagent.review;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewKind {
    ISSUE_COMMENT("issue_comment"),
    REVIEW_COMMENT("review_comment"),
    REVIEW("review"),
    WIZARD_REVIEW("wizard_review_command");

    private final String id;

    ReviewKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
