package org.rostilos.prwizard.pipelineagent.generic.exception;

import org.rostilos.prwizard.core.model.annotation.CommentLocation;

public class RemoteDeleteFailedException extends RuntimeException {

    public RemoteDeleteFailedException(CommentLocation location, Throwable cause) {
        super(String.format("Failed to delete %s comment %d: %s",
                location.kind().getId(), location.commentId(), cause.getMessage()), cause);
    }
}
