package org.rostilos.prwizard.pipelineagent.generic.annotation;

import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.pipelineagent.generic.exception.RemoteDeleteFailedException;

/**
 * Comment deletion on the hosting platform, scoped to an App installation.
 */
public interface AnnotationCommentClient {

    /**
     * Delete the comment at {@code location}, using the inline or thread endpoint as its kind requires.
     *
     * @return true if the comment was deleted, false if it was already gone
     * @throws RemoteDeleteFailedException on any other failure, including credential errors
     */
    boolean deleteComment(long installationId, OwnerRepo ownerRepo, CommentLocation location);
}
