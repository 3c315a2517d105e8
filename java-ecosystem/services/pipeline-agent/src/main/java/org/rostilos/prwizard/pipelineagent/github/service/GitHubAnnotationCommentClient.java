package org.rostilos.prwizard.pipelineagent.github.service;

import okhttp3.OkHttpClient;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.pipelineagent.generic.annotation.AnnotationCommentClient;
import org.rostilos.prwizard.pipelineagent.generic.exception.RemoteDeleteFailedException;
import org.rostilos.prwizard.vcsclient.InstallationClientProvider;
import org.rostilos.prwizard.vcsclient.github.actions.DeleteCommentAction;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Deletes comments through the GitHub REST API with a fresh installation client per call,
 * so it works outside of any webhook delivery.
 */
@Service
public class GitHubAnnotationCommentClient implements AnnotationCommentClient {

    private final InstallationClientProvider clientProvider;

    public GitHubAnnotationCommentClient(InstallationClientProvider clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public boolean deleteComment(long installationId, OwnerRepo ownerRepo, CommentLocation location) {
        try {
            OkHttpClient client = clientProvider.forInstallation(installationId);
            DeleteCommentAction action = new DeleteCommentAction(client);
            return switch (location.kind()) {
                case INLINE -> action.deleteReviewComment(ownerRepo.owner(), ownerRepo.repo(), location.commentId());
                case THREAD -> action.deleteIssueComment(ownerRepo.owner(), ownerRepo.repo(), location.commentId());
            };
        } catch (IOException | RuntimeException e) {
            throw new RemoteDeleteFailedException(location, e);
        }
    }
}
