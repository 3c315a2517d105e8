package org.rostilos.prwizard.pipelineagent.github.service;

import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.vcsclient.InstallationClientProvider;
import org.rostilos.prwizard.vcsclient.github.actions.CommentOnPullRequestAction;
import org.rostilos.prwizard.vcsclient.github.actions.GetPullRequestAction;
import org.rostilos.prwizard.vcsclient.github.actions.ListPullRequestFilesAction;
import org.rostilos.prwizard.vcsclient.github.actions.ListReviewCommentsAction;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestFile;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Pull request reads and comment posting on behalf of an App installation.
 */
@Service
public class GitHubPullRequestService {

    private final InstallationClientProvider clientProvider;

    public GitHubPullRequestService(InstallationClientProvider clientProvider) {
        this.clientProvider = clientProvider;
    }

    public PullRequestInfo getPullRequest(long installationId, OwnerRepo ownerRepo, int number) throws IOException {
        return new GetPullRequestAction(clientProvider.forInstallation(installationId))
                .getPullRequest(ownerRepo.owner(), ownerRepo.repo(), number);
    }

    public List<PullRequestFile> listFiles(long installationId, OwnerRepo ownerRepo, int number) throws IOException {
        return new ListPullRequestFilesAction(clientProvider.forInstallation(installationId))
                .listFiles(ownerRepo.owner(), ownerRepo.repo(), number);
    }

    public int countReviewComments(long installationId, OwnerRepo ownerRepo, int number, long reviewId)
            throws IOException {
        return new ListReviewCommentsAction(clientProvider.forInstallation(installationId))
                .countReviewComments(ownerRepo.owner(), ownerRepo.repo(), number, reviewId);
    }

    /** @return id of the new conversation comment */
    public long postThreadComment(long installationId, OwnerRepo ownerRepo, int number, String body)
            throws IOException {
        return new CommentOnPullRequestAction(clientProvider.forInstallation(installationId))
                .postComment(ownerRepo.owner(), ownerRepo.repo(), number, body);
    }

    /** @return id of the new inline reply */
    public long replyToReviewComment(long installationId, OwnerRepo ownerRepo, int number,
                                     long inReplyTo, String body) throws IOException {
        return new CommentOnPullRequestAction(clientProvider.forInstallation(installationId))
                .replyToReviewComment(ownerRepo.owner(), ownerRepo.repo(), number, inReplyTo, body);
    }
}
