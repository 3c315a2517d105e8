package org.rostilos.prwizard.vcsclient.github.actions;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Deletes pull request comments. A comment that is already gone (404) is reported as
 * {@code false} rather than an error so repeated deletes are harmless.
 */
public class DeleteCommentAction {

    private static final Logger log = LoggerFactory.getLogger(DeleteCommentAction.class);
    private final OkHttpClient authorizedOkHttpClient;

    public DeleteCommentAction(OkHttpClient authorizedOkHttpClient) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
    }

    /** Conversation comment: {@code DELETE /repos/{owner}/{repo}/issues/comments/{id}}. */
    public boolean deleteIssueComment(String owner, String repo, long commentId) throws IOException {
        String apiUrl = String.format("%s/repos/%s/%s/issues/comments/%d",
                GitHubConfig.API_BASE, owner, repo, commentId);
        return delete(apiUrl, commentId, "delete issue comment");
    }

    /** Inline review comment: {@code DELETE /repos/{owner}/{repo}/pulls/comments/{id}}. */
    public boolean deleteReviewComment(String owner, String repo, long commentId) throws IOException {
        String apiUrl = String.format("%s/repos/%s/%s/pulls/comments/%d",
                GitHubConfig.API_BASE, owner, repo, commentId);
        return delete(apiUrl, commentId, "delete review comment");
    }

    private boolean delete(String apiUrl, long commentId, String operation) throws IOException {
        Request req = new Request.Builder()
                .url(apiUrl)
                .header("Accept", GitHubConfig.ACCEPT_HEADER)
                .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                .delete()
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (resp.isSuccessful()) {
                log.debug("Deleted comment {}", commentId);
                return true;
            }
            if (resp.code() == 404) {
                log.debug("Comment {} already gone", commentId);
                return false;
            }
            String respBody = resp.body() != null ? resp.body().string() : "";
            log.warn("Failed to delete comment {}: {} - {}", commentId, resp.code(), respBody);
            throw new GitHubException(operation, resp.code(), respBody);
        }
    }
}
