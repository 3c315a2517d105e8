package org.rostilos.prwizard.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

public class CommentOnPullRequestAction {

    private static final Logger log = LoggerFactory.getLogger(CommentOnPullRequestAction.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CommentOnPullRequestAction(OkHttpClient authorizedOkHttpClient) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
    }

    /**
     * Post a conversation comment on the pull request.
     *
     * @return id of the created comment
     */
    public long postComment(String owner, String repo, int pullRequestNumber, String body) throws IOException {
        String apiUrl = String.format("%s/repos/%s/%s/issues/%d/comments",
                GitHubConfig.API_BASE, owner, repo, pullRequestNumber);
        return post(apiUrl, body, "post comment");
    }

    /**
     * Reply in the thread of an existing inline review comment.
     *
     * @return id of the created review comment
     */
    public long replyToReviewComment(String owner, String repo, int pullRequestNumber,
                                     long commentId, String body) throws IOException {
        String apiUrl = String.format("%s/repos/%s/%s/pulls/%d/comments/%d/replies",
                GitHubConfig.API_BASE, owner, repo, pullRequestNumber, commentId);
        return post(apiUrl, body, "reply to review comment");
    }

    private long post(String apiUrl, String body, String operation) throws IOException {
        Request req = new Request.Builder()
                .url(apiUrl)
                .header("Accept", GitHubConfig.ACCEPT_HEADER)
                .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                .post(RequestBody.create(objectMapper.writeValueAsString(Map.of("body", body)), JSON))
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            String respBody = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                log.warn("GitHub returned non-success response {} for URL {}: {}", resp.code(), apiUrl, respBody);
                throw new GitHubException(operation, resp.code(), respBody);
            }
            JsonNode created = objectMapper.readTree(respBody);
            JsonNode id = created.path("id");
            if (!id.canConvertToLong()) {
                throw new GitHubException("GitHub response to " + operation + " has no comment id");
            }
            return id.asLong();
        }
    }
}
