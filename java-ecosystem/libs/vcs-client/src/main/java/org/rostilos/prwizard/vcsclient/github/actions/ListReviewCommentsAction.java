package org.rostilos.prwizard.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class ListReviewCommentsAction {

    private static final Logger log = LoggerFactory.getLogger(ListReviewCommentsAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ListReviewCommentsAction(OkHttpClient authorizedOkHttpClient) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
    }

    /**
     * Number of inline comments attached to a submitted review.
     */
    public int countReviewComments(String owner, String repo, int pullRequestNumber, long reviewId) throws IOException {
        int count = 0;
        int page = 1;
        while (true) {
            String apiUrl = String.format("%s/repos/%s/%s/pulls/%d/reviews/%d/comments?per_page=%d&page=%d",
                    GitHubConfig.API_BASE, owner, repo, pullRequestNumber, reviewId, GitHubConfig.MAX_PAGE_SIZE, page);
            Request req = new Request.Builder()
                    .url(apiUrl)
                    .header("Accept", GitHubConfig.ACCEPT_HEADER)
                    .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                    .get()
                    .build();

            int batchSize;
            try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
                String body = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    log.warn("Failed to list comments of review {}: {} - {}", reviewId, resp.code(), body);
                    throw new GitHubException("list review comments", resp.code(), body);
                }
                JsonNode batch = objectMapper.readTree(body);
                batchSize = batch.isArray() ? batch.size() : 0;
            }
            count += batchSize;
            if (batchSize < GitHubConfig.MAX_PAGE_SIZE) {
                return count;
            }
            page++;
        }
    }
}
