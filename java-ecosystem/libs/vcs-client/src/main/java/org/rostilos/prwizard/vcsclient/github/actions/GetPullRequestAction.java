package org.rostilos.prwizard.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class GetPullRequestAction {

    private static final Logger log = LoggerFactory.getLogger(GetPullRequestAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GetPullRequestAction(OkHttpClient authorizedOkHttpClient) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
    }

    public PullRequestInfo getPullRequest(String owner, String repo, int pullRequestNumber) throws IOException {
        String apiUrl = String.format("%s/repos/%s/%s/pulls/%d",
                GitHubConfig.API_BASE, owner, repo, pullRequestNumber);

        Request req = new Request.Builder()
                .url(apiUrl)
                .header("Accept", GitHubConfig.ACCEPT_HEADER)
                .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                .get()
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                log.warn("GitHub returned non-success response {} for URL {}: {}", resp.code(), apiUrl, body);
                throw new GitHubException("get pull request", resp.code(), body);
            }
            JsonNode pr = objectMapper.readTree(body);
            return new PullRequestInfo(
                    pr.path("number").asInt(pullRequestNumber),
                    pr.path("title").asText(null),
                    pr.path("body").isNull() ? null : pr.path("body").asText(null),
                    pr.path("user").path("login").asText(null)
            );
        }
    }
}
