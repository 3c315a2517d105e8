package org.rostilos.prwizard.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class ListPullRequestFilesAction {

    private static final Logger log = LoggerFactory.getLogger(ListPullRequestFilesAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ListPullRequestFilesAction(OkHttpClient authorizedOkHttpClient) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
    }

    /**
     * All changed files of the pull request, following pages until a short page is returned.
     */
    public List<PullRequestFile> listFiles(String owner, String repo, int pullRequestNumber) throws IOException {
        List<PullRequestFile> files = new ArrayList<>();
        int page = 1;
        while (true) {
            String apiUrl = String.format("%s/repos/%s/%s/pulls/%d/files?per_page=%d&page=%d",
                    GitHubConfig.API_BASE, owner, repo, pullRequestNumber, GitHubConfig.MAX_PAGE_SIZE, page);
            JsonNode batch = fetch(apiUrl);
            if (!batch.isArray() || batch.isEmpty()) {
                break;
            }
            for (JsonNode f : batch) {
                files.add(new PullRequestFile(
                        f.path("filename").asText(),
                        f.path("status").asText(null),
                        f.path("additions").asInt(),
                        f.path("deletions").asInt(),
                        f.path("changes").asInt(),
                        f.hasNonNull("patch") ? f.get("patch").asText() : null
                ));
            }
            if (batch.size() < GitHubConfig.MAX_PAGE_SIZE) {
                break;
            }
            page++;
        }
        log.debug("Fetched {} files for {}/{}#{}", files.size(), owner, repo, pullRequestNumber);
        return files;
    }

    private JsonNode fetch(String apiUrl) throws IOException {
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
                throw new GitHubException("list pull request files", resp.code(), body);
            }
            return objectMapper.readTree(body);
        }
    }
}
