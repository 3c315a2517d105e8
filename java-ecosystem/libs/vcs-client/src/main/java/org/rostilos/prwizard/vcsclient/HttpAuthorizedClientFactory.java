package org.rostilos.prwizard.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class HttpAuthorizedClientFactory {

    /** Owner of the connection pool and dispatcher shared by every installation client. */
    private final OkHttpClient baseClient = new OkHttpClient();

    /**
     * Create an OkHttpClient configured for GitHub API with bearer token authentication.
     * Every request gets the GitHub media type and API version headers.
     *
     * @param accessToken installation access token
     * @param callTimeout upper bound for a whole call, also used for connect/read/write
     * @return configured OkHttpClient for GitHub API
     */
    public OkHttpClient createGitHubClient(String accessToken, Duration callTimeout) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return baseClient.newBuilder()
                .connectTimeout(callTimeout)
                .readTimeout(callTimeout)
                .writeTimeout(callTimeout)
                .callTimeout(callTimeout)
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + accessToken)
                            .header("Accept", GitHubConfig.ACCEPT_HEADER)
                            .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
