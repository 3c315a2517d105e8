package org.rostilos.prwizard.vcsclient.github;

import okhttp3.OkHttpClient;
import org.rostilos.prwizard.vcsclient.HttpAuthorizedClientFactory;
import org.rostilos.prwizard.vcsclient.InstallationClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link InstallationClientProvider} backed by GitHub App installation tokens.
 * Clients are cached per installation and rebuilt once the token is within
 * {@link #REFRESH_MARGIN} of its expiry.
 */
public class GitHubInstallationClientProvider implements InstallationClientProvider {

    private static final Logger log = LoggerFactory.getLogger(GitHubInstallationClientProvider.class);

    static final Duration REFRESH_MARGIN = Duration.ofMinutes(1);

    private final GitHubAppAuthService authService;
    private final HttpAuthorizedClientFactory clientFactory;
    private final Duration callTimeout;
    private final Clock clock;
    private final Map<Long, CachedClient> clients = new ConcurrentHashMap<>();

    public GitHubInstallationClientProvider(GitHubAppAuthService authService,
                                            HttpAuthorizedClientFactory clientFactory,
                                            Duration callTimeout,
                                            Clock clock) {
        this.authService = authService;
        this.clientFactory = clientFactory;
        this.callTimeout = callTimeout;
        this.clock = clock;
    }

    @Override
    public OkHttpClient forInstallation(long installationId) throws IOException {
        Instant now = clock.instant();
        CachedClient cached = clients.get(installationId);
        if (cached != null && now.isBefore(cached.expiresAt().minus(REFRESH_MARGIN))) {
            return cached.client();
        }

        GitHubAppAuthService.InstallationToken token = authService.getInstallationAccessToken(installationId);
        OkHttpClient client = clientFactory.createGitHubClient(token.token(), callTimeout);
        clients.put(installationId, new CachedClient(client, token.expiresAt()));
        log.debug("Refreshed client for installation {} (token expires {})", installationId, token.expiresAt());
        return client;
    }

    private record CachedClient(OkHttpClient client, Instant expiresAt) {}
}
