package org.rostilos.prwizard.pipelineagent.config;

import okhttp3.OkHttpClient;
import org.rostilos.prwizard.vcsclient.HttpAuthorizedClientFactory;
import org.rostilos.prwizard.vcsclient.InstallationClientProvider;
import org.rostilos.prwizard.vcsclient.VcsClientException;
import org.rostilos.prwizard.vcsclient.github.GitHubAppAuthService;
import org.rostilos.prwizard.vcsclient.github.GitHubConfig;
import org.rostilos.prwizard.vcsclient.github.GitHubInstallationClientProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.random.RandomGenerator;

@Configuration
public class GitHubAppConfig {

    private static final Logger log = LoggerFactory.getLogger(GitHubAppConfig.class);

    @Value("${prwizard.github.app.id:}")
    private String appId;

    @Value("${prwizard.github.app.private-key-path:}")
    private String privateKeyPath;

    @Value("${prwizard.github.call-timeout-seconds:15}")
    private int callTimeoutSeconds;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator annotationCodeRandom() {
        return new SecureRandom();
    }

    /**
     * Installation clients for the configured GitHub App. Without an App id and key the service
     * still starts, but every GitHub call fails with a {@link VcsClientException}.
     */
    @Bean
    public InstallationClientProvider installationClientProvider(HttpAuthorizedClientFactory clientFactory,
                                                                 Clock clock) {
        if (appId == null || appId.isBlank() || privateKeyPath == null || privateKeyPath.isBlank()) {
            log.warn("GitHub App id or private key path is not configured; GitHub calls are disabled");
            return installationId -> {
                throw new VcsClientException("GitHub App is not configured, cannot act for installation " + installationId);
            };
        }

        PrivateKey privateKey;
        try {
            privateKey = GitHubAppAuthService.loadPrivateKey(Path.of(privateKeyPath));
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot load GitHub App private key from " + privateKeyPath, e);
        }

        Duration callTimeout = Duration.ofSeconds(callTimeoutSeconds);
        OkHttpClient authHttpClient = new OkHttpClient.Builder()
                .callTimeout(callTimeout)
                .build();
        GitHubAppAuthService authService = new GitHubAppAuthService(
                appId, privateKey, authHttpClient, GitHubConfig.API_BASE, clock);
        log.info("GitHub App {} configured (call timeout {}s)", appId, callTimeoutSeconds);
        return new GitHubInstallationClientProvider(authService, clientFactory, callTimeout, clock);
    }
}
