package org.rostilos.prwizard.vcsclient.github;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.prwizard.vcsclient.HttpAuthorizedClientFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitHubInstallationClientProviderTest {

    private static final Instant START = Instant.parse("2026-10-19T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    @Mock
    private GitHubAppAuthService authService;

    @Mock
    private HttpAuthorizedClientFactory clientFactory;

    private final OkHttpClient firstClient = new OkHttpClient();
    private final OkHttpClient secondClient = new OkHttpClient();
    private SteppingClock clock;
    private GitHubInstallationClientProvider provider;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(START);
        provider = new GitHubInstallationClientProvider(authService, clientFactory, TIMEOUT, clock);
    }

    @Test
    void testForInstallation_ReusesClientWhileTokenIsFresh() throws IOException {
        when(authService.getInstallationAccessToken(7L))
                .thenReturn(new GitHubAppAuthService.InstallationToken("t1", START.plusSeconds(3600)));
        when(clientFactory.createGitHubClient("t1", TIMEOUT)).thenReturn(firstClient);

        OkHttpClient a = provider.forInstallation(7L);
        clock.advance(Duration.ofMinutes(30));
        OkHttpClient b = provider.forInstallation(7L);

        assertThat(a).isSameAs(firstClient);
        assertThat(b).isSameAs(firstClient);
        verify(authService, times(1)).getInstallationAccessToken(7L);
    }

    @Test
    void testForInstallation_RefreshesWithinOneMinuteOfExpiry() throws IOException {
        when(authService.getInstallationAccessToken(7L))
                .thenReturn(new GitHubAppAuthService.InstallationToken("t1", START.plusSeconds(3600)))
                .thenReturn(new GitHubAppAuthService.InstallationToken("t2", START.plusSeconds(7200)));
        when(clientFactory.createGitHubClient("t1", TIMEOUT)).thenReturn(firstClient);
        when(clientFactory.createGitHubClient("t2", TIMEOUT)).thenReturn(secondClient);

        provider.forInstallation(7L);
        clock.advance(Duration.ofSeconds(3600 - 59));

        assertThat(provider.forInstallation(7L)).isSameAs(secondClient);
        verify(authService, times(2)).getInstallationAccessToken(7L);
    }

    @Test
    void testForInstallation_CachesPerInstallation() throws IOException {
        when(authService.getInstallationAccessToken(anyLong()))
                .thenAnswer(inv -> new GitHubAppAuthService.InstallationToken(
                        "t" + inv.getArgument(0), START.plusSeconds(3600)));
        when(clientFactory.createGitHubClient("t1", TIMEOUT)).thenReturn(firstClient);
        when(clientFactory.createGitHubClient("t2", TIMEOUT)).thenReturn(secondClient);

        assertThat(provider.forInstallation(1L)).isSameAs(firstClient);
        assertThat(provider.forInstallation(2L)).isSameAs(secondClient);
    }

    @Test
    void testForInstallation_TokenExchangeFails_Propagates() throws IOException {
        when(authService.getInstallationAccessToken(7L)).thenThrow(new IOException("connect timed out"));

        assertThatThrownBy(() -> provider.forInstallation(7L))
                .isInstanceOf(IOException.class)
                .hasMessage("connect timed out");
        verifyNoInteractions(clientFactory);
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
