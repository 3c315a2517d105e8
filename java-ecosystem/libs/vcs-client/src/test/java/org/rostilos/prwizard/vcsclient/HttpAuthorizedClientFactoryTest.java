package org.rostilos.prwizard.vcsclient;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpAuthorizedClientFactoryTest {

    private final HttpAuthorizedClientFactory factory = new HttpAuthorizedClientFactory();

    @Test
    void testCreateGitHubClient_AppliesTimeoutsAndInterceptor() {
        OkHttpClient client = factory.createGitHubClient("ghs_token", Duration.ofSeconds(15));

        assertThat(client.callTimeoutMillis()).isEqualTo(15_000);
        assertThat(client.connectTimeoutMillis()).isEqualTo(15_000);
        assertThat(client.readTimeoutMillis()).isEqualTo(15_000);
        assertThat(client.interceptors()).hasSize(1);
    }

    @Test
    void testCreateGitHubClient_SharesConnectionPoolAcrossTokens() {
        OkHttpClient first = factory.createGitHubClient("ghs_first", Duration.ofSeconds(15));
        OkHttpClient refreshed = factory.createGitHubClient("ghs_second", Duration.ofSeconds(5));

        assertThat(refreshed).isNotSameAs(first);
        assertThat(refreshed.connectionPool()).isSameAs(first.connectionPool());
        assertThat(refreshed.dispatcher()).isSameAs(first.dispatcher());
        assertThat(first.interceptors()).hasSize(1);
        assertThat(refreshed.interceptors()).hasSize(1);
    }

    @Test
    void testCreateGitHubClient_BlankToken_Throws() {
        assertThatThrownBy(() -> factory.createGitHubClient(" ", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.createGitHubClient(null, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
