package org.rostilos.prwizard.vcsclient.github.actions;

import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.prwizard.vcsclient.github.GitHubException;
import org.rostilos.prwizard.vcsclient.github.GitHubResponses;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GetPullRequestActionTest {

    @Mock
    private OkHttpClient okHttpClient;

    @Mock
    private Call call;

    private final ArgumentCaptor<Request> requestCaptor = ArgumentCaptor.forClass(Request.class);

    private GetPullRequestAction action;

    @BeforeEach
    void setUp() {
        action = new GetPullRequestAction(okHttpClient);
    }

    private void respondWith(int code, String body) throws IOException {
        when(okHttpClient.newCall(requestCaptor.capture())).thenReturn(call);
        when(call.execute()).thenAnswer(inv -> GitHubResponses.json(requestCaptor.getValue(), code, body));
    }

    @Test
    void testGetPullRequest_Success_MapsFields() throws IOException {
        respondWith(200, """
                {"number": 42, "title": "Add caching", "body": "Speeds up lookups",
                 "user": {"login": "alice"}}
                """);

        PullRequestInfo pr = action.getPullRequest("owner", "repo", 42);

        assertThat(pr).isEqualTo(new PullRequestInfo(42, "Add caching", "Speeds up lookups", "alice"));
        assertThat(requestCaptor.getValue().url().encodedPath()).isEqualTo("/repos/owner/repo/pulls/42");
    }

    @Test
    void testGetPullRequest_NullBody_MapsToNull() throws IOException {
        respondWith(200, "{\"number\": 42, \"title\": \"t\", \"body\": null, \"user\": {\"login\": \"bob\"}}");

        assertThat(action.getPullRequest("owner", "repo", 42).body()).isNull();
    }

    @Test
    void testGetPullRequest_NotFound_Throws() throws IOException {
        respondWith(404, "{\"message\":\"Not Found\"}");

        assertThatThrownBy(() -> action.getPullRequest("owner", "repo", 42))
                .isInstanceOf(GitHubException.class)
                .hasMessageContaining("404");
    }
}
