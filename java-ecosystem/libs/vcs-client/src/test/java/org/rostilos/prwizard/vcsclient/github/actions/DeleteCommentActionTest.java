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

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeleteCommentActionTest {

    @Mock
    private OkHttpClient okHttpClient;

    @Mock
    private Call call;

    private final ArgumentCaptor<Request> requestCaptor = ArgumentCaptor.forClass(Request.class);

    private DeleteCommentAction action;

    @BeforeEach
    void setUp() {
        action = new DeleteCommentAction(okHttpClient);
    }

    private void respondWith(int code, String body) throws IOException {
        when(okHttpClient.newCall(requestCaptor.capture())).thenReturn(call);
        when(call.execute()).thenAnswer(inv -> GitHubResponses.json(requestCaptor.getValue(), code, body));
    }

    @Test
    void testDeleteIssueComment_NoContent_ReturnsTrue() throws IOException {
        respondWith(204, "");

        assertThat(action.deleteIssueComment("owner", "repo", 42L)).isTrue();
        Request sent = requestCaptor.getValue();
        assertThat(sent.method()).isEqualTo("DELETE");
        assertThat(sent.url().encodedPath()).isEqualTo("/repos/owner/repo/issues/comments/42");
    }

    @Test
    void testDeleteReviewComment_UsesPullsEndpoint() throws IOException {
        respondWith(204, "");

        assertThat(action.deleteReviewComment("owner", "repo", 43L)).isTrue();
        assertThat(requestCaptor.getValue().url().encodedPath()).isEqualTo("/repos/owner/repo/pulls/comments/43");
    }

    @Test
    void testDelete_AlreadyGone_ReturnsFalse() throws IOException {
        respondWith(404, "{\"message\":\"Not Found\"}");

        assertThat(action.deleteIssueComment("owner", "repo", 42L)).isFalse();
    }

    @Test
    void testDelete_ServerError_ThrowsGitHubException() throws IOException {
        respondWith(502, "Bad Gateway");

        assertThatThrownBy(() -> action.deleteReviewComment("owner", "repo", 43L))
                .isInstanceOf(GitHubException.class)
                .satisfies(e -> assertThat(((GitHubException) e).getStatusCode()).isEqualTo(502));
    }

    @Test
    void testDelete_Timeout_PropagatesIOException() throws IOException {
        when(okHttpClient.newCall(requestCaptor.capture())).thenReturn(call);
        when(call.execute()).thenThrow(new java.io.InterruptedIOException("timeout"));

        assertThatThrownBy(() -> action.deleteIssueComment("owner", "repo", 42L))
                .isInstanceOf(IOException.class)
                .hasMessage("timeout");
    }
}
