package org.rostilos.prwizard.pipelineagent.generic.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.prwizard.core.exception.DuplicateCodeException;
import org.rostilos.prwizard.core.exception.StoreUnavailableException;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.pipelineagent.generic.annotation.AnnotationRegistry;
import org.rostilos.prwizard.pipelineagent.generic.exception.CodeAllocationFailedException;
import org.rostilos.prwizard.pipelineagent.github.service.GitHubPullRequestService;
import org.rostilos.prwizard.pipelineagent.support.CommentEvents;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnnotatedReplyServiceTest {

    private static final OwnerRepo REPO = new OwnerRepo(CommentEvents.OWNER, CommentEvents.REPO);
    private static final long INSTALLATION = CommentEvents.INSTALLATION_ID;

    @Mock
    private AnnotationRegistry registry;

    @Mock
    private GitHubPullRequestService pullRequestService;

    private AnnotatedReplyService service;

    @BeforeEach
    void setUp() {
        service = new AnnotatedReplyService(registry, pullRequestService, 120);
    }

    @Test
    void shouldReplyInlineToReviewCommentAndRegisterInlineLocation() throws IOException {
        when(registry.allocateCode()).thenReturn("Q7X2P9");
        when(pullRequestService.replyToReviewComment(eq(INSTALLATION), eq(REPO), eq(42), eq(555L), anyString()))
                .thenReturn(1001L);

        assertThat(service.postAnnotatedReply(CommentEvents.reviewComment(555L, "Why?"), "Because."))
                .contains("Q7X2P9");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(pullRequestService).replyToReviewComment(eq(INSTALLATION), eq(REPO), eq(42), eq(555L), body.capture());
        assertThat(body.getValue()).startsWith("Because.").contains("/accept Q7X2P9").contains("within 2 minutes");
        verify(registry).registerAnnotation("Q7X2P9", CommentLocation.inline(1001L), REPO, 42, INSTALLATION, 120);
    }

    @Test
    void shouldPostThreadCommentForConversationComments() throws IOException {
        when(registry.allocateCode()).thenReturn("ABC123");
        when(pullRequestService.postThreadComment(eq(INSTALLATION), eq(REPO), eq(42), anyString())).thenReturn(2002L);

        assertThat(service.postAnnotatedReply(CommentEvents.issueComment(901L, "Question"), "Answer")).contains("ABC123");

        verify(registry).registerAnnotation("ABC123", CommentLocation.thread(2002L), REPO, 42, INSTALLATION, 120);
    }

    @Test
    void shouldPostThreadCommentForSubmittedReviews() throws IOException {
        when(registry.allocateCode()).thenReturn("ABC123");
        when(pullRequestService.postThreadComment(eq(INSTALLATION), eq(REPO), eq(42), anyString())).thenReturn(2003L);

        service.postAnnotatedReply(CommentEvents.reviewSubmitted(777L, "Overall fine"), "Thanks");

        verify(pullRequestService, never()).replyToReviewComment(anyLong(), any(), anyInt(), anyLong(), anyString());
    }

    @Test
    void shouldPostPlainReplyWhenNoCodeCanBeAllocated() throws IOException {
        when(registry.allocateCode()).thenThrow(new CodeAllocationFailedException(5, null));
        when(pullRequestService.postThreadComment(INSTALLATION, REPO, 42, "Answer")).thenReturn(2004L);

        assertThat(service.postAnnotatedReply(CommentEvents.issueComment(901L, "Question"), "Answer")).isEmpty();

        verify(registry, never()).registerAnnotation(anyString(), any(), any(), anyInt(), anyLong(), anyLong());
    }

    @Test
    void shouldPostPlainReplyWhenStoreIsDownBeforePosting() throws IOException {
        when(registry.allocateCode()).thenThrow(new StoreUnavailableException("get", "ABC123", null));
        when(pullRequestService.postThreadComment(INSTALLATION, REPO, 42, "Answer")).thenReturn(2005L);

        assertThat(service.postAnnotatedReply(CommentEvents.issueComment(901L, "Question"), "Answer")).isEmpty();
    }

    @Test
    void shouldLeaveReplyUntrackedWhenRegistrationFails() throws IOException {
        when(registry.allocateCode()).thenReturn("ABC123");
        when(pullRequestService.postThreadComment(eq(INSTALLATION), eq(REPO), eq(42), anyString())).thenReturn(2006L);
        doThrow(new DuplicateCodeException("ABC123", null)).when(registry)
                .registerAnnotation("ABC123", CommentLocation.thread(2006L), REPO, 42, INSTALLATION, 120);

        assertThat(service.postAnnotatedReply(CommentEvents.issueComment(901L, "Question"), "Answer")).isEmpty();
    }

    @Test
    void shouldPropagatePostingFailuresWithoutRegistering() throws IOException {
        when(registry.allocateCode()).thenReturn("ABC123");
        when(pullRequestService.postThreadComment(eq(INSTALLATION), eq(REPO), eq(42), anyString()))
                .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(
                        () -> service.postAnnotatedReply(CommentEvents.issueComment(901L, "Question"), "Answer"))
                .isInstanceOf(IOException.class);
        verify(registry, never()).registerAnnotation(anyString(), any(), any(), anyInt(), anyLong(), anyLong());
    }
}
