package org.rostilos.prwizard.pipelineagent.review;

import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestFile;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps a comment event plus pull request context onto a {@link ReviewRequest}.
 */
@Component
public class ReviewRequestBuilder {

    private static final String WIZARD_REVIEW_BODY = "/wizard-review";

    public ReviewRequest forFeedback(CommentEvent event, PullRequestInfo pr, List<PullRequestFile> files,
                                     int inlineCommentCount) {
        String text = event.text() != null ? event.text().trim() : "";
        return switch (event.source()) {
            case ISSUE_COMMENT -> build(ReviewKind.ISSUE_COMMENT, null, null, text, null,
                    event.commentId(), event, pr, files, 0);
            case REVIEW_COMMENT -> build(ReviewKind.REVIEW_COMMENT, null, null, text, event.inline(),
                    event.commentId(), event, pr, files, 0);
            case REVIEW_SUBMITTED -> build(ReviewKind.REVIEW, text, event.reviewState(), null, null,
                    null, event, pr, files, inlineCommentCount);
        };
    }

    public ReviewRequest forWizardReview(CommentEvent event, PullRequestInfo pr, List<PullRequestFile> files) {
        return build(ReviewKind.WIZARD_REVIEW, null, null, WIZARD_REVIEW_BODY, null,
                null, event, pr, files, 0);
    }

    private ReviewRequest build(ReviewKind kind, String reviewBody, String reviewState, String commentBody,
                                CommentEvent.InlineContext inline, Long commentId, CommentEvent event,
                                PullRequestInfo pr, List<PullRequestFile> files, int inlineCommentCount) {
        return new ReviewRequest(
                kind,
                reviewBody,
                reviewState,
                commentBody,
                inline != null ? inline.path() : null,
                inline != null ? inline.diffHunk() : null,
                inline != null ? inline.position() : null,
                commentId,
                event.senderLogin(),
                event.pullRequestNumber(),
                pr.title(),
                pr.body(),
                pr.authorLogin(),
                event.repoFullName(),
                event.owner(),
                event.repo(),
                files,
                inlineCommentCount
        );
    }
}
