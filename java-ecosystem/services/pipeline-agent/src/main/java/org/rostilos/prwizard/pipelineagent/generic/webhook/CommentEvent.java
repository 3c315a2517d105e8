package org.rostilos.prwizard.pipelineagent.generic.webhook;

import org.rostilos.prwizard.core.model.annotation.CommentKind;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;

/**
 * A human-authored comment or review on a pull request, reduced to what the reviewer needs.
 * Provider-specific parsers convert raw webhook payloads into this common format.
 */
public record CommentEvent(
    Source source,

    String deliveryId,

    /** Comment id, or review id for {@link Source#REVIEW_SUBMITTED}. */
    long commentId,

    String text,

    String senderLogin,

    /** Account type reported by the platform ("User", "Bot", "Organization"). */
    String senderType,

    String owner,

    String repo,

    String repoFullName,

    int pullRequestNumber,

    /** False for conversation comments on plain issues. */
    boolean onPullRequest,

    long installationId,

    /** Present when the payload embeds the pull request; conversation comments only carry the number. */
    PullRequestInfo pullRequest,

    InlineContext inline,

    String reviewState
) {

    public enum Source {
        ISSUE_COMMENT,
        REVIEW_COMMENT,
        REVIEW_SUBMITTED
    }

    /**
     * Diff position of an inline review comment.
     */
    public record InlineContext(
        String path,
        String diffHunk,
        Integer position
    ) {}

    public OwnerRepo ownerRepo() {
        return new OwnerRepo(owner, repo);
    }

    /**
     * Where the triggering comment lives; submitted reviews have no deletable comment.
     */
    public CommentLocation commentLocation() {
        return switch (source) {
            case ISSUE_COMMENT -> new CommentLocation(commentId, CommentKind.THREAD);
            case REVIEW_COMMENT -> new CommentLocation(commentId, CommentKind.INLINE);
            case REVIEW_SUBMITTED -> throw new IllegalStateException("A submitted review is not a comment");
        };
    }

    public boolean isCommentEvent() {
        return source != Source.REVIEW_SUBMITTED;
    }
}
