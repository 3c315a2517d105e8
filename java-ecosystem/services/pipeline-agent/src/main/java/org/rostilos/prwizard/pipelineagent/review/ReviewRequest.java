package org.rostilos.prwizard.pipelineagent.review;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestFile;

import java.util.List;

/**
 * Body of the review backend's {@code /analyze-review} call.
 */
public record ReviewRequest(
        @JsonProperty("kind") ReviewKind kind,
        @JsonProperty("review_body") String reviewBody,
        @JsonProperty("review_state") String reviewState,
        @JsonProperty("comment_body") String commentBody,
        @JsonProperty("comment_path") String commentPath,
        @JsonProperty("comment_diff_hunk") String commentDiffHunk,
        @JsonProperty("comment_position") Integer commentPosition,
        @JsonProperty("comment_id") Long commentId,
        @JsonProperty("reviewer_login") String reviewerLogin,
        @JsonProperty("pr_number") int prNumber,
        @JsonProperty("pr_title") String prTitle,
        @JsonProperty("pr_body") String prBody,
        @JsonProperty("pr_author_login") String prAuthorLogin,
        @JsonProperty("repo_full_name") String repoFullName,
        @JsonProperty("repo_owner") String repoOwner,
        @JsonProperty("repo_name") String repoName,
        @JsonProperty("files") List<PullRequestFile> files,
        @JsonProperty("inline_comment_count") int inlineCommentCount
) {}
