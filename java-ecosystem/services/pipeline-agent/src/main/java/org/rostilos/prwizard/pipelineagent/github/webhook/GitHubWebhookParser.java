package org.rostilos.prwizard.pipelineagent.github.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parser for GitHub comment and review webhook payloads.
 */
@Component
public class GitHubWebhookParser {

    private static final Logger log = LoggerFactory.getLogger(GitHubWebhookParser.class);

    public static final String ISSUE_COMMENT = "issue_comment";
    public static final String REVIEW_COMMENT = "pull_request_review_comment";
    public static final String REVIEW = "pull_request_review";

    /**
     * Parse a GitHub webhook payload.
     *
     * @param eventType  The X-GitHub-Event header value
     * @param deliveryId The X-GitHub-Delivery header value, may be null
     * @param payload    The raw JSON payload
     * @return the comment event, or empty for events and actions this service does not handle
     */
    public Optional<CommentEvent> parse(String eventType, String deliveryId, JsonNode payload) {
        if (eventType == null) {
            return Optional.empty();
        }
        String action = payload.path("action").asText("");

        return switch (eventType) {
            case ISSUE_COMMENT -> "created".equals(action)
                    ? parseComment(CommentEvent.Source.ISSUE_COMMENT, deliveryId, payload)
                    : Optional.empty();
            case REVIEW_COMMENT -> "created".equals(action)
                    ? parseComment(CommentEvent.Source.REVIEW_COMMENT, deliveryId, payload)
                    : Optional.empty();
            case REVIEW -> "submitted".equals(action)
                    ? parseReview(deliveryId, payload)
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    private Optional<CommentEvent> parseComment(CommentEvent.Source source, String deliveryId, JsonNode payload) {
        JsonNode comment = payload.path("comment");
        if (!comment.path("id").canConvertToLong()) {
            log.warn("{} payload without comment id (delivery {})", source, deliveryId);
            return Optional.empty();
        }

        int number;
        boolean onPullRequest;
        PullRequestInfo pullRequest = null;
        CommentEvent.InlineContext inline = null;
        if (source == CommentEvent.Source.ISSUE_COMMENT) {
            JsonNode issue = payload.path("issue");
            number = issue.path("number").asInt();
            onPullRequest = !issue.path("pull_request").isMissingNode() && !issue.path("pull_request").isNull();
        } else {
            pullRequest = parsePullRequest(payload.path("pull_request"));
            number = pullRequest.number();
            onPullRequest = true;
            inline = new CommentEvent.InlineContext(
                    comment.path("path").asText(null),
                    comment.path("diff_hunk").asText(null),
                    comment.path("position").canConvertToInt() ? comment.path("position").asInt() : null
            );
        }

        return build(source, deliveryId, payload, comment.path("id").asLong(), textOf(comment.path("body")),
                comment.path("user"), number, onPullRequest, pullRequest, inline, null);
    }

    private Optional<CommentEvent> parseReview(String deliveryId, JsonNode payload) {
        JsonNode review = payload.path("review");
        if (!review.path("id").canConvertToLong()) {
            log.warn("Review payload without review id (delivery {})", deliveryId);
            return Optional.empty();
        }
        PullRequestInfo pullRequest = parsePullRequest(payload.path("pull_request"));
        return build(CommentEvent.Source.REVIEW_SUBMITTED, deliveryId, payload, review.path("id").asLong(),
                textOf(review.path("body")), review.path("user"), pullRequest.number(), true, pullRequest, null,
                review.path("state").asText(null));
    }

    private Optional<CommentEvent> build(CommentEvent.Source source, String deliveryId, JsonNode payload,
                                         long commentId, String text, JsonNode author, int number,
                                         boolean onPullRequest, PullRequestInfo pullRequest,
                                         CommentEvent.InlineContext inline, String reviewState) {
        JsonNode repository = payload.path("repository");
        String owner = repository.path("owner").path("login").asText(null);
        String repo = repository.path("name").asText(null);
        if (owner == null || repo == null || number <= 0) {
            log.warn("{} payload without repository or number (delivery {})", source, deliveryId);
            return Optional.empty();
        }
        JsonNode installation = payload.path("installation").path("id");
        if (!installation.canConvertToLong()) {
            log.warn("{} payload for {}/{} has no installation id (delivery {})", source, owner, repo, deliveryId);
            return Optional.empty();
        }

        // Sender is the account that triggered the delivery; fall back to the author.
        JsonNode sender = payload.path("sender");
        JsonNode actor = sender.path("login").isTextual() ? sender : author;

        return Optional.of(new CommentEvent(
                source,
                deliveryId,
                commentId,
                text,
                actor.path("login").asText(null),
                actor.path("type").asText(null),
                owner,
                repo,
                repository.path("full_name").asText(owner + "/" + repo),
                number,
                onPullRequest,
                installation.asLong(),
                pullRequest,
                inline,
                reviewState
        ));
    }

    private PullRequestInfo parsePullRequest(JsonNode pr) {
        return new PullRequestInfo(
                pr.path("number").asInt(),
                pr.path("title").asText(null),
                textOf(pr.path("body")),
                pr.path("user").path("login").asText(null)
        );
    }

    private static String textOf(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
