package org.rostilos.prwizard.pipelineagent.generic.processor;

import org.rostilos.prwizard.pipelineagent.generic.annotation.ReconciliationEngine;
import org.rostilos.prwizard.pipelineagent.generic.annotation.Resolution;
import org.rostilos.prwizard.pipelineagent.generic.command.CommandParser;
import org.rostilos.prwizard.pipelineagent.generic.command.CommandType;
import org.rostilos.prwizard.pipelineagent.generic.command.ParsedCommand;
import org.rostilos.prwizard.pipelineagent.generic.guard.BotLoopGuard;
import org.rostilos.prwizard.pipelineagent.generic.service.AnnotatedReplyService;
import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.rostilos.prwizard.pipelineagent.github.service.GitHubPullRequestService;
import org.rostilos.prwizard.pipelineagent.review.ReviewRequest;
import org.rostilos.prwizard.pipelineagent.review.ReviewRequestBuilder;
import org.rostilos.prwizard.pipelineagent.review.ReviewResponder;
import org.rostilos.prwizard.vcsclient.VcsClientException;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestFile;
import org.rostilos.prwizard.vcsclient.github.dto.PullRequestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Routes one comment event: bot guard, then decision commands, then {@code /wizard-review},
 * then ordinary feedback that gets an annotated reply.
 */
@Service
public class CommentEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommentEventProcessor.class);

    private final BotLoopGuard botLoopGuard;
    private final CommandParser commandParser;
    private final ReconciliationEngine reconciliationEngine;
    private final GitHubPullRequestService pullRequestService;
    private final ReviewRequestBuilder requestBuilder;
    private final ReviewResponder reviewResponder;
    private final AnnotatedReplyService replyService;

    public CommentEventProcessor(
            BotLoopGuard botLoopGuard,
            CommandParser commandParser,
            ReconciliationEngine reconciliationEngine,
            GitHubPullRequestService pullRequestService,
            ReviewRequestBuilder requestBuilder,
            ReviewResponder reviewResponder,
            AnnotatedReplyService replyService
    ) {
        this.botLoopGuard = botLoopGuard;
        this.commandParser = commandParser;
        this.reconciliationEngine = reconciliationEngine;
        this.pullRequestService = pullRequestService;
        this.requestBuilder = requestBuilder;
        this.reviewResponder = reviewResponder;
        this.replyService = replyService;
    }

    public void process(CommentEvent event) throws IOException {
        if (!botLoopGuard.admit(event)) {
            return;
        }

        if (event.isCommentEvent()) {
            Optional<ParsedCommand> command = commandParser.parse(event.text());
            if (command.isPresent() && command.get().type().isDecision()) {
                Resolution resolution = reconciliationEngine.handleCommand(command.get(), event);
                log.debug("{} {} -> {}", command.get().type(), command.get().code(), resolution);
                return;
            }
            if (command.isPresent() && command.get().type() == CommandType.WIZARD_REVIEW) {
                if (!event.onPullRequest()) {
                    log.info("/wizard-review on plain issue {}#{}, skipping", event.repoFullName(), event.pullRequestNumber());
                    return;
                }
                handleWizardReview(event);
                return;
            }
        }

        if (!event.onPullRequest()) {
            log.info("Comment on plain issue {}#{}, skipping", event.repoFullName(), event.pullRequestNumber());
            return;
        }
        if (event.text() == null || event.text().isBlank()) {
            log.info("Skipping {} {} with empty body", event.source(), event.commentId());
            return;
        }
        handleFeedback(event);
    }

    private void handleWizardReview(CommentEvent event) throws IOException {
        log.info("Wizard review requested by {} on {}#{}", event.senderLogin(), event.repoFullName(), event.pullRequestNumber());
        PullRequestInfo pr = resolvePullRequest(event);
        List<PullRequestFile> files = pullRequestService.listFiles(event.installationId(), event.ownerRepo(), event.pullRequestNumber());

        Optional<String> reply = reviewResponder.respond(requestBuilder.forWizardReview(event, pr, files));
        if (reply.isEmpty()) {
            log.warn("Wizard review for {}#{} returned no response", event.repoFullName(), event.pullRequestNumber());
            return;
        }
        replyService.postAnnotatedReply(event, reply.get())
                .ifPresent(code -> log.info("Posted wizard review {} on {}#{}", code, event.repoFullName(), event.pullRequestNumber()));
    }

    private void handleFeedback(CommentEvent event) throws IOException {
        int inlineCommentCount = 0;
        if (event.source() == CommentEvent.Source.REVIEW_SUBMITTED) {
            inlineCommentCount = countInlineComments(event);
            if (inlineCommentCount > 0) {
                log.info("Skipping review {} with {} inline comments; they are handled individually",
                        event.commentId(), inlineCommentCount);
                return;
            }
        }

        PullRequestInfo pr = resolvePullRequest(event);
        List<PullRequestFile> files = pullRequestService.listFiles(event.installationId(), event.ownerRepo(), event.pullRequestNumber());
        ReviewRequest request = requestBuilder.forFeedback(event, pr, files, inlineCommentCount);

        Optional<String> reply = reviewResponder.respond(request);
        if (reply.isEmpty()) {
            return;
        }
        replyService.postAnnotatedReply(event, reply.get())
                .ifPresent(code -> log.info("Replied to {} {} with annotation {}", event.source(), event.commentId(), code));
    }

    private int countInlineComments(CommentEvent event) {
        try {
            return pullRequestService.countReviewComments(event.installationId(), event.ownerRepo(),
                    event.pullRequestNumber(), event.commentId());
        } catch (IOException | VcsClientException e) {
            log.error("Could not count inline comments of review {}, assuming none: {}", event.commentId(), e.getMessage());
            return 0;
        }
    }

    private PullRequestInfo resolvePullRequest(CommentEvent event) throws IOException {
        if (event.pullRequest() != null) {
            return event.pullRequest();
        }
        return pullRequestService.getPullRequest(event.installationId(), event.ownerRepo(), event.pullRequestNumber());
    }
}
