package org.rostilos.prwizard.pipelineagent.generic.service;

import org.rostilos.prwizard.core.exception.DuplicateCodeException;
import org.rostilos.prwizard.core.exception.StoreUnavailableException;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.pipelineagent.generic.annotation.AnnotationRegistry;
import org.rostilos.prwizard.pipelineagent.generic.annotation.DecisionFooter;
import org.rostilos.prwizard.pipelineagent.generic.exception.CodeAllocationFailedException;
import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.rostilos.prwizard.pipelineagent.github.service.GitHubPullRequestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Posts a reviewer reply with its decision footer and records it as a pending annotation.
 * <p>
 * Registry failures never block the reply: without a code the reply is posted plain, and a
 * reply whose record cannot be stored stays on the pull request untracked.
 */
@Service
public class AnnotatedReplyService {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedReplyService.class);

    private final AnnotationRegistry registry;
    private final GitHubPullRequestService pullRequestService;
    private final long ttlSeconds;

    public AnnotatedReplyService(
            AnnotationRegistry registry,
            GitHubPullRequestService pullRequestService,
            @Value("${prwizard.annotations.ttl-seconds:120}") long ttlSeconds
    ) {
        this.registry = registry;
        this.pullRequestService = pullRequestService;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * Reply to {@code event}: inline comments get a threaded inline reply, everything else a
     * conversation comment.
     *
     * @return the annotation code if the reply is tracked
     */
    public Optional<String> postAnnotatedReply(CommentEvent event, String replyText) throws IOException {
        OwnerRepo ownerRepo = event.ownerRepo();

        String code = null;
        try {
            code = registry.allocateCode();
        } catch (CodeAllocationFailedException | StoreUnavailableException e) {
            log.warn("Posting reply on {}#{} without a decision window: {}",
                    ownerRepo.fullName(), event.pullRequestNumber(), e.getMessage());
        }

        String body = code != null ? DecisionFooter.append(replyText, code, ttlSeconds) : replyText;
        CommentLocation posted = post(event, ownerRepo, body);
        if (code == null) {
            return Optional.empty();
        }

        try {
            registry.registerAnnotation(code, posted, ownerRepo, event.pullRequestNumber(),
                    event.installationId(), ttlSeconds);
            return Optional.of(code);
        } catch (DuplicateCodeException | StoreUnavailableException e) {
            log.warn("Reply {} on {}#{} is posted but untracked: {}",
                    posted, ownerRepo.fullName(), event.pullRequestNumber(), e.getMessage());
            return Optional.empty();
        }
    }

    private CommentLocation post(CommentEvent event, OwnerRepo ownerRepo, String body) throws IOException {
        if (event.source() == CommentEvent.Source.REVIEW_COMMENT) {
            long id = pullRequestService.replyToReviewComment(event.installationId(), ownerRepo,
                    event.pullRequestNumber(), event.commentId(), body);
            return CommentLocation.inline(id);
        }
        long id = pullRequestService.postThreadComment(event.installationId(), ownerRepo,
                event.pullRequestNumber(), body);
        return CommentLocation.thread(id);
    }
}
