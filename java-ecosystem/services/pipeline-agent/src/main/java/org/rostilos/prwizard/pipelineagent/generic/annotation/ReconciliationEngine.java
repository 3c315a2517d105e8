package org.rostilos.prwizard.pipelineagent.generic.annotation;

import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.rostilos.prwizard.core.service.annotation.PendingAnnotationStore;
import org.rostilos.prwizard.pipelineagent.generic.command.ParsedCommand;
import org.rostilos.prwizard.pipelineagent.generic.exception.RemoteDeleteFailedException;
import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves pending annotations to accepted, rejected or expired.
 * <p>
 * Every path claims the record with {@link PendingAnnotationStore#delete(String)} before touching
 * the platform. Only the caller whose delete removed the row goes on to delete comments; everyone
 * else gets {@link Resolution#NOT_FOUND} and does nothing.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final PendingAnnotationStore store;
    private final AnnotationCommentClient commentClient;

    public ReconciliationEngine(PendingAnnotationStore store, AnnotationCommentClient commentClient) {
        this.store = store;
        this.commentClient = commentClient;
    }

    /**
     * Apply an {@code /accept} or {@code /reject} command.
     *
     * @param command decision command
     * @param event   the comment that carried the command; it is deleted once the decision is applied
     */
    public Resolution handleCommand(ParsedCommand command, CommentEvent event) {
        if (!command.type().isDecision()) {
            throw new IllegalArgumentException("Not a decision command: " + command.type());
        }
        String code = command.code();

        Optional<PendingAnnotation> pending = store.get(code);
        if (pending.isEmpty()) {
            log.info("Ignoring {} {}: code is not pending", command.type(), code);
            return Resolution.NOT_FOUND;
        }
        PendingAnnotation annotation = pending.get();

        if (!store.delete(code)) {
            log.info("Ignoring {} {}: resolved concurrently", command.type(), code);
            return Resolution.NOT_FOUND;
        }

        Resolution resolution;
        switch (command.type()) {
            case ACCEPT -> resolution = Resolution.ACCEPTED;
            case REJECT -> {
                deleteQuietly(annotation.getInstallationId(), annotation.getOwnerRepo(), annotation.getCommentLocation(), code);
                resolution = Resolution.REJECTED;
            }
            default -> throw new IllegalStateException("Unexpected command " + command.type());
        }
        log.info("Annotation {} {} by {} on {}#{}", code, resolution, event.senderLogin(),
                annotation.getOwnerRepo().fullName(), annotation.getPullRequestNumber());

        if (event.isCommentEvent()) {
            deleteQuietly(event.installationId(), event.ownerRepo(), event.commentLocation(), code);
        }
        return resolution;
    }

    /**
     * Retire an annotation whose decision window has lapsed.
     */
    public Resolution expire(PendingAnnotation annotation) {
        String code = annotation.getCode();
        if (!store.delete(code)) {
            log.warn("Expired annotation {} was resolved before the sweep reached it", code);
            return Resolution.NOT_FOUND;
        }
        deleteQuietly(annotation.getInstallationId(), annotation.getOwnerRepo(), annotation.getCommentLocation(), code);
        log.info("Annotation {} EXPIRED on {}#{}", code,
                annotation.getOwnerRepo().fullName(), annotation.getPullRequestNumber());
        return Resolution.EXPIRED;
    }

    private void deleteQuietly(long installationId, OwnerRepo ownerRepo, CommentLocation location, String code) {
        try {
            if (!commentClient.deleteComment(installationId, ownerRepo, location)) {
                log.debug("Comment {} for {} was already deleted", location, code);
            }
        } catch (RemoteDeleteFailedException e) {
            log.warn("Annotation {}: {}", code, e.getMessage());
        }
    }
}
