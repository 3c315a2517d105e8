package org.rostilos.prwizard.pipelineagent.generic.processor;

import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs comment processing off the request thread. Failures end here as log entries;
 * nothing is reported back to GitHub.
 */
@Service
public class WebhookAsyncProcessor {

    private static final Logger log = LoggerFactory.getLogger(WebhookAsyncProcessor.class);

    private final CommentEventProcessor commentEventProcessor;

    public WebhookAsyncProcessor(CommentEventProcessor commentEventProcessor) {
        this.commentEventProcessor = commentEventProcessor;
    }

    @Async("webhookExecutor")
    public void processWebhookAsync(CommentEvent event) {
        try {
            commentEventProcessor.process(event);
        } catch (Exception e) {
            log.error("Error processing {} {} (delivery {}) on {}#{}", event.source(), event.commentId(),
                    event.deliveryId(), event.repoFullName(), event.pullRequestNumber(), e);
        }
    }
}
