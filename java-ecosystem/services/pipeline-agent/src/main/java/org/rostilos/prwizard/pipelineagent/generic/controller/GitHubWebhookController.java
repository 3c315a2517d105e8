package org.rostilos.prwizard.pipelineagent.generic.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.prwizard.pipelineagent.generic.processor.WebhookAsyncProcessor;
import org.rostilos.prwizard.pipelineagent.generic.service.WebhookDeduplicationService;
import org.rostilos.prwizard.pipelineagent.generic.webhook.CommentEvent;
import org.rostilos.prwizard.pipelineagent.generic.webhook.WebhookSignatureVerifier;
import org.rostilos.prwizard.pipelineagent.github.webhook.GitHubWebhookParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Receives GitHub App webhooks and hands supported comment events to async processing.
 * <p>
 * Webhook URL: {@code /api/webhooks/github}
 */
@RestController
@RequestMapping("/api/webhooks")
public class GitHubWebhookController {

    private static final Logger log = LoggerFactory.getLogger(GitHubWebhookController.class);

    private final WebhookSignatureVerifier signatureVerifier;
    private final GitHubWebhookParser parser;
    private final WebhookDeduplicationService deduplicationService;
    private final WebhookAsyncProcessor asyncProcessor;
    private final ObjectMapper objectMapper;

    public GitHubWebhookController(
            WebhookSignatureVerifier signatureVerifier,
            GitHubWebhookParser parser,
            WebhookDeduplicationService deduplicationService,
            WebhookAsyncProcessor asyncProcessor,
            ObjectMapper objectMapper
    ) {
        this.signatureVerifier = signatureVerifier;
        this.parser = parser;
        this.deduplicationService = deduplicationService;
        this.asyncProcessor = asyncProcessor;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/github")
    public ResponseEntity<?> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody byte[] body
    ) {
        if (!signatureVerifier.isValid(body, signature)) {
            log.warn("Rejected {} delivery {}: signature mismatch", eventType, deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "invalid_signature", "message", "Webhook signature does not match"));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} delivery {}: {}", eventType, deliveryId, e.getOriginalMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "invalid_payload", "message", "Request body is not valid JSON"));
        } catch (IOException e) {
            log.error("Error reading webhook body", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "processing_error", "message", e.getMessage()));
        }

        Optional<CommentEvent> event = parser.parse(eventType, deliveryId, payload);
        if (event.isEmpty()) {
            log.debug("Ignoring {} delivery {} (action {})", eventType, deliveryId, payload.path("action").asText());
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }
        if (deduplicationService.isDuplicateDelivery(deliveryId, eventType)) {
            return ResponseEntity.ok(Map.of("status", "ignored", "message", "Duplicate delivery"));
        }

        log.info("Received {} delivery {}: {}#{} comment {}", eventType, deliveryId,
                event.get().repoFullName(), event.get().pullRequestNumber(), event.get().commentId());
        asyncProcessor.processWebhookAsync(event.get());
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }
}
