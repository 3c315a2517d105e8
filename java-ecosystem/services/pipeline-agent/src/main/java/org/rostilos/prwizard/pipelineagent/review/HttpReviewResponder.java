package org.rostilos.prwizard.pipelineagent.review;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Calls the review backend over HTTP. Any failure is logged and treated as "no reply".
 */
@Service
public class HttpReviewResponder implements ReviewResponder {

    private static final Logger log = LoggerFactory.getLogger(HttpReviewResponder.class);
    private static final String ANALYZE_PATH = "/analyze-review";

    private final RestTemplate restTemplate;
    private final String backendBaseUrl;

    public HttpReviewResponder(
            @Qualifier("reviewRestTemplate") RestTemplate restTemplate,
            @Value("${prwizard.review-backend.url:}") String backendUrl
    ) {
        this.restTemplate = restTemplate;
        this.backendBaseUrl = normalizeBaseUrl(backendUrl);
    }

    @Override
    public Optional<String> respond(ReviewRequest request) {
        if (backendBaseUrl == null) {
            log.error("Review backend URL is not configured (prwizard.review-backend.url)");
            return Optional.empty();
        }

        String url = backendBaseUrl + ANALYZE_PATH;
        log.debug("Sending {} request for {}#{} to {}", request.kind().getId(), request.repoFullName(), request.prNumber(), url);
        try {
            JsonNode response = restTemplate.postForObject(url, request, JsonNode.class);
            if (response == null) {
                log.warn("Review backend returned an empty body");
                return Optional.empty();
            }
            String comment = response.path("comment").asText("").trim();
            if (comment.isEmpty()) {
                log.info("Review backend returned no comment for {}#{}, skipping", request.repoFullName(), request.prNumber());
                return Optional.empty();
            }
            return Optional.of(comment);
        } catch (RestClientException e) {
            log.error("Failed to call review backend at {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Adds {@code https://} when no scheme is given and drops trailing slashes.
     */
    static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
