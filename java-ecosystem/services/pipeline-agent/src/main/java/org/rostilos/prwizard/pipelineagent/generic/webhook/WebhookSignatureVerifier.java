package org.rostilos.prwizard.pipelineagent.generic.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Checks the {@code X-Hub-Signature-256} header against the configured webhook secret.
 * With no secret configured every delivery is accepted.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final byte[] secret;

    public WebhookSignatureVerifier(@Value("${prwizard.github.app.webhook-secret:}") String webhookSecret) {
        this.secret = webhookSecret == null || webhookSecret.isEmpty()
                ? null
                : webhookSecret.getBytes(StandardCharsets.UTF_8);
        if (this.secret == null) {
            log.warn("No webhook secret configured; webhook signatures are not verified");
        }
    }

    public boolean isValid(byte[] body, String signatureHeader) {
        if (secret == null) {
            return true;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }
        byte[] expected = SIGNATURE_PREFIX.concat(computeHmac(body)).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signatureHeader.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }

    private String computeHmac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute webhook signature", e);
        }
    }
}
