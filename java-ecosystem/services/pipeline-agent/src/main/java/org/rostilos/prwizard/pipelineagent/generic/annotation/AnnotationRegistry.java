package org.rostilos.prwizard.pipelineagent.generic.annotation;

import org.rostilos.prwizard.core.exception.DuplicateCodeException;
import org.rostilos.prwizard.core.model.annotation.CommentLocation;
import org.rostilos.prwizard.core.model.annotation.OwnerRepo;
import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.rostilos.prwizard.core.service.annotation.PendingAnnotationStore;
import org.rostilos.prwizard.pipelineagent.generic.exception.CodeAllocationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Mints codes for posted annotations and records them as pending.
 */
@Service
public class AnnotationRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnnotationRegistry.class);

    private final PendingAnnotationStore store;
    private final AnnotationCodeGenerator codeGenerator;
    private final Clock clock;
    private final int maxAttempts;

    public AnnotationRegistry(
            PendingAnnotationStore store,
            AnnotationCodeGenerator codeGenerator,
            Clock clock,
            @Value("${prwizard.annotations.max-code-attempts:5}") int maxAttempts
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-code-attempts must be at least 1");
        }
        this.store = store;
        this.codeGenerator = codeGenerator;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Draw a code and insert the record under it, drawing again while the code is taken.
     *
     * @return the code the record was stored under
     * @throws CodeAllocationFailedException when every attempt collided
     */
    public String registerAnnotation(CommentLocation location, OwnerRepo ownerRepo, int pullRequestNumber,
                                     long installationId, long ttlSeconds) {
        DuplicateCodeException lastCollision = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = codeGenerator.nextCode();
            try {
                store.put(newRecord(code, location, ownerRepo, pullRequestNumber, installationId, ttlSeconds));
                log.info("Registered annotation {} for {} on {}#{}", code, location, ownerRepo.fullName(), pullRequestNumber);
                return code;
            } catch (DuplicateCodeException e) {
                log.debug("Code {} collided on attempt {}/{}", code, attempt, maxAttempts);
                lastCollision = e;
            }
        }
        throw new CodeAllocationFailedException(maxAttempts, lastCollision);
    }

    /**
     * Draw a code that is not pending right now, for replies that must show their code before
     * they are posted. The code is not reserved; {@link #registerAnnotation(String, CommentLocation,
     * OwnerRepo, int, long, long)} can still fail with {@link DuplicateCodeException}.
     */
    public String allocateCode() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = codeGenerator.nextCode();
            if (store.get(code).isEmpty()) {
                return code;
            }
            log.debug("Code {} is pending, drawing again ({}/{})", code, attempt, maxAttempts);
        }
        throw new CodeAllocationFailedException(maxAttempts, null);
    }

    /**
     * Record an annotation under a code obtained from {@link #allocateCode()}.
     *
     * @throws DuplicateCodeException if the code became pending in the meantime
     */
    public void registerAnnotation(String code, CommentLocation location, OwnerRepo ownerRepo,
                                   int pullRequestNumber, long installationId, long ttlSeconds) {
        store.put(newRecord(code, location, ownerRepo, pullRequestNumber, installationId, ttlSeconds));
        log.info("Registered annotation {} for {} on {}#{}", code, location, ownerRepo.fullName(), pullRequestNumber);
    }

    private PendingAnnotation newRecord(String code, CommentLocation location, OwnerRepo ownerRepo,
                                        int pullRequestNumber, long installationId, long ttlSeconds) {
        Instant now = clock.instant();
        return new PendingAnnotation(code, location, ownerRepo, pullRequestNumber, installationId,
                now.getEpochSecond() + ttlSeconds, now);
    }
}
