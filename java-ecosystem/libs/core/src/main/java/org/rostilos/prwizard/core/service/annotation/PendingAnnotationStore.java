package org.rostilos.prwizard.core.service.annotation;

import org.rostilos.prwizard.core.exception.DuplicateCodeException;
import org.rostilos.prwizard.core.exception.StoreUnavailableException;
import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for pending annotations.
 * <p>
 * All operations are safe to call concurrently from webhook handlers and the expiry sweeper.
 * {@link #delete(String)} is the single point of truth for resolving a code: for any code at most
 * one caller ever observes {@code true}.
 * Every method may throw {@link StoreUnavailableException}.
 */
public interface PendingAnnotationStore {

    /**
     * Insert a new record keyed by its code.
     *
     * @throws DuplicateCodeException if the code is already pending
     */
    void put(PendingAnnotation annotation);

    Optional<PendingAnnotation> get(String code);

    /**
     * Remove the record for {@code code} if it is still present.
     *
     * @return {@code true} if this call removed the record, {@code false} if it was not there
     */
    boolean delete(String code);

    /**
     * Snapshot of every record with {@code expiresAt <= now}. Records are not removed.
     */
    List<PendingAnnotation> listExpired(Instant now);
}
