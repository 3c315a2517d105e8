package org.rostilos.prwizard.core.service.annotation;

import org.rostilos.prwizard.core.exception.DuplicateCodeException;
import org.rostilos.prwizard.core.exception.StoreUnavailableException;
import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.rostilos.prwizard.core.persistence.repository.annotation.PendingAnnotationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Database-backed {@link PendingAnnotationStore}.
 * <p>
 * Each operation runs in its own REQUIRES_NEW transaction with a bounded timeout, so a failed
 * insert never marks a caller's transaction rollback-only. Uniqueness comes from the primary key
 * and resolution from the affected-row count of a single DELETE statement; there is no
 * check-then-act in this class.
 */
@Service
public class JpaPendingAnnotationStore implements PendingAnnotationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPendingAnnotationStore.class);

    private final PendingAnnotationRepository repository;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public JpaPendingAnnotationStore(
            PendingAnnotationRepository repository,
            PlatformTransactionManager transactionManager,
            @Value("${prwizard.store.timeout-seconds:5}") int timeoutSeconds
    ) {
        this.repository = repository;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);
    }

    @Override
    public void put(PendingAnnotation annotation) {
        try {
            insert(annotation);
        } catch (StoreUnavailableException e) {
            if (!(e.getCause() instanceof ConcurrencyFailureException)) {
                throw e;
            }
            // A competing insert of the same code held the key; the re-run sees its committed outcome.
            log.debug("Lock conflict storing {}, re-running insert", annotation.getCode());
            insert(annotation);
        }
        log.debug("Stored pending annotation {}", annotation);
    }

    @Override
    public Optional<PendingAnnotation> get(String code) {
        return guarded("get", code, () -> readTemplate.execute(status -> repository.findByCode(code)));
    }

    @Override
    public boolean delete(String code) {
        int deleted;
        try {
            deleted = guarded("delete", code, () -> deleteInTransaction(code));
        } catch (StoreUnavailableException e) {
            if (!(e.getCause() instanceof ConcurrencyFailureException)) {
                throw e;
            }
            // Row was locked by a competing resolver; the re-run sees its committed outcome.
            log.debug("Lock conflict deleting {}, re-running delete", code);
            deleted = guarded("delete", code, () -> deleteInTransaction(code));
        }
        if (deleted > 0) {
            log.debug("Deleted pending annotation {}", code);
            return true;
        }
        return false;
    }

    @Override
    public List<PendingAnnotation> listExpired(Instant now) {
        long nowEpochSeconds = now.getEpochSecond();
        return guarded("listExpired", null, () -> readTemplate.execute(status -> repository.findExpired(nowEpochSeconds)));
    }

    private void insert(PendingAnnotation annotation) {
        String code = annotation.getCode();
        try {
            writeTemplate.executeWithoutResult(status -> repository.saveAndFlush(annotation));
        } catch (DataIntegrityViolationException e) {
            log.debug("Code {} is already pending", code);
            throw new DuplicateCodeException(code, e);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("put", code, e);
        }
    }

    private int deleteInTransaction(String code) {
        Integer deleted = writeTemplate.execute(status -> repository.deleteByCode(code));
        return deleted != null ? deleted : 0;
    }

    private <T> T guarded(String operation, String code, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException(operation, code, e);
        }
    }
}
