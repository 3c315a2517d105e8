package org.rostilos.prwizard.pipelineagent.generic.annotation;

import org.rostilos.prwizard.core.exception.StoreUnavailableException;
import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.rostilos.prwizard.core.service.annotation.PendingAnnotationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically retires annotations whose decision window has lapsed.
 * <p>
 * The sweeper owns its schedule: it starts with the application context, runs {@link #sweep()}
 * at a fixed rate on the injected scheduler and cancels it on shutdown. Tests call
 * {@link #sweep()} directly with a controllable clock.
 */
@Component
public class ExpirySweeper implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final PendingAnnotationStore store;
    private final ReconciliationEngine engine;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final long ttlSeconds;
    private final boolean enabled;

    private final Object lifecycleMonitor = new Object();
    private ScheduledFuture<?> scheduledTick;
    private volatile Instant lastCompletedSweep;

    public ExpirySweeper(
            PendingAnnotationStore store,
            ReconciliationEngine engine,
            Clock clock,
            @Qualifier("sweeperScheduler") TaskScheduler scheduler,
            @Value("${prwizard.annotations.sweep-interval-seconds:60}") long intervalSeconds,
            @Value("${prwizard.annotations.ttl-seconds:120}") long ttlSeconds,
            @Value("${prwizard.annotations.sweep-enabled:true}") boolean enabled
    ) {
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("sweep-interval-seconds must be at least 1");
        }
        this.store = store;
        this.engine = engine;
        this.clock = clock;
        this.scheduler = scheduler;
        this.interval = Duration.ofSeconds(intervalSeconds);
        this.ttlSeconds = ttlSeconds;
        this.enabled = enabled;
    }

    /**
     * Run one tick: list everything expired as of now and retire each record independently.
     */
    public SweepReport sweep() {
        Instant now = clock.instant();
        List<PendingAnnotation> expired;
        try {
            expired = store.listExpired(now);
        } catch (StoreUnavailableException e) {
            log.warn("Sweep at {} skipped: {}", now, e.getMessage());
            return SweepReport.storeUnavailable(now);
        }

        int retired = 0;
        int alreadyResolved = 0;
        int failed = 0;
        for (PendingAnnotation annotation : expired) {
            try {
                Resolution resolution = engine.expire(annotation);
                if (resolution == Resolution.EXPIRED) {
                    retired++;
                } else {
                    alreadyResolved++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to expire annotation {}", annotation.getCode(), e);
            }
        }

        SweepReport report = new SweepReport(now, expired.size(), retired, alreadyResolved, failed);
        lastCompletedSweep = now;
        if (expired.isEmpty()) {
            log.debug("Sweep at {}: nothing expired", now);
        } else {
            log.info("Sweep at {}: listed={}, expired={}, alreadyResolved={}, failed={}",
                    now, report.listed(), report.expired(), report.alreadyResolved(), report.failed());
        }
        return report;
    }

    public Optional<Instant> getLastCompletedSweep() {
        return Optional.ofNullable(lastCompletedSweep);
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (scheduledTick != null) {
                return;
            }
            if (interval.getSeconds() >= ttlSeconds) {
                log.warn("Sweep interval {}s is not smaller than the annotation TTL {}s; "
                        + "annotations may outlive their window by up to one interval", interval.getSeconds(), ttlSeconds);
            }
            scheduledTick = scheduler.scheduleAtFixedRate(this::tick, interval);
            log.info("Expiry sweeper started (interval {}s, ttl {}s)", interval.getSeconds(), ttlSeconds);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (scheduledTick != null) {
                scheduledTick.cancel(false);
                scheduledTick = null;
                log.info("Expiry sweeper stopped");
            }
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return scheduledTick != null;
        }
    }

    @Override
    public boolean isAutoStartup() {
        return enabled;
    }

    private void tick() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // A throwing task would cancel the fixed-rate schedule.
            log.error("Sweep tick failed", e);
        }
    }
}
