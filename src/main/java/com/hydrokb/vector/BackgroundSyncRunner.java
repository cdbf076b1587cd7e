package com.hydrokb.vector;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.ProviderDescriptor;
import com.hydrokb.embedding.ProviderSwitchListener;

/**
 * Turns provider switches into one delayed full sync pass. Switches arriving before the pending
 * pass has started are folded into it.
 */
public class BackgroundSyncRunner implements ProviderSwitchListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundSyncRunner.class);
    private static final long MIN_RETRY_DELAY_MS = 50L;

    private final VectorIndexSync sync;
    private final long delayMs;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "hydrokb-index-migration");
        thread.setDaemon(true);
        return thread;
    });
    private ScheduledFuture<SyncReport> pending;

    public BackgroundSyncRunner(VectorIndexSync sync, long delayMs) {
        this.sync = sync;
        this.delayMs = Math.max(0L, delayMs);
    }

    @Override
    public synchronized void onProviderSwitch(ProviderDescriptor previous, ProviderDescriptor current) {
        if (pending != null && !pending.isDone() && pending.getDelay(TimeUnit.MILLISECONDS) > 0) {
            log.info("sync.migration.coalesced from={} to={}", previous.id(), current.id());
            return;
        }
        log.info("sync.migration.scheduled from={} to={} delayMs={}", previous.id(), current.id(), delayMs);
        pending = executor.schedule(this::migrate, delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * The pass scheduled by the latest switch, or null when none has been requested.
     */
    public synchronized ScheduledFuture<SyncReport> pending() {
        return pending;
    }

    /**
     * Runs the full pass, waiting out any pass already holding the writer lock. That pass embeds
     * against the dimension it started with, so the migration must still run after it.
     */
    private SyncReport migrate() {
        try {
            SyncReport report = sync.sync(SyncMode.FULL);
            while (report.outcome() == SyncOutcome.SKIPPED) {
                log.info("sync.migration.deferred reason=pass-in-progress retryInMs={}", retryDelayMs());
                try {
                    Thread.sleep(retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("sync.migration.abandoned reason=interrupted");
                    return report;
                }
                report = sync.sync(SyncMode.FULL);
            }
            return report;
        } catch (RuntimeException e) {
            log.error("sync.migration.failed cause={}", e.toString());
            throw e;
        }
    }

    private long retryDelayMs() {
        return Math.max(MIN_RETRY_DELAY_MS, delayMs);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
