package com.pokeme.lifecycle;

import com.pokeme.shared.config.WatchdogConfig;
import com.pokeme.store.RequestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shuts the broker down once the store has had no pending request for longer than the idle
 * timeout. Checks run on a single daemon thread at a fixed interval.
 */
public class IdleWatchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IdleWatchdog.class);

    private final RequestStore store;
    private final WatchdogConfig config;
    private final Runnable onIdle;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    private volatile Instant lastActive;
    private volatile boolean fired;

    public IdleWatchdog(RequestStore store, WatchdogConfig config, Runnable onIdle) {
        this(store, config, onIdle, Clock.systemUTC());
    }

    public IdleWatchdog(RequestStore store, WatchdogConfig config, Runnable onIdle, Clock clock) {
        this.store = store;
        this.config = config;
        this.onIdle = onIdle;
        this.clock = clock;
        this.lastActive = clock.instant();
    }

    public synchronized void start() {
        if (scheduler != null) return;
        lastActive = clock.instant();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "pokeme-watchdog");
            t.setDaemon(true);
            return t;
        });
        var period = config.interval().toMillis();
        scheduler.scheduleAtFixedRate(this::runCheck, period, period, TimeUnit.MILLISECONDS);
        log.info("Idle watchdog started (interval {}s, idle timeout {}s)",
                config.interval().toSeconds(), config.idleTimeout().toSeconds());
    }

    /**
     * Runs one check. Returns true if this check found the broker idle and triggered the
     * shutdown.
     */
    boolean check() {
        if (fired) return false;
        var now = clock.instant();
        if (store.hasPending()) {
            lastActive = now;
            return false;
        }
        var idle = Duration.between(lastActive, now);
        if (idle.compareTo(config.idleTimeout()) <= 0) {
            return false;
        }
        fired = true;
        log.info("No pending requests for {}s, stopping", idle.toSeconds());
        onIdle.run();
        return true;
    }

    private void runCheck() {
        try {
            if (check()) {
                close();
            }
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.warn("Idle check failed", e);
        }
    }

    public boolean hasFired() {
        return fired;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
