package com.pokeme.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fire-and-forget shutdown of the broker. The close action runs on its own thread after a
 * short grace period so the HTTP response that asked for it can still be written.
 */
public class BrokerShutdown {

    private static final Logger log = LoggerFactory.getLogger(BrokerShutdown.class);

    private final Runnable closeAction;
    private final Duration grace;
    private final AtomicBoolean requested = new AtomicBoolean();

    public BrokerShutdown(Runnable closeAction) {
        this(closeAction, Duration.ofMillis(200));
    }

    public BrokerShutdown(Runnable closeAction, Duration grace) {
        this.closeAction = closeAction;
        this.grace = grace;
    }

    /** Returns false if a shutdown was already requested. */
    public boolean request(String reason) {
        if (!requested.compareAndSet(false, true)) {
            return false;
        }
        log.info("Shutting down broker: {}", reason);
        var t = new Thread(this::runClose, "pokeme-shutdown");
        t.setDaemon(false);
        t.start();
        return true;
    }

    public boolean isRequested() {
        return requested.get();
    }

    private void runClose() {
        try {
            Thread.sleep(grace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            closeAction.run();
        } catch (RuntimeException e) {
            log.error("Broker shutdown failed", e);
        }
    }
}
