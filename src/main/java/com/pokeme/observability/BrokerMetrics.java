package com.pokeme.observability;

import com.pokeme.store.RequestStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class BrokerMetrics {

    private final MeterRegistry registry;
    private final Counter created;
    private final Counter rejected;
    private final Counter answered;
    private final Counter answerConflicts;

    public BrokerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public BrokerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.created = Counter.builder("pokeme.requests.created").register(registry);
        this.rejected = Counter.builder("pokeme.requests.rejected")
                .description("ask calls refused because the pending capacity was reached")
                .register(registry);
        this.answered = Counter.builder("pokeme.requests.answered").register(registry);
        this.answerConflicts = Counter.builder("pokeme.answers.conflicts")
                .description("answers for unknown or already answered requests")
                .register(registry);
    }

    public void bindPendingGauge(RequestStore store) {
        Gauge.builder("pokeme.requests.pending", store, s -> s.pending().size()).register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public Counter created() { return created; }

    public Counter rejected() { return rejected; }

    public Counter answered() { return answered; }

    public Counter answerConflicts() { return answerConflicts; }
}
