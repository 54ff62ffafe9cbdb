package com.di.datapipe.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for every pipeline stage. Completion and staleness are exposed as gauges so that a
 * dataset silently absent from, or stale in, the warehouse is visible without parsing logs.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ConcurrentMap<String, AtomicLong> lastCompletedByTable = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> pendingSinceByJoin = new ConcurrentHashMap<>();

    @Autowired
    public PipelineMetrics(MeterRegistry meterRegistry) {
        this(meterRegistry, Clock.systemUTC());
    }

    public PipelineMetrics(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    // ============================================================================
    // Scheduler / ingestion
    // ============================================================================

    public void recordTick(String datasetId, boolean published) {
        meterRegistry.counter("datapipe.scheduler.ticks",
                "dataset", datasetId, "outcome", published ? "published" : "failed").increment();
    }

    public void recordFetch(String datasetId, boolean success, long durationMs) {
        meterRegistry.counter("datapipe.ingestion.fetches",
                "dataset", datasetId, "outcome", success ? "success" : "error").increment();
        Timer.builder("datapipe.ingestion.fetch.duration")
                .description("Time taken to fetch a dataset from its source")
                .tag("dataset", datasetId)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordLandingWrite(String datasetId, long bytes) {
        meterRegistry.counter("datapipe.landing.writes", "dataset", datasetId).increment();
        meterRegistry.summary("datapipe.landing.bytes", "dataset", datasetId).record(bytes);
    }

    public void recordPublish(String topic, boolean success) {
        meterRegistry.counter("datapipe.bus.publishes",
                "topic", topic, "outcome", success ? "success" : "error").increment();
    }

    // ============================================================================
    // Bus delivery
    // ============================================================================

    /**
     * @param outcome one of {@code acked}, {@code nacked}, {@code expired}, {@code dead_lettered}
     */
    public void recordDelivery(String subscription, String outcome) {
        meterRegistry.counter("datapipe.bus.deliveries",
                "subscription", subscription, "outcome", outcome).increment();
    }

    public void recordDeadLetter(String subscription, String category) {
        meterRegistry.counter("datapipe.bus.dead_letters",
                "subscription", subscription, "category", category).increment();
    }

    // ============================================================================
    // Warehouse
    // ============================================================================

    /**
     * @param outcome one of {@code completed}, {@code failed}, {@code malformed}
     */
    public void recordLoad(String table, String outcome, long durationMs) {
        meterRegistry.counter("datapipe.warehouse.loads", "table", table, "outcome", outcome).increment();
        Timer.builder("datapipe.warehouse.load.duration")
                .description("Time from load job submission to terminal state")
                .tag("table", table)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        if ("completed".equals(outcome)) {
            markTableCompleted(table);
        }
    }

    /** Age of the most recent completed load, per table. */
    public void markTableCompleted(String table) {
        lastCompletedByTable.computeIfAbsent(table, t -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder("datapipe.table.last_completed.age.seconds", holder,
                            h -> h.get() == 0 ? Double.NaN : (clock.millis() - h.get()) / 1000.0)
                    .description("Seconds since the table's most recent load completed")
                    .tag("table", t)
                    .register(meterRegistry);
            return holder;
        }).set(clock.millis());
    }

    // ============================================================================
    // Join coordinator
    // ============================================================================

    public void recordJoinTransition(String join, String state) {
        meterRegistry.counter("datapipe.join.transitions", "join", join, "state", state).increment();
        log.debug("Recorded join transition: join={}, state={}", join, state);
    }

    /** Starts or stops the pending clock for a join. {@code sinceMillis <= 0} means not pending. */
    public void setJoinPendingSince(String join, long sinceMillis) {
        pendingSinceByJoin.computeIfAbsent(join, j -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder("datapipe.join.pending.seconds", holder,
                            h -> h.get() <= 0 ? 0.0 : (clock.millis() - h.get()) / 1000.0)
                    .description("Seconds the current join task has waited on its dependencies")
                    .tag("join", j)
                    .register(meterRegistry);
            return holder;
        }).set(Math.max(0, sinceMillis));
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
