package com.di.datapipe.warehouse;

import com.di.datapipe.bus.MessageHandler;
import com.di.datapipe.bus.PushMessage;
import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.LandedObjectEvent;
import com.di.datapipe.model.PayloadCodec;
import com.di.datapipe.state.LoadStateStore;
import com.di.datapipe.state.TableLoadMarker;
import com.di.datapipe.util.JobIds;
import com.di.datapipe.util.MdcKeys;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;

/**
 * Notification-bus handler: loads a landed object into the dataset's table.
 *
 * <ol>
 *   <li>Decode the {@link LandedObjectEvent}.</li>
 *   <li>Derive the table name and a fresh job id; record the attempt as RUNNING.</li>
 *   <li>Run the load job (truncate, autodetect, one header row) and wait for a terminal state.</li>
 *   <li>On success mark the table COMPLETED and notify listeners; on failure mark it FAILED and
 *       rethrow so the bus redelivers or dead-letters.</li>
 * </ol>
 */
@Slf4j
public class WarehouseLoader implements MessageHandler {

    private final Warehouse warehouse;
    private final LoadStateStore stateStore;
    private final List<LoadCompletionListener> listeners;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public WarehouseLoader(Warehouse warehouse,
                           LoadStateStore stateStore,
                           List<LoadCompletionListener> listeners,
                           PipelineMetrics metrics,
                           Clock clock) {
        this.warehouse = warehouse;
        this.stateStore = stateStore;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void handle(PushMessage message) {
        LandedObjectEvent event = PayloadCodec.decodeLandedObject(message.getData());
        String table = TableNaming.forDataset(event.getDatasetId());
        String jobId = JobIds.next("load", table, clock);

        try (MDC.MDCCloseable d = MDC.putCloseable(MdcKeys.DATASET_ID, event.getDatasetId());
             MDC.MDCCloseable j = MDC.putCloseable(MdcKeys.JOB_ID, jobId)) {
            load(event, table, jobId);
        }
    }

    private void load(LandedObjectEvent event, String table, String jobId) {
        stateStore.beginAttempt(table, jobId, clock.instant());
        LoadJobSpec spec = LoadJobSpec.builder()
                .jobId(jobId)
                .table(table)
                .bucket(event.getBucket())
                .objectName(event.getObjectName())
                .build();

        long start = clock.millis();
        JobResult result;
        try {
            result = warehouse.runLoad(spec);
        } catch (RuntimeException e) {
            long elapsed = clock.millis() - start;
            FailureCategory category = FailureCategory.categorize(e);
            stateStore.markFailed(table, jobId, e.getMessage(), clock.instant());
            if (category == FailureCategory.MALFORMED_INPUT) {
                metrics.recordLoad(table, "malformed", elapsed);
                log.error("[LOAD] MALFORMED input {} for table={} jobId={}: {}",
                        spec.sourceUri(), table, jobId, e.getMessage());
            } else {
                metrics.recordLoad(table, "failed", elapsed);
                log.warn("[LOAD] table={} jobId={} failed [{}]: {}", table, jobId, category.name(), e.getMessage());
            }
            throw e;
        }

        boolean applied = stateStore.markCompleted(table, jobId, result.getRowCount(), clock.instant());
        metrics.recordLoad(table, "completed", clock.millis() - start);
        if (!applied) {
            log.info("[LOAD] table={} jobId={} finished but a newer attempt owns the marker", table, jobId);
            return;
        }
        log.info("[LOAD] table={} COMPLETED jobId={} rows={}", table, jobId, result.getRowCount());
        TableLoadMarker marker = stateStore.find(table).orElseThrow(
                () -> new IllegalStateException("Marker for " + table + " vanished after completion"));
        for (LoadCompletionListener listener : listeners) {
            listener.onLoadCompleted(marker);
        }
    }
}
