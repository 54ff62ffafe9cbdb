package com.di.datapipe.scheduler;

import com.di.datapipe.bus.TopicPublisher;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetRegistration;
import com.di.datapipe.model.PayloadCodec;
import com.di.datapipe.util.MdcKeys;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * One independent cron task per enabled dataset. Each tick publishes the dataset's FetchRequest to
 * the trigger topic and returns; a failed publish is logged and counted, never retried. The next
 * tick is the retry.
 */
@Slf4j
public class DatasetScheduler {

    private final DatasetCatalog catalog;
    private final TopicPublisher triggers;
    private final TaskScheduler taskScheduler;
    private final PipelineMetrics metrics;
    private final String defaultCron;

    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public DatasetScheduler(DatasetCatalog catalog,
                            TopicPublisher triggers,
                            TaskScheduler taskScheduler,
                            PipelineMetrics metrics,
                            String defaultCron) {
        this.catalog = catalog;
        this.triggers = triggers;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.defaultCron = defaultCron;
    }

    @PostConstruct
    public synchronized void start() {
        for (DatasetRegistration registration : catalog.all()) {
            if (!registration.isEnabled()) {
                log.info("[SCHEDULER] dataset={} disabled; not scheduled", registration.getId());
                continue;
            }
            String cron = registration.getSchedule() == null || registration.getSchedule().isBlank()
                    ? defaultCron
                    : registration.getSchedule();
            String datasetId = registration.getId();
            scheduled.add(taskScheduler.schedule(() -> tick(datasetId), new CronTrigger(cron)));
            log.info("[SCHEDULER] dataset={} scheduled cron='{}'", datasetId, cron);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        scheduled.forEach(f -> f.cancel(false));
        scheduled.clear();
    }

    /**
     * Publishes one FetchRequest for {@code datasetId}.
     *
     * @return the message id, or empty when the publish failed
     * @throws IllegalArgumentException for an unknown dataset
     */
    public Optional<String> tick(String datasetId) {
        DatasetRegistration registration = catalog.find(datasetId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown dataset: " + datasetId));
        try (MDC.MDCCloseable d = MDC.putCloseable(MdcKeys.DATASET_ID, datasetId)) {
            byte[] payload = PayloadCodec.encodeFetchRequest(registration.getDescriptor());
            String messageId = triggers.publish(payload, Map.of("dataset_id", datasetId));
            metrics.recordTick(datasetId, true);
            log.info("[SCHEDULER] dataset={} FetchRequest published messageId={}", datasetId, messageId);
            return Optional.of(messageId);
        } catch (RuntimeException e) {
            metrics.recordTick(datasetId, false);
            log.warn("[SCHEDULER] dataset={} FetchRequest publish failed; waiting for next tick: {}",
                    datasetId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public synchronized int scheduledCount() {
        return scheduled.size();
    }
}
