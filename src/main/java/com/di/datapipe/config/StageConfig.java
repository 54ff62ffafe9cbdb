package com.di.datapipe.config;

import com.di.datapipe.bus.GuardedTopicPublisher;
import com.di.datapipe.bus.TopicPublisher;
import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.ingestion.FetcherRegistry;
import com.di.datapipe.ingestion.IngestionWorker;
import com.di.datapipe.join.JoinCoordinator;
import com.di.datapipe.landing.GuardedLandingStore;
import com.di.datapipe.landing.LandingStore;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.scheduler.DatasetScheduler;
import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.security.Permission;
import com.di.datapipe.security.StageIdentity;
import com.di.datapipe.state.LoadStateStore;
import com.di.datapipe.util.MdcPropagation;
import com.di.datapipe.warehouse.GuardedWarehouse;
import com.di.datapipe.warehouse.Warehouse;
import com.di.datapipe.warehouse.WarehouseLoader;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the four stages onto whichever ports the active runtime provides. Every port a stage
 * receives is wrapped in a guard bound to that stage's identity, so each stage can only perform
 * the operations {@link AccessPolicy} grants it.
 */
@Slf4j
@Configuration
public class StageConfig {

    // ------------------------------------------------------------------
    // Scheduler (identity SCHEDULER)
    // ------------------------------------------------------------------

    @Bean
    public DatasetScheduler datasetScheduler(DatasetCatalog datasetCatalog,
                                             @Qualifier("triggerTopic") TopicPublisher triggerTopic,
                                             AccessPolicy accessPolicy,
                                             TaskScheduler taskScheduler,
                                             PipelineMetrics metrics,
                                             PipelineProperties properties) {
        TopicPublisher triggers = new GuardedTopicPublisher(
                triggerTopic, Permission.TRIGGER_PUBLISH, StageIdentity.SCHEDULER, accessPolicy);
        return new DatasetScheduler(datasetCatalog, triggers, taskScheduler, metrics,
                properties.getScheduler().getDefaultCron());
    }

    // ------------------------------------------------------------------
    // Ingestion worker (identity INGESTION)
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchPool(PipelineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(
                Math.max(1, properties.getIngestion().getFetchThreads()),
                r -> {
                    Thread t = new Thread(r, "datapipe-fetch-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }));
    }

    @Bean
    public Retry notificationPublishRetry(PipelineProperties properties) {
        PipelineProperties.PublishRetry cfg = properties.getIngestion().getPublishRetry();
        Retry retry = Retry.of("notification-publish", RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .waitDuration(cfg.getWaitDuration())
                .retryOnException(e -> FailureCategory.categorize(e).isRetryable())
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("[INGEST] publish retry #{} after: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    @Bean
    public IngestionWorker ingestionWorker(FetcherRegistry fetcherRegistry,
                                           DatasetCatalog datasetCatalog,
                                           LandingStore landingStore,
                                           @Qualifier("notificationTopic") TopicPublisher notificationTopic,
                                           AccessPolicy accessPolicy,
                                           Retry notificationPublishRetry,
                                           @Qualifier("fetchPool") ExecutorService fetchPool,
                                           PipelineMetrics metrics,
                                           PipelineProperties properties) {
        return new IngestionWorker(
                fetcherRegistry,
                datasetCatalog,
                new GuardedLandingStore(landingStore, StageIdentity.INGESTION, accessPolicy),
                new GuardedTopicPublisher(notificationTopic, Permission.NOTIFICATION_PUBLISH,
                        StageIdentity.INGESTION, accessPolicy),
                notificationPublishRetry,
                properties.getIngestion().getFetchTimeout(),
                fetchPool,
                metrics);
    }

    // ------------------------------------------------------------------
    // Warehouse loader and join coordinator (identity LOADER)
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService joinEvaluationExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "datapipe-join");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public JoinCoordinator joinCoordinator(PipelineProperties properties,
                                           LoadStateStore loadStateStore,
                                           Warehouse warehouse,
                                           AccessPolicy accessPolicy,
                                           PipelineMetrics metrics,
                                           Clock clock,
                                           @Qualifier("joinEvaluationExecutor") ExecutorService joinEvaluationExecutor) {
        PipelineProperties.JoinSettings join = properties.getJoin();
        return new JoinCoordinator(
                properties.getJoins().stream().map(PipelineProperties.Join::toDefinition).toList(),
                loadStateStore,
                new GuardedWarehouse(warehouse, StageIdentity.LOADER, accessPolicy),
                metrics,
                clock,
                join.getStaleAfter(),
                join.getRetryAfter(),
                joinEvaluationExecutor);
    }

    @Bean
    public WarehouseLoader warehouseLoader(Warehouse warehouse,
                                           AccessPolicy accessPolicy,
                                           LoadStateStore loadStateStore,
                                           JoinCoordinator joinCoordinator,
                                           PipelineMetrics metrics,
                                           Clock clock) {
        return new WarehouseLoader(
                new GuardedWarehouse(warehouse, StageIdentity.LOADER, accessPolicy),
                loadStateStore,
                List.of(joinCoordinator),
                metrics,
                clock);
    }
}
