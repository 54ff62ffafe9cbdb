package com.di.datapipe.config;

import com.di.datapipe.bus.DeadLetterSink;
import com.di.datapipe.bus.InProcessTopic;
import com.di.datapipe.bus.PushSubscription;
import com.di.datapipe.ingestion.IngestionWorker;
import com.di.datapipe.landing.GuardedLandingStore;
import com.di.datapipe.landing.InMemoryLandingStore;
import com.di.datapipe.landing.LandingStore;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.security.StageIdentity;
import com.di.datapipe.warehouse.InMemoryWarehouse;
import com.di.datapipe.warehouse.NaturalJoinQueryEvaluator;
import com.di.datapipe.warehouse.WarehouseLoader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * {@code datapipe.runtime=local}: in-memory landing store and warehouse, in-process topics with push
 * subscriptions delivering straight to the stage handlers.
 */
@Configuration
@ConditionalOnProperty(name = "datapipe.runtime", havingValue = "local", matchIfMissing = true)
public class LocalRuntimeConfig {

    @Bean
    public InMemoryLandingStore landingStore() {
        return new InMemoryLandingStore();
    }

    @Bean
    public InMemoryWarehouse warehouse(LandingStore landingStore, AccessPolicy accessPolicy) {
        return new InMemoryWarehouse(
                new GuardedLandingStore(landingStore, StageIdentity.LOADER, accessPolicy),
                new NaturalJoinQueryEvaluator());
    }

    @Bean
    public InProcessTopic triggerTopic(PipelineProperties properties, PipelineMetrics metrics) {
        return new InProcessTopic(properties.getBus().getTriggerTopic(), metrics);
    }

    @Bean
    public InProcessTopic notificationTopic(PipelineProperties properties, PipelineMetrics metrics) {
        return new InProcessTopic(properties.getBus().getNotificationTopic(), metrics);
    }

    @Bean
    public PushSubscription fetchRequestSubscription(@Qualifier("triggerTopic") InProcessTopic triggerTopic,
                                                     IngestionWorker ingestionWorker,
                                                     PipelineProperties properties,
                                                     DeadLetterSink deadLetterSink,
                                                     PipelineMetrics metrics) {
        PushSubscription subscription = new PushSubscription(triggerTopic.topic() + "-push", ingestionWorker,
                properties.getBus().getTrigger(), deadLetterSink, metrics);
        triggerTopic.subscribe(subscription);
        return subscription;
    }

    @Bean
    public PushSubscription landedObjectSubscription(@Qualifier("notificationTopic") InProcessTopic notificationTopic,
                                                     WarehouseLoader warehouseLoader,
                                                     PipelineProperties properties,
                                                     DeadLetterSink deadLetterSink,
                                                     PipelineMetrics metrics) {
        PushSubscription subscription = new PushSubscription(notificationTopic.topic() + "-push", warehouseLoader,
                properties.getBus().getNotification(), deadLetterSink, metrics);
        notificationTopic.subscribe(subscription);
        return subscription;
    }
}
