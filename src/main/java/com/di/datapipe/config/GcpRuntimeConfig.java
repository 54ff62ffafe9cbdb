package com.di.datapipe.config;

import com.di.datapipe.bus.PubSubTopicPublisher;
import com.di.datapipe.landing.GcsLandingStore;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.security.GoogleOidcPushAuthenticator;
import com.di.datapipe.security.PushEndpointGuard;
import com.di.datapipe.warehouse.BigQueryWarehouse;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * {@code datapipe.runtime=gcp}: Cloud Storage, BigQuery and Pub/Sub clients backed by Application
 * Default Credentials, plus the OIDC guard for push endpoints. Topics, subscriptions, buckets and
 * service accounts are provisioned outside this service.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "datapipe.runtime", havingValue = "gcp")
public class GcpRuntimeConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient() {
        return BigQueryOptions.getDefaultInstance().getService();
    }

    @Bean
    public GcsLandingStore landingStore(Storage gcsStorage) {
        return new GcsLandingStore(gcsStorage);
    }

    @Bean
    public BigQueryWarehouse warehouse(BigQuery bigQueryClient, PipelineProperties properties) {
        PipelineProperties.Warehouse wh = properties.getWarehouse();
        String project = wh.getProject() != null ? wh.getProject() : properties.getGcp().getProjectId();
        return new BigQueryWarehouse(bigQueryClient, project, wh.getDataset(), wh.getLoadTimeout(), wh.getQueryTimeout());
    }

    @Bean(destroyMethod = "close")
    public PubSubTopicPublisher triggerTopic(PipelineProperties properties, PipelineMetrics metrics) throws IOException {
        return PubSubTopicPublisher.create(requireProject(properties), properties.getBus().getTriggerTopic(),
                properties.getIngestion().getPublishTimeout(), metrics);
    }

    @Bean(destroyMethod = "close")
    public PubSubTopicPublisher notificationTopic(PipelineProperties properties, PipelineMetrics metrics) throws IOException {
        return PubSubTopicPublisher.create(requireProject(properties), properties.getBus().getNotificationTopic(),
                properties.getIngestion().getPublishTimeout(), metrics);
    }

    @Bean
    public PushEndpointGuard pushEndpointGuard(PipelineProperties properties) {
        String audience = properties.getPush().getAudience();
        if (audience == null || audience.isBlank()) {
            throw new IllegalStateException("datapipe.push.audience is required for the gcp runtime");
        }
        log.info("[PUSH] verifying push tokens for audience={}", audience);
        return new PushEndpointGuard(new GoogleOidcPushAuthenticator(audience));
    }

    private static String requireProject(PipelineProperties properties) {
        String projectId = properties.getGcp().getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalStateException("datapipe.gcp.project-id is required for the gcp runtime");
        }
        return projectId;
    }
}
