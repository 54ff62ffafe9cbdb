package com.di.datapipe.config;

import com.di.datapipe.bus.DeadLetterSink;
import com.di.datapipe.bus.LoggingDeadLetterSink;
import com.di.datapipe.ingestion.DatasetFetcher;
import com.di.datapipe.ingestion.FetcherRegistry;
import com.di.datapipe.ingestion.HttpDatasetFetcher;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.state.InMemoryLoadStateStore;
import com.di.datapipe.state.LoadStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Beans shared by both runtimes: dataset catalog, access policy, fetchers, dead-letter sink, the
 * default marker store and the scheduler thread pool.
 */
@Configuration
public class CoreConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccessPolicy accessPolicy() {
        return AccessPolicy.leastPrivilege();
    }

    @Bean
    public DatasetCatalog datasetCatalog(PipelineProperties properties) {
        return new DatasetCatalog(properties.getDatasets().stream()
                .map(PipelineProperties.Dataset::toRegistration)
                .toList());
    }

    @Bean
    public DeadLetterSink deadLetterSink(PipelineProperties properties) {
        return new LoggingDeadLetterSink(properties.getBus().getDeadLetterCapacity());
    }

    @Bean
    public RestTemplate datasetRestTemplate(RestTemplateBuilder builder, PipelineProperties properties) {
        return builder
                .setConnectTimeout(properties.getIngestion().getConnectTimeout())
                .setReadTimeout(properties.getIngestion().getReadTimeout())
                .build();
    }

    @Bean
    public HttpDatasetFetcher httpDatasetFetcher(RestTemplate datasetRestTemplate) {
        return new HttpDatasetFetcher(datasetRestTemplate);
    }

    @Bean
    public FetcherRegistry fetcherRegistry(List<DatasetFetcher> fetchers) {
        return new FetcherRegistry(fetchers);
    }

    @Bean
    @ConditionalOnProperty(name = "datapipe.state.store", havingValue = "memory", matchIfMissing = true)
    public LoadStateStore inMemoryLoadStateStore() {
        return new InMemoryLoadStateStore();
    }

    /** Runs dataset cron ticks and the join sweep. */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(PipelineProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
        scheduler.setThreadNamePrefix("datapipe-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
