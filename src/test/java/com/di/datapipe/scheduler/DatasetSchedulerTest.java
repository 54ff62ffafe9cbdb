package com.di.datapipe.scheduler;

import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetDescriptor;
import com.di.datapipe.model.DatasetRegistration;
import com.di.datapipe.model.PayloadCodec;
import com.di.datapipe.support.Metrics;
import com.di.datapipe.support.RecordingTopicPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatasetScheduler Tests")
class DatasetSchedulerTest {

    private static final String NEVER = "0 0 0 1 1 *";

    private ThreadPoolTaskScheduler taskScheduler;
    private PipelineMetrics metrics;
    private DatasetCatalog catalog;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.initialize();
        metrics = Metrics.simple();
        catalog = new DatasetCatalog(List.of(
                registration("HOUSEHOLD_INCOME", "SAIPE", true, NEVER),
                registration("POVERTY_BY_STATE", "POVERTY", true, null),
                registration("RETIRED", "OLD", false, NEVER)));
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    private static DatasetRegistration registration(String id, String filename, boolean enabled, String cron) {
        return DatasetRegistration.builder()
                .descriptor(DatasetDescriptor.builder()
                        .id(id)
                        .url("https://example.org/" + id)
                        .gcsBucket("landing")
                        .filename(filename)
                        .build())
                .schedule(cron)
                .enabled(enabled)
                .build();
    }

    @Test
    @DisplayName("Schedules one independent task per enabled dataset")
    void testStart() {
        DatasetScheduler scheduler = new DatasetScheduler(
                catalog, new RecordingTopicPublisher("fetch-requests"), taskScheduler, metrics, NEVER);

        scheduler.start();
        assertEquals(2, scheduler.scheduledCount());

        scheduler.stop();
        assertEquals(0, scheduler.scheduledCount());
    }

    @Test
    @DisplayName("A tick publishes the dataset's descriptor as a FetchRequest")
    void testTick_Published() {
        RecordingTopicPublisher triggers = new RecordingTopicPublisher("fetch-requests");
        DatasetScheduler scheduler = new DatasetScheduler(catalog, triggers, taskScheduler, metrics, NEVER);

        Optional<String> messageId = scheduler.tick("HOUSEHOLD_INCOME");

        assertTrue(messageId.isPresent());
        DatasetDescriptor sent = PayloadCodec.decodeFetchRequest(triggers.published().get(0));
        assertEquals(catalog.find("HOUSEHOLD_INCOME").orElseThrow().getDescriptor(), sent);
        assertEquals(1.0, Metrics.count(metrics, "datapipe.scheduler.ticks", "outcome", "published"));
    }

    @Test
    @DisplayName("A failed publish is counted and not retried")
    void testTick_PublishFailed() {
        RecordingTopicPublisher triggers = new RecordingTopicPublisher("fetch-requests", 1);
        DatasetScheduler scheduler = new DatasetScheduler(catalog, triggers, taskScheduler, metrics, NEVER);

        assertTrue(scheduler.tick("HOUSEHOLD_INCOME").isEmpty());
        assertEquals(1, triggers.calls());
        assertEquals(1.0, Metrics.count(metrics, "datapipe.scheduler.ticks", "outcome", "failed"));

        assertTrue(scheduler.tick("HOUSEHOLD_INCOME").isPresent());
    }

    @Test
    @DisplayName("Ticks of one dataset do not depend on another's failures")
    void testTick_Independent() {
        RecordingTopicPublisher triggers = new RecordingTopicPublisher("fetch-requests", 1);
        DatasetScheduler scheduler = new DatasetScheduler(catalog, triggers, taskScheduler, metrics, NEVER);

        scheduler.tick("HOUSEHOLD_INCOME");
        assertTrue(scheduler.tick("POVERTY_BY_STATE").isPresent());
    }

    @Test
    @DisplayName("Unknown datasets are rejected")
    void testTick_Unknown() {
        DatasetScheduler scheduler = new DatasetScheduler(
                catalog, new RecordingTopicPublisher("fetch-requests"), taskScheduler, metrics, NEVER);
        assertThrows(IllegalArgumentException.class, () -> scheduler.tick("NOPE"));
    }
}
