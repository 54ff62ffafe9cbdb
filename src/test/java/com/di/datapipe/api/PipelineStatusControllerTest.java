package com.di.datapipe.api;

import com.di.datapipe.bus.LoggingDeadLetterSink;
import com.di.datapipe.bus.PushSubscription;
import com.di.datapipe.bus.SubscriptionSettings;
import com.di.datapipe.config.PipelineProperties;
import com.di.datapipe.exception.GlobalExceptionHandler;
import com.di.datapipe.join.JoinCoordinator;
import com.di.datapipe.join.JoinDefinition;
import com.di.datapipe.landing.InMemoryLandingStore;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.model.DatasetCatalog;
import com.di.datapipe.model.DatasetDescriptor;
import com.di.datapipe.model.DatasetRegistration;
import com.di.datapipe.scheduler.DatasetScheduler;
import com.di.datapipe.state.InMemoryLoadStateStore;
import com.di.datapipe.support.Metrics;
import com.di.datapipe.support.RecordingTopicPublisher;
import com.di.datapipe.warehouse.InMemoryWarehouse;
import com.di.datapipe.warehouse.NaturalJoinQueryEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("PipelineStatusController Tests")
class PipelineStatusControllerTest {

    private InMemoryLoadStateStore stateStore;
    private RecordingTopicPublisher triggers;
    private ThreadPoolTaskScheduler taskScheduler;
    private PushSubscription subscription;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PipelineMetrics metrics = Metrics.simple();
        stateStore = new InMemoryLoadStateStore();
        triggers = new RecordingTopicPublisher("fetch-requests");
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();

        DatasetCatalog catalog = new DatasetCatalog(List.of(
                registration("HOUSEHOLD_INCOME", "SAIPE"),
                registration("POVERTY_BY_STATE", "POVERTY")));
        JoinCoordinator coordinator = new JoinCoordinator(
                List.of(JoinDefinition.builder()
                        .name("income_poverty")
                        .dependsOn(List.of("HOUSEHOLD_INCOME", "POVERTY_BY_STATE"))
                        .destinationTable("income_poverty")
                        .query("SELECT * FROM household_income NATURAL JOIN poverty_by_state")
                        .build()),
                stateStore,
                new InMemoryWarehouse(new InMemoryLandingStore(), new NaturalJoinQueryEvaluator()),
                metrics,
                Clock.systemUTC(),
                Duration.ofHours(1),
                Duration.ofMinutes(5),
                Runnable::run);
        DatasetScheduler scheduler = new DatasetScheduler(catalog, triggers, taskScheduler, metrics, "0 0 6 * * *");

        LoggingDeadLetterSink deadLetters = new LoggingDeadLetterSink(10);
        subscription = new PushSubscription("fetch-requests-push", m -> { }, new SubscriptionSettings(),
                deadLetters, metrics);
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("fetchRequestSubscription", subscription);

        PipelineStatusController controller = new PipelineStatusController(new PipelineProperties(), catalog,
                stateStore, coordinator, deadLetters, scheduler, beans.getBeanProvider(PushSubscription.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        subscription.close();
        taskScheduler.shutdown();
    }

    private static DatasetRegistration registration(String id, String filename) {
        return DatasetRegistration.builder()
                .descriptor(DatasetDescriptor.builder().id(id).url("https://example.org/" + id)
                        .gcsBucket("landing").filename(filename).build())
                .build();
    }

    @Test
    @DisplayName("GET /status lists datasets, markers and subscriptions")
    void testStatus() throws Exception {
        stateStore.beginAttempt("household_income", "load_1", Instant.parse("2024-05-01T10:00:00Z"));
        stateStore.markCompleted("household_income", "load_1", 3, Instant.parse("2024-05-01T10:00:05Z"));

        mockMvc.perform(get("/api/pipeline/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runtime").value("local"))
                .andExpect(jsonPath("$.datasets[0]").value("HOUSEHOLD_INCOME"))
                .andExpect(jsonPath("$.tables[0].table").value("household_income"))
                .andExpect(jsonPath("$.tables[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.tables[0].version").value(1))
                .andExpect(jsonPath("$.subscriptions[0].name").value("fetch-requests-push"));
    }

    @Test
    @DisplayName("GET /tables/{table} returns 404 for a table never loaded")
    void testTable() throws Exception {
        mockMvc.perform(get("/api/pipeline/tables/nope"))
                .andExpect(status().isNotFound());

        stateStore.beginAttempt("poverty_by_state", "load_2", Instant.now());
        mockMvc.perform(get("/api/pipeline/tables/poverty_by_state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    @DisplayName("POST /joins/{name}/evaluate reports the PENDING task")
    void testEvaluateJoin() throws Exception {
        mockMvc.perform(post("/api/pipeline/joins/income_poverty/evaluate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PENDING"));
        mockMvc.perform(get("/api/pipeline/joins"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].join").value("income_poverty"));
        mockMvc.perform(post("/api/pipeline/joins/unknown/evaluate"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /datasets/{id}/fetch publishes a FetchRequest")
    void testFetch() throws Exception {
        mockMvc.perform(post("/api/pipeline/datasets/HOUSEHOLD_INCOME/fetch"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("PUBLISHED"))
                .andExpect(jsonPath("$.messageId").value("fetch-requests-1"));
        mockMvc.perform(post("/api/pipeline/datasets/NOPE/fetch"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /datasets/{id}/fetch returns 503 when the publish fails")
    void testFetch_PublishFailed() throws Exception {
        RecordingTopicPublisher failing = new RecordingTopicPublisher("fetch-requests", 1);
        DatasetCatalog catalog = new DatasetCatalog(List.of(registration("HOUSEHOLD_INCOME", "SAIPE")));
        PipelineMetrics metrics = Metrics.simple();
        PipelineStatusController controller = new PipelineStatusController(new PipelineProperties(), catalog,
                stateStore, new JoinCoordinator(List.of(), stateStore, null, metrics, Clock.systemUTC(),
                        Duration.ofHours(1), Duration.ofMinutes(5), Runnable::run),
                new LoggingDeadLetterSink(1),
                new DatasetScheduler(catalog, failing, taskScheduler, metrics, "0 0 6 * * *"),
                new StaticListableBeanFactory().getBeanProvider(PushSubscription.class));

        MockMvcBuilders.standaloneSetup(controller).build()
                .perform(post("/api/pipeline/datasets/HOUSEHOLD_INCOME/fetch"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("FAILED"));
    }
}
