package com.di.datapipe.config;

import com.di.datapipe.bus.SubscriptionSettings;
import com.di.datapipe.join.JoinDefinition;
import com.di.datapipe.model.DatasetDescriptor;
import com.di.datapipe.model.DatasetRegistration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All {@code datapipe.*} settings (application.yml / application-{profile}.yml).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "datapipe")
public class PipelineProperties {

    /** {@code local} (in-memory ports, in-process buses) or {@code gcp}. */
    @Pattern(regexp = "local|gcp")
    private String runtime = "local";

    @Valid
    private List<Dataset> datasets = new ArrayList<>();

    @Valid
    private List<Join> joins = new ArrayList<>();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Bus bus = new Bus();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Warehouse warehouse = new Warehouse();

    @Valid
    private JoinSettings join = new JoinSettings();

    private Push push = new Push();

    private Identities identities = new Identities();

    @Valid
    private State state = new State();

    private Gcp gcp = new Gcp();

    @Data
    public static class Dataset {
        @NotBlank
        private String id;
        private String url;
        @NotBlank
        private String gcsBucket;
        private String filename;
        private String fileprefix;
        /** Six-field Spring cron; blank means {@code datapipe.scheduler.default-cron}. */
        private String schedule;
        @NotBlank
        private String fetcher = "http";
        private boolean enabled = true;

        public DatasetRegistration toRegistration() {
            return DatasetRegistration.builder()
                    .descriptor(DatasetDescriptor.builder()
                            .id(id)
                            .url(url)
                            .gcsBucket(gcsBucket)
                            .filename(blankToNull(filename))
                            .fileprefix(blankToNull(fileprefix))
                            .build())
                    .schedule(schedule)
                    .fetcher(fetcher)
                    .enabled(enabled)
                    .build();
        }
    }

    @Data
    public static class Join {
        @NotBlank
        private String name;
        /** Dataset ids whose tables must be COMPLETED before the query runs. */
        @NotEmpty
        private List<String> dependsOn = new ArrayList<>();
        @NotBlank
        private String destinationTable;
        @NotBlank
        private String query;

        public JoinDefinition toDefinition() {
            return JoinDefinition.builder()
                    .name(name)
                    .dependsOn(dependsOn)
                    .destinationTable(destinationTable)
                    .query(query)
                    .build();
        }
    }

    @Data
    public static class Scheduler {
        /** Daily at 06:00. */
        @NotBlank
        private String defaultCron = "0 0 6 * * *";
        @Min(1)
        private int poolSize = 4;
    }

    @Data
    public static class Bus {
        private String triggerTopic = "fetch-requests";
        private String notificationTopic = "landed-objects";
        @Valid
        private SubscriptionSettings trigger = new SubscriptionSettings();
        @Valid
        private SubscriptionSettings notification = new SubscriptionSettings();
        /** Dead letters kept in memory for the status API. */
        @Min(1)
        private int deadLetterCapacity = 200;
    }

    @Data
    public static class Ingestion {
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(120);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(90);
        @NotNull
        private Duration publishTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int fetchThreads = 4;
        @Valid
        private PublishRetry publishRetry = new PublishRetry();
    }

    @Data
    public static class PublishRetry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration waitDuration = Duration.ofSeconds(1);
    }

    @Data
    public static class Warehouse {
        private String project;
        @NotBlank
        private String dataset = "datapipe";
        @NotNull
        private Duration loadTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration queryTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class JoinSettings {
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(1);
        @NotNull
        private Duration staleAfter = Duration.ofHours(26);
        @NotNull
        private Duration retryAfter = Duration.ofMinutes(15);
    }

    @Data
    public static class Push {
        /** Expected {@code aud} claim of push OIDC tokens, usually the service URL. */
        private String audience;
    }

    @Data
    public static class Identities {
        /** Service account the trigger push subscription signs its tokens with. */
        private String ingestionInvoker;
        /** Service account the notification push subscription signs its tokens with. */
        private String loaderInvoker;
    }

    @Data
    public static class State {
        /** {@code memory} or {@code jdbc}. */
        @Pattern(regexp = "memory|jdbc")
        private String store = "memory";
        private Jdbc jdbc = new Jdbc();
    }

    @Data
    public static class Jdbc {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 5;
        private long connectionTimeoutMs = 30_000;
    }

    @Data
    public static class Gcp {
        private String projectId;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
