package com.di.datapipe.api;

import com.di.datapipe.bus.DeadLetter;
import com.di.datapipe.bus.DeadLetterSink;
import com.di.datapipe.bus.MessageHandler;
import com.di.datapipe.bus.PushEnvelope;
import com.di.datapipe.bus.PushMessage;
import com.di.datapipe.bus.SubscriptionSettings;
import com.di.datapipe.config.PipelineProperties;
import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.exception.InvalidMessageException;
import com.di.datapipe.ingestion.IngestionWorker;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.security.PushEndpointGuard;
import com.di.datapipe.util.MdcKeys;
import com.di.datapipe.warehouse.WarehouseLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Instant;

/**
 * Pub/Sub push endpoints for the gcp runtime.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Invoker</th><th>Handler</th></tr>
 * <tr><td>POST</td><td>/push/fetch-requests</td><td>ingestion invoker</td><td>{@link IngestionWorker}</td></tr>
 * <tr><td>POST</td><td>/push/landed-objects</td><td>loader invoker</td><td>{@link WarehouseLoader}</td></tr>
 * </table>
 *
 * The bearer token is verified before the body is read. 204 acknowledges, including a delivery whose
 * handler failed with a non-retryable category: that message is recorded as a dead letter and dropped.
 * Every other status comes from {@link com.di.datapipe.exception.GlobalExceptionHandler} and makes
 * Pub/Sub redeliver.
 */
@Slf4j
@RestController
@RequestMapping("/push")
@ConditionalOnProperty(name = "datapipe.runtime", havingValue = "gcp")
public class PushEndpointController {

    private static final int PREVIEW_CHARS = 2000;

    private final PushEndpointGuard guard;
    private final IngestionWorker ingestionWorker;
    private final WarehouseLoader warehouseLoader;
    private final PipelineProperties properties;
    private final DeadLetterSink deadLetters;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;

    public PushEndpointController(PushEndpointGuard guard,
                                  IngestionWorker ingestionWorker,
                                  WarehouseLoader warehouseLoader,
                                  PipelineProperties properties,
                                  DeadLetterSink deadLetters,
                                  PipelineMetrics metrics,
                                  ObjectMapper objectMapper) {
        this.guard = guard;
        this.ingestionWorker = ingestionWorker;
        this.warehouseLoader = warehouseLoader;
        this.properties = properties;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/fetch-requests")
    public ResponseEntity<Void> onFetchRequest(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) byte[] body) {
        guard.verify(authorization, properties.getIdentities().getIngestionInvoker());
        deliver(properties.getBus().getTriggerTopic() + "-push", body, ingestionWorker,
                properties.getBus().getTrigger());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/landed-objects")
    public ResponseEntity<Void> onLandedObject(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) byte[] body) {
        guard.verify(authorization, properties.getIdentities().getLoaderInvoker());
        deliver(properties.getBus().getNotificationTopic() + "-push", body, warehouseLoader,
                properties.getBus().getNotification());
        return ResponseEntity.noContent().build();
    }

    private void deliver(String subscription, byte[] body, MessageHandler handler, SubscriptionSettings settings) {
        PushMessage message = parse(body);
        try (MDC.MDCCloseable s = MDC.putCloseable(MdcKeys.SUBSCRIPTION, subscription);
             MDC.MDCCloseable m = MDC.putCloseable(MdcKeys.MESSAGE_ID, message.getMessageId())) {
            try {
                handler.handle(message);
                metrics.recordDelivery(subscription, "acked");
            } catch (RuntimeException e) {
                FailureCategory category = FailureCategory.categorize(e);
                if (!category.isRetryable()) {
                    // acknowledged after recording: a redelivery cannot change the outcome
                    deadLetter(subscription, message, category, e);
                    log.error("[PUSH] messageId={} dead-lettered [{}] and acknowledged: {}",
                            message.getMessageId(), category.name(), e.getMessage());
                    return;
                }
                metrics.recordDelivery(subscription, "nacked");
                if (message.getDeliveryAttempt() >= settings.getMaxDeliveryAttempts()) {
                    // Pub/Sub's dead-letter policy forwards the message; this records it for the status API
                    deadLetter(subscription, message, category, e);
                }
                throw e;
            }
        }
    }

    private void deadLetter(String subscription, PushMessage message, FailureCategory category, RuntimeException e) {
        metrics.recordDelivery(subscription, "dead_lettered");
        metrics.recordDeadLetter(subscription, category.name());
        deadLetters.accept(DeadLetter.builder()
                .subscription(subscription)
                .messageId(message.getMessageId())
                .attempts(message.getDeliveryAttempt())
                .category(category.name())
                .reason(e.getClass().getSimpleName() + ": " + e.getMessage())
                .payload(message.preview(PREVIEW_CHARS))
                .deadLetteredAt(Instant.now())
                .build());
    }

    private PushMessage parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidMessageException("Empty push body");
        }
        PushEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, PushEnvelope.class);
        } catch (IOException e) {
            throw new InvalidMessageException("Unreadable push envelope: " + e.getMessage(), e);
        }
        if (envelope.getMessage() == null) {
            throw new InvalidMessageException("Push envelope has no message");
        }
        return envelope.toPushMessage();
    }
}
