package com.di.datapipe.bus;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Push subscription delivery settings. Defaults follow Pub/Sub push defaults except
 * {@code maxDeliveryAttempts}, which bounds retries before dead-lettering.
 */
@Data
public class SubscriptionSettings {

    /** Window in which a handler must finish; past it the attempt is abandoned and redelivered. */
    @NotNull
    private Duration ackDeadline = Duration.ofSeconds(20);

    @NotNull
    private Duration minBackoff = Duration.ofSeconds(10);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(600);

    /** Attempts before a retryable failure is dead-lettered. */
    @Min(1)
    private int maxDeliveryAttempts = 5;

    /** Handler threads for the in-process runtime. */
    @Min(1)
    private int maxConcurrency = 8;

    /** Exponential backoff after failed attempt {@code attempt} (1-based), capped at {@link #maxBackoff}. */
    public Duration backoffFor(int attempt) {
        long base = Math.max(1, minBackoff.toMillis());
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = base << shift;
        if (millis <= 0 || millis > maxBackoff.toMillis()) {
            millis = maxBackoff.toMillis();
        }
        return Duration.ofMillis(millis);
    }
}
