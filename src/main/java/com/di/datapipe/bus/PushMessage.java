package com.di.datapipe.bus;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * One delivery of a bus message. The same {@code messageId} is seen again on redelivery with a higher
 * {@code deliveryAttempt}.
 */
@Value
@Builder(toBuilder = true)
public class PushMessage {

    String messageId;

    byte[] data;

    @Singular
    Map<String, String> attributes;

    Instant publishTime;

    int deliveryAttempt;

    public PushMessage withDeliveryAttempt(int attempt) {
        return toBuilder().deliveryAttempt(attempt).build();
    }

    /** Payload as UTF-8, cut at {@code maxChars} for logging. */
    public String preview(int maxChars) {
        if (data == null) {
            return "<null>";
        }
        String text = new String(data, StandardCharsets.UTF_8);
        return maxChars > 0 && text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
