package com.di.datapipe.bus;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Body of a Pub/Sub push request. {@code data} arrives base64-encoded and is decoded by Jackson.
 */
@Slf4j
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushEnvelope {

    private Message message;

    private String subscription;

    private Integer deliveryAttempt;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        private byte[] data;

        private Map<String, String> attributes;

        @JsonAlias("message_id")
        private String messageId;

        @JsonAlias("publish_time")
        private String publishTime;
    }

    public PushMessage toPushMessage() {
        PushMessage.PushMessageBuilder builder = PushMessage.builder()
                .messageId(message.getMessageId())
                .data(message.getData() == null ? new byte[0] : message.getData())
                .deliveryAttempt(deliveryAttempt == null ? 1 : deliveryAttempt)
                .publishTime(parseInstant(message.getPublishTime()));
        if (message.getAttributes() != null) {
            builder.attributes(message.getAttributes());
        }
        return builder.build();
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable publishTime '{}'", value);
            return null;
        }
    }
}
