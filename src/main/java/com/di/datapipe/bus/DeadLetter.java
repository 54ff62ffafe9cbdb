package com.di.datapipe.bus;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DeadLetter {
    String subscription;
    String messageId;
    int attempts;
    String category;
    String reason;
    String payload;
    Instant deadLetteredAt;
}
