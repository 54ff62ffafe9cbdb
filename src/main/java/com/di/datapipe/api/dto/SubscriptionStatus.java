package com.di.datapipe.api.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubscriptionStatus {

    String name;
    int outstanding;
    long deliveryAttempts;
    long acked;
}
