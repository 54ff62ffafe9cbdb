package com.di.datapipe.join;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JoinTaskSnapshot {

    String id;
    String join;
    JoinState state;
    Instant createdAt;
    Instant startedAt;
    Instant finishedAt;
    Map<String, Long> inputVersions;
    Long rowCount;
    String error;
}
