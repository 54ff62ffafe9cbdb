package com.di.datapipe.api.dto;

import com.di.datapipe.bus.DeadLetter;
import com.di.datapipe.join.JoinTaskSnapshot;
import com.di.datapipe.state.TableLoadMarker;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response for {@code GET /api/pipeline/status}: per-table markers, current join tasks, recent dead
 * letters and, in the local runtime, in-process subscription counters.
 */
@Value
@Builder
public class PipelineStatusResponse {

    String runtime;
    List<String> datasets;
    List<TableLoadMarker> tables;
    List<JoinTaskSnapshot> joins;
    List<DeadLetter> deadLetters;
    List<SubscriptionStatus> subscriptions;
}
