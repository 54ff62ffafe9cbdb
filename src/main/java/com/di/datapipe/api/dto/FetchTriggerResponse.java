package com.di.datapipe.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FetchTriggerResponse {

    String datasetId;
    /** PUBLISHED or FAILED */
    String status;
    String messageId;
}
