package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CleaningStepResult {

    String step;
    String reason;
    int rowsBefore;
    int rowsDropped;
}
