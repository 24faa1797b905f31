package com.salesanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response model for job polling. Outcome fields stay absent until the job finishes;
 * {@code result} is the analysis report JSON, embedded as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisJobStatus {

    private UUID jobId;
    private String status;
    private int topN;

    private Integer rawRowCount;
    private Integer cleanedRowCount;
    private Integer rowsDropped;
    private Integer productCount;
    private Boolean cached;

    @JsonRawValue
    private String result;

    private String failureType;
    private String errorMessage;

    private Instant submittedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Long executionTimeMs;
}
