package com.salesanalytics.api;

import com.salesanalytics.domain.exception.AnalysisJobNotFoundException;
import com.salesanalytics.domain.exception.DatasetValidationException;
import com.salesanalytics.domain.exception.SalesDataReadException;
import com.salesanalytics.domain.model.AnalysisJobStatus;
import com.salesanalytics.domain.model.ValidationResult;
import com.salesanalytics.domain.service.AnalysisJobProcessor;
import com.salesanalytics.domain.service.AnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Request mapping and error translation of the sales API.
 */
@ExtendWith(MockitoExtension.class)
class SalesAnalyticsControllerTest {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");
    private static final String CSV = "date,model,units_sold,avg_price\n2022-01-01,A,1,1\n";

    @Mock
    private AnalysisService analysisService;

    @Mock
    private AnalysisJobProcessor jobProcessor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SalesAnalyticsController(analysisService, jobProcessor))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testValidate() throws Exception {
        when(analysisService.validate(CSV)).thenReturn(ValidationResult.passed());

        mockMvc.perform(post("/api/v1/sales/validate").contentType(TEXT_CSV).content(CSV))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.errors").isEmpty());
    }

    @Test
    void testAnalyze_MissingColumnIsUnprocessable() throws Exception {
        when(analysisService.analyze(anyString(), isNull()))
                .thenThrow(new DatasetValidationException(List.of("Missing required column: avg_price")));

        mockMvc.perform(post("/api/v1/sales/analysis").contentType(TEXT_CSV).content(CSV))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value(422))
                .andExpect(jsonPath("$.details[0]").value("Missing required column: avg_price"));
    }

    @Test
    void testAnalyze_UnreadableDataIsBadRequest() throws Exception {
        when(analysisService.analyze(anyString(), eq(3)))
                .thenThrow(new SalesDataReadException("Line 2 of request body has 5 fields, header has 4"));

        mockMvc.perform(post("/api/v1/sales/analysis").param("topN", "3")
                        .contentType(MediaType.TEXT_PLAIN).content(CSV))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unreadable Data"));
    }

    @Test
    void testAnalyze_InvalidTopNIsBadRequest() throws Exception {
        when(analysisService.analyze(anyString(), eq(0)))
                .thenThrow(new IllegalArgumentException("topN must be at least 1, was 0"));

        mockMvc.perform(post("/api/v1/sales/analysis").param("topN", "0").contentType(TEXT_CSV).content(CSV))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("topN must be at least 1, was 0"));
    }

    @Test
    void testSubmitJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobProcessor.submitJob(CSV, null)).thenReturn(jobId);

        mockMvc.perform(post("/api/v1/sales/jobs").contentType(TEXT_CSV).content(CSV))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value(jobId.toString()));
    }

    @Test
    void testGetJobStatus_EmbedsResultJson() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobProcessor.getJobStatus(jobId)).thenReturn(AnalysisJobStatus.builder()
                .jobId(jobId)
                .status("COMPLETED")
                .result("{\"cached\":false}")
                .build());

        mockMvc.perform(get("/api/v1/sales/jobs/{jobId}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.result.cached").value(false))
                .andExpect(jsonPath("$.errorMessage").doesNotExist());
    }

    @Test
    void testGetJobStatus_NotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobProcessor.getJobStatus(jobId)).thenThrow(new AnalysisJobNotFoundException(jobId));

        mockMvc.perform(get("/api/v1/sales/jobs/{jobId}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: " + jobId));
    }
}
