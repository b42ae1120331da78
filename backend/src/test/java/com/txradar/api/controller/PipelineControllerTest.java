package com.txradar.api.controller;

import com.txradar.config.ClockConfig;
import com.txradar.domain.PipelineRun;
import com.txradar.domain.TransactionRecord;
import com.txradar.ingestion.SourceUnavailableException;
import com.txradar.job.PipelineRunService;
import com.txradar.job.PipelineRunSummary;
import com.txradar.pipeline.PipelineException;
import com.txradar.pipeline.enrichment.EnrichmentOptions;
import com.txradar.query.TransactionQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {PipelineController.class, TransactionQueryController.class})
@Import(ClockConfig.class)
class PipelineControllerTest {

    private static final Instant STARTED = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    PipelineRunService pipelineRunService;
    @MockBean
    TransactionQueryService transactionQueryService;

    @BeforeEach
    void defaults() {
        when(pipelineRunService.defaultOptions())
                .thenReturn(new EnrichmentOptions(true, false, "US", "USD", false));
    }

    @Test
    @DisplayName("POST /runs applies request overrides and returns the run summary")
    void runWithOverrides() {
        EnrichmentOptions expected = new EnrichmentOptions(false, true, "DE", "EUR", false);
        when(pipelineRunService.run(expected)).thenReturn(new PipelineRunSummary("run-1",
                PipelineRun.Status.COMPLETE, 12, 3, Map.of("anomalies", 2L), STARTED, STARTED.plusSeconds(4)));

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"holidays_enabled\":false,\"fx_enabled\":true,\"country_code\":\"de\",\"target_currency\":\"eur\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.run_id").isEqualTo("run-1")
                .jsonPath("$.status").isEqualTo("COMPLETE")
                .jsonPath("$.row_count").isEqualTo(12)
                .jsonPath("$.category_count").isEqualTo(3)
                .jsonPath("$.counters.anomalies").isEqualTo(2);
    }

    @Test
    @DisplayName("POST /runs without a body runs with the configured defaults")
    void runWithoutBody() {
        when(pipelineRunService.run(any())).thenReturn(new PipelineRunSummary("run-2",
                PipelineRun.Status.COMPLETE, 0, 0, Map.of(), STARTED, STARTED));

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .exchange()
                .expectStatus().isOk();

        verify(pipelineRunService).run(new EnrichmentOptions(true, false, "US", "USD", false));
    }

    @Test
    @DisplayName("invalid country code is rejected with 400 before any run starts")
    void invalidCountryCode() {
        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"country_code\":\"USA\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_COUNTRY_CODE")
                .jsonPath("$.timestamp").exists();

        verify(pipelineRunService, never()).run(any());
    }

    @Test
    @DisplayName("empty batch maps to 422 with the error code")
    void emptyBatch() {
        when(pipelineRunService.run(any()))
                .thenThrow(new PipelineException(PipelineException.EMPTY_BATCH, "Input batch has no rows"));

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("EMPTY_BATCH")
                .jsonPath("$.message").isEqualTo("Input batch has no rows");
    }

    @Test
    @DisplayName("unreachable source maps to 502")
    void sourceUnavailable() {
        when(pipelineRunService.run(any())).thenThrow(new SourceUnavailableException("connection refused"));

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SOURCE_UNAVAILABLE");
    }

    @Test
    @DisplayName("GET /runs/latest is 404 before any run completed")
    void latestMissing() {
        when(pipelineRunService.latestCompletedRun()).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/pipeline/runs/latest")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET /transactions returns snake_case rows of the latest run")
    void listTransactions() {
        TransactionRecord r = new TransactionRecord();
        r.setRowIndex(4);
        r.setCategory("Travel");
        r.setNetAmount(new BigDecimal("-900.00"));
        r.setAnomaly(true);
        r.getAnomalyReasons().add("LARGE_TRANSACTION");
        when(transactionQueryService.find("Travel", true))
                .thenReturn(new TransactionQueryService.TransactionPage("run-1", List.of(r)));

        webTestClient.get()
                .uri("/api/v1/transactions?category=Travel&anomaliesOnly=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.run_id").isEqualTo("run-1")
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.transactions[0].row_index").isEqualTo(4)
                .jsonPath("$.transactions[0].is_anomaly").isEqualTo(true)
                .jsonPath("$.transactions[0].anomaly_reasons[0]").isEqualTo("LARGE_TRANSACTION");
    }
}
