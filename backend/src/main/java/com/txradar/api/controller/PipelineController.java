package com.txradar.api.controller;

import com.txradar.api.dto.PipelineRunResponse;
import com.txradar.api.dto.RunPipelineRequest;
import com.txradar.job.PipelineRunService;
import com.txradar.job.PipelineRunSummary;
import com.txradar.pipeline.enrichment.EnrichmentOptions;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Triggers a pipeline run and reports the last completed one.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineRunService pipelineRunService;

    /**
     * Completes when the run does; 422 when the batch is empty or unrecognizable, 502 when the source is down.
     * The run blocks on HTTP lookups and Mongo writes, so it executes on boundedElastic, never on the event loop.
     */
    @PostMapping("/runs")
    public Mono<ResponseEntity<PipelineRunResponse>> run(@Valid @RequestBody(required = false) RunPipelineRequest request) {
        EnrichmentOptions defaults = pipelineRunService.defaultOptions();
        EnrichmentOptions options = request == null
                ? defaults
                : defaults.withOverrides(request.holidaysEnabled(), request.fxEnabled(),
                        request.countryCode(), request.targetCurrency());
        return Mono.fromCallable(() -> pipelineRunService.run(options))
                .subscribeOn(Schedulers.boundedElastic())
                .map(PipelineRunResponse::from)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<PipelineRunResponse> latest() {
        return pipelineRunService.latestCompletedRun()
                .map(PipelineRunSummary::of)
                .map(PipelineRunResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
