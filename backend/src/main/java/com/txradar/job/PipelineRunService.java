package com.txradar.job;

import com.txradar.domain.PipelineRun;
import com.txradar.domain.PipelineRunRepository;
import com.txradar.domain.RawTransaction;
import com.txradar.ingestion.SourceIngester;
import com.txradar.ingestion.SourceUnavailableException;
import com.txradar.load.EnrichedTransactionSink;
import com.txradar.pipeline.EnrichmentPipeline;
import com.txradar.pipeline.PipelineException;
import com.txradar.pipeline.PipelineResult;
import com.txradar.pipeline.config.EnrichmentProperties;
import com.txradar.pipeline.enrichment.EnrichmentOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One pipeline run end to end: ingest the raw batch, run the enrichment engine, hand the result to the sink.
 * Each run is recorded in pipeline_runs as RUNNING, then COMPLETE or FAILED. Runs are serialized.
 */
@Service
@EnableConfigurationProperties(PipelineJobProperties.class)
@RequiredArgsConstructor
@Slf4j
public class PipelineRunService {

    private final SourceIngester sourceIngester;
    private final EnrichmentPipeline enrichmentPipeline;
    private final EnrichedTransactionSink sink;
    private final PipelineRunRepository pipelineRunRepository;
    private final EnrichmentProperties enrichmentProperties;
    private final Clock clock;

    public PipelineRunSummary runWithDefaults() {
        return run(defaultOptions());
    }

    public EnrichmentOptions defaultOptions() {
        return EnrichmentOptions.from(enrichmentProperties);
    }

    /**
     * @throws PipelineException          when the batch is empty or unrecognizable; the run is stored as FAILED
     * @throws SourceUnavailableException when the source cannot be read; the run is stored as FAILED
     */
    public synchronized PipelineRunSummary run(EnrichmentOptions options) {
        PipelineRun run = new PipelineRun();
        run.setId(UUID.randomUUID().toString());
        run.setStatus(PipelineRun.Status.RUNNING);
        run.setStartedAt(clock.instant());
        pipelineRunRepository.save(run);
        log.info("Pipeline run {} started with {}", run.getId(), options);

        try {
            List<RawTransaction> rawBatch = sourceIngester.fetchBatch();
            PipelineResult result = enrichmentPipeline.run(rawBatch, options);
            int written = sink.write(run.getId(), result.records());

            run.setStatus(PipelineRun.Status.COMPLETE);
            run.setRowCount(written);
            run.setCategoryCount(result.categoryProfiles().size());
            run.setCounters(new TreeMap<>(result.counters()));
            run.setCompletedAt(clock.instant());
            pipelineRunRepository.save(run);
            log.info("Pipeline run {} COMPLETE: {} rows, {} categories", run.getId(), written, run.getCategoryCount());
            return PipelineRunSummary.of(run);
        } catch (PipelineException e) {
            markFailed(run, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (SourceUnavailableException e) {
            markFailed(run, SourceUnavailableException.ERROR_CODE, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            markFailed(run, "INTERNAL_ERROR", e.getMessage());
            throw e;
        }
    }

    public Optional<PipelineRun> latestCompletedRun() {
        return pipelineRunRepository.findFirstByStatusOrderByStartedAtDesc(PipelineRun.Status.COMPLETE);
    }

    private void markFailed(PipelineRun run, String errorCode, String message) {
        run.setStatus(PipelineRun.Status.FAILED);
        run.setErrorCode(errorCode);
        run.setErrorMessage(message);
        run.setCompletedAt(clock.instant());
        pipelineRunRepository.save(run);
        log.warn("Pipeline run {} FAILED [{}]: {}", run.getId(), errorCode, message);
    }
}
