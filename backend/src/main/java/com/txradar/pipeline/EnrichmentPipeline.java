package com.txradar.pipeline;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.RawTransaction;
import com.txradar.pipeline.anomaly.AnomalyDetector;
import com.txradar.pipeline.category.CategoryProfiler;
import com.txradar.pipeline.enrichment.EnrichmentOptions;
import com.txradar.pipeline.enrichment.ExternalEnrichmentAdapter;
import com.txradar.pipeline.normalizer.TransactionNormalizer;
import com.txradar.pipeline.quality.DataQualityScorer;
import com.txradar.pipeline.recurrence.RecurrenceAnalyzer;
import com.txradar.pipeline.temporal.TemporalFeatureGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs the stages strictly in order over the whole batch: normalize, temporal, category profile, anomaly,
 * recurrence, quality, then external enrichment. Each stage sees the complete output of the previous one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrichmentPipeline {

    private final TransactionNormalizer normalizer;
    private final TemporalFeatureGenerator temporalFeatureGenerator;
    private final CategoryProfiler categoryProfiler;
    private final AnomalyDetector anomalyDetector;
    private final RecurrenceAnalyzer recurrenceAnalyzer;
    private final DataQualityScorer dataQualityScorer;
    private final ExternalEnrichmentAdapter externalEnrichmentAdapter;

    /**
     * @throws PipelineException for an empty or unrecognizable batch; nothing else aborts the run
     */
    public PipelineResult run(List<RawTransaction> rawBatch, EnrichmentOptions options) {
        PipelineDiagnostics diagnostics = new PipelineDiagnostics();
        TransactionBatch batch = normalizer.normalize(rawBatch, diagnostics);
        temporalFeatureGenerator.apply(batch);
        Map<String, CategoryProfile> profiles = categoryProfiler.apply(batch);
        anomalyDetector.apply(batch, profiles);
        recurrenceAnalyzer.apply(batch);
        dataQualityScorer.apply(batch);
        externalEnrichmentAdapter.apply(batch, options);

        Map<String, Long> counters = diagnostics.snapshot();
        log.info("Pipeline completed: {} rows, counters {}", batch.size(), counters);
        return new PipelineResult(batch.getRecords(), profiles, counters);
    }
}
