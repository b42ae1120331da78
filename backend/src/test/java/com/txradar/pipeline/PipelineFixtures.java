package com.txradar.pipeline;

import com.txradar.domain.RawTransaction;
import com.txradar.pipeline.anomaly.AnomalyDetector;
import com.txradar.pipeline.anomaly.LargeTransactionRule;
import com.txradar.pipeline.anomaly.RareCategoryRule;
import com.txradar.pipeline.anomaly.ZScoreOutlierRule;
import com.txradar.pipeline.category.CategoryMetadataRegistry;
import com.txradar.pipeline.category.CategoryProfiler;
import com.txradar.pipeline.config.AnomalyProperties;
import com.txradar.pipeline.config.CategoryProperties;
import com.txradar.pipeline.config.EnrichmentProperties;
import com.txradar.pipeline.config.NormalizerProperties;
import com.txradar.pipeline.config.QualityProperties;
import com.txradar.pipeline.config.RecurrenceProperties;
import com.txradar.pipeline.enrichment.ExternalEnrichmentAdapter;
import com.txradar.pipeline.enrichment.FxEnricher;
import com.txradar.pipeline.enrichment.FxRateLookup;
import com.txradar.pipeline.enrichment.HolidayEnricher;
import com.txradar.pipeline.enrichment.HolidayLookup;
import com.txradar.pipeline.normalizer.TransactionNormalizer;
import com.txradar.pipeline.quality.DataQualityScorer;
import com.txradar.pipeline.recurrence.RecurrenceAnalyzer;
import com.txradar.pipeline.temporal.TemporalFeatureGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for raw rows and a fully wired pipeline with default properties.
 */
public final class PipelineFixtures {

    private PipelineFixtures() {
    }

    /** Row from alternating column name / value pairs; null values are kept as present-but-null. */
    public static RawTransaction raw(int rowIndex, Object... columnsAndValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < columnsAndValues.length; i += 2) {
            fields.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new RawTransaction(rowIndex, fields);
    }

    /** Fake-bank shaped row: transactionDate, description, category, debit, credit. */
    public static RawTransaction bankRow(int rowIndex, String date, String description, String category,
                                         Object debit, Object credit) {
        return raw(rowIndex,
                "id", rowIndex + 1,
                "transactionDate", date,
                "description", description,
                "category", category,
                "debit", debit,
                "credit", credit);
    }

    /** Debit-only rows of one category and description, one per amount, on consecutive days of Jan 2024. */
    public static List<RawTransaction> debits(String category, double... amounts) {
        List<RawTransaction> rows = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            rows.add(bankRow(i, String.format("2024-01-%02d", i + 1), "Store purchase " + i, category,
                    amounts[i], null));
        }
        return rows;
    }

    public static TransactionBatch normalize(List<RawTransaction> rows) {
        return new TransactionNormalizer(new NormalizerProperties()).normalize(rows, new PipelineDiagnostics());
    }

    public static EnrichmentPipeline pipeline(HolidayLookup holidayLookup, FxRateLookup fxRateLookup) {
        AnomalyProperties anomalyProperties = new AnomalyProperties();
        return new EnrichmentPipeline(
                new TransactionNormalizer(new NormalizerProperties()),
                new TemporalFeatureGenerator(),
                new CategoryProfiler(new CategoryMetadataRegistry(new CategoryProperties())),
                new AnomalyDetector(List.of(
                        new ZScoreOutlierRule(anomalyProperties),
                        new LargeTransactionRule(anomalyProperties),
                        new RareCategoryRule(anomalyProperties))),
                new RecurrenceAnalyzer(new RecurrenceProperties()),
                new DataQualityScorer(new QualityProperties()),
                new ExternalEnrichmentAdapter(
                        new HolidayEnricher(holidayLookup),
                        new FxEnricher(fxRateLookup),
                        Runnable::run,
                        new EnrichmentProperties()));
    }
}
