package com.txradar.pipeline;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.TransactionRecord;

import java.util.List;
import java.util.Map;

/**
 * Enriched rows in input order, the category profiles of the run and the diagnostics counters.
 */
public record PipelineResult(
        List<TransactionRecord> records,
        Map<String, CategoryProfile> categoryProfiles,
        Map<String, Long> counters
) {
}
