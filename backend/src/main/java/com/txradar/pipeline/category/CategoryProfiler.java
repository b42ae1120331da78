package com.txradar.pipeline.category;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 3: attaches category metadata and per-category net amount baselines.
 * Statistics are population mean/std over every row of the category with a known net amount, outliers
 * included. Rows without a category are profiled together under the empty key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryProfiler {

    static final String NO_CATEGORY = "";

    private final CategoryMetadataRegistry registry;

    /**
     * Builds profiles (full pass) then attaches them to every row. Returns profiles keyed by category.
     */
    public Map<String, CategoryProfile> apply(TransactionBatch batch) {
        Map<String, CategoryProfile> profiles = buildProfiles(batch.getRecords());
        Set<String> unknown = new HashSet<>();
        for (TransactionRecord r : batch.getRecords()) {
            CategoryProfile p = profiles.get(key(r));
            r.setCategoryType(p.type());
            r.setCategoryPriority(p.priority());
            r.setCategoryTaxDeductible(p.taxDeductible());
            r.setCatRowCount(p.rowCount());
            r.setCatNetMean(p.meanNet());
            r.setCatNetStd(p.stdNet());
            if (r.getCategory() != null && !registry.isKnown(r.getCategory())) {
                unknown.add(r.getCategory());
                batch.getDiagnostics().increment(PipelineDiagnostics.UNKNOWN_CATEGORY);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Categories without metadata, defaulted to UNKNOWN: {}", unknown);
        }
        log.info("Profiled {} categories over {} rows", profiles.size(), batch.size());
        return profiles;
    }

    Map<String, CategoryProfile> buildProfiles(List<TransactionRecord> records) {
        Map<String, List<TransactionRecord>> byCategory = new LinkedHashMap<>();
        for (TransactionRecord r : records) {
            byCategory.computeIfAbsent(key(r), k -> new ArrayList<>()).add(r);
        }
        Map<String, CategoryProfile> profiles = new LinkedHashMap<>();
        byCategory.forEach((category, rows) -> profiles.put(category, profile(category, rows)));
        return profiles;
    }

    private CategoryProfile profile(String category, List<TransactionRecord> rows) {
        double[] values = rows.stream()
                .filter(r -> r.getNetAmount() != null)
                .mapToDouble(r -> r.getNetAmount().doubleValue())
                .toArray();
        double mean = 0d;
        double std = 0d;
        if (values.length > 0) {
            double sum = 0d;
            for (double v : values) {
                sum += v;
            }
            mean = sum / values.length;
        }
        if (values.length >= 2) {
            double squares = 0d;
            for (double v : values) {
                squares += (v - mean) * (v - mean);
            }
            std = Math.sqrt(squares / values.length);
        }
        CategoryMetadata meta = registry.lookup(NO_CATEGORY.equals(category) ? null : category);
        return new CategoryProfile(category, meta.priority(), meta.type(), meta.taxDeductible(),
                rows.size(), mean, std);
    }

    static String key(TransactionRecord r) {
        return r.getCategory() == null ? NO_CATEGORY : r.getCategory();
    }
}
