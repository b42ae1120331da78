package com.txradar.pipeline.anomaly;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.TransactionRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-category baselines for z-scores: the profile statistics plus sums centered on the category mean, so the
 * statistics of "all other rows of the category" can be derived per row without a second scan.
 */
public final class CategoryBaselines {

    private static final double RELATIVE_VARIANCE_FLOOR = 1e-12;

    private final Map<String, CategoryProfile> profiles;
    private final Map<String, CenteredSums> sums;

    private CategoryBaselines(Map<String, CategoryProfile> profiles, Map<String, CenteredSums> sums) {
        this.profiles = profiles;
        this.sums = sums;
    }

    public static CategoryBaselines of(Map<String, CategoryProfile> profiles, List<TransactionRecord> records) {
        Map<String, CenteredSums> sums = new HashMap<>();
        for (TransactionRecord r : records) {
            if (r.getNetAmount() == null) {
                continue;
            }
            CategoryProfile p = profiles.get(categoryKey(r));
            if (p == null) {
                continue;
            }
            double d = r.getNetAmount().doubleValue() - p.meanNet();
            sums.computeIfAbsent(p.category(), k -> new CenteredSums()).add(d);
        }
        return new CategoryBaselines(Map.copyOf(profiles), sums);
    }

    public CategoryProfile profile(TransactionRecord r) {
        return profiles.get(categoryKey(r));
    }

    /** (net - mean) / std over the whole category; 0 when std is 0 or net unknown. */
    public double zScore(TransactionRecord r) {
        CategoryProfile p = profile(r);
        if (p == null || r.getNetAmount() == null || p.stdNet() <= 0d) {
            return 0d;
        }
        return (r.getNetAmount().doubleValue() - p.meanNet()) / p.stdNet();
    }

    /**
     * z against the category without this row; 0 when fewer than 2 other rows have a known net amount or
     * the other rows have no spread.
     */
    public double zScoreExcludingSelf(TransactionRecord r) {
        CategoryProfile p = profile(r);
        if (p == null || r.getNetAmount() == null) {
            return 0d;
        }
        CenteredSums s = sums.get(p.category());
        if (s == null || s.count - 1 < 2) {
            return 0d;
        }
        double d = r.getNetAmount().doubleValue() - p.meanNet();
        int others = s.count - 1;
        double othersMean = (s.sum - d) / others;
        double othersVariance = (s.sumSquares - d * d) / others - othersMean * othersMean;
        double floor = RELATIVE_VARIANCE_FLOOR * Math.max(1d, p.meanNet() * p.meanNet());
        if (othersVariance <= floor) {
            return 0d;
        }
        return (d - othersMean) / Math.sqrt(othersVariance);
    }

    private static String categoryKey(TransactionRecord r) {
        return r.getCategory() == null ? "" : r.getCategory();
    }

    private static final class CenteredSums {
        private int count;
        private double sum;
        private double sumSquares;

        private void add(double d) {
            count++;
            sum += d;
            sumSquares += d * d;
        }
    }
}
