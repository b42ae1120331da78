package com.txradar.domain;

/**
 * Per-category metadata plus population statistics of net amount over the current batch.
 * stdNet is 0 when the category has fewer than 2 rows with a known net amount.
 */
public record CategoryProfile(
        String category,
        int priority,
        CategoryType type,
        boolean taxDeductible,
        long rowCount,
        double meanNet,
        double stdNet
) {
}
