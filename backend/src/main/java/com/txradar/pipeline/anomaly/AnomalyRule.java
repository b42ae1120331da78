package com.txradar.pipeline.anomaly;

import com.txradar.domain.TransactionRecord;

/**
 * One independent anomaly signal. Rules run after z-scores are attached; each fired rule adds its code to
 * anomaly_reasons and is_anomaly is the OR of all enabled rules.
 */
public interface AnomalyRule {

    /** Reason code written to anomaly_reasons. */
    String code();

    boolean isEnabled();

    boolean matches(TransactionRecord record, CategoryBaselines baselines);
}
