package com.txradar.pipeline.anomaly;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.config.AnomalyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Statistical outlier: |z| at or above the threshold (default 3), z taken against the rest of the category.
 * Every row flagged by the whole-category z is flagged here too.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class ZScoreOutlierRule implements AnomalyRule {

    public static final String CODE = "Z_SCORE_OUTLIER";

    private final AnomalyProperties properties;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean matches(TransactionRecord record, CategoryBaselines baselines) {
        Double z = record.getCatNetZscoreExcludingSelf();
        return z != null && Math.abs(z) >= properties.getZScoreThreshold();
    }
}
