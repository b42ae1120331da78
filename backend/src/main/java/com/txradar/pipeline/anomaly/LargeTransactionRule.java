package com.txradar.pipeline.anomaly;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.config.AnomalyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Absolute size: abs_amount above the configured cutoff, independent of category statistics.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class LargeTransactionRule implements AnomalyRule {

    public static final String CODE = "LARGE_TRANSACTION";

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
        return record.getAbsAmount() != null
                && record.getAbsAmount().compareTo(properties.getLargeAmountThreshold()) > 0;
    }
}
