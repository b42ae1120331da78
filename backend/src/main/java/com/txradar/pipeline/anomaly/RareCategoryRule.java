package com.txradar.pipeline.anomaly;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.config.AnomalyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Category seen at most max-rows times in the batch. Disabled unless txradar.anomaly.rare-category.enabled.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class RareCategoryRule implements AnomalyRule {

    public static final String CODE = "RARE_CATEGORY";

    private final AnomalyProperties properties;

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public boolean isEnabled() {
        return properties.getRareCategory().isEnabled();
    }

    @Override
    public boolean matches(TransactionRecord record, CategoryBaselines baselines) {
        if (record.getCategory() == null) {
            return false;
        }
        CategoryProfile p = baselines.profile(record);
        return p != null && p.rowCount() <= properties.getRareCategory().getMaxRows();
    }
}
