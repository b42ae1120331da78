package com.txradar.pipeline.quality;

import com.txradar.domain.DataIssue;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.TransactionBatch;
import com.txradar.pipeline.config.QualityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stage 6: score = 1 - weighted sum of binary penalties, clamped to [0, 1] and rounded to 4 decimals.
 * Low scores never remove a row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataQualityScorer {

    private final QualityProperties properties;

    public void apply(TransactionBatch batch) {
        double total = 0d;
        for (TransactionRecord r : batch.getRecords()) {
            double score = score(r);
            r.setDataQualityScore(score);
            total += score;
        }
        log.info("Data quality: mean score {} over {} rows",
                BigDecimal.valueOf(total / batch.size()).setScale(4, RoundingMode.HALF_UP), batch.size());
    }

    double score(TransactionRecord r) {
        double penalty = 0d;
        if (r.getDate() == null) {
            penalty += properties.getMissingDateWeight();
        }
        if (r.getNetAmount() == null) {
            penalty += properties.getMissingAmountWeight();
        }
        if (r.getCategory() == null) {
            penalty += properties.getMissingCategoryWeight();
        }
        String description = r.getDescription() == null ? "" : r.getDescription().strip();
        if (description.length() < properties.getMinDescriptionLength()) {
            r.addDataIssue(DataIssue.SHORT_DESCRIPTION);
            penalty += properties.getShortDescriptionWeight();
        }
        if (r.getTransactionId() == null) {
            penalty += properties.getMissingTransactionIdWeight();
        }
        double score = Math.max(0d, Math.min(1d, 1d - penalty));
        return BigDecimal.valueOf(score).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
