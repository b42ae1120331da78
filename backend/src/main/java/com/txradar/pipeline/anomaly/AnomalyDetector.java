package com.txradar.pipeline.anomaly;

import com.txradar.domain.CategoryProfile;
import com.txradar.domain.TransactionRecord;
import com.txradar.domain.TransactionSize;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stage 4: z-scores against the category baselines, then every enabled {@link AnomalyRule} independently.
 * is_outlier and is_large_transaction mirror their rules; is_anomaly is the union of all fired rules.
 */
@Component
@Slf4j
public class AnomalyDetector {

    private final List<AnomalyRule> rules;

    public AnomalyDetector(List<AnomalyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public void apply(TransactionBatch batch, Map<String, CategoryProfile> profiles) {
        CategoryBaselines baselines = CategoryBaselines.of(profiles, batch.getRecords());
        List<AnomalyRule> enabled = rules.stream().filter(AnomalyRule::isEnabled).toList();
        int anomalies = 0;
        for (TransactionRecord r : batch.getRecords()) {
            r.setCatNetZscore(baselines.zScore(r));
            r.setCatNetZscoreExcludingSelf(baselines.zScoreExcludingSelf(r));

            List<String> reasons = new ArrayList<>();
            for (AnomalyRule rule : enabled) {
                if (rule.matches(r, baselines)) {
                    reasons.add(rule.code());
                }
            }
            r.setAnomalyReasons(reasons);
            r.setOutlier(reasons.contains(ZScoreOutlierRule.CODE));
            r.setLargeTransaction(reasons.contains(LargeTransactionRule.CODE));
            r.setAnomaly(!reasons.isEmpty());
            r.setTransactionSize(TransactionSize.of(r.getAbsAmount()));
            BusinessFlags.apply(r);
            if (r.isAnomaly()) {
                anomalies++;
            }
        }
        batch.getDiagnostics().add(PipelineDiagnostics.ANOMALIES, anomalies);
        log.info("Anomaly detection: {} of {} rows flagged by rules {}", anomalies, batch.size(),
                enabled.stream().map(AnomalyRule::code).toList());
    }
}
