package com.txradar.query;

import com.txradar.domain.EnrichedTransactionRepository;
import com.txradar.domain.PipelineRun;
import com.txradar.domain.PipelineRunRepository;
import com.txradar.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Reads enriched rows of the latest completed run, in row order.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final PipelineRunRepository pipelineRunRepository;
    private final EnrichedTransactionRepository enrichedTransactionRepository;

    public Optional<String> latestRunId() {
        return pipelineRunRepository.findFirstByStatusOrderByStartedAtDesc(PipelineRun.Status.COMPLETE)
                .map(PipelineRun::getId);
    }

    /**
     * @param category      exact category, or null for all
     * @param anomaliesOnly only rows with is_anomaly; combined with category when both are given
     */
    public TransactionPage find(String category, boolean anomaliesOnly) {
        Optional<String> runId = latestRunId();
        if (runId.isEmpty()) {
            return new TransactionPage(null, List.of());
        }
        String id = runId.get();
        List<TransactionRecord> records;
        if (category != null && !category.isBlank()) {
            records = enrichedTransactionRepository.findByRunIdAndCategoryOrderByRowIndexAsc(id, category.strip());
            if (anomaliesOnly) {
                records = records.stream().filter(TransactionRecord::isAnomaly).toList();
            }
        } else if (anomaliesOnly) {
            records = enrichedTransactionRepository.findByRunIdAndIsAnomalyTrueOrderByRowIndexAsc(id);
        } else {
            records = enrichedTransactionRepository.findByRunIdOrderByRowIndexAsc(id);
        }
        return new TransactionPage(id, records);
    }

    public List<TransactionRecord> latestRunRecords() {
        return latestRunId()
                .map(enrichedTransactionRepository::findByRunIdOrderByRowIndexAsc)
                .orElse(List.of());
    }

    public record TransactionPage(String runId, List<TransactionRecord> records) {
    }
}
