package com.txradar.load;

import com.txradar.domain.EnrichedTransactionRepository;
import com.txradar.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stores the batch in enriched_transactions. The new run's rows are written first, then rows of older runs are
 * removed, so readers never see an empty table between runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoEnrichedTransactionSink implements EnrichedTransactionSink {

    private final EnrichedTransactionRepository repository;
    private final Clock clock;

    @Override
    public int write(String runId, List<TransactionRecord> records) {
        Instant processedAt = clock.instant();
        for (TransactionRecord r : records) {
            r.setId(documentId(runId, r.getRowIndex()));
            r.setRunId(runId);
            r.setProcessedAt(processedAt);
        }
        repository.saveAll(records);
        long removed = repository.deleteByRunIdNot(runId);
        log.info("Stored {} enriched rows for run {}; removed {} rows of previous runs", records.size(), runId, removed);
        return records.size();
    }

    static String documentId(String runId, int rowIndex) {
        return runId + ":" + rowIndex;
    }
}
