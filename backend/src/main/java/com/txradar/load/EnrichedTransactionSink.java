package com.txradar.load;

import com.txradar.domain.TransactionRecord;

import java.util.List;

/**
 * Destination of the enriched batch. A successful write replaces whatever the previous run stored.
 */
public interface EnrichedTransactionSink {

    /** @return number of rows written */
    int write(String runId, List<TransactionRecord> records);
}
