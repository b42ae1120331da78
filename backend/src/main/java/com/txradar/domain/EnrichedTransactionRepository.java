package com.txradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for enriched_transactions, written once per pipeline run.
 */
public interface EnrichedTransactionRepository extends MongoRepository<TransactionRecord, String> {

    List<TransactionRecord> findByRunIdOrderByRowIndexAsc(String runId);

    List<TransactionRecord> findByRunIdAndCategoryOrderByRowIndexAsc(String runId, String category);

    List<TransactionRecord> findByRunIdAndIsAnomalyTrueOrderByRowIndexAsc(String runId);

    long deleteByRunIdNot(String runId);
}
