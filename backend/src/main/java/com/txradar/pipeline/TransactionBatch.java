package com.txradar.pipeline;

import com.txradar.domain.TransactionRecord;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * Whole-table snapshot passed between stages. Stages add fields to the records in place; the row count
 * never changes. columns holds the canonical column names present on at least one raw row.
 */
@Getter
public class TransactionBatch {

    private final List<TransactionRecord> records;
    private final Set<String> columns;
    private final PipelineDiagnostics diagnostics;

    public TransactionBatch(List<TransactionRecord> records, Set<String> columns, PipelineDiagnostics diagnostics) {
        this.records = List.copyOf(records);
        this.columns = Set.copyOf(columns);
        this.diagnostics = diagnostics;
    }

    public boolean hasColumn(String canonicalName) {
        return columns.contains(canonicalName);
    }

    public int size() {
        return records.size();
    }
}
