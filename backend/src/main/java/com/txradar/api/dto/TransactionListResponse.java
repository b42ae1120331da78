package com.txradar.api.dto;

import com.txradar.domain.TransactionRecord;

import java.util.List;

/**
 * GET /api/v1/transactions response. runId is null when no run has completed yet.
 */
public record TransactionListResponse(String runId, int count, List<TransactionRecord> transactions) {
}
