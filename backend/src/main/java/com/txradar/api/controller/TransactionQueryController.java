package com.txradar.api.controller;

import com.txradar.api.dto.TransactionListResponse;
import com.txradar.query.TransactionQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Enriched rows of the latest completed run.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionQueryController {

    private final TransactionQueryService transactionQueryService;

    @GetMapping
    public ResponseEntity<TransactionListResponse> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false, defaultValue = "false") boolean anomaliesOnly
    ) {
        TransactionQueryService.TransactionPage page = transactionQueryService.find(category, anomaliesOnly);
        return ResponseEntity.ok(new TransactionListResponse(page.runId(), page.records().size(), page.records()));
    }
}
