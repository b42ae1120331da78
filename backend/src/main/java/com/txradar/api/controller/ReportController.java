package com.txradar.api.controller;

import com.txradar.query.TransactionReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final TransactionReportService transactionReportService;

    @GetMapping("/categories")
    public ResponseEntity<List<TransactionReportService.CategorySummary>> categories() {
        return ResponseEntity.ok(transactionReportService.categorySummary());
    }

    @GetMapping("/monthly-flow")
    public ResponseEntity<List<TransactionReportService.MonthlyFlow>> monthlyFlow() {
        return ResponseEntity.ok(transactionReportService.monthlyFlow());
    }
}
