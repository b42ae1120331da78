package com.txradar.query;

import com.txradar.domain.CategoryType;
import com.txradar.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate reports over the latest completed run: per-category spend and anomaly rate, monthly cash flow.
 * Rows without a net amount are counted but contribute no money; rows without a date are left out of the
 * monthly flow.
 */
@Service
@RequiredArgsConstructor
public class TransactionReportService {

    private static final int MONEY_SCALE = 2;
    private static final int RATE_SCALE = 4;

    private final TransactionQueryService transactionQueryService;

    /** Sorted by anomaly rate, then average expense, both descending. */
    public List<CategorySummary> categorySummary() {
        Map<String, List<TransactionRecord>> byCategory = new LinkedHashMap<>();
        for (TransactionRecord r : transactionQueryService.latestRunRecords()) {
            String category = r.getCategory() == null ? "" : r.getCategory();
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(r);
        }
        List<CategorySummary> out = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, rows) -> out.add(summarize(category, rows)));
        out.sort(Comparator.comparing(CategorySummary::anomalyRate)
                .thenComparing(s -> s.averageExpense() == null ? BigDecimal.ZERO : s.averageExpense())
                .reversed());
        return out;
    }

    /** One entry per year_month in ascending order. */
    public List<MonthlyFlow> monthlyFlow() {
        Map<String, BigDecimal[]> byMonth = new TreeMap<>();
        for (TransactionRecord r : transactionQueryService.latestRunRecords()) {
            if (r.getYearMonth() == null || r.getNetAmount() == null) {
                continue;
            }
            BigDecimal[] sums = byMonth.computeIfAbsent(r.getYearMonth(),
                    k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            BigDecimal net = r.getNetAmount();
            if (net.signum() > 0) {
                sums[0] = sums[0].add(net);
            } else if (net.signum() < 0) {
                sums[1] = sums[1].add(net.negate());
            }
        }
        List<MonthlyFlow> out = new ArrayList<>(byMonth.size());
        byMonth.forEach((month, sums) -> out.add(new MonthlyFlow(month, sums[0], sums[1], sums[0].subtract(sums[1]))));
        return out;
    }

    private static CategorySummary summarize(String category, List<TransactionRecord> rows) {
        long anomalies = rows.stream().filter(TransactionRecord::isAnomaly).count();
        BigDecimal totalNet = BigDecimal.ZERO;
        BigDecimal expenseTotal = BigDecimal.ZERO;
        int expenseCount = 0;
        for (TransactionRecord r : rows) {
            if (r.getNetAmount() == null) {
                continue;
            }
            totalNet = totalNet.add(r.getNetAmount());
            if (r.getNetAmount().signum() < 0) {
                expenseTotal = expenseTotal.add(r.getNetAmount().negate());
                expenseCount++;
            }
        }
        BigDecimal averageExpense = expenseCount == 0
                ? null
                : expenseTotal.divide(BigDecimal.valueOf(expenseCount), MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal anomalyRate = BigDecimal.valueOf(anomalies)
                .divide(BigDecimal.valueOf(rows.size()), RATE_SCALE, RoundingMode.HALF_UP);
        TransactionRecord first = rows.get(0);
        return new CategorySummary(category, first.getCategoryType(), first.getCategoryPriority(),
                first.isCategoryTaxDeductible(), rows.size(), anomalies, anomalyRate, averageExpense, totalNet);
    }

    public record CategorySummary(
            String category,
            CategoryType categoryType,
            Integer categoryPriority,
            boolean taxDeductible,
            int rowCount,
            long anomalyCount,
            BigDecimal anomalyRate,
            BigDecimal averageExpense,
            BigDecimal totalNet
    ) {
    }

    public record MonthlyFlow(String yearMonth, BigDecimal income, BigDecimal expenses, BigDecimal net) {
    }
}
