package com.txradar.domain;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One enriched transaction row. Field names are persisted in snake_case (see application.yml) and form the
 * stable schema read by the report queries.
 */
@Document(collection = "enriched_transactions")
@CompoundIndexes({
    @CompoundIndex(name = "run_row", def = "{'run_id': 1, 'row_index': 1}", unique = true),
    @CompoundIndex(name = "category_date", def = "{'category': 1, 'date': 1}"),
    @CompoundIndex(name = "year_month", def = "{'year_month': 1}")
})
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@NoArgsConstructor
@Getter
@Setter
public class TransactionRecord {

    @Id
    private String id;
    private String runId;
    private Instant processedAt;

    private int rowIndex;
    private String transactionId;
    private String description;
    private String category;
    private LocalDate date;
    private String currency;

    /** Non-negative magnitudes, scale 2. */
    private BigDecimal creditAmount;
    private BigDecimal debitAmount;
    /** credit - debit; null when either side is unparseable or both are missing. */
    private BigDecimal netAmount;
    private BigDecimal absAmount;
    private boolean isIncome;
    private boolean isExpense;

    private Integer year;
    private Integer month;
    private String yearMonth;
    /** 0 = Monday .. 6 = Sunday. */
    private Integer dayOfWeek;
    private String dayName;
    private Integer quarter;
    private Integer weekOfYear;
    private Boolean isWeekend;
    private Boolean isMonthStart;
    private Boolean isMonthEnd;

    private CategoryType categoryType;
    /** 1 = high, 2 = medium, 3 = low. */
    private Integer categoryPriority;
    private boolean categoryTaxDeductible;
    private Long catRowCount;
    private Double catNetMean;
    private Double catNetStd;

    private Double catNetZscore;
    /** z of the row against the other rows of its category; the outlier rule reads this one. */
    private Double catNetZscoreExcludingSelf;
    private boolean isOutlier;
    private boolean isLargeTransaction;
    private boolean isAnomaly;
    private List<String> anomalyReasons = new ArrayList<>();
    private TransactionSize transactionSize;

    private boolean isFeeTransaction;
    private boolean isPaymentTransaction;
    private boolean isRefund;
    private boolean isDiscretionary;

    private String normalizedDescription;
    private Integer descriptionFrequency;
    private Long daysSincePrevSameDescription;
    private boolean hasKeywordSubscription;
    private boolean isRecurringDescription;
    private boolean isDuplicateCandidate;

    private Double dataQualityScore;
    private List<DataIssue> dataIssues = new ArrayList<>();

    /** Null when holiday enrichment is off; false when it ran but the calendar was unavailable. */
    private Boolean isPublicHoliday;
    private String fxTargetCurrency;
    private BigDecimal fxRate;
    /**
     * {amount_field}_{TARGET} to converted value; value null when no rate was resolvable. Stored as a
     * sub-document, so queries address e.g. converted_amounts.net_amount_USD. Empty when FX did not run.
     */
    private Map<String, BigDecimal> convertedAmounts = new LinkedHashMap<>();

    public void addDataIssue(DataIssue issue) {
        if (!dataIssues.contains(issue)) {
            dataIssues.add(issue);
        }
    }
}
