package com.txradar.pipeline.recurrence;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.TransactionBatch;
import com.txradar.pipeline.config.RecurrenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Stage 5: groups rows by normalized description and derives frequency, day gap to the previous occurrence,
 * subscription/recurring flags and duplicate-charge candidates. Same-day ties are ordered by row_index.
 */
@Component
@Slf4j
public class RecurrenceAnalyzer {

    private final List<String> keywords;
    private final int minOccurrences;
    private final int duplicateWindowDays;
    private final BigDecimal amountEpsilon;

    public RecurrenceAnalyzer(RecurrenceProperties properties) {
        this.keywords = properties.getSubscriptionKeywords().stream()
                .filter(Objects::nonNull)
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .toList();
        this.minOccurrences = properties.getMinOccurrences();
        this.duplicateWindowDays = Math.max(0, properties.getDuplicateWindowDays());
        this.amountEpsilon = properties.getAmountEpsilon().abs();
    }

    public void apply(TransactionBatch batch) {
        Map<String, List<TransactionRecord>> rowsByKey = new LinkedHashMap<>();
        for (TransactionRecord r : batch.getRecords()) {
            String key = DescriptionGroup.normalize(r.getDescription());
            r.setNormalizedDescription(key);
            rowsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }

        int duplicates = 0;
        int recurringGroups = 0;
        for (Map.Entry<String, List<TransactionRecord>> e : rowsByKey.entrySet()) {
            DescriptionGroup group = DescriptionGroup.of(e.getKey(), e.getValue());
            boolean keywordMatch = matchesKeyword(group.key());
            boolean recurring = keywordMatch || group.frequency() >= minOccurrences;
            if (recurring) {
                recurringGroups++;
            }
            for (TransactionRecord r : e.getValue()) {
                r.setDescriptionFrequency(group.frequency());
                r.setHasKeywordSubscription(keywordMatch);
                r.setRecurringDescription(recurring);
                r.setDaysSincePrevSameDescription(null);
                r.setDuplicateCandidate(false);
            }
            duplicates += linkOccurrences(group);
        }
        batch.getDiagnostics().add(PipelineDiagnostics.DUPLICATE_CANDIDATES, duplicates);
        log.info("Recurrence: {} description groups, {} recurring, {} duplicate candidates",
                rowsByKey.size(), recurringGroups, duplicates);
    }

    private int linkOccurrences(DescriptionGroup group) {
        int duplicates = 0;
        TransactionRecord previous = null;
        for (TransactionRecord current : group.dated()) {
            if (previous != null) {
                long gap = ChronoUnit.DAYS.between(previous.getDate(), current.getDate());
                current.setDaysSincePrevSameDescription(gap);
                if (gap <= duplicateWindowDays && nearEqual(previous.getNetAmount(), current.getNetAmount())) {
                    current.setDuplicateCandidate(true);
                    duplicates++;
                }
            }
            previous = current;
        }
        return duplicates;
    }

    boolean matchesKeyword(String normalizedDescription) {
        if (normalizedDescription.isEmpty()) {
            return false;
        }
        for (String k : keywords) {
            if (normalizedDescription.contains(k)) {
                return true;
            }
        }
        return false;
    }

    private boolean nearEqual(BigDecimal a, BigDecimal b) {
        return a != null && b != null && a.subtract(b).abs().compareTo(amountEpsilon) <= 0;
    }
}
