package com.txradar.pipeline.recurrence;

import com.txradar.domain.TransactionRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rows sharing one normalized description. dated holds the rows with a date ordered by (date, row_index);
 * undated rows only count toward frequency.
 */
record DescriptionGroup(String key, int frequency, List<TransactionRecord> dated) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Comparator<TransactionRecord> OCCURRENCE_ORDER =
            Comparator.comparing(TransactionRecord::getDate).thenComparingInt(TransactionRecord::getRowIndex);

    static DescriptionGroup of(String key, List<TransactionRecord> rows) {
        List<TransactionRecord> dated = rows.stream()
                .filter(r -> r.getDate() != null)
                .sorted(OCCURRENCE_ORDER)
                .toList();
        return new DescriptionGroup(key, rows.size(), dated);
    }

    /** Trimmed, inner whitespace collapsed, lower-cased; null becomes "". */
    static String normalize(String description) {
        if (description == null) {
            return "";
        }
        return WHITESPACE.matcher(description.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
