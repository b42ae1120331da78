package com.txradar.pipeline.normalizer;

import com.txradar.pipeline.CanonicalColumns;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps free-form source column names to canonical snake_case names.
 */
public final class ColumnNameNormalizer {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-./]+");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_+");

    private static final Map<String, String> STANDARD_NAMES = Map.ofEntries(
            Map.entry("id", CanonicalColumns.TRANSACTION_ID),
            Map.entry("transaction_id", CanonicalColumns.TRANSACTION_ID),
            Map.entry("category", CanonicalColumns.CATEGORY),
            Map.entry("transaction_category", CanonicalColumns.CATEGORY),
            Map.entry("description", CanonicalColumns.DESCRIPTION),
            Map.entry("transaction_description", CanonicalColumns.DESCRIPTION),
            Map.entry("credit", CanonicalColumns.CREDIT_AMOUNT),
            Map.entry("credit_amount", CanonicalColumns.CREDIT_AMOUNT),
            Map.entry("debit", CanonicalColumns.DEBIT_AMOUNT),
            Map.entry("debit_amount", CanonicalColumns.DEBIT_AMOUNT),
            Map.entry("amount", CanonicalColumns.AMOUNT),
            Map.entry("transactiondate", CanonicalColumns.DATE),
            Map.entry("transaction_date", CanonicalColumns.DATE),
            Map.entry("date", CanonicalColumns.DATE),
            Map.entry("currency", CanonicalColumns.CURRENCY),
            Map.entry("currency_code", CanonicalColumns.CURRENCY)
    );

    private ColumnNameNormalizer() {
    }

    /**
     * "transactionDate", "Transaction Date" and "transaction-date" all become "date"; unknown names come back
     * in snake_case.
     */
    public static String canonicalName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return "";
        }
        String snake = CAMEL_BOUNDARY.matcher(rawName.strip()).replaceAll("$1_$2");
        snake = SEPARATORS.matcher(snake).replaceAll("_");
        snake = REPEATED_UNDERSCORE.matcher(snake.toLowerCase(Locale.ROOT)).replaceAll("_");
        if (snake.startsWith("_")) {
            snake = snake.substring(1);
        }
        if (snake.endsWith("_")) {
            snake = snake.substring(0, snake.length() - 1);
        }
        return STANDARD_NAMES.getOrDefault(snake, snake);
    }
}
