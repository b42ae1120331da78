package com.txradar.pipeline;

/**
 * Canonical input column names produced by the normalizer.
 */
public final class CanonicalColumns {

    public static final String TRANSACTION_ID = "transaction_id";
    public static final String DESCRIPTION = "description";
    public static final String CATEGORY = "category";
    public static final String DATE = "date";
    public static final String CREDIT_AMOUNT = "credit_amount";
    public static final String DEBIT_AMOUNT = "debit_amount";
    /** Signed single-amount feeds: positive credit, negative debit. */
    public static final String AMOUNT = "amount";
    public static final String CURRENCY = "currency";

    /** Amount fields converted by FX enrichment, in output order. */
    public static final String NET_AMOUNT = "net_amount";
    public static final String ABS_AMOUNT = "abs_amount";

    private CanonicalColumns() {
    }
}
