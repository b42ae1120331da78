package com.txradar.domain;

/**
 * Row-level data defects. Recorded on the row, reflected in the quality score, never fatal.
 */
public enum DataIssue {
    MISSING_TRANSACTION_ID,
    MISSING_DATE,
    UNPARSEABLE_DATE,
    MISSING_AMOUNT,
    UNPARSEABLE_AMOUNT,
    MISSING_CATEGORY,
    SHORT_DESCRIPTION
}
