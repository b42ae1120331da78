package com.txradar.domain;

import java.math.BigDecimal;

/**
 * Size bucket on absolute amount: [0,10) micro, [10,50) small, [50,200) medium, [200,1000) large, 1000+ very large.
 */
public enum TransactionSize {
    MICRO,
    SMALL,
    MEDIUM,
    LARGE,
    VERY_LARGE;

    private static final BigDecimal SMALL_FROM = BigDecimal.valueOf(10);
    private static final BigDecimal MEDIUM_FROM = BigDecimal.valueOf(50);
    private static final BigDecimal LARGE_FROM = BigDecimal.valueOf(200);
    private static final BigDecimal VERY_LARGE_FROM = BigDecimal.valueOf(1000);

    public static TransactionSize of(BigDecimal absAmount) {
        if (absAmount == null) {
            return null;
        }
        if (absAmount.compareTo(SMALL_FROM) < 0) {
            return MICRO;
        }
        if (absAmount.compareTo(MEDIUM_FROM) < 0) {
            return SMALL;
        }
        if (absAmount.compareTo(LARGE_FROM) < 0) {
            return MEDIUM;
        }
        if (absAmount.compareTo(VERY_LARGE_FROM) < 0) {
            return LARGE;
        }
        return VERY_LARGE;
    }
}
