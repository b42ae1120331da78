package com.txradar.pipeline.anomaly;

import com.txradar.domain.CategoryType;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.category.CategoryMetadata;

import java.util.Locale;

/**
 * Category-driven flags used by the report queries (fees, payments, refunds, discretionary spend).
 */
final class BusinessFlags {

    private BusinessFlags() {
    }

    static void apply(TransactionRecord r) {
        String category = r.getCategory() == null ? "" : r.getCategory().toLowerCase(Locale.ROOT);
        r.setFeeTransaction(category.contains("fee"));
        r.setPaymentTransaction(category.contains("payment"));
        r.setRefund(r.isIncome() && r.getCategoryType() != CategoryType.PAYMENT);
        r.setDiscretionary(r.getCategoryType() != CategoryType.UNKNOWN
                && r.getCategoryPriority() != null
                && r.getCategoryPriority() == CategoryMetadata.LOW);
    }
}
