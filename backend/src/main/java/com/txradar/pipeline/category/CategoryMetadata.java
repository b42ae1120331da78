package com.txradar.pipeline.category;

import com.txradar.domain.CategoryType;

/**
 * Static business metadata of a category. Priority 1 = high, 2 = medium, 3 = low.
 */
public record CategoryMetadata(CategoryType type, int priority, boolean taxDeductible) {

    public static final int HIGH = 1;
    public static final int MEDIUM = 2;
    public static final int LOW = 3;

    public static final CategoryMetadata UNKNOWN = new CategoryMetadata(CategoryType.UNKNOWN, LOW, false);
}
