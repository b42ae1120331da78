package com.txradar.domain;

/**
 * Business classification attached to a transaction category.
 */
public enum CategoryType {
    SERVICE,
    HEALTHCARE,
    PAYMENT,
    RETAIL,
    UTILITIES,
    FEE,
    MISCELLANEOUS,
    FOOD_BEVERAGE,
    TRANSPORTATION,
    TRAVEL,
    PERSONAL_CARE,
    UNKNOWN
}
