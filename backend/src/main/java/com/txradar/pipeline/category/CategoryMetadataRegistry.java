package com.txradar.pipeline.category;

import com.txradar.domain.CategoryType;
import com.txradar.pipeline.config.CategoryProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static com.txradar.pipeline.category.CategoryMetadata.HIGH;
import static com.txradar.pipeline.category.CategoryMetadata.LOW;
import static com.txradar.pipeline.category.CategoryMetadata.MEDIUM;

/**
 * Category string to metadata lookup, keyed by exact category value. Built-in table covers the fake bank
 * feed's categories; txradar.category.metadata entries are merged over it.
 */
@Component
public class CategoryMetadataRegistry {

    private static final Map<String, CategoryMetadata> BUILT_IN = Map.ofEntries(
            Map.entry("Other Services", new CategoryMetadata(CategoryType.SERVICE, MEDIUM, false)),
            Map.entry("Health Care", new CategoryMetadata(CategoryType.HEALTHCARE, HIGH, true)),
            Map.entry("Payment/Credit", new CategoryMetadata(CategoryType.PAYMENT, HIGH, false)),
            Map.entry("Merchandise", new CategoryMetadata(CategoryType.RETAIL, LOW, false)),
            Map.entry("Phone/Cable", new CategoryMetadata(CategoryType.UTILITIES, MEDIUM, false)),
            Map.entry("Fee/Interest Charge", new CategoryMetadata(CategoryType.FEE, HIGH, false)),
            Map.entry("Other", new CategoryMetadata(CategoryType.MISCELLANEOUS, LOW, false)),
            Map.entry("Dining", new CategoryMetadata(CategoryType.FOOD_BEVERAGE, LOW, false)),
            Map.entry("Gas/Automotive", new CategoryMetadata(CategoryType.TRANSPORTATION, MEDIUM, true)),
            Map.entry("Other Travel", new CategoryMetadata(CategoryType.TRAVEL, MEDIUM, true)),
            Map.entry("restaurants", new CategoryMetadata(CategoryType.FOOD_BEVERAGE, LOW, false)),
            Map.entry("beauty", new CategoryMetadata(CategoryType.PERSONAL_CARE, LOW, false)),
            Map.entry("fuel", new CategoryMetadata(CategoryType.TRANSPORTATION, MEDIUM, true)),
            Map.entry("air", new CategoryMetadata(CategoryType.TRANSPORTATION, MEDIUM, true)),
            Map.entry("gaz", new CategoryMetadata(CategoryType.TRANSPORTATION, MEDIUM, true)),
            Map.entry("food", new CategoryMetadata(CategoryType.FOOD_BEVERAGE, LOW, false)),
            Map.entry("taxi", new CategoryMetadata(CategoryType.TRANSPORTATION, MEDIUM, true))
    );

    private final Map<String, CategoryMetadata> metadata;

    public CategoryMetadataRegistry(CategoryProperties properties) {
        Map<String, CategoryMetadata> merged = new HashMap<>(BUILT_IN);
        properties.getMetadata().forEach((category, entry) -> {
            if (category != null && entry != null) {
                int priority = Math.min(LOW, Math.max(HIGH, entry.getPriority()));
                merged.put(category, new CategoryMetadata(entry.getType(), priority, entry.isTaxDeductible()));
            }
        });
        this.metadata = Map.copyOf(merged);
    }

    public boolean isKnown(String category) {
        return category != null && metadata.containsKey(category);
    }

    /** Unmatched or null category gets {@link CategoryMetadata#UNKNOWN}. */
    public CategoryMetadata lookup(String category) {
        if (category == null) {
            return CategoryMetadata.UNKNOWN;
        }
        return metadata.getOrDefault(category, CategoryMetadata.UNKNOWN);
    }
}
