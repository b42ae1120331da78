package com.txradar.pipeline.config;

import com.txradar.domain.CategoryType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extra category metadata merged over the built-in table (entries here win). Key is the exact category string.
 */
@ConfigurationProperties(prefix = "txradar.category")
@Getter
@Setter
public class CategoryProperties {

    private Map<String, Entry> metadata = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Entry {
        private CategoryType type = CategoryType.UNKNOWN;
        /** 1 = high, 2 = medium, 3 = low. */
        private int priority = 3;
        private boolean taxDeductible;
    }
}
