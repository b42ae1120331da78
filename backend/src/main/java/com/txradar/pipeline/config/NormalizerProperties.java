package com.txradar.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer configuration. Documented in application.yml under txradar.normalizer.
 */
@ConfigurationProperties(prefix = "txradar.normalizer")
@Getter
@Setter
public class NormalizerProperties {

    /**
     * Date patterns tried in order after the ISO forms (java.time.format.DateTimeFormatter syntax, parsed with
     * Locale.US). Month-first for slash dates, matching the fake bank feed.
     */
    private List<String> datePatterns = new ArrayList<>(List.of(
            "yyyy/MM/dd",
            "M/d/yyyy",
            "yyyyMMdd",
            "MMM d, yyyy",
            "d MMM yyyy"
    ));
}
