package com.txradar.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Anomaly rule thresholds. Documented in application.yml under txradar.anomaly.
 */
@ConfigurationProperties(prefix = "txradar.anomaly")
@Getter
@Setter
public class AnomalyProperties {

    /** |z| at or above this marks a statistical outlier. */
    private double zScoreThreshold = 3.0;

    /** abs_amount strictly above this marks a large transaction, whatever the category. */
    private BigDecimal largeAmountThreshold = new BigDecimal("500");

    private RareCategory rareCategory = new RareCategory();

    @Getter
    @Setter
    public static class RareCategory {
        /** Off by default: no confirmed rule exists for "unusual categories". */
        private boolean enabled = false;
        /** A category with at most this many rows in the batch is rare. */
        private int maxRows = 1;
    }
}
