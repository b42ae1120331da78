package com.txradar.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Penalty weights for the data quality score (score = 1 - sum of weights of the penalties that apply).
 */
@ConfigurationProperties(prefix = "txradar.quality")
@Getter
@Setter
public class QualityProperties {

    private double missingDateWeight = 0.30;
    private double missingAmountWeight = 0.30;
    private double missingCategoryWeight = 0.15;
    private double shortDescriptionWeight = 0.15;
    private double missingTransactionIdWeight = 0.10;

    /** Descriptions shorter than this (after trim) are penalized. */
    private int minDescriptionLength = 3;
}
