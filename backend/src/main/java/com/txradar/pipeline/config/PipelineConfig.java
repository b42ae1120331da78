package com.txradar.pipeline.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline module configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        NormalizerProperties.class,
        CategoryProperties.class,
        AnomalyProperties.class,
        RecurrenceProperties.class,
        QualityProperties.class,
        EnrichmentProperties.class
})
public class PipelineConfig {
}
