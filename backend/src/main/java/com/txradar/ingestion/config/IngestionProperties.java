package com.txradar.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Source REST API. Documented in application.yml under txradar.ingestion.
 */
@ConfigurationProperties(prefix = "txradar.ingestion")
@Getter
@Setter
public class IngestionProperties {

    private String baseUrl = "https://api.sampleapis.com";

    /** Path under baseUrl returning a JSON array of transactions. */
    private String endpoint = "fakebank/accounts";

    private int timeoutSeconds = 30;
}
