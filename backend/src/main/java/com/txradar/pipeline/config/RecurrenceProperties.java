package com.txradar.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurrence and duplicate detection settings. Documented in application.yml under txradar.recurrence.
 */
@ConfigurationProperties(prefix = "txradar.recurrence")
@Getter
@Setter
public class RecurrenceProperties {

    /** Case-insensitive substrings that mark a description as a subscription. */
    private List<String> subscriptionKeywords = new ArrayList<>(List.of(
            "subscription", "suscripcion", "membership", "netflix", "spotify", "hulu", "disney",
            "amazon prime", "icloud", "apple.com/bill", "google storage", "youtube premium", "adobe", "patreon", "gym"
    ));

    /** A description group with at least this many rows is recurring. */
    private int minOccurrences = 3;

    /** Max day gap to the previous same-description row for a duplicate candidate (0 = same day only). */
    private int duplicateWindowDays = 1;

    /** Max absolute difference of net amounts for a duplicate candidate. */
    private BigDecimal amountEpsilon = new BigDecimal("0.01");
}
