package com.txradar.pipeline.enrichment;

/**
 * Thrown by a {@link HolidayLookup} or {@link FxRateLookup} when the external source fails (HTTP error, timeout,
 * malformed payload). Never escapes the enrichment adapter.
 */
public class ExternalLookupException extends RuntimeException {

    public ExternalLookupException(String message) {
        super(message);
    }

    public ExternalLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
