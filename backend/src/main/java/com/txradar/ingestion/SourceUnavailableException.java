package com.txradar.ingestion;

/**
 * The source could not be read or returned something that is not a list of rows.
 */
public class SourceUnavailableException extends RuntimeException {

    public static final String ERROR_CODE = "SOURCE_UNAVAILABLE";

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
