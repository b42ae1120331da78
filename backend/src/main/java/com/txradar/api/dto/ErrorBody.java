package com.txradar.api.dto;

import java.time.Instant;

/**
 * Body of every non-2xx response. error is a stable machine code (EMPTY_BATCH, INVALID_COUNTRY_CODE,
 * SOURCE_UNAVAILABLE, ...); timestamp is serialized as ISO 8601.
 */
public record ErrorBody(String error, String message, Instant timestamp) {
}
