package com.txradar.api.dto;

import jakarta.validation.constraints.Pattern;

/**
 * POST /api/v1/pipeline/runs body. Every field is optional; null keeps the configured default.
 */
public record RunPipelineRequest(
        Boolean holidaysEnabled,
        Boolean fxEnabled,
        @Pattern(regexp = "[A-Za-z]{2}", message = "INVALID_COUNTRY_CODE") String countryCode,
        @Pattern(regexp = "[A-Za-z]{3}", message = "INVALID_CURRENCY") String targetCurrency
) {
}
