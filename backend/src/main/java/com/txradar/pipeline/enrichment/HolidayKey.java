package com.txradar.pipeline.enrichment;

public record HolidayKey(String countryCode, int year) {
}
