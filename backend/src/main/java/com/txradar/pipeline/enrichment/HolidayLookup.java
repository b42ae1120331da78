package com.txradar.pipeline.enrichment;

import java.time.LocalDate;
import java.util.Set;

/**
 * Public holiday source. An unsupported country yields an empty set; a failed call throws.
 */
public interface HolidayLookup {

    Set<LocalDate> fetchHolidays(String countryCode, int year);
}
