package com.txradar.pipeline.temporal;

import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.TransactionBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Stage 2: calendar fields derived from the transaction date only. Rows without a date get nulls.
 */
@Component
@Slf4j
public class TemporalFeatureGenerator {

    public void apply(TransactionBatch batch) {
        int dated = 0;
        for (TransactionRecord r : batch.getRecords()) {
            if (r.getDate() != null) {
                dated++;
            }
            apply(r);
        }
        log.info("Temporal features derived for {} of {} rows", dated, batch.size());
    }

    static void apply(TransactionRecord r) {
        LocalDate d = r.getDate();
        if (d == null) {
            r.setYear(null);
            r.setMonth(null);
            r.setYearMonth(null);
            r.setDayOfWeek(null);
            r.setDayName(null);
            r.setQuarter(null);
            r.setWeekOfYear(null);
            r.setIsWeekend(null);
            r.setIsMonthStart(null);
            r.setIsMonthEnd(null);
            return;
        }
        DayOfWeek dow = d.getDayOfWeek();
        r.setYear(d.getYear());
        r.setMonth(d.getMonthValue());
        r.setYearMonth(String.format(Locale.ROOT, "%04d-%02d", d.getYear(), d.getMonthValue()));
        r.setDayOfWeek(dow.getValue() - 1);
        r.setDayName(dow.getDisplayName(TextStyle.FULL, Locale.US));
        r.setQuarter(d.get(IsoFields.QUARTER_OF_YEAR));
        r.setWeekOfYear(d.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        r.setIsWeekend(dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY);
        r.setIsMonthStart(d.getDayOfMonth() == 1);
        r.setIsMonthEnd(d.getDayOfMonth() == d.lengthOfMonth());
    }
}
