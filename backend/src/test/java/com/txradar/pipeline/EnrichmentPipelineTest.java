package com.txradar.pipeline;

import com.txradar.domain.DataIssue;
import com.txradar.domain.RawTransaction;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.enrichment.EnrichmentOptions;
import com.txradar.pipeline.enrichment.ExternalLookupException;
import com.txradar.pipeline.enrichment.FxRateLookup;
import com.txradar.pipeline.enrichment.HolidayLookup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.txradar.pipeline.PipelineFixtures.bankRow;
import static com.txradar.pipeline.PipelineFixtures.pipeline;
import static com.txradar.pipeline.PipelineFixtures.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentPipelineTest {

    @Mock
    HolidayLookup holidayLookup;
    @Mock
    FxRateLookup fxRateLookup;

    private static List<RawTransaction> sample() {
        return List.of(
                bankRow(0, "2016-01-04", "Payment, thank you", "Payment/Credit", null, "1000"),
                bankRow(1, "2016-01-04", "NETFLIX.COM", "Other Services", "15.99", null),
                bankRow(2, "2016-01-05", "Shell gas", "Gas/Automotive", "42.10", null),
                bankRow(3, "2016-01-05", "Shell gas", "Gas/Automotive", "42.10", null),
                bankRow(4, "2016-02-04", "NETFLIX.COM", "Other Services", "15.99", null),
                bankRow(5, "bad date", "??", null, "abc", null),
                bankRow(6, "2016-03-04", "NETFLIX.COM", "Other Services", "15.99", null),
                bankRow(7, "2016-03-10", "Hotel", "Other Travel", "980.00", null)
        );
    }

    @Test
    @DisplayName("all stages run in order and every row is kept with its row_index")
    void endToEnd() {
        when(holidayLookup.fetchHolidays("US", 2016)).thenReturn(Set.of(LocalDate.of(2016, 1, 4)));
        EnrichmentOptions options = new EnrichmentOptions(true, false, "US", "USD", false);

        PipelineResult result = pipeline(holidayLookup, fxRateLookup).run(sample(), options);

        List<TransactionRecord> rows = result.records();
        assertThat(rows).hasSize(8);
        assertThat(rows).extracting(TransactionRecord::getRowIndex).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(rows.get(0).getIsPublicHoliday()).isTrue();
        assertThat(rows.get(0).getDayName()).isEqualTo("Monday");
        assertThat(rows.get(3).isDuplicateCandidate()).isTrue();
        assertThat(rows.get(6).getDaysSincePrevSameDescription()).isEqualTo(29L);
        assertThat(rows.get(6).isRecurringDescription()).isTrue();
        assertThat(rows.get(7).isLargeTransaction()).isTrue();
        assertThat(rows.get(5).getDataIssues())
                .contains(DataIssue.UNPARSEABLE_DATE, DataIssue.UNPARSEABLE_AMOUNT, DataIssue.MISSING_CATEGORY,
                        DataIssue.SHORT_DESCRIPTION);
        assertThat(rows.get(5).getDataQualityScore()).isLessThan(rows.get(2).getDataQualityScore());
        assertThat(result.categoryProfiles()).containsKeys("Payment/Credit", "Other Services", "");
        assertThat(result.counters()).containsEntry(PipelineDiagnostics.DUPLICATE_CANDIDATES, 1L);
        verify(fxRateLookup, never()).fetchRate(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("running twice over the same input gives identical output")
    void idempotent() {
        lenient().when(holidayLookup.fetchHolidays(anyString(), anyInt())).thenReturn(Set.of(LocalDate.of(2016, 1, 4)));
        EnrichmentPipeline pipeline = pipeline(holidayLookup, fxRateLookup);
        EnrichmentOptions options = new EnrichmentOptions(true, false, "US", "USD", false);

        PipelineResult first = pipeline.run(sample(), options);
        PipelineResult second = pipeline.run(sample(), options);

        assertThat(second.records()).usingRecursiveComparison().isEqualTo(first.records());
        assertThat(second.counters()).isEqualTo(first.counters());
    }

    @Test
    @DisplayName("holiday and FX outages degrade rows but never fail the batch")
    void externalOutagesAreNonFatal() {
        when(holidayLookup.fetchHolidays(anyString(), anyInt())).thenThrow(new ExternalLookupException("down"));
        when(fxRateLookup.fetchRate(any(), anyString(), anyString())).thenThrow(new ExternalLookupException("down"));
        List<RawTransaction> rows = List.of(
                raw(0, "date", "2024-01-02", "debit", "10", "currency", "EUR", "description", "Cafe"),
                raw(1, "date", "2024-01-03", "debit", "12", "currency", "EUR", "description", "Cafe")
        );

        PipelineResult result = pipeline(holidayLookup, fxRateLookup)
                .run(rows, new EnrichmentOptions(true, true, "DE", "USD", false));

        assertThat(result.records()).allSatisfy(r -> {
            assertThat(r.getIsPublicHoliday()).isFalse();
            assertThat(r.getFxRate()).isNull();
            assertThat(r.getConvertedAmounts()).containsEntry("net_amount_USD", null);
        });
        assertThat(result.counters()).containsEntry(PipelineDiagnostics.FX_LOOKUP_FAILURES, 2L);
        assertThat(result.counters()).containsEntry(PipelineDiagnostics.HOLIDAY_LOOKUP_FAILURES, 1L);
    }

    @Test
    @DisplayName("disabled enrichments leave the external columns unset")
    void disabledEnrichment() {
        PipelineResult result = pipeline(holidayLookup, fxRateLookup)
                .run(List.of(bankRow(0, "2024-01-01", "Test row", "Other", "1", null)), EnrichmentOptions.disabled());

        TransactionRecord r = result.records().get(0);
        assertThat(r.getIsPublicHoliday()).isNull();
        assertThat(r.getFxTargetCurrency()).isNull();
        verify(holidayLookup, never()).fetchHolidays(anyString(), anyInt());
    }

    @Test
    @DisplayName("empty input aborts with EMPTY_BATCH")
    void emptyInputIsFatal() {
        EnrichmentPipeline pipeline = pipeline(holidayLookup, fxRateLookup);
        EnrichmentOptions options = EnrichmentOptions.disabled();

        assertThatThrownBy(() -> pipeline.run(List.of(), options))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    @DisplayName("FX amounts use the normalized amounts of the row")
    void fxUsesNormalizedAmounts() {
        when(fxRateLookup.fetchRate(LocalDate.of(2024, 1, 2), "EUR", "USD"))
                .thenReturn(Optional.of(new BigDecimal("1.10")));

        PipelineResult result = pipeline(holidayLookup, fxRateLookup).run(
                List.of(raw(0, "date", "2024-01-02", "credit", "$1,000.00", "currency", "eur", "description", "Salary")),
                new EnrichmentOptions(false, true, null, "usd", false));

        assertThat(result.records().get(0).getConvertedAmounts().get("credit_amount_USD"))
                .isEqualByComparingTo("1100.00");
    }
}
