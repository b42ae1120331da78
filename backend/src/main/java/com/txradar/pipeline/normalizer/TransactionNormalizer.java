package com.txradar.pipeline.normalizer;

import com.txradar.domain.DataIssue;
import com.txradar.domain.RawTransaction;
import com.txradar.domain.TransactionRecord;
import com.txradar.pipeline.CanonicalColumns;
import com.txradar.pipeline.PipelineDiagnostics;
import com.txradar.pipeline.PipelineException;
import com.txradar.pipeline.TransactionBatch;
import com.txradar.pipeline.config.NormalizerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stage 1: canonical column names, one LocalDate representation, scale-2 amounts.
 * Unparseable values are kept as null and recorded as data issues; rows are never dropped.
 */
@Component
@Slf4j
public class TransactionNormalizer {

    private final DateValueParser dateParser;

    public TransactionNormalizer(NormalizerProperties properties) {
        this.dateParser = new DateValueParser(properties.getDatePatterns());
    }

    /**
     * @throws PipelineException when the batch is empty or carries neither a date nor any amount column
     */
    public TransactionBatch normalize(List<RawTransaction> rawBatch, PipelineDiagnostics diagnostics) {
        if (rawBatch == null || rawBatch.isEmpty()) {
            throw new PipelineException(PipelineException.EMPTY_BATCH, "Input batch has no rows");
        }
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> canonicalRows = new ArrayList<>(rawBatch.size());
        for (RawTransaction raw : rawBatch) {
            Map<String, Object> row = canonicalize(raw.getFields());
            columns.addAll(row.keySet());
            canonicalRows.add(row);
        }
        boolean hasAmountColumn = columns.contains(CanonicalColumns.CREDIT_AMOUNT)
                || columns.contains(CanonicalColumns.DEBIT_AMOUNT)
                || columns.contains(CanonicalColumns.AMOUNT);
        if (!columns.contains(CanonicalColumns.DATE) && !hasAmountColumn) {
            throw new PipelineException(PipelineException.UNRECOGNIZED_SCHEMA,
                    "No date or amount column among " + columns);
        }

        List<TransactionRecord> records = new ArrayList<>(rawBatch.size());
        for (int i = 0; i < rawBatch.size(); i++) {
            records.add(toRecord(rawBatch.get(i).getRowIndex(), canonicalRows.get(i), diagnostics));
        }
        log.info("Normalized {} rows; columns {}", records.size(), columns);
        return new TransactionBatch(records, columns, diagnostics);
    }

    /** First non-null value wins when two raw columns map to the same canonical name. */
    private static Map<String, Object> canonicalize(Map<String, Object> fields) {
        Map<String, Object> out = new HashMap<>();
        fields.forEach((name, value) -> {
            String canonical = ColumnNameNormalizer.canonicalName(name);
            if (canonical.isEmpty()) {
                return;
            }
            if (!out.containsKey(canonical) || out.get(canonical) == null) {
                out.put(canonical, value);
            }
        });
        return out;
    }

    private TransactionRecord toRecord(int rowIndex, Map<String, Object> row, PipelineDiagnostics diagnostics) {
        TransactionRecord r = new TransactionRecord();
        r.setRowIndex(rowIndex);
        r.setTransactionId(text(row.get(CanonicalColumns.TRANSACTION_ID)));
        r.setDescription(text(row.get(CanonicalColumns.DESCRIPTION)));
        r.setCategory(text(row.get(CanonicalColumns.CATEGORY)));
        String currency = text(row.get(CanonicalColumns.CURRENCY));
        r.setCurrency(currency == null ? null : currency.toUpperCase(Locale.ROOT));

        if (r.getTransactionId() == null) {
            r.addDataIssue(DataIssue.MISSING_TRANSACTION_ID);
        }
        if (r.getCategory() == null) {
            r.addDataIssue(DataIssue.MISSING_CATEGORY);
            diagnostics.increment(PipelineDiagnostics.MISSING_CATEGORY);
        }

        ParseOutcome<LocalDate> date = dateParser.parse(row.get(CanonicalColumns.DATE));
        r.setDate(date.value());
        if (date.isMissing()) {
            r.addDataIssue(DataIssue.MISSING_DATE);
            diagnostics.increment(PipelineDiagnostics.MISSING_DATES);
        } else if (date.isInvalid()) {
            r.addDataIssue(DataIssue.UNPARSEABLE_DATE);
            diagnostics.increment(PipelineDiagnostics.UNPARSEABLE_DATES);
            log.debug("Row {}: unparseable date '{}'", rowIndex, row.get(CanonicalColumns.DATE));
        }

        applyAmounts(r, row, diagnostics);
        return r;
    }

    private static void applyAmounts(TransactionRecord r, Map<String, Object> row, PipelineDiagnostics diagnostics) {
        ParseOutcome<BigDecimal> credit = AmountValueParser.parse(row.get(CanonicalColumns.CREDIT_AMOUNT));
        ParseOutcome<BigDecimal> debit = AmountValueParser.parse(row.get(CanonicalColumns.DEBIT_AMOUNT));
        if (credit.isMissing() && debit.isMissing()) {
            ParseOutcome<BigDecimal> signed = AmountValueParser.parse(row.get(CanonicalColumns.AMOUNT));
            if (signed.isOk()) {
                BigDecimal v = signed.value();
                credit = ParseOutcome.ok(v.signum() > 0 ? v : BigDecimal.ZERO.setScale(AmountValueParser.SCALE));
                debit = ParseOutcome.ok(v.signum() < 0 ? v.negate() : BigDecimal.ZERO.setScale(AmountValueParser.SCALE));
            } else if (signed.isInvalid()) {
                credit = ParseOutcome.invalid();
            }
        }

        if (credit.isInvalid() || debit.isInvalid()) {
            r.setCreditAmount(credit.isOk() ? credit.value().abs() : null);
            r.setDebitAmount(debit.isOk() ? debit.value().abs() : null);
            r.addDataIssue(DataIssue.UNPARSEABLE_AMOUNT);
            diagnostics.increment(PipelineDiagnostics.UNPARSEABLE_AMOUNTS);
            log.debug("Row {}: unparseable amount credit='{}' debit='{}'", r.getRowIndex(),
                    row.get(CanonicalColumns.CREDIT_AMOUNT), row.get(CanonicalColumns.DEBIT_AMOUNT));
            return;
        }
        if (credit.isMissing() && debit.isMissing()) {
            r.addDataIssue(DataIssue.MISSING_AMOUNT);
            diagnostics.increment(PipelineDiagnostics.MISSING_AMOUNTS);
            return;
        }

        BigDecimal zero = BigDecimal.ZERO.setScale(AmountValueParser.SCALE);
        BigDecimal creditAmount = credit.isOk() ? credit.value().abs() : zero;
        BigDecimal debitAmount = debit.isOk() ? debit.value().abs() : zero;
        if (creditAmount.signum() != 0 && debitAmount.signum() != 0) {
            diagnostics.increment(PipelineDiagnostics.BOTH_SIDES_AMOUNT);
            log.debug("Row {}: both credit and debit set", r.getRowIndex());
        }
        BigDecimal net = creditAmount.subtract(debitAmount);
        r.setCreditAmount(creditAmount);
        r.setDebitAmount(debitAmount);
        r.setNetAmount(net);
        r.setAbsAmount(net.abs());
        r.setIncome(net.signum() > 0);
        r.setExpense(net.signum() < 0);
        if (net.signum() == 0) {
            diagnostics.increment(PipelineDiagnostics.ZERO_NET_AMOUNT);
            log.debug("Row {}: zero net amount, neither income nor expense", r.getRowIndex());
        }
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().strip();
        return s.isEmpty() ? null : s;
    }
}
