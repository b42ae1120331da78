package com.txradar.pipeline.normalizer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses raw date values into LocalDate. ISO forms first, then the configured patterns in order.
 */
public class DateValueParser {

    private static final List<DateTimeFormatter> ISO_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private final List<DateTimeFormatter> formats;

    public DateValueParser(List<String> patterns) {
        List<DateTimeFormatter> all = new ArrayList<>(ISO_FORMATS);
        if (patterns != null) {
            for (String p : patterns) {
                if (p != null && !p.isBlank()) {
                    all.add(DateTimeFormatter.ofPattern(p.strip(), Locale.US));
                }
            }
        }
        this.formats = List.copyOf(all);
    }

    public ParseOutcome<LocalDate> parse(Object raw) {
        if (raw == null) {
            return ParseOutcome.missing();
        }
        if (raw instanceof LocalDate d) {
            return ParseOutcome.ok(d);
        }
        if (raw instanceof LocalDateTime dt) {
            return ParseOutcome.ok(dt.toLocalDate());
        }
        if (raw instanceof OffsetDateTime odt) {
            return ParseOutcome.ok(odt.toLocalDate());
        }
        String text = raw.toString().strip();
        if (text.isEmpty() || "nat".equalsIgnoreCase(text) || "null".equalsIgnoreCase(text)) {
            return ParseOutcome.missing();
        }
        for (DateTimeFormatter format : formats) {
            Optional<LocalDate> parsed = tryParse(text, format);
            if (parsed.isPresent()) {
                return ParseOutcome.ok(parsed.get());
            }
        }
        return ParseOutcome.invalid();
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
