package com.txradar.pipeline.normalizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses raw monetary values ("$1,234.50", "(12.00)", "USD 42", 42, "") into signed BigDecimal at scale 2.
 * Only currency symbols, a leading or trailing 3-letter currency code, grouping commas and spaces are dropped;
 * any other character (exponents, words) makes the value invalid.
 */
public final class AmountValueParser {

    public static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final Set<String> EMPTY_MARKERS = Set.of("nan", "none", "null", "n/a");
    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Za-z]{3}(?=[\\s\\p{Sc}\\d(.-])|(?<=[\\d\\s.])[A-Za-z]{3}$");
    private static final Pattern DECORATION = Pattern.compile("[\\p{Sc},\\s]");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

    private AmountValueParser() {
    }

    public static ParseOutcome<BigDecimal> parse(Object raw) {
        if (raw == null) {
            return ParseOutcome.missing();
        }
        if (raw instanceof BigDecimal bd) {
            return ParseOutcome.ok(bd.setScale(SCALE, ROUNDING));
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return ParseOutcome.invalid();
            }
            return ParseOutcome.ok(new BigDecimal(n.toString()).setScale(SCALE, ROUNDING));
        }
        String text = raw.toString().strip();
        if (text.isEmpty() || EMPTY_MARKERS.contains(text.toLowerCase())) {
            return ParseOutcome.missing();
        }
        String cleaned = DECORATION.matcher(CURRENCY_CODE.matcher(text).replaceAll("")).replaceAll("");
        boolean negative = false;
        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            negative = true;
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        if (!PLAIN_NUMBER.matcher(cleaned).matches()) {
            return ParseOutcome.invalid();
        }
        try {
            BigDecimal value = new BigDecimal(cleaned).setScale(SCALE, ROUNDING);
            return ParseOutcome.ok(negative ? value.negate() : value);
        } catch (NumberFormatException e) {
            return ParseOutcome.invalid();
        }
    }
}
