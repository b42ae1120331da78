package com.txradar.pipeline.normalizer;

/**
 * Result of parsing one raw value: absent/blank, present but unparseable, or a value.
 */
public record ParseOutcome<T>(T value, Status status) {

    public enum Status { MISSING, INVALID, OK }

    public static <T> ParseOutcome<T> missing() {
        return new ParseOutcome<>(null, Status.MISSING);
    }

    public static <T> ParseOutcome<T> invalid() {
        return new ParseOutcome<>(null, Status.INVALID);
    }

    public static <T> ParseOutcome<T> ok(T value) {
        return new ParseOutcome<>(value, Status.OK);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isMissing() {
        return status == Status.MISSING;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }
}
