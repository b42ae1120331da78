package com.txradar.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw source row as delivered by the ingester: free-form column names, untyped values.
 * rowIndex is the position in the delivered batch and is the deterministic tie-breaker downstream.
 */
@Getter
public class RawTransaction {

    private final int rowIndex;
    private final Map<String, Object> fields;

    public RawTransaction(int rowIndex, Map<String, ?> fields) {
        this.rowIndex = rowIndex;
        this.fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
