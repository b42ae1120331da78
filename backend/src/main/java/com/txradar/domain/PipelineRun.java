package com.txradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Audit record of one pipeline run: row count, diagnostics counters, outcome.
 */
@Document(collection = "pipeline_runs")
@NoArgsConstructor
@Getter
@Setter
public class PipelineRun {

    @Id
    private String id;
    private Status status;
    private int rowCount;
    private int categoryCount;
    private Map<String, Long> counters = new TreeMap<>();
    private String errorCode;
    private String errorMessage;
    @Indexed
    private Instant startedAt;
    private Instant completedAt;

    public enum Status { RUNNING, COMPLETE, FAILED }
}
