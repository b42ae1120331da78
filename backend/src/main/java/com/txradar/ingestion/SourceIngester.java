package com.txradar.ingestion;

import com.txradar.domain.RawTransaction;

import java.util.List;

/**
 * Supplies the raw batch for one pipeline run, rows numbered 0..n-1 in delivery order.
 */
public interface SourceIngester {

    /**
     * @throws SourceUnavailableException when the source cannot be read
     */
    List<RawTransaction> fetchBatch();
}
