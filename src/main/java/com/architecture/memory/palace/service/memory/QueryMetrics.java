package com.architecture.memory.palace.service.memory;

import org.neo4j.driver.summary.ResultSummary;
import org.neo4j.driver.summary.SummaryCounters;

import java.util.concurrent.TimeUnit;

/**
 * Outcome of one query execution: the server's query type and update counters, the number of
 * rows, server-side and client-side timing, and the error message when it failed.
 *
 * @param queryType        driver query type ({@code READ_ONLY}, {@code WRITE_ONLY}, ...), {@code UNKNOWN} on failure
 * @param serverTimeMs     time until the result was available plus time to consume it, as reported by the server
 * @param elapsedMs        wall-clock time on the client, session handling included
 */
public record QueryMetrics(String queryType,
                           int rows,
                           int nodesCreated,
                           int nodesDeleted,
                           int relationshipsCreated,
                           int relationshipsDeleted,
                           int propertiesSet,
                           long serverTimeMs,
                           long elapsedMs,
                           boolean successful,
                           String error) {

    public static final String UNKNOWN_TYPE = "UNKNOWN";

    public static QueryMetrics of(ResultSummary summary, int rows, long elapsedMs) {
        SummaryCounters counters = summary.counters();
        long available = Math.max(summary.resultAvailableAfter(TimeUnit.MILLISECONDS), 0);
        long consumed = Math.max(summary.resultConsumedAfter(TimeUnit.MILLISECONDS), 0);
        return new QueryMetrics(
                summary.queryType() == null ? UNKNOWN_TYPE : summary.queryType().name(),
                rows,
                counters.nodesCreated(),
                counters.nodesDeleted(),
                counters.relationshipsCreated(),
                counters.relationshipsDeleted(),
                counters.propertiesSet(),
                available + consumed,
                elapsedMs,
                true,
                null);
    }

    public static QueryMetrics failed(Throwable cause, long elapsedMs) {
        return new QueryMetrics(UNKNOWN_TYPE, 0, 0, 0, 0, 0, 0, 0, elapsedMs, false, cause.getMessage());
    }

    public boolean containsUpdates() {
        return nodesCreated + nodesDeleted + relationshipsCreated + relationshipsDeleted + propertiesSet > 0;
    }
}
