package com.architecture.memory.palace.service.memory;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running totals over every query the executor ran. Safe to share between threads.
 */
@Slf4j
public class QueryMetricsCollector {

    private final LongAdder executed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder rows = new LongAdder();
    private final LongAdder elapsedMs = new LongAdder();
    private final AtomicLong slowestMs = new AtomicLong();
    private final Map<String, LongAdder> byQueryType = new ConcurrentHashMap<>();
    private final AtomicReference<QueryMetrics> last = new AtomicReference<>();

    public void record(QueryMetrics metrics) {
        executed.increment();
        if (!metrics.successful()) {
            failed.increment();
        }
        rows.add(metrics.rows());
        elapsedMs.add(metrics.elapsedMs());
        slowestMs.accumulateAndGet(metrics.elapsedMs(), Math::max);
        byQueryType.computeIfAbsent(metrics.queryType(), type -> new LongAdder()).increment();
        last.set(metrics);

        if (metrics.successful()) {
            log.debug("[Query Metrics] {} query: {} rows, {} nodes created, {} deleted, {} relationships created, "
                            + "{} deleted, {} properties set, server {}ms, total {}ms",
                    metrics.queryType(), metrics.rows(), metrics.nodesCreated(), metrics.nodesDeleted(),
                    metrics.relationshipsCreated(), metrics.relationshipsDeleted(), metrics.propertiesSet(),
                    metrics.serverTimeMs(), metrics.elapsedMs());
        }
    }

    public long executedQueries() {
        return executed.sum();
    }

    public long failedQueries() {
        return failed.sum();
    }

    public long totalRows() {
        return rows.sum();
    }

    public long totalElapsedMs() {
        return elapsedMs.sum();
    }

    public long slowestMs() {
        return slowestMs.get();
    }

    public double averageElapsedMs() {
        long count = executed.sum();
        return count == 0 ? 0.0 : (double) elapsedMs.sum() / count;
    }

    /**
     * Executions per query type, sorted by type name.
     */
    public Map<String, Long> countsByQueryType() {
        Map<String, Long> counts = new TreeMap<>();
        byQueryType.forEach((type, count) -> counts.put(type, count.sum()));
        return counts;
    }

    /**
     * @return metrics of the most recent execution, or null before the first one
     */
    public QueryMetrics last() {
        return last.get();
    }
}
