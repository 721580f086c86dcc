package com.architecture.memory.palace.service.memory;

import com.architecture.memory.palace.exception.QueryExecutionException;
import com.architecture.memory.palace.service.query.QueryPlan;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.async.AsyncSession;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.ResultSummary;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Hands finished {@link QueryPlan}s to the Neo4j driver. Text and parameters are passed as they
 * are; the driver binds the parameters. Every call runs with the configured transaction timeout
 * and reports a {@link QueryMetrics} to the {@link QueryMetricsCollector}, failures included.
 */
@Slf4j
public class Neo4jQueryExecutor {

    private final Driver neo4jDriver;
    private final TransactionConfig transactionConfig;
    private final QueryMetricsCollector metricsCollector;

    public Neo4jQueryExecutor(Driver neo4jDriver, Duration timeout, QueryMetricsCollector metricsCollector) {
        this.neo4jDriver = neo4jDriver;
        this.metricsCollector = metricsCollector;
        this.transactionConfig = TransactionConfig.builder()
                .withTimeout(timeout)
                .build();
    }

    /**
     * Run a plan that may write.
     */
    public List<Record> execute(QueryPlan plan) {
        return run(plan, AccessMode.WRITE);
    }

    /**
     * Run a read-only plan; clusters may route it to a follower.
     */
    public List<Record> read(QueryPlan plan) {
        return run(plan, AccessMode.READ);
    }

    /**
     * Run a read-only plan on an async session. The stage fails with {@link QueryExecutionException}
     * when the driver does; the session is closed either way.
     */
    public CompletionStage<List<Record>> executeAsync(QueryPlan plan) {
        log.debug("[Neo4j Executor] Submitting async query with {} parameters", plan.parameters().size());
        long startTime = System.currentTimeMillis();
        AsyncSession session = neo4jDriver.session(AsyncSession.class, sessionConfig(AccessMode.READ));
        CompletableFuture<List<Record>> outcome = new CompletableFuture<>();

        session.runAsync(plan.text(), plan.parameters(), transactionConfig)
                .thenCompose(cursor -> cursor.listAsync()
                        .thenCompose(records -> cursor.consumeAsync()
                                .thenApply(summary -> {
                                    report(summary, records.size(), startTime);
                                    return records;
                                })))
                .whenComplete((records, error) -> session.closeAsync().whenComplete((ignored, closeError) -> {
                    if (closeError != null) {
                        log.warn("[Neo4j Executor] Failed to close async session: {}", closeError.getMessage());
                    }
                    if (error != null) {
                        outcome.completeExceptionally(failure(plan, unwrap(error), startTime));
                    } else {
                        outcome.complete(records);
                    }
                }));

        return outcome;
    }

    private List<Record> run(QueryPlan plan, AccessMode mode) {
        long startTime = System.currentTimeMillis();
        try (Session session = neo4jDriver.session(sessionConfig(mode))) {
            Result result = session.run(plan.text(), plan.parameters(), transactionConfig);
            List<Record> records = result.list();
            QueryMetrics metrics = report(result.consume(), records.size(), startTime);
            log.debug("[Neo4j Executor] {} session ran {} query: {} records in {}ms",
                    mode, metrics.queryType(), records.size(), metrics.elapsedMs());
            return records;
        } catch (Neo4jException e) {
            throw failure(plan, e, startTime);
        }
    }

    private QueryMetrics report(ResultSummary summary, int rows, long startTime) {
        QueryMetrics metrics = QueryMetrics.of(summary, rows, System.currentTimeMillis() - startTime);
        if (metrics.containsUpdates()) {
            log.info("[Neo4j Executor] {} query updated the graph: +{}/-{} nodes, +{}/-{} relationships, {} properties",
                    metrics.queryType(), metrics.nodesCreated(), metrics.nodesDeleted(),
                    metrics.relationshipsCreated(), metrics.relationshipsDeleted(), metrics.propertiesSet());
        }
        metricsCollector.record(metrics);
        return metrics;
    }

    private static SessionConfig sessionConfig(AccessMode mode) {
        return SessionConfig.builder()
                .withDefaultAccessMode(mode)
                .build();
    }

    private QueryExecutionException failure(QueryPlan plan, Throwable cause, long startTime) {
        metricsCollector.record(QueryMetrics.failed(cause, System.currentTimeMillis() - startTime));
        log.error("[Neo4j Executor] Query failed ({} parameters): {}", plan.parameters().size(), plan.text(), cause);
        return new QueryExecutionException("Failed to execute query: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
