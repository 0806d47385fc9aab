package org.hypertrace.core.metrics.etl.executor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.etl.MetricsEtlException;
import org.hypertrace.core.metrics.etl.config.QueryDefinition;
import org.hypertrace.core.metrics.etl.normalize.NormalizationResult;
import org.hypertrace.core.metrics.etl.normalize.NormalizedRecord;
import org.hypertrace.core.metrics.etl.normalize.SampleNormalizer;
import org.hypertrace.core.metrics.etl.plan.QueryPlanner;
import org.hypertrace.core.metrics.etl.plan.SourceRequest;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.source.QueryResult;
import org.hypertrace.core.metrics.etl.store.RecordStore;
import org.hypertrace.core.metrics.etl.store.StoreException;
import org.hypertrace.core.metrics.etl.time.ReferenceInstant;
import org.hypertrace.core.metrics.etl.utils.DurationUtil;
import org.slf4j.MDC;

/**
 * Runs a query definition end to end (plan, fetch, normalize, persist) with bounded retry, and
 * writes exactly one {@link ExecutionRecord} per invocation whatever the outcome.
 *
 * <p>An invocation is sequential. Up to {@code retryCount + 1} attempts are made, separated by the
 * definition's retry interval; every failure inside an attempt, persistence included, moves on to
 * the next attempt. The wait between attempts returns early when the {@link CancellationScope} is
 * cancelled, and no further attempt is started. Concurrent invocations of the same query id are
 * not serialized here. An unchecked exception from a collaborator ends the invocation at once: the
 * failure is recorded and the exception is rethrown.
 */
@Slf4j
public class RetryingExecutor {
  static final String QUERY_ID_MDC_KEY = "queryId";

  private static final String EXECUTIONS_COUNTER = "metrics.etl.query.executions";
  private static final String ATTEMPTS_COUNTER = "metrics.etl.query.attempts";
  private static final String SKIPPED_SAMPLES_COUNTER = "metrics.etl.samples.skipped";
  private static final String DURATION_TIMER = "metrics.etl.query.duration";

  private final QueryPlanner planner;
  private final MetricsSource source;
  private final SampleNormalizer normalizer;
  private final RecordStore store;
  private final Clock clock;
  private final Duration defaultRetryInterval;
  private final boolean skipRetryOnDeterministicErrors;

  private final MeterRegistry meterRegistry;

  private Counter successCounter;
  private Counter failureCounter;
  private Counter attemptCounter;
  private Counter skippedSamplesCounter;
  private Timer durationTimer;

  public RetryingExecutor(
      QueryPlanner planner,
      MetricsSource source,
      SampleNormalizer normalizer,
      RecordStore store,
      Clock clock,
      MeterRegistry meterRegistry,
      Duration defaultRetryInterval,
      boolean skipRetryOnDeterministicErrors) {
    this.planner = planner;
    this.source = source;
    this.normalizer = normalizer;
    this.store = store;
    this.clock = clock;
    this.defaultRetryInterval = defaultRetryInterval;
    this.skipRetryOnDeterministicErrors = skipRetryOnDeterministicErrors;
    this.meterRegistry = meterRegistry;
    initMetrics();
  }

  private void initMetrics() {
    successCounter = meterRegistry.counter(EXECUTIONS_COUNTER, "status", "success");
    failureCounter = meterRegistry.counter(EXECUTIONS_COUNTER, "status", "failed");
    attemptCounter = meterRegistry.counter(ATTEMPTS_COUNTER);
    skippedSamplesCounter = meterRegistry.counter(SKIPPED_SAMPLES_COUNTER);
    durationTimer = meterRegistry.timer(DURATION_TIMER);
  }

  public ExecutionRecord runQuery(
      QueryDefinition query, ReferenceInstant reference, CancellationScope cancellationScope) {
    ExecutionRecord execution =
        ExecutionRecord.started(query.getId(), query.getName(), clock.instant());
    MDC.put(QUERY_ID_MDC_KEY, query.getId());
    try {
      log.info("Starting query execution: {} [{}]", query.getName(), query.getQuery());
      int maxAttempts = query.getRetryCount() + 1;
      Duration retryInterval = retryIntervalOf(query);
      MetricsEtlException lastError = null;
      int attempts = 0;

      while (attempts < maxAttempts) {
        if (attempts > 0) {
          log.info(
              "Retrying query execution, attempt {}/{} in {}",
              attempts + 1,
              maxAttempts,
              retryInterval);
        }
        if (cancelledBeforeAttempt(attempts, retryInterval, cancellationScope)) {
          CancelledException cancelled = new CancelledException(attempts);
          log.warn("Query execution {}", cancelled.getMessage());
          return complete(execution.failed(clock.instant(), attempts, cancelled.getMessage()));
        }

        attempts++;
        attemptCounter.increment();
        int written;
        try {
          written = runAttempt(query, reference);
        } catch (MetricsEtlException e) {
          lastError = e;
          log.warn("Attempt {}/{} failed: {}", attempts, maxAttempts, e.getMessage());
          if (skipRetryOnDeterministicErrors && e.isDeterministic()) {
            log.warn("Not retrying deterministic failure");
            break;
          }
          continue;
        } catch (RuntimeException e) {
          log.error("Attempt {}/{} failed unexpectedly, not retrying", attempts, maxAttempts, e);
          complete(execution.failed(clock.instant(), attempts, unexpectedFailure(attempts, e)));
          throw e;
        }

        ExecutionRecord succeeded = execution.succeeded(clock.instant(), written, attempts);
        log.info(
            "Query execution completed successfully: {} records in {} attempt(s)",
            written,
            attempts);
        return complete(succeeded);
      }

      QueryExecutionException failure = new QueryExecutionException(attempts, lastError);
      log.error("Query execution failed", failure);
      return complete(execution.failed(clock.instant(), attempts, failure.getMessage()));
    } finally {
      MDC.remove(QUERY_ID_MDC_KEY);
    }
  }

  /**
   * Checks that the metrics source and then the record store are reachable. Not retried; the first
   * failure is thrown.
   */
  public void checkConnections() throws MetricsEtlException {
    source.ping();
    store.ping();
    log.info("Metrics source and record store are reachable");
  }

  private int runAttempt(QueryDefinition query, ReferenceInstant reference)
      throws MetricsEtlException {
    SourceRequest request = planner.plan(query, reference);
    log.debug("Planned source request {}", request);
    QueryResult result = request.execute(source);
    NormalizationResult normalized =
        normalizer.normalizeAll(result.getSamples(), query.getId(), request.getResultType());
    if (normalized.getSkippedCount() > 0) {
      skippedSamplesCounter.increment(normalized.getSkippedCount());
    }
    List<NormalizedRecord> records = normalized.getRecords();
    store.insertNormalizedRecords(records);
    return records.size();
  }

  private boolean cancelledBeforeAttempt(
      int attemptsSoFar, Duration retryInterval, CancellationScope cancellationScope) {
    if (attemptsSoFar == 0) {
      return cancellationScope.isCancelled();
    }
    try {
      return cancellationScope.awaitCancellation(retryInterval);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  /** Records metrics and persists the finished execution; a failed write is only logged. */
  private ExecutionRecord complete(ExecutionRecord record) {
    if (record.getStatus() == ExecutionStatus.SUCCESS) {
      successCounter.increment();
    } else {
      failureCounter.increment();
    }
    record.getDuration().ifPresent(durationTimer::record);

    try {
      store.insertExecutionRecord(record);
    } catch (StoreException e) {
      log.error("Failed to store execution record", e);
    }
    return record;
  }

  private static String unexpectedFailure(int attempts, RuntimeException error) {
    return String.format(
        "query failed unexpectedly after %d %s: %s",
        attempts, attempts == 1 ? "attempt" : "attempts", error);
  }

  private Duration retryIntervalOf(QueryDefinition query) {
    return DurationUtil.parse(query.getRetryInterval())
        .filter(interval -> !interval.isNegative())
        .orElse(defaultRetryInterval);
  }
}
