package org.hypertrace.core.metrics.etl;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.EtlConfig;
import org.hypertrace.core.metrics.etl.config.QueryDefinition;
import org.hypertrace.core.metrics.etl.config.QueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.executor.CancellationScope;
import org.hypertrace.core.metrics.etl.executor.ExecutionRecord;
import org.hypertrace.core.metrics.etl.executor.ExecutionStatus;
import org.hypertrace.core.metrics.etl.executor.RetryingExecutor;
import org.hypertrace.core.metrics.etl.store.JdbcConnectionProvider;
import org.hypertrace.core.metrics.etl.time.ReferenceInstant;

/**
 * Runs every enabled query definition once against a single reference instant and exits with 0
 * when all of them succeeded, 1 otherwise.
 */
@Slf4j
public class MetricsEtlRunner {
  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURE = 1;
  static final Duration SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

  private final RetryingExecutor executor;
  private final QueryDefinitionProvider queryDefinitionProvider;
  private final EtlConfig etlConfig;
  private final Clock clock;

  @Inject
  MetricsEtlRunner(
      RetryingExecutor executor,
      QueryDefinitionProvider queryDefinitionProvider,
      MetricsEtlConfig config,
      Clock clock) {
    this.executor = executor;
    this.queryDefinitionProvider = queryDefinitionProvider;
    this.etlConfig = config.getEtlConfig();
    this.clock = clock;
  }

  public static void main(String[] args) {
    Config config = ConfigFactory.load();
    Injector injector = Guice.createInjector(new MetricsEtlModule(config));
    CancellationScope cancellationScope = new CancellationScope();
    CountDownLatch finished = new CountDownLatch(1);
    ShutdownHook shutdownHook =
        new ShutdownHook(cancellationScope, finished, SHUTDOWN_GRACE_PERIOD);
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    int exitCode;
    try {
      exitCode = injector.getInstance(MetricsEtlRunner.class).run(cancellationScope);
    } finally {
      injector.getInstance(JdbcConnectionProvider.class).close();
      finished.countDown();
    }
    // System.exit blocks forever once the JVM is already shutting down
    if (!shutdownHook.isStarted()) {
      System.exit(exitCode);
    }
  }

  int run(CancellationScope cancellationScope) {
    if (etlConfig.isCheckConnectionsOnStartup()) {
      try {
        executor.checkConnections();
      } catch (MetricsEtlException e) {
        log.error("Connection check failed, not running any query", e);
        return EXIT_FAILURE;
      }
    }

    List<QueryDefinition> definitions;
    try {
      definitions = queryDefinitionProvider.listEnabledQueryDefinitions();
    } catch (MetricsEtlException e) {
      log.error("Unable to load query definitions", e);
      return EXIT_FAILURE;
    }
    if (definitions.isEmpty()) {
      log.warn("No enabled query definitions found");
      return EXIT_SUCCESS;
    }

    ReferenceInstant reference = ReferenceInstant.capture(clock, etlConfig.getTimeZone());
    log.info("Running {} queries at reference {}", definitions.size(), reference);
    List<ExecutionRecord> records = runAll(definitions, reference, cancellationScope);

    long failed = records.stream().filter(r -> r.getStatus() != ExecutionStatus.SUCCESS).count();
    int written = records.stream().mapToInt(ExecutionRecord::getRecordsCount).sum();
    log.info(
        "Finished {} queries: {} succeeded, {} failed, {} records written",
        definitions.size(),
        definitions.size() - failed,
        failed,
        written);
    return failed == 0 && records.size() == definitions.size() ? EXIT_SUCCESS : EXIT_FAILURE;
  }

  private List<ExecutionRecord> runAll(
      List<QueryDefinition> definitions,
      ReferenceInstant reference,
      CancellationScope cancellationScope) {
    ExecutorService workers =
        Executors.newFixedThreadPool(
            Math.min(etlConfig.getWorkerPoolSize(), definitions.size()),
            new ThreadFactoryBuilder().setNameFormat("metrics-etl-worker-%d").build());
    try {
      List<Future<ExecutionRecord>> futures = new ArrayList<>();
      for (QueryDefinition definition : definitions) {
        futures.add(
            workers.submit(() -> executor.runQuery(definition, reference, cancellationScope)));
      }

      List<ExecutionRecord> records = new ArrayList<>();
      for (Future<ExecutionRecord> future : futures) {
        try {
          records.add(future.get());
        } catch (ExecutionException e) {
          log.error("Query execution terminated unexpectedly", e.getCause());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          cancellationScope.cancel();
          log.warn("Interrupted while waiting for query executions");
          break;
        }
      }
      return records;
    } finally {
      workers.shutdown();
    }
  }

  /**
   * Cancels the running queries on JVM shutdown and holds the shutdown back until the run has
   * finished, so that the cancelled executions still get their records written. Gives up after the
   * grace period.
   */
  static class ShutdownHook extends Thread {
    private final CancellationScope cancellationScope;
    private final CountDownLatch finished;
    private final Duration gracePeriod;
    private volatile boolean started;

    ShutdownHook(
        CancellationScope cancellationScope, CountDownLatch finished, Duration gracePeriod) {
      super("metrics-etl-shutdown");
      this.cancellationScope = cancellationScope;
      this.finished = finished;
      this.gracePeriod = gracePeriod;
    }

    boolean isStarted() {
      return started;
    }

    @Override
    public void run() {
      started = true;
      log.info("Shutdown requested, cancelling running queries");
      cancellationScope.cancel();
      try {
        if (!finished.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Queries did not finish within {}, shutting down anyway", gracePeriod);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for queries to finish");
      }
    }
  }
}
