package com.flightgen.generator.pipeline;

import com.flightgen.generator.config.RunConfiguration;
import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.RowGenerator;
import com.flightgen.generator.sink.BatchSink;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a run across planes, starts one worker per plane and joins them.
 *
 * <p>The join is fail-fast: the first failed plane cancels the others, and the report still
 * carries every row flushed before they stopped. One run at a time.
 */
@Component
public class FleetCoordinator {
  private static final Logger log = LoggerFactory.getLogger(FleetCoordinator.class);

  private final BatchSink sink;
  private final GeneratorMetrics metrics;
  private final Clock clock;
  private final AtomicReference<ActiveRun> active = new AtomicReference<>();

  public FleetCoordinator(BatchSink sink, MeterRegistry meterRegistry, Clock clock) {
    this.sink = sink;
    this.metrics = new GeneratorMetrics(meterRegistry);
    this.clock = clock;
  }

  /**
   * Splits {@code totalRows} as evenly as possible: every plane gets {@code totalRows / planeCount}
   * rows and the first {@code totalRows % planeCount} planes get one more.
   */
  public static long[] splitBudget(long totalRows, int planeCount) {
    if (totalRows < 0) {
      throw new IllegalArgumentException("totalRows must be >= 0");
    }
    if (planeCount <= 0) {
      throw new IllegalArgumentException("planeCount must be > 0");
    }
    long base = totalRows / planeCount;
    long remainder = totalRows % planeCount;
    long[] budgets = new long[planeCount];
    for (int i = 0; i < planeCount; i++) {
      budgets[i] = base + (i < remainder ? 1 : 0);
    }
    return budgets;
  }

  /**
   * Resolves every plane's identifier and row budget.
   *
   * @throws com.flightgen.generator.plane.RangeExceededException when the fleet does not fit
   *     between the starting identifier and {@code ZZ99}
   */
  public static List<PlaneAssignment> assign(RunConfiguration config) {
    PlaneId start = config.startingPlaneId();
    // Check the last identifier first so nothing is allocated for a fleet that cannot fit.
    PlaneId.identifierAt(start, config.planeCount() - 1L);

    long[] budgets = splitBudget(config.totalRows(), config.planeCount());
    List<PlaneAssignment> assignments = new ArrayList<>(budgets.length);
    for (int ordinal = 0; ordinal < budgets.length; ordinal++) {
      assignments.add(new PlaneAssignment(ordinal, PlaneId.identifierAt(start, ordinal), budgets[ordinal]));
    }
    return assignments;
  }

  public RunReport run(RunConfiguration config) {
    return run(config, FlushListener.NOOP);
  }

  /**
   * Runs the whole fleet to completion, failure or cancellation.
   *
   * @param config validated run configuration
   * @param listener progress callback, invoked from worker threads
   * @return the run's report
   * @throws com.flightgen.generator.config.ConfigurationException when identifiers cannot be
   *     assigned; no worker is started in that case
   */
  public RunReport run(RunConfiguration config, FlushListener listener) {
    List<PlaneAssignment> assignments = assign(config);

    ActiveRun run = new ActiveRun();
    if (!active.compareAndSet(null, run)) {
      throw new IllegalStateException("a fleet run is already in progress");
    }

    long startNanos = System.nanoTime();
    List<PlaneWorker> workers = new ArrayList<>(assignments.size());
    for (PlaneAssignment assignment : assignments) {
      workers.add(new PlaneWorker(
          assignment,
          config.tableName(),
          config.batchSize(),
          sink,
          new FixedIntervalRateLimiter(config.ratePerPlane()),
          new RowGenerator(assignment.planeId(), clock),
          metrics,
          listener,
          run::isCancelled));
    }

    log.info(
        "Starting {} planes ({}..{}): totalRows={}, ratePerPlane={}/s, batchSize={}, table={}",
        assignments.size(),
        assignments.get(0).planeId(),
        assignments.get(assignments.size() - 1).planeId(),
        config.totalRows(),
        config.ratePerPlane(),
        config.batchSize(),
        config.tableName());

    ExecutorService executor = Executors.newFixedThreadPool(workers.size(), planeThreadFactory());
    try {
      CompletionService<PlaneOutcome> completion = new ExecutorCompletionService<>(executor);
      for (PlaneWorker worker : workers) {
        completion.submit(worker);
      }
      run.attach(executor);
      awaitWorkers(completion, workers.size(), run);
    } finally {
      shutdown(executor, config.shutdownTimeout());
      active.compareAndSet(run, null);
    }

    List<PlaneOutcome> outcomes = workers.stream().map(PlaneWorker::outcome).toList();
    RunReport report = new RunReport(
        statusOf(outcomes),
        config.totalRows(),
        outcomes.stream().mapToLong(PlaneOutcome::rowsFlushed).sum(),
        Duration.ofNanos(System.nanoTime() - startNanos),
        outcomes);
    log.info("Fleet run {}: {} of {} rows flushed in {} ms",
        report.status(), report.rowsFlushed(), report.rowsRequested(), report.elapsed().toMillis());
    return report;
  }

  /** Requests cooperative cancellation of the run in progress, if any. */
  @PreDestroy
  public void cancel() {
    ActiveRun run = active.get();
    if (run != null) {
      log.info("Cancellation requested");
      run.cancel();
    }
  }

  private void awaitWorkers(CompletionService<PlaneOutcome> completion, int count, ActiveRun run) {
    for (int remaining = count; remaining > 0; remaining--) {
      Future<PlaneOutcome> done;
      try {
        done = completion.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        run.cancel();
        return;
      }

      PlaneOutcome outcome;
      try {
        outcome = done.get();
      } catch (CancellationException ex) {
        continue;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        run.cancel();
        return;
      } catch (ExecutionException ex) {
        run.cancel();
        throw new IllegalStateException("plane worker crashed", ex.getCause());
      }

      if (outcome.failed()) {
        log.warn("Plane {} failed, cancelling remaining planes", outcome.planeId());
        run.cancel();
        return;
      }
    }
  }

  private static void shutdown(ExecutorService executor, Duration timeout) {
    boolean interrupted = Thread.interrupted();
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Plane workers still running after {} ms; reporting last observed progress", timeout.toMillis());
      }
    } catch (InterruptedException ex) {
      interrupted = true;
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static RunStatus statusOf(List<PlaneOutcome> outcomes) {
    if (outcomes.stream().anyMatch(PlaneOutcome::failed)) {
      return RunStatus.FAILED;
    }
    if (outcomes.stream().allMatch(o -> o.state() == WorkerState.COMPLETED)) {
      return RunStatus.COMPLETED;
    }
    return RunStatus.CANCELLED;
  }

  private static ThreadFactory planeThreadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "plane-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static final class ActiveRun {
    private volatile boolean cancelled;
    private volatile ExecutorService executor;

    boolean isCancelled() {
      return cancelled;
    }

    void attach(ExecutorService executor) {
      this.executor = executor;
      if (cancelled) {
        executor.shutdownNow();
      }
    }

    void cancel() {
      cancelled = true;
      ExecutorService current = executor;
      if (current != null) {
        current.shutdownNow();
      }
    }
  }
}
