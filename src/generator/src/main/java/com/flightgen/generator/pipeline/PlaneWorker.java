package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.PlaneState;
import com.flightgen.generator.plane.RowGenerator;
import com.flightgen.generator.sink.BatchSink;
import com.flightgen.generator.sink.SinkException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one plane from its first row to its last flushed batch.
 *
 * <p>Each iteration waits for a rate slot, generates a row and appends it to the plane's buffer;
 * full batches are flushed as they complete and the remainder is flushed once the row budget is
 * reached. A sink failure ends the worker in {@link WorkerState#FAILED} without retrying. On
 * cancellation the partially filled batch is abandoned.
 *
 * <p>Generator state and buffer are confined to the worker thread. {@link #state()} and
 * {@link #outcome()} may be read from any thread.
 */
public class PlaneWorker implements Callable<PlaneOutcome> {
  private static final Logger log = LoggerFactory.getLogger(PlaneWorker.class);

  private final PlaneAssignment assignment;
  private final String tableName;
  private final BatchSink sink;
  private final RateLimiter rateLimiter;
  private final RowGenerator rowGenerator;
  private final BatchBuffer buffer;
  private final GeneratorMetrics metrics;
  private final FlushListener listener;
  private final BooleanSupplier cancelRequested;

  private final AtomicLong rowsGenerated = new AtomicLong();
  private final AtomicLong rowsFlushed = new AtomicLong();
  private volatile WorkerState state = WorkerState.INITIALIZING;
  private volatile Throwable failure;

  public PlaneWorker(
      PlaneAssignment assignment,
      String tableName,
      int batchSize,
      BatchSink sink,
      RateLimiter rateLimiter,
      RowGenerator rowGenerator,
      GeneratorMetrics metrics,
      FlushListener listener,
      BooleanSupplier cancelRequested) {
    this.assignment = Objects.requireNonNull(assignment, "assignment");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.rowGenerator = Objects.requireNonNull(rowGenerator, "rowGenerator");
    this.buffer = new BatchBuffer(assignment.planeId(), batchSize);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = listener == null ? FlushListener.NOOP : listener;
    this.cancelRequested = cancelRequested == null ? () -> false : cancelRequested;
  }

  @Override
  public PlaneOutcome call() {
    PlaneId planeId = assignment.planeId();
    long budget = assignment.rowBudget();
    metrics.planeStarted();
    try {
      state = WorkerState.GENERATING;
      PlaneState planeState = PlaneState.initial(planeId);
      while (rowsGenerated.get() < budget) {
        if (isCancelled()) {
          return cancel();
        }
        rateLimiter.awaitSlot();
        RowGenerator.Step step = rowGenerator.next(planeState);
        planeState = step.state();
        rowsGenerated.incrementAndGet();

        Optional<Batch> full = buffer.append(step.row());
        if (full.isPresent()) {
          flush(full.get());
          state = WorkerState.GENERATING;
        }
      }

      Optional<Batch> tail = buffer.finish();
      if (tail.isPresent()) {
        flush(tail.get());
      }
      state = WorkerState.COMPLETED;
      log.debug("Plane {} completed: {} rows flushed", planeId, rowsFlushed.get());
      return outcome();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return cancel();
    } catch (SinkException ex) {
      // A write torn down by cancellation is not a sink failure.
      return isCancelled() ? cancel() : fail(ex);
    } catch (RuntimeException ex) {
      return fail(ex);
    } finally {
      metrics.planeStopped();
    }
  }

  /** Current lifecycle state. */
  public WorkerState state() {
    return state;
  }

  /** Snapshot of this worker's progress; final once {@link #state()} is terminal. */
  public PlaneOutcome outcome() {
    return new PlaneOutcome(
        assignment.planeId(),
        assignment.rowBudget(),
        rowsGenerated.get(),
        rowsFlushed.get(),
        state,
        failure);
  }

  private void flush(Batch batch) throws SinkException {
    state = WorkerState.FLUSHING;
    long start = System.nanoTime();
    try {
      sink.send(tableName, batch);
    } catch (SinkException ex) {
      metrics.recordSinkError(System.nanoTime() - start);
      throw ex;
    } catch (RuntimeException ex) {
      metrics.recordSinkError(System.nanoTime() - start);
      throw new SinkException("sink rejected batch of plane " + batch.planeId() + ": " + ex.getMessage(), ex);
    }
    metrics.recordFlush(batch.size(), System.nanoTime() - start);
    long flushed = rowsFlushed.addAndGet(batch.size());
    listener.onFlush(batch.planeId(), batch.size(), flushed, assignment.rowBudget());
  }

  private boolean isCancelled() {
    return cancelRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
  }

  private PlaneOutcome cancel() {
    int abandoned = buffer.pendingRows();
    state = WorkerState.CANCELLED;
    log.debug("Plane {} cancelled after {} rows flushed ({} buffered rows dropped)",
        assignment.planeId(), rowsFlushed.get(), abandoned);
    return outcome();
  }

  private PlaneOutcome fail(Exception ex) {
    failure = ex;
    state = WorkerState.FAILED;
    log.error("Plane {} failed after {} rows flushed", assignment.planeId(), rowsFlushed.get(), ex);
    return outcome();
  }
}
