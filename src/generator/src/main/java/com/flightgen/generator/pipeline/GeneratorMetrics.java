package com.flightgen.generator.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Fleet-wide meters. No per-plane tags. */
public class GeneratorMetrics {
  private final Counter rowsFlushed;
  private final Counter batchesFlushed;
  private final Counter sinkErrors;
  private final Timer flushDuration;
  private final AtomicInteger activePlanes;

  public GeneratorMetrics(MeterRegistry meterRegistry) {
    this.rowsFlushed = Counter.builder("generator.rows.flushed")
        .description("Rows accepted by the sink")
        .register(meterRegistry);
    this.batchesFlushed = Counter.builder("generator.batches.flushed")
        .description("Batches accepted by the sink")
        .register(meterRegistry);
    this.sinkErrors = Counter.builder("generator.sink.errors")
        .description("Batches rejected by the sink")
        .register(meterRegistry);
    this.flushDuration = Timer.builder("generator.flush.duration")
        .description("Time spent in a single sink write")
        .register(meterRegistry);
    this.activePlanes = meterRegistry.gauge("generator.planes.active", new AtomicInteger(0));
  }

  void recordFlush(int rows, long elapsedNanos) {
    rowsFlushed.increment(rows);
    batchesFlushed.increment();
    flushDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  void recordSinkError(long elapsedNanos) {
    sinkErrors.increment();
    flushDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  void planeStarted() {
    activePlanes.incrementAndGet();
  }

  void planeStopped() {
    activePlanes.decrementAndGet();
  }
}
