package com.flightgen.generator.pipeline;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Fixed-interval pacing for one plane.
 *
 * <p>Keeps an absolute "next due" instant and advances it by one interval per permit, so
 * scheduling jitter does not accumulate. A caller that arrives late is let through immediately
 * and the schedule restarts from the current instant; missed slots are never replayed as a burst.
 *
 * <p>One instance per plane; not shared between threads.
 */
public final class FixedIntervalRateLimiter implements RateLimiter {

  /** Sleeps the current thread; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleepNanos(long nanos) throws InterruptedException;
  }

  private final long intervalNanos;
  private final LongSupplier nanoTime;
  private final Sleeper sleeper;
  private boolean started;
  private long nextDueNanos;

  public FixedIntervalRateLimiter(double ratePerSecond) {
    this(ratePerSecond, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
  }

  public FixedIntervalRateLimiter(double ratePerSecond, LongSupplier nanoTime, Sleeper sleeper) {
    if (Double.isNaN(ratePerSecond) || Double.isInfinite(ratePerSecond) || ratePerSecond <= 0) {
      throw new IllegalArgumentException("ratePerSecond must be a finite value > 0 (was " + ratePerSecond + ")");
    }
    this.intervalNanos = Math.max(1L, Math.round(TimeUnit.SECONDS.toNanos(1) / ratePerSecond));
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public void awaitSlot() throws InterruptedException {
    long now = nanoTime.getAsLong();
    if (!started) {
      started = true;
      nextDueNanos = now + intervalNanos;
      return;
    }
    long waitNanos = nextDueNanos - now;
    if (waitNanos > 0) {
      sleeper.sleepNanos(waitNanos);
      nextDueNanos += intervalNanos;
    } else {
      nextDueNanos = now + intervalNanos;
    }
  }

  public long intervalNanos() {
    return intervalNanos;
  }
}
