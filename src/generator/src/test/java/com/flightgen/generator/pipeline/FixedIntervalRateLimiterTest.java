package com.flightgen.generator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FixedIntervalRateLimiterTest {

  /** Manual clock whose sleeps advance time exactly. */
  private static final class FakeTime {
    long now = 1_000_000L;
    final List<Long> sleeps = new ArrayList<>();

    long nanoTime() {
      return now;
    }

    void sleep(long nanos) {
      sleeps.add(nanos);
      now += nanos;
    }
  }

  @Test
  void firstPermitIsImmediateThenOnePerInterval() throws Exception {
    FakeTime time = new FakeTime();
    FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter(4.0, time::nanoTime, time::sleep);

    limiter.awaitSlot();
    limiter.awaitSlot();
    limiter.awaitSlot();

    assertThat(limiter.intervalNanos()).isEqualTo(250_000_000L);
    assertThat(time.sleeps).containsExactly(250_000_000L, 250_000_000L);
  }

  @Test
  void schedulingJitterDoesNotAccumulate() throws Exception {
    FakeTime time = new FakeTime();
    FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter(10.0, time::nanoTime, time::sleep);

    limiter.awaitSlot();
    time.now += 30_000_000L; // caller spent 30 ms working
    limiter.awaitSlot();

    assertThat(time.sleeps).containsExactly(70_000_000L);
  }

  @Test
  void lateCallerProceedsWithoutBurstCatchUp() throws Exception {
    FakeTime time = new FakeTime();
    FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter(10.0, time::nanoTime, time::sleep);

    limiter.awaitSlot();
    time.now += 550_000_000L; // five intervals late
    limiter.awaitSlot();
    limiter.awaitSlot();

    // No sleep for the late call, then a full interval, not a series of zero waits.
    assertThat(time.sleeps).containsExactly(100_000_000L);
  }

  @Test
  void rejectsNonPositiveOrNonFiniteRates() {
    for (double rate : new double[] {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY}) {
      assertThatThrownBy(() -> new FixedIntervalRateLimiter(rate))
          .as("rate %s", rate)
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void realSleepIsInterruptible() {
    FixedIntervalRateLimiter limiter = new FixedIntervalRateLimiter(0.01);
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> {
        limiter.awaitSlot();
        limiter.awaitSlot();
      }).isInstanceOf(InterruptedException.class);
    } finally {
      Thread.interrupted();
    }
  }
}
