package com.flightgen.generator;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProgressLoggerTest {

  @Test
  void crossedIntervalDetectsBoundaryInsideBatch() {
    ProgressLogger logger = new ProgressLogger(1000);

    assertThat(logger.crossedInterval(300, 900)).isFalse();
    assertThat(logger.crossedInterval(300, 1200)).isTrue();
    assertThat(logger.crossedInterval(500, 1000)).isTrue();
    assertThat(logger.crossedInterval(500, 1500)).isFalse();
  }

  @Test
  void zeroIntervalDisablesIntermediateProgress() {
    ProgressLogger logger = new ProgressLogger(0);

    assertThat(logger.crossedInterval(1000, 5000)).isFalse();
  }
}
