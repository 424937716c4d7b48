package com.flightgen.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flightgen.generator.config.GeneratorProperties;
import com.flightgen.generator.config.RunConfiguration;
import com.flightgen.generator.pipeline.FleetCoordinator;
import com.flightgen.generator.pipeline.FlushListener;
import com.flightgen.generator.pipeline.PlaneOutcome;
import com.flightgen.generator.pipeline.RunReport;
import com.flightgen.generator.pipeline.RunStatus;
import com.flightgen.generator.pipeline.WorkerState;
import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.RangeExceededException;
import com.flightgen.generator.sink.SinkException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class GenerationRunnerTest {
  private final FleetCoordinator coordinator = mock(FleetCoordinator.class);

  @Test
  void completedRunExitsWithZero() {
    when(coordinator.run(any(RunConfiguration.class), any(FlushListener.class)))
        .thenReturn(report(RunStatus.COMPLETED, 10, outcome("AA00", 10, 10, WorkerState.COMPLETED, null)));
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 1, "AA00", false));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(GenerationRunner.EXIT_OK);
    assertThat(runner.lastReport().rowsFlushed()).isEqualTo(10);
    verify(coordinator).run(
        argThat(config -> config.totalRows() == 10 && config.startingPlaneId().equals(PlaneId.parse("AA00"))),
        argThat(listener -> listener instanceof ProgressLogger));
  }

  @Test
  void quietRunInstallsNoProgressListener() {
    when(coordinator.run(any(RunConfiguration.class), any(FlushListener.class)))
        .thenReturn(report(RunStatus.COMPLETED, 10, outcome("AA00", 10, 10, WorkerState.COMPLETED, null)));
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 1, "AA00", true));

    runner.run(new DefaultApplicationArguments());

    verify(coordinator).run(any(RunConfiguration.class), eq(FlushListener.NOOP));
  }

  @Test
  void sinkFailureExitsWithOne() {
    when(coordinator.run(any(RunConfiguration.class), any(FlushListener.class)))
        .thenReturn(report(RunStatus.FAILED, 6,
            outcome("AA00", 5, 3, WorkerState.CANCELLED, null),
            outcome("AA01", 5, 3, WorkerState.FAILED, new SinkException("connection reset"))));
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 2, "AA00", true));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(GenerationRunner.EXIT_SINK_FAILURE);
    assertThat(runner.lastReport().failures()).extracting(PlaneOutcome::planeId)
        .containsExactly(PlaneId.parse("AA01"));
  }

  @Test
  void cancelledRunExitsWith130() {
    when(coordinator.run(any(RunConfiguration.class), any(FlushListener.class)))
        .thenReturn(report(RunStatus.CANCELLED, 4, outcome("AA00", 10, 4, WorkerState.CANCELLED, null)));
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 1, "AA00", true));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(GenerationRunner.EXIT_CANCELLED);
  }

  @Test
  void invalidPropertiesExitWithTwoBeforeAnyGeneration() {
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 0, "AA00", true));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(GenerationRunner.EXIT_CONFIGURATION_ERROR);
    assertThat(runner.lastReport()).isNull();
    verifyNoInteractions(coordinator);
  }

  @Test
  void identifierOverflowExitsWithTwo() {
    when(coordinator.run(any(RunConfiguration.class), any(FlushListener.class)))
        .thenThrow(new RangeExceededException(PlaneId.parse("ZZ98"), 2));
    GenerationRunner runner = new GenerationRunner(coordinator, properties(10, 3, "ZZ98", true));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(GenerationRunner.EXIT_CONFIGURATION_ERROR);
  }

  private static GeneratorProperties properties(long totalRows, int planes, String start, boolean quiet) {
    return new GeneratorProperties(
        "jdbc:postgresql://localhost:8812/qdb",
        totalRows,
        10.0,
        planes,
        "flight_data",
        start,
        1000,
        quiet,
        1000L,
        Duration.ofSeconds(1),
        null);
  }

  private static PlaneOutcome outcome(String id, long budget, long flushed, WorkerState state, Throwable failure) {
    return new PlaneOutcome(PlaneId.parse(id), budget, flushed, flushed, state, failure);
  }

  private static RunReport report(RunStatus status, long flushed, PlaneOutcome... planes) {
    return new RunReport(status, 10, flushed, Duration.ofMillis(25), List.of(planes));
  }
}
