package com.flightgen.generator.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of {@link FleetCoordinator#run}.
 *
 * @param rowsRequested total rows the run was asked to emit
 * @param rowsFlushed rows accepted by the sink across every plane, including planes that kept
 *     flushing until the run was stopped
 * @param planes per-plane outcomes in allocation order
 */
public record RunReport(
    RunStatus status,
    long rowsRequested,
    long rowsFlushed,
    Duration elapsed,
    List<PlaneOutcome> planes) {

  public RunReport {
    planes = List.copyOf(planes);
  }

  public boolean succeeded() {
    return status == RunStatus.COMPLETED;
  }

  /** Planes that ended in {@link WorkerState#FAILED}. */
  public List<PlaneOutcome> failures() {
    return planes.stream().filter(PlaneOutcome::failed).toList();
  }

  /** Rows flushed by planes that did not fail. */
  public long rowsFlushedByHealthyPlanes() {
    return planes.stream().filter(p -> !p.failed()).mapToLong(PlaneOutcome::rowsFlushed).sum();
  }
}
