package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;

/**
 * Final (or last observed) status of one plane.
 *
 * @param failure cause of a {@link WorkerState#FAILED} outcome, otherwise {@code null}
 */
public record PlaneOutcome(
    PlaneId planeId,
    long rowBudget,
    long rowsGenerated,
    long rowsFlushed,
    WorkerState state,
    Throwable failure) {

  public boolean failed() {
    return state == WorkerState.FAILED;
  }
}
