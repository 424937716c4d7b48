package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;

/** Notified from worker threads after each successful flush. Must be thread-safe. */
@FunctionalInterface
public interface FlushListener {
  FlushListener NOOP = (planeId, batchRows, planeRowsFlushed, planeRowBudget) -> {};

  void onFlush(PlaneId planeId, int batchRows, long planeRowsFlushed, long planeRowBudget);
}
