package com.flightgen.generator;

import com.flightgen.generator.pipeline.FlushListener;
import com.flightgen.generator.plane.PlaneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Progress output for non-quiet runs. */
class ProgressLogger implements FlushListener {
  private static final Logger log = LoggerFactory.getLogger(ProgressLogger.class);

  private final long intervalRows;

  ProgressLogger(long intervalRows) {
    this.intervalRows = intervalRows;
  }

  @Override
  public void onFlush(PlaneId planeId, int batchRows, long planeRowsFlushed, long planeRowBudget) {
    log.debug("Flushed {} rows for plane {} ({} so far)", batchRows, planeId, planeRowsFlushed);
    if (planeRowsFlushed >= planeRowBudget) {
      log.info("Plane {} generated {} rows", planeId, planeRowsFlushed);
    } else if (crossedInterval(batchRows, planeRowsFlushed)) {
      log.info("Plane {} generated {} rows so far ({} remaining)",
          planeId, planeRowsFlushed, planeRowBudget - planeRowsFlushed);
    }
  }

  boolean crossedInterval(int batchRows, long planeRowsFlushed) {
    if (intervalRows <= 0) {
      return false;
    }
    return planeRowsFlushed / intervalRows > (planeRowsFlushed - batchRows) / intervalRows;
  }
}
