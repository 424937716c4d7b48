package com.flightgen.generator.pipeline;

/** Lifecycle of a {@link PlaneWorker}. */
public enum WorkerState {
  INITIALIZING,
  GENERATING,
  FLUSHING,
  COMPLETED,
  FAILED,
  CANCELLED
}
