package com.flightgen.generator.pipeline;

/** Overall result of a fleet run. */
public enum RunStatus {
  /** Every plane flushed its whole budget. */
  COMPLETED,
  /** At least one plane's sink write failed; the run was stopped early. */
  FAILED,
  /** The run was cancelled before every plane completed. Not an error. */
  CANCELLED
}
