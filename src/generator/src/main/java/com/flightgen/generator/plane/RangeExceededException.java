package com.flightgen.generator.plane;

import com.flightgen.generator.config.ConfigurationException;

/** Allocation would run past the last identifier ({@code ZZ99}). */
public class RangeExceededException extends ConfigurationException {
  public RangeExceededException(PlaneId start, long offset) {
    super("plane id " + start + " + " + offset + " exceeds ZZ99 ("
        + start.remaining() + " identifiers left from " + start + ")");
  }
}
