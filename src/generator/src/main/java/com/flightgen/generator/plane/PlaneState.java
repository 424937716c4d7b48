package com.flightgen.generator.plane;

import java.time.Instant;

/**
 * Per-plane generator state.
 *
 * <p>{@code last} is {@code null} until the first sample has been produced. Instances are
 * immutable; each generation step returns a new one.
 */
public record PlaneState(PlaneId planeId, long sequence, TelemetryRow last) {

  public static PlaneState initial(PlaneId planeId) {
    return new PlaneState(planeId, 0L, null);
  }

  public boolean started() {
    return last != null;
  }

  public Instant lastTimestamp() {
    return last == null ? null : last.timestamp();
  }
}
