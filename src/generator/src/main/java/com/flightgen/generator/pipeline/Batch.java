package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.TelemetryRow;
import java.util.List;

/** Ordered, immutable group of rows belonging to one plane. */
public record Batch(PlaneId planeId, List<TelemetryRow> rows) {
  public Batch {
    rows = List.copyOf(rows);
  }

  public int size() {
    return rows.size();
  }
}
