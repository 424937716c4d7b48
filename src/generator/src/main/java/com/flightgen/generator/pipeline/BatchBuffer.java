package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;
import com.flightgen.generator.plane.TelemetryRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates one plane's rows into batches of a fixed size.
 *
 * <p>Every appended row ends up in exactly one returned batch, in append order. Not thread-safe.
 */
public final class BatchBuffer {
  private final PlaneId planeId;
  private final int batchSize;
  private List<TelemetryRow> pending;

  public BatchBuffer(PlaneId planeId, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.planeId = Objects.requireNonNull(planeId, "planeId");
    this.batchSize = batchSize;
    this.pending = new ArrayList<>(initialCapacity(batchSize));
  }

  /**
   * Adds a row and hands back a completed batch once the configured size is reached.
   *
   * @param row next row of this buffer's plane
   * @return the full batch, or empty while the buffer is still filling
   */
  public Optional<Batch> append(TelemetryRow row) {
    if (!planeId.equals(row.planeId())) {
      throw new IllegalArgumentException("row of " + row.planeId() + " appended to buffer of " + planeId);
    }
    pending.add(row);
    if (pending.size() < batchSize) {
      return Optional.empty();
    }
    return Optional.of(swap());
  }

  /**
   * Drains whatever is left at end of stream.
   *
   * @return the partially filled batch, or empty when nothing is pending
   */
  public Optional<Batch> finish() {
    if (pending.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(swap());
  }

  public int pendingRows() {
    return pending.size();
  }

  private Batch swap() {
    Batch batch = new Batch(planeId, pending);
    pending = new ArrayList<>(initialCapacity(batchSize));
    return batch;
  }

  private static int initialCapacity(int batchSize) {
    return Math.min(batchSize, 4096);
  }
}
