package com.flightgen.generator.sink;

import com.flightgen.generator.pipeline.Batch;

/**
 * Transport for finished batches.
 *
 * <p>Implementations are called concurrently by every plane worker and must be thread-safe.
 * Each {@link #send} is a single write attempt: the batch is delivered whole or not at all.
 * Retries, if any, belong to the implementation.
 */
public interface BatchSink {
  /**
   * Writes one batch.
   *
   * @param tableName destination table
   * @param batch rows of a single plane, in generation order
   * @throws SinkException when the batch was not accepted
   */
  void send(String tableName, Batch batch) throws SinkException;
}
