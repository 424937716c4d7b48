package com.flightgen.generator.pipeline;

/** Paces a single plane's emissions. */
public interface RateLimiter {
  /**
   * Blocks the calling thread until its next emission slot.
   *
   * @throws InterruptedException when the waiting thread is interrupted (cancellation)
   */
  void awaitSlot() throws InterruptedException;
}
