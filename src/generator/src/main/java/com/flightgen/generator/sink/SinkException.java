package com.flightgen.generator.sink;

/** A batch could not be delivered to the ingestion endpoint. */
public class SinkException extends Exception {
  public SinkException(String message) {
    super(message);
  }

  public SinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
