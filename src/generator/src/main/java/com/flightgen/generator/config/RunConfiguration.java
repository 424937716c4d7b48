package com.flightgen.generator.config;

import com.flightgen.generator.plane.PlaneId;
import io.lettuce.core.RedisURI;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of one generation run.
 *
 * <p>Built once at startup from {@link GeneratorProperties} and shared read-only by every plane
 * worker.
 */
public record RunConfiguration(
    String connectionString,
    long totalRows,
    double ratePerPlane,
    int planeCount,
    PlaneId startingPlaneId,
    int batchSize,
    String tableName,
    boolean quiet,
    long progressIntervalRows,
    Duration shutdownTimeout) {

  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
  public static final String JDBC_SINK = "jdbc";
  public static final String REDIS_SINK = "redis";

  private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  public RunConfiguration {
    if (connectionString == null || connectionString.isBlank()) {
      throw new ConfigurationException("connection-string must not be empty");
    }
    if (totalRows <= 0) {
      throw new ConfigurationException("total-rows must be > 0 (was " + totalRows + ")");
    }
    if (Double.isNaN(ratePerPlane) || Double.isInfinite(ratePerPlane) || ratePerPlane <= 0) {
      throw new ConfigurationException("rate-per-plane must be a finite value > 0 (was " + ratePerPlane + ")");
    }
    if (planeCount <= 0) {
      throw new ConfigurationException("plane-count must be > 0 (was " + planeCount + ")");
    }
    if (startingPlaneId == null) {
      throw new ConfigurationException("starting-plane-id must not be empty");
    }
    if (batchSize <= 0) {
      throw new ConfigurationException("batch-size must be > 0 (was " + batchSize + ")");
    }
    if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
      throw new ConfigurationException("table-name must be a plain identifier (was '" + tableName + "')");
    }
    progressIntervalRows = Math.max(0L, progressIntervalRows);
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    }
  }

  /**
   * Validates bound properties and freezes them into a run configuration.
   *
   * @param properties properties bound under {@code generator.*}
   * @return validated configuration
   * @throws ConfigurationException when any value is missing or out of range
   */
  public static RunConfiguration from(GeneratorProperties properties) {
    checkConnectionString(sinkType(properties), properties.connectionString());
    String rawStart = properties.startingPlaneId();
    if (rawStart == null || rawStart.isBlank()) {
      throw new ConfigurationException("starting-plane-id must not be empty");
    }
    return new RunConfiguration(
        properties.connectionString(),
        properties.totalRows(),
        properties.ratePerPlane(),
        properties.planeCount(),
        PlaneId.parse(rawStart.trim()),
        properties.batchSize(),
        properties.tableName(),
        properties.quiet(),
        properties.progressIntervalRows(),
        properties.shutdownTimeout());
  }

  private static String sinkType(GeneratorProperties properties) {
    GeneratorProperties.Sink sink = properties.sink();
    return sink == null || sink.type() == null || sink.type().isBlank() ? JDBC_SINK : sink.type().trim();
  }

  // The connection string is only parsed here; sinks open it on their first batch.
  private static void checkConnectionString(String sinkType, String connectionString) {
    if (connectionString == null || connectionString.isBlank()) {
      throw new ConfigurationException("connection-string must not be empty");
    }
    switch (sinkType) {
      case JDBC_SINK -> {
        if (!connectionString.startsWith("jdbc:")) {
          throw new ConfigurationException(
              "connection-string must be a JDBC URL for the jdbc sink (was '" + connectionString + "')");
        }
      }
      case REDIS_SINK -> {
        try {
          RedisURI.create(connectionString);
        } catch (IllegalArgumentException ex) {
          throw new ConfigurationException(
              "connection-string must be a Redis URI for the redis sink (was '" + connectionString + "')", ex);
        }
      }
      default -> throw new ConfigurationException(
          "sink.type must be '" + JDBC_SINK + "' or '" + REDIS_SINK + "' (was '" + sinkType + "')");
    }
  }
}
