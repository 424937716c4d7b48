package com.flightgen.generator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "generator")
public record GeneratorProperties(
    String connectionString,
    long totalRows,
    double ratePerPlane,
    int planeCount,
    String tableName,
    String startingPlaneId,
    int batchSize,
    boolean quiet,
    long progressIntervalRows,
    Duration shutdownTimeout,
    Sink sink) {
  public record Sink(String type, Jdbc jdbc, Redis redis) {}

  public record Jdbc(String username, String password, int poolSize, boolean createTable) {}

  public record Redis(String keyPrefix) {}
}
