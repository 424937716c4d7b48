package com.flightgen.generator;

import com.flightgen.generator.config.ConfigurationException;
import com.flightgen.generator.config.GeneratorProperties;
import com.flightgen.generator.config.RunConfiguration;
import com.flightgen.generator.pipeline.FleetCoordinator;
import com.flightgen.generator.pipeline.FlushListener;
import com.flightgen.generator.pipeline.PlaneOutcome;
import com.flightgen.generator.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the fleet once at startup and turns the report into log output and an exit code.
 */
@Component
public class GenerationRunner implements ApplicationRunner, ExitCodeGenerator {
  private static final Logger log = LoggerFactory.getLogger(GenerationRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_SINK_FAILURE = 1;
  static final int EXIT_CONFIGURATION_ERROR = ConfigurationException.EXIT_CODE;
  static final int EXIT_CANCELLED = 130;

  private final FleetCoordinator coordinator;
  private final GeneratorProperties properties;
  private volatile int exitCode = EXIT_OK;
  private volatile RunReport lastReport;

  public GenerationRunner(FleetCoordinator coordinator, GeneratorProperties properties) {
    this.coordinator = coordinator;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    RunReport report;
    try {
      RunConfiguration config = RunConfiguration.from(properties);
      FlushListener listener = config.quiet() ? FlushListener.NOOP : new ProgressLogger(config.progressIntervalRows());
      log.info("Writing {} rows to table {} at {}", config.totalRows(), config.tableName(), config.connectionString());
      report = coordinator.run(config, listener);
    } catch (ConfigurationException ex) {
      log.error("Invalid configuration, no rows generated: {}", ex.getMessage());
      exitCode = EXIT_CONFIGURATION_ERROR;
      return;
    }
    lastReport = report;
    exitCode = report(report);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  RunReport lastReport() {
    return lastReport;
  }

  private int report(RunReport report) {
    switch (report.status()) {
      case COMPLETED -> {
        log.info("Data generation completed. Total rows generated: {} in {} ms",
            report.rowsFlushed(), report.elapsed().toMillis());
        return EXIT_OK;
      }
      case CANCELLED -> {
        log.info("Data generation cancelled after {} of {} rows ({} ms)",
            report.rowsFlushed(), report.rowsRequested(), report.elapsed().toMillis());
        return EXIT_CANCELLED;
      }
      default -> {
        for (PlaneOutcome failed : report.failures()) {
          Throwable cause = failed.failure();
          log.error("Plane {} failed after flushing {} of {} rows: {}",
              failed.planeId(),
              failed.rowsFlushed(),
              failed.rowBudget(),
              cause == null ? "unknown error" : cause.getMessage());
        }
        log.error("Data generation failed. Rows flushed before failure: {} of {} ({} by healthy planes)",
            report.rowsFlushed(), report.rowsRequested(), report.rowsFlushedByHealthyPlanes());
        return EXIT_SINK_FAILURE;
      }
    }
  }
}
