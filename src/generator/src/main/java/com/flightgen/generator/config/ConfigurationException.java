package com.flightgen.generator.config;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Startup validation failure.
 *
 * <p>Raised before any row is generated; never retried. When it aborts the application context
 * itself, Spring Boot picks up {@link #getExitCode()} for the process exit status.
 */
public class ConfigurationException extends RuntimeException implements ExitCodeGenerator {
  public static final int EXIT_CODE = 2;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int getExitCode() {
    return EXIT_CODE;
  }
}
