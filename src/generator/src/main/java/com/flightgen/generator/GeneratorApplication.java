package com.flightgen.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GeneratorApplication {
  // Boots Spring, runs the fleet once via GenerationRunner, then exits with its status code.
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(GeneratorApplication.class, args)));
  }
}
