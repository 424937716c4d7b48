package com.flightgen.generator.plane;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Random;

/**
 * Synthetic telemetry for a single plane.
 *
 * <p>The first sample is drawn from a distribution seeded by the plane identifier, so the same
 * identifier produces the same kinematic sequence on every run. Later samples nudge the previous
 * values by a small random delta (bounded random walk) and clamp or wrap them back into range.
 *
 * <p>Not thread-safe: one instance belongs to one plane worker.
 */
public final class RowGenerator {
  private static final long SEED_SALT = 0x5DEECE66DL;
  // Degrees of latitude/longitude travelled per knot of ground speed per sample.
  private static final double DEGREES_PER_KNOT_STEP = 1.0e-5;

  static final double MIN_SPEED = 0.0;
  static final double MAX_SPEED = 600.0;
  static final double MIN_ALTITUDE = 0.0;
  static final double MAX_ALTITUDE = 45_000.0;
  static final double ATTITUDE_LIMIT = 10.0;
  static final double MIN_AOA = 0.0;
  static final double MAX_AOA = 15.0;
  static final double MIN_OAT = -60.0;
  static final double MAX_OAT = 20.0;

  private final PlaneId planeId;
  private final Clock clock;
  private final Random random;

  public RowGenerator(PlaneId planeId, Clock clock) {
    this.planeId = Objects.requireNonNull(planeId, "planeId");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = new Random(seedFor(planeId));
  }

  /** Seed used for a plane's random stream. */
  public static long seedFor(PlaneId planeId) {
    return SEED_SALT ^ (planeId.index() * 0x9E3779B97F4A7C15L);
  }

  /**
   * Produces the next sample for {@code state}.
   *
   * @param state current state of this generator's plane
   * @return the new row and the state to pass to the following call
   */
  public Step next(PlaneState state) {
    if (!planeId.equals(state.planeId())) {
      throw new IllegalArgumentException("state belongs to " + state.planeId() + ", generator to " + planeId);
    }
    Instant timestamp = nextTimestamp(state.lastTimestamp());
    long sequence = state.sequence();
    TelemetryRow row = state.started()
        ? walk(state.last(), sequence, timestamp)
        : initial(sequence, timestamp);
    return new Step(row, new PlaneState(planeId, sequence + 1, row));
  }

  private TelemetryRow initial(long sequence, Instant timestamp) {
    return new TelemetryRow(
        planeId,
        sequence,
        timestamp,
        uniform(-90.0, 90.0),
        uniform(-180.0, 180.0),
        uniform(30_000.0, 40_000.0),
        uniform(200.0, 300.0),
        uniform(0.0, 360.0),
        uniform(-ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        uniform(-ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        uniform(-ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        uniform(MIN_AOA, MAX_AOA),
        uniform(MIN_OAT, MAX_OAT));
  }

  private TelemetryRow walk(TelemetryRow last, long sequence, Instant timestamp) {
    double speed = clamp(last.groundSpeed() + uniform(-1.0, 1.0), MIN_SPEED, MAX_SPEED);
    double heading = wrapHeading(last.heading() + uniform(-2.0, 2.0));
    double radians = Math.toRadians(heading);
    double latitude = last.latitude() + Math.cos(radians) * speed * DEGREES_PER_KNOT_STEP;
    double longitude = last.longitude() + Math.sin(radians) * speed * DEGREES_PER_KNOT_STEP;

    // Crossing a pole: reflect back into range and turn around.
    if (latitude > 90.0) {
      latitude = 180.0 - latitude;
      heading = wrapHeading(180.0 - heading);
    } else if (latitude < -90.0) {
      latitude = -180.0 - latitude;
      heading = wrapHeading(180.0 - heading);
    }

    return new TelemetryRow(
        planeId,
        sequence,
        timestamp,
        latitude,
        wrapLongitude(longitude),
        clamp(last.altitude() + uniform(-10.0, 10.0), MIN_ALTITUDE, MAX_ALTITUDE),
        speed,
        heading,
        clamp(last.pitch() + uniform(-1.0, 1.0), -ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        clamp(last.roll() + uniform(-1.0, 1.0), -ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        clamp(last.yaw() + uniform(-1.0, 1.0), -ATTITUDE_LIMIT, ATTITUDE_LIMIT),
        clamp(last.angleOfAttack() + uniform(-0.5, 0.5), MIN_AOA, MAX_AOA),
        clamp(last.outsideAirTemp() + uniform(-1.0, 1.0), MIN_OAT, MAX_OAT));
  }

  private Instant nextTimestamp(Instant previous) {
    Instant now = clock.instant();
    if (previous != null && !now.isAfter(previous)) {
      return previous.plus(1, ChronoUnit.MICROS);
    }
    return now;
  }

  private double uniform(double min, double max) {
    return min + random.nextDouble() * (max - min);
  }

  static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  static double wrapHeading(double heading) {
    double wrapped = heading % 360.0;
    if (wrapped < 0) {
      wrapped += 360.0;
    }
    return wrapped >= 360.0 ? 0.0 : wrapped;
  }

  static double wrapLongitude(double longitude) {
    double shifted = (longitude + 180.0) % 360.0;
    if (shifted < 0) {
      shifted += 360.0;
    }
    return shifted >= 360.0 ? -180.0 : shifted - 180.0;
  }

  /** Result of one generation step. */
  public record Step(TelemetryRow row, PlaneState state) {}
}
