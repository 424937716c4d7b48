package com.flightgen.generator.plane;

import java.time.Instant;

/**
 * One telemetry sample of one plane.
 *
 * <p>Units: altitude in feet, ground speed in knots, angles in degrees, temperature in Celsius.
 */
public record TelemetryRow(
    PlaneId planeId,
    long sequence,
    Instant timestamp,
    double latitude,
    double longitude,
    double altitude,
    double groundSpeed,
    double heading,
    double pitch,
    double roll,
    double yaw,
    double angleOfAttack,
    double outsideAirTemp) {}
