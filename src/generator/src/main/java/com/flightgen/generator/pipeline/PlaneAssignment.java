package com.flightgen.generator.pipeline;

import com.flightgen.generator.plane.PlaneId;

/** Identifier and row budget handed to one plane worker. */
public record PlaneAssignment(int ordinal, PlaneId planeId, long rowBudget) {}
