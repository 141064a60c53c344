package com.verlumen.evolution.benchmark;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.evaluation.ObjectiveFunction;

/** A test problem with a fixed number of inputs and a known search space. */
public abstract class Benchmark implements ObjectiveFunction {
  private final int dimensions;
  private final boolean maximize;

  protected Benchmark(int dimensions, boolean maximize) {
    checkArgument(dimensions > 0, "Dimensions must be positive: %s", dimensions);
    this.dimensions = dimensions;
    this.maximize = maximize;
  }

  public final int dimensions() {
    return dimensions;
  }

  public final boolean maximize() {
    return maximize;
  }

  public abstract Bounder bounder();

  @Override
  public String toString() {
    return String.format("%s (%d dimensions)", getClass().getSimpleName(), dimensions);
  }
}
