package com.verlumen.evolution.generation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.evaluation.EvaluationContext;
import java.util.Random;

/**
 * Draws each gene uniformly between the bounder's per-dimension limits, or in {@code [0, 1)} when
 * the bounder is unbounded.
 */
public final class UniformGenerator implements CandidateGenerator {
  private final int dimensions;
  private final ImmutableList<Double> lower;
  private final ImmutableList<Double> upper;

  public UniformGenerator(int dimensions, Bounder bounder) {
    checkArgument(dimensions > 0, "Dimensions must be positive: %s", dimensions);
    this.dimensions = dimensions;
    this.lower = bounder.lowerBounds(dimensions).orElse(unitBounds(dimensions, 0.0));
    this.upper = bounder.upperBounds(dimensions).orElse(unitBounds(dimensions, 1.0));
    checkArgument(
        lower.size() >= dimensions && upper.size() >= dimensions,
        "Bounder covers fewer than %s dimensions",
        dimensions);
  }

  @Override
  public ImmutableList<Double> generate(Random random, EvaluationContext context) {
    ImmutableList.Builder<Double> candidate = ImmutableList.builderWithExpectedSize(dimensions);
    for (int i = 0; i < dimensions; i++) {
      candidate.add(lower.get(i) + random.nextDouble() * (upper.get(i) - lower.get(i)));
    }
    return candidate.build();
  }

  private static ImmutableList<Double> unitBounds(int dimensions, double value) {
    ImmutableList.Builder<Double> bounds = ImmutableList.builderWithExpectedSize(dimensions);
    for (int i = 0; i < dimensions; i++) {
      bounds.add(value);
    }
    return bounds.build();
  }
}
