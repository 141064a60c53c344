package com.verlumen.evolution.generation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.evaluation.EvaluationContext;
import java.util.List;
import java.util.Random;

/**
 * Hands out precomputed points in order, e.g. a design-of-experiments sample computed elsewhere.
 * The random stream is not used.
 */
public final class SeededGenerator implements CandidateGenerator {
  private final ImmutableList<ImmutableList<Double>> points;
  private int next;

  public SeededGenerator(List<? extends List<Double>> points) {
    checkArgument(!points.isEmpty(), "At least one point is required");
    ImmutableList.Builder<ImmutableList<Double>> copies = ImmutableList.builder();
    points.forEach(point -> copies.add(ImmutableList.copyOf(point)));
    this.points = copies.build();
  }

  @Override
  public synchronized ImmutableList<Double> generate(Random random, EvaluationContext context) {
    if (next >= points.size()) {
      throw new IllegalStateException("All " + points.size() + " precomputed points were used");
    }
    return points.get(next++);
  }

  public synchronized int remaining() {
    return points.size() - next;
  }
}
