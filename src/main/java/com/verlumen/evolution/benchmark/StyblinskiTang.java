package com.verlumen.evolution.benchmark;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.bounding.RangeBounder;
import com.verlumen.evolution.evaluation.Evaluation;
import com.verlumen.evolution.evaluation.EvaluationContext;

/**
 * The Styblinski-Tang function, f(x) = 1/2 * sum(x_i^4 - 16 x_i^2 + 5 x_i), over normalized
 * candidates: each gene in [0, 1] maps to x_i = 10 * gene - 5. Also reports the responses
 * {@code r1 = f - 5} and {@code r2 = 2f}.
 *
 * <p>The minimum, about -39.166 per dimension, lies at x_i = -2.903534.
 */
public final class StyblinskiTang extends Benchmark {
  public static final double OPTIMUM_INPUT = -2.903534;

  private static final Bounder BOUNDER = RangeBounder.of(0.0, 1.0);

  public StyblinskiTang(int dimensions) {
    this(dimensions, false);
  }

  public StyblinskiTang(int dimensions, boolean maximize) {
    super(dimensions, maximize);
  }

  /** Maps a gene of the unit interval to the function's domain [-5, 5]. */
  public static double denormalize(double gene) {
    return 10 * gene - 5;
  }

  /** The inverse of {@link #denormalize}. */
  public static double normalize(double x) {
    return (x + 5) / 10;
  }

  @Override
  public Bounder bounder() {
    return BOUNDER;
  }

  @Override
  public Evaluation evaluate(ImmutableList<Double> candidate, EvaluationContext context) {
    double sum = 0;
    for (double gene : candidate) {
      double x = denormalize(gene);
      double square = x * x;
      sum += square * square - 16 * square + 5 * x;
    }
    double fitness = sum / 2;
    return Evaluation.of(fitness, ImmutableMap.of("r1", fitness - 5, "r2", 2 * fitness));
  }
}
