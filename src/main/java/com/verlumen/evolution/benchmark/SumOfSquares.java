package com.verlumen.evolution.benchmark;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.bounding.RangeBounder;
import com.verlumen.evolution.evaluation.Evaluation;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** f(x) = sum of x_i squared over the unit hypercube; minimum 0 at the origin. */
public final class SumOfSquares extends Benchmark {
  private static final Bounder BOUNDER = RangeBounder.of(0.0, 1.0);

  public SumOfSquares(int dimensions) {
    super(dimensions, false);
  }

  @Override
  public Bounder bounder() {
    return BOUNDER;
  }

  @Override
  public Evaluation evaluate(ImmutableList<Double> candidate, EvaluationContext context) {
    double sum = 0;
    for (double x : candidate) {
      sum += x * x;
    }
    return Evaluation.of(sum);
  }
}
