package com.verlumen.evolution.evaluation;

import com.google.common.collect.ImmutableList;

/** Evaluates a whole batch of candidates. Closing releases any workers the evaluator owns. */
public interface Evaluator extends AutoCloseable {
  /**
   * Returns results aligned with {@code candidates}: entry {@code i} of the batch belongs to
   * candidate {@code i}, whatever order the evaluations actually completed in.
   */
  EvaluatedBatch evaluate(ImmutableList<ImmutableList<Double>> candidates, EvaluationContext context);

  @Override
  default void close() {}
}
