package com.verlumen.evolution.evaluation;

import com.google.common.collect.ImmutableList;

/**
 * The problem being optimized. Implementations may be called concurrently from several worker
 * threads and must not rely on shared mutable state.
 */
@FunctionalInterface
public interface ObjectiveFunction {
  /**
   * Evaluates one candidate.
   *
   * @param candidate the point to evaluate
   * @param context the transferable run options
   * @return the fitness and responses, or {@link Evaluation#undefined()}
   * @throws Exception if the evaluation failed; the candidate is then treated as undefined
   */
  Evaluation evaluate(ImmutableList<Double> candidate, EvaluationContext context) throws Exception;
}
