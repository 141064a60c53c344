package com.verlumen.evolution.termination;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/**
 * Fires once the number of evaluations reaches the limit. Checked between generations only, so a
 * run may overshoot by up to one batch.
 */
public final class MaxEvaluationsTermination implements TerminationClause {
  private final int maxEvaluations;

  public MaxEvaluationsTermination(int maxEvaluations) {
    checkArgument(maxEvaluations > 0, "Max evaluations must be positive: %s", maxEvaluations);
    this.maxEvaluations = maxEvaluations;
  }

  @Override
  public boolean shouldTerminate(RunState state, EvaluationContext context) {
    return state.evaluations() >= maxEvaluations;
  }
}
