package com.verlumen.evolution.termination;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** Fires once the given number of generations has completed. */
public final class MaxGenerationsTermination implements TerminationClause {
  private final int maxGenerations;

  public MaxGenerationsTermination(int maxGenerations) {
    checkArgument(maxGenerations >= 0, "Max generations cannot be negative: %s", maxGenerations);
    this.maxGenerations = maxGenerations;
  }

  @Override
  public boolean shouldTerminate(RunState state, EvaluationContext context) {
    return state.generation() >= maxGenerations;
  }
}
