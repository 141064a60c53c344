package com.verlumen.evolution.termination;

import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** A condition that can stop a run. Clauses may keep state between calls. */
@FunctionalInterface
public interface TerminationClause {
  boolean shouldTerminate(RunState state, EvaluationContext context);

  /** Reported as the termination cause when this clause fires. */
  default String name() {
    return getClass().getSimpleName();
  }
}
