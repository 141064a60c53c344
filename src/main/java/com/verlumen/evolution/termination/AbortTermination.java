package com.verlumen.evolution.termination;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** Fires at the next generation boundary after an {@link AbortSignal} is raised. */
public final class AbortTermination implements TerminationClause {
  private final AbortSignal signal;

  public AbortTermination(AbortSignal signal) {
    this.signal = checkNotNull(signal, "Abort signal cannot be null");
  }

  @Override
  public boolean shouldTerminate(RunState state, EvaluationContext context) {
    return signal.isRequested();
  }
}
