package com.verlumen.evolution.observation;

import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/**
 * Notified with the initial population (generation 0) and after every generation. An exception
 * thrown here aborts the run.
 */
@FunctionalInterface
public interface Observer {
  void observe(RunState state, EvaluationContext context);
}
