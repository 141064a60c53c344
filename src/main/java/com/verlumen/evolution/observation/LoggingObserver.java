package com.verlumen.evolution.observation;

import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** Logs a one-line fitness summary per generation. */
public final class LoggingObserver implements Observer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Override
  public void observe(RunState state, EvaluationContext context) {
    if (state.population().isEmpty()) {
      logger.atWarning().log("Generation %d has an empty population", state.generation());
      return;
    }
    logger.atInfo().log(
        "Generation %d, %d evaluations, population %d: %s",
        state.generation(),
        state.evaluations(),
        state.population().size(),
        FitnessStatistics.of(state.population()));
  }
}
