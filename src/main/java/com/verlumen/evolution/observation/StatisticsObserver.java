package com.verlumen.evolution.observation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.inject.Inject;
import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;

/** Appends the population's fitness statistics to a {@link StatisticsLog} every generation. */
public final class StatisticsObserver implements Observer {
  private final StatisticsLog log;

  @Inject
  public StatisticsObserver(StatisticsLog log) {
    this.log = checkNotNull(log, "Statistics log cannot be null");
  }

  @Override
  public void observe(RunState state, EvaluationContext context) {
    if (state.generation() == 0) {
      log.clear();
    }
    log.record(FitnessStatistics.of(state.population()));
  }
}
