package com.verlumen.evolution.termination;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;
import com.verlumen.evolution.observation.StatisticsLog;
import java.util.Collections;

/**
 * Fires when the best fitness has plateaued.
 *
 * <p>Reads the per-generation best fitness recorded in a {@link StatisticsLog}. Needs more than
 * three entries, that is the initial population plus at least three generations. Fires when the
 * last two entries differ by at most {@code |last * tolerance|} and the last entry is no worse than
 * the previous one and is the best ever recorded.
 */
public final class ConvergenceTermination implements TerminationClause {
  private static final int MIN_HISTORY = 4;

  private final StatisticsLog log;
  private final double tolerance;
  private final boolean maximize;

  public ConvergenceTermination(StatisticsLog log, double tolerance, boolean maximize) {
    checkArgument(tolerance >= 0, "Tolerance cannot be negative: %s", tolerance);
    this.log = checkNotNull(log, "Statistics log cannot be null");
    this.tolerance = tolerance;
    this.maximize = maximize;
  }

  @Override
  public boolean shouldTerminate(RunState state, EvaluationContext context) {
    ImmutableList<Double> history = log.bestFitnessHistory();
    if (history.size() < MIN_HISTORY) {
      return false;
    }
    double last = history.get(history.size() - 1);
    double previous = history.get(history.size() - 2);
    if (Math.abs(last - previous) > Math.abs(last * tolerance)) {
      return false;
    }
    return maximize
        ? last >= previous && last >= Collections.max(history)
        : last <= previous && last <= Collections.min(history);
  }
}
