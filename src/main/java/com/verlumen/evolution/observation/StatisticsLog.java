package com.verlumen.evolution.observation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-generation fitness statistics of a run, written by {@link StatisticsObserver} and read by
 * stateful termination clauses.
 */
public final class StatisticsLog {
  private final List<FitnessStatistics> entries = new ArrayList<>();

  public synchronized void record(FitnessStatistics statistics) {
    entries.add(statistics);
  }

  public synchronized ImmutableList<FitnessStatistics> entries() {
    return ImmutableList.copyOf(entries);
  }

  public synchronized ImmutableList<Double> bestFitnessHistory() {
    ImmutableList.Builder<Double> history = ImmutableList.builderWithExpectedSize(entries.size());
    for (FitnessStatistics entry : entries) {
      history.add(entry.best());
    }
    return history.build();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized void clear() {
    entries.clear();
  }
}
