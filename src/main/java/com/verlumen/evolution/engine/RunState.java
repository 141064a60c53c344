package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;

/**
 * Snapshot of a run at a generation boundary. A new snapshot is produced for every generation;
 * observers and termination clauses only ever see snapshots, never the live engine.
 */
@AutoValue
public abstract class RunState {
  public abstract ImmutableList<Individual> population();

  public abstract ImmutableList<Individual> archive();

  /** Completed generations; 0 for the initial population. */
  public abstract int generation();

  /** Candidates submitted for evaluation so far, including those that failed. */
  public abstract int evaluations();

  public static RunState create(
      ImmutableList<Individual> population,
      ImmutableList<Individual> archive,
      int generation,
      int evaluations) {
    return new AutoValue_RunState(population, archive, generation, evaluations);
  }

  /** The best individual of the population. */
  public Individual best() {
    return Populations.best(population());
  }
}
