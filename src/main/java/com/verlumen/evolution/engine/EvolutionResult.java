package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/** Outcome of {@link EvolutionaryComputation#evolve}. */
@AutoValue
public abstract class EvolutionResult {
  /** Name of the clause that stopped the run, or {@link #EXIT_CAUSE} after an early exit. */
  public static final String EXIT_CAUSE = "EvolutionExit";

  public abstract RunState finalState();

  public abstract String terminationCause();

  /**
   * True when the run was stopped by an {@link com.verlumen.evolution.EvolutionExit}. The
   * population is then provisional.
   */
  public abstract boolean aborted();

  static EvolutionResult completed(RunState state, String cause) {
    return new AutoValue_EvolutionResult(state, cause, false);
  }

  static EvolutionResult aborted(RunState state) {
    return new AutoValue_EvolutionResult(state, EXIT_CAUSE, true);
  }

  public ImmutableList<Individual> population() {
    return finalState().population();
  }

  public Individual best() {
    return finalState().best();
  }
}
