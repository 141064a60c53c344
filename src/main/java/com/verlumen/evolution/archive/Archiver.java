package com.verlumen.evolution.archive;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/** Maintains the best-so-far store kept alongside the population. */
public interface Archiver {
  /**
   * Returns the updated archive. Called once for the initial population with an empty archive and
   * once per generation after replacement.
   */
  ImmutableList<Individual> archive(
      ImmutableList<Individual> population, ImmutableList<Individual> archive);
}
