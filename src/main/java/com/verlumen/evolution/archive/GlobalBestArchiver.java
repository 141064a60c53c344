package com.verlumen.evolution.archive;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;

/** Keeps a single entry: the best individual of the current population. */
public final class GlobalBestArchiver implements Archiver {
  @Override
  public ImmutableList<Individual> archive(
      ImmutableList<Individual> population, ImmutableList<Individual> archive) {
    return ImmutableList.of(Populations.best(population));
  }
}
