package com.verlumen.evolution.replacement;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;

/**
 * Steady-state replacement: pools parents and evaluated offspring and keeps the best, preserving
 * the population size. Parents come first in the pool, so they win ties.
 */
public final class RankedReplacer implements Replacer {
  @Override
  public ImmutableList<Individual> replace(
      ImmutableList<Individual> population, ImmutableList<Individual> offspring) {
    ImmutableList<Individual> pool =
        ImmutableList.<Individual>builder()
            .addAll(population)
            .addAll(Populations.evaluatedOnly(offspring))
            .build();
    return Populations.rankBestFirst(pool).subList(0, population.size());
  }
}
