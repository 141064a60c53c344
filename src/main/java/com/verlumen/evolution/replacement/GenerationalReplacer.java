package com.verlumen.evolution.replacement;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/**
 * Offspring replace the population slot by slot, better or not. A slot whose offspring failed
 * evaluation keeps its current individual.
 */
public final class GenerationalReplacer implements Replacer {
  @Override
  public ImmutableList<Individual> replace(
      ImmutableList<Individual> population, ImmutableList<Individual> offspring) {
    checkArgument(
        population.size() == offspring.size(),
        "Generational replacement needs one offspring per slot: %s parents, %s offspring",
        population.size(),
        offspring.size());
    ImmutableList.Builder<Individual> next = ImmutableList.builderWithExpectedSize(population.size());
    for (int i = 0; i < population.size(); i++) {
      next.add(offspring.get(i).hasFitness() ? offspring.get(i) : population.get(i));
    }
    return next.build();
  }
}
