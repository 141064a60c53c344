package com.verlumen.evolution.replacement;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/** Merges the current population and its offspring into the next generation. */
public interface Replacer {
  /**
   * @param population the current population
   * @param offspring the offspring of this generation; individuals whose evaluation failed have no
   *     fitness and must not enter the next generation
   * @return the next population
   */
  ImmutableList<Individual> replace(
      ImmutableList<Individual> population, ImmutableList<Individual> offspring);
}
