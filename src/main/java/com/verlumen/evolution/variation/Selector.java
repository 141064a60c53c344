package com.verlumen.evolution.variation;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;
import java.util.Random;

/** Picks the parents of the next offspring batch. */
@FunctionalInterface
public interface Selector {
  ImmutableList<Individual> select(ImmutableList<Individual> population, Random random);
}
