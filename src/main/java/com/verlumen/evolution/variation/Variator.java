package com.verlumen.evolution.variation;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.population.Individual;
import java.util.Random;

/**
 * One stage of the variation pipeline. Each stage receives the output of the previous one; the
 * individuals it returns are unevaluated.
 */
@FunctionalInterface
public interface Variator {
  ImmutableList<Individual> vary(
      ImmutableList<Individual> parents, Bounder bounder, Random random);
}
