package com.verlumen.evolution.variation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.population.Individual;
import java.util.List;
import java.util.Random;

/**
 * Pairs consecutive parents and, with the crossover rate's probability, creates two children that
 * lie on the segment from the worse parent towards the better one: {@code worse + u * (better -
 * worse)}, with {@code u} drawn uniformly from {@code [0, 1)} for every gene. Pairs that are not
 * crossed are copied. An odd trailing parent is dropped.
 */
public final class HeuristicCrossover implements Variator {
  private final double crossoverRate;

  public HeuristicCrossover(double crossoverRate) {
    checkArgument(
        crossoverRate >= 0 && crossoverRate <= 1,
        "Crossover rate must be in [0, 1]: %s",
        crossoverRate);
    this.crossoverRate = crossoverRate;
  }

  @Override
  public ImmutableList<Individual> vary(
      ImmutableList<Individual> parents, Bounder bounder, Random random) {
    ImmutableList.Builder<Individual> children = ImmutableList.builder();
    for (int i = 0; i + 1 < parents.size(); i += 2) {
      Individual mom = parents.get(i);
      Individual dad = parents.get(i + 1);
      if (random.nextDouble() < crossoverRate) {
        boolean momIsBetter = mom.isBetterThan(dad);
        children.add(child(mom, dad, momIsBetter, bounder, random));
        children.add(child(mom, dad, momIsBetter, bounder, random));
      } else {
        children.add(Individual.create(mom.candidate(), mom.maximize()));
        children.add(Individual.create(dad.candidate(), dad.maximize()));
      }
    }
    return children.build();
  }

  private static Individual child(
      Individual mom, Individual dad, boolean momIsBetter, Bounder bounder, Random random) {
    List<Double> better = momIsBetter ? mom.candidate() : dad.candidate();
    List<Double> worse = momIsBetter ? dad.candidate() : mom.candidate();
    int length = Math.min(better.size(), worse.size());
    ImmutableList.Builder<Double> genes = ImmutableList.builderWithExpectedSize(length);
    for (int j = 0; j < length; j++) {
      genes.add(worse.get(j) + random.nextDouble() * (better.get(j) - worse.get(j)));
    }
    return Individual.create(bounder.bound(genes.build()), mom.maximize());
  }
}
